/*
 * Copyright 2025 adityamehta.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.outwardflow.exceptions;

import java.time.OffsetDateTime;
import java.util.UUID;

public class ReservationExpiredException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final UUID reservationId;

    public ReservationExpiredException(UUID reservationId, OffsetDateTime expiredAt) {
        super(String.format("Reservation %s expired at %s and must be placed again", reservationId, expiredAt));
        this.reservationId = reservationId;
    }

    public UUID getReservationId() {
        return reservationId;
    }
}
