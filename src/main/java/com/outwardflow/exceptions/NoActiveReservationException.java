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

import java.util.UUID;

public class NoActiveReservationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public NoActiveReservationException(UUID requestId, String storeId) {
        super(String.format("Request %s has no active reservation covering its quantity at store %s",
                requestId, storeId));
    }
}
