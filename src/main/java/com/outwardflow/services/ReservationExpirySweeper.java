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
package com.outwardflow.services;

import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically expires ACTIVE holds that are past their expiry. Each hold is expired in its
 * own transaction so one failure does not block the rest.
 */
@Component
@Slf4j
public class ReservationExpirySweeper {

    private final StockReservationService reservationService;

    public ReservationExpirySweeper(StockReservationService reservationService) {
        this.reservationService = reservationService;
    }

    @Scheduled(fixedDelayString = "${outward.reservation.sweep-interval-ms:60000}")
    public void sweep() {
        sweepExpiredReservations();
    }

    /**
     * @return number of holds expired by this pass
     */
    public int sweepExpiredReservations() {
        List<UUID> expiredIds = reservationService.findExpiredReservationIds();
        if (expiredIds.isEmpty()) {
            return 0;
        }

        log.info("Found {} expired reservations to sweep", expiredIds.size());
        int expired = 0;
        for (UUID reservationId : expiredIds) {
            try {
                if (reservationService.expire(reservationId)) {
                    expired++;
                }
            } catch (Exception e) {
                log.error("Error expiring reservation {}", reservationId, e);
            }
        }

        log.info("Expired {} of {} reservations", expired, expiredIds.size());
        return expired;
    }
}
