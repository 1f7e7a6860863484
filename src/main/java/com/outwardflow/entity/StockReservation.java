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
package com.outwardflow.entity;

import jakarta.persistence.*;
import lombok.*;
import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@Entity
@Table(name = "stock_reservation", indexes = {
    @Index(name = "idx_reservation_part_store", columnList = "spare_part_id, store_id, status"),
    @Index(name = "idx_reservation_request", columnList = "request_id"),
    @Index(name = "idx_reservation_expiry", columnList = "status, expires_at")
})
public class StockReservation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "request_id", nullable = false)
    private UUID requestId;

    @Column(name = "spare_part_id", nullable = false)
    private UUID sparePartId;

    @Column(name = "store_id", nullable = false, length = 100)
    private String storeId;

    @Column(nullable = false)
    private Integer quantity;

    @Column(name = "reserved_by", nullable = false, length = 100)
    private String reservedBy;

    @Column(name = "reserved_at", nullable = false)
    private OffsetDateTime reservedAt;

    // null means the hold never expires on its own
    @Column(name = "expires_at")
    private OffsetDateTime expiresAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ReservationStatus status;

    @Column(name = "released_at")
    private OffsetDateTime releasedAt;

    @Column(name = "release_reason", length = 500)
    private String releaseReason;

    public boolean isActive() {
        return status == ReservationStatus.ACTIVE;
    }

    /**
     * The single expiry rule shared by consume and the sweep.
     */
    public boolean isExpiredAt(OffsetDateTime now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public void close(ReservationStatus terminalStatus, OffsetDateTime at, String reason) {
        if (!isActive()) {
            throw new IllegalStateException("Reservation " + id + " is already " + status);
        }
        if (terminalStatus == ReservationStatus.ACTIVE) {
            throw new IllegalArgumentException("A reservation cannot be reactivated");
        }
        this.status = terminalStatus;
        this.releasedAt = at;
        this.releaseReason = reason;
    }
}
