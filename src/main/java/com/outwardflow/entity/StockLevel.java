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

/**
 * Physical stock of one part at one store. Reserved quantities are not stored here;
 * they are the sum of the ACTIVE {@link StockReservation} rows for the same pair.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@Entity
@Table(name = "stock_level",
        uniqueConstraints = @UniqueConstraint(name = "uk_stock_part_store",
                columnNames = {"spare_part_id", "store_id"}))
public class StockLevel {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "spare_part_id", nullable = false)
    private UUID sparePartId;

    @Column(name = "store_id", nullable = false, length = 100)
    private String storeId;

    @Column(name = "current_stock", nullable = false)
    private int currentStock;

    // part of currentStock that cannot be issued
    @Column(name = "damaged_stock", nullable = false)
    private int damagedStock;

    @Version
    @Column(nullable = false)
    private Long version;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public int usableStock() {
        return currentStock - damagedStock;
    }

    public void deduct(int quantity) {
        if (quantity > usableStock()) {
            throw new IllegalStateException("Cannot deduct " + quantity + " from usable stock "
                    + usableStock() + " of part " + sparePartId + " at store " + storeId);
        }
        currentStock -= quantity;
    }
}
