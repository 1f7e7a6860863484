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
package com.outwardflow.repository;

import com.outwardflow.entity.ReservationStatus;
import com.outwardflow.entity.StockReservation;
import jakarta.persistence.LockModeType;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface StockReservationRepository extends JpaRepository<StockReservation, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from StockReservation r where r.id = :id")
    Optional<StockReservation> findByIdForUpdate(@Param("id") UUID id);

    @Query("select coalesce(sum(r.quantity), 0) from StockReservation r "
            + "where r.sparePartId = :partId and r.storeId = :storeId and r.status = :status")
    Long sumQuantityByStatus(@Param("partId") UUID partId,
                             @Param("storeId") String storeId,
                             @Param("status") ReservationStatus status);

    List<StockReservation> findByRequestIdAndStatus(UUID requestId, ReservationStatus status);

    List<StockReservation> findByRequestIdOrderByReservedAtAsc(UUID requestId);

    @Query("select r.id from StockReservation r where r.status = :status "
            + "and r.expiresAt is not null and r.expiresAt < :now")
    List<UUID> findIdsByStatusAndExpiresAtBefore(@Param("status") ReservationStatus status,
                                                 @Param("now") OffsetDateTime now);
}
