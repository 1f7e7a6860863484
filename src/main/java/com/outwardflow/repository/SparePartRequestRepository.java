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

import com.outwardflow.entity.RequestStatus;
import com.outwardflow.entity.SparePartRequest;
import jakarta.persistence.LockModeType;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface SparePartRequestRepository extends JpaRepository<SparePartRequest, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from SparePartRequest r where r.id = :id")
    Optional<SparePartRequest> findByIdForUpdate(@Param("id") UUID id);

    List<SparePartRequest> findByRequestedByAndStatusInAndRequestedAtGreaterThanEqual(
            String requestedBy, Collection<RequestStatus> statuses, OffsetDateTime since);

    List<SparePartRequest> findByStatusOrderByRequestedAtDesc(RequestStatus status);

    List<SparePartRequest> findByRequestedByOrderByRequestedAtDesc(String requestedBy);

    List<SparePartRequest> findByServiceRequestIdOrderByRequestedAtDesc(String serviceRequestId);

    List<SparePartRequest> findAllByOrderByRequestedAtDesc();
}
