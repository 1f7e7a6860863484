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

import com.outwardflow.entity.ApprovalDecision;
import com.outwardflow.entity.ApprovalHistoryEntry;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ApprovalHistoryRepository extends JpaRepository<ApprovalHistoryEntry, UUID> {

    Optional<ApprovalHistoryEntry> findByRequestIdAndActiveTrue(UUID requestId);

    List<ApprovalHistoryEntry> findByRequestIdOrderByLevelAsc(UUID requestId);

    boolean existsByRequestIdAndLevelAndActiveFalse(UUID requestId, int level);

    List<ApprovalHistoryEntry> findByActiveTrueOrderByAssignedAtAsc();

    /**
     * Closes an entry only if it is still awaiting a decision. Returns 0 when another
     * decision got there first.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ApprovalHistoryEntry e set e.active = false, e.decision = :decision, "
            + "e.approverId = :approverId, e.comments = :comments, e.processedAt = :processedAt "
            + "where e.id = :id and e.active = true")
    int closeIfActive(@Param("id") UUID id,
                      @Param("decision") ApprovalDecision decision,
                      @Param("approverId") String approverId,
                      @Param("comments") String comments,
                      @Param("processedAt") OffsetDateTime processedAt);
}
