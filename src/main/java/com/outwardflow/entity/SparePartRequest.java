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
import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A technician's request for a quantity of one part against one service request.
 * Approval history, reservations and the installation record point back here by id.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@Entity
@Table(name = "spare_part_request", indexes = {
    @Index(name = "idx_request_technician", columnList = "requested_by, requested_at"),
    @Index(name = "idx_request_service", columnList = "service_request_id")
})
public class SparePartRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "service_request_id", nullable = false, length = 100)
    private String serviceRequestId;

    @Column(name = "spare_part_id", nullable = false)
    private UUID sparePartId;

    // snapshot of the part's category, used by CATEGORY limits
    @Column(name = "category_id", length = 100)
    private String categoryId;

    @Column(name = "store_id", length = 100)
    private String storeId;

    @Column(name = "requested_quantity", nullable = false, updatable = false)
    private Integer requestedQuantity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RequestPriority priority;

    @Column(length = 1000)
    private String justification;

    @Column(name = "estimated_cost", nullable = false, precision = 14, scale = 2)
    private BigDecimal estimatedCost;

    @Column(name = "issued_cost", precision = 14, scale = 2)
    private BigDecimal issuedCost;

    @Column(name = "actual_cost", precision = 14, scale = 2)
    private BigDecimal actualCost;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RequestStatus status;

    @Column(name = "current_approval_level", nullable = false)
    private int currentApprovalLevel;

    @Column(name = "required_approval_levels", nullable = false)
    private int requiredApprovalLevels;

    @Enumerated(EnumType.STRING)
    @Column(name = "limit_outcome", length = 30)
    private LimitOutcome limitOutcome;

    @Column(name = "awaiting_stock", nullable = false)
    private boolean awaitingStock;

    @Column(name = "requested_by", nullable = false, length = 100)
    private String requestedBy;

    @Column(name = "approved_by", length = 100)
    private String approvedBy;

    @Column(name = "issued_by", length = 100)
    private String issuedBy;

    @Column(name = "issued_quantity")
    private Integer issuedQuantity;

    @Column(name = "requested_at", nullable = false)
    private OffsetDateTime requestedAt;

    @Column(name = "approved_at")
    private OffsetDateTime approvedAt;

    @Column(name = "issued_at")
    private OffsetDateTime issuedAt;

    @Column(name = "installed_at")
    private OffsetDateTime installedAt;

    @Column(name = "cancelled_at")
    private OffsetDateTime cancelledAt;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Column(name = "returned_quantity")
    private Integer returnedQuantity;

    @Enumerated(EnumType.STRING)
    @Column(name = "return_condition", length = 20)
    private ReturnCondition returnCondition;

    @Column(name = "return_reason", length = 500)
    private String returnReason;

    @Column(name = "returned_at")
    private OffsetDateTime returnedAt;

    @Version
    @Column(nullable = false)
    private Long version;

    /**
     * Cost used when this request counts against a technician's running totals.
     */
    public BigDecimal effectiveCost() {
        if (actualCost != null) {
            return actualCost;
        }
        return issuedCost != null ? issuedCost : estimatedCost;
    }

    /**
     * Raises the approval level; levels never move backwards.
     */
    public void advanceApprovalLevel(int level) {
        if (level < currentApprovalLevel) {
            throw new IllegalStateException("Approval level cannot decrease from "
                    + currentApprovalLevel + " to " + level);
        }
        this.currentApprovalLevel = level;
    }
}
