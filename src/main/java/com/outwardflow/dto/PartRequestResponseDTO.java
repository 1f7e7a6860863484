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
package com.outwardflow.dto;

import com.outwardflow.entity.LimitOutcome;
import com.outwardflow.entity.RequestPriority;
import com.outwardflow.entity.RequestStatus;
import com.outwardflow.entity.ReturnCondition;
import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PartRequestResponseDTO {
    private UUID id;
    private String serviceRequestId;
    private UUID sparePartId;
    private String categoryId;
    private String storeId;
    private Integer requestedQuantity;
    private RequestPriority priority;
    private String justification;
    private BigDecimal estimatedCost;
    private BigDecimal issuedCost;
    private BigDecimal actualCost;
    private RequestStatus status;
    private int currentApprovalLevel;
    private int requiredApprovalLevels;
    private LimitOutcome limitOutcome;
    private boolean awaitingStock;
    private UUID activeReservationId;
    private String requestedBy;
    private String approvedBy;
    private String issuedBy;
    private Integer issuedQuantity;
    private OffsetDateTime requestedAt;
    private OffsetDateTime approvedAt;
    private OffsetDateTime issuedAt;
    private OffsetDateTime installedAt;
    private OffsetDateTime cancelledAt;
    private String cancellationReason;
    private Integer returnedQuantity;
    private ReturnCondition returnCondition;
    private OffsetDateTime returnedAt;
}
