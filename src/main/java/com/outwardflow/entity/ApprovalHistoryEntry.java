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

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@Entity
@Table(name = "approval_history",
        uniqueConstraints = @UniqueConstraint(name = "uk_approval_request_level",
                columnNames = {"request_id", "approval_level"}),
        indexes = @Index(name = "idx_approval_active", columnList = "request_id, active"))
public class ApprovalHistoryEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "request_id", nullable = false)
    private UUID requestId;

    @Column(name = "approval_level", nullable = false)
    private int level;

    @Column(name = "approver_id", length = 100)
    private String approverId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ApprovalDecision decision;

    @Column(length = 1000)
    private String comments;

    @Column(name = "request_value", nullable = false, precision = 14, scale = 2)
    private BigDecimal requestValue;

    @Column(name = "available_stock")
    private Integer availableStock;

    @Column(name = "assigned_at", nullable = false)
    private OffsetDateTime assignedAt;

    @Column(name = "processed_at")
    private OffsetDateTime processedAt;

    // true while awaiting a decision
    @Column(nullable = false)
    private boolean active;
}
