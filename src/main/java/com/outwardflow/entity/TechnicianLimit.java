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
 * Spend and quantity ceilings for one technician. Every ceiling is optional; a null
 * ceiling is simply not checked.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@Entity
@Table(name = "technician_limit", indexes = {
    @Index(name = "idx_limit_technician", columnList = "technician_id, active")
})
public class TechnicianLimit {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "technician_id", nullable = false, length = 100)
    private String technicianId;

    @Enumerated(EnumType.STRING)
    @Column(name = "limit_scope", nullable = false, length = 20)
    private LimitScope scope;

    // part id for PART, category id for CATEGORY, null for TOTAL
    @Column(name = "target_id", length = 100)
    private String targetId;

    @Column(name = "max_quantity_per_request")
    private Integer maxQuantityPerRequest;

    @Column(name = "max_value_per_request", precision = 14, scale = 2)
    private BigDecimal maxValuePerRequest;

    @Column(name = "max_quantity_per_day")
    private Integer maxQuantityPerDay;

    @Column(name = "max_value_per_day", precision = 14, scale = 2)
    private BigDecimal maxValuePerDay;

    @Column(name = "max_quantity_per_month")
    private Integer maxQuantityPerMonth;

    @Column(name = "max_value_per_month", precision = 14, scale = 2)
    private BigDecimal maxValuePerMonth;

    @Column(name = "requires_approval", nullable = false)
    private boolean requiresApproval;

    @Column(name = "auto_approve_below", precision = 14, scale = 2)
    private BigDecimal autoApproveBelow;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "created_at")
    private OffsetDateTime createdAt;
}
