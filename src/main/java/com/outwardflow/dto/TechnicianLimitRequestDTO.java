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

import com.outwardflow.entity.LimitScope;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TechnicianLimitRequestDTO {

    @NotBlank
    private String technicianId;

    @NotNull
    private LimitScope scope;

    private String targetId;

    @Positive
    private Integer maxQuantityPerRequest;

    @PositiveOrZero
    private BigDecimal maxValuePerRequest;

    @Positive
    private Integer maxQuantityPerDay;

    @PositiveOrZero
    private BigDecimal maxValuePerDay;

    @Positive
    private Integer maxQuantityPerMonth;

    @PositiveOrZero
    private BigDecimal maxValuePerMonth;

    private boolean requiresApproval;

    @PositiveOrZero
    private BigDecimal autoApproveBelow;
}
