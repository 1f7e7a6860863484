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

import com.outwardflow.entity.RequestPriority;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of a new outward request. When {@code estimatedCost} is omitted it is priced from
 * the part's unit price.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatePartRequestDTO {

    @NotBlank
    private String serviceRequestId;

    @NotNull
    private UUID sparePartId;

    private String storeId;

    @NotNull
    @Positive
    private Integer quantity;

    @NotNull
    private RequestPriority priority;

    @PositiveOrZero
    private BigDecimal estimatedCost;

    @Size(max = 1000)
    private String justification;

    @NotBlank
    private String technicianId;
}
