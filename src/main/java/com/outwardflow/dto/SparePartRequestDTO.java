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

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Catalogue entry for a new spare part.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SparePartRequestDTO {

    @NotBlank
    @Size(max = 100)
    private String partNumber;

    @NotBlank
    @Size(max = 200)
    private String name;

    private String categoryId;

    @NotNull
    @PositiveOrZero
    private BigDecimal unitPrice;

    @PositiveOrZero
    private Integer warrantyMonths;
}
