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

import java.math.BigDecimal;
import java.time.LocalDate;
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
public class InstalledPartDTO {
    private UUID id;
    private UUID requestId;
    private String serviceRequestId;
    private UUID sparePartId;
    private Integer quantity;
    private BigDecimal unitCost;
    private BigDecimal serviceCost;
    private BigDecimal laborCost;
    private BigDecimal totalCost;
    private String installedBy;
    private OffsetDateTime installedAt;
    private LocalDate warrantyStart;
    private LocalDate warrantyEnd;
    private Long mileageAtInstallation;
    private String serialNumber;
    private String batchNumber;
    private String notes;
}
