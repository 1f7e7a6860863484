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
package com.outwardflow.mapper;

import com.outwardflow.dto.ApprovalHistoryEntryDTO;
import com.outwardflow.dto.InstalledPartDTO;
import com.outwardflow.dto.PartRequestResponseDTO;
import com.outwardflow.dto.StockReservationDTO;
import com.outwardflow.entity.ApprovalHistoryEntry;
import com.outwardflow.entity.InstalledPart;
import com.outwardflow.entity.SparePartRequest;
import com.outwardflow.entity.StockReservation;
import java.util.List;
import java.util.UUID;

public interface OutwardFlowMapper {

    PartRequestResponseDTO toResponseDTO(SparePartRequest request, UUID activeReservationId);

    ApprovalHistoryEntryDTO toApprovalHistoryEntryDTO(ApprovalHistoryEntry entry);

    List<ApprovalHistoryEntryDTO> toApprovalHistoryEntryDTOList(List<ApprovalHistoryEntry> entries);

    StockReservationDTO toStockReservationDTO(StockReservation reservation);

    InstalledPartDTO toInstalledPartDTO(InstalledPart installedPart);
}
