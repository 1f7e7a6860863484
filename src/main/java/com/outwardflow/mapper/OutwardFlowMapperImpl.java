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
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

@Component
public class OutwardFlowMapperImpl implements OutwardFlowMapper {

    @Override
    public PartRequestResponseDTO toResponseDTO(SparePartRequest request, UUID activeReservationId) {
        if (request == null) {
            return null;
        }

        return PartRequestResponseDTO.builder()
                .id(request.getId())
                .serviceRequestId(request.getServiceRequestId())
                .sparePartId(request.getSparePartId())
                .categoryId(request.getCategoryId())
                .storeId(request.getStoreId())
                .requestedQuantity(request.getRequestedQuantity())
                .priority(request.getPriority())
                .justification(request.getJustification())
                .estimatedCost(request.getEstimatedCost())
                .issuedCost(request.getIssuedCost())
                .actualCost(request.getActualCost())
                .status(request.getStatus())
                .currentApprovalLevel(request.getCurrentApprovalLevel())
                .requiredApprovalLevels(request.getRequiredApprovalLevels())
                .limitOutcome(request.getLimitOutcome())
                .awaitingStock(request.isAwaitingStock())
                .activeReservationId(activeReservationId)
                .requestedBy(request.getRequestedBy())
                .approvedBy(request.getApprovedBy())
                .issuedBy(request.getIssuedBy())
                .issuedQuantity(request.getIssuedQuantity())
                .requestedAt(request.getRequestedAt())
                .approvedAt(request.getApprovedAt())
                .issuedAt(request.getIssuedAt())
                .installedAt(request.getInstalledAt())
                .cancelledAt(request.getCancelledAt())
                .cancellationReason(request.getCancellationReason())
                .returnedQuantity(request.getReturnedQuantity())
                .returnCondition(request.getReturnCondition())
                .returnedAt(request.getReturnedAt())
                .build();
    }

    @Override
    public ApprovalHistoryEntryDTO toApprovalHistoryEntryDTO(ApprovalHistoryEntry entry) {
        if (entry == null) {
            return null;
        }

        return ApprovalHistoryEntryDTO.builder()
                .id(entry.getId())
                .requestId(entry.getRequestId())
                .level(entry.getLevel())
                .approverId(entry.getApproverId())
                .decision(entry.getDecision())
                .comments(entry.getComments())
                .requestValue(entry.getRequestValue())
                .availableStock(entry.getAvailableStock())
                .assignedAt(entry.getAssignedAt())
                .processedAt(entry.getProcessedAt())
                .active(entry.isActive())
                .build();
    }

    @Override
    public List<ApprovalHistoryEntryDTO> toApprovalHistoryEntryDTOList(List<ApprovalHistoryEntry> entries) {
        if (entries == null) {
            return Collections.emptyList();
        }

        return entries.stream()
                .map(this::toApprovalHistoryEntryDTO)
                .collect(Collectors.toList());
    }

    @Override
    public StockReservationDTO toStockReservationDTO(StockReservation reservation) {
        if (reservation == null) {
            return null;
        }

        return StockReservationDTO.builder()
                .id(reservation.getId())
                .requestId(reservation.getRequestId())
                .sparePartId(reservation.getSparePartId())
                .storeId(reservation.getStoreId())
                .quantity(reservation.getQuantity())
                .reservedBy(reservation.getReservedBy())
                .reservedAt(reservation.getReservedAt())
                .expiresAt(reservation.getExpiresAt())
                .status(reservation.getStatus())
                .releasedAt(reservation.getReleasedAt())
                .releaseReason(reservation.getReleaseReason())
                .build();
    }

    @Override
    public InstalledPartDTO toInstalledPartDTO(InstalledPart installedPart) {
        if (installedPart == null) {
            return null;
        }

        return InstalledPartDTO.builder()
                .id(installedPart.getId())
                .requestId(installedPart.getRequestId())
                .serviceRequestId(installedPart.getServiceRequestId())
                .sparePartId(installedPart.getSparePartId())
                .quantity(installedPart.getQuantity())
                .unitCost(installedPart.getUnitCost())
                .serviceCost(installedPart.getServiceCost())
                .laborCost(installedPart.getLaborCost())
                .totalCost(installedPart.getTotalCost())
                .installedBy(installedPart.getInstalledBy())
                .installedAt(installedPart.getInstalledAt())
                .warrantyStart(installedPart.getWarrantyStart())
                .warrantyEnd(installedPart.getWarrantyEnd())
                .mileageAtInstallation(installedPart.getMileageAtInstallation())
                .serialNumber(installedPart.getSerialNumber())
                .batchNumber(installedPart.getBatchNumber())
                .notes(installedPart.getNotes())
                .build();
    }
}
