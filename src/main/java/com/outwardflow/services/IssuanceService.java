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
package com.outwardflow.services;

import com.outwardflow.config.OutwardFlowProperties;
import com.outwardflow.dto.InstallationRequestDTO;
import com.outwardflow.dto.InstalledPartDTO;
import com.outwardflow.dto.IssueRequestDTO;
import com.outwardflow.dto.PartRequestResponseDTO;
import com.outwardflow.dto.ReturnPartsRequestDTO;
import com.outwardflow.entity.InstalledPart;
import com.outwardflow.entity.RequestStatus;
import com.outwardflow.entity.ReturnCondition;
import com.outwardflow.entity.SparePart;
import com.outwardflow.entity.SparePartRequest;
import com.outwardflow.entity.StockReservation;
import com.outwardflow.exceptions.InvalidRequestException;
import com.outwardflow.exceptions.InvalidTransitionException;
import com.outwardflow.exceptions.NoActiveReservationException;
import com.outwardflow.exceptions.ReservationExpiredException;
import com.outwardflow.exceptions.ResourceNotFoundException;
import com.outwardflow.mapper.OutwardFlowMapper;
import com.outwardflow.repository.InstalledPartRepository;
import com.outwardflow.repository.SparePartRequestRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Moves approved requests through issue, installation or return.
 *
 * @author adityamehta
 */
@Service
@Transactional
@Slf4j
public class IssuanceService {

    private final SparePartRequestRepository requestRepository;
    private final InstalledPartRepository installedPartRepository;
    private final StockReservationService reservationService;
    private final StockLevelService stockLevelService;
    private final CostReconciliationService costReconciliationService;
    private final OutwardFlowMapper mapper;
    private final OutwardFlowProperties properties;
    private final Clock clock;

    public IssuanceService(
            SparePartRequestRepository requestRepository,
            InstalledPartRepository installedPartRepository,
            StockReservationService reservationService,
            StockLevelService stockLevelService,
            CostReconciliationService costReconciliationService,
            OutwardFlowMapper mapper,
            OutwardFlowProperties properties,
            Clock clock) {
        this.requestRepository = requestRepository;
        this.installedPartRepository = installedPartRepository;
        this.reservationService = reservationService;
        this.stockLevelService = stockLevelService;
        this.costReconciliationService = costReconciliationService;
        this.mapper = mapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Issues an approved request from the hold it has at the given store. If the hold has
     * expired, it stays EXPIRED after the call fails.
     */
    @Transactional(noRollbackFor = ReservationExpiredException.class)
    public PartRequestResponseDTO issue(UUID requestId, IssueRequestDTO issue) {
        SparePartRequest request = lockRequest(requestId);

        if (request.getStatus() != RequestStatus.APPROVED) {
            throw new InvalidTransitionException(requestId, request.getStatus(), "issue");
        }

        StockReservation reservation = reservationService.findActiveReservation(requestId, issue.getStoreId())
                .filter(active -> active.getQuantity() >= request.getRequestedQuantity())
                .orElseThrow(() -> new NoActiveReservationException(requestId, issue.getStoreId()));

        reservationService.consume(reservation.getId(), issue.getIssuedBy());

        request.setStatus(RequestStatus.ISSUED);
        request.setStoreId(issue.getStoreId());
        request.setIssuedBy(issue.getIssuedBy());
        request.setIssuedAt(OffsetDateTime.now(clock));
        request.setIssuedQuantity(reservation.getQuantity());
        request.setIssuedCost(issue.getCost());
        request.setAwaitingStock(false);
        SparePartRequest saved = requestRepository.save(request);

        log.info("Issued {} units for request {} from store {} by {}",
                saved.getIssuedQuantity(), requestId, issue.getStoreId(), issue.getIssuedBy());
        return mapper.toResponseDTO(saved, null);
    }

    /**
     * Records the installation of an issued request. Calling it again returns the first
     * record unchanged.
     */
    public InstalledPartDTO install(UUID requestId, InstallationRequestDTO installation) {
        SparePartRequest request = lockRequest(requestId);

        Optional<InstalledPart> existing = installedPartRepository.findByRequestId(requestId);
        if (existing.isPresent()) {
            log.info("Request {} already installed, returning existing record {}", requestId, existing.get().getId());
            return mapper.toInstalledPartDTO(existing.get());
        }

        if (request.getStatus() != RequestStatus.ISSUED) {
            throw new InvalidTransitionException(requestId, request.getStatus(), "install");
        }

        int issuedQuantity = request.getIssuedQuantity();
        int quantity = installation.getQuantity() != null ? installation.getQuantity() : issuedQuantity;
        if (quantity > issuedQuantity) {
            throw new InvalidRequestException("Installed quantity " + quantity
                    + " exceeds issued quantity " + issuedQuantity);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        LocalDate warrantyStart = installation.getWarrantyStart() != null
                ? installation.getWarrantyStart()
                : now.atZoneSameInstant(properties.getLimits().getZone()).toLocalDate();
        LocalDate warrantyEnd = installation.getWarrantyEnd() != null
                ? installation.getWarrantyEnd()
                : defaultWarrantyEnd(request.getSparePartId(), warrantyStart);
        if (warrantyEnd != null && warrantyEnd.isBefore(warrantyStart)) {
            throw new InvalidRequestException("Warranty end " + warrantyEnd + " is before warranty start " + warrantyStart);
        }

        InstalledPart installedPart = InstalledPart.builder()
                .requestId(requestId)
                .serviceRequestId(request.getServiceRequestId())
                .sparePartId(request.getSparePartId())
                .quantity(quantity)
                .unitCost(installation.getUnitCost())
                .serviceCost(installation.getServiceCost() != null ? installation.getServiceCost() : BigDecimal.ZERO)
                .laborCost(installation.getLaborCost() != null ? installation.getLaborCost() : BigDecimal.ZERO)
                .installedBy(installation.getInstalledBy())
                .installedAt(now)
                .warrantyStart(warrantyStart)
                .warrantyEnd(warrantyEnd)
                .mileageAtInstallation(installation.getMileageAtInstallation())
                .serialNumber(installation.getSerialNumber())
                .batchNumber(installation.getBatchNumber())
                .notes(installation.getNotes())
                .build();

        costReconciliationService.reconcile(request, installedPart);
        InstalledPart saved = installedPartRepository.save(installedPart);

        request.setStatus(RequestStatus.INSTALLED);
        request.setInstalledAt(now);
        requestRepository.save(request);

        log.info("Installed {} units for request {} on service request {}, actual cost {}",
                quantity, requestId, request.getServiceRequestId(), saved.getTotalCost());
        return mapper.toInstalledPartDTO(saved);
    }

    /**
     * Takes unused issued parts back into the store they came from. Parts that are not in
     * good condition are booked as damaged.
     */
    public PartRequestResponseDTO returnParts(UUID requestId, ReturnPartsRequestDTO returnRequest) {
        SparePartRequest request = lockRequest(requestId);

        if (request.getStatus() != RequestStatus.ISSUED) {
            throw new InvalidTransitionException(requestId, request.getStatus(), "return parts");
        }

        boolean damaged = returnRequest.getCondition() != ReturnCondition.GOOD;
        int quantity = request.getIssuedQuantity();
        String reason = returnRequest.getReason() != null
                ? returnRequest.getReason()
                : "Returned " + returnRequest.getCondition();

        stockLevelService.returnToStock(request.getSparePartId(), request.getStoreId(), quantity, damaged,
                requestId, returnRequest.getReturnedBy(), reason);

        request.setStatus(RequestStatus.RETURNED);
        request.setReturnedQuantity(quantity);
        request.setReturnCondition(returnRequest.getCondition());
        request.setReturnReason(returnRequest.getReason());
        request.setReturnedAt(OffsetDateTime.now(clock));
        SparePartRequest saved = requestRepository.save(request);

        log.info("Request {} returned {} units in {} condition to store {}",
                requestId, quantity, returnRequest.getCondition(), request.getStoreId());
        return mapper.toResponseDTO(saved, null);
    }

    @Transactional(readOnly = true)
    public InstalledPartDTO getInstallation(UUID requestId) {
        return installedPartRepository.findByRequestId(requestId)
                .map(mapper::toInstalledPartDTO)
                .orElseThrow(() -> new ResourceNotFoundException("No installation recorded for request: " + requestId));
    }

    private LocalDate defaultWarrantyEnd(UUID sparePartId, LocalDate warrantyStart) {
        SparePart part = stockLevelService.getPart(sparePartId);
        if (part.getWarrantyMonths() == null || part.getWarrantyMonths() == 0) {
            return null;
        }
        return warrantyStart.plusMonths(part.getWarrantyMonths());
    }

    private SparePartRequest lockRequest(UUID requestId) {
        return requestRepository.findByIdForUpdate(requestId)
                .orElseThrow(() -> new ResourceNotFoundException("Request not found with ID: " + requestId));
    }
}
