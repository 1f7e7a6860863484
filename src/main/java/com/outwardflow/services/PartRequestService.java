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

import com.outwardflow.dto.CancelRequestDTO;
import com.outwardflow.dto.CreatePartRequestDTO;
import com.outwardflow.dto.LimitCheckResult;
import com.outwardflow.dto.PartRequestResponseDTO;
import com.outwardflow.entity.LimitOutcome;
import com.outwardflow.entity.RequestStatus;
import com.outwardflow.entity.SparePart;
import com.outwardflow.entity.SparePartRequest;
import com.outwardflow.exceptions.IdempotencyConflictException;
import com.outwardflow.exceptions.InvalidTransitionException;
import com.outwardflow.exceptions.ResourceNotFoundException;
import com.outwardflow.mapper.OutwardFlowMapper;
import com.outwardflow.repository.SparePartRequestRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Creation, lookup and cancellation of outward requests.
 *
 * @author adityamehta
 */
@Service
@Transactional
@Slf4j
public class PartRequestService {

    static final String REASON_REQUEST_CANCELLED = "REQUEST_CANCELLED";

    private final SparePartRequestRepository requestRepository;
    private final StockLevelService stockLevelService;
    private final LimitCheckerService limitCheckerService;
    private final ApprovalEngineService approvalEngineService;
    private final ApprovalLevelPolicy approvalLevelPolicy;
    private final StockReservationService reservationService;
    private final IdempotencyRedisService idempotencyRedisService;
    private final OutwardFlowMapper mapper;
    private final Clock clock;

    public PartRequestService(
            SparePartRequestRepository requestRepository,
            StockLevelService stockLevelService,
            LimitCheckerService limitCheckerService,
            ApprovalEngineService approvalEngineService,
            ApprovalLevelPolicy approvalLevelPolicy,
            StockReservationService reservationService,
            IdempotencyRedisService idempotencyRedisService,
            OutwardFlowMapper mapper,
            Clock clock) {
        this.requestRepository = requestRepository;
        this.stockLevelService = stockLevelService;
        this.limitCheckerService = limitCheckerService;
        this.approvalEngineService = approvalEngineService;
        this.approvalLevelPolicy = approvalLevelPolicy;
        this.reservationService = reservationService;
        this.idempotencyRedisService = idempotencyRedisService;
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * Creates a request. With an idempotency key, a retry from the same technician gets the
     * response of the first call instead of a second request.
     */
    public PartRequestResponseDTO createRequest(CreatePartRequestDTO request, String clientKey) {
        if (clientKey == null || clientKey.isBlank()) {
            return processRequest(request);
        }

        String idempotencyKey = generateIdempotencyKey(request.getTechnicianId(), clientKey);
        log.info("Creating request for technician {} with idempotency key: {}", request.getTechnicianId(), idempotencyKey);

        Optional<PartRequestResponseDTO> existingResponse = idempotencyRedisService.getResponse(idempotencyKey);
        if (existingResponse.isPresent()) {
            log.info("Returning cached response for idempotency key: {}", idempotencyKey);
            return existingResponse.get();
        }

        if (!idempotencyRedisService.tryLock(idempotencyKey)) {
            log.info("Lock held elsewhere, waiting for result for idempotency key: {}", idempotencyKey);
            return idempotencyRedisService.waitForResult(idempotencyKey)
                    .orElseThrow(() -> new IdempotencyConflictException(clientKey));
        }

        try {
            idempotencyRedisService.markAsProcessing(idempotencyKey);

            Optional<PartRequestResponseDTO> doubleCheckResponse = idempotencyRedisService.getResponse(idempotencyKey);
            if (doubleCheckResponse.isPresent()) {
                return doubleCheckResponse.get();
            }

            PartRequestResponseDTO response = processRequest(request);
            storeResponseAfterCommit(idempotencyKey, response);
            return response;

        } catch (RuntimeException e) {
            log.error("Error creating request with idempotency key: {}", idempotencyKey, e);
            idempotencyRedisService.releaseLock(idempotencyKey);
            idempotencyRedisService.removeProcessingMarker(idempotencyKey);
            throw e;
        }
    }

    /**
     * Replays must only ever see requests that were committed, so the response is published
     * once the surrounding transaction commits. A rollback drops the lock instead.
     */
    private void storeResponseAfterCommit(String idempotencyKey, PartRequestResponseDTO response) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            idempotencyRedisService.storeResponseAndReleaseLock(idempotencyKey, response);
            return;
        }

        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                idempotencyRedisService.storeResponseAndReleaseLock(idempotencyKey, response);
            }

            @Override
            public void afterCompletion(int status) {
                if (status != STATUS_COMMITTED) {
                    log.warn("Request for idempotency key {} rolled back, releasing lock", idempotencyKey);
                    idempotencyRedisService.releaseLock(idempotencyKey);
                    idempotencyRedisService.removeProcessingMarker(idempotencyKey);
                }
            }
        });
    }

    private PartRequestResponseDTO processRequest(CreatePartRequestDTO request) {
        SparePart part = stockLevelService.getPart(request.getSparePartId());

        if (request.getStoreId() != null && !stockLevelService.hasStockRecord(part.getId(), request.getStoreId())) {
            throw new ResourceNotFoundException("No stock record for part " + part.getId()
                    + " at store " + request.getStoreId());
        }

        BigDecimal estimatedCost = request.getEstimatedCost() != null
                ? request.getEstimatedCost()
                : part.getUnitPrice().multiply(BigDecimal.valueOf(request.getQuantity())).setScale(2, RoundingMode.HALF_UP);

        LimitCheckResult limitCheck = limitCheckerService.check(request.getTechnicianId(), part.getId(),
                part.getCategoryId(), request.getQuantity(), estimatedCost);
        boolean autoApprovable = limitCheck.getOutcome() == LimitOutcome.AUTO_APPROVABLE;

        SparePartRequest partRequest = requestRepository.save(SparePartRequest.builder()
                .serviceRequestId(request.getServiceRequestId())
                .sparePartId(part.getId())
                .categoryId(part.getCategoryId())
                .storeId(request.getStoreId())
                .requestedQuantity(request.getQuantity())
                .priority(request.getPriority())
                .justification(request.getJustification())
                .estimatedCost(estimatedCost)
                .status(RequestStatus.PENDING)
                .currentApprovalLevel(0)
                .requiredApprovalLevels(autoApprovable ? 1 : approvalLevelPolicy.requiredLevels(estimatedCost))
                .limitOutcome(limitCheck.getOutcome())
                .requestedBy(request.getTechnicianId())
                .requestedAt(OffsetDateTime.now(clock))
                .build());

        log.info("Created request {} for {} x part {} on service request {}, limit outcome {}",
                partRequest.getId(), partRequest.getRequestedQuantity(), part.getPartNumber(),
                partRequest.getServiceRequestId(), limitCheck.getOutcome());

        if (autoApprovable) {
            partRequest = approvalEngineService.recordAutoApproval(partRequest);
            approvalEngineService.holdAfterApproval(partRequest, partRequest.getApprovedBy());
        } else {
            approvalEngineService.openLevel(partRequest, 1);
            partRequest = requestRepository.save(partRequest);
        }

        return toResponse(partRequest);
    }

    @Transactional(readOnly = true)
    public PartRequestResponseDTO getRequest(UUID requestId) {
        return toResponse(findRequest(requestId));
    }

    /**
     * Lists requests newest first. All given filters must match.
     */
    @Transactional(readOnly = true)
    public List<PartRequestResponseDTO> listRequests(RequestStatus status, String technicianId, String serviceRequestId) {
        Stream<SparePartRequest> requests;
        if (serviceRequestId != null) {
            requests = requestRepository.findByServiceRequestIdOrderByRequestedAtDesc(serviceRequestId).stream();
        } else if (technicianId != null) {
            requests = requestRepository.findByRequestedByOrderByRequestedAtDesc(technicianId).stream();
        } else if (status != null) {
            requests = requestRepository.findByStatusOrderByRequestedAtDesc(status).stream();
        } else {
            requests = requestRepository.findAllByOrderByRequestedAtDesc().stream();
        }

        return requests
                .filter(request -> status == null || request.getStatus() == status)
                .filter(request -> technicianId == null || technicianId.equals(request.getRequestedBy()))
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    /**
     * Cancels a request that has not reached a final state. The pending approval is
     * withdrawn and every active hold is released.
     */
    public PartRequestResponseDTO cancelRequest(UUID requestId, CancelRequestDTO cancel) {
        SparePartRequest request = requestRepository.findByIdForUpdate(requestId)
                .orElseThrow(() -> new ResourceNotFoundException("Request not found with ID: " + requestId));

        if (!request.getStatus().canTransitionTo(RequestStatus.CANCELLED)) {
            throw new InvalidTransitionException(requestId, request.getStatus(), "cancel");
        }

        approvalEngineService.withdrawActiveEntry(requestId, cancel.getCancelledBy(), cancel.getReason());
        reservationService.releaseAllForRequest(requestId, REASON_REQUEST_CANCELLED);

        RequestStatus previous = request.getStatus();
        request.setStatus(RequestStatus.CANCELLED);
        request.setCancelledAt(OffsetDateTime.now(clock));
        request.setCancellationReason(cancel.getReason());
        request.setAwaitingStock(false);
        request = requestRepository.save(request);

        log.info("Cancelled request {} from {} by {}", requestId, previous, cancel.getCancelledBy());
        return toResponse(request);
    }

    private SparePartRequest findRequest(UUID requestId) {
        return requestRepository.findById(requestId)
                .orElseThrow(() -> new ResourceNotFoundException("Request not found with ID: " + requestId));
    }

    private PartRequestResponseDTO toResponse(SparePartRequest request) {
        return mapper.toResponseDTO(request, reservationService.findActiveReservationId(request.getId()).orElse(null));
    }

    private String generateIdempotencyKey(String technicianId, String clientKey) {
        String source = technicianId + ":" + clientKey;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(source.getBytes(StandardCharsets.UTF_8));

            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    hexString.append('0');
                }
                hexString.append(hex);
            }
            return hexString.toString();

        } catch (NoSuchAlgorithmException e) {
            log.warn("SHA-256 unavailable, using raw idempotency key");
            return source;
        }
    }
}
