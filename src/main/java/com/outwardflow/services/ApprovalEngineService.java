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
import com.outwardflow.dto.ApprovalDecisionRequestDTO;
import com.outwardflow.dto.ApprovalDecisionResponseDTO;
import com.outwardflow.dto.ApprovalHistoryEntryDTO;
import com.outwardflow.entity.ApprovalDecision;
import com.outwardflow.entity.ApprovalHistoryEntry;
import com.outwardflow.entity.RequestStatus;
import com.outwardflow.entity.SparePartRequest;
import com.outwardflow.entity.StockReservation;
import com.outwardflow.exceptions.ApprovalConflictException;
import com.outwardflow.exceptions.ApproverNotAuthorizedException;
import com.outwardflow.exceptions.InvalidRequestException;
import com.outwardflow.exceptions.InvalidTransitionException;
import com.outwardflow.exceptions.ResourceNotFoundException;
import com.outwardflow.mapper.OutwardFlowMapper;
import com.outwardflow.repository.ApprovalHistoryRepository;
import com.outwardflow.repository.SparePartRequestRepository;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Multi-level approval of outward requests.
 *
 * <p>A request waits on at most one active history entry. A decision closes that entry
 * with a conditional update on {@code active = true}; whoever loses that race gets an
 * {@link ApprovalConflictException}. Approval at the last required level approves the
 * request and tries to hold stock for it, otherwise the next level is opened.
 */
@Service
@Transactional
@Slf4j
public class ApprovalEngineService {

    private final SparePartRequestRepository requestRepository;
    private final ApprovalHistoryRepository historyRepository;
    private final ApproverAuthorization approverAuthorization;
    private final StockReservationService reservationService;
    private final OutwardFlowMapper mapper;
    private final OutwardFlowProperties properties;
    private final Clock clock;

    public ApprovalEngineService(
            SparePartRequestRepository requestRepository,
            ApprovalHistoryRepository historyRepository,
            ApproverAuthorization approverAuthorization,
            StockReservationService reservationService,
            OutwardFlowMapper mapper,
            OutwardFlowProperties properties,
            Clock clock) {
        this.requestRepository = requestRepository;
        this.historyRepository = historyRepository;
        this.approverAuthorization = approverAuthorization;
        this.reservationService = reservationService;
        this.mapper = mapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Opens the given level for a pending request and makes it the current one.
     */
    public ApprovalHistoryEntry openLevel(SparePartRequest request, int level) {
        request.advanceApprovalLevel(level);

        Integer availableStock = request.getStoreId() == null ? null
                : reservationService.availableStock(request.getSparePartId(), request.getStoreId()).orElse(null);

        ApprovalHistoryEntry entry = historyRepository.save(ApprovalHistoryEntry.builder()
                .requestId(request.getId())
                .level(level)
                .decision(ApprovalDecision.PENDING)
                .requestValue(request.getEstimatedCost())
                .availableStock(availableStock)
                .assignedAt(OffsetDateTime.now(clock))
                .active(true)
                .build());

        log.info("Opened approval level {} of {} for request {}", level, request.getRequiredApprovalLevels(), request.getId());
        return entry;
    }

    /**
     * Approves a request that passed its limit check without a human decision. The level-1
     * entry is written already closed, signed by the system actor.
     */
    public SparePartRequest recordAutoApproval(SparePartRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        String systemActor = properties.getReservation().getSystemActor();

        request.advanceApprovalLevel(1);
        request.setStatus(RequestStatus.APPROVED);
        request.setApprovedBy(systemActor);
        request.setApprovedAt(now);

        historyRepository.save(ApprovalHistoryEntry.builder()
                .requestId(request.getId())
                .level(1)
                .approverId(systemActor)
                .decision(ApprovalDecision.APPROVED)
                .comments("Auto-approved within technician limits")
                .requestValue(request.getEstimatedCost())
                .assignedAt(now)
                .processedAt(now)
                .active(false)
                .build());

        log.info("Request {} auto-approved", request.getId());
        return requestRepository.save(request);
    }

    public ApprovalDecisionResponseDTO decide(UUID requestId, ApprovalDecisionRequestDTO decisionRequest) {
        ApprovalDecision decision = decisionRequest.getDecision();
        int level = decisionRequest.getLevel();
        String approverId = decisionRequest.getApproverId();

        if (decision == ApprovalDecision.PENDING) {
            throw new InvalidRequestException("Decision must be APPROVED, REJECTED or ESCALATED");
        }

        SparePartRequest request = requestRepository.findByIdForUpdate(requestId)
                .orElseThrow(() -> new ResourceNotFoundException("Request not found with ID: " + requestId));

        if (request.getStatus() != RequestStatus.PENDING) {
            // a level that was already closed on a finished request is a replayed or raced decision
            if (historyRepository.existsByRequestIdAndLevelAndActiveFalse(requestId, level)) {
                throw new ApprovalConflictException(requestId, level, "a decision was already recorded");
            }
            throw new InvalidTransitionException(requestId, request.getStatus(), "decide approval");
        }

        if (!approverAuthorization.canDecide(approverId, level, request.getEstimatedCost())) {
            throw new ApproverNotAuthorizedException(approverId, level);
        }

        ApprovalHistoryEntry activeEntry = historyRepository.findByRequestIdAndActiveTrue(requestId)
                .orElseThrow(() -> new ApprovalConflictException(requestId, level, "no approval is awaiting a decision"));

        if (activeEntry.getLevel() != level) {
            throw new ApprovalConflictException(requestId, level,
                    "the request is awaiting a decision at level " + activeEntry.getLevel());
        }

        if (decision == ApprovalDecision.ESCALATED && level >= properties.getApproval().getMaxLevel()) {
            throw new InvalidRequestException("Cannot escalate beyond approval level " + properties.getApproval().getMaxLevel());
        }

        int updated = historyRepository.closeIfActive(activeEntry.getId(), decision, approverId,
                decisionRequest.getComments(), OffsetDateTime.now(clock));
        if (updated == 0) {
            throw new ApprovalConflictException(requestId, level, "a decision was already recorded");
        }

        log.info("Request {} level {} decided {} by {}", requestId, level, decision, approverId);

        // the conditional update cleared the persistence context, so the request is merged back
        ApprovalHistoryEntry nextEntry = null;
        switch (decision) {
            case REJECTED:
                request.setStatus(RequestStatus.REJECTED);
                request = requestRepository.save(request);
                break;
            case APPROVED:
                if (level >= request.getRequiredApprovalLevels()) {
                    request.setStatus(RequestStatus.APPROVED);
                    request.setApprovedBy(approverId);
                    request.setApprovedAt(OffsetDateTime.now(clock));
                    request = requestRepository.save(request);
                    holdAfterApproval(request, approverId);
                } else {
                    nextEntry = openLevel(request, level + 1);
                    request = requestRepository.save(request);
                }
                break;
            case ESCALATED:
                request.setRequiredApprovalLevels(Math.max(request.getRequiredApprovalLevels(), level + 1));
                nextEntry = openLevel(request, level + 1);
                request = requestRepository.save(request);
                break;
            default:
                throw new InvalidRequestException("Unsupported decision " + decision);
        }

        ApprovalHistoryEntry decided = historyRepository.findById(activeEntry.getId()).orElse(activeEntry);
        UUID activeReservationId = reservationService.findActiveReservationId(requestId).orElse(null);

        return ApprovalDecisionResponseDTO.builder()
                .decidedEntry(mapper.toApprovalHistoryEntryDTO(decided))
                .nextEntry(mapper.toApprovalHistoryEntryDTO(nextEntry))
                .request(mapper.toResponseDTO(request, activeReservationId))
                .build();
    }

    /**
     * Tries to hold stock for a freshly approved request. A shortage leaves the request
     * APPROVED and flagged as awaiting stock.
     */
    public Optional<StockReservation> holdAfterApproval(SparePartRequest request, String actor) {
        if (request.getStoreId() == null) {
            log.info("Request {} approved without a store, no stock held", request.getId());
            return Optional.empty();
        }

        Optional<StockReservation> reservation = reservationService.tryReserve(request.getId(),
                request.getSparePartId(), request.getStoreId(), request.getRequestedQuantity(),
                actor, properties.getReservation().getTtl());

        request.setAwaitingStock(reservation.isEmpty());
        requestRepository.save(request);

        if (reservation.isEmpty()) {
            log.warn("Request {} approved but stock unavailable at store {}, awaiting stock",
                    request.getId(), request.getStoreId());
        }
        return reservation;
    }

    /**
     * Withdraws the pending entry of a request that is being cancelled. The entry keeps its
     * PENDING decision and records the cancellation in its comments.
     */
    public void withdrawActiveEntry(UUID requestId, String actor, String reason) {
        historyRepository.findByRequestIdAndActiveTrue(requestId).ifPresent(entry -> {
            historyRepository.closeIfActive(entry.getId(), entry.getDecision(), actor,
                    "Request cancelled" + (reason != null ? ": " + reason : ""), OffsetDateTime.now(clock));
            log.info("Withdrew approval level {} of cancelled request {}", entry.getLevel(), requestId);
        });
    }

    @Transactional(readOnly = true)
    public List<ApprovalHistoryEntryDTO> getApprovalHistory(UUID requestId) {
        if (!requestRepository.existsById(requestId)) {
            throw new ResourceNotFoundException("Request not found with ID: " + requestId);
        }
        return mapper.toApprovalHistoryEntryDTOList(historyRepository.findByRequestIdOrderByLevelAsc(requestId));
    }

    @Transactional(readOnly = true)
    public List<ApprovalHistoryEntryDTO> getPendingApprovals() {
        return mapper.toApprovalHistoryEntryDTOList(historyRepository.findByActiveTrueOrderByAssignedAtAsc());
    }
}
