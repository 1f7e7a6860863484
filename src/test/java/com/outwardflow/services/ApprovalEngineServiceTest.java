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
import com.outwardflow.entity.ApprovalDecision;
import com.outwardflow.entity.ApprovalHistoryEntry;
import com.outwardflow.entity.RequestPriority;
import com.outwardflow.entity.RequestStatus;
import com.outwardflow.entity.SparePartRequest;
import com.outwardflow.exceptions.ApprovalConflictException;
import com.outwardflow.exceptions.ApproverNotAuthorizedException;
import com.outwardflow.exceptions.InvalidRequestException;
import com.outwardflow.exceptions.InvalidTransitionException;
import com.outwardflow.mapper.OutwardFlowMapperImpl;
import com.outwardflow.repository.ApprovalHistoryRepository;
import com.outwardflow.repository.SparePartRequestRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Approval state machine with repositories and the reservation manager mocked.
 */
@ExtendWith(MockitoExtension.class)
class ApprovalEngineServiceTest {

    @Mock SparePartRequestRepository requestRepository;
    @Mock ApprovalHistoryRepository historyRepository;
    @Mock ApproverAuthorization approverAuthorization;
    @Mock StockReservationService reservationService;

    ApprovalEngineService service;
    UUID requestId;

    @BeforeEach
    void setUp() {
        service = new ApprovalEngineService(requestRepository, historyRepository, approverAuthorization,
                reservationService, new OutwardFlowMapperImpl(), new OutwardFlowProperties(),
                Clock.fixed(Instant.parse("2026-03-15T10:00:00Z"), ZoneOffset.UTC));
        requestId = UUID.randomUUID();
    }

    // Helpers

    private SparePartRequest pendingRequest(int requiredLevels, int currentLevel, String storeId) {
        return SparePartRequest.builder()
                .id(requestId)
                .serviceRequestId("SR-1")
                .sparePartId(UUID.randomUUID())
                .storeId(storeId)
                .requestedQuantity(2)
                .priority(RequestPriority.MEDIUM)
                .estimatedCost(new BigDecimal("2500"))
                .status(RequestStatus.PENDING)
                .currentApprovalLevel(currentLevel)
                .requiredApprovalLevels(requiredLevels)
                .requestedBy("tech-1")
                .requestedAt(OffsetDateTime.parse("2026-03-15T09:00:00Z"))
                .version(0L)
                .build();
    }

    private ApprovalHistoryEntry activeEntry(int level) {
        return ApprovalHistoryEntry.builder()
                .id(UUID.randomUUID())
                .requestId(requestId)
                .level(level)
                .decision(ApprovalDecision.PENDING)
                .requestValue(new BigDecimal("2500"))
                .assignedAt(OffsetDateTime.parse("2026-03-15T09:00:00Z"))
                .active(true)
                .build();
    }

    private ApprovalDecisionRequestDTO decision(int level, ApprovalDecision decision) {
        return ApprovalDecisionRequestDTO.builder()
                .level(level)
                .decision(decision)
                .approverId("manager-" + level)
                .comments("ok")
                .build();
    }

    private void givenDecisionContext(SparePartRequest request, ApprovalHistoryEntry entry) {
        when(requestRepository.findByIdForUpdate(requestId)).thenReturn(Optional.of(request));
        when(approverAuthorization.canDecide(any(), anyInt(), any())).thenReturn(true);
        when(historyRepository.findByRequestIdAndActiveTrue(requestId)).thenReturn(Optional.of(entry));
    }

    // decide

    @Test
    @DisplayName("approval at level 1 of 2 opens level 2 and keeps the request pending")
    void approveIntermediateLevelOpensNext() {
        SparePartRequest request = pendingRequest(2, 1, null);
        ApprovalHistoryEntry level1 = activeEntry(1);
        givenDecisionContext(request, level1);
        when(historyRepository.closeIfActive(eq(level1.getId()), eq(ApprovalDecision.APPROVED), eq("manager-1"), any(), any()))
                .thenReturn(1);
        when(historyRepository.save(any(ApprovalHistoryEntry.class))).thenAnswer(inv -> inv.getArgument(0));
        when(requestRepository.save(any(SparePartRequest.class))).thenAnswer(inv -> inv.getArgument(0));

        ApprovalDecisionResponseDTO response = service.decide(requestId, decision(1, ApprovalDecision.APPROVED));

        ArgumentCaptor<ApprovalHistoryEntry> opened = ArgumentCaptor.forClass(ApprovalHistoryEntry.class);
        verify(historyRepository).save(opened.capture());
        assertThat(opened.getValue().getLevel()).isEqualTo(2);
        assertThat(opened.getValue().isActive()).isTrue();
        assertThat(opened.getValue().getDecision()).isEqualTo(ApprovalDecision.PENDING);

        assertThat(response.getRequest().getStatus()).isEqualTo(RequestStatus.PENDING);
        assertThat(response.getRequest().getCurrentApprovalLevel()).isEqualTo(2);
        assertThat(response.getNextEntry().getLevel()).isEqualTo(2);
        verify(reservationService, never()).tryReserve(any(), any(), any(), anyInt(), any(), any());
    }

    @Test
    @DisplayName("replaying a level-1 decision after level 2 opened is a conflict")
    void replayedDecisionConflicts() {
        givenDecisionContext(pendingRequest(2, 2, null), activeEntry(2));

        assertThatThrownBy(() -> service.decide(requestId, decision(1, ApprovalDecision.APPROVED)))
                .isInstanceOf(ApprovalConflictException.class);
        verify(historyRepository, never()).closeIfActive(any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("losing the conditional update race is a conflict")
    void concurrentDecisionConflicts() {
        ApprovalHistoryEntry level1 = activeEntry(1);
        givenDecisionContext(pendingRequest(1, 1, null), level1);
        when(historyRepository.closeIfActive(eq(level1.getId()), any(), any(), any(), any())).thenReturn(0);

        assertThatThrownBy(() -> service.decide(requestId, decision(1, ApprovalDecision.APPROVED)))
                .isInstanceOf(ApprovalConflictException.class);
        verify(requestRepository, never()).save(any());
    }

    @Test
    @DisplayName("final approval with no stock leaves the request approved and awaiting stock")
    void finalApprovalWithoutStock() {
        SparePartRequest request = pendingRequest(1, 1, "STORE-1");
        ApprovalHistoryEntry level1 = activeEntry(1);
        givenDecisionContext(request, level1);
        when(historyRepository.closeIfActive(eq(level1.getId()), eq(ApprovalDecision.APPROVED), any(), any(), any()))
                .thenReturn(1);
        when(requestRepository.save(any(SparePartRequest.class))).thenAnswer(inv -> inv.getArgument(0));
        when(reservationService.tryReserve(eq(requestId), any(), eq("STORE-1"), eq(2), eq("manager-1"), eq(Duration.ofHours(24))))
                .thenReturn(Optional.empty());

        ApprovalDecisionResponseDTO response = service.decide(requestId, decision(1, ApprovalDecision.APPROVED));

        assertThat(response.getRequest().getStatus()).isEqualTo(RequestStatus.APPROVED);
        assertThat(response.getRequest().getApprovedBy()).isEqualTo("manager-1");
        assertThat(response.getRequest().isAwaitingStock()).isTrue();
        assertThat(response.getNextEntry()).isNull();
    }

    @Test
    @DisplayName("rejection ends the request without holding stock")
    void rejectEndsRequest() {
        ApprovalHistoryEntry level1 = activeEntry(1);
        givenDecisionContext(pendingRequest(2, 1, "STORE-1"), level1);
        when(historyRepository.closeIfActive(eq(level1.getId()), eq(ApprovalDecision.REJECTED), any(), any(), any()))
                .thenReturn(1);
        when(requestRepository.save(any(SparePartRequest.class))).thenAnswer(inv -> inv.getArgument(0));

        ApprovalDecisionResponseDTO response = service.decide(requestId, decision(1, ApprovalDecision.REJECTED));

        assertThat(response.getRequest().getStatus()).isEqualTo(RequestStatus.REJECTED);
        verify(reservationService, never()).tryReserve(any(), any(), any(), anyInt(), any(), any());
    }

    @Test
    @DisplayName("escalation opens the next level and raises the required level count")
    void escalateOpensNextLevel() {
        ApprovalHistoryEntry level1 = activeEntry(1);
        givenDecisionContext(pendingRequest(1, 1, null), level1);
        when(historyRepository.closeIfActive(eq(level1.getId()), eq(ApprovalDecision.ESCALATED), any(), any(), any()))
                .thenReturn(1);
        when(historyRepository.save(any(ApprovalHistoryEntry.class))).thenAnswer(inv -> inv.getArgument(0));
        when(requestRepository.save(any(SparePartRequest.class))).thenAnswer(inv -> inv.getArgument(0));

        ApprovalDecisionResponseDTO response = service.decide(requestId, decision(1, ApprovalDecision.ESCALATED));

        assertThat(response.getRequest().getRequiredApprovalLevels()).isEqualTo(2);
        assertThat(response.getNextEntry().getLevel()).isEqualTo(2);
    }

    @Test
    @DisplayName("escalating past the highest level is rejected before anything is written")
    void escalateBeyondMaxLevel() {
        givenDecisionContext(pendingRequest(5, 5, null), activeEntry(5));

        assertThatThrownBy(() -> service.decide(requestId, decision(5, ApprovalDecision.ESCALATED)))
                .isInstanceOf(InvalidRequestException.class);
        verify(historyRepository, never()).closeIfActive(any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("an approver without authority for the level is refused")
    void unauthorizedApprover() {
        when(requestRepository.findByIdForUpdate(requestId)).thenReturn(Optional.of(pendingRequest(1, 1, null)));
        when(approverAuthorization.canDecide(any(), anyInt(), any())).thenReturn(false);

        assertThatThrownBy(() -> service.decide(requestId, decision(1, ApprovalDecision.APPROVED)))
                .isInstanceOf(ApproverNotAuthorizedException.class);
    }

    @Test
    @DisplayName("replaying the final level after the request was approved is a conflict")
    void replayFinalLevelAfterApproval() {
        SparePartRequest approved = pendingRequest(1, 1, null);
        approved.setStatus(RequestStatus.APPROVED);
        when(requestRepository.findByIdForUpdate(requestId)).thenReturn(Optional.of(approved));
        when(historyRepository.existsByRequestIdAndLevelAndActiveFalse(requestId, 1)).thenReturn(true);

        assertThatThrownBy(() -> service.decide(requestId, decision(1, ApprovalDecision.APPROVED)))
                .isInstanceOf(ApprovalConflictException.class);
        verify(historyRepository, never()).closeIfActive(any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("deciding a level that never existed on a finished request is an invalid transition")
    void decideUnknownLevelOnApprovedRequest() {
        SparePartRequest approved = pendingRequest(1, 1, null);
        approved.setStatus(RequestStatus.APPROVED);
        when(requestRepository.findByIdForUpdate(requestId)).thenReturn(Optional.of(approved));
        when(historyRepository.existsByRequestIdAndLevelAndActiveFalse(requestId, 3)).thenReturn(false);

        assertThatThrownBy(() -> service.decide(requestId, decision(3, ApprovalDecision.APPROVED)))
                .isInstanceOf(InvalidTransitionException.class);
    }
}
