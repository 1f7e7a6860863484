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
package com.outwardflow;

import com.outwardflow.dto.ApprovalDecisionRequestDTO;
import com.outwardflow.dto.ApprovalDecisionResponseDTO;
import com.outwardflow.dto.ApprovalHistoryEntryDTO;
import com.outwardflow.dto.CancelRequestDTO;
import com.outwardflow.dto.CreatePartRequestDTO;
import com.outwardflow.dto.InstallationRequestDTO;
import com.outwardflow.dto.InstalledPartDTO;
import com.outwardflow.dto.IssueRequestDTO;
import com.outwardflow.dto.PartRequestResponseDTO;
import com.outwardflow.dto.ReturnPartsRequestDTO;
import com.outwardflow.dto.ServiceCostSummaryDTO;
import com.outwardflow.dto.SparePartRequestDTO;
import com.outwardflow.dto.StockAvailabilityDTO;
import com.outwardflow.dto.StockReceiptRequestDTO;
import com.outwardflow.dto.StockReservationDTO;
import com.outwardflow.dto.TechnicianLimitRequestDTO;
import com.outwardflow.entity.ApprovalDecision;
import com.outwardflow.entity.LimitOutcome;
import com.outwardflow.entity.LimitScope;
import com.outwardflow.entity.RequestPriority;
import com.outwardflow.entity.RequestStatus;
import com.outwardflow.entity.ReservationStatus;
import com.outwardflow.entity.ReturnCondition;
import com.outwardflow.entity.SparePart;
import com.outwardflow.entity.TechnicianLimit;
import com.outwardflow.exceptions.ApprovalConflictException;
import com.outwardflow.exceptions.InsufficientStockException;
import com.outwardflow.exceptions.InvalidTransitionException;
import com.outwardflow.exceptions.ReservationExpiredException;
import com.outwardflow.exceptions.ResourceNotFoundException;
import com.outwardflow.repository.SparePartRequestRepository;
import com.outwardflow.services.ApprovalEngineService;
import com.outwardflow.services.IdempotencyRedisService;
import com.outwardflow.services.IssuanceService;
import com.outwardflow.services.PartRequestService;
import com.outwardflow.services.CostReconciliationService;
import com.outwardflow.services.ReservationExpirySweeper;
import com.outwardflow.services.StockLevelService;
import com.outwardflow.services.StockReservationService;
import com.outwardflow.services.TechnicianLimitService;
import com.outwardflow.services.redis.StockAvailabilityCacheService;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * End-to-end workflow against H2 with real transactions and row locks. Redis-backed
 * services are mocked.
 */
@SpringBootTest
@ActiveProfiles("test")
class OutwardFlowIntegrationTest {

    private static final Instant START = Instant.parse("2026-03-15T10:00:00Z");
    private static final String STORE = "STORE-1";

    @TestConfiguration
    static class ClockConfig {
        @Bean
        @Primary
        MutableClock testClock() {
            return new MutableClock(START);
        }
    }

    @MockBean IdempotencyRedisService idempotencyRedisService;
    @MockBean StockAvailabilityCacheService availabilityCache;

    @Autowired MutableClock clock;
    @Autowired StockLevelService stockLevelService;
    @Autowired StockReservationService reservationService;
    @Autowired PartRequestService partRequestService;
    @Autowired ApprovalEngineService approvalEngineService;
    @Autowired IssuanceService issuanceService;
    @Autowired CostReconciliationService costReconciliationService;
    @Autowired ReservationExpirySweeper sweeper;
    @Autowired TechnicianLimitService technicianLimitService;
    @Autowired SparePartRequestRepository requestRepository;

    SparePart part;
    String technician;
    String serviceRequest;

    @BeforeEach
    void setUp() {
        clock.setInstant(START);
        technician = "tech-" + UUID.randomUUID();
        serviceRequest = "SR-" + UUID.randomUUID();
        part = stockLevelService.registerPart(SparePartRequestDTO.builder()
                .partNumber("BP-" + UUID.randomUUID())
                .name("Brake pad set")
                .categoryId("BRAKES")
                .unitPrice(new BigDecimal("100.00"))
                .warrantyMonths(12)
                .build());
        stockLevelService.receiveStock(part.getId(), StockReceiptRequestDTO.builder()
                .storeId(STORE)
                .quantity(10)
                .receivedBy("storekeeper")
                .build());
    }

    // Helpers

    private PartRequestResponseDTO create(int quantity, String estimatedCost) {
        return partRequestService.createRequest(CreatePartRequestDTO.builder()
                .serviceRequestId(serviceRequest)
                .sparePartId(part.getId())
                .storeId(STORE)
                .quantity(quantity)
                .priority(RequestPriority.HIGH)
                .estimatedCost(new BigDecimal(estimatedCost))
                .justification("Worn pads")
                .technicianId(technician)
                .build(), null);
    }

    private ApprovalDecisionResponseDTO approve(UUID requestId, int level) {
        return approvalEngineService.decide(requestId, ApprovalDecisionRequestDTO.builder()
                .level(level)
                .decision(ApprovalDecision.APPROVED)
                .approverId("manager-" + level)
                .build());
    }

    private IssueRequestDTO issueFromStore() {
        return IssueRequestDTO.builder().storeId(STORE).issuedBy("storekeeper").build();
    }

    private StockAvailabilityDTO availability() {
        return stockLevelService.getAvailability(part.getId(), STORE);
    }

    // Tests

    @Test
    @DisplayName("two-level approval, issue and install settle an actual cost of 270")
    void fullFlow() {
        PartRequestResponseDTO created = create(2, "1500");
        assertThat(created.getStatus()).isEqualTo(RequestStatus.PENDING);
        assertThat(created.getRequiredApprovalLevels()).isEqualTo(2);
        assertThat(created.getCurrentApprovalLevel()).isEqualTo(1);

        ApprovalDecisionResponseDTO first = approve(created.getId(), 1);
        assertThat(first.getRequest().getStatus()).isEqualTo(RequestStatus.PENDING);
        assertThat(first.getNextEntry().getLevel()).isEqualTo(2);

        assertThatThrownBy(() -> approve(created.getId(), 1)).isInstanceOf(ApprovalConflictException.class);

        ApprovalDecisionResponseDTO second = approve(created.getId(), 2);
        assertThat(second.getRequest().getStatus()).isEqualTo(RequestStatus.APPROVED);
        assertThat(second.getRequest().getActiveReservationId()).isNotNull();
        assertThat(availability().getAvailableStock()).isEqualTo(8);

        List<ApprovalHistoryEntryDTO> history = approvalEngineService.getApprovalHistory(created.getId());
        assertThat(history).extracting(ApprovalHistoryEntryDTO::getLevel).containsExactly(1, 2);
        assertThat(history).noneMatch(ApprovalHistoryEntryDTO::isActive);

        PartRequestResponseDTO issued = issuanceService.issue(created.getId(), issueFromStore());
        assertThat(issued.getStatus()).isEqualTo(RequestStatus.ISSUED);
        assertThat(issued.getActualCost()).isNull();
        assertThat(availability().getCurrentStock()).isEqualTo(8);
        assertThat(availability().getReservedStock()).isZero();

        InstallationRequestDTO installation = InstallationRequestDTO.builder()
                .unitCost(new BigDecimal("100"))
                .serviceCost(new BigDecimal("50"))
                .laborCost(new BigDecimal("20"))
                .installedBy(technician)
                .build();
        InstalledPartDTO installed = issuanceService.install(created.getId(), installation);
        assertThat(installed.getTotalCost()).isEqualByComparingTo("270");
        assertThat(installed.getQuantity()).isEqualTo(2);
        assertThat(installed.getWarrantyEnd()).isEqualTo(installed.getWarrantyStart().plusMonths(12));

        InstalledPartDTO again = issuanceService.install(created.getId(), installation);
        assertThat(again.getId()).isEqualTo(installed.getId());

        PartRequestResponseDTO finished = partRequestService.getRequest(created.getId());
        assertThat(finished.getStatus()).isEqualTo(RequestStatus.INSTALLED);
        assertThat(finished.getActualCost()).isEqualByComparingTo("270");

        ServiceCostSummaryDTO summary = costReconciliationService.summarize(serviceRequest);
        assertThat(summary.getTotalActualCost()).isEqualByComparingTo("270");
        assertThat(summary.getVariance()).isEqualByComparingTo("-1230");
    }

    @Test
    @DisplayName("a request below the auto-approval threshold is approved and held immediately")
    void autoApproval() {
        PartRequestResponseDTO created = create(2, "200");

        assertThat(created.getStatus()).isEqualTo(RequestStatus.APPROVED);
        assertThat(created.getApprovedBy()).isEqualTo("system");
        assertThat(created.getActiveReservationId()).isNotNull();
        assertThat(approvalEngineService.getApprovalHistory(created.getId()))
                .singleElement()
                .satisfies(entry -> {
                    assertThat(entry.getDecision()).isEqualTo(ApprovalDecision.APPROVED);
                    assertThat(entry.isActive()).isFalse();
                });
    }

    @Test
    @DisplayName("two concurrent holds of 6 on a stock of 10: exactly one succeeds")
    void concurrentReservations() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<UUID>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 2; i++) {
                Callable<UUID> hold = () -> {
                    start.await();
                    return reservationService.reserve(UUID.randomUUID(), part.getId(), STORE, 6,
                            technician, Duration.ofHours(1)).getId();
                };
                results.add(executor.submit(hold));
            }
            start.countDown();

            int succeeded = 0;
            int refused = 0;
            for (Future<UUID> result : results) {
                try {
                    result.get(30, TimeUnit.SECONDS);
                    succeeded++;
                } catch (java.util.concurrent.ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(InsufficientStockException.class);
                    refused++;
                }
            }

            assertThat(succeeded).isEqualTo(1);
            assertThat(refused).isEqualTo(1);
            assertThat(availability().getReservedStock()).isEqualTo(6);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("releasing twice leaves the first release untouched")
    void releaseIsIdempotent() {
        UUID reservationId = create(2, "200").getActiveReservationId();

        StockReservationDTO first = reservationService.release(reservationId, "no longer needed");
        clock.advance(Duration.ofMinutes(5));
        StockReservationDTO second = reservationService.release(reservationId, "again");

        assertThat(first.getStatus()).isEqualTo(ReservationStatus.RELEASED);
        assertThat(second.getStatus()).isEqualTo(ReservationStatus.RELEASED);
        assertThat(second.getReleasedAt()).isAtSameInstantAs(first.getReleasedAt());
        assertThat(second.getReleaseReason()).isEqualTo("no longer needed");
        assertThat(availability().getAvailableStock()).isEqualTo(10);
    }

    @Test
    @DisplayName("an expired hold cannot be issued and stays EXPIRED")
    void expiredReservationIsNotConsumable() {
        PartRequestResponseDTO created = create(2, "200");
        clock.advance(Duration.ofHours(25));

        assertThatThrownBy(() -> issuanceService.issue(created.getId(), issueFromStore()))
                .isInstanceOf(ReservationExpiredException.class);

        assertThat(reservationService.getReservations(created.getId()))
                .singleElement()
                .extracting(StockReservationDTO::getStatus)
                .isEqualTo(ReservationStatus.EXPIRED);
        assertThat(partRequestService.getRequest(created.getId()).getStatus()).isEqualTo(RequestStatus.APPROVED);
        assertThat(availability().getCurrentStock()).isEqualTo(10);
    }

    @Test
    @DisplayName("the sweep expires overdue holds and frees their stock")
    void sweepExpiresOverdueHolds() {
        PartRequestResponseDTO created = create(3, "300");
        assertThat(availability().getAvailableStock()).isEqualTo(7);

        clock.advance(Duration.ofHours(25));
        assertThat(sweeper.sweepExpiredReservations()).isGreaterThanOrEqualTo(1);

        StockReservationDTO swept = reservationService.release(created.getActiveReservationId(), "late release");
        assertThat(swept.getStatus()).isEqualTo(ReservationStatus.EXPIRED);
        assertThat(availability().getAvailableStock()).isEqualTo(10);
    }

    @Test
    @DisplayName("cancelling an approved request releases its hold")
    void cancelReleasesHold() {
        PartRequestResponseDTO created = create(4, "400");
        assertThat(availability().getAvailableStock()).isEqualTo(6);

        PartRequestResponseDTO cancelled = partRequestService.cancelRequest(created.getId(),
                CancelRequestDTO.builder().cancelledBy(technician).reason("job postponed").build());

        assertThat(cancelled.getStatus()).isEqualTo(RequestStatus.CANCELLED);
        assertThat(cancelled.getActiveReservationId()).isNull();
        assertThat(reservationService.getReservations(created.getId()))
                .singleElement()
                .satisfies(reservation -> {
                    assertThat(reservation.getStatus()).isEqualTo(ReservationStatus.RELEASED);
                    assertThat(reservation.getReleaseReason()).isEqualTo("REQUEST_CANCELLED");
                });
        assertThat(availability().getAvailableStock()).isEqualTo(10);

        assertThatThrownBy(() -> partRequestService.cancelRequest(created.getId(),
                CancelRequestDTO.builder().cancelledBy(technician).build()))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    @DisplayName("cancelling a pending request withdraws its open approval")
    void cancelWithdrawsPendingApproval() {
        PartRequestResponseDTO created = create(1, "800");

        partRequestService.cancelRequest(created.getId(),
                CancelRequestDTO.builder().cancelledBy(technician).reason("duplicate").build());

        assertThat(approvalEngineService.getApprovalHistory(created.getId()))
                .singleElement()
                .satisfies(entry -> {
                    assertThat(entry.isActive()).isFalse();
                    assertThat(entry.getDecision()).isEqualTo(ApprovalDecision.PENDING);
                    assertThat(entry.getComments()).contains("duplicate");
                });
        assertThat(approvalEngineService.getPendingApprovals())
                .noneMatch(entry -> entry.getRequestId().equals(created.getId()));
    }

    @Test
    @DisplayName("approval without enough stock leaves the request awaiting stock")
    void approvalWithoutStock() {
        PartRequestResponseDTO created = create(12, "120");

        assertThat(created.getStatus()).isEqualTo(RequestStatus.APPROVED);
        assertThat(created.isAwaitingStock()).isTrue();
        assertThat(created.getActiveReservationId()).isNull();
    }

    @Test
    @DisplayName("damaged returns go back on the shelf but not into available stock")
    void damagedReturn() {
        PartRequestResponseDTO created = create(2, "200");
        issuanceService.issue(created.getId(), issueFromStore());

        PartRequestResponseDTO returned = issuanceService.returnParts(created.getId(), ReturnPartsRequestDTO.builder()
                .condition(ReturnCondition.DAMAGED)
                .reason("cracked in transit")
                .returnedBy(technician)
                .build());

        assertThat(returned.getStatus()).isEqualTo(RequestStatus.RETURNED);
        StockAvailabilityDTO stock = availability();
        assertThat(stock.getCurrentStock()).isEqualTo(10);
        assertThat(stock.getDamagedStock()).isEqualTo(2);
        assertThat(stock.getAvailableStock()).isEqualTo(8);
    }

    @Test
    @DisplayName("a breached per-request quantity ceiling routes the request to manual approval until deactivated")
    void limitCeilingForcesApproval() {
        TechnicianLimit limit = technicianLimitService.defineLimit(TechnicianLimitRequestDTO.builder()
                .technicianId(technician)
                .scope(LimitScope.TOTAL)
                .targetId("ignored")
                .maxQuantityPerRequest(1)
                .build());
        assertThat(limit.getTargetId()).isNull();
        assertThat(technicianLimitService.getLimits(technician)).hasSize(1);

        PartRequestResponseDTO limited = create(2, "200");
        assertThat(limited.getLimitOutcome()).isEqualTo(LimitOutcome.LIMIT_EXCEEDED);
        assertThat(limited.getStatus()).isEqualTo(RequestStatus.PENDING);
        assertThat(limited.getCurrentApprovalLevel()).isEqualTo(1);

        technicianLimitService.deactivateLimit(limit.getId());

        PartRequestResponseDTO unlimited = create(2, "200");
        assertThat(unlimited.getLimitOutcome()).isEqualTo(LimitOutcome.AUTO_APPROVABLE);
        assertThat(unlimited.getStatus()).isEqualTo(RequestStatus.APPROVED);
    }

    @Test
    @DisplayName("two approvers racing on the final level: one applies, the other conflicts")
    void concurrentFinalApproval() throws Exception {
        PartRequestResponseDTO created = create(2, "800");
        assertThat(created.getRequiredApprovalLevels()).isEqualTo(1);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ApprovalDecisionResponseDTO>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 2; i++) {
                String approverId = "manager-" + i;
                Callable<ApprovalDecisionResponseDTO> decide = () -> {
                    start.await();
                    return approvalEngineService.decide(created.getId(), ApprovalDecisionRequestDTO.builder()
                            .level(1)
                            .decision(ApprovalDecision.APPROVED)
                            .approverId(approverId)
                            .build());
                };
                results.add(executor.submit(decide));
            }
            start.countDown();

            int applied = 0;
            int conflicted = 0;
            for (Future<ApprovalDecisionResponseDTO> result : results) {
                try {
                    result.get(30, TimeUnit.SECONDS);
                    applied++;
                } catch (java.util.concurrent.ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(ApprovalConflictException.class);
                    conflicted++;
                }
            }

            assertThat(applied).isEqualTo(1);
            assertThat(conflicted).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }

        assertThat(approvalEngineService.getApprovalHistory(created.getId()))
                .singleElement()
                .satisfies(entry -> {
                    assertThat(entry.getLevel()).isEqualTo(1);
                    assertThat(entry.getDecision()).isEqualTo(ApprovalDecision.APPROVED);
                    assertThat(entry.isActive()).isFalse();
                });
        assertThat(partRequestService.getRequest(created.getId()).getStatus()).isEqualTo(RequestStatus.APPROVED);
    }

    @Test
    @DisplayName("replaying the final approval after the request is approved is a conflict")
    void replayedFinalApprovalConflicts() {
        PartRequestResponseDTO created = create(2, "800");
        approve(created.getId(), 1);

        assertThatThrownBy(() -> approve(created.getId(), 1)).isInstanceOf(ApprovalConflictException.class);
    }

    @Test
    @DisplayName("an idempotent create publishes its response only once the request is committed")
    void idempotentResponseStoredAfterCommit() {
        when(idempotencyRedisService.tryLock(anyString())).thenReturn(true);
        AtomicBoolean visibleWhenStored = new AtomicBoolean();
        ExecutorService reader = Executors.newSingleThreadExecutor();
        try {
            doAnswer(invocation -> {
                PartRequestResponseDTO stored = invocation.getArgument(1);
                visibleWhenStored.set(reader.submit(() -> requestRepository.existsById(stored.getId()))
                        .get(30, TimeUnit.SECONDS));
                return null;
            }).when(idempotencyRedisService).storeResponseAndReleaseLock(anyString(), any(PartRequestResponseDTO.class));

            PartRequestResponseDTO created = partRequestService.createRequest(CreatePartRequestDTO.builder()
                    .serviceRequestId(serviceRequest)
                    .sparePartId(part.getId())
                    .storeId(STORE)
                    .quantity(1)
                    .priority(RequestPriority.MEDIUM)
                    .technicianId(technician)
                    .build(), "retry-key-1");

            verify(idempotencyRedisService).storeResponseAndReleaseLock(anyString(), eq(created));
            assertThat(visibleWhenStored).isTrue();
        } finally {
            reader.shutdownNow();
        }
    }

    @Test
    @DisplayName("a failed idempotent create releases the key without storing a response")
    void failedIdempotentCreateReleasesKey() {
        when(idempotencyRedisService.tryLock(anyString())).thenReturn(true);

        assertThatThrownBy(() -> partRequestService.createRequest(CreatePartRequestDTO.builder()
                .serviceRequestId(serviceRequest)
                .sparePartId(UUID.randomUUID())
                .storeId(STORE)
                .quantity(1)
                .priority(RequestPriority.MEDIUM)
                .technicianId(technician)
                .build(), "retry-key-2"))
                .isInstanceOf(ResourceNotFoundException.class);

        verify(idempotencyRedisService, never()).storeResponseAndReleaseLock(anyString(), any());
        verify(idempotencyRedisService).releaseLock(anyString());
    }
}
