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

import com.outwardflow.dto.ServiceCostSummaryDTO;
import com.outwardflow.entity.InstalledPart;
import com.outwardflow.entity.RequestStatus;
import com.outwardflow.entity.SparePartRequest;
import com.outwardflow.exceptions.ResourceNotFoundException;
import com.outwardflow.mapper.OutwardFlowMapperImpl;
import com.outwardflow.repository.InstalledPartRepository;
import com.outwardflow.repository.SparePartRequestRepository;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CostReconciliationServiceTest {

    @Mock InstalledPartRepository installedPartRepository;
    @Mock SparePartRequestRepository requestRepository;

    CostReconciliationService service;

    @BeforeEach
    void setUp() {
        service = new CostReconciliationService(installedPartRepository, requestRepository, new OutwardFlowMapperImpl());
    }

    @Test
    @DisplayName("reconcile: 2 x 100 + 50 service + 20 labor settles at 270")
    void reconcileWritesTotalOnBothRecords() {
        SparePartRequest request = SparePartRequest.builder()
                .id(UUID.randomUUID())
                .estimatedCost(new BigDecimal("250.00"))
                .build();
        InstalledPart installed = InstalledPart.builder()
                .quantity(2)
                .unitCost(new BigDecimal("100"))
                .serviceCost(new BigDecimal("50"))
                .laborCost(new BigDecimal("20"))
                .build();

        BigDecimal total = service.reconcile(request, installed);

        assertThat(total).isEqualByComparingTo("270");
        assertThat(total.scale()).isEqualTo(2);
        assertThat(installed.getTotalCost()).isEqualByComparingTo("270");
        assertThat(request.getActualCost()).isEqualByComparingTo("270");
        assertThat(request.effectiveCost()).isEqualByComparingTo("270");
    }

    @Test
    @DisplayName("calculateTotal: missing service and labor cost count as zero")
    void missingCostsAreZero() {
        assertThat(service.calculateTotal(new BigDecimal("12.345"), 3, null, null)).isEqualByComparingTo("37.04");
    }

    @Test
    @DisplayName("summarize: sums installations and reports variance against estimates")
    void summarizeServiceRequest() {
        UUID installedId = UUID.randomUUID();
        SparePartRequest installedRequest = SparePartRequest.builder()
                .id(installedId)
                .status(RequestStatus.INSTALLED)
                .estimatedCost(new BigDecimal("250"))
                .build();
        SparePartRequest cancelled = SparePartRequest.builder()
                .id(UUID.randomUUID())
                .status(RequestStatus.CANCELLED)
                .estimatedCost(new BigDecimal("900"))
                .build();
        InstalledPart part = InstalledPart.builder()
                .requestId(installedId)
                .serviceRequestId("SR-1")
                .quantity(2)
                .unitCost(new BigDecimal("100"))
                .serviceCost(new BigDecimal("50"))
                .laborCost(new BigDecimal("20"))
                .totalCost(new BigDecimal("270"))
                .build();

        when(requestRepository.findByServiceRequestIdOrderByRequestedAtDesc("SR-1"))
                .thenReturn(List.of(installedRequest, cancelled));
        when(installedPartRepository.findByServiceRequestId("SR-1")).thenReturn(List.of(part));

        ServiceCostSummaryDTO summary = service.summarize("SR-1");

        assertThat(summary.getInstalledParts()).isEqualTo(1);
        assertThat(summary.getPartsCost()).isEqualByComparingTo("200");
        assertThat(summary.getServiceCost()).isEqualByComparingTo("50");
        assertThat(summary.getLaborCost()).isEqualByComparingTo("20");
        assertThat(summary.getTotalActualCost()).isEqualByComparingTo("270");
        assertThat(summary.getTotalEstimatedCost()).isEqualByComparingTo("250");
        assertThat(summary.getVariance()).isEqualByComparingTo("20");
        assertThat(summary.getInstallations()).hasSize(1);
    }

    @Test
    @DisplayName("summarize: unknown service request is NOT_FOUND")
    void summarizeUnknown() {
        when(requestRepository.findByServiceRequestIdOrderByRequestedAtDesc("SR-X")).thenReturn(List.of());

        assertThatThrownBy(() -> service.summarize("SR-X")).isInstanceOf(ResourceNotFoundException.class);
    }
}
