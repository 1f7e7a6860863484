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

import com.outwardflow.dto.InstalledPartDTO;
import com.outwardflow.dto.ServiceCostSummaryDTO;
import com.outwardflow.entity.InstalledPart;
import com.outwardflow.entity.RequestStatus;
import com.outwardflow.entity.SparePartRequest;
import com.outwardflow.exceptions.ResourceNotFoundException;
import com.outwardflow.mapper.OutwardFlowMapper;
import com.outwardflow.repository.InstalledPartRepository;
import com.outwardflow.repository.SparePartRequestRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Settles the actual cost of an installation and rolls costs up per service request.
 */
@Service
@Transactional(readOnly = true)
@Slf4j
public class CostReconciliationService {

    private final InstalledPartRepository installedPartRepository;
    private final SparePartRequestRepository requestRepository;
    private final OutwardFlowMapper mapper;

    public CostReconciliationService(
            InstalledPartRepository installedPartRepository,
            SparePartRequestRepository requestRepository,
            OutwardFlowMapper mapper) {
        this.installedPartRepository = installedPartRepository;
        this.requestRepository = requestRepository;
        this.mapper = mapper;
    }

    public BigDecimal calculateTotal(BigDecimal unitCost, int quantity, BigDecimal serviceCost, BigDecimal laborCost) {
        return nullToZero(unitCost).multiply(BigDecimal.valueOf(quantity))
                .add(nullToZero(serviceCost))
                .add(nullToZero(laborCost))
                .setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Writes the total onto the installation record and the request. Neither is saved here.
     */
    public BigDecimal reconcile(SparePartRequest request, InstalledPart installedPart) {
        BigDecimal total = calculateTotal(installedPart.getUnitCost(), installedPart.getQuantity(),
                installedPart.getServiceCost(), installedPart.getLaborCost());

        installedPart.setTotalCost(total);
        request.setActualCost(total);

        log.info("Request {} actual cost {} (estimated {})", request.getId(), total, request.getEstimatedCost());
        return total;
    }

    public ServiceCostSummaryDTO summarize(String serviceRequestId) {
        List<SparePartRequest> requests = requestRepository.findByServiceRequestIdOrderByRequestedAtDesc(serviceRequestId);
        if (requests.isEmpty()) {
            throw new ResourceNotFoundException("No requests found for service request: " + serviceRequestId);
        }

        List<InstalledPart> installed = installedPartRepository.findByServiceRequestId(serviceRequestId);

        BigDecimal partsCost = BigDecimal.ZERO;
        BigDecimal serviceCost = BigDecimal.ZERO;
        BigDecimal laborCost = BigDecimal.ZERO;
        BigDecimal totalActual = BigDecimal.ZERO;
        for (InstalledPart part : installed) {
            partsCost = partsCost.add(nullToZero(part.getUnitCost()).multiply(BigDecimal.valueOf(part.getQuantity())));
            serviceCost = serviceCost.add(nullToZero(part.getServiceCost()));
            laborCost = laborCost.add(nullToZero(part.getLaborCost()));
            totalActual = totalActual.add(nullToZero(part.getTotalCost()));
        }

        BigDecimal totalEstimated = requests.stream()
                .filter(request -> request.getStatus() == RequestStatus.INSTALLED)
                .map(SparePartRequest::getEstimatedCost)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        List<InstalledPartDTO> installations = installed.stream()
                .map(mapper::toInstalledPartDTO)
                .collect(Collectors.toList());

        return ServiceCostSummaryDTO.builder()
                .serviceRequestId(serviceRequestId)
                .installedParts(installed.size())
                .partsCost(partsCost.setScale(2, RoundingMode.HALF_UP))
                .serviceCost(serviceCost.setScale(2, RoundingMode.HALF_UP))
                .laborCost(laborCost.setScale(2, RoundingMode.HALF_UP))
                .totalActualCost(totalActual.setScale(2, RoundingMode.HALF_UP))
                .totalEstimatedCost(totalEstimated.setScale(2, RoundingMode.HALF_UP))
                .variance(totalActual.subtract(totalEstimated).setScale(2, RoundingMode.HALF_UP))
                .installations(installations)
                .build();
    }

    private static BigDecimal nullToZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
