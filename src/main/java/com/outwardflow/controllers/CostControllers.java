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
package com.outwardflow.controllers;

import com.outwardflow.dto.ServiceCostSummaryDTO;
import com.outwardflow.services.CostReconciliationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/outward/service-requests")
public class CostControllers {

    private final CostReconciliationService costReconciliationService;

    public CostControllers(CostReconciliationService costReconciliationService) {
        this.costReconciliationService = costReconciliationService;
    }

    @GetMapping("/{serviceRequestId}/cost")
    public ResponseEntity<ServiceCostSummaryDTO> getCostSummary(@PathVariable String serviceRequestId) {
        return ResponseEntity.ok(costReconciliationService.summarize(serviceRequestId));
    }
}
