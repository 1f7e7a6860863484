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

import com.outwardflow.dto.ApprovalDecisionRequestDTO;
import com.outwardflow.dto.ApprovalDecisionResponseDTO;
import com.outwardflow.dto.ApprovalHistoryEntryDTO;
import com.outwardflow.services.ApprovalEngineService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/outward")
@Validated
public class ApprovalControllers {

    private final ApprovalEngineService approvalEngineService;

    public ApprovalControllers(ApprovalEngineService approvalEngineService) {
        this.approvalEngineService = approvalEngineService;
    }

    @PostMapping("/requests/{id}/decisions")
    public ResponseEntity<ApprovalDecisionResponseDTO> decide(@PathVariable UUID id,
                                                              @Valid @RequestBody ApprovalDecisionRequestDTO request) {
        return ResponseEntity.ok(approvalEngineService.decide(id, request));
    }

    @GetMapping("/requests/{id}/approval-history")
    public ResponseEntity<List<ApprovalHistoryEntryDTO>> getApprovalHistory(@PathVariable UUID id) {
        return ResponseEntity.ok(approvalEngineService.getApprovalHistory(id));
    }

    @GetMapping("/approvals/pending")
    public ResponseEntity<List<ApprovalHistoryEntryDTO>> getPendingApprovals() {
        return ResponseEntity.ok(approvalEngineService.getPendingApprovals());
    }
}
