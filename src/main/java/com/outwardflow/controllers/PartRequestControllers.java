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

import com.outwardflow.dto.CancelRequestDTO;
import com.outwardflow.dto.CreatePartRequestDTO;
import com.outwardflow.dto.InstallationRequestDTO;
import com.outwardflow.dto.InstalledPartDTO;
import com.outwardflow.dto.IssueRequestDTO;
import com.outwardflow.dto.PartRequestResponseDTO;
import com.outwardflow.dto.ReturnPartsRequestDTO;
import com.outwardflow.entity.RequestStatus;
import com.outwardflow.services.IssuanceService;
import com.outwardflow.services.PartRequestService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 *
 * @author adityamehta
 */
@RestController
@RequestMapping("/api/outward/requests")
@Validated
public class PartRequestControllers {

    private final PartRequestService partRequestService;
    private final IssuanceService issuanceService;

    public PartRequestControllers(PartRequestService partRequestService, IssuanceService issuanceService) {
        this.partRequestService = partRequestService;
        this.issuanceService = issuanceService;
    }

    @PostMapping
    public ResponseEntity<PartRequestResponseDTO> createRequest(
            @Valid @RequestBody CreatePartRequestDTO request,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {
        PartRequestResponseDTO created = partRequestService.createRequest(request, idempotencyKey);
        return new ResponseEntity<>(created, HttpStatus.CREATED);
    }

    @GetMapping("/{id}")
    public ResponseEntity<PartRequestResponseDTO> getRequest(@PathVariable UUID id) {
        return ResponseEntity.ok(partRequestService.getRequest(id));
    }

    @GetMapping
    public ResponseEntity<List<PartRequestResponseDTO>> listRequests(
            @RequestParam(required = false) RequestStatus status,
            @RequestParam(required = false) String technicianId,
            @RequestParam(required = false) String serviceRequestId) {
        return ResponseEntity.ok(partRequestService.listRequests(status, technicianId, serviceRequestId));
    }

    @PostMapping("/{id}/issue")
    public ResponseEntity<PartRequestResponseDTO> issue(@PathVariable UUID id, @Valid @RequestBody IssueRequestDTO request) {
        return ResponseEntity.ok(issuanceService.issue(id, request));
    }

    @PostMapping("/{id}/install")
    public ResponseEntity<InstalledPartDTO> install(@PathVariable UUID id, @Valid @RequestBody InstallationRequestDTO request) {
        return ResponseEntity.ok(issuanceService.install(id, request));
    }

    @GetMapping("/{id}/installation")
    public ResponseEntity<InstalledPartDTO> getInstallation(@PathVariable UUID id) {
        return ResponseEntity.ok(issuanceService.getInstallation(id));
    }

    @PostMapping("/{id}/return")
    public ResponseEntity<PartRequestResponseDTO> returnParts(@PathVariable UUID id, @Valid @RequestBody ReturnPartsRequestDTO request) {
        return ResponseEntity.ok(issuanceService.returnParts(id, request));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<PartRequestResponseDTO> cancel(@PathVariable UUID id, @Valid @RequestBody CancelRequestDTO request) {
        return ResponseEntity.ok(partRequestService.cancelRequest(id, request));
    }
}
