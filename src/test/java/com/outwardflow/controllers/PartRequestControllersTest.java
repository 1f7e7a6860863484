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
import com.outwardflow.dto.IssueRequestDTO;
import com.outwardflow.dto.PartRequestResponseDTO;
import com.outwardflow.entity.RequestStatus;
import com.outwardflow.exceptions.ApprovalConflictException;
import com.outwardflow.exceptions.InvalidTransitionException;
import com.outwardflow.exceptions.ReservationExpiredException;
import com.outwardflow.exceptions.ResourceNotFoundException;
import com.outwardflow.services.ApprovalEngineService;
import com.outwardflow.services.IssuanceService;
import com.outwardflow.services.PartRequestService;
import java.time.OffsetDateTime;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * REST surface and error mapping, services mocked.
 */
@WebMvcTest(controllers = {PartRequestControllers.class, ApprovalControllers.class})
class PartRequestControllersTest {

    @Autowired MockMvc mockMvc;

    @MockBean PartRequestService partRequestService;
    @MockBean IssuanceService issuanceService;
    @MockBean ApprovalEngineService approvalEngineService;

    private static final String CREATE_BODY = "{"
            + "\"serviceRequestId\":\"SR-1\","
            + "\"sparePartId\":\"" + UUID.randomUUID() + "\","
            + "\"storeId\":\"STORE-1\","
            + "\"quantity\":2,"
            + "\"priority\":\"HIGH\","
            + "\"estimatedCost\":250.00,"
            + "\"technicianId\":\"tech-1\"}";

    @Test
    @DisplayName("POST /api/outward/requests creates with 201 and forwards the idempotency key")
    void createRequest() throws Exception {
        UUID id = UUID.randomUUID();
        when(partRequestService.createRequest(any(), eq("key-1"))).thenReturn(PartRequestResponseDTO.builder()
                .id(id)
                .status(RequestStatus.PENDING)
                .currentApprovalLevel(1)
                .requestedAt(OffsetDateTime.parse("2026-03-15T10:00:00Z"))
                .build());

        mockMvc.perform(post("/api/outward/requests")
                        .header("Idempotency-Key", "key-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(id.toString()))
                .andExpect(jsonPath("$.status").value("PENDING"));
    }

    @Test
    @DisplayName("non-positive quantity is a VALIDATION error and never reaches the service")
    void invalidQuantity() throws Exception {
        mockMvc.perform(post("/api/outward/requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY.replace("\"quantity\":2", "\"quantity\":0")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION"))
                .andExpect(jsonPath("$.retryable").value(false));

        verifyNoInteractions(partRequestService);
    }

    @Test
    @DisplayName("unknown request is NOT_FOUND")
    void unknownRequest() throws Exception {
        UUID id = UUID.randomUUID();
        when(partRequestService.getRequest(id)).thenThrow(new ResourceNotFoundException("Request not found with ID: " + id));

        mockMvc.perform(get("/api/outward/requests/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("decision conflict maps to a retryable 409 CONFLICT")
    void decisionConflict() throws Exception {
        UUID id = UUID.randomUUID();
        when(approvalEngineService.decide(eq(id), any(ApprovalDecisionRequestDTO.class)))
                .thenThrow(new ApprovalConflictException(id, 1, "a decision was already recorded"));

        mockMvc.perform(post("/api/outward/requests/{id}/decisions", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"level\":1,\"decision\":\"APPROVED\",\"approverId\":\"manager-1\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CONFLICT"))
                .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    @DisplayName("issuing from an expired hold is 410 RESERVATION_EXPIRED")
    void expiredReservation() throws Exception {
        UUID id = UUID.randomUUID();
        when(issuanceService.issue(eq(id), any(IssueRequestDTO.class)))
                .thenThrow(new ReservationExpiredException(UUID.randomUUID(), OffsetDateTime.parse("2026-03-15T10:00:00Z")));

        mockMvc.perform(post("/api/outward/requests/{id}/issue", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"storeId\":\"STORE-1\",\"issuedBy\":\"storekeeper\"}"))
                .andExpect(status().isGone())
                .andExpect(jsonPath("$.code").value("RESERVATION_EXPIRED"));
    }

    @Test
    @DisplayName("issuing a pending request is 422 INVALID_TRANSITION")
    void invalidTransition() throws Exception {
        UUID id = UUID.randomUUID();
        when(issuanceService.issue(eq(id), any(IssueRequestDTO.class)))
                .thenThrow(new InvalidTransitionException(id, RequestStatus.PENDING, "issue"));

        mockMvc.perform(post("/api/outward/requests/{id}/issue", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"storeId\":\"STORE-1\",\"issuedBy\":\"storekeeper\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INVALID_TRANSITION"))
                .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    @DisplayName("unknown decision value is a VALIDATION error")
    void malformedDecision() throws Exception {
        mockMvc.perform(post("/api/outward/requests/{id}/decisions", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"level\":1,\"decision\":\"MAYBE\",\"approverId\":\"manager-1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION"));
    }
}
