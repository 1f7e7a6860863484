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

import com.outwardflow.dto.ReleaseReservationRequestDTO;
import com.outwardflow.dto.ReserveStockRequestDTO;
import com.outwardflow.dto.StockReservationDTO;
import com.outwardflow.services.StockReservationService;
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
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 *
 * @author adityamehta
 */
@RestController
@RequestMapping("/api/outward")
@Validated
public class ReservationControllers {

    private final StockReservationService reservationService;

    public ReservationControllers(StockReservationService reservationService) {
        this.reservationService = reservationService;
    }

    @PostMapping("/requests/{id}/reservations")
    public ResponseEntity<StockReservationDTO> reserveStock(@PathVariable UUID id,
                                                            @Valid @RequestBody ReserveStockRequestDTO request) {
        return new ResponseEntity<>(reservationService.reserveForRequest(id, request), HttpStatus.CREATED);
    }

    @GetMapping("/requests/{id}/reservations")
    public ResponseEntity<List<StockReservationDTO>> getReservations(@PathVariable UUID id) {
        return ResponseEntity.ok(reservationService.getReservations(id));
    }

    @PostMapping("/reservations/{id}/release")
    public ResponseEntity<StockReservationDTO> release(@PathVariable UUID id,
                                                      @Valid @RequestBody(required = false) ReleaseReservationRequestDTO request) {
        String reason = request != null && request.getReason() != null ? request.getReason() : "RELEASED";
        return ResponseEntity.ok(reservationService.release(id, reason));
    }
}
