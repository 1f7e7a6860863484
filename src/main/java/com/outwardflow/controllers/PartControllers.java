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

import com.outwardflow.dto.SparePartRequestDTO;
import com.outwardflow.dto.StockAvailabilityDTO;
import com.outwardflow.dto.StockReceiptRequestDTO;
import com.outwardflow.entity.SparePart;
import com.outwardflow.services.StockLevelService;
import jakarta.validation.Valid;
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
@RequestMapping("/api/parts")
@Validated
public class PartControllers {

    private final StockLevelService stockLevelService;

    public PartControllers(StockLevelService stockLevelService) {
        this.stockLevelService = stockLevelService;
    }

    @PostMapping
    public ResponseEntity<SparePart> registerPart(@Valid @RequestBody SparePartRequestDTO request) {
        return new ResponseEntity<>(stockLevelService.registerPart(request), HttpStatus.CREATED);
    }

    @GetMapping("{id}")
    public SparePart getPart(@PathVariable UUID id) {
        return stockLevelService.getPart(id);
    }

    @PostMapping("{id}/stock")
    public ResponseEntity<StockAvailabilityDTO> receiveStock(@PathVariable UUID id,
                                                             @Valid @RequestBody StockReceiptRequestDTO request) {
        return ResponseEntity.ok(stockLevelService.receiveStock(id, request));
    }

    @GetMapping("{id}/stock/{storeId}")
    public ResponseEntity<StockAvailabilityDTO> getAvailability(@PathVariable UUID id, @PathVariable String storeId) {
        return ResponseEntity.ok(stockLevelService.getAvailability(id, storeId));
    }
}
