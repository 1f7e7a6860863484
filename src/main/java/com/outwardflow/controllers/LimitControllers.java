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

import com.outwardflow.dto.LimitCheckRequestDTO;
import com.outwardflow.dto.LimitCheckResult;
import com.outwardflow.dto.TechnicianLimitRequestDTO;
import com.outwardflow.entity.TechnicianLimit;
import com.outwardflow.services.LimitCheckerService;
import com.outwardflow.services.TechnicianLimitService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/outward/limits")
@Validated
public class LimitControllers {

    private final LimitCheckerService limitCheckerService;
    private final TechnicianLimitService technicianLimitService;

    public LimitControllers(LimitCheckerService limitCheckerService, TechnicianLimitService technicianLimitService) {
        this.limitCheckerService = limitCheckerService;
        this.technicianLimitService = technicianLimitService;
    }

    @PostMapping("/check")
    public ResponseEntity<LimitCheckResult> checkLimits(@Valid @RequestBody LimitCheckRequestDTO request) {
        return ResponseEntity.ok(limitCheckerService.check(request));
    }

    @PostMapping
    public ResponseEntity<TechnicianLimit> defineLimit(@Valid @RequestBody TechnicianLimitRequestDTO request) {
        return new ResponseEntity<>(technicianLimitService.defineLimit(request), HttpStatus.CREATED);
    }

    @GetMapping
    public List<TechnicianLimit> getLimits(@RequestParam String technicianId) {
        return technicianLimitService.getLimits(technicianId);
    }

    @DeleteMapping("/{id}")
    public TechnicianLimit deactivateLimit(@PathVariable UUID id) {
        return technicianLimitService.deactivateLimit(id);
    }
}
