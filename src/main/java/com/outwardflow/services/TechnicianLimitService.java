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

import com.outwardflow.dto.TechnicianLimitRequestDTO;
import com.outwardflow.entity.LimitScope;
import com.outwardflow.entity.TechnicianLimit;
import com.outwardflow.exceptions.InvalidRequestException;
import com.outwardflow.exceptions.ResourceNotFoundException;
import com.outwardflow.repository.TechnicianLimitRepository;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 *
 * @author adityamehta
 */
@Service
@Transactional
@Slf4j
public class TechnicianLimitService {

    private final TechnicianLimitRepository limitRepository;
    private final Clock clock;

    public TechnicianLimitService(TechnicianLimitRepository limitRepository, Clock clock) {
        this.limitRepository = limitRepository;
        this.clock = clock;
    }

    public TechnicianLimit defineLimit(TechnicianLimitRequestDTO request) {
        String targetId = request.getTargetId();
        if (request.getScope() == LimitScope.TOTAL) {
            targetId = null;
        } else if (targetId == null || targetId.isBlank()) {
            throw new InvalidRequestException(request.getScope() + " limits need a targetId");
        } else if (request.getScope() == LimitScope.PART) {
            try {
                targetId = UUID.fromString(targetId).toString();
            } catch (IllegalArgumentException e) {
                throw new InvalidRequestException("PART limit target is not a spare part id: " + targetId);
            }
        }

        TechnicianLimit limit = TechnicianLimit.builder()
                .technicianId(request.getTechnicianId())
                .scope(request.getScope())
                .targetId(targetId)
                .maxQuantityPerRequest(request.getMaxQuantityPerRequest())
                .maxValuePerRequest(request.getMaxValuePerRequest())
                .maxQuantityPerDay(request.getMaxQuantityPerDay())
                .maxValuePerDay(request.getMaxValuePerDay())
                .maxQuantityPerMonth(request.getMaxQuantityPerMonth())
                .maxValuePerMonth(request.getMaxValuePerMonth())
                .requiresApproval(request.isRequiresApproval())
                .autoApproveBelow(request.getAutoApproveBelow())
                .active(true)
                .createdAt(OffsetDateTime.now(clock))
                .build();

        TechnicianLimit saved = limitRepository.save(limit);
        log.info("Defined {} limit {} for technician {}", saved.getScope(), saved.getId(), saved.getTechnicianId());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<TechnicianLimit> getLimits(String technicianId) {
        return limitRepository.findByTechnicianId(technicianId);
    }

    public TechnicianLimit deactivateLimit(UUID limitId) {
        TechnicianLimit limit = limitRepository.findById(limitId)
                .orElseThrow(() -> new ResourceNotFoundException("Limit not found with ID: " + limitId));
        limit.setActive(false);
        log.info("Deactivated limit {} of technician {}", limitId, limit.getTechnicianId());
        return limitRepository.save(limit);
    }
}
