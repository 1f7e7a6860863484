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

import com.outwardflow.config.OutwardFlowProperties;
import com.outwardflow.dto.LimitCheckRequestDTO;
import com.outwardflow.dto.LimitCheckResult;
import com.outwardflow.entity.LimitCeiling;
import com.outwardflow.entity.LimitOutcome;
import com.outwardflow.entity.RequestStatus;
import com.outwardflow.entity.SparePart;
import com.outwardflow.entity.SparePartRequest;
import com.outwardflow.entity.TechnicianLimit;
import com.outwardflow.repository.SparePartRepository;
import com.outwardflow.repository.SparePartRequestRepository;
import com.outwardflow.repository.TechnicianLimitRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Evaluates a proposed request against the technician's limits. Read only.
 *
 * <p>Limits are checked PART first, then CATEGORY, then TOTAL. Within one limit the
 * per-request ceilings come before the day and month ceilings, quantity before value. The
 * first ceiling crossed decides the result.
 */
@Service
@Transactional(readOnly = true)
@Slf4j
public class LimitCheckerService {

    private static final Set<RequestStatus> COUNTED_STATUSES =
            EnumSet.of(RequestStatus.APPROVED, RequestStatus.ISSUED, RequestStatus.INSTALLED);

    private final TechnicianLimitRepository limitRepository;
    private final SparePartRequestRepository requestRepository;
    private final SparePartRepository sparePartRepository;
    private final OutwardFlowProperties properties;
    private final Clock clock;

    public LimitCheckerService(
            TechnicianLimitRepository limitRepository,
            SparePartRequestRepository requestRepository,
            SparePartRepository sparePartRepository,
            OutwardFlowProperties properties,
            Clock clock) {
        this.limitRepository = limitRepository;
        this.requestRepository = requestRepository;
        this.sparePartRepository = sparePartRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public LimitCheckResult check(LimitCheckRequestDTO request) {
        return check(request.getTechnicianId(), request.getSparePartId(), request.getCategoryId(),
                request.getQuantity(), request.getEstimatedCost());
    }

    public LimitCheckResult check(String technicianId, UUID sparePartId, String categoryId,
                                  int quantity, BigDecimal estimatedCost) {
        String category = categoryId;
        if (category == null && sparePartId != null) {
            category = sparePartRepository.findById(sparePartId).map(SparePart::getCategoryId).orElse(null);
        }

        final String resolvedCategory = category;
        List<TechnicianLimit> applicable = limitRepository.findByTechnicianIdAndActiveTrue(technicianId).stream()
                .filter(limit -> applies(limit, sparePartId, resolvedCategory))
                .sorted(Comparator.comparing(TechnicianLimit::getScope))
                .collect(Collectors.toList());

        if (applicable.isEmpty()) {
            return autoApprovalByDefault(technicianId, estimatedCost);
        }

        ZoneId zone = properties.getLimits().getZone();
        LocalDate today = LocalDate.now(clock.withZone(zone));
        OffsetDateTime dayStart = today.atStartOfDay(zone).toOffsetDateTime();
        OffsetDateTime monthStart = today.withDayOfMonth(1).atStartOfDay(zone).toOffsetDateTime();

        List<SparePartRequest> monthRequests = requestRepository
                .findByRequestedByAndStatusInAndRequestedAtGreaterThanEqual(technicianId, COUNTED_STATUSES, monthStart);

        for (TechnicianLimit limit : applicable) {
            List<SparePartRequest> scoped = monthRequests.stream()
                    .filter(existing -> inScope(limit, existing))
                    .collect(Collectors.toList());
            Usage month = Usage.of(scoped);
            Usage day = Usage.of(scoped.stream()
                    .filter(existing -> !existing.getRequestedAt().isBefore(dayStart))
                    .collect(Collectors.toList()));

            LimitCheckResult violation = firstViolation(limit, quantity, estimatedCost, day, month);
            if (violation != null) {
                log.warn("Technician {} exceeds {} limit {}: {} {} against ceiling {}", technicianId,
                        limit.getScope(), limit.getId(), violation.getViolatedCeiling(),
                        violation.getAttemptedValue(), violation.getCeilingValue());
                return violation;
            }
        }

        boolean approvalForced = applicable.stream().anyMatch(TechnicianLimit::isRequiresApproval);
        List<BigDecimal> thresholds = applicable.stream()
                .map(TechnicianLimit::getAutoApproveBelow)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
        if (thresholds.isEmpty()) {
            thresholds = List.of(properties.getLimits().getDefaultAutoApproveBelow());
        }
        boolean belowAll = thresholds.stream().allMatch(threshold -> estimatedCost.compareTo(threshold) < 0);

        if (!approvalForced && belowAll) {
            return LimitCheckResult.of(LimitOutcome.AUTO_APPROVABLE, "Within limits and below auto-approval threshold");
        }
        return LimitCheckResult.of(LimitOutcome.APPROVAL_REQUIRED,
                approvalForced ? "Limit policy requires approval" : "Value at or above auto-approval threshold");
    }

    private LimitCheckResult autoApprovalByDefault(String technicianId, BigDecimal estimatedCost) {
        BigDecimal threshold = properties.getLimits().getDefaultAutoApproveBelow();
        log.debug("No limits apply to technician {}, default threshold {}", technicianId, threshold);
        if (estimatedCost.compareTo(threshold) < 0) {
            return LimitCheckResult.of(LimitOutcome.AUTO_APPROVABLE, "Below default auto-approval threshold " + threshold);
        }
        return LimitCheckResult.of(LimitOutcome.APPROVAL_REQUIRED, "At or above default auto-approval threshold " + threshold);
    }

    private LimitCheckResult firstViolation(TechnicianLimit limit, int quantity, BigDecimal value, Usage day, Usage month) {
        if (exceeds(quantity, limit.getMaxQuantityPerRequest())) {
            return exceeded(limit, LimitCeiling.QUANTITY_PER_REQUEST,
                    BigDecimal.valueOf(limit.getMaxQuantityPerRequest()), BigDecimal.valueOf(quantity));
        }
        if (exceeds(value, limit.getMaxValuePerRequest())) {
            return exceeded(limit, LimitCeiling.VALUE_PER_REQUEST, limit.getMaxValuePerRequest(), value);
        }
        if (exceeds(day.quantity + quantity, limit.getMaxQuantityPerDay())) {
            return exceeded(limit, LimitCeiling.QUANTITY_PER_DAY,
                    BigDecimal.valueOf(limit.getMaxQuantityPerDay()), BigDecimal.valueOf(day.quantity + quantity));
        }
        if (exceeds(day.value.add(value), limit.getMaxValuePerDay())) {
            return exceeded(limit, LimitCeiling.VALUE_PER_DAY, limit.getMaxValuePerDay(), day.value.add(value));
        }
        if (exceeds(month.quantity + quantity, limit.getMaxQuantityPerMonth())) {
            return exceeded(limit, LimitCeiling.QUANTITY_PER_MONTH,
                    BigDecimal.valueOf(limit.getMaxQuantityPerMonth()), BigDecimal.valueOf(month.quantity + quantity));
        }
        if (exceeds(month.value.add(value), limit.getMaxValuePerMonth())) {
            return exceeded(limit, LimitCeiling.VALUE_PER_MONTH, limit.getMaxValuePerMonth(), month.value.add(value));
        }
        return null;
    }

    private LimitCheckResult exceeded(TechnicianLimit limit, LimitCeiling ceiling, BigDecimal ceilingValue, BigDecimal attempted) {
        return LimitCheckResult.builder()
                .outcome(LimitOutcome.LIMIT_EXCEEDED)
                .violatedScope(limit.getScope())
                .violatedLimitId(limit.getId())
                .violatedCeiling(ceiling)
                .ceilingValue(ceilingValue)
                .attemptedValue(attempted)
                .message(ceiling + " of " + limit.getScope() + " limit exceeded: " + attempted + " > " + ceilingValue)
                .build();
    }

    private static boolean exceeds(long attempted, Integer ceiling) {
        return ceiling != null && attempted > ceiling;
    }

    private static boolean exceeds(BigDecimal attempted, BigDecimal ceiling) {
        return ceiling != null && attempted.compareTo(ceiling) > 0;
    }

    private static boolean applies(TechnicianLimit limit, UUID sparePartId, String categoryId) {
        switch (limit.getScope()) {
            case PART:
                return sparePartId != null && sparePartId.toString().equals(limit.getTargetId());
            case CATEGORY:
                return categoryId != null && categoryId.equals(limit.getTargetId());
            case TOTAL:
                return true;
            default:
                return false;
        }
    }

    private static boolean inScope(TechnicianLimit limit, SparePartRequest existing) {
        switch (limit.getScope()) {
            case PART:
                return existing.getSparePartId().toString().equals(limit.getTargetId());
            case CATEGORY:
                return limit.getTargetId().equals(existing.getCategoryId());
            default:
                return true;
        }
    }

    private static final class Usage {
        private final long quantity;
        private final BigDecimal value;

        private Usage(long quantity, BigDecimal value) {
            this.quantity = quantity;
            this.value = value;
        }

        static Usage of(List<SparePartRequest> requests) {
            long quantity = 0;
            BigDecimal value = BigDecimal.ZERO;
            for (SparePartRequest request : requests) {
                quantity += request.getRequestedQuantity();
                BigDecimal cost = request.effectiveCost();
                if (cost != null) {
                    value = value.add(cost);
                }
            }
            return new Usage(quantity, value);
        }
    }
}
