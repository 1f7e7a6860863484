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
package com.outwardflow.dto;

import com.outwardflow.entity.LimitCeiling;
import com.outwardflow.entity.LimitOutcome;
import com.outwardflow.entity.LimitScope;
import java.math.BigDecimal;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a limit check. The violation fields are only set for {@code LIMIT_EXCEEDED}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LimitCheckResult {
    private LimitOutcome outcome;
    private LimitScope violatedScope;
    private UUID violatedLimitId;
    private LimitCeiling violatedCeiling;
    private BigDecimal ceilingValue;
    private BigDecimal attemptedValue;
    private String message;

    public static LimitCheckResult of(LimitOutcome outcome, String message) {
        return LimitCheckResult.builder().outcome(outcome).message(message).build();
    }
}
