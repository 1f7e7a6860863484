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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Level count from ascending value thresholds: with {@code [1000, 5000]} a request worth
 * up to 1000 needs one level, up to 5000 two, anything more three.
 */
public class ThresholdApprovalLevelPolicy implements ApprovalLevelPolicy {

    private final List<BigDecimal> thresholds;

    public ThresholdApprovalLevelPolicy(List<BigDecimal> thresholds) {
        List<BigDecimal> sorted = new ArrayList<>(thresholds == null ? List.of() : thresholds);
        Collections.sort(sorted);
        this.thresholds = List.copyOf(sorted);
    }

    @Override
    public int requiredLevels(BigDecimal requestValue) {
        BigDecimal value = requestValue == null ? BigDecimal.ZERO : requestValue;
        int levels = 1;
        for (BigDecimal threshold : thresholds) {
            if (value.compareTo(threshold) <= 0) {
                return levels;
            }
            levels++;
        }
        return levels;
    }
}
