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
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ThresholdApprovalLevelPolicyTest {

    private final ThresholdApprovalLevelPolicy policy = new ThresholdApprovalLevelPolicy(
            List.of(new BigDecimal("5000"), new BigDecimal("1000")));

    @Test
    @DisplayName("values up to the first threshold need one level")
    void singleLevel() {
        assertThat(policy.requiredLevels(BigDecimal.ZERO)).isEqualTo(1);
        assertThat(policy.requiredLevels(new BigDecimal("1000"))).isEqualTo(1);
    }

    @Test
    @DisplayName("each crossed threshold adds a level")
    void levelsGrowWithValue() {
        assertThat(policy.requiredLevels(new BigDecimal("1000.01"))).isEqualTo(2);
        assertThat(policy.requiredLevels(new BigDecimal("5000"))).isEqualTo(2);
        assertThat(policy.requiredLevels(new BigDecimal("5000.01"))).isEqualTo(3);
    }

    @Test
    @DisplayName("no thresholds means a single level for everything")
    void noThresholds() {
        ThresholdApprovalLevelPolicy flat = new ThresholdApprovalLevelPolicy(List.of());
        assertThat(flat.requiredLevels(new BigDecimal("1000000"))).isEqualTo(1);
        assertThat(flat.requiredLevels(null)).isEqualTo(1);
    }
}
