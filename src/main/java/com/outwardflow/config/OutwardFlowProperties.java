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
package com.outwardflow.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

/**
 * Workflow policy knobs, bound from the {@code outward} block of {@code application.yml}.
 */
@Getter
@Validated
@ConfigurationProperties(prefix = "outward")
public class OutwardFlowProperties {

    @NestedConfigurationProperty
    private final Approval approval = new Approval();

    @NestedConfigurationProperty
    private final Limits limits = new Limits();

    @NestedConfigurationProperty
    private final Reservation reservation = new Reservation();

    @Getter
    @Setter
    public static class Approval {

        /**
         * Ascending request values. A value at or below the n-th threshold needs n levels,
         * anything above the last one needs one level more.
         */
        private List<BigDecimal> levelThresholds = new ArrayList<>(List.of(
                new BigDecimal("1000"), new BigDecimal("5000")));

        // escalation cannot go past this level
        @Min(1)
        private int maxLevel = 5;
    }

    @Getter
    @Setter
    public static class Limits {

        /**
         * Auto-approval threshold for technicians without any applicable limit.
         */
        @NotNull
        private BigDecimal defaultAutoApproveBelow = new BigDecimal("500");

        // day and month windows are computed in this zone
        @NotNull
        private ZoneId zone = ZoneId.of("UTC");
    }

    @Getter
    @Setter
    public static class Reservation {

        // null disables automatic expiry of new holds
        private Duration ttl = Duration.ofHours(24);

        @Min(1000)
        private long sweepIntervalMs = 60_000L;

        private String systemActor = "system";
    }
}
