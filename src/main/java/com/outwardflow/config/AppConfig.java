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

import com.outwardflow.services.ApprovalLevelPolicy;
import com.outwardflow.services.ApproverAuthorization;
import com.outwardflow.services.ThresholdApprovalLevelPolicy;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Application-wide beans: time source, approval policy and the approver authorization seam.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(OutwardFlowProperties.class)
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(ApprovalLevelPolicy.class)
    public ApprovalLevelPolicy approvalLevelPolicy(OutwardFlowProperties properties) {
        return new ThresholdApprovalLevelPolicy(properties.getApproval().getLevelThresholds());
    }

    // Permission lookup lives in the identity service; deployments replace this bean.
    @Bean
    @ConditionalOnMissingBean(ApproverAuthorization.class)
    public ApproverAuthorization approverAuthorization() {
        return (approverId, level, requestValue) -> approverId != null && !approverId.isBlank();
    }
}
