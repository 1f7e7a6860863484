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
package com.outwardflow.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a spare part request. While PENDING the request moves through
 * approval levels; those are tracked by {@link ApprovalHistoryEntry}, not here.
 */
public enum RequestStatus {
    PENDING,
    APPROVED,
    REJECTED,
    ISSUED,
    INSTALLED,
    RETURNED,
    CANCELLED;

    public boolean isTerminal() {
        return this == REJECTED || this == INSTALLED || this == RETURNED || this == CANCELLED;
    }

    public boolean canTransitionTo(RequestStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<RequestStatus> allowedTargets() {
        switch (this) {
            case PENDING:
                return EnumSet.of(APPROVED, REJECTED, CANCELLED);
            case APPROVED:
                return EnumSet.of(ISSUED, CANCELLED);
            case ISSUED:
                return EnumSet.of(INSTALLED, RETURNED, CANCELLED);
            default:
                return EnumSet.noneOf(RequestStatus.class);
        }
    }
}
