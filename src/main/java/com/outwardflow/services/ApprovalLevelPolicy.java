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

/**
 * Maps a request's value to the number of sequential approval levels it needs.
 */
@FunctionalInterface
public interface ApprovalLevelPolicy {

    /**
     * @return number of levels, always at least 1
     */
    int requiredLevels(BigDecimal requestValue);
}
