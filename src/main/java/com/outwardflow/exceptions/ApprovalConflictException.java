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
package com.outwardflow.exceptions;

import java.util.UUID;

/**
 * The decision targeted an approval entry that is no longer awaiting a decision.
 */
public class ApprovalConflictException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final UUID requestId;
    private final int level;

    public ApprovalConflictException(UUID requestId, int level, String detail) {
        super(String.format("Approval level %d of request %s is not open for decision: %s",
                level, requestId, detail));
        this.requestId = requestId;
        this.level = level;
    }

    public UUID getRequestId() {
        return requestId;
    }

    public int getLevel() {
        return level;
    }
}
