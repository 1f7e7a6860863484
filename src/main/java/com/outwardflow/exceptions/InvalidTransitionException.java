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

import com.outwardflow.entity.RequestStatus;
import java.util.UUID;

/**
 * Operation not permitted from the request's current status.
 */
public class InvalidTransitionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final RequestStatus currentStatus;

    public InvalidTransitionException(UUID requestId, RequestStatus currentStatus, String operation) {
        super(String.format("Cannot %s request %s in status %s", operation, requestId, currentStatus));
        this.currentStatus = currentStatus;
    }

    public RequestStatus getCurrentStatus() {
        return currentStatus;
    }
}
