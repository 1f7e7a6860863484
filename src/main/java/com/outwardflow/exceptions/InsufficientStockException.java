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

public class InsufficientStockException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final UUID sparePartId;
    private final String storeId;
    private final int requested;
    private final int available;

    public InsufficientStockException(UUID sparePartId, String storeId, int requested, int available) {
        super(String.format("Insufficient stock for part %s at store %s: requested=%d, available=%d",
                sparePartId, storeId, requested, available));
        this.sparePartId = sparePartId;
        this.storeId = storeId;
        this.requested = requested;
        this.available = available;
    }

    public UUID getSparePartId() {
        return sparePartId;
    }

    public String getStoreId() {
        return storeId;
    }

    public int getRequested() {
        return requested;
    }

    public int getAvailable() {
        return available;
    }
}
