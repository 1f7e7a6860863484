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

public enum LimitCeiling {
    QUANTITY_PER_REQUEST,
    VALUE_PER_REQUEST,
    QUANTITY_PER_DAY,
    VALUE_PER_DAY,
    QUANTITY_PER_MONTH,
    VALUE_PER_MONTH
}
