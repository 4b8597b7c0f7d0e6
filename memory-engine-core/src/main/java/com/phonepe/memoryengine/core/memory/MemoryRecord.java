/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.memoryengine.core.memory;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * A record as returned by the memory store
 */
@Value
@With
@Builder
@Jacksonized
public class MemoryRecord {
    @NonNull
    String id;
    String entityName;
    String entityType;
    String content;
    double relevance;
    /**
     * Hops from the anchor entity at which this record was reached. Null when the store does not report it.
     */
    Integer depth;
    @Builder.Default
    Map<String, Object> metadata = Map.of();
}
