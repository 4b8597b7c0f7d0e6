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

package com.phonepe.memoryengine.memoryclient;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.phonepe.memoryengine.core.memory.MemoryRecord;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;
import java.util.Objects;

/**
 * An entity as returned by the memory service search
 */
@Value
@Builder
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MemoryEntityPayload {
    String id;
    String entityName;
    String entityType;
    String content;
    double confidence;
    Integer depth;
    Map<String, Object> metadata;

    public MemoryRecord toRecord() {
        return MemoryRecord.builder()
                .id(id)
                .entityName(entityName)
                .entityType(entityType)
                .content(content)
                .relevance(confidence)
                .depth(depth)
                .metadata(Objects.requireNonNullElseGet(metadata, Map::<String, Object>of))
                .build();
    }
}
