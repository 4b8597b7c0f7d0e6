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
import com.phonepe.memoryengine.core.memory.MemoryFact;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;
import java.util.Set;

/**
 * A fact sent to {@code POST /memory/entities}. The service upserts on {@code fact_key}.
 */
@Value
@Builder
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FactPayload {
    String factKey;
    String factType;
    String subject;
    String content;
    double confidence;
    Set<String> sourceMessageIds;
    String sessionId;
    Map<String, Object> metadata;

    public static FactPayload from(final MemoryFact fact) {
        return FactPayload.builder()
                .factKey(fact.getFactKey())
                .factType(fact.getFactType())
                .subject(fact.getSubject())
                .content(fact.getContent())
                .confidence(fact.getConfidence())
                .sourceMessageIds(fact.getSourceMessageIds())
                .sessionId(fact.getSessionId())
                .metadata(fact.getMetadata())
                .build();
    }
}
