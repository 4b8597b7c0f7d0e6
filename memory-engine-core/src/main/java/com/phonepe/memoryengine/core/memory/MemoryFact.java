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
import java.util.Set;

/**
 * A durable fact extracted from a conversation and written to the actor realm
 */
@Value
@With
@Builder
@Jacksonized
public class MemoryFact {
    /**
     * Deterministic key. The same fact extracted twice has the same key.
     */
    @NonNull
    String factKey;
    @NonNull
    String factType;
    @NonNull
    String subject;
    String content;
    double confidence;
    /**
     * Ids of the messages this fact was derived from. Stores merge these as a set.
     */
    @Builder.Default
    Set<String> sourceMessageIds = Set.of();
    String sessionId;
    @Builder.Default
    Map<String, Object> metadata = Map.of();
}
