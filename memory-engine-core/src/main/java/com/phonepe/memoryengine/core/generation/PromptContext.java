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

package com.phonepe.memoryengine.core.generation;

import com.phonepe.memoryengine.core.memory.ResolvedMemoryEntry;
import com.phonepe.memoryengine.core.model.ChatMessage;
import com.phonepe.memoryengine.core.model.Mode;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * Everything a {@link ResponseGenerator} needs to answer one turn
 */
@Value
@Builder
public class PromptContext {
    @NonNull
    String sessionId;
    @NonNull
    Mode mode;
    /**
     * System level instructions for the model
     */
    @NonNull
    String instructions;
    /**
     * Prompt for this turn with memory context and the user's message rendered in
     */
    @NonNull
    String prompt;
    /**
     * The raw user message for this turn
     */
    @NonNull
    String userMessage;
    /**
     * Prior conversation, oldest first, not including this turn's message
     */
    @Builder.Default
    List<ChatMessage> history = List.of();
    @Builder.Default
    List<ResolvedMemoryEntry> memory = List.of();
    /**
     * Client policies that must shape the answer regardless of anything else
     */
    @Builder.Default
    List<String> policyOverrides = List.of();
    /**
     * Set when memory could not be fully resolved and the answer relies on history and general capability
     */
    boolean degraded;
}
