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

package com.phonepe.memoryengine.core.modes;

import com.phonepe.memoryengine.core.generation.PromptContext;
import com.phonepe.memoryengine.core.memory.MemorySearchResult;
import com.phonepe.memoryengine.core.model.Mode;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * What a mode processor decided to do for a turn: either ask the generator using {@link #promptContext}, or
 * answer with {@link #fixedResponse} without involving the generator at all.
 */
@Value
@Builder
public class TurnPlan {
    @NonNull
    String sessionId;
    @NonNull
    Mode mode;
    @NonNull
    String userMessage;
    PromptContext promptContext;
    String fixedResponse;
    @Builder.Default
    MemorySearchResult memory = MemorySearchResult.empty();
    @Builder.Default
    List<String> followUpQuestions = List.of();
    @Builder.Default
    List<String> suggestedTopics = List.of();
    /**
     * State machine events to apply when the turn is persisted, regardless of how generation went
     */
    @Builder.Default
    List<ModeEvent> events = List.of();
    /**
     * Mode specific details about the turn, reported back to the caller
     */
    @Builder.Default
    Map<String, Object> details = Map.of();

    public boolean requiresGeneration() {
        return null == fixedResponse;
    }
}
