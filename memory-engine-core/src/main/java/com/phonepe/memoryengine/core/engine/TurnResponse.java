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

package com.phonepe.memoryengine.core.engine;

import com.phonepe.memoryengine.core.errors.EngineError;
import com.phonepe.memoryengine.core.memory.ResolvedMemoryEntry;
import com.phonepe.memoryengine.core.model.LearningProgress;
import com.phonepe.memoryengine.core.model.Mode;
import com.phonepe.memoryengine.core.model.Realm;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Answer to a {@link TurnRequest}
 */
@Value
@Builder
public class TurnResponse {
    String sessionId;
    /**
     * Id of the assistant message in the session history
     */
    String messageId;
    String response;
    Mode mode;
    @Builder.Default
    List<ResolvedMemoryEntry> memoryContext = List.of();
    /**
     * Set when memory could not be fully resolved. The answer then leans on history alone.
     */
    boolean degraded;
    @Builder.Default
    Set<Realm> unavailableRealms = Set.of();
    EngineError memoryError;
    @Builder.Default
    List<String> followUpQuestions = List.of();
    @Builder.Default
    List<String> suggestedTopics = List.of();
    /**
     * Learning progress after the turn, tutor mode only
     */
    LearningProgress learningProgress;
    @Builder.Default
    Map<String, Object> details = Map.of();
    /**
     * Consolidation job submitted because of this turn, if any
     */
    String consolidationJobId;
}
