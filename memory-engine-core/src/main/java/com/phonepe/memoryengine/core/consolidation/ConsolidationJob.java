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

package com.phonepe.memoryengine.core.consolidation;

import com.phonepe.memoryengine.core.model.ChatMessage;
import com.phonepe.memoryengine.core.model.Identity;
import com.phonepe.memoryengine.core.model.LearningProgress;
import com.phonepe.memoryengine.core.model.TaskOutcome;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * A slice of conversation to turn into durable actor memory, with its retry state. Persisted after every change so
 * that its progress can be followed from any engine instance.
 */
@Value
@With
@Builder
@Jacksonized
public class ConsolidationJob {
    @NonNull
    String jobId;
    @NonNull
    String sessionId;
    @NonNull
    Identity identity;
    /**
     * Messages to consolidate, oldest first
     */
    @Builder.Default
    List<ChatMessage> messages = List.of();
    @Builder.Default
    List<TaskOutcome> outcomes = List.of();
    /**
     * Learning progress of the session at submission time, if it was in tutor mode
     */
    LearningProgress learningProgress;
    @NonNull
    ConsolidationTrigger trigger;
    @NonNull
    ConsolidationJobStatus status;
    Instant submittedAt;
    Instant updatedAt;
    int attempts;
    String lastError;
    int factsExtracted;
}
