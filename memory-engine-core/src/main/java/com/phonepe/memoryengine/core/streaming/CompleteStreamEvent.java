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

package com.phonepe.memoryengine.core.streaming;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Objects;

/**
 * Completion marker. Last event of every stream.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class CompleteStreamEvent extends StreamEvent {
    StreamOutcome.Status status;
    int chunks;
    List<String> followUpQuestions;
    List<String> suggestedTopics;

    @Builder
    @Jacksonized
    public CompleteStreamEvent(
            @NonNull String sessionId,
            @NonNull StreamOutcome.Status status,
            int chunks,
            List<String> followUpQuestions,
            List<String> suggestedTopics) {
        super(StreamEventType.COMPLETE, sessionId);
        this.status = status;
        this.chunks = chunks;
        this.followUpQuestions = Objects.requireNonNullElseGet(followUpQuestions, List::of);
        this.suggestedTopics = Objects.requireNonNullElseGet(suggestedTopics, List::of);
    }

    @Override
    public <T> T accept(StreamEventVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
