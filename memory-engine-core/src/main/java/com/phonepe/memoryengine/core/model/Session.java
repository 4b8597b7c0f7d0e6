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

package com.phonepe.memoryengine.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.phonepe.memoryengine.core.modes.ModeState;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Durable state of one conversation. Instances are immutable; changes are made by creating a modified copy inside
 * {@link com.phonepe.memoryengine.core.store.ContextStore#mutate}.
 */
@Value
@With
@Builder(toBuilder = true)
@Jacksonized
public class Session {
    @NonNull
    String sessionId;
    @NonNull
    Identity identity;
    @NonNull
    Mode mode;
    @Builder.Default
    List<ChatMessage> messages = List.of();
    @Builder.Default
    List<MemoryContextRef> activeMemoryContext = List.of();
    LearningProgress learningProgress;
    @Builder.Default
    List<TaskOutcome> pendingOutcomes = List.of();
    /**
     * Number of messages ever appended. Unlike {@link #messages} this is never trimmed.
     */
    long messageCount;
    /**
     * Value of {@link #messageCount} at the last consolidation submission
     */
    long consolidatedMessageCount;
    Instant createdAt;
    Instant lastActivity;
    @Builder.Default
    Map<String, String> metadata = Map.of();

    public static Session create(
            final String sessionId,
            final Identity identity,
            final Mode mode,
            final Instant now) {
        final var modeState = ModeState.initial(mode);
        return Session.builder()
                .sessionId(sessionId)
                .identity(identity)
                .mode(mode)
                .learningProgress(modeState.getLearningProgress())
                .createdAt(now)
                .lastActivity(now)
                .build();
    }

    @JsonIgnore
    public ModeState getModeState() {
        return new ModeState(mode, learningProgress, pendingOutcomes);
    }

    public Session withModeState(final ModeState state) {
        return toBuilder()
                .mode(state.getMode())
                .learningProgress(state.getLearningProgress())
                .pendingOutcomes(state.getPendingOutcomes())
                .build();
    }

    public Session appendMessages(final List<ChatMessage> newMessages) {
        final var updated = new ArrayList<>(Objects.requireNonNullElseGet(messages, List::<ChatMessage>of));
        updated.addAll(newMessages);
        return toBuilder()
                .messages(List.copyOf(updated))
                .messageCount(messageCount + newMessages.size())
                .build();
    }

    /**
     * Keep only the most recent {@code maxMessages} history entries
     */
    public Session trimHistory(int maxMessages) {
        if (messages.size() <= maxMessages) {
            return this;
        }
        return withMessages(List.copyOf(messages.subList(messages.size() - maxMessages, messages.size())));
    }

    /**
     * Messages appended since the last consolidation submission that are still in history
     */
    @JsonIgnore
    public List<ChatMessage> getUnconsolidatedMessages() {
        final var pending = (int) Math.min(messages.size(), Math.max(0, messageCount - consolidatedMessageCount));
        return List.copyOf(messages.subList(messages.size() - pending, messages.size()));
    }
}
