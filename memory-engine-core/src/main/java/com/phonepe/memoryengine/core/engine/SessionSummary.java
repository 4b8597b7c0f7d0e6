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

import com.phonepe.memoryengine.core.model.ChatMessage;
import com.phonepe.memoryengine.core.model.LearningProgress;
import com.phonepe.memoryengine.core.model.MemoryContextRef;
import com.phonepe.memoryengine.core.model.Mode;
import com.phonepe.memoryengine.core.model.Session;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of a session
 */
@Value
@Builder
public class SessionSummary {
    String sessionId;
    String clientId;
    String actorId;
    Mode mode;
    List<ChatMessage> messages;
    /**
     * Messages ever exchanged, including ones trimmed from history
     */
    long messageCount;
    List<MemoryContextRef> activeMemoryContext;
    LearningProgress learningProgress;
    int pendingOutcomes;
    Instant createdAt;
    Instant lastActivity;

    public static SessionSummary from(final Session session) {
        return SessionSummary.builder()
                .sessionId(session.getSessionId())
                .clientId(session.getIdentity().getClientId())
                .actorId(session.getIdentity().getActorId())
                .mode(session.getMode())
                .messages(session.getMessages())
                .messageCount(session.getMessageCount())
                .activeMemoryContext(session.getActiveMemoryContext())
                .learningProgress(session.getLearningProgress())
                .pendingOutcomes(session.getPendingOutcomes().size())
                .createdAt(session.getCreatedAt())
                .lastActivity(session.getLastActivity())
                .build();
    }
}
