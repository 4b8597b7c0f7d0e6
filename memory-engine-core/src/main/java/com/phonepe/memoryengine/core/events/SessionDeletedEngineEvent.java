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

package com.phonepe.memoryengine.core.events;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A session was deleted by its owner
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class SessionDeletedEngineEvent extends EngineEvent {
    String clientId;
    /**
     * Messages handed to consolidation on deletion
     */
    int unconsolidatedMessages;

    @Builder
    @Jacksonized
    public SessionDeletedEngineEvent(@NonNull String sessionId,
                                     String actorId,
                                     @NonNull String clientId,
                                     int unconsolidatedMessages) {
        super(EngineEventType.SESSION_DELETED, sessionId, actorId);
        this.clientId = clientId;
        this.unconsolidatedMessages = unconsolidatedMessages;
    }

    @Override
    public <T> T accept(EngineEventVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
