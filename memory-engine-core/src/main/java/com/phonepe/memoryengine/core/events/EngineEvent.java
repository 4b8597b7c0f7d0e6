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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AccessLevel;
import lombok.Data;
import lombok.RequiredArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Something that happened inside the engine. Published on the {@link EventBus}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(name = EngineEventType.Values.SESSION_CREATED, value = SessionCreatedEngineEvent.class),
        @JsonSubTypes.Type(name = EngineEventType.Values.SESSION_DELETED, value = SessionDeletedEngineEvent.class),
        @JsonSubTypes.Type(name = EngineEventType.Values.SESSION_EXPIRED, value = SessionExpiredEngineEvent.class),
        @JsonSubTypes.Type(name = EngineEventType.Values.MODE_SWITCHED, value = ModeSwitchedEngineEvent.class),
        @JsonSubTypes.Type(name = EngineEventType.Values.MEMORY_DEGRADED, value = MemoryDegradedEngineEvent.class),
        @JsonSubTypes.Type(name = EngineEventType.Values.CONSOLIDATION_SUCCEEDED, value = ConsolidationSucceededEngineEvent.class),
        @JsonSubTypes.Type(name = EngineEventType.Values.CONSOLIDATION_FAILED, value = ConsolidationFailedEngineEvent.class),
})
@Data
@RequiredArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class EngineEvent {
    private final EngineEventType type;
    private final String eventId = UUID.randomUUID().toString();
    private final String sessionId;
    private final String actorId;
    private final Instant timestamp = Instant.now();

    public abstract <T> T accept(final EngineEventVisitor<T> visitor);
}
