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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AccessLevel;
import lombok.Data;
import lombok.RequiredArgsConstructor;

import java.time.Instant;

/**
 * An event delivered to the consumer of a {@link ResponseStream}. Every stream ends with exactly one
 * {@link CompleteStreamEvent}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(name = StreamEventType.Values.METADATA, value = MetadataStreamEvent.class),
        @JsonSubTypes.Type(name = StreamEventType.Values.STATUS, value = StatusStreamEvent.class),
        @JsonSubTypes.Type(name = StreamEventType.Values.CHUNK, value = ChunkStreamEvent.class),
        @JsonSubTypes.Type(name = StreamEventType.Values.ERROR, value = ErrorStreamEvent.class),
        @JsonSubTypes.Type(name = StreamEventType.Values.COMPLETE, value = CompleteStreamEvent.class),
})
@Data
@RequiredArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class StreamEvent {
    private final StreamEventType type;
    private final String sessionId;
    private final Instant timestamp = Instant.now();

    public abstract <T> T accept(final StreamEventVisitor<T> visitor);
}
