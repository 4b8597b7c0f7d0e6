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

import com.phonepe.memoryengine.core.model.Mode;
import com.phonepe.memoryengine.core.model.Realm;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * First event of a stream. Describes how the turn is being answered.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class MetadataStreamEvent extends StreamEvent {
    Mode mode;
    int memoryEntries;
    boolean degraded;
    Set<Realm> unavailableRealms;
    Map<String, Object> details;

    @Builder
    @Jacksonized
    public MetadataStreamEvent(
            @NonNull String sessionId,
            @NonNull Mode mode,
            int memoryEntries,
            boolean degraded,
            Set<Realm> unavailableRealms,
            Map<String, Object> details) {
        super(StreamEventType.METADATA, sessionId);
        this.mode = mode;
        this.memoryEntries = memoryEntries;
        this.degraded = degraded;
        this.unavailableRealms = Objects.requireNonNullElseGet(unavailableRealms, Set::of);
        this.details = Objects.requireNonNullElseGet(details, Map::of);
    }

    @Override
    public <T> T accept(StreamEventVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
