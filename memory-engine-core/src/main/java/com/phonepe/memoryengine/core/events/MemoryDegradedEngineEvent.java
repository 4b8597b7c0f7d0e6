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

import com.phonepe.memoryengine.core.errors.ErrorType;
import com.phonepe.memoryengine.core.model.Realm;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Set;

/**
 * Memory could not be fully resolved for a turn
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class MemoryDegradedEngineEvent extends EngineEvent {
    ErrorType errorType;
    /**
     * Realms that returned nothing usable
     */
    Set<Realm> unavailableRealms;

    @Builder
    @Jacksonized
    public MemoryDegradedEngineEvent(@NonNull String sessionId,
                                     String actorId,
                                     @NonNull ErrorType errorType,
                                     Set<Realm> unavailableRealms) {
        super(EngineEventType.MEMORY_DEGRADED, sessionId, actorId);
        this.errorType = errorType;
        this.unavailableRealms = unavailableRealms;
    }

    @Override
    public <T> T accept(EngineEventVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
