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

package com.phonepe.memoryengine.core.store;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.Objects;

/**
 * Expiry and bounds for {@link ContextStore}
 */
@Value
@With
public class ContextStoreSetup {
    public static final Duration DEFAULT_SESSION_TTL = Duration.ofHours(24);
    public static final int DEFAULT_MAX_HISTORY = 100;
    public static final int DEFAULT_MAX_MUTATE_ATTEMPTS = 32;
    public static final ContextStoreSetup DEFAULT = ContextStoreSetup.builder().build();

    /**
     * Inactivity period after which the store drops a session. Refreshed on every write.
     */
    Duration sessionTtl;

    /**
     * Number of most recent messages kept in a session
     */
    int maxHistory;

    /**
     * Compare-and-set attempts made by a single mutate before it gives up with a session conflict
     */
    int maxMutateAttempts;

    @Builder
    @Jacksonized
    public ContextStoreSetup(Duration sessionTtl, int maxHistory, int maxMutateAttempts) {
        this.sessionTtl = Objects.requireNonNullElse(sessionTtl, DEFAULT_SESSION_TTL);
        this.maxHistory = maxHistory <= 0 ? DEFAULT_MAX_HISTORY : maxHistory;
        this.maxMutateAttempts = maxMutateAttempts <= 0 ? DEFAULT_MAX_MUTATE_ATTEMPTS : maxMutateAttempts;
    }
}
