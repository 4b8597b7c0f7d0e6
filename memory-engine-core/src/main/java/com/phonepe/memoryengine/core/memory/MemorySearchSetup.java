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

package com.phonepe.memoryengine.core.memory;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.Objects;

/**
 * Timeouts and cache bounds for {@link HierarchicalMemorySearcher}
 */
@Value
@With
public class MemorySearchSetup {
    public static final Duration DEFAULT_REALM_TIMEOUT = Duration.ofSeconds(2);
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(15);
    public static final int DEFAULT_CACHE_MAX_ENTRIES = 1000;
    public static final MemorySearchSetup DEFAULT = MemorySearchSetup.builder().build();

    /**
     * Maximum time to wait for each realm request
     */
    Duration realmTimeout;
    /**
     * How long merged results stay in the cache
     */
    Duration cacheTtl;
    /**
     * Maximum number of cached results. Oldest are evicted first.
     */
    int cacheMaxEntries;

    @Builder
    @Jacksonized
    public MemorySearchSetup(Duration realmTimeout, Duration cacheTtl, int cacheMaxEntries) {
        this.realmTimeout = Objects.requireNonNullElse(realmTimeout, DEFAULT_REALM_TIMEOUT);
        this.cacheTtl = Objects.requireNonNullElse(cacheTtl, DEFAULT_CACHE_TTL);
        this.cacheMaxEntries = cacheMaxEntries <= 0 ? DEFAULT_CACHE_MAX_ENTRIES : cacheMaxEntries;
    }
}
