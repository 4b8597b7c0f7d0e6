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

import com.phonepe.memoryengine.core.model.Identity;
import com.phonepe.memoryengine.core.model.Realm;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A hierarchical search across one or more realms
 */
@Value
public class MemorySearchRequest {
    public static final int DEFAULT_MAX_RESULTS = 50;
    public static final int MIN_DEPTH = 1;
    public static final int MAX_DEPTH = 3;
    public static final int DEFAULT_MAX_DEPTH = 2;
    public static final double DEFAULT_MIN_RELEVANCE = 0.7;

    @NonNull
    String anchorQuery;
    @NonNull
    Identity identity;
    /**
     * Realms to search. Defaults to all of them.
     */
    Set<Realm> realms;
    int maxResults;
    /**
     * Relationship traversal depth, clamped to [{@value #MIN_DEPTH}, {@value #MAX_DEPTH}]
     */
    int maxDepth;
    double minRelevance;

    @Builder
    public MemorySearchRequest(
            @NonNull String anchorQuery,
            @NonNull Identity identity,
            Set<Realm> realms,
            int maxResults,
            int maxDepth,
            Double minRelevance) {
        this.anchorQuery = anchorQuery;
        this.identity = identity;
        this.realms = realms == null || realms.isEmpty()
                      ? Set.copyOf(EnumSet.allOf(Realm.class))
                      : Set.copyOf(realms);
        this.maxResults = maxResults <= 0 ? DEFAULT_MAX_RESULTS : maxResults;
        this.maxDepth = maxDepth <= 0
                        ? DEFAULT_MAX_DEPTH
                        : Math.max(MIN_DEPTH, Math.min(MAX_DEPTH, maxDepth));
        this.minRelevance = Objects.requireNonNullElse(minRelevance, DEFAULT_MIN_RELEVANCE);
    }
}
