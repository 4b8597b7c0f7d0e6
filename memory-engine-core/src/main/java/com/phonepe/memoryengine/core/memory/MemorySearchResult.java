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

import com.phonepe.memoryengine.core.errors.EngineError;
import com.phonepe.memoryengine.core.model.Realm;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.List;
import java.util.Set;

/**
 * Merged, precedence ordered result of a hierarchical search. When some or all realms could not be searched the
 * result carries a {@link com.phonepe.memoryengine.core.errors.ErrorType#PARTIAL_MEMORY} or
 * {@link com.phonepe.memoryengine.core.errors.ErrorType#MEMORY_UNAVAILABLE} error and the caller is expected to
 * degrade instead of failing.
 */
@Value
@With
@Builder
public class MemorySearchResult {
    @Builder.Default
    List<ResolvedMemoryEntry> entries = List.of();
    @Builder.Default
    Set<Realm> searchedRealms = Set.of();
    @Builder.Default
    Set<Realm> unavailableRealms = Set.of();
    EngineError error;
    boolean cached;
    long elapsedMillis;

    public static MemorySearchResult empty() {
        return MemorySearchResult.builder().build();
    }

    public boolean isDegraded() {
        return error != null;
    }

    public boolean isMemoryUnavailable() {
        return !searchedRealms.isEmpty() && unavailableRealms.containsAll(searchedRealms);
    }
}
