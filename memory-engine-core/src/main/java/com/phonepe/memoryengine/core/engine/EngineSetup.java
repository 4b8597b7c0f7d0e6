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

import com.phonepe.memoryengine.core.consolidation.ConsolidationSetup;
import com.phonepe.memoryengine.core.memory.MemorySearchSetup;
import com.phonepe.memoryengine.core.model.Mode;
import com.phonepe.memoryengine.core.store.ContextStoreSetup;
import com.phonepe.memoryengine.core.streaming.StreamingSetup;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.Objects;

/**
 * Configuration for {@link ConversationEngine}. Missing sections fall back to their defaults.
 */
@Value
@With
public class EngineSetup {
    public static final Mode DEFAULT_MODE = Mode.AGENT;
    public static final EngineSetup DEFAULT = EngineSetup.builder().build();

    /**
     * Mode for sessions created without one
     */
    Mode defaultMode;
    MemorySearchSetup memorySearch;
    ContextStoreSetup contextStore;
    StreamingSetup streaming;
    ConsolidationSetup consolidation;

    @Builder
    @Jacksonized
    public EngineSetup(
            Mode defaultMode,
            MemorySearchSetup memorySearch,
            ContextStoreSetup contextStore,
            StreamingSetup streaming,
            ConsolidationSetup consolidation) {
        this.defaultMode = Objects.requireNonNullElse(defaultMode, DEFAULT_MODE);
        this.memorySearch = Objects.requireNonNullElse(memorySearch, MemorySearchSetup.DEFAULT);
        this.contextStore = Objects.requireNonNullElse(contextStore, ContextStoreSetup.DEFAULT);
        this.streaming = Objects.requireNonNullElse(streaming, StreamingSetup.DEFAULT);
        this.consolidation = Objects.requireNonNullElse(consolidation, ConsolidationSetup.DEFAULT);
    }
}
