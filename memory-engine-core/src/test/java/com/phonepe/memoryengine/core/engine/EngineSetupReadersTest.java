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
import com.phonepe.memoryengine.core.errors.ErrorType;
import com.phonepe.memoryengine.core.memory.MemorySearchSetup;
import com.phonepe.memoryengine.core.model.Mode;
import com.phonepe.memoryengine.core.store.ContextStoreSetup;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link EngineSetupReaders}
 */
class EngineSetupReadersTest {

    @Test
    @SneakyThrows
    void testReadsYaml() {
        try (final var stream = getClass().getResourceAsStream("/engine-setup.yml")) {
            final var setup = EngineSetupReaders.fromYaml(stream);

            assertEquals(Mode.TUTOR, setup.getDefaultMode());
            assertEquals(Duration.ofSeconds(1), setup.getMemorySearch().getRealmTimeout());
            assertEquals(Duration.ofMinutes(5), setup.getMemorySearch().getCacheTtl());
            assertEquals(MemorySearchSetup.DEFAULT_CACHE_MAX_ENTRIES, setup.getMemorySearch().getCacheMaxEntries());
            assertEquals(Duration.ofHours(2), setup.getContextStore().getSessionTtl());
            assertEquals(40, setup.getContextStore().getMaxHistory());
            assertEquals(ContextStoreSetup.DEFAULT_MAX_MUTATE_ATTEMPTS, setup.getContextStore().getMaxMutateAttempts());
            assertEquals(Duration.ofSeconds(10), setup.getStreaming().getStallTimeout());
            assertEquals(80, setup.getStreaming().getChunkSize());
            assertEquals(2, setup.getConsolidation().getWorkers());
            assertEquals(6, setup.getConsolidation().getWindow());
            assertEquals(ConsolidationSetup.DEFAULT_QUEUE_CAPACITY, setup.getConsolidation().getQueueCapacity());
            final var retry = setup.getConsolidation().getRetrySetup();
            assertEquals(5, retry.getMaxAttempts());
            assertEquals(Duration.ofSeconds(1), retry.getInitialDelay());
            assertEquals(Set.of(ErrorType.MEMORY_CLIENT_FAILURE), retry.getRetriableErrorTypes());
        }
    }

    @Test
    void testEmptyContentGivesDefaults() {
        assertSame(EngineSetup.DEFAULT, EngineSetupReaders.fromYaml(new byte[0]));
    }

    @Test
    void testMissingSectionsGetDefaults() {
        final var setup = EngineSetupReaders.fromYaml("defaultMode: AGENT\n".getBytes(StandardCharsets.UTF_8));

        assertEquals(Mode.AGENT, setup.getDefaultMode());
        assertEquals(MemorySearchSetup.DEFAULT, setup.getMemorySearch());
        assertEquals(ConsolidationSetup.DEFAULT, setup.getConsolidation());
    }
}
