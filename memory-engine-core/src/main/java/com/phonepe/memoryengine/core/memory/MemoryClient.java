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

import com.phonepe.memoryengine.core.model.Realm;

import java.util.List;

/**
 * Request/response interface to the external long term memory store. Implementations are expected to be
 * thread-safe; the searcher calls {@link #search(MemoryQuery)} concurrently for different realms.
 */
public interface MemoryClient {

    /**
     * Search one realm entity for memory relevant to the anchor query.
     *
     * @param query Realm, entity id, anchor query and result bounds
     * @return Matching records, most relevant first. Never null.
     * @throws com.phonepe.memoryengine.core.errors.EngineException on failure. Failures with a retryable error type
     *                                                             are considered transient.
     */
    List<MemoryRecord> search(MemoryQuery query);

    /**
     * Insert or update facts for an entity. Facts are keyed by {@link MemoryFact#getFactKey()}, so resubmitting a
     * fact updates the stored one instead of adding a duplicate.
     *
     * @param realm    Realm to write to. The engine only ever writes to {@link Realm#ACTOR}.
     * @param entityId Entity owning the facts
     * @param facts    Facts to write
     * @return Count of created and updated facts
     */
    UpsertAck upsert(Realm realm, String entityId, List<MemoryFact> facts);
}
