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

import com.phonepe.memoryengine.core.model.MemoryContextRef;
import com.phonepe.memoryengine.core.model.Realm;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * A memory entry after realm resolution, tagged with the realm it came from
 */
@Value
@Builder
@Jacksonized
public class ResolvedMemoryEntry {
    @NonNull
    String semanticKey;
    @NonNull
    Realm realm;
    @NonNull
    String entityId;
    @NonNull
    String recordId;
    String entityName;
    String entityType;
    String content;
    double relevance;
    Integer depth;
    @Builder.Default
    Map<String, Object> metadata = Map.of();

    public static ResolvedMemoryEntry from(final Realm realm, final String entityId, final MemoryRecord memoryRecord) {
        return ResolvedMemoryEntry.builder()
                .semanticKey(SemanticKeys.of(memoryRecord))
                .realm(realm)
                .entityId(entityId)
                .recordId(memoryRecord.getId())
                .entityName(memoryRecord.getEntityName())
                .entityType(memoryRecord.getEntityType())
                .content(memoryRecord.getContent())
                .relevance(memoryRecord.getRelevance())
                .depth(memoryRecord.getDepth())
                .metadata(memoryRecord.getMetadata() == null ? Map.of() : memoryRecord.getMetadata())
                .build();
    }

    public MemoryContextRef toRef() {
        return new MemoryContextRef(semanticKey, realm, entityId);
    }

    public String displayName() {
        return entityName == null || entityName.isBlank() ? semanticKey : entityName;
    }
}
