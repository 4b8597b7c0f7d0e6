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

import com.google.common.base.Strings;
import com.phonepe.memoryengine.core.model.Realm;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A memory client that keeps everything in process. Useful for tests and local runs.
 * <p>
 * Search matches records sharing at least one word (three characters or longer) with the anchor query and returns
 * them with the relevance they were stored with. Upserted facts are exposed as records too.
 */
@Slf4j
public class InMemoryMemoryClient implements MemoryClient {
    public static final String EVIDENCE_COUNT_METADATA = "evidence_count";
    public static final String SOURCE_MESSAGES_METADATA = "source_message_ids";

    private record Key(Realm realm, String entityId) {
    }

    private final Map<Key, Map<String, MemoryRecord>> records = new ConcurrentHashMap<>();
    private final Map<Key, Map<String, MemoryFact>> facts = new ConcurrentHashMap<>();

    public InMemoryMemoryClient add(final Realm realm, final String entityId, final MemoryRecord memoryRecord) {
        records.computeIfAbsent(new Key(realm, entityId), k -> new ConcurrentHashMap<>())
                .put(memoryRecord.getId(), memoryRecord);
        return this;
    }

    @Override
    public List<MemoryRecord> search(MemoryQuery query) {
        final var key = new Key(query.getRealm(), query.getEntityId());
        final var candidates = new ArrayList<>(records.getOrDefault(key, Map.of()).values());
        facts.getOrDefault(key, Map.of()).values().forEach(fact -> candidates.add(toRecord(fact)));
        final var words = words(query.getAnchorQuery());
        return candidates.stream()
                .filter(memoryRecord -> memoryRecord.getRelevance() >= query.getMinRelevance())
                .filter(memoryRecord -> null == memoryRecord.getDepth()
                        || memoryRecord.getDepth() <= query.getMaxDepth())
                .filter(memoryRecord -> words.isEmpty() || matches(memoryRecord, words))
                .sorted(Comparator.comparing(MemoryRecord::getRelevance, Comparator.reverseOrder())
                                .thenComparing(MemoryRecord::getId))
                .limit(query.getMaxResults())
                .toList();
    }

    @Override
    public synchronized UpsertAck upsert(Realm realm, String entityId, List<MemoryFact> newFacts) {
        final var existing = facts.computeIfAbsent(new Key(realm, entityId), k -> new ConcurrentHashMap<>());
        var created = 0;
        var updated = 0;
        for (final var fact : newFacts) {
            final var old = existing.get(fact.getFactKey());
            if (null == old) {
                existing.put(fact.getFactKey(), fact);
                created++;
            }
            else {
                final var sources = new HashSet<>(old.getSourceMessageIds());
                sources.addAll(fact.getSourceMessageIds());
                existing.put(fact.getFactKey(),
                             fact.withSourceMessageIds(Set.copyOf(sources))
                                     .withConfidence(Math.max(old.getConfidence(), fact.getConfidence())));
                updated++;
            }
        }
        log.debug("Upserted facts for {}/{}: {} created, {} updated", realm, entityId, created, updated);
        return new UpsertAck(created, updated);
    }

    /**
     * Facts stored for an entity, keyed by fact key
     */
    public Map<String, MemoryFact> facts(final Realm realm, final String entityId) {
        return Map.copyOf(facts.getOrDefault(new Key(realm, entityId), Map.of()));
    }

    private static MemoryRecord toRecord(final MemoryFact fact) {
        final var metadata = new HashMap<String, Object>(Objects.requireNonNullElseGet(fact.getMetadata(), Map::of));
        metadata.put(EVIDENCE_COUNT_METADATA, fact.getSourceMessageIds().size());
        metadata.put(SOURCE_MESSAGES_METADATA, fact.getSourceMessageIds().stream().sorted().toList());
        return MemoryRecord.builder()
                .id(fact.getFactKey())
                .entityName(fact.getSubject())
                .entityType(fact.getFactType())
                .content(fact.getContent())
                .relevance(fact.getConfidence())
                .depth(0)
                .metadata(Map.copyOf(metadata))
                .build();
    }

    private static boolean matches(final MemoryRecord memoryRecord, final List<String> words) {
        final var text = String.join(" ",
                                     Strings.nullToEmpty(memoryRecord.getEntityName()),
                                     Strings.nullToEmpty(memoryRecord.getEntityType()),
                                     Strings.nullToEmpty(memoryRecord.getContent()))
                .toLowerCase(Locale.ROOT);
        return words.stream().anyMatch(text::contains);
    }

    private static List<String> words(final String query) {
        return Arrays.stream(Strings.nullToEmpty(query).toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(word -> word.length() >= 3)
                .distinct()
                .toList();
    }
}
