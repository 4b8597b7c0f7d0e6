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

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.phonepe.memoryengine.core.model.Identity;
import com.phonepe.memoryengine.core.model.Realm;
import com.phonepe.memoryengine.core.utils.EngineUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Short lived cache of merged search results. Entries expire a fixed time after they are written and can be
 * dropped early for an actor when new memory is written to its realm.
 * <p>
 * Every invalidation moves the actor to a new generation. A search captures the generation before it queries the
 * realms and its result is only stored if no invalidation happened meanwhile, so a search racing a memory write
 * cannot put the pre-write result back.
 */
@Slf4j
public class MemorySearchCache {
    static final int QUERY_PREFIX_LENGTH = 100;

    record CacheKey(
            String queryHash,
            Identity identity,
            List<Realm> realms,
            int maxDepth,
            int maxResults,
            double minRelevance) {
    }

    private final Cache<CacheKey, MemorySearchResult> cache;
    private final Map<String, Long> generations = new ConcurrentHashMap<>();

    public MemorySearchCache(final MemorySearchSetup setup) {
        this(setup, Ticker.systemTicker());
    }

    public MemorySearchCache(final MemorySearchSetup setup, final Ticker ticker) {
        this.cache = CacheBuilder.newBuilder()
                .expireAfterWrite(setup.getCacheTtl())
                .maximumSize(setup.getCacheMaxEntries())
                .ticker(ticker)
                .build();
    }

    static CacheKey key(final MemorySearchRequest request) {
        final var normalized = EngineUtils.truncate(request.getAnchorQuery().trim().toLowerCase(Locale.ROOT),
                                                    QUERY_PREFIX_LENGTH);
        return new CacheKey(EngineUtils.sha256(normalized),
                            request.getIdentity(),
                            request.getRealms().stream().sorted(Realm.BY_AUTHORITY).toList(),
                            request.getMaxDepth(),
                            request.getMaxResults(),
                            request.getMinRelevance());
    }

    public Optional<MemorySearchResult> get(final MemorySearchRequest request) {
        return Optional.ofNullable(cache.getIfPresent(key(request)));
    }

    /**
     * Current generation of an actor's cached results. Capture it before searching and pass it to
     * {@link #put(MemorySearchRequest, long, MemorySearchResult)}.
     */
    public long generation(final String actorId) {
        return generations.getOrDefault(actorId, 0L);
    }

    /**
     * Store a result unless the actor was invalidated after {@code generation} was captured
     *
     * @return true if the result was stored
     */
    public boolean put(final MemorySearchRequest request, long generation, final MemorySearchResult result) {
        final var actorId = request.getIdentity().getActorId();
        final var stored = new boolean[1];
        generations.compute(actorId, (id, current) -> {
            if (Objects.requireNonNullElse(current, 0L) == generation) {
                cache.put(key(request), result);
                stored[0] = true;
            }
            return current;
        });
        if (!stored[0]) {
            log.debug("Not caching memory search for actor {}, its memory changed during the search", actorId);
        }
        return stored[0];
    }

    /**
     * Drop every cached result computed for the given actor
     */
    public void invalidateActor(final String actorId) {
        generations.compute(actorId, (id, current) -> {
            final var removed = cache.asMap()
                    .keySet()
                    .removeIf(key -> key.identity().getActorId().equals(actorId));
            if (removed) {
                log.debug("Invalidated cached memory searches for actor {}", actorId);
            }
            return Objects.requireNonNullElse(current, 0L) + 1;
        });
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.size();
    }
}
