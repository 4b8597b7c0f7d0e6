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

import com.google.common.base.Stopwatch;
import com.phonepe.memoryengine.core.errors.EngineError;
import com.phonepe.memoryengine.core.errors.ErrorType;
import com.phonepe.memoryengine.core.model.Realm;
import com.phonepe.memoryengine.core.utils.EngineUtils;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Resolves memory across the realm hierarchy. Realms are queried concurrently, each with its own timeout. Records
 * describing the same fact in several realms are collapsed to the one from the highest authority realm, and the
 * survivors are ordered by relevance.
 * <p>
 * An executor created here is shut down by {@link #close()}; one passed in belongs to the caller.
 */
@Slf4j
public class HierarchicalMemorySearcher implements AutoCloseable {

    /**
     * Preference among records sharing a semantic key: realm authority first, relevance is only a tie breaker
     * inside one realm.
     */
    static final Comparator<ResolvedMemoryEntry> PRECEDENCE = Comparator
            .comparing(ResolvedMemoryEntry::getRealm, Realm.BY_AUTHORITY)
            .thenComparing(ResolvedMemoryEntry::getRelevance, Comparator.reverseOrder())
            .thenComparing(entry -> Objects.requireNonNullElse(entry.getDepth(), 0))
            .thenComparing(ResolvedMemoryEntry::getEntityId)
            .thenComparing(ResolvedMemoryEntry::getRecordId);

    /**
     * Final ordering of merged entries
     */
    static final Comparator<ResolvedMemoryEntry> RESULT_ORDER = Comparator
            .comparing(ResolvedMemoryEntry::getRelevance, Comparator.reverseOrder())
            .thenComparing(ResolvedMemoryEntry::getRealm, Realm.BY_AUTHORITY)
            .thenComparing(ResolvedMemoryEntry::getSemanticKey);

    private record RealmCall(Realm realm, String entityId, List<MemoryRecord> records, Throwable failure) {
        boolean failed() {
            return failure != null;
        }
    }

    private final MemoryClient memoryClient;
    private final MemorySearchSetup setup;
    @Getter
    private final MemorySearchCache cache;
    private final ExecutorService executorService;
    private final boolean ownsExecutor;

    public HierarchicalMemorySearcher(@NonNull MemoryClient memoryClient, MemorySearchSetup setup) {
        this(memoryClient, setup, null, null);
    }

    public HierarchicalMemorySearcher(
            @NonNull MemoryClient memoryClient,
            MemorySearchSetup setup,
            MemorySearchCache cache,
            ExecutorService executorService) {
        this.memoryClient = memoryClient;
        this.setup = Objects.requireNonNullElse(setup, MemorySearchSetup.DEFAULT);
        this.cache = Objects.requireNonNullElseGet(cache, () -> new MemorySearchCache(this.setup));
        this.ownsExecutor = null == executorService;
        this.executorService = Objects.requireNonNullElseGet(executorService, Executors::newCachedThreadPool);
    }

    public MemorySearchResult search(@NonNull final MemorySearchRequest request) {
        final var cached = cache.get(request);
        if (cached.isPresent()) {
            log.debug("Memory search cache hit for actor {}", request.getIdentity().getActorId());
            return cached.get().withCached(true);
        }
        final var generation = cache.generation(request.getIdentity().getActorId());
        final var stopwatch = Stopwatch.createStarted();
        final var calls = request.getRealms()
                .stream()
                .sorted(Realm.BY_AUTHORITY)
                .flatMap(realm -> request.getIdentity()
                        .entityIds(realm)
                        .stream()
                        .map(entityId -> callRealm(realm, entityId, request)))
                .toList();
        CompletableFuture.allOf(calls.toArray(CompletableFuture[]::new)).join();
        final var outcomes = calls.stream().map(CompletableFuture::join).toList();

        final var searchedRealms = outcomes.stream()
                .map(RealmCall::realm)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(Realm.class)));
        final var unavailableRealms = searchedRealms.stream()
                .filter(realm -> outcomes.stream()
                        .filter(call -> call.realm() == realm)
                        .allMatch(RealmCall::failed))
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(Realm.class)));
        final var entries = merge(outcomes.stream()
                                          .filter(call -> !call.failed())
                                          .flatMap(call -> call.records()
                                                  .stream()
                                                  .map(memoryRecord -> ResolvedMemoryEntry.from(call.realm(),
                                                                                                call.entityId(),
                                                                                                memoryRecord)))
                                          .toList(),
                                  request.getMaxResults());
        final var result = MemorySearchResult.builder()
                .entries(entries)
                .searchedRealms(Set.copyOf(searchedRealms))
                .unavailableRealms(Set.copyOf(unavailableRealms))
                .error(error(searchedRealms, unavailableRealms))
                .elapsedMillis(stopwatch.elapsed(TimeUnit.MILLISECONDS))
                .build();
        final var anyFailure = outcomes.stream().anyMatch(RealmCall::failed);
        if (anyFailure) {
            log.warn("Memory search for actor {} degraded. Unavailable realms: {}",
                     request.getIdentity().getActorId(), unavailableRealms);
        }
        else {
            cache.put(request, generation, result);
        }
        log.debug("Resolved {} memory entries from realms {} in {} ms",
                  entries.size(), searchedRealms, result.getElapsedMillis());
        return result;
    }

    /**
     * Collapse entries sharing a semantic key to the one with the highest precedence, then order and truncate
     */
    static List<ResolvedMemoryEntry> merge(final List<ResolvedMemoryEntry> entries, int maxResults) {
        final var winners = new HashMap<String, ResolvedMemoryEntry>();
        entries.forEach(entry -> winners.merge(entry.getSemanticKey(),
                                               entry,
                                               (existing, candidate) -> PRECEDENCE.compare(candidate, existing) < 0
                                                                        ? candidate
                                                                        : existing));
        return winners.values()
                .stream()
                .sorted(RESULT_ORDER)
                .limit(maxResults)
                .toList();
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executorService.shutdownNow();
        }
    }

    boolean isExecutorShutdown() {
        return executorService.isShutdown();
    }

    private CompletableFuture<RealmCall> callRealm(
            final Realm realm,
            final String entityId,
            final MemorySearchRequest request) {
        final var query = MemoryQuery.builder()
                .realm(realm)
                .entityId(entityId)
                .identity(request.getIdentity())
                .anchorQuery(request.getAnchorQuery())
                .maxResults(request.getMaxResults())
                .maxDepth(request.getMaxDepth())
                .minRelevance(request.getMinRelevance())
                .build();
        return CompletableFuture
                .supplyAsync(() -> memoryClient.search(query), executorService)
                .orTimeout(setup.getRealmTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((records, error) -> {
                    if (error != null) {
                        final var rootCause = EngineUtils.rootCause(error);
                        if (rootCause instanceof TimeoutException) {
                            log.warn("Memory search in realm {} for entity {} timed out after {}",
                                     realm, entityId, setup.getRealmTimeout());
                        }
                        else {
                            log.warn("Memory search in realm {} for entity {} failed. Error: {}",
                                     realm, entityId, rootCause.getMessage());
                        }
                        return new RealmCall(realm, entityId, List.of(), rootCause);
                    }
                    return new RealmCall(realm, entityId, Objects.requireNonNullElseGet(records, List::of), null);
                });
    }

    private static EngineError error(final Set<Realm> searched, final Set<Realm> unavailable) {
        if (unavailable.isEmpty()) {
            return null;
        }
        final var names = unavailable.stream()
                .sorted(Realm.BY_AUTHORITY)
                .map(Realm::name)
                .collect(Collectors.joining(", "));
        return unavailable.containsAll(searched)
               ? EngineError.error(ErrorType.MEMORY_UNAVAILABLE, names)
               : EngineError.error(ErrorType.PARTIAL_MEMORY, names);
    }
}
