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

import com.google.common.util.concurrent.Uninterruptibles;
import com.phonepe.memoryengine.core.errors.EngineException;
import com.phonepe.memoryengine.core.errors.ErrorType;
import com.phonepe.memoryengine.core.model.Identity;
import com.phonepe.memoryengine.core.model.Realm;
import com.phonepe.memoryengine.core.utils.TestUtils;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;

import static com.phonepe.memoryengine.core.utils.TestUtils.memoryRecord;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link HierarchicalMemorySearcher}
 */
class HierarchicalMemorySearcherTest {

    private static MemorySearchRequest request(String query) {
        return MemorySearchRequest.builder()
                .anchorQuery(query)
                .identity(TestUtils.identity())
                .build();
    }

    @Test
    void testHigherAuthorityRealmWinsSharedSemanticKey() {
        final var searcher = new HierarchicalMemorySearcher(TestUtils.seededMemoryClient(), null);
        final var result = searcher.search(request("vacation policy"));

        assertFalse(result.isDegraded());
        final var policies = result.getEntries()
                .stream()
                .filter(entry -> entry.getSemanticKey().equals("policy:vacation-policy"))
                .toList();
        assertEquals(1, policies.size());
        assertEquals(Realm.CLIENT, policies.get(0).getRealm());
        assertEquals("c-vacation", policies.get(0).getRecordId());
        assertTrue(result.getEntries().stream().noneMatch(entry -> entry.getRecordId().equals("sk-vacation")));
        assertEquals(EnumSet.allOf(Realm.class), result.getSearchedRealms());
    }

    @Test
    void testResultsOrderedByRelevance() {
        final var searcher = new HierarchicalMemorySearcher(TestUtils.seededMemoryClient(), null);
        final var entries = searcher.search(request("vacation policy")).getEntries();

        assertEquals(List.of("sk-request", "a-pref", "c-vacation", "cl-planning"),
                     entries.stream().map(ResolvedMemoryEntry::getRecordId).toList());
        assertEquals("preference:vacation-month", entries.get(1).getSemanticKey());
    }

    @Test
    void testRepeatedSearchIsIdempotentAndCached() {
        final var searcher = new HierarchicalMemorySearcher(TestUtils.seededMemoryClient(), null);
        final var first = searcher.search(request("Vacation Policy"));
        final var second = searcher.search(request("  vacation policy "));

        assertFalse(first.isCached());
        assertTrue(second.isCached());
        assertEquals(first.getEntries(), second.getEntries());
        assertEquals(1, searcher.getCache().size());
    }

    @Test
    void testSearchRacingMemoryWriteIsNotCached() {
        final var seeded = TestUtils.seededMemoryClient();
        final var client = mock(MemoryClient.class);
        final var searcher = new HierarchicalMemorySearcher(client, null);
        when(client.search(any())).thenAnswer(invocation -> {
            final MemoryQuery query = invocation.getArgument(0);
            if (query.getRealm() == Realm.ACTOR) {
                // consolidation finishes for this actor while the search is in flight
                searcher.getCache().invalidateActor(TestUtils.ACTOR_ID);
            }
            return seeded.search(query);
        });

        final var first = searcher.search(request("vacation policy"));

        assertFalse(first.isDegraded());
        assertEquals(0, searcher.getCache().size());
        assertFalse(searcher.search(request("vacation policy")).isCached());
    }

    @Test
    void testCloseShutsDownOwnExecutorOnly() {
        final var searcher = new HierarchicalMemorySearcher(TestUtils.seededMemoryClient(), null);
        searcher.search(request("vacation policy"));
        searcher.close();
        assertTrue(searcher.isExecutorShutdown());

        final var executor = Executors.newSingleThreadExecutor();
        try {
            final var shared = new HierarchicalMemorySearcher(TestUtils.seededMemoryClient(), null, null, executor);
            shared.close();
            assertFalse(executor.isShutdown());
        }
        finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testAllRealmsTimingOutYieldsUnavailableMemory() {
        final var client = mock(MemoryClient.class);
        when(client.search(any())).thenAnswer(invocation -> {
            Uninterruptibles.sleepUninterruptibly(Duration.ofMillis(500));
            return List.of(memoryRecord("late", "fact", "Late", "too late", 0.9));
        });
        final var searcher = new HierarchicalMemorySearcher(
                client, MemorySearchSetup.builder().realmTimeout(Duration.ofMillis(50)).build());

        final var result = assertDoesNotThrow(() -> searcher.search(request("vacation policy")));

        assertTrue(result.getEntries().isEmpty());
        assertTrue(result.isDegraded());
        assertTrue(result.isMemoryUnavailable());
        assertEquals(ErrorType.MEMORY_UNAVAILABLE, result.getError().getErrorType());
        assertEquals(EnumSet.allOf(Realm.class), result.getUnavailableRealms());
        assertEquals(0, searcher.getCache().size());
    }

    @Test
    void testFailedRealmIsReportedAndOthersStillCount() {
        final var seeded = TestUtils.seededMemoryClient();
        final var client = mock(MemoryClient.class);
        when(client.search(any())).thenAnswer(invocation -> {
            final MemoryQuery query = invocation.getArgument(0);
            if (query.getRealm() == Realm.ACTOR) {
                throw EngineException.of(ErrorType.MEMORY_CLIENT_FAILURE, "actor store down");
            }
            return seeded.search(query);
        });
        final var searcher = new HierarchicalMemorySearcher(client, null);

        final var result = searcher.search(request("vacation policy"));

        assertEquals(ErrorType.PARTIAL_MEMORY, result.getError().getErrorType());
        assertEquals(Set.of(Realm.ACTOR), result.getUnavailableRealms());
        assertFalse(result.isMemoryUnavailable());
        assertEquals(3, result.getEntries().size());
        assertTrue(result.getEntries().stream().noneMatch(entry -> entry.getRealm() == Realm.ACTOR));
        assertEquals(0, searcher.getCache().size());
    }

    @Test
    void testSkillModuleRealmAvailableWhileAnyModuleAnswers() {
        final var seeded = TestUtils.seededMemoryClient();
        final var client = mock(MemoryClient.class);
        when(client.search(any())).thenAnswer(invocation -> {
            final MemoryQuery query = invocation.getArgument(0);
            if ("SK2".equals(query.getEntityId())) {
                throw EngineException.of(ErrorType.MEMORY_CLIENT_FAILURE, "module store down");
            }
            return seeded.search(query);
        });
        final var searcher = new HierarchicalMemorySearcher(client, null);
        final var identity = Identity.builder()
                .clientId(TestUtils.CLIENT_ID)
                .actorId(TestUtils.ACTOR_ID)
                .actorClassId(TestUtils.ACTOR_CLASS_ID)
                .skillModuleIds(List.of(TestUtils.SKILL_MODULE_ID, "SK2"))
                .build();

        final var result = searcher.search(MemorySearchRequest.builder()
                                                   .anchorQuery("vacation")
                                                   .identity(identity)
                                                   .build());

        assertFalse(result.isDegraded());
        assertTrue(result.getUnavailableRealms().isEmpty());
        assertTrue(result.getEntries().stream().anyMatch(entry -> entry.getRealm() == Realm.SKILL_MODULE));
        //A failed call still keeps the result out of the cache
        assertEquals(0, searcher.getCache().size());
    }

    @Test
    void testRealmWithoutEntityIsSkipped() {
        final var searcher = new HierarchicalMemorySearcher(TestUtils.seededMemoryClient(), null);
        final var identity = Identity.builder()
                .clientId(TestUtils.CLIENT_ID)
                .actorId(TestUtils.ACTOR_ID)
                .build();

        final var result = searcher.search(MemorySearchRequest.builder()
                                                   .anchorQuery("vacation policy")
                                                   .identity(identity)
                                                   .build());

        assertFalse(result.isDegraded());
        assertEquals(Set.of(Realm.CLIENT, Realm.ACTOR), result.getSearchedRealms());
    }

    @Test
    void testMergeBreaksTiesInsideRealm() {
        final var deep = ResolvedMemoryEntry.from(Realm.ACTOR_CLASS, "CL1",
                                                  memoryRecord("r1", "guide", "Setup", "deep", 0.8)
                                                          .withDepth(3));
        final var shallow = ResolvedMemoryEntry.from(Realm.ACTOR_CLASS, "CL1",
                                                     memoryRecord("r2", "guide", "Setup", "shallow", 0.8));
        final var better = ResolvedMemoryEntry.from(Realm.ACTOR_CLASS, "CL1",
                                                    memoryRecord("r3", "guide", "setup", "better", 0.9));

        assertEquals(List.of(better), HierarchicalMemorySearcher.merge(List.of(deep, shallow, better), 10));
        assertEquals(List.of(shallow), HierarchicalMemorySearcher.merge(List.of(deep, shallow), 10));
        assertEquals(HierarchicalMemorySearcher.merge(List.of(shallow, deep), 10),
                     HierarchicalMemorySearcher.merge(List.of(deep, shallow), 10));
    }

    @Test
    void testMergeTruncatesToMaxResults() {
        final var entries = List.of(
                ResolvedMemoryEntry.from(Realm.ACTOR, "A1", memoryRecord("1", "fact", "One", "1", 0.9)),
                ResolvedMemoryEntry.from(Realm.ACTOR, "A1", memoryRecord("2", "fact", "Two", "2", 0.8)),
                ResolvedMemoryEntry.from(Realm.ACTOR, "A1", memoryRecord("3", "fact", "Three", "3", 0.7)));

        final var merged = HierarchicalMemorySearcher.merge(entries, 2);

        assertEquals(List.of("1", "2"), merged.stream().map(ResolvedMemoryEntry::getRecordId).toList());
    }
}
