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

package com.phonepe.memoryengine.core.consolidation;

import com.google.common.util.concurrent.Uninterruptibles;
import com.phonepe.memoryengine.core.errors.EngineException;
import com.phonepe.memoryengine.core.errors.ErrorType;
import com.phonepe.memoryengine.core.events.ConsolidationFailedEngineEvent;
import com.phonepe.memoryengine.core.events.ConsolidationSucceededEngineEvent;
import com.phonepe.memoryengine.core.events.EngineEvent;
import com.phonepe.memoryengine.core.events.EventBus;
import com.phonepe.memoryengine.core.memory.InMemoryMemoryClient;
import com.phonepe.memoryengine.core.memory.MemoryClient;
import com.phonepe.memoryengine.core.memory.MemorySearchCache;
import com.phonepe.memoryengine.core.memory.MemorySearchRequest;
import com.phonepe.memoryengine.core.memory.MemorySearchResult;
import com.phonepe.memoryengine.core.memory.MemorySearchSetup;
import com.phonepe.memoryengine.core.memory.UpsertAck;
import com.phonepe.memoryengine.core.model.ChatMessage;
import com.phonepe.memoryengine.core.model.Realm;
import com.phonepe.memoryengine.core.retry.RetrySetup;
import com.phonepe.memoryengine.core.store.InMemoryKeyValueStore;
import com.phonepe.memoryengine.core.utils.TestUtils;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

import static com.phonepe.memoryengine.core.consolidation.PatternFactExtractorTest.assistant;
import static com.phonepe.memoryengine.core.consolidation.PatternFactExtractorTest.user;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link ConsolidationPipeline}
 */
class ConsolidationPipelineTest {
    private static final RetrySetup FAST_RETRY = RetrySetup.builder()
            .maxAttempts(3)
            .initialDelay(Duration.ofMillis(10))
            .maxDelay(Duration.ofMillis(50))
            .build();

    private static final List<ChatMessage> SLICE = List.of(
            user("m1", "How do I reset my password?"),
            assistant("m2", "Done. Your password reset is complete."));

    private static ConsolidationSetup setup() {
        return ConsolidationSetup.builder().retrySetup(FAST_RETRY).build();
    }

    private static KeyValueConsolidationJobStore jobStore() {
        return new KeyValueConsolidationJobStore(new InMemoryKeyValueStore(), null);
    }

    private static ConsolidationJob awaitTerminal(ConsolidationPipeline pipeline, String jobId) {
        await().atMost(Duration.ofSeconds(10))
                .until(() -> pipeline.job(jobId).map(job -> job.getStatus().isTerminal()).orElse(false));
        return pipeline.job(jobId).orElseThrow();
    }

    private static EventBus recordingBus(List<EngineEvent> events) {
        final var eventBus = new EventBus();
        eventBus.connect(events::add);
        return eventBus;
    }

    @Test
    void testResubmittingSliceUpdatesSameFacts() {
        final var memoryClient = new InMemoryMemoryClient();
        final var events = new CopyOnWriteArrayList<EngineEvent>();
        try (final var pipeline = new ConsolidationPipeline(memoryClient, jobStore(), null,
                                                            recordingBus(events), setup())) {
            final var first = pipeline.submit("s1", TestUtils.identity(), SLICE, List.of(),
                                              ConsolidationTrigger.MESSAGE_WINDOW);
            assertEquals(ConsolidationJobStatus.SUCCEEDED, awaitTerminal(pipeline, first.getJobId()).getStatus());
            final var afterFirst = memoryClient.facts(Realm.ACTOR, TestUtils.ACTOR_ID);

            final var second = pipeline.submit("s1", TestUtils.identity(), SLICE, List.of(),
                                               ConsolidationTrigger.SESSION_DELETED);
            final var done = awaitTerminal(pipeline, second.getJobId());

            assertEquals(ConsolidationJobStatus.SUCCEEDED, done.getStatus());
            assertEquals(1, done.getAttempts());
            assertEquals(1, done.getFactsExtracted());
            final var afterSecond = memoryClient.facts(Realm.ACTOR, TestUtils.ACTOR_ID);
            assertEquals(afterFirst.keySet(), afterSecond.keySet());
            afterSecond.forEach((key, fact) -> assertEquals(afterFirst.get(key).getSourceMessageIds(),
                                                            fact.getSourceMessageIds()));
            await().atMost(Duration.ofSeconds(5))
                    .until(() -> events.stream().filter(ConsolidationSucceededEngineEvent.class::isInstance).count()
                            == 2);
            final var resubmitted = events.stream()
                    .filter(ConsolidationSucceededEngineEvent.class::isInstance)
                    .map(ConsolidationSucceededEngineEvent.class::cast)
                    .filter(event -> event.getJobId().equals(second.getJobId()))
                    .findFirst()
                    .orElseThrow();
            assertEquals(0, resubmitted.getFactsCreated());
            assertEquals(1, resubmitted.getFactsUpdated());
        }
    }

    @Test
    void testTransientFailureIsRetried() {
        final var memoryClient = mock(MemoryClient.class);
        when(memoryClient.upsert(eq(Realm.ACTOR), eq(TestUtils.ACTOR_ID), anyList()))
                .thenThrow(EngineException.of(ErrorType.MEMORY_CLIENT_FAILURE, "connection reset"))
                .thenReturn(new UpsertAck(1, 0));
        try (final var pipeline = new ConsolidationPipeline(memoryClient, jobStore(), null, null, setup())) {
            final var job = pipeline.submit("s1", TestUtils.identity(), SLICE, List.of(),
                                            ConsolidationTrigger.MANUAL);

            final var done = awaitTerminal(pipeline, job.getJobId());

            assertEquals(ConsolidationJobStatus.SUCCEEDED, done.getStatus());
            assertEquals(2, done.getAttempts());
            assertNull(done.getLastError());
            verify(memoryClient, times(2)).upsert(eq(Realm.ACTOR), eq(TestUtils.ACTOR_ID), anyList());
        }
    }

    @Test
    void testExhaustedRetriesFailPermanently() {
        final var memoryClient = mock(MemoryClient.class);
        when(memoryClient.upsert(any(), any(), anyList()))
                .thenThrow(EngineException.of(ErrorType.MEMORY_CLIENT_FAILURE, "store down"));
        final var events = new CopyOnWriteArrayList<EngineEvent>();
        try (final var pipeline = new ConsolidationPipeline(memoryClient, jobStore(), null,
                                                            recordingBus(events), setup())) {
            final var job = pipeline.submit("s1", TestUtils.identity(), SLICE, List.of(),
                                            ConsolidationTrigger.SESSION_EXPIRED);

            final var failed = awaitTerminal(pipeline, job.getJobId());

            assertEquals(ConsolidationJobStatus.FAILED_PERMANENT, failed.getStatus());
            assertEquals(3, failed.getAttempts());
            assertTrue(failed.getLastError().contains("store down"));
            await().atMost(Duration.ofSeconds(5))
                    .until(() -> events.stream().anyMatch(ConsolidationFailedEngineEvent.class::isInstance));
            final var event = events.stream()
                    .filter(ConsolidationFailedEngineEvent.class::isInstance)
                    .map(ConsolidationFailedEngineEvent.class::cast)
                    .findFirst()
                    .orElseThrow();
            assertEquals(job.getJobId(), event.getJobId());
            assertEquals(ConsolidationTrigger.SESSION_EXPIRED, event.getTrigger());
            assertEquals(3, event.getAttempts());
        }
    }

    @Test
    void testRejectedUpsertIsNotRetried() {
        final var memoryClient = mock(MemoryClient.class);
        when(memoryClient.upsert(any(), any(), anyList()))
                .thenThrow(EngineException.of(ErrorType.MEMORY_CLIENT_REJECTED, "bad fact"));
        try (final var pipeline = new ConsolidationPipeline(memoryClient, jobStore(), null, null, setup())) {
            final var job = pipeline.submit("s1", TestUtils.identity(), SLICE, List.of(),
                                            ConsolidationTrigger.MANUAL);

            final var failed = awaitTerminal(pipeline, job.getJobId());

            assertEquals(ConsolidationJobStatus.FAILED_PERMANENT, failed.getStatus());
            assertEquals(1, failed.getAttempts());
        }
    }

    @Test
    void testNothingToRememberStillSucceeds() {
        final var memoryClient = mock(MemoryClient.class);
        try (final var pipeline = new ConsolidationPipeline(memoryClient, jobStore(), null, null, setup())) {
            final var job = pipeline.submit("s1", TestUtils.identity(),
                                            List.of(user("m1", "Hello"), assistant("m2", "Hi there")),
                                            List.of(), ConsolidationTrigger.MANUAL);

            final var done = awaitTerminal(pipeline, job.getJobId());

            assertEquals(ConsolidationJobStatus.SUCCEEDED, done.getStatus());
            assertEquals(0, done.getFactsExtracted());
            verifyNoInteractions(memoryClient);
        }
    }

    @Test
    void testSuccessInvalidatesActorSearches() {
        final var cache = new MemorySearchCache(MemorySearchSetup.DEFAULT);
        final var request = MemorySearchRequest.builder()
                .anchorQuery("password")
                .identity(TestUtils.identity())
                .build();
        cache.put(request, 0L, MemorySearchResult.empty());
        try (final var pipeline = new ConsolidationPipeline(new InMemoryMemoryClient(), jobStore(), cache, null,
                                                            setup())) {
            final var job = pipeline.submit("s1", TestUtils.identity(), SLICE, List.of(),
                                            ConsolidationTrigger.MANUAL);

            assertEquals(ConsolidationJobStatus.SUCCEEDED, awaitTerminal(pipeline, job.getJobId()).getStatus());
            assertTrue(cache.get(request).isEmpty());
        }
    }

    @Test
    void testFullQueueFailsJobImmediately() {
        final var started = new CountDownLatch(1);
        final var release = new CountDownLatch(1);
        final FactExtractor blockingExtractor = job -> {
            started.countDown();
            Uninterruptibles.awaitUninterruptibly(release);
            return List.of();
        };
        final var events = new CopyOnWriteArrayList<EngineEvent>();
        try (final var pipeline = new ConsolidationPipeline(mock(MemoryClient.class),
                                                            jobStore(),
                                                            blockingExtractor,
                                                            null,
                                                            recordingBus(events),
                                                            ConsolidationSetup.builder()
                                                                    .workers(1)
                                                                    .queueCapacity(1)
                                                                    .retrySetup(FAST_RETRY)
                                                                    .build(),
                                                            null)) {
            final var running = pipeline.submit("s1", TestUtils.identity(), SLICE, List.of(),
                                                ConsolidationTrigger.MANUAL);
            Uninterruptibles.awaitUninterruptibly(started);
            final var queued = pipeline.submit("s2", TestUtils.identity(), SLICE, List.of(),
                                               ConsolidationTrigger.MANUAL);
            final var rejected = pipeline.submit("s3", TestUtils.identity(), SLICE, List.of(),
                                                 ConsolidationTrigger.MANUAL);

            assertEquals(ConsolidationJobStatus.FAILED_PERMANENT, rejected.getStatus());
            assertEquals(ConsolidationJobStatus.FAILED_PERMANENT,
                         pipeline.job(rejected.getJobId()).orElseThrow().getStatus());
            release.countDown();
            assertEquals(ConsolidationJobStatus.SUCCEEDED, awaitTerminal(pipeline, running.getJobId()).getStatus());
            assertEquals(ConsolidationJobStatus.SUCCEEDED, awaitTerminal(pipeline, queued.getJobId()).getStatus());
        }
    }
}
