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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.phonepe.memoryengine.core.errors.EngineError;
import com.phonepe.memoryengine.core.errors.EngineException;
import com.phonepe.memoryengine.core.errors.ErrorType;
import com.phonepe.memoryengine.core.events.ConsolidationFailedEngineEvent;
import com.phonepe.memoryengine.core.events.ConsolidationSucceededEngineEvent;
import com.phonepe.memoryengine.core.events.EventBus;
import com.phonepe.memoryengine.core.memory.MemoryClient;
import com.phonepe.memoryengine.core.memory.MemorySearchCache;
import com.phonepe.memoryengine.core.memory.UpsertAck;
import com.phonepe.memoryengine.core.model.ChatMessage;
import com.phonepe.memoryengine.core.model.Identity;
import com.phonepe.memoryengine.core.model.LearningProgress;
import com.phonepe.memoryengine.core.model.Realm;
import com.phonepe.memoryengine.core.model.TaskOutcome;
import com.phonepe.memoryengine.core.retry.RetryPolicies;
import dev.failsafe.Failsafe;
import dev.failsafe.RetryPolicy;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

import static com.phonepe.memoryengine.core.utils.EngineUtils.engineException;
import static com.phonepe.memoryengine.core.utils.EngineUtils.rootCause;

/**
 * Writes what was learnt in conversations back to the actor realm, off the request path.
 * <p>
 * Every submission becomes a {@link ConsolidationJob} that is persisted before it is queued and again after every
 * state change. Jobs run on a bounded worker pool. Facts are upserted with deterministic keys, so a slice that is
 * submitted twice updates the same facts instead of adding new ones. Retryable failures are retried with exponential
 * backoff; a job that runs out of attempts ends up {@link ConsolidationJobStatus#FAILED_PERMANENT}, is logged with
 * its full context and is published as a {@link ConsolidationFailedEngineEvent}.
 */
@Slf4j
public class ConsolidationPipeline implements AutoCloseable {
    private final MemoryClient memoryClient;
    private final ConsolidationJobStore jobStore;
    private final FactExtractor factExtractor;
    private final MemorySearchCache searchCache;
    private final EventBus eventBus;
    private final ConsolidationSetup setup;
    private final Clock clock;
    private final ThreadPoolExecutor workers;

    public ConsolidationPipeline(
            @NonNull MemoryClient memoryClient,
            @NonNull ConsolidationJobStore jobStore,
            MemorySearchCache searchCache,
            EventBus eventBus,
            ConsolidationSetup setup) {
        this(memoryClient, jobStore, null, searchCache, eventBus, setup, null);
    }

    public ConsolidationPipeline(
            @NonNull MemoryClient memoryClient,
            @NonNull ConsolidationJobStore jobStore,
            FactExtractor factExtractor,
            MemorySearchCache searchCache,
            EventBus eventBus,
            ConsolidationSetup setup,
            Clock clock) {
        this.memoryClient = memoryClient;
        this.jobStore = jobStore;
        this.setup = Objects.requireNonNullElse(setup, ConsolidationSetup.DEFAULT);
        this.factExtractor = Objects.requireNonNullElseGet(
                factExtractor, () -> new PatternFactExtractor(this.setup.getSuccessThreshold()));
        this.searchCache = searchCache;
        this.eventBus = Objects.requireNonNullElseGet(eventBus, EventBus::new);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        this.workers = new ThreadPoolExecutor(this.setup.getWorkers(),
                                              this.setup.getWorkers(),
                                              0L,
                                              TimeUnit.MILLISECONDS,
                                              new ArrayBlockingQueue<>(this.setup.getQueueCapacity()),
                                              new ThreadFactoryBuilder()
                                                      .setNameFormat("consolidation-%d")
                                                      .setDaemon(true)
                                                      .build());
    }

    public ConsolidationJob submit(
            @NonNull String sessionId,
            @NonNull Identity identity,
            List<ChatMessage> messages,
            List<TaskOutcome> outcomes,
            @NonNull ConsolidationTrigger trigger) {
        return submit(sessionId, identity, messages, outcomes, null, trigger);
    }

    /**
     * Queue a conversation slice for consolidation. Returns as soon as the job is recorded.
     *
     * @param learningProgress Learning progress at the time of submission, null outside tutor mode
     * @return The job as recorded. Its id can be used to follow progress through {@link #job(String)}.
     */
    public ConsolidationJob submit(
            @NonNull String sessionId,
            @NonNull Identity identity,
            List<ChatMessage> messages,
            List<TaskOutcome> outcomes,
            LearningProgress learningProgress,
            @NonNull ConsolidationTrigger trigger) {
        final var now = clock.instant();
        final var job = ConsolidationJob.builder()
                .jobId(UUID.randomUUID().toString())
                .sessionId(sessionId)
                .identity(identity)
                .messages(List.copyOf(Objects.requireNonNullElseGet(messages, List::<ChatMessage>of)))
                .outcomes(List.copyOf(Objects.requireNonNullElseGet(outcomes, List::<TaskOutcome>of)))
                .learningProgress(learningProgress)
                .trigger(trigger)
                .status(ConsolidationJobStatus.PENDING)
                .submittedAt(now)
                .updatedAt(now)
                .build();
        jobStore.save(job);
        log.info("Consolidation job {} submitted for session {} actor {} ({}): {} messages, {} outcomes",
                 job.getJobId(), sessionId, identity.getActorId(), trigger,
                 job.getMessages().size(), job.getOutcomes().size());
        try {
            workers.execute(() -> run(job));
        }
        catch (RejectedExecutionException e) {
            return failPermanently(job, EngineError.error(ErrorType.CONSOLIDATION_FAILED_PERMANENT,
                                                          job.getJobId(), 0, "worker queue is full"));
        }
        return job;
    }

    public Optional<ConsolidationJob> job(@NonNull String jobId) {
        return jobStore.get(jobId);
    }

    /**
     * Stop accepting jobs and wait for queued and running ones to finish
     */
    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(setup.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Consolidation workers did not finish within {}. {} jobs still queued",
                         setup.getShutdownTimeout(), workers.getQueue().size());
                workers.shutdownNow();
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private void run(final ConsolidationJob submitted) {
        final var current = new AtomicReference<>(submitted);
        final RetryPolicy<UpsertAck> retryPolicy = RetryPolicies.<UpsertAck>exponentialBuilder(setup.getRetrySetup())
                .onFailedAttempt(event -> {
                    final var error = event.getLastException();
                    log.warn("Consolidation job {} attempt {} failed: {}",
                             submitted.getJobId(), event.getAttemptCount(), rootCause(error).getMessage());
                    update(current, job -> job.withLastError(rootCause(error).getMessage()));
                })
                .build();
        try {
            final var ack = Failsafe.with(retryPolicy)
                    .get(() -> attempt(current));
            final var done = update(current, job -> job.withStatus(ConsolidationJobStatus.SUCCEEDED)
                    .withLastError(null));
            if (null != searchCache) {
                searchCache.invalidateActor(done.getIdentity().getActorId());
            }
            log.info("Consolidation job {} for session {} succeeded after {} attempts. {} facts: {} created, {} "
                             + "updated",
                     done.getJobId(), done.getSessionId(), done.getAttempts(), done.getFactsExtracted(),
                     ack.created(), ack.updated());
            eventBus.notify(ConsolidationSucceededEngineEvent.builder()
                                    .sessionId(done.getSessionId())
                                    .actorId(done.getIdentity().getActorId())
                                    .jobId(done.getJobId())
                                    .trigger(done.getTrigger())
                                    .attempts(done.getAttempts())
                                    .factsExtracted(done.getFactsExtracted())
                                    .factsCreated(ack.created())
                                    .factsUpdated(ack.updated())
                                    .build());
        }
        catch (Exception e) {
            final var job = current.get();
            final var cause = engineException(e)
                    .map(EngineException::getError)
                    .orElseGet(() -> EngineError.error(ErrorType.MEMORY_CLIENT_FAILURE, e));
            failPermanently(job, EngineError.error(ErrorType.CONSOLIDATION_FAILED_PERMANENT,
                                                   job.getJobId(), job.getAttempts(), cause.getMessage()));
        }
    }

    private UpsertAck attempt(final AtomicReference<ConsolidationJob> current) {
        final var job = update(current, j -> j.withStatus(ConsolidationJobStatus.RUNNING)
                .withAttempts(j.getAttempts() + 1));
        final var facts = factExtractor.extract(job);
        update(current, j -> j.withFactsExtracted(facts.size()));
        if (facts.isEmpty()) {
            log.debug("Nothing worth remembering in job {}", job.getJobId());
            return new UpsertAck(0, 0);
        }
        return memoryClient.upsert(Realm.ACTOR, job.getIdentity().getActorId(), facts);
    }

    private ConsolidationJob failPermanently(final ConsolidationJob job, final EngineError error) {
        final var failed = job.withStatus(ConsolidationJobStatus.FAILED_PERMANENT)
                .withLastError(error.getMessage())
                .withUpdatedAt(clock.instant());
        saveQuietly(failed);
        final var messageIds = failed.getMessages().stream().map(ChatMessage::getMessageId).toList();
        log.error("Consolidation job {} FAILED PERMANENTLY. Session: {} Client: {} Actor: {} Trigger: {} "
                          + "Attempts: {} Messages: {} Outcomes: {} Error: {}",
                  failed.getJobId(), failed.getSessionId(), failed.getIdentity().getClientId(),
                  failed.getIdentity().getActorId(), failed.getTrigger(), failed.getAttempts(), messageIds,
                  failed.getOutcomes().size(), error.getMessage());
        eventBus.notify(ConsolidationFailedEngineEvent.builder()
                                .sessionId(failed.getSessionId())
                                .actorId(failed.getIdentity().getActorId())
                                .jobId(failed.getJobId())
                                .trigger(failed.getTrigger())
                                .attempts(failed.getAttempts())
                                .errorType(ErrorType.CONSOLIDATION_FAILED_PERMANENT)
                                .errorMessage(error.getMessage())
                                .build());
        return failed;
    }

    private ConsolidationJob update(
            final AtomicReference<ConsolidationJob> current,
            final UnaryOperator<ConsolidationJob> change) {
        final var updated = current.updateAndGet(job -> change.apply(job).withUpdatedAt(clock.instant()));
        saveQuietly(updated);
        return updated;
    }

    private void saveQuietly(final ConsolidationJob job) {
        try {
            jobStore.save(job);
        }
        catch (Exception e) {
            log.error("Could not record state {} of consolidation job {}. Error: {}",
                      job.getStatus(), job.getJobId(), rootCause(e).getMessage(), e);
        }
    }
}
