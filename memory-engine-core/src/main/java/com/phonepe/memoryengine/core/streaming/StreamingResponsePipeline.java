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

package com.phonepe.memoryengine.core.streaming;

import com.phonepe.memoryengine.core.errors.EngineError;
import com.phonepe.memoryengine.core.errors.EngineException;
import com.phonepe.memoryengine.core.errors.ErrorType;
import com.phonepe.memoryengine.core.generation.GeneratedResponse;
import com.phonepe.memoryengine.core.generation.ResponseGenerator;
import com.phonepe.memoryengine.core.modes.TurnPlan;
import com.google.common.util.concurrent.Uninterruptibles;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

import static com.phonepe.memoryengine.core.utils.EngineUtils.engineException;
import static com.phonepe.memoryengine.core.utils.EngineUtils.rootCause;

/**
 * Runs generation for a turn on a producer thread and hands chunks to a {@link ResponseStream} as they become
 * available.
 * <p>
 * Every stream is terminated with a completion marker. A generator that produces nothing for longer than the stall
 * timeout is abandoned with a {@link ErrorType#GENERATION_TIMEOUT} error; chunks it produces afterwards are refused, which
 * tells the generator to stop. A generator that fails before producing
 * anything is retried once without streaming and its response is delivered as a single chunk.
 * <p>
 * The {@code onFinished} callback runs on the producer thread before the completion marker is queued, so once a
 * consumer sees the marker the outcome has been persisted.
 */
@Slf4j
public class StreamingResponsePipeline {
    private static final long MAX_POLL_MILLIS = 250;

    private final ResponseGenerator generator;
    private final StreamingSetup setup;
    private final ExecutorService executorService;

    public StreamingResponsePipeline(
            ResponseGenerator generator,
            StreamingSetup setup,
            ExecutorService executorService) {
        this.generator = generator;
        this.setup = Objects.requireNonNullElse(setup, StreamingSetup.DEFAULT);
        this.executorService = executorService;
    }

    /**
     * Start streaming the answer for a planned turn
     *
     * @param plan       The turn
     * @param onFinished Called with the outcome. Returns an error to report on the stream, or null.
     */
    public ResponseStream stream(final TurnPlan plan, final Function<StreamOutcome, EngineError> onFinished) {
        final var stream = new ResponseStream(plan.getSessionId());
        executorService.submit(() -> produce(plan, stream, onFinished));
        return stream;
    }

    private void produce(
            final TurnPlan plan,
            final ResponseStream stream,
            final Function<StreamOutcome, EngineError> onFinished) {
        final var sessionId = plan.getSessionId();
        StreamOutcome outcome;
        try {
            stream.emit(MetadataStreamEvent.builder()
                                .sessionId(sessionId)
                                .mode(plan.getMode())
                                .memoryEntries(plan.getMemory().getEntries().size())
                                .degraded(plan.getMemory().isDegraded())
                                .unavailableRealms(plan.getMemory().getUnavailableRealms())
                                .details(plan.getDetails())
                                .build());
            outcome = plan.requiresGeneration()
                      ? generate(plan, stream)
                      : replay(sessionId, plan.getFixedResponse(), stream);
        }
        catch (Exception e) {
            log.error("Streaming failed for session {}. Error: {}", sessionId, rootCause(e).getMessage(), e);
            outcome = StreamOutcome.builder()
                    .status(StreamOutcome.Status.FAILED)
                    .text("")
                    .error(EngineError.error(ErrorType.GENERATION_FAILURE, e))
                    .build();
        }
        if (outcome.getError() != null) {
            stream.emit(errorEvent(sessionId, outcome.getError()));
        }
        final var persistError = finish(sessionId, outcome, onFinished);
        if (null != persistError) {
            stream.emit(errorEvent(sessionId, persistError));
        }
        stream.terminate(CompleteStreamEvent.builder()
                                 .sessionId(sessionId)
                                 .status(outcome.getStatus())
                                 .chunks(outcome.getChunks())
                                 .followUpQuestions(plan.getFollowUpQuestions())
                                 .suggestedTopics(plan.getSuggestedTopics())
                                 .build(),
                         outcome);
    }

    private StreamOutcome generate(final TurnPlan plan, final ResponseStream stream) throws InterruptedException {
        final var sessionId = plan.getSessionId();
        final var text = new StringBuffer();
        final var index = new AtomicInteger();
        final var lastActivity = new AtomicLong(System.nanoTime());
        stream.emit(StatusStreamEvent.builder().sessionId(sessionId).status(StatusStreamEvent.GENERATING).build());
        final CompletableFuture<GeneratedResponse> future;
        try {
            future = generator.generateStream(plan.getPromptContext(), chunk -> stream.deliver(() -> {
                lastActivity.set(System.nanoTime());
                text.append(chunk);
                stream.emit(ChunkStreamEvent.builder()
                                    .sessionId(sessionId)
                                    .index(index.getAndIncrement())
                                    .content(chunk)
                                    .build());
            }));
        }
        catch (Exception e) {
            log.warn("Could not start streaming generation for session {}: {}", sessionId, rootCause(e).getMessage());
            return fallback(plan, stream, e);
        }
        final var stallNanos = setup.getStallTimeout().toNanos();
        final var pollMillis = pollInterval(setup.getStallTimeout()).toMillis();
        while (true) {
            if (stream.isCancelled()) {
                stream.abandon();
                future.cancel(true);
                return outcome(StreamOutcome.Status.CANCELLED, text, index, null, null);
            }
            try {
                final var response = future.get(pollMillis, TimeUnit.MILLISECONDS);
                return outcome(StreamOutcome.Status.COMPLETED, text, index, response, null);
            }
            catch (TimeoutException e) {
                if (System.nanoTime() - lastActivity.get() > stallNanos) {
                    stream.abandon();
                    future.cancel(true);
                    log.warn("Generation for session {} stalled for more than {}", sessionId,
                             setup.getStallTimeout());
                    return outcome(StreamOutcome.Status.FAILED, text, index, null,
                                   EngineError.error(ErrorType.GENERATION_TIMEOUT, setup.getStallTimeout()));
                }
            }
            catch (ExecutionException | CancellationException e) {
                if (index.get() == 0 && !stream.isCancelled()) {
                    log.warn("Streaming generation failed for session {} before any output: {}",
                             sessionId, rootCause(e).getMessage());
                    return fallback(plan, stream, e);
                }
                log.error("Streaming generation failed for session {} after {} chunks. Error: {}",
                          sessionId, index.get(), rootCause(e).getMessage(), e);
                return outcome(StreamOutcome.Status.FAILED, text, index, null,
                               EngineError.error(ErrorType.GENERATION_FAILURE, e));
            }
        }
    }

    private StreamOutcome fallback(final TurnPlan plan, final ResponseStream stream, final Exception cause)
            throws InterruptedException {
        final var sessionId = plan.getSessionId();
        stream.emit(StatusStreamEvent.builder().sessionId(sessionId).status(StatusStreamEvent.FALLBACK).build());
        try {
            final var response = CompletableFuture.supplyAsync(() -> generator.generate(plan.getPromptContext()),
                                                               executorService)
                    .get(setup.getStallTimeout().toMillis(), TimeUnit.MILLISECONDS);
            final var text = new StringBuffer(response.getText());
            stream.emit(ChunkStreamEvent.builder().sessionId(sessionId).index(0).content(response.getText()).build());
            return outcome(StreamOutcome.Status.COMPLETED, text, new AtomicInteger(1), response, null);
        }
        catch (TimeoutException e) {
            return outcome(StreamOutcome.Status.FAILED, new StringBuffer(), new AtomicInteger(), null,
                           EngineError.error(ErrorType.GENERATION_TIMEOUT, setup.getStallTimeout()));
        }
        catch (ExecutionException e) {
            final var error = engineException(e)
                    .map(EngineException::getError)
                    .orElseGet(() -> EngineError.error(ErrorType.GENERATION_FAILURE, e));
            log.error("Fallback generation failed for session {}. Original error: {}. Error: {}",
                      sessionId, rootCause(cause).getMessage(), error.getMessage());
            return outcome(StreamOutcome.Status.FAILED, new StringBuffer(), new AtomicInteger(), null, error);
        }
    }

    private StreamOutcome replay(final String sessionId, final String fixedResponse, final ResponseStream stream) {
        final var chunks = SentenceChunker.chunk(fixedResponse, setup.getChunkSize());
        final var text = new StringBuffer();
        final var index = new AtomicInteger();
        for (final var chunk : chunks) {
            if (stream.isCancelled()) {
                return outcome(StreamOutcome.Status.CANCELLED, text, index, null, null);
            }
            text.append(chunk);
            stream.emit(ChunkStreamEvent.builder()
                                .sessionId(sessionId)
                                .index(index.getAndIncrement())
                                .content(chunk)
                                .build());
            if (!setup.getChunkDelay().isZero()) {
                Uninterruptibles.sleepUninterruptibly(setup.getChunkDelay());
            }
        }
        return outcome(StreamOutcome.Status.COMPLETED, text, index, GeneratedResponse.of(fixedResponse), null);
    }

    private static EngineError finish(
            final String sessionId,
            final StreamOutcome outcome,
            final Function<StreamOutcome, EngineError> onFinished) {
        try {
            return onFinished.apply(outcome);
        }
        catch (Exception e) {
            log.error("Could not persist stream outcome for session {}. Error: {}",
                      sessionId, rootCause(e).getMessage(), e);
            return e instanceof EngineException engineException
                   ? engineException.getError()
                   : EngineError.error(ErrorType.GENERATION_FAILURE, e);
        }
    }

    private static ErrorStreamEvent errorEvent(final String sessionId, final EngineError error) {
        return ErrorStreamEvent.builder()
                .sessionId(sessionId)
                .errorType(error.getErrorType())
                .message(error.getMessage())
                .build();
    }

    private static StreamOutcome outcome(
            StreamOutcome.Status status,
            StringBuffer text,
            AtomicInteger chunks,
            GeneratedResponse response,
            EngineError error) {
        return StreamOutcome.builder()
                .status(status)
                .text(text.toString())
                .chunks(chunks.get())
                .response(response)
                .error(error)
                .build();
    }

    static Duration pollInterval(Duration stallTimeout) {
        return Duration.ofMillis(Math.max(1, Math.min(MAX_POLL_MILLIS, stallTimeout.toMillis() / 4)));
    }
}
