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

import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Consumer side of a streamed response. Events are read in order, the last one being a
 * {@link CompleteStreamEvent}. Calling {@link #cancel()} stops the producer; the text delivered up to that point is
 * kept as a partial response.
 */
@Slf4j
public class ResponseStream {
    private final String sessionId;
    private final BlockingQueue<StreamEvent> events = new LinkedBlockingQueue<>();
    private final CompletableFuture<StreamOutcome> outcome = new CompletableFuture<>();
    private final Object lock = new Object();
    private volatile boolean cancelled;
    private volatile boolean abandoned;
    private volatile boolean terminated;

    public ResponseStream(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * Wait up to {@code timeout} for the next event
     */
    @SneakyThrows
    public Optional<StreamEvent> next(Duration timeout) {
        return Optional.ofNullable(events.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    /**
     * Blocking, ordered view of the events. The stream ends after the completion marker.
     */
    public Stream<StreamEvent> events() {
        final var iterator = new Iterator<StreamEvent>() {
            private boolean done;

            @Override
            public boolean hasNext() {
                return !done;
            }

            @Override
            @SneakyThrows
            public StreamEvent next() {
                if (done) {
                    throw new NoSuchElementException();
                }
                final var event = events.take();
                done = event.getType() == StreamEventType.COMPLETE;
                return event;
            }
        };
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED), false);
    }

    /**
     * Read every event up to and including the completion marker
     */
    public List<StreamEvent> readAll() {
        return new ArrayList<>(events().toList());
    }

    /**
     * Stop the stream. Safe to call more than once and after completion.
     */
    public void cancel() {
        if (!cancelled && !terminated) {
            log.debug("Stream for session {} cancelled by consumer", sessionId);
        }
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Completes once the producer has finished and the outcome has been persisted
     */
    public CompletableFuture<StreamOutcome> outcome() {
        return outcome;
    }

    boolean emit(final StreamEvent event) {
        synchronized (lock) {
            if (terminated) {
                return false;
            }
            events.add(event);
            return !cancelled;
        }
    }

    /**
     * Run a chunk delivery unless the consumer left or the producer gave up on generation. Deliveries, abandonment
     * and termination are mutually exclusive, so whatever the producer reads after {@link #abandon()} is final.
     *
     * @return false once generation should stop
     */
    boolean deliver(final Runnable delivery) {
        synchronized (lock) {
            if (cancelled || abandoned || terminated) {
                return false;
            }
            delivery.run();
            return !cancelled;
        }
    }

    /**
     * Refuse any further generated chunks. Status, error and completion events can still be emitted.
     */
    void abandon() {
        synchronized (lock) {
            abandoned = true;
        }
    }

    void terminate(final StreamEvent completion, final StreamOutcome result) {
        synchronized (lock) {
            if (!terminated) {
                events.add(completion);
                terminated = true;
            }
        }
        outcome.complete(result);
    }
}
