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

package com.phonepe.memoryengine.core.events;

import com.google.common.eventbus.AllowConcurrentEvents;
import com.google.common.eventbus.AsyncEventBus;
import com.google.common.eventbus.Subscribe;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

import static com.phonepe.memoryengine.core.utils.EngineUtils.rootCause;

/**
 * Publishes {@link EngineEvent}s to whoever is listening. Handlers run asynchronously and never hold up a turn.
 */
@Slf4j
public class EventBus implements AutoCloseable {
    private final AsyncEventBus eventBus;
    private final ExecutorService executorService;
    private final boolean ownsExecutor;

    /**
     * Create event bus with default cached thread pool executor service
     */
    public EventBus() {
        this(Executors.newCachedThreadPool(), true);
    }

    /**
     * Create event bus with custom executor service
     *
     * @param executorService The executor service to run event handlers on
     */
    public EventBus(final ExecutorService executorService) {
        this(executorService, false);
    }

    private EventBus(final ExecutorService executorService, boolean ownsExecutor) {
        this.executorService = executorService;
        this.ownsExecutor = ownsExecutor;
        this.eventBus = new AsyncEventBus(executorService, (exception, context) ->
                log.error("Event handler failed for {}. Error: {}",
                          context.getEvent().getClass().getSimpleName(),
                          rootCause(exception).getMessage(),
                          exception));
    }

    /**
     * Attach a handler that receives every event published from now on
     */
    public void connect(final Consumer<EngineEvent> handler) {
        eventBus.register(new HandlerSubscriber(handler));
    }

    public void notify(final EngineEvent event) {
        eventBus.post(event);
    }

    /**
     * Stops the handler pool if this bus created it. Events already posted are still delivered.
     */
    @Override
    public void close() {
        if (ownsExecutor) {
            executorService.shutdown();
        }
    }

    boolean isExecutorShutdown() {
        return executorService.isShutdown();
    }

    private record HandlerSubscriber(Consumer<EngineEvent> handler) {
        @Subscribe
        @AllowConcurrentEvents
        public void onEvent(EngineEvent event) {
            handler.accept(event);
        }
    }
}
