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

package com.phonepe.memoryengine.core.engine;

import com.google.common.base.Strings;
import com.phonepe.memoryengine.core.consolidation.ConsolidationJob;
import com.phonepe.memoryengine.core.consolidation.ConsolidationJobStore;
import com.phonepe.memoryengine.core.consolidation.ConsolidationPipeline;
import com.phonepe.memoryengine.core.consolidation.ConsolidationTrigger;
import com.phonepe.memoryengine.core.consolidation.FactExtractor;
import com.phonepe.memoryengine.core.consolidation.KeyValueConsolidationJobStore;
import com.phonepe.memoryengine.core.errors.EngineError;
import com.phonepe.memoryengine.core.errors.EngineException;
import com.phonepe.memoryengine.core.errors.ErrorType;
import com.phonepe.memoryengine.core.events.EventBus;
import com.phonepe.memoryengine.core.events.MemoryDegradedEngineEvent;
import com.phonepe.memoryengine.core.events.ModeSwitchedEngineEvent;
import com.phonepe.memoryengine.core.events.SessionCreatedEngineEvent;
import com.phonepe.memoryengine.core.events.SessionDeletedEngineEvent;
import com.phonepe.memoryengine.core.events.SessionExpiredEngineEvent;
import com.phonepe.memoryengine.core.generation.GeneratedResponse;
import com.phonepe.memoryengine.core.generation.ResponseGenerator;
import com.phonepe.memoryengine.core.memory.HierarchicalMemorySearcher;
import com.phonepe.memoryengine.core.memory.MemoryClient;
import com.phonepe.memoryengine.core.memory.MemorySearchCache;
import com.phonepe.memoryengine.core.memory.ResolvedMemoryEntry;
import com.phonepe.memoryengine.core.model.ChatMessage;
import com.phonepe.memoryengine.core.model.MessageRole;
import com.phonepe.memoryengine.core.model.Mode;
import com.phonepe.memoryengine.core.model.Session;
import com.phonepe.memoryengine.core.modes.AgentModeProcessor;
import com.phonepe.memoryengine.core.modes.ModeEvent;
import com.phonepe.memoryengine.core.modes.ModeProcessor;
import com.phonepe.memoryengine.core.modes.ModeStateMachine;
import com.phonepe.memoryengine.core.modes.TurnPlan;
import com.phonepe.memoryengine.core.modes.TutorModeProcessor;
import com.phonepe.memoryengine.core.store.ContextStore;
import com.phonepe.memoryengine.core.store.KeyValueStore;
import com.phonepe.memoryengine.core.streaming.StreamOutcome;
import com.phonepe.memoryengine.core.streaming.StreamingResponsePipeline;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static com.phonepe.memoryengine.core.utils.EngineUtils.engineException;
import static com.phonepe.memoryengine.core.utils.EngineUtils.rootCause;

/**
 * Entry point of the engine. Runs a turn as: load or create the session, resolve memory through the active mode's
 * processor, generate the answer, persist the turn with a single atomic session update and, once enough messages
 * have piled up, hand the new messages to consolidation without waiting for it.
 * <p>
 * The engine holds no per-session state of its own. Every instance sharing a {@link KeyValueStore} can serve any
 * session.
 */
@Slf4j
public class ConversationEngine implements AutoCloseable {

    @Getter
    private final EngineSetup setup;
    @Getter
    private final ContextStore contextStore;
    @Getter
    private final HierarchicalMemorySearcher searcher;
    @Getter
    private final ConsolidationPipeline consolidationPipeline;
    @Getter
    private final EventBus eventBus;
    private final ResponseGenerator generator;
    private final StreamingResponsePipeline streamingPipeline;
    private final Map<Mode, ModeProcessor> processors;
    private final ExecutorService executorService;
    private final boolean ownsExecutor;
    private final boolean ownsEventBus;
    private final Clock clock;

    /**
     * @param keyValueStore   Shared store for sessions and consolidation jobs
     * @param memoryClient    Memory service
     * @param generator       Language model
     * @param setup           Configuration, defaults when null
     * @param eventBus        Bus to publish engine events on, a new one when null
     * @param factExtractor   Consolidation fact extractor, pattern based when null
     * @param jobStore        Consolidation job store, the key-value store when null
     * @param executorService Executor for memory searches, generation and streaming, a cached pool when null. A
     *                        pool created here is shut down by {@link #close()}.
     * @param clock           Clock, UTC system clock when null
     */
    @Builder
    public ConversationEngine(
            @NonNull KeyValueStore keyValueStore,
            @NonNull MemoryClient memoryClient,
            @NonNull ResponseGenerator generator,
            EngineSetup setup,
            EventBus eventBus,
            FactExtractor factExtractor,
            ConsolidationJobStore jobStore,
            ExecutorService executorService,
            Clock clock) {
        this.setup = Objects.requireNonNullElse(setup, EngineSetup.DEFAULT);
        this.generator = generator;
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        this.ownsExecutor = null == executorService;
        this.executorService = Objects.requireNonNullElseGet(executorService, Executors::newCachedThreadPool);
        this.ownsEventBus = null == eventBus;
        this.eventBus = Objects.requireNonNullElseGet(eventBus, EventBus::new);
        this.contextStore = new ContextStore(keyValueStore, this.setup.getContextStore(), null, this.clock);
        final var memorySetup = this.setup.getMemorySearch();
        this.searcher = new HierarchicalMemorySearcher(memoryClient,
                                                       memorySetup,
                                                       new MemorySearchCache(memorySetup),
                                                       this.executorService);
        this.consolidationPipeline = new ConsolidationPipeline(
                memoryClient,
                Objects.requireNonNullElseGet(
                        jobStore,
                        () -> new KeyValueConsolidationJobStore(keyValueStore,
                                                                this.setup.getConsolidation().getJobRetention())),
                factExtractor,
                searcher.getCache(),
                this.eventBus,
                this.setup.getConsolidation(),
                this.clock);
        this.streamingPipeline = new StreamingResponsePipeline(generator, this.setup.getStreaming(),
                                                               this.executorService);
        this.processors = new EnumMap<>(Mode.class);
        this.processors.put(Mode.TUTOR, new TutorModeProcessor(searcher));
        this.processors.put(Mode.AGENT, new AgentModeProcessor(searcher, this.clock));
        this.contextStore.addExpiryListener(this::onSessionExpired);
    }

    /**
     * Answer a message in one piece
     *
     * @throws EngineException {@link ErrorType#GENERATION_TIMEOUT} or {@link ErrorType#GENERATION_FAILURE} when no
     *                         answer could be generated, {@link ErrorType#SESSION_ACCESS_DENIED} when the session
     *                         belongs to another client, {@link ErrorType#SESSION_CONFLICT} when the turn could not be
     *                         saved
     */
    public TurnResponse submitTurn(@NonNull final TurnRequest request) {
        final var prepared = prepare(request);
        final var plan = prepared.plan();
        final var response = plan.requiresGeneration()
                             ? generate(plan)
                             : GeneratedResponse.of(plan.getFixedResponse());
        final var assistantMessageId = UUID.randomUUID().toString();
        final var saved = persistTurn(prepared, response.getText(), response, assistantMessageId, false);
        final var job = consolidateIfDue(saved);
        return TurnResponse.builder()
                .sessionId(saved.getSessionId())
                .messageId(assistantMessageId)
                .response(response.getText())
                .mode(plan.getMode())
                .memoryContext(plan.getMemory().getEntries())
                .degraded(plan.getMemory().isDegraded())
                .unavailableRealms(plan.getMemory().getUnavailableRealms())
                .memoryError(plan.getMemory().getError())
                .followUpQuestions(plan.getFollowUpQuestions())
                .suggestedTopics(plan.getSuggestedTopics())
                .learningProgress(saved.getLearningProgress())
                .details(plan.getDetails())
                .consolidationJobId(null == job ? null : job.getJobId())
                .build();
    }

    /**
     * Answer a message as a stream of chunks. Memory is resolved before this returns; generation runs in the
     * background. The turn is saved when the stream ends, including when the consumer cancels it.
     */
    public StreamingTurn submitTurnStreaming(@NonNull final TurnRequest request) {
        final var prepared = prepare(request);
        final var plan = prepared.plan();
        final var assistantMessageId = UUID.randomUUID().toString();
        final var stream = streamingPipeline.stream(plan, outcome -> onStreamFinished(prepared,
                                                                                      outcome,
                                                                                      assistantMessageId));
        return new StreamingTurn(plan.getSessionId(), stream);
    }

    /**
     * Move a session to another mode. History is kept as is; only the state of the mode being left is dropped.
     * Agent outcomes not yet consolidated are handed to consolidation before they are dropped.
     */
    public ModeSwitchResult switchMode(
            @NonNull final String sessionId,
            @NonNull final String clientId,
            @NonNull final Mode newMode) {
        ownedSession(sessionId, clientId);
        final var before = new AtomicReference<Session>();
        final var updated = contextStore.mutate(sessionId, session -> {
            before.set(session);
            final var transition = ModeStateMachine.apply(session.getModeState(),
                                                          new ModeEvent.SwitchMode(newMode));
            return transition.changed() ? session.withModeState(transition.state()) : session;
        });
        final var previous = before.get();
        if (previous.getMode() == newMode) {
            return new ModeSwitchResult(newMode, newMode, null);
        }
        ConsolidationJob job = null;
        if (!previous.getPendingOutcomes().isEmpty()) {
            job = consolidationPipeline.submit(sessionId,
                                               previous.getIdentity(),
                                               List.of(),
                                               previous.getPendingOutcomes(),
                                               previous.getLearningProgress(),
                                               ConsolidationTrigger.MODE_SWITCH);
        }
        log.info("Session {} switched from {} to {} mode", sessionId, previous.getMode(), updated.getMode());
        eventBus.notify(ModeSwitchedEngineEvent.builder()
                                .sessionId(sessionId)
                                .actorId(updated.getIdentity().getActorId())
                                .previousMode(previous.getMode())
                                .newMode(newMode)
                                .outcomesSubmitted(previous.getPendingOutcomes().size())
                                .build());
        return new ModeSwitchResult(previous.getMode(), newMode, null == job ? null : job.getJobId());
    }

    public SessionSummary getSession(@NonNull final String sessionId, @NonNull final String clientId) {
        return SessionSummary.from(ownedSession(sessionId, clientId));
    }

    /**
     * Delete a session. Messages and outcomes not yet consolidated in the deleted state are handed to consolidation.
     *
     * @return false if there was no such session
     */
    public boolean deleteSession(@NonNull final String sessionId, @NonNull final String clientId) {
        final var deleted = contextStore.remove(sessionId, session -> checkOwner(session, clientId));
        if (deleted.isEmpty()) {
            return false;
        }
        final var session = deleted.get();
        final var pending = session.getUnconsolidatedMessages();
        if (!pending.isEmpty() || !session.getPendingOutcomes().isEmpty()) {
            consolidationPipeline.submit(sessionId,
                                         session.getIdentity(),
                                         pending,
                                         session.getPendingOutcomes(),
                                         session.getLearningProgress(),
                                         ConsolidationTrigger.SESSION_DELETED);
        }
        eventBus.notify(SessionDeletedEngineEvent.builder()
                                .sessionId(sessionId)
                                .actorId(session.getIdentity().getActorId())
                                .clientId(clientId)
                                .unconsolidatedMessages(pending.size())
                                .build());
        return true;
    }

    /**
     * @throws EngineException {@link ErrorType#NOT_IN_TUTOR_MODE} if the session is not in tutor mode
     */
    public LearningProgressSummary getLearningProgress(
            @NonNull final String sessionId,
            @NonNull final String clientId) {
        final var session = ownedSession(sessionId, clientId);
        if (session.getMode() != Mode.TUTOR || null == session.getLearningProgress()) {
            throw EngineException.of(ErrorType.NOT_IN_TUTOR_MODE, sessionId, session.getMode());
        }
        final var progress = session.getLearningProgress();
        final var started = Objects.requireNonNullElse(session.getCreatedAt(), clock.instant());
        return LearningProgressSummary.builder()
                .sessionId(sessionId)
                .topic(progress.getTopic())
                .understandingLevel(progress.getUnderstandingLevel())
                .learningPath(progress.getLearningPath())
                .messageCount(session.getMessageCount())
                .sessionDurationMinutes(Duration.between(started, clock.instant()).toMinutes())
                .build();
    }

    /**
     * Stops consolidation after running jobs finish, then shuts down the executor and event bus if they were
     * created by this engine
     */
    @Override
    public void close() {
        consolidationPipeline.close();
        if (ownsExecutor) {
            executorService.shutdownNow();
        }
        if (ownsEventBus) {
            eventBus.close();
        }
    }

    boolean isExecutorShutdown() {
        return executorService.isShutdown();
    }

    private record PreparedTurn(Session session, TurnPlan plan, ModeProcessor processor) {
    }

    private PreparedTurn prepare(final TurnRequest request) {
        if (Strings.isNullOrEmpty(request.getMessage()) || request.getMessage().isBlank()) {
            throw EngineException.of(ErrorType.INVALID_REQUEST, "message must not be empty");
        }
        final var identity = request.getIdentity();
        final var sessionId = Strings.isNullOrEmpty(request.getSessionId())
                              ? UUID.randomUUID().toString()
                              : request.getSessionId();
        final var initialMode = Objects.requireNonNullElse(request.getMode(), setup.getDefaultMode());
        final var loaded = contextStore.loadOrCreate(sessionId, identity, initialMode);
        var session = loaded.session();
        if (loaded.created()) {
            eventBus.notify(SessionCreatedEngineEvent.builder()
                                    .sessionId(sessionId)
                                    .actorId(identity.getActorId())
                                    .clientId(identity.getClientId())
                                    .mode(session.getMode())
                                    .build());
        }
        else {
            checkOwner(session, identity.getClientId());
            if (null != request.getMode() && request.getMode() != session.getMode()) {
                switchMode(sessionId, identity.getClientId(), request.getMode());
                session = contextStore.load(sessionId)
                        .orElseThrow(() -> EngineException.of(ErrorType.SESSION_NOT_FOUND, sessionId));
            }
        }
        final var processor = processors.get(session.getMode());
        final var plan = processor.plan(session, request.getMessage(), request.getLearningTopic());
        final var memory = plan.getMemory();
        if (memory.isDegraded()) {
            log.warn("Answering turn for session {} with degraded memory. Unavailable realms: {}",
                     sessionId, memory.getUnavailableRealms());
            eventBus.notify(MemoryDegradedEngineEvent.builder()
                                    .sessionId(sessionId)
                                    .actorId(identity.getActorId())
                                    .errorType(memory.getError().getErrorType())
                                    .unavailableRealms(memory.getUnavailableRealms())
                                    .build());
        }
        return new PreparedTurn(session, plan, processor);
    }

    private GeneratedResponse generate(final TurnPlan plan) {
        final var timeout = setup.getStreaming().getStallTimeout();
        final var future = CompletableFuture.supplyAsync(() -> generator.generate(plan.getPromptContext()),
                                                         executorService);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException e) {
            future.cancel(true);
            log.error("Generation for session {} timed out after {}", plan.getSessionId(), timeout);
            throw new EngineException(EngineError.error(ErrorType.GENERATION_TIMEOUT, timeout), e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineException(EngineError.error(ErrorType.GENERATION_FAILURE, e), e);
        }
        catch (ExecutionException e) {
            log.error("Generation failed for session {}. Error: {}",
                      plan.getSessionId(), rootCause(e).getMessage(), e);
            throw engineException(e)
                    .orElseGet(() -> new EngineException(EngineError.error(ErrorType.GENERATION_FAILURE, e), e));
        }
    }

    private EngineError onStreamFinished(
            final PreparedTurn prepared,
            final StreamOutcome outcome,
            final String assistantMessageId) {
        final var saved = persistTurn(prepared,
                                      outcome.getText(),
                                      outcome.getResponse(),
                                      assistantMessageId,
                                      outcome.isPartial());
        if (outcome.isPartial()) {
            log.info("Saved {} turn for session {} with {} characters of partial response",
                     outcome.getStatus(), saved.getSessionId(), outcome.getText().length());
        }
        consolidateIfDue(saved);
        return null;
    }

    /**
     * Save the user message, the answer and the resulting mode state in one update
     *
     * @param response Full generator response, null if generation did not finish
     */
    private Session persistTurn(
            final PreparedTurn prepared,
            final String responseText,
            final GeneratedResponse response,
            final String assistantMessageId,
            boolean partial) {
        final var plan = prepared.plan();
        final var now = clock.instant();
        final var messages = new ArrayList<ChatMessage>();
        messages.add(ChatMessage.builder()
                             .messageId(UUID.randomUUID().toString())
                             .role(MessageRole.USER)
                             .content(plan.getUserMessage())
                             .mode(plan.getMode())
                             .timestamp(now)
                             .build());
        if (!Strings.isNullOrEmpty(responseText)) {
            messages.add(ChatMessage.builder()
                                 .messageId(assistantMessageId)
                                 .role(MessageRole.ASSISTANT)
                                 .content(responseText)
                                 .mode(plan.getMode())
                                 .timestamp(now)
                                 .partial(partial)
                                 .build());
        }
        final var events = new ArrayList<>(plan.getEvents());
        if (null != response) {
            events.addAll(prepared.processor().onResponse(plan, response, assistantMessageId));
        }
        final var refs = plan.getMemory()
                .getEntries()
                .stream()
                .map(ResolvedMemoryEntry::toRef)
                .toList();
        return contextStore.mutate(plan.getSessionId(), session -> {
            final var transition = ModeStateMachine.applyAll(session.getModeState(), events);
            return session.appendMessages(messages)
                    .withModeState(transition.state())
                    .withActiveMemoryContext(refs);
        });
    }

    /**
     * Submit unconsolidated messages once they fill the window. The claim is made inside a session update, so
     * concurrent turns never submit the same window twice.
     */
    private ConsolidationJob consolidateIfDue(final Session saved) {
        final var window = setup.getConsolidation().getWindow();
        if (saved.getMessageCount() - saved.getConsolidatedMessageCount() < window) {
            return null;
        }
        final var claimed = new AtomicReference<Session>();
        try {
            contextStore.mutate(saved.getSessionId(), session -> {
                if (session.getMessageCount() - session.getConsolidatedMessageCount() < window) {
                    claimed.set(null);
                    return session;
                }
                claimed.set(session);
                final var drained = ModeStateMachine.apply(
                        session.getModeState(),
                        new ModeEvent.OutcomesDrained(session.getPendingOutcomes().size()));
                return session.withModeState(drained.state())
                        .withConsolidatedMessageCount(session.getMessageCount());
            });
        }
        catch (EngineException e) {
            log.warn("Could not claim consolidation window for session {}: {}", saved.getSessionId(),
                     e.getMessage());
            return null;
        }
        final var session = claimed.get();
        if (null == session) {
            return null;
        }
        return consolidationPipeline.submit(session.getSessionId(),
                                            session.getIdentity(),
                                            session.getUnconsolidatedMessages(),
                                            session.getPendingOutcomes(),
                                            session.getLearningProgress(),
                                            ConsolidationTrigger.MESSAGE_WINDOW);
    }

    private void onSessionExpired(final Session session) {
        try {
            final var pending = session.getUnconsolidatedMessages();
            log.info("Session {} expired with {} unconsolidated messages",
                     session.getSessionId(), pending.size());
            if (!pending.isEmpty() || !session.getPendingOutcomes().isEmpty()) {
                consolidationPipeline.submit(session.getSessionId(),
                                             session.getIdentity(),
                                             pending,
                                             session.getPendingOutcomes(),
                                             session.getLearningProgress(),
                                             ConsolidationTrigger.SESSION_EXPIRED);
            }
            eventBus.notify(SessionExpiredEngineEvent.builder()
                                    .sessionId(session.getSessionId())
                                    .actorId(session.getIdentity().getActorId())
                                    .unconsolidatedMessages(pending.size())
                                    .build());
        }
        catch (Exception e) {
            log.error("Could not consolidate expired session {}. Error: {}",
                      session.getSessionId(), rootCause(e).getMessage(), e);
        }
    }

    private Session ownedSession(final String sessionId, final String clientId) {
        return checkOwner(contextStore.load(sessionId)
                                  .orElseThrow(() -> EngineException.of(ErrorType.SESSION_NOT_FOUND, sessionId)),
                          clientId);
    }

    private static Session checkOwner(final Session session, final String clientId) {
        if (!session.getIdentity().getClientId().equals(clientId)) {
            log.warn("Client {} tried to access session {} owned by another client", clientId,
                     session.getSessionId());
            throw EngineException.of(ErrorType.SESSION_ACCESS_DENIED, session.getSessionId(), clientId);
        }
        return session;
    }
}
