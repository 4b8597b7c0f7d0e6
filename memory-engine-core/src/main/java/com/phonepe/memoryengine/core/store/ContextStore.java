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

package com.phonepe.memoryengine.core.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.google.common.util.concurrent.Uninterruptibles;
import com.phonepe.memoryengine.core.errors.EngineException;
import com.phonepe.memoryengine.core.errors.ErrorType;
import com.phonepe.memoryengine.core.model.Identity;
import com.phonepe.memoryengine.core.model.Mode;
import com.phonepe.memoryengine.core.model.Session;
import com.phonepe.memoryengine.core.utils.JsonUtils;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Stores conversation sessions in a shared {@link KeyValueStore}. All writes to an existing session go through
 * {@link #mutate(String, UnaryOperator)}, which is an optimistic read-modify-write: the new value is written with a
 * compare-and-set against the value that was read, and the whole cycle is retried when another writer got there
 * first.
 */
@Slf4j
public class ContextStore {
    public static final String KEY_PREFIX = "chat:session:";

    /**
     * Result of {@link #loadOrCreate(String, Identity, Mode)}
     */
    public record LoadedSession(Session session, boolean created) {
    }

    private final KeyValueStore keyValueStore;
    @Getter
    private final ContextStoreSetup setup;
    private final ObjectMapper mapper;
    private final Clock clock;

    public ContextStore(@NonNull KeyValueStore keyValueStore, ContextStoreSetup setup) {
        this(keyValueStore, setup, null, null);
    }

    public ContextStore(
            @NonNull KeyValueStore keyValueStore,
            ContextStoreSetup setup,
            ObjectMapper mapper,
            Clock clock) {
        this.keyValueStore = keyValueStore;
        this.setup = Objects.requireNonNullElse(setup, ContextStoreSetup.DEFAULT);
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
    }

    public static String key(final String sessionId) {
        return KEY_PREFIX + sessionId;
    }

    public static Optional<String> sessionId(final String key) {
        return key.startsWith(KEY_PREFIX)
               ? Optional.of(key.substring(KEY_PREFIX.length()))
               : Optional.empty();
    }

    public Optional<Session> load(@NonNull final String sessionId) {
        return keyValueStore.get(key(sessionId)).map(this::deserialize);
    }

    /**
     * Create a new session
     *
     * @throws EngineException with {@link ErrorType#SESSION_ALREADY_EXISTS} if the id is taken
     */
    public Session create(@NonNull final String sessionId, @NonNull final Identity identity, @NonNull Mode mode) {
        final var session = Session.create(sessionId, identity, mode, clock.instant());
        if (!keyValueStore.compareAndSet(key(sessionId), null, serialize(session), setup.getSessionTtl())) {
            throw EngineException.of(ErrorType.SESSION_ALREADY_EXISTS, sessionId);
        }
        log.info("Created session {} for client {} actor {} in {} mode",
                 sessionId, identity.getClientId(), identity.getActorId(), mode);
        return session;
    }

    /**
     * Load a session, creating it if it does not exist. Safe against concurrent creators of the same id.
     */
    public LoadedSession loadOrCreate(
            @NonNull final String sessionId,
            @NonNull final Identity identity,
            @NonNull final Mode mode) {
        final var existing = load(sessionId);
        if (existing.isPresent()) {
            return new LoadedSession(existing.get(), false);
        }
        try {
            return new LoadedSession(create(sessionId, identity, mode), true);
        }
        catch (EngineException e) {
            if (e.getErrorType() != ErrorType.SESSION_ALREADY_EXISTS) {
                throw e;
            }
            log.debug("Session {} was created concurrently, loading it", sessionId);
            return new LoadedSession(load(sessionId)
                                             .orElseThrow(() -> EngineException.of(ErrorType.SESSION_NOT_FOUND,
                                                                                   sessionId)),
                                     false);
        }
    }

    /**
     * Atomically apply a change to a session. The function may be invoked more than once when writers race, so it
     * must not have side effects. History is trimmed, last activity is stamped and the TTL is refreshed on every
     * successful write.
     *
     * @return The session as written
     * @throws EngineException with {@link ErrorType#SESSION_NOT_FOUND} if the session does not exist, or
     *                         {@link ErrorType#SESSION_CONFLICT} if all attempts lost the race
     */
    public Session mutate(@NonNull final String sessionId, @NonNull final UnaryOperator<Session> mutation) {
        final var key = key(sessionId);
        for (int attempt = 1; attempt <= setup.getMaxMutateAttempts(); attempt++) {
            final var current = keyValueStore.get(key)
                    .orElseThrow(() -> EngineException.of(ErrorType.SESSION_NOT_FOUND, sessionId));
            final var updated = Objects.requireNonNull(mutation.apply(deserialize(current)),
                                                       "Session mutation must not return null")
                    .trimHistory(setup.getMaxHistory())
                    .withLastActivity(clock.instant());
            if (keyValueStore.compareAndSet(key, current, serialize(updated), setup.getSessionTtl())) {
                if (attempt > 1) {
                    log.debug("Session {} updated after {} attempts", sessionId, attempt);
                }
                return updated;
            }
            backoff(attempt);
        }
        log.warn("Giving up on session {} after {} conflicting writes", sessionId, setup.getMaxMutateAttempts());
        throw EngineException.of(ErrorType.SESSION_CONFLICT, sessionId, setup.getMaxMutateAttempts());
    }

    public boolean delete(@NonNull final String sessionId) {
        final var deleted = keyValueStore.delete(key(sessionId));
        if (deleted) {
            log.info("Deleted session {}", sessionId);
        }
        return deleted;
    }

    /**
     * Atomically delete a session and return the exact state that was deleted. The check runs against the state
     * about to be deleted and may throw to veto the delete. A write landing between the read and the delete makes
     * the delete fail, and the cycle is retried with the new state.
     *
     * @return The deleted session, or empty if there was none
     * @throws EngineException with {@link ErrorType#SESSION_CONFLICT} if all attempts lost the race
     */
    public Optional<Session> remove(@NonNull final String sessionId, @NonNull final Consumer<Session> check) {
        final var key = key(sessionId);
        for (int attempt = 1; attempt <= setup.getMaxMutateAttempts(); attempt++) {
            final var current = keyValueStore.get(key);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            final var session = deserialize(current.get());
            check.accept(session);
            if (keyValueStore.compareAndDelete(key, current.get())) {
                log.info("Deleted session {}", sessionId);
                return Optional.of(session);
            }
            log.debug("Session {} changed while being deleted, retrying", sessionId);
            backoff(attempt);
        }
        log.warn("Giving up deleting session {} after {} conflicting writes", sessionId,
                 setup.getMaxMutateAttempts());
        throw EngineException.of(ErrorType.SESSION_CONFLICT, sessionId, setup.getMaxMutateAttempts());
    }

    /**
     * Get called with the last state of every session the store lets expire
     */
    public void addExpiryListener(@NonNull final Consumer<Session> listener) {
        keyValueStore.addExpiryListener((key, lastValue) -> sessionId(key).ifPresent(sessionId -> {
            if (Strings.isNullOrEmpty(lastValue)) {
                log.warn("Session {} expired but its last state is not available", sessionId);
                return;
            }
            listener.accept(deserialize(lastValue));
        }));
    }

    public Session deserialize(final String value) {
        return JsonUtils.read(mapper, value, Session.class);
    }

    private String serialize(final Session session) {
        return JsonUtils.write(mapper, session);
    }

    private static void backoff(int attempt) {
        final var ceiling = 1L << Math.min(attempt, 6);
        Uninterruptibles.sleepUninterruptibly(ThreadLocalRandom.current().nextLong(1, ceiling + 1),
                                              TimeUnit.MILLISECONDS);
    }
}
