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

import com.phonepe.memoryengine.core.utils.EngineUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Process local {@link KeyValueStore}. Expired keys are never returned and are removed on access, by
 * {@link #evictExpired()} or by the optional periodic sweeper. Expiry listeners are notified for every removed key.
 */
@Slf4j
public class InMemoryKeyValueStore implements KeyValueStore, AutoCloseable {

    private record Entry(String value, Instant expiresAt) {
        boolean expired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final List<ExpiryListener> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;
    private final ScheduledExecutorService sweeper;

    public InMemoryKeyValueStore() {
        this(Clock.systemUTC());
    }

    public InMemoryKeyValueStore(Clock clock) {
        this(clock, null);
    }

    /**
     * @param sweepInterval If set, expired keys are evicted periodically so listeners hear about them without any
     *                      access to the key
     */
    public InMemoryKeyValueStore(Clock clock, Duration sweepInterval) {
        this.clock = Objects.requireNonNull(clock);
        if (null != sweepInterval) {
            this.sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
                final var thread = new Thread(runnable, "kv-expiry-sweeper");
                thread.setDaemon(true);
                return thread;
            });
            this.sweeper.scheduleWithFixedDelay(this::evictExpired,
                                                sweepInterval.toMillis(),
                                                sweepInterval.toMillis(),
                                                TimeUnit.MILLISECONDS);
        }
        else {
            this.sweeper = null;
        }
    }

    @Override
    public Optional<String> get(String key) {
        final var entry = entries.get(key);
        if (null == entry) {
            return Optional.empty();
        }
        if (entry.expired(clock.instant())) {
            expire(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public boolean compareAndSet(String key, String expected, String update, Duration ttl) {
        final var now = clock.instant();
        final var expiredEntries = new ArrayList<Entry>(1);
        final var replaced = new boolean[]{false};
        entries.compute(key, (k, current) -> {
            var live = current;
            if (null != live && live.expired(now)) {
                expiredEntries.add(live);
                live = null;
            }
            final var matches = null == expected
                                ? null == live
                                : null != live && expected.equals(live.value());
            if (!matches) {
                return live;
            }
            replaced[0] = true;
            return new Entry(update, now.plus(ttl));
        });
        expiredEntries.forEach(entry -> notifyListeners(key, entry));
        return replaced[0];
    }

    @Override
    public boolean delete(String key) {
        final var removed = entries.remove(key);
        return null != removed && !removed.expired(clock.instant());
    }

    @Override
    public boolean compareAndDelete(String key, String expected) {
        final var now = clock.instant();
        final var expiredEntries = new ArrayList<Entry>(1);
        final var deleted = new boolean[]{false};
        entries.computeIfPresent(key, (k, current) -> {
            if (current.expired(now)) {
                expiredEntries.add(current);
                return null;
            }
            if (!current.value().equals(expected)) {
                return current;
            }
            deleted[0] = true;
            return null;
        });
        expiredEntries.forEach(entry -> notifyListeners(key, entry));
        return deleted[0];
    }

    @Override
    public void addExpiryListener(ExpiryListener listener) {
        listeners.add(listener);
    }

    /**
     * Remove every expired key and notify listeners
     *
     * @return Number of keys evicted
     */
    public int evictExpired() {
        final var now = clock.instant();
        var count = 0;
        for (final var mapEntry : entries.entrySet()) {
            if (mapEntry.getValue().expired(now) && expire(mapEntry.getKey(), mapEntry.getValue())) {
                count++;
            }
        }
        return count;
    }

    public int size() {
        return entries.size();
    }

    @Override
    public void close() {
        if (null != sweeper) {
            sweeper.shutdownNow();
        }
    }

    private boolean expire(String key, Entry entry) {
        if (entries.remove(key, entry)) {
            notifyListeners(key, entry);
            return true;
        }
        return false;
    }

    private void notifyListeners(String key, Entry entry) {
        listeners.forEach(listener -> {
            try {
                listener.expired(key, entry.value());
            }
            catch (Exception e) {
                log.error("Expiry listener failed for key %s. Error: %s"
                                  .formatted(key, EngineUtils.rootCause(e).getMessage()), e);
            }
        });
    }
}
