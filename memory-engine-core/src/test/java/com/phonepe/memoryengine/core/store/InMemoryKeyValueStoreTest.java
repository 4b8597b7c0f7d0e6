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

import com.phonepe.memoryengine.core.utils.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link InMemoryKeyValueStore}
 */
class InMemoryKeyValueStoreTest {

    @Test
    void testCompareAndSet() {
        final var store = new InMemoryKeyValueStore();
        final var ttl = Duration.ofMinutes(1);

        assertTrue(store.compareAndSet("k", null, "v1", ttl));
        assertFalse(store.compareAndSet("k", null, "v2", ttl));
        assertFalse(store.compareAndSet("k", "stale", "v2", ttl));
        assertTrue(store.compareAndSet("k", "v1", "v2", ttl));
        assertEquals("v2", store.get("k").orElseThrow());
        assertFalse(store.compareAndSet("missing", "v1", "v2", ttl));
    }

    @Test
    void testCompareAndDelete() {
        final var clock = new MutableClock();
        final var store = new InMemoryKeyValueStore(clock);
        final var expired = new CopyOnWriteArrayList<String>();
        store.addExpiryListener((key, lastValue) -> expired.add(lastValue));
        store.set("k", "v1", Duration.ofMinutes(1));

        assertFalse(store.compareAndDelete("missing", "v1"));
        assertFalse(store.compareAndDelete("k", "stale"));
        assertEquals("v1", store.get("k").orElseThrow());
        assertTrue(store.compareAndDelete("k", "v1"));
        assertTrue(store.get("k").isEmpty());

        store.set("old", "v", Duration.ofSeconds(30));
        clock.advance(Duration.ofMinutes(1));
        assertFalse(store.compareAndDelete("old", "v"));
        assertEquals(List.of("v"), expired);
    }

    @Test
    void testExpiredKeysAreInvisibleAndReported() {
        final var clock = new MutableClock();
        final var store = new InMemoryKeyValueStore(clock);
        final var expired = new CopyOnWriteArrayList<String>();
        store.addExpiryListener((key, lastValue) -> expired.add(key + "=" + lastValue));
        store.set("a", "1", Duration.ofMinutes(1));
        store.set("b", "2", Duration.ofMinutes(10));

        clock.advance(Duration.ofMinutes(2));

        assertTrue(store.get("a").isEmpty());
        assertEquals("2", store.get("b").orElseThrow());
        assertEquals(List.of("a=1"), expired);
        assertEquals(0, store.evictExpired());

        clock.advance(Duration.ofMinutes(10));
        assertEquals(1, store.evictExpired());
        assertEquals(List.of("a=1", "b=2"), expired);
        assertEquals(0, store.size());
    }

    @Test
    void testExpiredKeyCanBeRecreated() {
        final var clock = new MutableClock();
        final var store = new InMemoryKeyValueStore(clock);
        final var expired = new CopyOnWriteArrayList<String>();
        store.addExpiryListener((key, lastValue) -> expired.add(lastValue));
        store.set("k", "old", Duration.ofSeconds(30));

        clock.advance(Duration.ofMinutes(1));

        assertTrue(store.compareAndSet("k", null, "new", Duration.ofSeconds(30)));
        assertEquals(List.of("old"), expired);
        assertFalse(store.delete("missing"));
        assertTrue(store.delete("k"));
    }

    @Test
    void testSweeperEvictsWithoutAccess() {
        final var clock = new MutableClock();
        final var expired = new CopyOnWriteArrayList<String>();
        try (final var store = new InMemoryKeyValueStore(clock, Duration.ofMillis(20))) {
            store.addExpiryListener((key, lastValue) -> expired.add(key));
            store.set("k", "v", Duration.ofSeconds(1));
            clock.advance(Duration.ofSeconds(5));

            await().atMost(Duration.ofSeconds(5)).until(() -> expired.contains("k"));
        }
    }

    @Test
    void testFailingListenerDoesNotBreakOthers() {
        final var clock = new MutableClock();
        final var store = new InMemoryKeyValueStore(clock);
        final var expired = new CopyOnWriteArrayList<String>();
        store.addExpiryListener((key, lastValue) -> {
            throw new IllegalStateException("listener failure");
        });
        store.addExpiryListener((key, lastValue) -> expired.add(key));
        store.set("k", "v", Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(2));

        assertEquals(1, store.evictExpired());
        assertEquals(List.of("k"), expired);
    }
}
