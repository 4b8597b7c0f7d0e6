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

package com.phonepe.memoryengine.redis;

import com.google.common.util.concurrent.Uninterruptibles;
import com.phonepe.memoryengine.core.model.ChatMessage;
import com.phonepe.memoryengine.core.model.MessageRole;
import com.phonepe.memoryengine.core.model.Mode;
import com.phonepe.memoryengine.core.model.Session;
import com.phonepe.memoryengine.core.store.ContextStore;
import com.phonepe.memoryengine.core.store.ContextStoreSetup;
import com.phonepe.memoryengine.core.utils.TestUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link RedissonKeyValueStore}
 */
class RedissonKeyValueStoreTest extends RedisIntegrationTestBase {
    private RedissonClient redisson;
    private RedissonKeyValueStore store;

    @BeforeEach
    void setup() {
        redisson = redisson();
        store = RedissonKeyValueStore.builder()
                .redisson(redisson)
                .expiryGrace(Duration.ofSeconds(30))
                .build();
    }

    @AfterEach
    void tearDown() {
        store.close();
        redisson.shutdown();
    }

    private static String key() {
        return "test:" + UUID.randomUUID();
    }

    private static ChatMessage message(int index) {
        return ChatMessage.builder()
                .messageId("m" + index)
                .role(MessageRole.USER)
                .content("message " + index)
                .mode(Mode.AGENT)
                .timestamp(Instant.now())
                .build();
    }

    @Test
    void testSetGetDelete() {
        final var key = key();
        assertTrue(store.get(key).isEmpty());

        store.set(key, "v1", Duration.ofMinutes(1));

        assertEquals("v1", store.get(key).orElseThrow());
        assertTrue(store.delete(key));
        assertTrue(store.get(key).isEmpty());
        assertFalse(store.delete(key));
    }

    @Test
    void testCompareAndSet() {
        final var key = key();
        assertTrue(store.compareAndSet(key, null, "v1", Duration.ofMinutes(1)));
        assertFalse(store.compareAndSet(key, null, "v2", Duration.ofMinutes(1)));
        assertFalse(store.compareAndSet(key, "stale", "v2", Duration.ofMinutes(1)));
        assertTrue(store.compareAndSet(key, "v1", "v2", Duration.ofMinutes(1)));
        assertEquals("v2", store.get(key).orElseThrow());
    }

    @Test
    void testCompareAndDelete() {
        final var key = key();
        assertFalse(store.compareAndDelete(key, "v1"));
        store.set(key, "v1", Duration.ofMinutes(1));

        assertFalse(store.compareAndDelete(key, "stale"));
        assertEquals("v1", store.get(key).orElseThrow());
        assertTrue(store.compareAndDelete(key, "v1"));
        assertTrue(store.get(key).isEmpty());
        assertEquals(0, redisson.getKeys().countExists(RedissonKeyValueStore.dataKey(key),
                                                        RedissonKeyValueStore.markerKey(key)));
    }

    @Test
    void testValueAndMarkerShareHashTag() {
        final var key = key();
        assertEquals("{" + key + "}", RedissonKeyValueStore.dataKey(key));
        assertEquals("{" + key + "}:ttl", RedissonKeyValueStore.markerKey(key));

        store.set(key, "v1", Duration.ofMinutes(1));

        assertEquals("v1", redisson.getBucket(RedissonKeyValueStore.dataKey(key), StringCodec.INSTANCE).get());
        assertTrue(redisson.getBucket(RedissonKeyValueStore.markerKey(key), StringCodec.INSTANCE).isExists());
    }

    @Test
    void testExpiredValueIsHiddenAndReported() {
        final var key = key();
        final var expired = new CopyOnWriteArrayList<String>();
        store.addExpiryListener((expiredKey, lastValue) -> {
            if (expiredKey.equals(key)) {
                expired.add(lastValue);
            }
        });

        store.set(key, "last", Duration.ofMillis(300));

        await().atMost(10, TimeUnit.SECONDS).until(() -> expired.equals(List.of("last")));
        assertTrue(store.get(key).isEmpty());
        assertTrue(store.compareAndSet(key, null, "fresh", Duration.ofMinutes(1)));
    }

    @Test
    void testOnlyOneInstanceSeesExpiry() {
        final var key = key();
        final var expired = new CopyOnWriteArrayList<String>();
        try (final var other = new RedissonKeyValueStore(redisson, Duration.ofSeconds(30))) {
            store.addExpiryListener((expiredKey, lastValue) -> {
                if (expiredKey.equals(key)) {
                    expired.add("first");
                }
            });
            other.addExpiryListener((expiredKey, lastValue) -> {
                if (expiredKey.equals(key)) {
                    expired.add("second");
                }
            });

            store.set(key, "value", Duration.ofMillis(200));

            await().atMost(10, TimeUnit.SECONDS).until(() -> !expired.isEmpty());
            Uninterruptibles.sleepUninterruptibly(Duration.ofSeconds(1));
            assertEquals(1, expired.size());
        }
    }

    @Test
    void testConcurrentSessionUpdatesAreNotLost() throws Exception {
        final var contextStore = new ContextStore(store, ContextStoreSetup.builder()
                .sessionTtl(Duration.ofMinutes(5))
                .maxHistory(1000)
                .build());
        final var sessionId = UUID.randomUUID().toString();
        contextStore.create(sessionId, TestUtils.identity(), Mode.AGENT);
        final ExecutorService executorService = Executors.newFixedThreadPool(8);
        try {
            final List<Future<Session>> futures = IntStream.range(0, 20)
                    .mapToObj(i -> executorService.submit(
                            () -> contextStore.mutate(sessionId,
                                                      session -> session.appendMessages(List.of(message(i))))))
                    .toList();
            for (final var future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        }
        finally {
            executorService.shutdownNow();
        }
        assertEquals(20, contextStore.load(sessionId).orElseThrow().getMessageCount());
        assertTrue(contextStore.delete(sessionId));
    }

    @Test
    void testRemoveReturnsStateThatWasDeleted() {
        final var contextStore = new ContextStore(store, ContextStoreSetup.builder()
                .sessionTtl(Duration.ofMinutes(5))
                .build());
        final var sessionId = UUID.randomUUID().toString();
        contextStore.create(sessionId, TestUtils.identity(), Mode.AGENT);
        final var raced = new boolean[]{false};

        final var removed = contextStore.remove(sessionId, session -> {
            if (!raced[0]) {
                raced[0] = true;
                contextStore.mutate(sessionId, current -> current.appendMessages(List.of(message(1))));
            }
        });

        assertEquals(1, removed.orElseThrow().getMessageCount());
        assertTrue(contextStore.load(sessionId).isEmpty());
    }
}
