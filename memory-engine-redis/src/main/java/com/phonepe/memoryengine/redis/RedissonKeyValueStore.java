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

import com.phonepe.memoryengine.core.store.ExpiryListener;
import com.phonepe.memoryengine.core.store.KeyValueStore;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RPatternTopic;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.api.listener.PatternMessageListener;
import org.redisson.client.codec.StringCodec;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.phonepe.memoryengine.core.utils.EngineUtils.rootCause;

/**
 * {@link KeyValueStore} on Redis, shared by every engine instance.
 * <p>
 * Each key is stored as {@code {<key>}} together with a marker key {@code {<key>}:ttl} carrying the real time to
 * live. The braces are a hash tag, so both land in the same cluster slot and the scripts touching them work on a
 * Redis cluster. The value itself lives a grace period longer. When Redis expires the marker, the keyspace notification is used to read the
 * value one last time and hand it to expiry listeners. Reading and deleting the value is a single script, so only
 * one instance sees each expiry. Keyspace notifications for expired keys must be enabled on the server
 * ({@code notify-keyspace-events Ex}).
 */
@Slf4j
public class RedissonKeyValueStore implements KeyValueStore, AutoCloseable {
    public static final String MARKER_SUFFIX = "}:ttl";
    public static final Duration DEFAULT_EXPIRY_GRACE = Duration.ofMinutes(5);
    public static final String EXPIRED_KEY_EVENTS = "__keyevent@*__:expired";

    private static final String GET_SCRIPT = """
            if redis.call('exists', KEYS[2]) == 1 then
                return redis.call('get', KEYS[1])
            end
            return false
            """;
    private static final String SET_SCRIPT = """
            redis.call('set', KEYS[1], ARGV[1], 'PX', ARGV[3])
            redis.call('set', KEYS[2], '1', 'PX', ARGV[2])
            return 1
            """;
    private static final String CAS_SCRIPT = """
            local current = false
            if redis.call('exists', KEYS[2]) == 1 then
                current = redis.call('get', KEYS[1])
            end
            if ARGV[1] == '0' then
                if current then
                    return 0
                end
            elseif current ~= ARGV[2] then
                return 0
            end
            redis.call('set', KEYS[1], ARGV[3], 'PX', ARGV[5])
            redis.call('set', KEYS[2], '1', 'PX', ARGV[4])
            return 1
            """;
    private static final String DELETE_SCRIPT = """
            local live = redis.call('exists', KEYS[2])
            redis.call('del', KEYS[1], KEYS[2])
            return live
            """;
    private static final String COMPARE_AND_DELETE_SCRIPT = """
            if redis.call('exists', KEYS[2]) == 0 then
                return 0
            end
            if redis.call('get', KEYS[1]) ~= ARGV[1] then
                return 0
            end
            redis.call('del', KEYS[1], KEYS[2])
            return 1
            """;
    private static final String CLAIM_EXPIRED_SCRIPT = """
            if redis.call('exists', KEYS[2]) == 1 then
                return false
            end
            local value = redis.call('get', KEYS[1])
            if value then
                redis.call('del', KEYS[1])
            end
            return value
            """;

    private final RedissonClient redisson;
    private final Duration expiryGrace;
    private final List<ExpiryListener> listeners = new CopyOnWriteArrayList<>();
    private final RPatternTopic expiryTopic;
    private final int expiryListenerId;

    /**
     * @param redisson    Redis client
     * @param expiryGrace How long a value outlives its marker so it can be handed to expiry listeners
     */
    @Builder
    public RedissonKeyValueStore(@NonNull RedissonClient redisson, Duration expiryGrace) {
        this.redisson = redisson;
        this.expiryGrace = Objects.requireNonNullElse(expiryGrace, DEFAULT_EXPIRY_GRACE);
        this.expiryTopic = redisson.getPatternTopic(EXPIRED_KEY_EVENTS, StringCodec.INSTANCE);
        this.expiryListenerId = expiryTopic.addListener(String.class, new PatternMessageListener<String>() {
            @Override
            public void onMessage(CharSequence pattern, CharSequence channel, String expiredKey) {
                onKeyExpired(expiredKey);
            }
        });
    }

    /**
     * @return Redis key holding the value of {@code key}
     */
    public static String dataKey(final String key) {
        return "{" + key + "}";
    }

    /**
     * @return Redis key whose expiry marks the expiry of {@code key}
     */
    public static String markerKey(final String key) {
        return "{" + key + MARKER_SUFFIX;
    }

    @Override
    public Optional<String> get(String key) {
        final String value = script().eval(RScript.Mode.READ_ONLY,
                                           GET_SCRIPT,
                                           RScript.ReturnType.VALUE,
                                           keys(key));
        return Optional.ofNullable(value);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        script().eval(RScript.Mode.READ_WRITE,
                      SET_SCRIPT,
                      RScript.ReturnType.INTEGER,
                      keys(key),
                      value,
                      millis(ttl),
                      millis(ttl.plus(expiryGrace)));
    }

    @Override
    public boolean compareAndSet(String key, String expected, String update, Duration ttl) {
        final Long replaced = script().eval(RScript.Mode.READ_WRITE,
                                            CAS_SCRIPT,
                                            RScript.ReturnType.INTEGER,
                                            keys(key),
                                            null == expected ? "0" : "1",
                                            Objects.requireNonNullElse(expected, ""),
                                            update,
                                            millis(ttl),
                                            millis(ttl.plus(expiryGrace)));
        return null != replaced && replaced == 1L;
    }

    @Override
    public boolean delete(String key) {
        final Long existed = script().eval(RScript.Mode.READ_WRITE,
                                           DELETE_SCRIPT,
                                           RScript.ReturnType.INTEGER,
                                           keys(key));
        return null != existed && existed == 1L;
    }

    @Override
    public boolean compareAndDelete(String key, String expected) {
        final Long deleted = script().eval(RScript.Mode.READ_WRITE,
                                           COMPARE_AND_DELETE_SCRIPT,
                                           RScript.ReturnType.INTEGER,
                                           keys(key),
                                           expected);
        return null != deleted && deleted == 1L;
    }

    @Override
    public void addExpiryListener(ExpiryListener listener) {
        listeners.add(listener);
    }

    @Override
    public void close() {
        expiryTopic.removeListener(expiryListenerId);
    }

    void onKeyExpired(final String expiredKey) {
        if (null == expiredKey || !expiredKey.startsWith("{") || !expiredKey.endsWith(MARKER_SUFFIX)) {
            return;
        }
        final var key = expiredKey.substring(1, expiredKey.length() - MARKER_SUFFIX.length());
        final String lastValue;
        try {
            lastValue = script().eval(RScript.Mode.READ_WRITE,
                                      CLAIM_EXPIRED_SCRIPT,
                                      RScript.ReturnType.VALUE,
                                      keys(key));
        }
        catch (Exception e) {
            log.error("Could not read last value of expired key {}. Error: {}", key, rootCause(e).getMessage(), e);
            return;
        }
        if (null == lastValue) {
            log.debug("Expiry of {} was handled elsewhere or the key was rewritten", key);
            return;
        }
        log.debug("Key {} expired", key);
        listeners.forEach(listener -> {
            try {
                listener.expired(key, lastValue);
            }
            catch (Exception e) {
                log.error("Expiry listener failed for key {}. Error: {}", key, rootCause(e).getMessage(), e);
            }
        });
    }

    private RScript script() {
        return redisson.getScript(StringCodec.INSTANCE);
    }

    private static List<Object> keys(final String key) {
        return List.of(dataKey(key), markerKey(key));
    }

    private static String millis(final Duration duration) {
        return Long.toString(Math.max(1, duration.toMillis()));
    }
}
