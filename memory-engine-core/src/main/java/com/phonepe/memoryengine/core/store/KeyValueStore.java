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

import java.time.Duration;
import java.util.Optional;

/**
 * A shared, expiring string key-value store. Every instance of the engine talks to the same store, so any
 * instance can serve any session.
 */
public interface KeyValueStore {

    /**
     * @return Value for the key, or empty if absent or expired
     */
    Optional<String> get(String key);

    /**
     * Unconditionally set a value
     *
     * @param ttl Time after which the store drops the key
     */
    void set(String key, String value, Duration ttl);

    /**
     * Atomically replace the value of a key if it currently holds {@code expected}.
     *
     * @param expected Value the key must hold. {@code null} means the key must be absent.
     * @param update   New value
     * @param ttl      New time to live for the key
     * @return true if the value was replaced
     */
    boolean compareAndSet(String key, String expected, String update, Duration ttl);

    /**
     * @return true if the key existed
     */
    boolean delete(String key);

    /**
     * Atomically delete a key if it currently holds {@code expected}
     *
     * @return true if the key was deleted
     */
    boolean compareAndDelete(String key, String expected);

    /**
     * Register a listener called when a key expires. Stores that cannot observe expiry ignore the listener.
     */
    default void addExpiryListener(ExpiryListener listener) {
        //Nothing to do by default
    }
}
