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

package com.phonepe.memoryengine.core.consolidation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.memoryengine.core.store.KeyValueStore;
import com.phonepe.memoryengine.core.utils.JsonUtils;
import lombok.NonNull;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps job records as JSON in the shared {@link KeyValueStore}, next to the sessions
 */
public class KeyValueConsolidationJobStore implements ConsolidationJobStore {
    public static final String KEY_PREFIX = "chat:consolidation-job:";

    private final KeyValueStore keyValueStore;
    private final Duration retention;
    private final ObjectMapper mapper;

    public KeyValueConsolidationJobStore(@NonNull KeyValueStore keyValueStore, Duration retention) {
        this(keyValueStore, retention, null);
    }

    public KeyValueConsolidationJobStore(
            @NonNull KeyValueStore keyValueStore,
            Duration retention,
            ObjectMapper mapper) {
        this.keyValueStore = keyValueStore;
        this.retention = Objects.requireNonNullElse(retention, ConsolidationSetup.DEFAULT_JOB_RETENTION);
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
    }

    public static String key(final String jobId) {
        return KEY_PREFIX + jobId;
    }

    @Override
    public void save(@NonNull ConsolidationJob job) {
        keyValueStore.set(key(job.getJobId()), JsonUtils.write(mapper, job), retention);
    }

    @Override
    public Optional<ConsolidationJob> get(@NonNull String jobId) {
        return keyValueStore.get(key(jobId))
                .map(value -> JsonUtils.read(mapper, value, ConsolidationJob.class));
    }
}
