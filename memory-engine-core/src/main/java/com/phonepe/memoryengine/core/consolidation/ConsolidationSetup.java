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

import com.phonepe.memoryengine.core.retry.RetrySetup;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for {@link ConsolidationPipeline}
 */
@Value
@With
public class ConsolidationSetup {
    public static final int DEFAULT_WORKERS = 4;
    public static final int DEFAULT_QUEUE_CAPACITY = 1_000;
    public static final int DEFAULT_WINDOW = 10;
    public static final double DEFAULT_SUCCESS_THRESHOLD = 0.7;
    public static final Duration DEFAULT_JOB_RETENTION = Duration.ofDays(7);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);
    public static final ConsolidationSetup DEFAULT = ConsolidationSetup.builder().build();

    /**
     * Number of worker threads running jobs
     */
    int workers;
    /**
     * Jobs that can wait for a worker. Submissions beyond this fail permanently right away.
     */
    int queueCapacity;
    /**
     * Number of unconsolidated messages in a session that triggers consolidation
     */
    int window;
    /**
     * Extracted patterns scoring below this are not written to memory
     */
    double successThreshold;
    /**
     * How long job records are kept
     */
    Duration jobRetention;
    /**
     * How long {@link ConsolidationPipeline#close()} waits for running jobs
     */
    Duration shutdownTimeout;
    RetrySetup retrySetup;

    @Builder
    @Jacksonized
    public ConsolidationSetup(
            int workers,
            int queueCapacity,
            int window,
            double successThreshold,
            Duration jobRetention,
            Duration shutdownTimeout,
            RetrySetup retrySetup) {
        this.workers = workers <= 0 ? DEFAULT_WORKERS : workers;
        this.queueCapacity = queueCapacity <= 0 ? DEFAULT_QUEUE_CAPACITY : queueCapacity;
        this.window = window <= 0 ? DEFAULT_WINDOW : window;
        this.successThreshold = successThreshold <= 0 ? DEFAULT_SUCCESS_THRESHOLD : successThreshold;
        this.jobRetention = Objects.requireNonNullElse(jobRetention, DEFAULT_JOB_RETENTION);
        this.shutdownTimeout = Objects.requireNonNullElse(shutdownTimeout, DEFAULT_SHUTDOWN_TIMEOUT);
        this.retrySetup = Objects.requireNonNullElse(retrySetup, RetrySetup.DEFAULT);
    }
}
