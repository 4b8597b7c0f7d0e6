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

package com.phonepe.memoryengine.core.retry;

import com.phonepe.memoryengine.core.errors.ErrorType;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configuration for retry with exponential backoff
 */
@Value
@With
public class RetrySetup {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(500);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(10);
    public static final double DEFAULT_DELAY_FACTOR = 2.0;
    public static final Set<ErrorType> DEFAULT_RETRYABLE_ERROR_TYPES = Arrays.stream(ErrorType.values())
            .filter(ErrorType::isRetryable)
            .collect(Collectors.toUnmodifiableSet());
    public static final RetrySetup DEFAULT = RetrySetup.builder().build();

    /**
     * Number of attempts to stop after if calls keep failing. Includes the first attempt.
     */
    int maxAttempts;

    /**
     * Time to wait after the first failure
     */
    Duration initialDelay;

    /**
     * Upper bound on the wait between attempts
     */
    Duration maxDelay;

    /**
     * Multiplier applied to the wait after each failure
     */
    double delayFactor;

    /**
     * By default, we use {@link ErrorType#isRetryable()} to determine if an error can be retried. If this set is
     * provided, we use that to retry instead.
     */
    Set<ErrorType> retriableErrorTypes;

    @Builder
    @Jacksonized
    public RetrySetup(
            int maxAttempts,
            Duration initialDelay,
            Duration maxDelay,
            double delayFactor,
            Set<ErrorType> retriableErrorTypes) {
        this.maxAttempts = maxAttempts <= 0 ? DEFAULT_MAX_ATTEMPTS : maxAttempts;
        this.initialDelay = Objects.requireNonNullElse(initialDelay, DEFAULT_INITIAL_DELAY);
        final var max = Objects.requireNonNullElse(maxDelay, DEFAULT_MAX_DELAY);
        this.maxDelay = max.compareTo(this.initialDelay) > 0 ? max : this.initialDelay.plusMillis(1);
        this.delayFactor = delayFactor <= 1.0 ? DEFAULT_DELAY_FACTOR : delayFactor;
        this.retriableErrorTypes = Objects.requireNonNullElse(retriableErrorTypes, DEFAULT_RETRYABLE_ERROR_TYPES);
    }
}
