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

import com.phonepe.memoryengine.core.errors.EngineException;
import dev.failsafe.RetryPolicy;
import dev.failsafe.RetryPolicyBuilder;
import lombok.experimental.UtilityClass;

import static com.phonepe.memoryengine.core.utils.EngineUtils.engineException;

/**
 * Builds Failsafe retry policies from a {@link RetrySetup}
 */
@UtilityClass
public class RetryPolicies {

    /**
     * Retries {@link EngineException}s whose error type the setup considers retriable. Anything else fails
     * immediately.
     */
    public static <T> RetryPolicy<T> exponential(final RetrySetup setup) {
        return RetryPolicies.<T>exponentialBuilder(setup).build();
    }

    /**
     * Same as {@link #exponential(RetrySetup)}, left open for listeners to be added
     */
    public static <T> RetryPolicyBuilder<T> exponentialBuilder(final RetrySetup setup) {
        return RetryPolicy.<T>builder()
                .withMaxAttempts(setup.getMaxAttempts())
                .withBackoff(setup.getInitialDelay(), setup.getMaxDelay(), setup.getDelayFactor())
                .handleIf(error -> isRetriable(setup, error));
    }

    public static boolean isRetriable(final RetrySetup setup, final Throwable error) {
        return engineException(error)
                .map(e -> setup.getRetriableErrorTypes().contains(e.getErrorType()))
                .orElse(false);
    }
}
