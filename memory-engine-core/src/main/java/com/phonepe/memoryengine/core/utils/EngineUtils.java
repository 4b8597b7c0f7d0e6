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

package com.phonepe.memoryengine.core.utils;

import com.google.common.base.Strings;
import com.google.common.hash.Hashing;
import com.phonepe.memoryengine.core.errors.EngineException;
import lombok.experimental.UtilityClass;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

/**
 * Small helpers shared across the engine.
 */
@UtilityClass
public class EngineUtils {

    public static Throwable rootCause(final Throwable leaf) {
        Throwable cause = leaf;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Outermost {@link EngineException} in the cause chain, if any
     */
    public static Optional<EngineException> engineException(final Throwable leaf) {
        Throwable cause = leaf;
        while (cause != null) {
            if (cause instanceof EngineException engineException) {
                return Optional.of(engineException);
            }
            cause = cause.getCause() == cause ? null : cause.getCause();
        }
        return Optional.empty();
    }

    /**
     * Lowercase, trim and collapse every run of characters that are not letters or digits into a single dash.
     */
    public static String slug(final String input) {
        if (Strings.isNullOrEmpty(input)) {
            return "";
        }
        return input.trim()
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^\\p{L}\\p{N}]+", "-")
                .replaceAll("(^-+)|(-+$)", "");
    }

    public static String sha256(final String input) {
        return Hashing.sha256().hashString(Strings.nullToEmpty(input), StandardCharsets.UTF_8).toString();
    }

    public static String truncate(final String input, int maxLength) {
        final var value = Strings.nullToEmpty(input);
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }
}
