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

package com.phonepe.memoryengine.core.generation;

import lombok.NonNull;
import lombok.Value;

import java.util.Objects;

/**
 * Complete output of a generation call
 */
@Value
public class GeneratedResponse {
    @NonNull
    String text;
    @NonNull
    ComprehensionSignal comprehension;

    public GeneratedResponse(@NonNull String text, ComprehensionSignal comprehension) {
        this.text = text;
        this.comprehension = Objects.requireNonNullElse(comprehension, ComprehensionSignal.NEUTRAL);
    }

    public static GeneratedResponse of(final String text) {
        return new GeneratedResponse(text, ComprehensionSignal.NEUTRAL);
    }
}
