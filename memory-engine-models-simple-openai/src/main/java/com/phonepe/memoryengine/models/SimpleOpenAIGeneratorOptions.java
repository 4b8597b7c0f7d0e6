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

package com.phonepe.memoryengine.models;

import lombok.Builder;
import lombok.Value;

/**
 * Request settings for {@link SimpleOpenAIResponseGenerator}
 */
@Value
public class SimpleOpenAIGeneratorOptions {
    public static final int DEFAULT_MAX_HISTORY_MESSAGES = 20;
    public static final SimpleOpenAIGeneratorOptions DEFAULT = SimpleOpenAIGeneratorOptions.builder().build();

    /**
     * Sampling temperature, model default when null
     */
    Double temperature;
    /**
     * Cap on completion tokens, model default when null
     */
    Integer maxTokens;
    /**
     * Most recent history messages sent with each request
     */
    int maxHistoryMessages;

    @Builder
    public SimpleOpenAIGeneratorOptions(Double temperature, Integer maxTokens, int maxHistoryMessages) {
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.maxHistoryMessages = maxHistoryMessages <= 0 ? DEFAULT_MAX_HISTORY_MESSAGES : maxHistoryMessages;
    }
}
