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

package com.phonepe.memoryengine.core.streaming;

import com.phonepe.memoryengine.core.errors.EngineError;
import com.phonepe.memoryengine.core.generation.GeneratedResponse;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * How a stream ended and what it produced
 */
@Value
@Builder
public class StreamOutcome {
    public enum Status {
        COMPLETED,
        CANCELLED,
        FAILED,
    }

    @NonNull
    Status status;
    /**
     * Concatenation of every chunk delivered
     */
    @NonNull
    String text;
    int chunks;
    /**
     * Final generator response. Null unless the generator finished.
     */
    GeneratedResponse response;
    EngineError error;

    /**
     * Whether the text is less than the full response
     */
    public boolean isPartial() {
        return status != Status.COMPLETED;
    }
}
