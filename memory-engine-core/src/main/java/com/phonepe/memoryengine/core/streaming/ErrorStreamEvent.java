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

import com.phonepe.memoryengine.core.errors.ErrorType;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * The stream could not be completed normally. Always followed by a {@link CompleteStreamEvent}.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ErrorStreamEvent extends StreamEvent {
    ErrorType errorType;
    String message;

    @Builder
    @Jacksonized
    public ErrorStreamEvent(@NonNull String sessionId, @NonNull ErrorType errorType, String message) {
        super(StreamEventType.ERROR, sessionId);
        this.errorType = errorType;
        this.message = message;
    }

    @Override
    public <T> T accept(StreamEventVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
