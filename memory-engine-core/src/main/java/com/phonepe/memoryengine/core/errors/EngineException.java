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

package com.phonepe.memoryengine.core.errors;

import lombok.Getter;

/**
 * Thrown when a failure has to be surfaced to the caller of the engine. The attached {@link EngineError} tells
 * the caller what happened and whether the operation can be retried.
 */
@Getter
public class EngineException extends RuntimeException {
    private final transient EngineError error;

    public EngineException(EngineError error) {
        super(error.getMessage());
        this.error = error;
    }

    public EngineException(EngineError error, Throwable cause) {
        super(error.getMessage(), cause);
        this.error = error;
    }

    public static EngineException of(ErrorType errorType, Object... args) {
        return new EngineException(EngineError.error(errorType, args));
    }

    public ErrorType getErrorType() {
        return error.getErrorType();
    }

    public boolean isRetryable() {
        return error.isRetryable();
    }
}
