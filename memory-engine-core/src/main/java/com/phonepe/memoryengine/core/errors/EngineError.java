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

import com.phonepe.memoryengine.core.utils.EngineUtils;
import lombok.Value;

/**
 * An error attached to an engine result
 */
@Value
public class EngineError {
    ErrorType errorType;
    String message;

    public static EngineError success() {
        return new EngineError(ErrorType.SUCCESS, ErrorType.SUCCESS.getMessage());
    }

    public static EngineError error(ErrorType errorType, Object... args) {
        return new EngineError(errorType, String.format(errorType.getMessage(), args));
    }

    public static EngineError error(ErrorType errorType, Throwable throwable) {
        return EngineError.error(errorType, EngineUtils.rootCause(throwable).getMessage());
    }

    public boolean isRetryable() {
        return errorType.isRetryable();
    }
}
