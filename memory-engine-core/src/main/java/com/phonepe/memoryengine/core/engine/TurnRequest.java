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

package com.phonepe.memoryengine.core.engine;

import com.phonepe.memoryengine.core.model.Identity;
import com.phonepe.memoryengine.core.model.Mode;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One user message to the engine
 */
@Value
@Builder
@Jacksonized
public class TurnRequest {
    /**
     * Session to continue. A new session is created when absent or unknown.
     */
    String sessionId;
    @NonNull
    Identity identity;
    @NonNull
    String message;
    /**
     * Mode for a new session. For an existing session a different mode is an explicit switch.
     */
    Mode mode;
    /**
     * Learning topic to set in tutor mode
     */
    String learningTopic;
}
