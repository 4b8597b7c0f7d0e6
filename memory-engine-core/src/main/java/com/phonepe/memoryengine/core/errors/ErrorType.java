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

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Kinds of failure the engine reports. Each carries a message format and whether a caller may retry.
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    SUCCESS("Success", false),
    MEMORY_UNAVAILABLE("No memory realm could be searched. Unavailable realms: %s", true),
    PARTIAL_MEMORY("Some memory realms were unavailable: %s", true),
    MEMORY_CLIENT_FAILURE("Memory client call failed: %s", true),
    MEMORY_CLIENT_REJECTED("Memory client rejected the request: %s", false),
    SESSION_CONFLICT("Could not update session %s after %d attempts due to concurrent writers", true),
    SESSION_NOT_FOUND("Session %s not found", false),
    SESSION_ALREADY_EXISTS("Session %s already exists", false),
    SESSION_ACCESS_DENIED("Session %s does not belong to client %s", false),
    NOT_IN_TUTOR_MODE("Session %s is in %s mode, not tutor mode", false),
    GENERATION_TIMEOUT("Response generation stalled for more than %s", true),
    GENERATION_FAILURE("Response generation failed: %s", true),
    CONSOLIDATION_FAILED_PERMANENT("Consolidation job %s failed permanently after %d attempts: %s", false),
    SERIALIZATION_ERROR("Error serializing object to JSON. Error: %s", false),
    DESERIALIZATION_ERROR("Error deserializing object from JSON. Error: %s", false),
    INVALID_REQUEST("Invalid request: %s", false),
    ;

    private final String message;
    private final boolean retryable;
}
