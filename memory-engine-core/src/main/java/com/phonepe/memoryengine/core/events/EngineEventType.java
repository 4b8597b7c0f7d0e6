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

package com.phonepe.memoryengine.core.events;

import lombok.Getter;
import lombok.experimental.UtilityClass;

/**
 * Types of events published on the {@link EventBus}
 */
@Getter
public enum EngineEventType {
    SESSION_CREATED(Values.SESSION_CREATED),
    SESSION_DELETED(Values.SESSION_DELETED),
    SESSION_EXPIRED(Values.SESSION_EXPIRED),
    MODE_SWITCHED(Values.MODE_SWITCHED),
    MEMORY_DEGRADED(Values.MEMORY_DEGRADED),
    CONSOLIDATION_SUCCEEDED(Values.CONSOLIDATION_SUCCEEDED),
    CONSOLIDATION_FAILED(Values.CONSOLIDATION_FAILED),
    ;

    private final String type;

    EngineEventType(String type) {
        this.type = type;
    }

    @UtilityClass
    public static final class Values {
        public static final String SESSION_CREATED = "SESSION_CREATED";
        public static final String SESSION_DELETED = "SESSION_DELETED";
        public static final String SESSION_EXPIRED = "SESSION_EXPIRED";
        public static final String MODE_SWITCHED = "MODE_SWITCHED";
        public static final String MEMORY_DEGRADED = "MEMORY_DEGRADED";
        public static final String CONSOLIDATION_SUCCEEDED = "CONSOLIDATION_SUCCEEDED";
        public static final String CONSOLIDATION_FAILED = "CONSOLIDATION_FAILED";
    }
}
