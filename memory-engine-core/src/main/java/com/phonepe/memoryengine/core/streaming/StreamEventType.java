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

import lombok.Getter;
import lombok.experimental.UtilityClass;

/**
 * Kinds of events on a response stream
 */
@Getter
public enum StreamEventType {
    METADATA(Values.METADATA),
    STATUS(Values.STATUS),
    CHUNK(Values.CHUNK),
    ERROR(Values.ERROR),
    COMPLETE(Values.COMPLETE),
    ;

    private final String type;

    StreamEventType(String type) {
        this.type = type;
    }

    @UtilityClass
    public static final class Values {
        public static final String METADATA = "METADATA";
        public static final String STATUS = "STATUS";
        public static final String CHUNK = "CHUNK";
        public static final String ERROR = "ERROR";
        public static final String COMPLETE = "COMPLETE";
    }
}
