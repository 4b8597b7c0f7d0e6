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

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.Objects;

/**
 * Timeouts and chunking for {@link StreamingResponsePipeline}
 */
@Value
@With
public class StreamingSetup {
    public static final Duration DEFAULT_STALL_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_CHUNK_SIZE = 50;
    public static final StreamingSetup DEFAULT = StreamingSetup.builder().build();

    /**
     * Longest time the generator may go without producing a chunk
     */
    Duration stallTimeout;
    /**
     * Target size of chunks made from responses that are not generated incrementally
     */
    int chunkSize;
    /**
     * Pause between chunks of such responses
     */
    Duration chunkDelay;

    @Builder
    @Jacksonized
    public StreamingSetup(Duration stallTimeout, int chunkSize, Duration chunkDelay) {
        this.stallTimeout = Objects.requireNonNullElse(stallTimeout, DEFAULT_STALL_TIMEOUT);
        this.chunkSize = chunkSize <= 0 ? DEFAULT_CHUNK_SIZE : chunkSize;
        this.chunkDelay = Objects.requireNonNullElse(chunkDelay, Duration.ZERO);
    }
}
