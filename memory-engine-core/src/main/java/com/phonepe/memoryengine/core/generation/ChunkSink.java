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

package com.phonepe.memoryengine.core.generation;

/**
 * Receives chunks from a streaming {@link ResponseGenerator}
 */
@FunctionalInterface
public interface ChunkSink {
    /**
     * @param chunk Next piece of generated text
     * @return false if the consumer has gone away and generation should stop
     */
    boolean accept(String chunk);
}
