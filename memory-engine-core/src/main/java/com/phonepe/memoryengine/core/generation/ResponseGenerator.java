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

import java.util.concurrent.CompletableFuture;

/**
 * The language model side of a turn. Implementations report a best effort comprehension signal with each response;
 * tutor mode uses it to move the user's understanding level.
 */
public interface ResponseGenerator {

    /**
     * Generate the complete response in one call
     *
     * @throws com.phonepe.memoryengine.core.errors.EngineException if the generator is unavailable
     */
    GeneratedResponse generate(PromptContext context);

    /**
     * Generate the response incrementally. Chunks are pushed to the sink in order. Implementations should stop
     * generating when the sink returns false. The default implementation generates the full response and emits it
     * as a single chunk.
     *
     * @return Future completing with the full response once generation ends
     */
    default CompletableFuture<GeneratedResponse> generateStream(PromptContext context, ChunkSink sink) {
        return CompletableFuture.supplyAsync(() -> {
            final var response = generate(context);
            sink.accept(response.getText());
            return response;
        });
    }
}
