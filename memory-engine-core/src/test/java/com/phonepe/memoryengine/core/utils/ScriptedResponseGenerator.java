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

package com.phonepe.memoryengine.core.utils;

import com.phonepe.memoryengine.core.errors.EngineException;
import com.phonepe.memoryengine.core.errors.ErrorType;
import com.phonepe.memoryengine.core.generation.ChunkSink;
import com.phonepe.memoryengine.core.generation.ComprehensionSignal;
import com.phonepe.memoryengine.core.generation.GeneratedResponse;
import com.phonepe.memoryengine.core.generation.PromptContext;
import com.phonepe.memoryengine.core.generation.ResponseGenerator;
import com.google.common.util.concurrent.Uninterruptibles;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Response generator that answers with a fixed text. Streams it in fixed size pieces and can be told to fail or to
 * stop producing after a number of chunks.
 */
@Setter
@Accessors(chain = true, fluent = true)
public class ScriptedResponseGenerator implements ResponseGenerator {
    private final ExecutorService executorService = Executors.newCachedThreadPool();
    private final CountDownLatch release = new CountDownLatch(1);

    private String text;
    private ComprehensionSignal comprehension = ComprehensionSignal.NEUTRAL;
    private int streamChunkSize = 10;
    private Duration chunkDelay = Duration.ZERO;
    private boolean failGenerate;
    private boolean failStreaming;
    /**
     * Hold the stream after this many chunks until {@link #release()} is called. Negative means never.
     */
    private int holdAfterChunks = -1;

    @Getter
    private final AtomicInteger generateCalls = new AtomicInteger();
    @Getter
    private final AtomicInteger streamCalls = new AtomicInteger();
    /**
     * Chunks the sink refused, after which the generator stopped
     */
    @Getter
    private final AtomicInteger refusedChunks = new AtomicInteger();
    @Getter
    private final List<PromptContext> prompts = new CopyOnWriteArrayList<>();

    public ScriptedResponseGenerator(String text) {
        this.text = text;
    }

    public void release() {
        release.countDown();
    }

    @Override
    public GeneratedResponse generate(PromptContext context) {
        generateCalls.incrementAndGet();
        prompts.add(context);
        if (failGenerate) {
            throw EngineException.of(ErrorType.GENERATION_FAILURE, "scripted failure");
        }
        return new GeneratedResponse(text, comprehension);
    }

    @Override
    public CompletableFuture<GeneratedResponse> generateStream(PromptContext context, ChunkSink sink) {
        streamCalls.incrementAndGet();
        prompts.add(context);
        return CompletableFuture.supplyAsync(() -> {
            if (failStreaming) {
                throw EngineException.of(ErrorType.GENERATION_FAILURE, "scripted stream failure");
            }
            int emitted = 0;
            for (int start = 0; start < text.length(); start += streamChunkSize) {
                if (emitted == holdAfterChunks) {
                    Uninterruptibles.awaitUninterruptibly(release);
                }
                if (!chunkDelay.isZero()) {
                    Uninterruptibles.sleepUninterruptibly(chunkDelay);
                }
                if (!sink.accept(text.substring(start, Math.min(text.length(), start + streamChunkSize)))) {
                    refusedChunks.incrementAndGet();
                    break;
                }
                emitted++;
            }
            return new GeneratedResponse(text, comprehension);
        }, executorService);
    }
}
