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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SentenceChunker}
 */
class SentenceChunkerTest {

    @Test
    void testChunksJoinBackToOriginal() {
        final var text = "Open the HR portal. Choose your dates!  Then submit the request for approval, and wait "
                + "for your manager to respond.\nDone?";
        for (final var size : List.of(5, 10, 20, 50, 500)) {
            final var chunks = SentenceChunker.chunk(text, size);
            assertEquals(text, String.join("", chunks), "size " + size);
            assertTrue(chunks.stream().allMatch(chunk -> chunk.length() <= size), "size " + size);
            assertTrue(chunks.stream().noneMatch(String::isEmpty));
        }
    }

    @Test
    void testBreaksAfterSentence() {
        final var chunks = SentenceChunker.chunk("First sentence here. Second one follows.", 30);
        assertEquals(List.of("First sentence here. ", "Second one follows."), chunks);
    }

    @Test
    void testLongWordIsCut() {
        final var chunks = SentenceChunker.chunk("supercalifragilistic word", 8);
        assertEquals(List.of("supercal", "ifragili", "stic ", "word"), chunks);
    }

    @Test
    void testEmptyText() {
        assertTrue(SentenceChunker.chunk("", 10).isEmpty());
    }
}
