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

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into chunks of at most {@code chunkSize} characters, preferring to break after a sentence. Joining
 * the chunks gives back the original text exactly.
 */
@UtilityClass
public class SentenceChunker {

    public static List<String> chunk(final String text, int chunkSize) {
        if (text.isEmpty()) {
            return List.of();
        }
        //Each token is a word with the whitespace that follows it
        final var tokens = text.split("(?<=\\s)(?=\\S)");
        final var chunks = new ArrayList<String>();
        final var current = new StringBuilder();
        for (final var token : tokens) {
            if (!current.isEmpty() && current.length() + token.length() > chunkSize) {
                chunks.add(current.toString());
                current.setLength(0);
            }
            if (token.length() > chunkSize) {
                //Words longer than a chunk are cut
                int start = 0;
                while (token.length() - start > chunkSize) {
                    chunks.add(token.substring(start, start + chunkSize));
                    start += chunkSize;
                }
                current.append(token, start, token.length());
                continue;
            }
            current.append(token);
            if (endsSentence(token) && current.length() >= chunkSize / 2) {
                chunks.add(current.toString());
                current.setLength(0);
            }
        }
        if (!current.isEmpty()) {
            chunks.add(current.toString());
        }
        return List.copyOf(chunks);
    }

    private static boolean endsSentence(final String token) {
        final var trimmed = token.stripTrailing();
        return !trimmed.isEmpty() && ".!?".indexOf(trimmed.charAt(trimmed.length() - 1)) >= 0;
    }
}
