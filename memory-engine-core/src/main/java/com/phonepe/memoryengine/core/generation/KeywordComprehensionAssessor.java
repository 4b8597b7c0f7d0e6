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

import com.google.common.base.Strings;

import java.util.List;
import java.util.Locale;

/**
 * Phrase matching comprehension assessor. Confusion phrases win over understanding phrases; a long question with
 * neither is read as comprehension since it builds on what was explained.
 */
public class KeywordComprehensionAssessor implements ComprehensionAssessor {
    static final List<String> CONFUSION_PHRASES = List.of(
            "i don't understand",
            "i do not understand",
            "confused",
            "what does that mean",
            "can you explain",
            "i'm lost",
            "too complex",
            "simpler");
    static final List<String> UNDERSTANDING_PHRASES = List.of(
            "i see",
            "that makes sense",
            "makes sense",
            "i understand",
            "got it",
            "what about",
            "how does this relate to",
            "advanced");
    static final int LONG_QUESTION_WORDS = 10;

    @Override
    public ComprehensionSignal assess(String userMessage) {
        final var message = Strings.nullToEmpty(userMessage).toLowerCase(Locale.ROOT);
        if (CONFUSION_PHRASES.stream().anyMatch(message::contains)) {
            return ComprehensionSignal.CONFUSED;
        }
        if (UNDERSTANDING_PHRASES.stream().anyMatch(message::contains)) {
            return ComprehensionSignal.COMPREHENDED;
        }
        if (message.contains("?") && message.trim().split("\\s+").length >= LONG_QUESTION_WORDS) {
            return ComprehensionSignal.COMPREHENDED;
        }
        return ComprehensionSignal.NEUTRAL;
    }
}
