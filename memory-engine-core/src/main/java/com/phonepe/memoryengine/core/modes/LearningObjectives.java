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

package com.phonepe.memoryengine.core.modes;

import com.google.common.base.Strings;
import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Picks a learning topic and objective out of free text
 */
@UtilityClass
public class LearningObjectives {
    private record ObjectivePattern(Pattern pattern, String objectiveFormat) {
    }

    private static final List<ObjectivePattern> PATTERNS = List.of(
            new ObjectivePattern(pattern("how do i"), "Learn to %s"),
            new ObjectivePattern(pattern("how to"), "Learn to %s"),
            new ObjectivePattern(pattern("what is"), "Understand %s"),
            new ObjectivePattern(pattern("what are"), "Understand %s"),
            new ObjectivePattern(pattern("when should i"), "Learn when to apply %s"),
            new ObjectivePattern(pattern("when should"), "Learn when to apply %s"),
            new ObjectivePattern(pattern("teach me about"), "Learn about %s"),
            new ObjectivePattern(pattern("teach me"), "Learn %s"),
            new ObjectivePattern(pattern("i want to learn about"), "Learn about %s"),
            new ObjectivePattern(pattern("i want to learn"), "Learn %s"),
            new ObjectivePattern(pattern("why"), "Understand reasoning behind %s"));

    private static Pattern pattern(final String lead) {
        return Pattern.compile("(?i)\\b" + Pattern.quote(lead) + "\\b\\s+(.+)");
    }

    /**
     * @return Topic named in the message, if the message reads like a learning request
     */
    public static Optional<String> topic(final String message) {
        return match(message).map(Match::subject);
    }

    /**
     * Objective for this turn. Falls back to deepening the current topic when the message names none.
     */
    public static String objective(final String message, final String currentTopic) {
        return match(message)
                .map(match -> match.pattern().objectiveFormat().formatted(match.subject()))
                .orElseGet(() -> Strings.isNullOrEmpty(currentTopic)
                                 ? "Explore the topic"
                                 : "Deepen understanding of " + currentTopic);
    }

    private record Match(ObjectivePattern pattern, String subject) {
    }

    private static Optional<Match> match(final String message) {
        final var text = Strings.nullToEmpty(message).trim();
        for (final var objectivePattern : PATTERNS) {
            final var matcher = objectivePattern.pattern().matcher(text);
            if (matcher.find()) {
                final var subject = clean(matcher.group(1));
                if (!subject.isEmpty()) {
                    return Optional.of(new Match(objectivePattern, subject));
                }
            }
        }
        return Optional.empty();
    }

    private static String clean(final String subject) {
        return subject.replaceAll("[?.!]+$", "").trim();
    }
}
