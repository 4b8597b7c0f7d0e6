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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Keyword based reading of what a user wants done
 *
 * @param taskType One of {@code procedure, troubleshooting, information, creation, search, general}
 * @param action   First action verb found in the message, may be null
 * @param entities Quoted strings in the message
 */
public record TaskIntent(String taskType, String action, List<String> entities) {
    public static final String PROCEDURE = "procedure";
    public static final String TROUBLESHOOTING = "troubleshooting";
    public static final String INFORMATION = "information";
    public static final String CREATION = "creation";
    public static final String SEARCH = "search";
    public static final String GENERAL = "general";

    private static final List<String> ACTION_VERBS
            = List.of("create", "update", "delete", "find", "fix", "explain", "show", "list");
    private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");

    public static TaskIntent analyze(final String message) {
        final var text = Strings.nullToEmpty(message);
        final var lower = text.toLowerCase(Locale.ROOT);
        final String taskType;
        if (containsAny(lower, "how to", "how do i", "steps to")) {
            taskType = PROCEDURE;
        }
        else if (containsAny(lower, "fix", "error", "problem", "issue")) {
            taskType = TROUBLESHOOTING;
        }
        else if (containsAny(lower, "what is", "explain", "definition")) {
            taskType = INFORMATION;
        }
        else if (containsAny(lower, "create", "make", "build", "generate")) {
            taskType = CREATION;
        }
        else if (containsAny(lower, "find", "search", "locate", "where")) {
            taskType = SEARCH;
        }
        else {
            taskType = GENERAL;
        }
        final var action = ACTION_VERBS.stream()
                .filter(lower::contains)
                .findFirst()
                .orElse(null);
        final var entities = new ArrayList<String>();
        final var matcher = QUOTED.matcher(text);
        while (matcher.find()) {
            entities.add(matcher.group(1));
        }
        return new TaskIntent(taskType, action, List.copyOf(entities));
    }

    /**
     * Whether handling this intent counts as completing a task worth remembering
     */
    public boolean taskShaped() {
        return !GENERAL.equals(taskType) && !INFORMATION.equals(taskType);
    }

    /**
     * Anchor query biased toward the kind of memory this intent needs
     */
    public String enhanceQuery(final String message) {
        return switch (taskType) {
            case PROCEDURE -> "procedure SOP steps: " + message;
            case TROUBLESHOOTING -> "troubleshooting fix solution: " + message;
            default -> message;
        };
    }

    private static boolean containsAny(final String text, final String... fragments) {
        for (final var fragment : fragments) {
            if (text.contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}
