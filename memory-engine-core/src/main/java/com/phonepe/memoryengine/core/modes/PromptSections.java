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
import com.phonepe.memoryengine.core.memory.ResolvedMemoryEntry;
import com.phonepe.memoryengine.core.model.Realm;
import com.phonepe.memoryengine.core.utils.EngineUtils;
import lombok.experimental.UtilityClass;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rendering of resolved memory into prompt text
 */
@UtilityClass
class PromptSections {
    static final int MAX_PROMPT_ENTRIES = 10;
    static final int MAX_CONTENT_LENGTH = 200;
    static final String NO_KNOWLEDGE = "No specific knowledge available.";
    static final String DEGRADED_NOTE = "Note: long term memory is currently unavailable. Answer from the "
            + "conversation so far and general knowledge, and say so if the answer may be incomplete.";
    private static final Set<String> POLICY_TYPES = Set.of("policy", "rule", "requirement");

    /**
     * Entries from the preferred realms come first, each group keeps its relevance order
     */
    static String memory(final List<ResolvedMemoryEntry> entries, final Set<Realm> preferredRealms) {
        if (entries.isEmpty()) {
            return NO_KNOWLEDGE;
        }
        return entries.stream()
                .sorted(Comparator.comparing((ResolvedMemoryEntry entry) -> !preferredRealms.contains(entry.getRealm())))
                .limit(MAX_PROMPT_ENTRIES)
                .map(entry -> "- [%s] %s: %s".formatted(entry.getRealm(),
                                                        entry.displayName(),
                                                        EngineUtils.truncate(Strings.nullToEmpty(entry.getContent()),
                                                                             MAX_CONTENT_LENGTH)))
                .collect(Collectors.joining("\n"));
    }

    static boolean isPolicy(final ResolvedMemoryEntry entry) {
        return entry.getRealm() == Realm.CLIENT && typeContainsAny(entry, POLICY_TYPES);
    }

    static List<String> policies(final List<ResolvedMemoryEntry> entries) {
        return entries.stream()
                .filter(PromptSections::isPolicy)
                .map(entry -> "%s: %s".formatted(entry.displayName(), Strings.nullToEmpty(entry.getContent())))
                .toList();
    }

    static String policyText(final List<String> policies) {
        if (policies.isEmpty()) {
            return "No specific policies apply.";
        }
        return policies.stream()
                .map(policy -> "- " + policy)
                .collect(Collectors.joining("\n"));
    }

    static boolean typeContainsAny(final ResolvedMemoryEntry entry, final Set<String> fragments) {
        final var type = Strings.nullToEmpty(entry.getEntityType()).toLowerCase(Locale.ROOT);
        return fragments.stream().anyMatch(type::contains);
    }
}
