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
import com.phonepe.memoryengine.core.generation.GeneratedResponse;
import com.phonepe.memoryengine.core.generation.PromptContext;
import com.phonepe.memoryengine.core.memory.HierarchicalMemorySearcher;
import com.phonepe.memoryengine.core.memory.MemorySearchRequest;
import com.phonepe.memoryengine.core.memory.ResolvedMemoryEntry;
import com.phonepe.memoryengine.core.model.LearningProgress;
import com.phonepe.memoryengine.core.model.Mode;
import com.phonepe.memoryengine.core.model.Realm;
import com.phonepe.memoryengine.core.model.Session;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.text.StringSubstitutor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Proactive mode. Makes sure a learning topic exists before teaching, sizes explanations to the user's
 * understanding level and proposes where to go next.
 */
@Slf4j
public class TutorModeProcessor implements ModeProcessor {
    public static final String ELICITATION_RESPONSE = "Hi! I'm here to help you learn. What would you like to "
            + "learn about today? Tell me a topic or a question, for example \"How do I write a project plan?\"";
    static final Set<Realm> PREFERRED_REALMS = Set.of(Realm.ACTOR_CLASS, Realm.SKILL_MODULE);
    static final int MAX_FOLLOW_UPS = 3;
    static final int MAX_SUGGESTED_TOPICS = 5;
    static final String RELATED_TOPICS_METADATA = "related_topics";

    static final Map<Integer, String> LEVEL_GUIDANCE = Map.of(
            1, "Explain in very simple terms with basic examples",
            2, "Explain clearly with simple examples",
            3, "Provide balanced explanation with examples",
            4, "Include more detail and connections",
            5, "Provide advanced explanation with nuances");

    static final String INSTRUCTIONS = """
            You are a patient, encouraging tutor. Teach one step at a time, check understanding and adapt the depth \
            of your explanations to the learner's level. Never contradict client policies.""";

    static final String PROMPT_TEMPLATE = """
            The learning objective is: ${objective}

            User understanding level: ${level}/5
            Guidance: ${guidance}

            Available knowledge from memory:
            ${memory}

            Client policies that must be followed:
            ${policies}
            ${degraded}
            User question: ${message}

            Provide a response that:
            1. Addresses the question at the appropriate level
            2. Builds on their current understanding
            3. Uses examples from the memory context when relevant
            4. Encourages further exploration""";

    private final HierarchicalMemorySearcher searcher;

    public TutorModeProcessor(@NonNull HierarchicalMemorySearcher searcher) {
        this.searcher = searcher;
    }

    @Override
    public Mode mode() {
        return Mode.TUTOR;
    }

    @Override
    public TurnPlan plan(Session session, String message, String requestedTopic) {
        final var progress = Objects.requireNonNullElseGet(session.getLearningProgress(), LearningProgress::initial);
        final var events = new ArrayList<ModeEvent>();
        var topic = progress.getTopic();
        final var candidate = Strings.isNullOrEmpty(requestedTopic) || requestedTopic.isBlank()
                              ? (progress.hasTopic() ? null : LearningObjectives.topic(message).orElse(null))
                              : requestedTopic.trim();
        if (null != candidate && !candidate.equals(topic)) {
            events.add(new ModeEvent.TopicSelected(candidate));
            topic = candidate;
        }
        if (Strings.isNullOrEmpty(topic)) {
            log.debug("No learning topic for session {}, asking for one", session.getSessionId());
            return TurnPlan.builder()
                    .sessionId(session.getSessionId())
                    .mode(Mode.TUTOR)
                    .userMessage(message)
                    .fixedResponse(ELICITATION_RESPONSE)
                    .details(Map.of("awaiting_topic", true))
                    .build();
        }
        final var memory = searcher.search(MemorySearchRequest.builder()
                                                   .anchorQuery("%s tutorial guide: %s".formatted(topic, message))
                                                   .identity(session.getIdentity())
                                                   .build());
        final var level = progress.getUnderstandingLevel();
        final var objective = LearningObjectives.objective(message, topic);
        final var policies = PromptSections.policies(memory.getEntries());
        final var prompt = StringSubstitutor.replace(
                PROMPT_TEMPLATE,
                Map.of("objective", objective,
                       "level", level,
                       "guidance", LEVEL_GUIDANCE.getOrDefault(level, LEVEL_GUIDANCE.get(3)),
                       "memory", PromptSections.memory(memory.getEntries(), PREFERRED_REALMS),
                       "policies", PromptSections.policyText(policies),
                       "degraded", memory.isDegraded() ? "\n" + PromptSections.DEGRADED_NOTE + "\n" : "",
                       "message", message));
        return TurnPlan.builder()
                .sessionId(session.getSessionId())
                .mode(Mode.TUTOR)
                .userMessage(message)
                .promptContext(PromptContext.builder()
                                       .sessionId(session.getSessionId())
                                       .mode(Mode.TUTOR)
                                       .instructions(INSTRUCTIONS)
                                       .prompt(prompt)
                                       .userMessage(message)
                                       .history(session.getMessages())
                                       .memory(memory.getEntries())
                                       .policyOverrides(policies)
                                       .degraded(memory.isDegraded())
                                       .build())
                .memory(memory)
                .followUpQuestions(followUpQuestions(objective, level, memory.getEntries()))
                .suggestedTopics(suggestedTopics(topic, memory.getEntries(), level))
                .events(List.copyOf(events))
                .details(Map.of("learning_topic", topic,
                                "learning_objective", objective,
                                "understanding_level", level))
                .build();
    }

    @Override
    public List<ModeEvent> onResponse(TurnPlan plan, GeneratedResponse response, String responseMessageId) {
        if (!plan.requiresGeneration()) {
            return List.of();
        }
        return List.of(new ModeEvent.ComprehensionObserved(response.getComprehension()));
    }

    static List<String> followUpQuestions(
            final String objective,
            int level,
            final List<ResolvedMemoryEntry> entries) {
        final var questions = new ArrayList<String>();
        if (level <= 2) {
            questions.add("Would you like a simpler explanation of %s?".formatted(objective));
            questions.add("What part would you like me to clarify?");
            questions.add("Shall we go through an example together?");
        }
        else if (level == 3) {
            questions.add("How do you think %s applies to your work?".formatted(objective));
            questions.add("What aspects interest you most?");
            questions.add("Would you like to explore a related concept?");
        }
        else {
            questions.add("What are your thoughts on alternative approaches to %s?".formatted(objective));
            questions.add("How does this connect with your existing knowledge?");
            questions.add("What advanced aspects would you like to explore?");
        }
        if (!entries.isEmpty()) {
            questions.set(MAX_FOLLOW_UPS - 1,
                          "Would you like to dive deeper into %s?".formatted(entries.get(0).displayName()));
        }
        return List.copyOf(questions.subList(0, MAX_FOLLOW_UPS));
    }

    static List<String> suggestedTopics(
            final String topic,
            final List<ResolvedMemoryEntry> entries,
            int level) {
        final var suggestions = new LinkedHashSet<String>();
        entries.stream()
                .limit(PromptSections.MAX_PROMPT_ENTRIES)
                .map(entry -> entry.getMetadata().get(RELATED_TOPICS_METADATA))
                .filter(Collection.class::isInstance)
                .flatMap(related -> ((Collection<?>) related).stream())
                .map(Object::toString)
                .forEach(suggestions::add);
        if (level >= LearningProgress.INITIAL_LEVEL) {
            suggestions.add("Advanced " + topic);
        }
        suggestions.remove(topic);
        return suggestions.stream()
                .limit(MAX_SUGGESTED_TOPICS)
                .toList();
    }
}
