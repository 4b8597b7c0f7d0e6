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

package com.phonepe.memoryengine.core.consolidation;

import com.google.common.base.Strings;
import com.phonepe.memoryengine.core.memory.MemoryFact;
import com.phonepe.memoryengine.core.model.ChatMessage;
import com.phonepe.memoryengine.core.model.LearningProgress;
import com.phonepe.memoryengine.core.model.MessageRole;
import com.phonepe.memoryengine.core.model.TaskOutcome;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Extracts facts by looking for simple success patterns in a conversation slice:
 * <ul>
 *     <li>Tasks that were completed, either recorded as agent outcomes with procedures or announced as done by the
 *     assistant</li>
 *     <li>Learning progress in tutor mode, when the understanding level went above the starting level</li>
 *     <li>Interest in a learning topic</li>
 * </ul>
 * Patterns scoring below the success threshold are dropped. Patterns with the same key are merged.
 */
@Slf4j
public class PatternFactExtractor implements FactExtractor {
    public static final String TASK_COMPLETION = "task_completion";
    public static final String LEARNING_PROGRESS = "learning_progress";
    public static final String TOPIC_INTEREST = "topic_interest";

    static final double TASK_COMPLETION_SCORE = 0.9;
    static final double LEARNING_PROGRESS_SCORE = 0.8;
    static final double TOPIC_INTEREST_SCORE = 0.75;
    static final double UNPROCEDURED_TASK_SCORE = 0.6;

    static final List<String> COMPLETION_MARKERS = List.of(
            "solved", "fixed", "working", "done", "completed", "finished");
    static final List<String> PROGRESS_MARKERS = List.of(
            "i understand", "makes sense", "i see", "now i get it", "clear now", "got it");

    private final double successThreshold;

    public PatternFactExtractor() {
        this(ConsolidationSetup.DEFAULT_SUCCESS_THRESHOLD);
    }

    public PatternFactExtractor(double successThreshold) {
        this.successThreshold = successThreshold;
    }

    @Override
    public List<MemoryFact> extract(final ConsolidationJob job) {
        final var actorId = job.getIdentity().getActorId();
        final var found = new ArrayList<MemoryFact>();
        job.getOutcomes().forEach(outcome -> found.add(outcomeFact(job, actorId, outcome)));
        found.addAll(exchangeFacts(job, actorId));
        learningFacts(job, actorId).forEach(found::add);

        final var merged = new LinkedHashMap<String, MemoryFact>();
        found.forEach(fact -> merged.merge(fact.getFactKey(), fact, PatternFactExtractor::mergeFacts));
        final var facts = merged.values()
                .stream()
                .filter(fact -> fact.getConfidence() >= successThreshold)
                .sorted(Comparator.comparingDouble(MemoryFact::getConfidence).reversed()
                                .thenComparing(MemoryFact::getFactKey))
                .toList();
        log.debug("Job {} yielded {} patterns, {} above threshold {}",
                  job.getJobId(), merged.size(), facts.size(), successThreshold);
        return facts;
    }

    public static String factKey(final String actorId, final String factType, final String subject) {
        return UUID.nameUUIDFromBytes("%s-%s-%s".formatted(actorId, factType, subject)
                                              .getBytes(StandardCharsets.UTF_8))
                .toString();
    }

    private MemoryFact outcomeFact(ConsolidationJob job, String actorId, TaskOutcome outcome) {
        final var procedures = Objects.requireNonNullElseGet(outcome.getProcedures(), List::<String>of);
        final var subject = "%s/%s".formatted(outcome.getTaskType(), outcome.getAction());
        return fact(job,
                    actorId,
                    TASK_COMPLETION,
                    subject,
                    "Completed %s task (%s) using: %s".formatted(outcome.getTaskType(),
                                                                  outcome.getAction(),
                                                                  procedures.isEmpty()
                                                                  ? "general knowledge"
                                                                  : String.join(", ", procedures)),
                    procedures.isEmpty() ? UNPROCEDURED_TASK_SCORE : TASK_COMPLETION_SCORE,
                    Strings.isNullOrEmpty(outcome.getSourceMessageId())
                    ? List.of()
                    : List.of(outcome.getSourceMessageId()),
                    Map.of("approach", procedures.isEmpty() ? "general response" : "procedure-following approach",
                           "entities", Objects.requireNonNullElseGet(outcome.getEntities(), List::of)));
    }

    private List<MemoryFact> exchangeFacts(ConsolidationJob job, String actorId) {
        final var facts = new ArrayList<MemoryFact>();
        final var messages = job.getMessages();
        for (int i = 0; i + 1 < messages.size(); i++) {
            final var question = messages.get(i);
            final var answer = messages.get(i + 1);
            if (question.getRole() != MessageRole.USER || answer.getRole() != MessageRole.ASSISTANT
                    || answer.isPartial()) {
                continue;
            }
            if (containsAny(answer.getContent(), COMPLETION_MARKERS)) {
                final var trigger = trigger(question.getContent());
                facts.add(fact(job,
                               actorId,
                               TASK_COMPLETION,
                               trigger,
                               "Successfully completed task: " + trigger,
                               TASK_COMPLETION_SCORE,
                               List.of(question.getMessageId(), answer.getMessageId()),
                               Map.of("approach", "memory-guided response")));
            }
        }
        return facts;
    }

    private List<MemoryFact> learningFacts(ConsolidationJob job, String actorId) {
        final var progress = job.getLearningProgress();
        if (null == progress || !progress.hasTopic()) {
            return List.of();
        }
        final var userMessages = job.getMessages()
                .stream()
                .filter(message -> message.getRole() == MessageRole.USER)
                .toList();
        if (userMessages.isEmpty()) {
            return List.of();
        }
        final var facts = new ArrayList<MemoryFact>();
        facts.add(fact(job,
                       actorId,
                       TOPIC_INTEREST,
                       progress.getTopic(),
                       "Interested in learning about " + progress.getTopic(),
                       TOPIC_INTEREST_SCORE,
                       userMessages.stream().map(ChatMessage::getMessageId).toList(),
                       Map.of("learning_path", progress.getLearningPath())));
        if (progress.getUnderstandingLevel() > LearningProgress.INITIAL_LEVEL) {
            final var evidence = userMessages.stream()
                    .filter(message -> containsAny(message.getContent(), PROGRESS_MARKERS))
                    .map(ChatMessage::getMessageId)
                    .toList();
            facts.add(fact(job,
                           actorId,
                           LEARNING_PROGRESS,
                           progress.getTopic(),
                           "Progressed to understanding level %d in %s".formatted(progress.getUnderstandingLevel(),
                                                                                   progress.getTopic()),
                           LEARNING_PROGRESS_SCORE,
                           evidence.isEmpty()
                           ? userMessages.stream().map(ChatMessage::getMessageId).toList()
                           : evidence,
                           Map.of("understanding_level", progress.getUnderstandingLevel(),
                                  "approach", "progressive explanation")));
        }
        return facts;
    }

    private static MemoryFact fact(
            ConsolidationJob job,
            String actorId,
            String factType,
            String subject,
            String content,
            double confidence,
            List<String> sourceMessageIds,
            Map<String, Object> metadata) {
        return MemoryFact.builder()
                .factKey(factKey(actorId, factType, subject))
                .factType(factType)
                .subject(subject)
                .content(content)
                .confidence(confidence)
                .sourceMessageIds(new TreeSet<>(sourceMessageIds))
                .sessionId(job.getSessionId())
                .metadata(metadata)
                .build();
    }

    private static MemoryFact mergeFacts(MemoryFact existing, MemoryFact incoming) {
        final var sources = new TreeSet<>(existing.getSourceMessageIds());
        sources.addAll(incoming.getSourceMessageIds());
        return existing.withSourceMessageIds(sources)
                .withConfidence(Math.max(existing.getConfidence(), incoming.getConfidence()));
    }

    static String trigger(final String message) {
        final var text = Strings.nullToEmpty(message).toLowerCase(Locale.ROOT);
        if (text.contains("how do i") || text.contains("how to")) {
            return "how-to question";
        }
        if (text.contains("what is") || text.contains("what are")) {
            return "definition question";
        }
        if (text.contains("error") || text.contains("problem") || text.contains("issue")) {
            return "troubleshooting request";
        }
        if (text.contains("create") || text.contains("make")) {
            return "creation task";
        }
        return "general query";
    }

    private static boolean containsAny(final String text, final List<String> markers) {
        final var lower = Strings.nullToEmpty(text).toLowerCase(Locale.ROOT);
        return markers.stream().anyMatch(lower::contains);
    }
}
