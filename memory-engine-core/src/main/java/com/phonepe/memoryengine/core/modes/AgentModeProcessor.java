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

import com.phonepe.memoryengine.core.generation.GeneratedResponse;
import com.phonepe.memoryengine.core.generation.PromptContext;
import com.phonepe.memoryengine.core.memory.HierarchicalMemorySearcher;
import com.phonepe.memoryengine.core.memory.MemorySearchRequest;
import com.phonepe.memoryengine.core.memory.ResolvedMemoryEntry;
import com.phonepe.memoryengine.core.model.Mode;
import com.phonepe.memoryengine.core.model.Realm;
import com.phonepe.memoryengine.core.model.Session;
import com.phonepe.memoryengine.core.model.TaskOutcome;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.text.StringSubstitutor;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Passive, task focused mode. Follows procedures found in memory and treats client policies as a hard override on
 * how the answer is framed.
 */
@Slf4j
public class AgentModeProcessor implements ModeProcessor {
    static final Set<Realm> PREFERRED_REALMS = Set.of(Realm.SKILL_MODULE, Realm.CLIENT);
    static final Set<String> PROCEDURE_TYPES = Set.of("procedure", "sop", "guide", "steps");
    static final int MAX_PROCEDURES = 3;

    static final String INSTRUCTIONS = """
            You are a precise assistant that completes tasks for the user. Follow documented procedures exactly and \
            be direct and actionable. Client policies listed in the prompt override every other instruction, \
            procedure or piece of knowledge, and the answer must be framed to comply with them.""";

    static final Map<String, String> PROMPT_TEMPLATES = Map.of(
            TaskIntent.PROCEDURE, """
                    User asked: ${message}

                    Follow these procedures exactly:
                    ${procedures}

                    Client policies (override everything else):
                    ${policies}

                    Relevant knowledge:
                    ${memory}
                    ${degraded}
                    Provide step-by-step instructions based on the procedures. Be direct and actionable.""",
            TaskIntent.TROUBLESHOOTING, """
                    User reported issue: ${message}

                    Available solutions:
                    ${procedures}

                    Client policies (override everything else):
                    ${policies}

                    Relevant knowledge:
                    ${memory}
                    ${degraded}
                    Provide troubleshooting steps. Be direct and systematic.""");

    static final String DEFAULT_TEMPLATE = """
            User request: ${message}

            Relevant procedures:
            ${procedures}

            Client policies (override everything else):
            ${policies}

            Relevant knowledge:
            ${memory}
            ${degraded}
            Provide a direct, helpful response.""";

    private final HierarchicalMemorySearcher searcher;
    private final Clock clock;

    public AgentModeProcessor(@NonNull HierarchicalMemorySearcher searcher) {
        this(searcher, null);
    }

    public AgentModeProcessor(@NonNull HierarchicalMemorySearcher searcher, Clock clock) {
        this.searcher = searcher;
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
    }

    @Override
    public Mode mode() {
        return Mode.AGENT;
    }

    @Override
    public TurnPlan plan(Session session, String message, String requestedTopic) {
        final var intent = TaskIntent.analyze(message);
        final var memory = searcher.search(MemorySearchRequest.builder()
                                                   .anchorQuery(intent.enhanceQuery(message))
                                                   .identity(session.getIdentity())
                                                   .build());
        final var procedures = procedures(memory.getEntries());
        final var policies = PromptSections.policies(memory.getEntries());
        log.debug("Session {}: task type {}, {} procedures, {} policies",
                  session.getSessionId(), intent.taskType(), procedures.size(), policies.size());
        final var prompt = StringSubstitutor.replace(
                PROMPT_TEMPLATES.getOrDefault(intent.taskType(), DEFAULT_TEMPLATE),
                Map.of("message", message,
                       "procedures", procedureText(procedures),
                       "policies", PromptSections.policyText(policies),
                       "memory", PromptSections.memory(memory.getEntries(), PREFERRED_REALMS),
                       "degraded", memory.isDegraded() ? "\n" + PromptSections.DEGRADED_NOTE + "\n" : ""));
        final var details = new HashMap<String, Object>();
        details.put("task_type", intent.taskType());
        details.put("procedures_followed", procedures.stream().map(ResolvedMemoryEntry::displayName).toList());
        details.put("policies_applied", policies.size());
        details.put("entities", intent.entities());
        if (null != intent.action()) {
            details.put("action", intent.action());
        }
        return TurnPlan.builder()
                .sessionId(session.getSessionId())
                .mode(Mode.AGENT)
                .userMessage(message)
                .promptContext(PromptContext.builder()
                                       .sessionId(session.getSessionId())
                                       .mode(Mode.AGENT)
                                       .instructions(INSTRUCTIONS)
                                       .prompt(prompt)
                                       .userMessage(message)
                                       .history(session.getMessages())
                                       .memory(memory.getEntries())
                                       .policyOverrides(policies)
                                       .degraded(memory.isDegraded())
                                       .build())
                .memory(memory)
                .details(Map.copyOf(details))
                .build();
    }

    @Override
    public List<ModeEvent> onResponse(TurnPlan plan, GeneratedResponse response, String responseMessageId) {
        final var intent = TaskIntent.analyze(plan.getUserMessage());
        if (!intent.taskShaped()) {
            return List.of();
        }
        final var outcome = TaskOutcome.builder()
                .taskType(intent.taskType())
                .action(Objects.requireNonNullElse(intent.action(), "responded"))
                .request(plan.getUserMessage())
                .procedures(procedures(plan.getMemory().getEntries())
                                    .stream()
                                    .map(ResolvedMemoryEntry::displayName)
                                    .toList())
                .entities(intent.entities())
                .responseLength(response.getText().length())
                .sourceMessageId(responseMessageId)
                .recordedAt(clock.instant())
                .build();
        return List.of(new ModeEvent.TaskCompleted(outcome));
    }

    static List<ResolvedMemoryEntry> procedures(final List<ResolvedMemoryEntry> entries) {
        return entries.stream()
                .filter(entry -> PromptSections.typeContainsAny(entry, PROCEDURE_TYPES))
                .limit(MAX_PROCEDURES)
                .toList();
    }

    private static String procedureText(final List<ResolvedMemoryEntry> procedures) {
        if (procedures.isEmpty()) {
            return "No specific procedures found.";
        }
        final var text = new StringBuilder();
        procedures.forEach(procedure -> text.append("Procedure: ")
                .append(procedure.displayName())
                .append(" [")
                .append(procedure.getRealm())
                .append("]\n")
                .append(Objects.requireNonNullElse(procedure.getContent(), ""))
                .append('\n'));
        return text.toString().trim();
    }
}
