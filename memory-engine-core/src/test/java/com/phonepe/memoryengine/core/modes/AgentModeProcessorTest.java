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

import com.phonepe.memoryengine.core.errors.EngineException;
import com.phonepe.memoryengine.core.errors.ErrorType;
import com.phonepe.memoryengine.core.generation.GeneratedResponse;
import com.phonepe.memoryengine.core.memory.HierarchicalMemorySearcher;
import com.phonepe.memoryengine.core.memory.MemoryClient;
import com.phonepe.memoryengine.core.model.Mode;
import com.phonepe.memoryengine.core.model.Session;
import com.phonepe.memoryengine.core.utils.MutableClock;
import com.phonepe.memoryengine.core.utils.TestUtils;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link AgentModeProcessor}
 */
class AgentModeProcessorTest {

    private static Session agentSession() {
        return Session.create("s1", TestUtils.identity(), Mode.AGENT, Instant.now());
    }

    @Test
    void testClientPolicyOverridesSkillModuleKnowledge() {
        final var processor = new AgentModeProcessor(
                new HierarchicalMemorySearcher(TestUtils.seededMemoryClient(), null));

        final var plan = processor.plan(agentSession(), "How do I request vacation?", null);

        final var context = plan.getPromptContext();
        assertEquals(1, context.getPolicyOverrides().size());
        assertTrue(context.getPolicyOverrides().get(0).contains("25 vacation days"));
        assertTrue(context.getPrompt().contains("Client policies (override everything else):\n- Vacation Policy"));
        assertFalse(context.getPrompt().contains("15 days"));
        assertTrue(context.getInstructions().contains("override every other instruction"));
        assertEquals(TaskIntent.PROCEDURE, plan.getDetails().get("task_type"));
        assertTrue(((List<?>) plan.getDetails().get("procedures_followed")).contains("Vacation request steps"));
        assertFalse(context.isDegraded());
    }

    @Test
    void testTaskShapedTurnRecordsOutcome() {
        final var clock = new MutableClock();
        final var processor = new AgentModeProcessor(
                new HierarchicalMemorySearcher(TestUtils.seededMemoryClient(), null), clock);
        final var plan = processor.plan(agentSession(), "How do I create a \"vacation request\"?", null);

        final var events = processor.onResponse(plan, GeneratedResponse.of("Open the HR portal"), "m2");

        assertEquals(1, events.size());
        final var outcome = ((ModeEvent.TaskCompleted) events.get(0)).outcome();
        assertEquals(TaskIntent.PROCEDURE, outcome.getTaskType());
        assertEquals("create", outcome.getAction());
        assertEquals(List.of("vacation request"), outcome.getEntities());
        assertEquals("m2", outcome.getSourceMessageId());
        assertEquals(clock.instant(), outcome.getRecordedAt());
        assertEquals("Open the HR portal".length(), outcome.getResponseLength());
    }

    @Test
    void testConversationalTurnRecordsNothing() {
        final var processor = new AgentModeProcessor(
                new HierarchicalMemorySearcher(TestUtils.seededMemoryClient(), null));
        final var plan = processor.plan(agentSession(), "Hello there", null);

        assertTrue(processor.onResponse(plan, GeneratedResponse.of("Hi"), "m2").isEmpty());
        assertEquals(TaskIntent.GENERAL, plan.getDetails().get("task_type"));
    }

    @Test
    void testDegradedMemoryStillProducesPrompt() {
        final var client = mock(MemoryClient.class);
        when(client.search(any())).thenThrow(EngineException.of(ErrorType.MEMORY_CLIENT_FAILURE, "down"));
        final var processor = new AgentModeProcessor(new HierarchicalMemorySearcher(client, null));

        final var plan = processor.plan(agentSession(), "How do I request vacation?", null);

        assertTrue(plan.getMemory().isMemoryUnavailable());
        assertTrue(plan.getPromptContext().isDegraded());
        assertTrue(plan.getPromptContext().getPrompt().contains(PromptSections.DEGRADED_NOTE));
        assertTrue(plan.getPromptContext().getPrompt().contains("No specific procedures found."));
    }

    @Test
    void testIntentAnalysis() {
        assertEquals(TaskIntent.TROUBLESHOOTING, TaskIntent.analyze("I get an error on login").taskType());
        assertEquals(TaskIntent.INFORMATION, TaskIntent.analyze("What is PTO?").taskType());
        assertEquals(TaskIntent.CREATION, TaskIntent.analyze("Make a report").taskType());
        assertEquals(TaskIntent.SEARCH, TaskIntent.analyze("Where is the handbook").taskType());
        assertFalse(TaskIntent.analyze("What is PTO?").taskShaped());
        assertTrue(TaskIntent.analyze("Make a report").taskShaped());
    }
}
