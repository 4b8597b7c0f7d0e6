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

import com.phonepe.memoryengine.core.generation.ComprehensionSignal;
import com.phonepe.memoryengine.core.model.LearningProgress;
import com.phonepe.memoryengine.core.model.Mode;
import com.phonepe.memoryengine.core.model.TaskOutcome;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ModeStateMachine}
 */
class ModeStateMachineTest {

    private static TaskOutcome outcome(String taskType) {
        return TaskOutcome.builder()
                .taskType(taskType)
                .action("create")
                .request("create a " + taskType)
                .build();
    }

    @Test
    void testSwitchResetsModeSubState() {
        final var tutor = ModeStateMachine.applyAll(ModeState.initial(Mode.TUTOR),
                                                    List.of(new ModeEvent.TopicSelected("budgeting"),
                                                            new ModeEvent.ComprehensionObserved(
                                                                    ComprehensionSignal.COMPREHENDED)))
                .state();
        assertEquals(4, tutor.getLearningProgress().getUnderstandingLevel());

        final var agent = ModeStateMachine.apply(tutor, new ModeEvent.SwitchMode(Mode.AGENT));
        assertTrue(agent.changed());
        assertEquals(ModeEffect.Type.MODE_CHANGED, agent.effects().get(0).type());
        assertEquals(Mode.AGENT, agent.state().getMode());
        assertNull(agent.state().getLearningProgress());

        final var backToTutor = ModeStateMachine.apply(agent.state(), new ModeEvent.SwitchMode(Mode.TUTOR)).state();
        assertEquals(LearningProgress.initial(), backToTutor.getLearningProgress());
        assertTrue(backToTutor.getPendingOutcomes().isEmpty());
    }

    @Test
    void testSwitchToSameModeIsNoop() {
        final var state = ModeState.initial(Mode.AGENT)
                .withPendingOutcomes(List.of(outcome("creation")));

        final var transition = ModeStateMachine.apply(state, new ModeEvent.SwitchMode(Mode.AGENT));

        assertFalse(transition.changed());
        assertSame(state, transition.state());
    }

    @Test
    void testComprehensionMovesLevelWithinBounds() {
        var state = ModeStateMachine.apply(ModeState.initial(Mode.TUTOR), new ModeEvent.TopicSelected("git"))
                .state();
        for (int i = 0; i < 4; i++) {
            state = ModeStateMachine.apply(state, new ModeEvent.ComprehensionObserved(ComprehensionSignal.COMPREHENDED))
                    .state();
        }
        assertEquals(LearningProgress.MAX_LEVEL, state.getLearningProgress().getUnderstandingLevel());

        final var atCeiling = ModeStateMachine.apply(
                state, new ModeEvent.ComprehensionObserved(ComprehensionSignal.COMPREHENDED));
        assertFalse(atCeiling.changed());

        for (int i = 0; i < 6; i++) {
            state = ModeStateMachine.apply(state, new ModeEvent.ComprehensionObserved(ComprehensionSignal.CONFUSED))
                    .state();
        }
        assertEquals(LearningProgress.MIN_LEVEL, state.getLearningProgress().getUnderstandingLevel());

        assertFalse(ModeStateMachine.apply(state, new ModeEvent.ComprehensionObserved(ComprehensionSignal.NEUTRAL))
                            .changed());
    }

    @Test
    void testTopicSelectionTracksBoundedPath() {
        var state = ModeState.initial(Mode.TUTOR);
        for (int i = 0; i < 12; i++) {
            state = ModeStateMachine.apply(state, new ModeEvent.TopicSelected("topic " + i)).state();
        }
        final var progress = state.getLearningProgress();
        assertEquals("topic 11", progress.getTopic());
        assertEquals(LearningProgress.MAX_PATH_LENGTH, progress.getLearningPath().size());
        assertEquals("topic 2", progress.getLearningPath().get(0));

        final var repeated = ModeStateMachine.apply(state, new ModeEvent.TopicSelected(" topic 11 "));
        assertFalse(repeated.changed());
        assertFalse(ModeStateMachine.apply(state, new ModeEvent.TopicSelected("  ")).changed());
    }

    @Test
    void testEventsForOtherModeAreIgnored() {
        final var agent = ModeState.initial(Mode.AGENT);
        assertFalse(ModeStateMachine.apply(agent, new ModeEvent.TopicSelected("git")).changed());
        assertFalse(ModeStateMachine.apply(agent, new ModeEvent.ComprehensionObserved(ComprehensionSignal.CONFUSED))
                            .changed());

        final var tutor = ModeState.initial(Mode.TUTOR);
        final var transition = ModeStateMachine.apply(tutor, new ModeEvent.TaskCompleted(outcome("creation")));
        assertFalse(transition.changed());
        assertTrue(transition.state().getPendingOutcomes().isEmpty());
    }

    @Test
    void testOutcomesBufferAndDrainInOrder() {
        final var recorded = ModeStateMachine.applyAll(
                ModeState.initial(Mode.AGENT),
                IntStream.range(0, 3)
                        .mapToObj(i -> (ModeEvent) new ModeEvent.TaskCompleted(outcome("type" + i)))
                        .toList());
        assertEquals(3, recorded.effects().size());
        assertEquals(3, recorded.state().getPendingOutcomes().size());

        final var drained = ModeStateMachine.apply(recorded.state(), new ModeEvent.OutcomesDrained(2));
        assertEquals(List.of(new ModeEffect(ModeEffect.Type.OUTCOMES_DRAINED, "2")), drained.effects());
        assertEquals(List.of("type2"),
                     drained.state().getPendingOutcomes().stream().map(TaskOutcome::getTaskType).toList());

        final var overDrained = ModeStateMachine.apply(drained.state(), new ModeEvent.OutcomesDrained(10));
        assertTrue(overDrained.state().getPendingOutcomes().isEmpty());
        assertFalse(ModeStateMachine.apply(overDrained.state(), new ModeEvent.OutcomesDrained(1)).changed());
    }
}
