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
import com.phonepe.memoryengine.core.model.LearningProgress;
import com.phonepe.memoryengine.core.model.Mode;
import com.phonepe.memoryengine.core.model.TaskOutcome;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * The tutor/agent state machine as a pure function of {@code (state, event)}. Events that do not apply to the
 * current mode leave the state untouched and produce no effects.
 */
@UtilityClass
public class ModeStateMachine {

    public static ModeTransition apply(final ModeState state, final ModeEvent event) {
        return event.accept(new ModeEventVisitor<>() {
            @Override
            public ModeTransition visit(ModeEvent.SwitchMode switchMode) {
                return switchMode(state, switchMode.target());
            }

            @Override
            public ModeTransition visit(ModeEvent.TopicSelected topicSelected) {
                return selectTopic(state, topicSelected.topic());
            }

            @Override
            public ModeTransition visit(ModeEvent.ComprehensionObserved comprehensionObserved) {
                return observeComprehension(state, comprehensionObserved);
            }

            @Override
            public ModeTransition visit(ModeEvent.TaskCompleted taskCompleted) {
                return recordOutcome(state, taskCompleted.outcome());
            }

            @Override
            public ModeTransition visit(ModeEvent.OutcomesDrained outcomesDrained) {
                return drainOutcomes(state, outcomesDrained.count());
            }
        });
    }

    /**
     * Apply events in order, collecting all effects
     */
    public static ModeTransition applyAll(final ModeState state, final List<ModeEvent> events) {
        var current = state;
        final var effects = new ArrayList<ModeEffect>();
        for (final var event : events) {
            final var transition = apply(current, event);
            current = transition.state();
            effects.addAll(transition.effects());
        }
        return new ModeTransition(current, List.copyOf(effects));
    }

    private static ModeTransition switchMode(final ModeState state, final Mode target) {
        if (state.getMode() == target) {
            return ModeTransition.unchanged(state);
        }
        //Leaving a mode drops its sub-state, entering one starts from scratch
        return new ModeTransition(ModeState.initial(target),
                                  List.of(ModeEffect.modeChanged(state.getMode(), target)));
    }

    private static ModeTransition selectTopic(final ModeState state, final String topic) {
        if (state.getMode() != Mode.TUTOR || Strings.isNullOrEmpty(topic) || topic.isBlank()) {
            return ModeTransition.unchanged(state);
        }
        final var progress = progress(state);
        final var normalized = topic.trim();
        if (normalized.equals(progress.getTopic())) {
            return ModeTransition.unchanged(state);
        }
        final var path = new ArrayList<>(progress.getLearningPath());
        path.add(normalized);
        final var trimmedPath = path.size() > LearningProgress.MAX_PATH_LENGTH
                                ? path.subList(path.size() - LearningProgress.MAX_PATH_LENGTH, path.size())
                                : path;
        return new ModeTransition(state.withLearningProgress(progress.withTopic(normalized)
                                                                     .withLearningPath(List.copyOf(trimmedPath))),
                                  List.of(ModeEffect.topicChanged(normalized)));
    }

    private static ModeTransition observeComprehension(
            final ModeState state,
            final ModeEvent.ComprehensionObserved event) {
        if (state.getMode() != Mode.TUTOR || null == event.signal()) {
            return ModeTransition.unchanged(state);
        }
        final var progress = progress(state);
        final var current = progress.getUnderstandingLevel();
        final var next = switch (event.signal()) {
            case COMPREHENDED -> LearningProgress.clamp(current + 1);
            case CONFUSED -> LearningProgress.clamp(current - 1);
            case NEUTRAL -> current;
        };
        if (next == current) {
            return ModeTransition.unchanged(state);
        }
        return new ModeTransition(state.withLearningProgress(progress.withUnderstandingLevel(next)),
                                  List.of(ModeEffect.levelChanged(current, next)));
    }

    private static ModeTransition recordOutcome(final ModeState state, final TaskOutcome outcome) {
        if (state.getMode() != Mode.AGENT || null == outcome) {
            return ModeTransition.unchanged(state);
        }
        final var outcomes = new ArrayList<>(state.getPendingOutcomes());
        outcomes.add(outcome);
        return new ModeTransition(state.withPendingOutcomes(List.copyOf(outcomes)),
                                  List.of(ModeEffect.outcomeRecorded(outcome.getTaskType())));
    }

    private static ModeTransition drainOutcomes(final ModeState state, int count) {
        if (count <= 0 || state.getPendingOutcomes().isEmpty()) {
            return ModeTransition.unchanged(state);
        }
        final var outcomes = state.getPendingOutcomes();
        final var drained = Math.min(count, outcomes.size());
        return new ModeTransition(state.withPendingOutcomes(List.copyOf(outcomes.subList(drained, outcomes.size()))),
                                  List.of(ModeEffect.outcomesDrained(drained)));
    }

    private static LearningProgress progress(final ModeState state) {
        return null == state.getLearningProgress() ? LearningProgress.initial() : state.getLearningProgress();
    }
}
