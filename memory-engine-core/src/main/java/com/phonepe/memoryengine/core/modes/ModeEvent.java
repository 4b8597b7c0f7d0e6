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
import com.phonepe.memoryengine.core.model.Mode;
import com.phonepe.memoryengine.core.model.TaskOutcome;

/**
 * Inputs to the {@link ModeStateMachine}
 */
public interface ModeEvent {

    <T> T accept(ModeEventVisitor<T> visitor);

    /**
     * Explicit request to move a session to another mode
     */
    record SwitchMode(Mode target) implements ModeEvent {
        @Override
        public <T> T accept(ModeEventVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * A learning topic was chosen for a tutor session
     */
    record TopicSelected(String topic) implements ModeEvent {
        @Override
        public <T> T accept(ModeEventVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * The response generator judged how well the user understood the last explanation
     */
    record ComprehensionObserved(ComprehensionSignal signal) implements ModeEvent {
        @Override
        public <T> T accept(ModeEventVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * An agent session finished a task shaped request
     */
    record TaskCompleted(TaskOutcome outcome) implements ModeEvent {
        @Override
        public <T> T accept(ModeEventVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * The oldest {@code count} buffered outcomes were handed to consolidation
     */
    record OutcomesDrained(int count) implements ModeEvent {
        @Override
        public <T> T accept(ModeEventVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }
}
