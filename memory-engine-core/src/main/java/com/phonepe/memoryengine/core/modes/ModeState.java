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

import com.phonepe.memoryengine.core.model.LearningProgress;
import com.phonepe.memoryengine.core.model.Mode;
import com.phonepe.memoryengine.core.model.TaskOutcome;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.util.List;
import java.util.Objects;

/**
 * Mode specific part of a session. Learning progress is present only in tutor mode, pending task outcomes only
 * accumulate in agent mode.
 */
@Value
@With
public class ModeState {
    @NonNull
    Mode mode;
    LearningProgress learningProgress;
    List<TaskOutcome> pendingOutcomes;

    public ModeState(@NonNull Mode mode, LearningProgress learningProgress, List<TaskOutcome> pendingOutcomes) {
        this.mode = mode;
        this.learningProgress = learningProgress;
        this.pendingOutcomes = List.copyOf(Objects.requireNonNullElseGet(pendingOutcomes, List::<TaskOutcome>of));
    }

    public static ModeState initial(final Mode mode) {
        return switch (mode) {
            case TUTOR -> new ModeState(Mode.TUTOR, LearningProgress.initial(), List.of());
            case AGENT -> new ModeState(Mode.AGENT, null, List.of());
        };
    }
}
