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

package com.phonepe.memoryengine.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Objects;

/**
 * Tutor mode sub-state: the current topic, how well the user understands it and the topics covered so far.
 */
@Value
@With
public class LearningProgress {
    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 5;
    public static final int INITIAL_LEVEL = 3;
    public static final int MAX_PATH_LENGTH = 10;

    String topic;
    int understandingLevel;
    List<String> learningPath;

    @Builder
    @Jacksonized
    public LearningProgress(String topic, int understandingLevel, List<String> learningPath) {
        this.topic = topic;
        this.understandingLevel = clamp(understandingLevel == 0 ? INITIAL_LEVEL : understandingLevel);
        this.learningPath = List.copyOf(Objects.requireNonNullElseGet(learningPath, List::<String>of));
    }

    public static LearningProgress initial() {
        return new LearningProgress(null, INITIAL_LEVEL, List.of());
    }

    public boolean hasTopic() {
        return topic != null && !topic.isBlank();
    }

    public static int clamp(int level) {
        return Math.max(MIN_LEVEL, Math.min(MAX_LEVEL, level));
    }
}
