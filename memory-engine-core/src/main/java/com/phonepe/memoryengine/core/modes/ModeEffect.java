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

import com.phonepe.memoryengine.core.model.Mode;

/**
 * Observable consequence of a mode transition
 */
public record ModeEffect(Type type, String detail) {
    public enum Type {
        MODE_CHANGED,
        TOPIC_CHANGED,
        LEVEL_CHANGED,
        OUTCOME_RECORDED,
        OUTCOMES_DRAINED,
    }

    public static ModeEffect modeChanged(Mode from, Mode to) {
        return new ModeEffect(Type.MODE_CHANGED, from + "->" + to);
    }

    public static ModeEffect topicChanged(String topic) {
        return new ModeEffect(Type.TOPIC_CHANGED, topic);
    }

    public static ModeEffect levelChanged(int from, int to) {
        return new ModeEffect(Type.LEVEL_CHANGED, from + "->" + to);
    }

    public static ModeEffect outcomeRecorded(String taskType) {
        return new ModeEffect(Type.OUTCOME_RECORDED, taskType);
    }

    public static ModeEffect outcomesDrained(int count) {
        return new ModeEffect(Type.OUTCOMES_DRAINED, Integer.toString(count));
    }
}
