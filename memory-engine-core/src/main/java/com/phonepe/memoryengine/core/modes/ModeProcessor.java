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
import com.phonepe.memoryengine.core.model.Mode;
import com.phonepe.memoryengine.core.model.Session;

import java.util.List;

/**
 * Decides how a turn is answered in one mode
 */
public interface ModeProcessor {
    Mode mode();

    /**
     * Resolve memory and prepare the turn
     *
     * @param session        Session as loaded at the start of the turn
     * @param message        User message
     * @param requestedTopic Learning topic explicitly requested by the caller, may be null
     */
    TurnPlan plan(Session session, String message, String requestedTopic);

    /**
     * State machine events that follow from the generated response
     *
     * @param responseMessageId Id of the history message the response is stored under
     */
    List<ModeEvent> onResponse(TurnPlan plan, GeneratedResponse response, String responseMessageId);
}
