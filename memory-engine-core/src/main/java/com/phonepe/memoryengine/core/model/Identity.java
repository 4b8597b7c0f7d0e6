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

import com.google.common.base.Strings;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Objects;

/**
 * The acting identity a conversation runs under. Determines the entity id searched in every realm.
 */
@Value
public class Identity {
    public static final String DEFAULT_ACTOR_TYPE = "synth";

    @NonNull
    String clientId;
    @NonNull
    String actorId;
    String actorType;
    String actorClassId;
    List<String> skillModuleIds;

    @Builder
    @Jacksonized
    public Identity(
            @NonNull String clientId,
            @NonNull String actorId,
            String actorType,
            String actorClassId,
            List<String> skillModuleIds) {
        this.clientId = clientId;
        this.actorId = actorId;
        this.actorType = Strings.isNullOrEmpty(actorType) ? DEFAULT_ACTOR_TYPE : actorType;
        this.actorClassId = actorClassId;
        this.skillModuleIds = List.copyOf(Objects.requireNonNullElseGet(skillModuleIds, List::<String>of));
    }

    /**
     * Entity ids to query for a realm. Empty when the identity has nothing in that realm.
     */
    public List<String> entityIds(final Realm realm) {
        return switch (realm) {
            case CLIENT -> List.of(clientId);
            case ACTOR -> List.of(actorId);
            case ACTOR_CLASS -> Strings.isNullOrEmpty(actorClassId) ? List.of() : List.of(actorClassId);
            case SKILL_MODULE -> skillModuleIds;
        };
    }
}
