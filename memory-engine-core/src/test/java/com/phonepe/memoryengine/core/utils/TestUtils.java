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

package com.phonepe.memoryengine.core.utils;

import com.phonepe.memoryengine.core.memory.InMemoryMemoryClient;
import com.phonepe.memoryengine.core.memory.MemoryRecord;
import com.phonepe.memoryengine.core.memory.SemanticKeys;
import com.phonepe.memoryengine.core.model.Identity;
import com.phonepe.memoryengine.core.model.Realm;
import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Map;

/**
 * Identities and seeded memory shared by the tests
 */
@UtilityClass
public class TestUtils {
    public static final String CLIENT_ID = "C1";
    public static final String ACTOR_ID = "A1";
    public static final String ACTOR_CLASS_ID = "CL1";
    public static final String SKILL_MODULE_ID = "SK1";

    public static Identity identity() {
        return Identity.builder()
                .clientId(CLIENT_ID)
                .actorId(ACTOR_ID)
                .actorClassId(ACTOR_CLASS_ID)
                .skillModuleIds(List.of(SKILL_MODULE_ID))
                .build();
    }

    public static MemoryRecord memoryRecord(
            String id,
            String type,
            String name,
            String content,
            double relevance) {
        return MemoryRecord.builder()
                .id(id)
                .entityType(type)
                .entityName(name)
                .content(content)
                .relevance(relevance)
                .depth(1)
                .build();
    }

    /**
     * Memory where the client and a skill module both know about the vacation policy, with the skill module's
     * version scoring higher
     */
    public static InMemoryMemoryClient seededMemoryClient() {
        return new InMemoryMemoryClient()
                .add(Realm.CLIENT, CLIENT_ID,
                     memoryRecord("c-vacation", "policy", "Vacation Policy",
                                  "Employees get 25 vacation days. Requests need two weeks notice.", 0.8))
                .add(Realm.SKILL_MODULE, SKILL_MODULE_ID,
                     memoryRecord("sk-vacation", "policy", "vacation policy",
                                  "Generic vacation policy: 15 days.", 0.95))
                .add(Realm.SKILL_MODULE, SKILL_MODULE_ID,
                     memoryRecord("sk-request", "procedure", "Vacation request steps",
                                  "Open the HR portal, choose dates, submit for approval.", 0.9))
                .add(Realm.ACTOR_CLASS, ACTOR_CLASS_ID,
                     memoryRecord("cl-planning", "guide", "Vacation planning guide",
                                  "Plan vacation around project milestones.", 0.75))
                .add(Realm.ACTOR, ACTOR_ID,
                     MemoryRecord.builder()
                             .id("a-pref")
                             .entityType("preference")
                             .entityName("Preferred vacation month")
                             .content("Prefers vacation in August")
                             .relevance(0.85)
                             .depth(1)
                             .metadata(Map.of(SemanticKeys.SEMANTIC_KEY_METADATA, "preference:vacation-month"))
                             .build());
    }
}
