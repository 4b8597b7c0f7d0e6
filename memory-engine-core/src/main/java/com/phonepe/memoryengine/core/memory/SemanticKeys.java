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

package com.phonepe.memoryengine.core.memory;

import com.google.common.base.Strings;
import com.phonepe.memoryengine.core.utils.EngineUtils;
import lombok.experimental.UtilityClass;

import java.util.Locale;

/**
 * Derives the key used to decide whether two records from different realms describe the same fact.
 * <p>
 * The key is {@code <fact-type>:<normalized-entity-name>}. A key supplied by the store in the
 * {@value #SEMANTIC_KEY_METADATA} metadata field is used verbatim. Records without a name are keyed on a hash of
 * their content.
 */
@UtilityClass
public class SemanticKeys {
    public static final String SEMANTIC_KEY_METADATA = "semantic_key";
    public static final String DEFAULT_FACT_TYPE = "fact";

    public static String of(final MemoryRecord memoryRecord) {
        final var metadata = memoryRecord.getMetadata();
        if (metadata != null && metadata.get(SEMANTIC_KEY_METADATA) instanceof String supplied && !supplied.isBlank()) {
            return supplied;
        }
        return of(memoryRecord.getEntityType(), memoryRecord.getEntityName(), memoryRecord.getContent());
    }

    public static String of(final String entityType, final String entityName, final String content) {
        final var type = Strings.isNullOrEmpty(entityType)
                         ? DEFAULT_FACT_TYPE
                         : entityType.trim().toLowerCase(Locale.ROOT);
        final var name = EngineUtils.slug(entityName);
        if (!name.isEmpty()) {
            return type + ":" + name;
        }
        return type + ":" + EngineUtils.sha256(Strings.nullToEmpty(content).trim());
    }
}
