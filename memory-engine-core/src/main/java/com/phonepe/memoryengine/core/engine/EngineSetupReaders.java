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

package com.phonepe.memoryengine.core.engine;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.SneakyThrows;
import lombok.experimental.UtilityClass;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link EngineSetup} from YAML. Durations are ISO-8601 strings such as {@code PT15M}.
 */
@UtilityClass
public class EngineSetupReaders {

    @SneakyThrows
    public static EngineSetup fromYaml(final Path path) {
        return fromYaml(Files.readAllBytes(path));
    }

    @SneakyThrows
    public static EngineSetup fromYaml(final InputStream stream) {
        return fromYaml(stream.readAllBytes());
    }

    @SneakyThrows
    public static EngineSetup fromYaml(final byte[] content) {
        if (content.length == 0) {
            return EngineSetup.DEFAULT;
        }
        return yamlMapper().readValue(content, EngineSetup.class);
    }

    private static YAMLMapper yamlMapper() {
        final var mapper = YAMLMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .build();
        mapper.findAndRegisterModules();
        return mapper;
    }
}
