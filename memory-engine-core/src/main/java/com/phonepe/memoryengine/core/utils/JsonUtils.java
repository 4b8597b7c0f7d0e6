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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.phonepe.memoryengine.core.errors.EngineError;
import com.phonepe.memoryengine.core.errors.EngineException;
import com.phonepe.memoryengine.core.errors.ErrorType;
import lombok.experimental.UtilityClass;

import java.io.IOException;

/**
 * Mapper creation and checked-exception free (de)serialization helpers
 */
@UtilityClass
public class JsonUtils {

    public static JsonMapper createMapper() {
        final var mapper = new JsonMapper();
        mapper.findAndRegisterModules()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS);
        return mapper;
    }

    public static String write(final ObjectMapper mapper, final Object value) {
        try {
            return mapper.writeValueAsString(value);
        }
        catch (IOException e) {
            throw new EngineException(EngineError.error(ErrorType.SERIALIZATION_ERROR, e), e);
        }
    }

    public static <T> T read(final ObjectMapper mapper, final String value, final Class<T> clazz) {
        try {
            return mapper.readValue(value, clazz);
        }
        catch (IOException e) {
            throw new EngineException(EngineError.error(ErrorType.DESERIALIZATION_ERROR, e), e);
        }
    }
}
