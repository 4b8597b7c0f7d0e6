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

package com.phonepe.memoryengine.models;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import com.phonepe.memoryengine.core.errors.EngineException;
import com.phonepe.memoryengine.core.errors.ErrorType;
import com.phonepe.memoryengine.core.generation.ComprehensionSignal;
import com.phonepe.memoryengine.core.generation.PromptContext;
import com.phonepe.memoryengine.core.model.ChatMessage;
import com.phonepe.memoryengine.core.model.MessageRole;
import com.phonepe.memoryengine.core.model.Mode;
import com.phonepe.memoryengine.core.utils.JsonUtils;
import io.github.sashirestela.cleverclient.client.OkHttpClientAdapter;
import io.github.sashirestela.openai.SimpleOpenAIAzure;
import lombok.SneakyThrows;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests {@link SimpleOpenAIResponseGenerator}
 */
@WireMockTest
class SimpleOpenAIResponseGeneratorTest {
    private static final String COMPLETIONS_URL = "/chat/completions?api-version=2024-10-21";
    private static final String ANSWER
            = "Open the HR portal, choose your dates and submit the request for approval.";

    private static SimpleOpenAIResponseGenerator generator(final WireMockRuntimeInfo wiremock) {
        final var mapper = JsonUtils.createMapper();
        return SimpleOpenAIResponseGenerator.builder()
                .modelName("gpt-4o")
                .completionServices(SimpleOpenAIAzure.builder()
                                            .baseUrl(wiremock.getHttpBaseUrl())
                                            .apiKey("BLAH")
                                            .apiVersion("2024-10-21")
                                            .objectMapper(mapper)
                                            .clientAdapter(new OkHttpClientAdapter(new OkHttpClient.Builder()
                                                                                           .build()))
                                            .build())
                .options(SimpleOpenAIGeneratorOptions.builder()
                                 .temperature(0.1)
                                 .maxHistoryMessages(2)
                                 .build())
                .mapper(mapper)
                .build();
    }

    private static PromptContext context(String userMessage) {
        final var now = Instant.now();
        return PromptContext.builder()
                .sessionId("s1")
                .mode(Mode.AGENT)
                .instructions("You are a precise assistant that completes tasks for the user.")
                .prompt("Relevant procedures:\n- Vacation request steps\n\nUser: " + userMessage)
                .userMessage(userMessage)
                .history(List.of(
                        message("m1", MessageRole.USER, "Hello", now),
                        message("m2", MessageRole.ASSISTANT, "Hi, how can I help?", now),
                        message("m3", MessageRole.USER, "I need some time off", now)))
                .build();
    }

    private static ChatMessage message(String id, MessageRole role, String content, Instant timestamp) {
        return ChatMessage.builder()
                .messageId(id)
                .role(role)
                .content(content)
                .mode(Mode.AGENT)
                .timestamp(timestamp)
                .build();
    }

    @SneakyThrows
    private static String readStubFile(String name) {
        return Files.readString(Path.of(Objects.requireNonNull(
                SimpleOpenAIResponseGeneratorTest.class.getResource("/wiremock/%s".formatted(name))).toURI()));
    }

    @Test
    void testGenerate(final WireMockRuntimeInfo wiremock) {
        stubFor(post(COMPLETIONS_URL)
                        .withRequestBody(matchingJsonPath("$.model", equalTo("gpt-4o")))
                        .willReturn(okJson(readStubFile("chat.1.json"))));

        final var response = generator(wiremock).generate(context("Got it, what about carry over days?"));

        assertEquals(ANSWER, response.getText());
        assertEquals(ComprehensionSignal.COMPREHENDED, response.getComprehension());
        verify(postRequestedFor(urlEqualTo(COMPLETIONS_URL))
                       .withRequestBody(matchingJsonPath("$.messages[2].content", equalTo("I need some time off")))
                       .withRequestBody(matchingJsonPath("$.messages[0].role", equalTo("system")))
                       .withRequestBody(matchingJsonPath("$.messages[1].content", equalTo("Hi, how can I help?")))
                       .withRequestBody(matchingJsonPath("$.messages[3].content",
                                                         containing("Vacation request steps"))));
    }

    @Test
    void testGenerateFailure(final WireMockRuntimeInfo wiremock) {
        stubFor(post(COMPLETIONS_URL).willReturn(serverError()));

        final var error = assertThrows(EngineException.class,
                                       () -> generator(wiremock).generate(context("How do I request leave?")));

        assertEquals(ErrorType.GENERATION_FAILURE, error.getErrorType());
    }

    @Test
    @SneakyThrows
    void testStreaming(final WireMockRuntimeInfo wiremock) {
        stubFor(post(COMPLETIONS_URL)
                        .withRequestBody(matchingJsonPath("$.stream", equalTo("true")))
                        .willReturn(okForContentType("text/event-stream", readStubFile("stream.1.json"))));
        final var chunks = new CopyOnWriteArrayList<String>();

        final var response = generator(wiremock)
                .generateStream(context("I'm lost, can you make it simpler?"), chunks::add)
                .get(10, TimeUnit.SECONDS);

        assertEquals(ANSWER, response.getText());
        assertEquals(ComprehensionSignal.CONFUSED, response.getComprehension());
        assertEquals(List.of("Open the HR portal, ", "choose your dates ", "and submit the request ",
                             "for approval."),
                     chunks);
    }

    @Test
    @SneakyThrows
    void testStreamingStopsWhenConsumerLeaves(final WireMockRuntimeInfo wiremock) {
        stubFor(post(COMPLETIONS_URL)
                        .willReturn(okForContentType("text/event-stream", readStubFile("stream.1.json"))));
        final var chunks = new CopyOnWriteArrayList<String>();

        final var response = generator(wiremock)
                .generateStream(context("How do I request leave?"), chunk -> {
                    chunks.add(chunk);
                    return chunks.size() < 2;
                })
                .get(10, TimeUnit.SECONDS);

        assertEquals(2, chunks.size());
        assertEquals("Open the HR portal, choose your dates ", response.getText());
    }

    @Test
    void testStreamingFailure(final WireMockRuntimeInfo wiremock) {
        stubFor(post(COMPLETIONS_URL).willReturn(serverError()));

        final var future = generator(wiremock).generateStream(context("How do I request leave?"), chunk -> true);

        final var error = assertThrows(CompletionException.class, future::join);
        final var cause = assertInstanceOf(EngineException.class, error.getCause());
        assertEquals(ErrorType.GENERATION_FAILURE, cause.getErrorType());
    }
}
