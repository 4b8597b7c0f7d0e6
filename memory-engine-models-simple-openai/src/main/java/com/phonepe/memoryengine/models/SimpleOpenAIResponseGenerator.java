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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.phonepe.memoryengine.core.errors.EngineError;
import com.phonepe.memoryengine.core.errors.EngineException;
import com.phonepe.memoryengine.core.errors.ErrorType;
import com.phonepe.memoryengine.core.generation.ChunkSink;
import com.phonepe.memoryengine.core.generation.ComprehensionAssessor;
import com.phonepe.memoryengine.core.generation.GeneratedResponse;
import com.phonepe.memoryengine.core.generation.KeywordComprehensionAssessor;
import com.phonepe.memoryengine.core.generation.PromptContext;
import com.phonepe.memoryengine.core.generation.ResponseGenerator;
import com.phonepe.memoryengine.core.model.MessageRole;
import com.phonepe.memoryengine.core.utils.JsonUtils;
import io.github.sashirestela.openai.domain.chat.Chat;
import io.github.sashirestela.openai.domain.chat.ChatMessage;
import io.github.sashirestela.openai.domain.chat.ChatRequest;
import io.github.sashirestela.openai.service.ChatCompletionServices;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.phonepe.memoryengine.core.utils.EngineUtils.engineException;
import static com.phonepe.memoryengine.core.utils.EngineUtils.rootCause;

/**
 * {@link ResponseGenerator} on an OpenAI compatible chat completion API. The request carries the turn's
 * instructions as the system message, the most recent history and the rendered prompt as the last user message.
 * The comprehension signal is read from the user's message.
 */
@Slf4j
public class SimpleOpenAIResponseGenerator implements ResponseGenerator {
    private final String modelName;
    private final ChatCompletionServices completionServices;
    private final SimpleOpenAIGeneratorOptions options;
    private final ComprehensionAssessor comprehensionAssessor;
    private final ExecutorService executorService;
    private final ObjectMapper mapper;

    @Builder
    public SimpleOpenAIResponseGenerator(
            @NonNull String modelName,
            @NonNull ChatCompletionServices completionServices,
            SimpleOpenAIGeneratorOptions options,
            ComprehensionAssessor comprehensionAssessor,
            ExecutorService executorService,
            ObjectMapper mapper) {
        this.modelName = modelName;
        this.completionServices = completionServices;
        this.options = Objects.requireNonNullElse(options, SimpleOpenAIGeneratorOptions.DEFAULT);
        this.comprehensionAssessor = Objects.requireNonNullElseGet(comprehensionAssessor,
                                                                   KeywordComprehensionAssessor::new);
        this.executorService = Objects.requireNonNullElseGet(executorService, Executors::newCachedThreadPool);
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
    }

    @Override
    public GeneratedResponse generate(PromptContext context) {
        final var request = toChatRequest(context);
        logModelRequest(request);
        final Chat completion;
        try {
            completion = completionServices.chatCompletions()
                    .create(request)
                    .join();
        }
        catch (Exception e) {
            throw failure(context, e);
        }
        logModelResponse(completion);
        final var choice = extractResponse(completion);
        if (null == choice || null == choice.getMessage() || Strings.isNullOrEmpty(choice.getMessage().getContent())) {
            throw EngineException.of(ErrorType.GENERATION_FAILURE, "model returned no content");
        }
        return new GeneratedResponse(choice.getMessage().getContent(),
                                     comprehensionAssessor.assess(context.getUserMessage()));
    }

    @Override
    public CompletableFuture<GeneratedResponse> generateStream(PromptContext context, ChunkSink sink) {
        final var request = toChatRequest(context);
        logModelRequest(request);
        return CompletableFuture.supplyAsync(() -> {
            final var text = new StringBuilder();
            try (final var chunks = completionServices.chatCompletions().createStream(request).join()) {
                final var iterator = chunks.iterator();
                while (iterator.hasNext()) {
                    final var choice = extractResponse(iterator.next());
                    if (null == choice || null == choice.getMessage()) {
                        continue;
                    }
                    final var content = choice.getMessage().getContent();
                    if (Strings.isNullOrEmpty(content)) {
                        continue;
                    }
                    text.append(content);
                    if (!sink.accept(content)) {
                        log.debug("Consumer for session {} went away, stopping generation", context.getSessionId());
                        break;
                    }
                }
            }
            catch (Exception e) {
                throw failure(context, e);
            }
            if (text.length() == 0) {
                throw EngineException.of(ErrorType.GENERATION_FAILURE, "model returned no content");
            }
            return new GeneratedResponse(text.toString(), comprehensionAssessor.assess(context.getUserMessage()));
        }, executorService);
    }

    private ChatRequest toChatRequest(final PromptContext context) {
        final var messages = new ArrayList<ChatMessage>();
        messages.add(ChatMessage.SystemMessage.of(context.getInstructions()));
        final var history = context.getHistory();
        history.subList(Math.max(0, history.size() - options.getMaxHistoryMessages()), history.size())
                .stream()
                .filter(message -> !Strings.isNullOrEmpty(message.getContent()))
                .forEach(message -> {
                    if (message.getRole() == MessageRole.USER) {
                        messages.add(ChatMessage.UserMessage.of(message.getContent()));
                    }
                    else if (message.getRole() == MessageRole.ASSISTANT) {
                        messages.add(ChatMessage.AssistantMessage.of(message.getContent()));
                    }
                });
        messages.add(ChatMessage.UserMessage.of(context.getPrompt()));
        final var builder = ChatRequest.builder()
                .messages(List.copyOf(messages))
                .model(modelName)
                .n(1);
        if (null != options.getTemperature()) {
            builder.temperature(options.getTemperature());
        }
        if (null != options.getMaxTokens()) {
            builder.maxCompletionTokens(options.getMaxTokens());
        }
        return builder.build();
    }

    private static Chat.Choice extractResponse(Chat completionResponse) {
        if (null == completionResponse || null == completionResponse.getChoices()) {
            return null;
        }
        return completionResponse
                .getChoices()
                .stream()
                .findFirst()
                .orElse(null);
    }

    private static EngineException failure(final PromptContext context, final Exception e) {
        return engineException(e).orElseGet(() -> {
            log.error("Model call failed for session {}. Error: {}",
                      context.getSessionId(), rootCause(e).getMessage());
            return new EngineException(EngineError.error(ErrorType.GENERATION_FAILURE, e), e);
        });
    }

    private void logModelRequest(Object node) {
        logDataDebug("Request to model: {}", node);
    }

    private void logModelResponse(Object node) {
        logDataDebug("Response from model: {}", node);
    }

    private void logDataDebug(String fmtStr, Object node) {
        if (log.isDebugEnabled()) {
            try {
                log.debug(fmtStr, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node));
            }
            catch (JsonProcessingException e) {
                log.debug("Could not serialize model payload: {}", e.getMessage());
            }
        }
    }
}
