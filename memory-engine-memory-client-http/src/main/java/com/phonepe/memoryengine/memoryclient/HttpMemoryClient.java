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

package com.phonepe.memoryengine.memoryclient;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.phonepe.memoryengine.core.errors.EngineError;
import com.phonepe.memoryengine.core.errors.EngineException;
import com.phonepe.memoryengine.core.errors.ErrorType;
import com.phonepe.memoryengine.core.memory.MemoryClient;
import com.phonepe.memoryengine.core.memory.MemoryFact;
import com.phonepe.memoryengine.core.memory.MemoryQuery;
import com.phonepe.memoryengine.core.memory.MemoryRecord;
import com.phonepe.memoryengine.core.memory.UpsertAck;
import com.phonepe.memoryengine.core.model.Realm;
import com.phonepe.memoryengine.core.retry.RetryPolicies;
import com.phonepe.memoryengine.core.retry.RetrySetup;
import com.phonepe.memoryengine.core.utils.JsonUtils;
import dev.failsafe.Failsafe;
import dev.failsafe.RetryPolicy;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

import static com.phonepe.memoryengine.core.utils.EngineUtils.rootCause;

/**
 * {@link MemoryClient} for the memory service HTTP API.
 * <ul>
 *     <li>{@code POST /memory/search} searches one realm entity</li>
 *     <li>{@code POST /memory/entities} upserts facts keyed by {@code fact_key}</li>
 * </ul>
 * Server errors and I/O failures on searches are retried. Upserts are attempted once and fail with
 * {@link ErrorType#MEMORY_CLIENT_FAILURE}, consolidation jobs own the retries for writes. Client errors are reported
 * as {@link ErrorType#MEMORY_CLIENT_REJECTED} and never retried.
 */
@Slf4j
public class HttpMemoryClient implements MemoryClient {
    public static final RetrySetup DEFAULT_RETRY_SETUP = RetrySetup.builder()
            .maxAttempts(3)
            .initialDelay(Duration.ofMillis(200))
            .maxDelay(Duration.ofSeconds(2))
            .retriableErrorTypes(Set.of(ErrorType.MEMORY_CLIENT_FAILURE))
            .build();

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final TypeReference<List<MemoryEntityPayload>> ENTITIES = new TypeReference<>() {
    };
    private static final TypeReference<List<UpsertResultPayload>> UPSERT_RESULTS = new TypeReference<>() {
    };

    private final HttpUrl baseUrl;
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final RetryPolicy<Object> retryPolicy;

    /**
     * @param baseUrl    Base URL of the memory service
     * @param httpClient Client to use, a default one when null
     * @param mapper     Mapper, {@link JsonUtils#createMapper()} when null
     * @param retrySetup Retries for transient search failures, {@link #DEFAULT_RETRY_SETUP} when null
     */
    @Builder
    public HttpMemoryClient(
            @NonNull String baseUrl,
            OkHttpClient httpClient,
            ObjectMapper mapper,
            RetrySetup retrySetup) {
        this.baseUrl = HttpUrl.get(baseUrl);
        this.httpClient = Objects.requireNonNullElseGet(httpClient, OkHttpClient::new);
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        this.retryPolicy = RetryPolicies.<Object>exponentialBuilder(
                        Objects.requireNonNullElse(retrySetup, DEFAULT_RETRY_SETUP))
                .onRetry(event -> log.warn("Retrying memory service call. Attempt: {} Error: {}",
                                           event.getAttemptCount(),
                                           rootCause(event.getLastException()).getMessage()))
                .build();
    }

    @Override
    public List<MemoryRecord> search(MemoryQuery query) {
        final var identity = query.getIdentity();
        final var url = baseUrl.newBuilder()
                .addPathSegments("memory/search")
                .addQueryParameter("client_user_id", identity.getClientId())
                .addQueryParameter("actor_type", identity.getActorType())
                .addQueryParameter("actor_id", identity.getActorId())
                .addQueryParameter("realm", query.getRealm().name())
                .build();
        final var payload = SearchPayload.builder()
                .query(query.getAnchorQuery())
                .limit(query.getMaxResults())
                .minConfidence(query.getMinRelevance())
                .maxDepth(query.getMaxDepth())
                .entityIds(List.of(query.getEntityId()))
                .build();
        final List<MemoryEntityPayload> entities = withRetries(() -> post(url, payload, ENTITIES));
        log.debug("Memory service returned {} entities for realm {} entity {}",
                  entities.size(), query.getRealm(), query.getEntityId());
        return entities.stream()
                .filter(entity -> !Strings.isNullOrEmpty(entity.getId()))
                .map(MemoryEntityPayload::toRecord)
                .toList();
    }

    /**
     * Single attempt. A retryable failure is left to the caller so a consolidation job does not multiply its own
     * attempts by the client's.
     */
    @Override
    public UpsertAck upsert(Realm realm, String entityId, List<MemoryFact> facts) {
        if (facts.isEmpty()) {
            return new UpsertAck(0, 0);
        }
        final var urlBuilder = baseUrl.newBuilder()
                .addPathSegments("memory/entities")
                .addQueryParameter("realm", realm.name())
                .addQueryParameter("entity_id", entityId);
        if (realm == Realm.ACTOR) {
            urlBuilder.addQueryParameter("actor_id", entityId);
        }
        final var url = urlBuilder.build();
        final var payload = facts.stream().map(FactPayload::from).toList();
        final List<UpsertResultPayload> results = post(url, payload, UPSERT_RESULTS);
        final var created = (int) results.stream()
                .filter(result -> UpsertResultPayload.CREATED.equalsIgnoreCase(result.getStatus()))
                .count();
        final var updated = (int) results.stream()
                .filter(result -> UpsertResultPayload.UPDATED.equalsIgnoreCase(result.getStatus()))
                .count();
        log.info("Upserted {} facts for {} {}: {} created, {} updated",
                 facts.size(), realm, entityId, created, updated);
        return new UpsertAck(created, updated);
    }

    private <T> T withRetries(Supplier<T> call) {
        return Failsafe.with(retryPolicy).get(call::get);
    }

    private <T> List<T> post(HttpUrl url, Object payload, TypeReference<List<T>> responseType) {
        final var request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(JsonUtils.write(mapper, payload), JSON))
                .build();
        try (final var response = httpClient.newCall(request).execute()) {
            final var responseBody = response.body();
            final var body = null == responseBody ? "" : responseBody.string();
            if (response.code() >= 500) {
                throw EngineException.of(ErrorType.MEMORY_CLIENT_FAILURE,
                                         "%s returned %d: %s".formatted(url.encodedPath(), response.code(), body));
            }
            if (!response.isSuccessful()) {
                log.error("Memory service rejected call to {}. Status: {} Body: {}",
                          url.encodedPath(), response.code(), body);
                throw EngineException.of(ErrorType.MEMORY_CLIENT_REJECTED,
                                         "%s returned %d: %s".formatted(url.encodedPath(), response.code(), body));
            }
            if (Strings.isNullOrEmpty(body)) {
                return List.of();
            }
            final List<T> parsed = mapper.readValue(body, responseType);
            return Objects.requireNonNullElseGet(parsed, List::<T>of);
        }
        catch (IOException e) {
            throw new EngineException(EngineError.error(ErrorType.MEMORY_CLIENT_FAILURE, e), e);
        }
    }
}
