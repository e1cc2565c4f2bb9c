package me.golemcore.memory.adapter.outbound.rag;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.KnowledgeSettings;
import me.golemcore.memory.infrastructure.config.MemoryEngineProperties;
import me.golemcore.memory.port.outbound.GraphRagPort;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * LightRAG adapter: queries the LightRAG knowledge graph REST API over HTTP.
 *
 * <p>
 * Endpoint: {@code POST {url}/query} with
 * {@code {"query", "mode", "top_k", "response_type"}}. The answer is read from
 * the {@code response} field, then {@code content}, then {@code answer}; any
 * other body is returned as raw text.
 *
 * <p>
 * Calls are asynchronous. The returned future fails with
 * {@link GraphRagException} on transport errors and non-2xx replies, and
 * cancelling it cancels the HTTP call. The client's call timeout is the
 * configured knowledge timeout, so a call never outlives it.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code memory-engine.rag.enabled} - Enable/disable the graph backend
 * <li>{@code memory-engine.rag.url} - LightRAG API base URL
 * <li>{@code memory-engine.rag.api-key} - Optional API key
 * <li>{@code memory-engine.rag.response-type} - LightRAG response format
 * </ul>
 *
 * @see me.golemcore.memory.domain.service.KnowledgeCoordinator
 */
@Component
@Slf4j
public class LightRagAdapter implements GraphRagPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final MemoryEngineProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public LightRagAdapter(MemoryEngineProperties properties, KnowledgeSettings knowledgeSettings,
            OkHttpClient baseHttpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;

        long timeoutMillis = knowledgeSettings.getTimeout().toMillis();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .build();
    }

    @Override
    public CompletableFuture<String> query(String query, String mode, int topK) {
        CompletableFuture<String> result = new CompletableFuture<>();
        if (!isAvailable()) {
            result.completeExceptionally(new GraphRagException("LightRAG is disabled", -1));
            return result;
        }

        Request request;
        try {
            String body = objectMapper.writeValueAsString(
                    new QueryRequest(query, mode, topK, properties.getRag().getResponseType()));
            Request.Builder requestBuilder = new Request.Builder()
                    .url(properties.getRag().getUrl() + "/query")
                    .post(RequestBody.create(body, JSON));
            addApiKeyHeader(requestBuilder);
            request = requestBuilder.build();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            result.completeExceptionally(new GraphRagException("Failed to build LightRAG request", e));
            return result;
        }

        log.debug("[RAG] Querying LightRAG (mode: {}, top_k: {}): {}", mode, topK, query);
        Call call = httpClient.newCall(request);
        result.whenComplete((answer, error) -> {
            if (result.isCancelled()) {
                call.cancel();
            }
        });
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failedCall, IOException e) {
                log.warn("[RAG] Query error: {}", e.getMessage());
                result.completeExceptionally(new GraphRagException("LightRAG request failed: " + e.getMessage(), e));
            }

            @Override
            public void onResponse(Call completedCall, Response response) {
                try (response) {
                    ResponseBody responseBody = response.body();
                    String responseStr = responseBody != null ? responseBody.string() : "";
                    if (!response.isSuccessful()) {
                        log.warn("[RAG] Query failed: HTTP {}", response.code());
                        result.completeExceptionally(new GraphRagException(
                                "LightRAG server error " + response.code() + ": " + responseStr, response.code()));
                        return;
                    }
                    result.complete(parseQueryResponse(responseStr));
                } catch (IOException e) {
                    result.completeExceptionally(
                            new GraphRagException("Failed to read LightRAG response: " + e.getMessage(), e));
                }
            }
        });
        return result;
    }

    @Override
    public boolean isAvailable() {
        return properties.getRag().isEnabled();
    }

    private void addApiKeyHeader(Request.Builder builder) {
        String apiKey = properties.getRag().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
    }

    String parseQueryResponse(String responseBody) {
        try {
            JsonNode node = objectMapper.readTree(responseBody);
            for (String field : new String[] { "response", "content", "answer" }) {
                if (node != null && node.hasNonNull(field)) {
                    return node.get(field).asText("");
                }
            }
            return responseBody.trim();
        } catch (JsonProcessingException e) {
            log.debug("[RAG] Failed to parse query response, using raw text");
            return responseBody.trim();
        }
    }

    // Request DTOs
    record QueryRequest(String query, String mode, @JsonProperty("top_k") int topK,
            @JsonProperty("response_type") String responseType) {
    }
}
