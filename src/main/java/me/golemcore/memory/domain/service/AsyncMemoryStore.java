package me.golemcore.memory.domain.service;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.memory.domain.model.IngestResult;
import me.golemcore.memory.domain.model.MemoryEntry;
import me.golemcore.memory.domain.model.ScoredMemory;
import me.golemcore.memory.domain.model.StorageResult;
import me.golemcore.memory.port.inbound.MemoryStorePort;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Thin asynchronous facade over {@link MemoryStorePort} for callers running on
 * an event loop. Holds no logic of its own.
 */
@Component
@RequiredArgsConstructor
public class AsyncMemoryStore {

    private final MemoryStorePort memoryStore;

    public CompletableFuture<StorageResult> add(String text, String ownerId) {
        return CompletableFuture.supplyAsync(() -> memoryStore.add(text, ownerId));
    }

    public CompletableFuture<StorageResult> add(String text, String ownerId, Collection<String> topics,
            double confidence, boolean proxy, String proxyAgent) {
        return CompletableFuture.supplyAsync(
                () -> memoryStore.add(text, ownerId, topics, confidence, proxy, proxyAgent));
    }

    public CompletableFuture<List<ScoredMemory>> search(String query, String ownerId, int limit,
            double similarityThreshold, double topicBoost) {
        return CompletableFuture.supplyAsync(
                () -> memoryStore.search(query, ownerId, limit, similarityThreshold, topicBoost));
    }

    public CompletableFuture<List<MemoryEntry>> listAll(String ownerId) {
        return CompletableFuture.supplyAsync(() -> memoryStore.listAll(ownerId));
    }

    public CompletableFuture<Boolean> delete(String memoryId, String ownerId) {
        return CompletableFuture.supplyAsync(() -> memoryStore.delete(memoryId, ownerId));
    }

    public CompletableFuture<IngestResult> ingest(String text, String ownerId) {
        return CompletableFuture.supplyAsync(() -> memoryStore.ingest(text, ownerId));
    }
}
