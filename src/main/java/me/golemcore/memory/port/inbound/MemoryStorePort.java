package me.golemcore.memory.port.inbound;

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

import me.golemcore.memory.domain.model.IngestResult;
import me.golemcore.memory.domain.model.MemoryEntry;
import me.golemcore.memory.domain.model.MemoryStats;
import me.golemcore.memory.domain.model.ScoredMemory;
import me.golemcore.memory.domain.model.StorageResult;

import java.util.Collection;
import java.util.List;

/**
 * Library surface of the semantic memory store, consumed by the agent runtime.
 *
 * <p>
 * Every operation is scoped to a single owner. Expected conditions (empty or
 * oversized content, duplicates, storage failures) are reported through the
 * return value and never thrown.
 */
public interface MemoryStorePort {

    /**
     * Admit a memory with auto-classified topics and full confidence.
     */
    default StorageResult add(String text, String ownerId) {
        return add(text, ownerId, null, MemoryEntry.DEFAULT_CONFIDENCE, false, null);
    }

    /**
     * Admit a memory with caller-supplied topics.
     */
    default StorageResult add(String text, String ownerId, Collection<String> topics) {
        return add(text, ownerId, topics, MemoryEntry.DEFAULT_CONFIDENCE, false, null);
    }

    /**
     * Admit a memory.
     *
     * @param text
     *            memory content
     * @param ownerId
     *            owner namespace
     * @param topics
     *            caller topics merged with auto-classified ones, may be
     *            {@code null}
     * @param confidence
     *            1.0 for user-asserted facts, lower for inferred ones
     * @param proxy
     *            whether a delegated agent produced the memory
     * @param proxyAgent
     *            producing agent name, ignored unless {@code proxy}
     */
    StorageResult add(String text, String ownerId, Collection<String> topics, double confidence, boolean proxy,
            String proxyAgent);

    /**
     * Search with the configured default limit and threshold and no topic
     * boost.
     */
    List<ScoredMemory> search(String query, String ownerId);

    List<ScoredMemory> search(String query, String ownerId, int limit, double similarityThreshold,
            double topicBoost);

    List<MemoryEntry> listAll(String ownerId);

    List<MemoryEntry> listByTopic(String ownerId, Collection<String> topics);

    boolean delete(String memoryId, String ownerId);

    int deleteByTopic(String ownerId, Collection<String> topics);

    int deleteAll(String ownerId);

    StorageResult updateConfidence(String memoryId, String ownerId, double confidence);

    MemoryStats stats(String ownerId);

    /**
     * Extract memorable statements from free text and admit each one.
     */
    IngestResult ingest(String text, String ownerId);
}
