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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.IntentClassification;
import me.golemcore.memory.domain.model.MemoryEntry;
import me.golemcore.memory.port.inbound.MemoryStorePort;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Answers eligible queries straight from the memory store, bypassing agent
 * inference. Only high-confidence memory list queries qualify.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryFastPathService {

    private final QueryIntentClassifier intentClassifier;
    private final MemoryStorePort memoryStore;

    /**
     * @return the formatted answer, or empty when the query must go to the agent
     *         runtime
     */
    public Optional<String> tryFastPath(String query, String ownerId) {
        IntentClassification classification = intentClassifier.classify(query);
        if (!intentClassifier.isFastPathEligible(classification)) {
            return Optional.empty();
        }

        List<MemoryEntry> memories = memoryStore.listAll(ownerId);
        log.info("[FastPath] Served '{}' for {} from {} memories", query, ownerId, memories.size());
        return Optional.of(format(memories));
    }

    static String format(List<MemoryEntry> memories) {
        if (memories.isEmpty()) {
            return "No memories stored yet.";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Stored memories (").append(memories.size()).append("):\n");
        int index = 1;
        for (MemoryEntry memory : memories) {
            sb.append(index++).append(". ").append(memory.getText())
                    .append(" [").append(String.join(", ", memory.getTopics())).append("]\n");
        }
        return sb.toString().stripTrailing();
    }
}
