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
import me.golemcore.memory.domain.model.DuplicateVerdict;
import me.golemcore.memory.domain.model.IngestResult;
import me.golemcore.memory.domain.model.MemoryEntry;
import me.golemcore.memory.domain.model.MemorySettings;
import me.golemcore.memory.domain.model.MemoryStats;
import me.golemcore.memory.domain.model.ScoredMemory;
import me.golemcore.memory.domain.model.StorageResult;
import me.golemcore.memory.domain.model.StorageStatus;
import me.golemcore.memory.port.inbound.MemoryStorePort;
import me.golemcore.memory.port.outbound.MemoryRepositoryPort;
import me.golemcore.memory.port.outbound.MemoryStorageException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Semantic memory store: admission control, topic tagging, search and
 * statistics over one owner's memories.
 *
 * <p>
 * Write flow for {@link #add}:
 * <ol>
 * <li>Reject blank owner, empty or oversized content and invalid confidence
 * before any similarity work</li>
 * <li>Check the candidate against the owner's entries with
 * {@link DuplicateDetector}</li>
 * <li>Merge caller topics with {@link TopicClassifier} output</li>
 * <li>Persist through {@link MemoryRepositoryPort}</li>
 * </ol>
 *
 * <p>
 * Mutations for the same owner run under a per-owner lock so that the
 * duplicate check and the insert cannot interleave with another writer in this
 * process. Nothing is thrown for expected conditions: results carry a
 * {@link StorageStatus}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SemanticMemoryService implements MemoryStorePort {

    private static final double PARTIAL_TOPIC_MATCH = 0.8;
    private static final int MIN_TOPIC_QUERY_LENGTH = 3;

    private final MemoryRepositoryPort repository;
    private final TopicClassifier topicClassifier;
    private final DuplicateDetector duplicateDetector;
    private final QueryExpander queryExpander;
    private final MemoryStatementExtractor statementExtractor;
    private final MemorySettings settings;
    private final Clock clock;

    private final Map<String, ReentrantLock> ownerLocks = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> duplicateRejections = new ConcurrentHashMap<>();

    // ==================== WRITE ====================

    @Override
    public StorageResult add(String text, String ownerId, Collection<String> topics, double confidence,
            boolean proxy, String proxyAgent) {
        if (isBlank(ownerId)) {
            return StorageResult.failure(StorageStatus.VALIDATION_ERROR, "Owner id must not be blank");
        }
        if (isBlank(text)) {
            return StorageResult.failure(StorageStatus.CONTENT_EMPTY, "Memory content cannot be empty");
        }
        String content = text.strip();
        if (content.length() > settings.getMaxContentLength()) {
            log.warn("[Memory] Rejected oversized memory for {}: {} chars", ownerId, content.length());
            return StorageResult.failure(StorageStatus.CONTENT_TOO_LONG,
                    "Memory too long (" + content.length() + " > " + settings.getMaxContentLength() + " chars)");
        }
        if (!MemoryEntry.isValidConfidence(confidence)) {
            return StorageResult.failure(StorageStatus.VALIDATION_ERROR,
                    "Confidence must be within [0.0, 1.0], got " + confidence);
        }

        return withOwnerLock(ownerId, () -> admit(content, ownerId, topics, confidence, proxy, proxyAgent));
    }

    private StorageResult admit(String content, String ownerId, Collection<String> callerTopics, double confidence,
            boolean proxy, String proxyAgent) {
        try {
            List<MemoryEntry> existing = readOwned(ownerId);
            DuplicateVerdict verdict = duplicateDetector.check(content, existing);
            if (verdict.isDuplicate()) {
                duplicateRejections.computeIfAbsent(ownerId, key -> new AtomicLong()).incrementAndGet();
                log.info("[Memory] Rejected {} duplicate for {}: '{}' ~ '{}'",
                        verdict.getKind().name().toLowerCase(Locale.ROOT), ownerId, content, verdict.getMatchText());
                return StorageResult.duplicate(verdict, verdict.getMatchText());
            }

            List<String> topics = resolveTopics(content, callerTopics);
            Instant now = clock.instant();
            MemoryEntry entry = MemoryEntry.builder()
                    .id(UUID.randomUUID().toString())
                    .ownerId(ownerId)
                    .text(content)
                    .topics(topics)
                    .confidence(confidence)
                    .proxy(proxy)
                    .proxyAgent(proxyAgent)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            String id = repository.write(entry);
            log.info("[Memory] Added memory {} for {}: '{}' (topics: {})", id, ownerId, content, topics);
            return StorageResult.success(id, topics, "Memory added successfully");
        } catch (MemoryStorageException e) {
            log.error("[Memory] Failed to add memory for {}: {}", ownerId, e.getMessage(), e);
            return StorageResult.failure(StorageStatus.STORAGE_ERROR, "Error adding memory: " + e.getMessage());
        }
    }

    private List<String> resolveTopics(String content, Collection<String> callerTopics) {
        boolean callerSupplied = callerTopics != null && !callerTopics.isEmpty();
        List<String> supplied = callerSupplied ? TopicNormalizer.normalize(callerTopics) : List.of();
        if (!settings.isTopicClassificationEnabled()) {
            return TopicNormalizer.normalize(supplied);
        }
        return TopicNormalizer.merge(supplied, topicClassifier.classify(content));
    }

    @Override
    public StorageResult updateConfidence(String memoryId, String ownerId, double confidence) {
        if (isBlank(memoryId) || isBlank(ownerId)) {
            return StorageResult.failure(StorageStatus.VALIDATION_ERROR, "Memory id and owner id are required");
        }
        if (!MemoryEntry.isValidConfidence(confidence)) {
            return StorageResult.failure(StorageStatus.VALIDATION_ERROR,
                    "Confidence must be within [0.0, 1.0], got " + confidence);
        }

        return withOwnerLock(ownerId, () -> {
            try {
                Optional<MemoryEntry> current = findOwned(memoryId, ownerId);
                if (current.isEmpty()) {
                    return StorageResult.failure(StorageStatus.VALIDATION_ERROR,
                            "Memory " + memoryId + " not found");
                }
                MemoryEntry updated = current.get().withConfidence(confidence, clock.instant());
                repository.write(updated);
                log.info("[Memory] Updated confidence of {} to {}", memoryId, confidence);
                return StorageResult.success(memoryId, updated.getTopics(), "Memory updated successfully");
            } catch (MemoryStorageException e) {
                log.error("[Memory] Failed to update memory {}: {}", memoryId, e.getMessage(), e);
                return StorageResult.failure(StorageStatus.STORAGE_ERROR,
                        "Error updating memory: " + e.getMessage());
            }
        });
    }

    @Override
    public IngestResult ingest(String text, String ownerId) {
        List<String> statements = statementExtractor.extract(text);
        if (statements.isEmpty()) {
            log.debug("[Memory] No memorable statements found for {}", ownerId);
            return IngestResult.empty();
        }

        IngestResult.IngestResultBuilder result = IngestResult.builder();
        for (String statement : statements) {
            StorageResult stored = add(statement, ownerId);
            if (stored.isSuccess()) {
                result.addedResult(stored);
            } else {
                result.rejectedResult(stored);
            }
        }
        IngestResult ingested = result.build();
        log.info("[Memory] Ingested {} statements for {}: {} added, {} rejected",
                statements.size(), ownerId, ingested.getAddedCount(), ingested.getRejectedCount());
        return ingested;
    }

    // ==================== DELETE ====================

    @Override
    public boolean delete(String memoryId, String ownerId) {
        if (isBlank(memoryId) || isBlank(ownerId)) {
            return false;
        }
        return withOwnerLock(ownerId, () -> {
            try {
                if (findOwned(memoryId, ownerId).isEmpty()) {
                    log.warn("[Memory] Memory {} not found for {}", memoryId, ownerId);
                    return false;
                }
                boolean deleted = repository.delete(memoryId, ownerId);
                if (deleted) {
                    log.info("[Memory] Deleted memory {} for {}", memoryId, ownerId);
                }
                return deleted;
            } catch (MemoryStorageException e) {
                log.error("[Memory] Failed to delete memory {}: {}", memoryId, e.getMessage(), e);
                return false;
            }
        });
    }

    @Override
    public int deleteByTopic(String ownerId, Collection<String> topics) {
        if (isBlank(ownerId) || topics == null || topics.isEmpty()) {
            return 0;
        }
        return withOwnerLock(ownerId, () -> {
            List<MemoryEntry> matching = listByTopic(ownerId, topics);
            int deleted = deleteEntries(matching);
            log.info("[Memory] Deleted {} memories for topics {} of {}", deleted, topics, ownerId);
            return deleted;
        });
    }

    @Override
    public int deleteAll(String ownerId) {
        if (isBlank(ownerId)) {
            return 0;
        }
        return withOwnerLock(ownerId, () -> {
            int deleted = deleteEntries(listAll(ownerId));
            log.info("[Memory] Cleared {} memories of {}", deleted, ownerId);
            return deleted;
        });
    }

    private int deleteEntries(List<MemoryEntry> entries) {
        int deleted = 0;
        for (MemoryEntry entry : entries) {
            try {
                if (repository.delete(entry.getId(), entry.getOwnerId())) {
                    deleted++;
                }
            } catch (MemoryStorageException e) {
                log.error("[Memory] Failed to delete memory {}: {}", entry.getId(), e.getMessage(), e);
            }
        }
        return deleted;
    }

    // ==================== READ ====================

    @Override
    public List<ScoredMemory> search(String query, String ownerId) {
        return search(query, ownerId, settings.getDefaultSearchLimit(), settings.getDefaultSearchThreshold(), 0.0);
    }

    @Override
    public List<ScoredMemory> search(String query, String ownerId, int limit, double similarityThreshold,
            double topicBoost) {
        if (isBlank(query) || isBlank(ownerId) || limit <= 0) {
            return List.of();
        }

        List<String> queries = queryExpander.expand(query.strip());
        List<ScoredMemory> results = new ArrayList<>();
        for (MemoryEntry entry : listAll(ownerId)) {
            double contentScore = 0.0;
            for (String candidate : queries) {
                contentScore = Math.max(contentScore, TextSimilarity.searchScore(candidate, entry.getText()));
            }
            double score = contentScore + topicScore(queries, entry) * topicBoost;
            if (score >= similarityThreshold) {
                results.add(new ScoredMemory(entry, score));
            }
        }

        results.sort(Comparator.comparingDouble(ScoredMemory::score).reversed());
        List<ScoredMemory> limited = results.size() > limit ? List.copyOf(results.subList(0, limit))
                : List.copyOf(results);
        log.debug("[Memory] Search '{}' for {}: {} hits ({} expansions)", query, ownerId, limited.size(),
                queries.size());
        return limited;
    }

    private double topicScore(List<String> queries, MemoryEntry entry) {
        double best = 0.0;
        for (String topic : entry.getTopics()) {
            String readableTopic = topic.replace('_', ' ');
            for (String candidate : queries) {
                String normalized = TextSimilarity.normalize(candidate);
                if (normalized.length() < MIN_TOPIC_QUERY_LENGTH) {
                    continue;
                }
                if (normalized.equals(topic) || normalized.equals(readableTopic)) {
                    return 1.0;
                }
                if (normalized.contains(topic) || normalized.contains(readableTopic)
                        || topic.contains(normalized)) {
                    best = Math.max(best, PARTIAL_TOPIC_MATCH);
                }
            }
        }
        return best;
    }

    @Override
    public List<MemoryEntry> listAll(String ownerId) {
        if (isBlank(ownerId)) {
            return List.of();
        }
        try {
            return readOwned(ownerId);
        } catch (MemoryStorageException e) {
            log.error("[Memory] Failed to read memories of {}: {}", ownerId, e.getMessage(), e);
            return List.of();
        }
    }

    @Override
    public List<MemoryEntry> listByTopic(String ownerId, Collection<String> topics) {
        if (topics == null || topics.isEmpty()) {
            return List.of();
        }
        List<String> wanted = TopicNormalizer.normalize(topics);
        return listAll(ownerId).stream()
                .filter(entry -> wanted.stream().anyMatch(entry::hasTopic))
                .toList();
    }

    @Override
    public MemoryStats stats(String ownerId) {
        List<MemoryEntry> entries = listAll(ownerId);
        Map<String, Integer> distribution = new LinkedHashMap<>();
        long totalLength = 0;
        int proxyCount = 0;
        int updatedToday = 0;
        LocalDate today = LocalDate.now(clock);
        for (MemoryEntry entry : entries) {
            for (String topic : entry.getTopics()) {
                distribution.merge(topic, 1, Integer::sum);
            }
            totalLength += entry.getText().length();
            if (entry.isProxy()) {
                proxyCount++;
            }
            if (LocalDate.ofInstant(entry.getUpdatedAt(), clock.getZone()).equals(today)) {
                updatedToday++;
            }
        }

        String mostCommon = null;
        int mostCommonCount = 0;
        for (Map.Entry<String, Integer> topic : distribution.entrySet()) {
            if (topic.getValue() > mostCommonCount) {
                mostCommon = topic.getKey();
                mostCommonCount = topic.getValue();
            }
        }

        AtomicLong rejections = isBlank(ownerId) ? null : duplicateRejections.get(ownerId);
        return MemoryStats.builder()
                .ownerId(ownerId)
                .totalMemories(entries.size())
                .topicDistribution(distribution)
                .duplicateRejections(rejections != null ? rejections.get() : 0L)
                .averageTextLength(entries.isEmpty() ? 0.0 : (double) totalLength / entries.size())
                .mostCommonTopic(mostCommon)
                .updatedToday(updatedToday)
                .proxyMemories(proxyCount)
                .build();
    }

    // ==================== HELPERS ====================

    private Optional<MemoryEntry> findOwned(String memoryId, String ownerId) {
        return readOwned(ownerId).stream()
                .filter(entry -> memoryId.equals(entry.getId()))
                .findFirst();
    }

    private List<MemoryEntry> readOwned(String ownerId) {
        return repository.readAll(ownerId).stream()
                .filter(entry -> ownerId.equals(entry.getOwnerId()))
                .toList();
    }

    private <T> T withOwnerLock(String ownerId, Supplier<T> action) {
        ReentrantLock lock = ownerLocks.computeIfAbsent(ownerId, key -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
