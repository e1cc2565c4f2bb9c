package me.golemcore.memory.adapter.outbound.storage;

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

import me.golemcore.memory.domain.model.MemoryEntry;
import me.golemcore.memory.domain.service.TopicNormalizer;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Converts between {@link MemoryEntry} and its persisted {@link MemoryRecord}.
 */
@Component
public class MemoryRecordMapper {

    public MemoryRecord toRecord(MemoryEntry entry) {
        return MemoryRecord.builder()
                .id(entry.getId())
                .ownerId(entry.getOwnerId())
                .text(entry.getText())
                .topics(entry.getTopics())
                .confidence(entry.getConfidence())
                .proxy(entry.isProxy())
                .proxyAgent(entry.getProxyAgent())
                .createdAt(entry.getCreatedAt().toString())
                .updatedAt(entry.getUpdatedAt().toString())
                .build();
    }

    /**
     * Build an entry from a stored record, applying defaults for fields older
     * rows lack.
     *
     * @param fallbackOwnerId
     *            owner to assume when the record does not name one
     * @throws IllegalArgumentException
     *             if the record has no id or text, or an invalid confidence
     */
    public MemoryEntry toEntry(MemoryRecord memoryRecord, String fallbackOwnerId) {
        String ownerId = memoryRecord.getOwnerId() != null ? memoryRecord.getOwnerId() : fallbackOwnerId;
        Instant updatedAt = parseTimestamp(memoryRecord.getUpdatedAt());
        Instant createdAt = memoryRecord.getCreatedAt() != null ? parseTimestamp(memoryRecord.getCreatedAt())
                : updatedAt;

        return MemoryEntry.builder()
                .id(memoryRecord.getId())
                .ownerId(ownerId)
                .text(memoryRecord.getText())
                .topics(TopicNormalizer.normalize(memoryRecord.getTopics()))
                .confidence(memoryRecord.getConfidence() != null ? memoryRecord.getConfidence()
                        : MemoryEntry.DEFAULT_CONFIDENCE)
                .proxy(Boolean.TRUE.equals(memoryRecord.getProxy()))
                .proxyAgent(memoryRecord.getProxyAgent())
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }

    /**
     * Accepts ISO instants, zone-less ISO date-times (read as UTC) and epoch
     * seconds.
     */
    static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            return Instant.parse(trimmed);
        } catch (DateTimeParseException notInstant) {
            try {
                return LocalDateTime.parse(trimmed.replace(' ', 'T')).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException notLocal) {
                try {
                    double seconds = Double.parseDouble(trimmed);
                    return Instant.ofEpochMilli(Math.round(seconds * 1000));
                } catch (NumberFormatException notNumber) {
                    throw new IllegalArgumentException("Unrecognized timestamp: " + value, notNumber);
                }
            }
        }
    }
}
