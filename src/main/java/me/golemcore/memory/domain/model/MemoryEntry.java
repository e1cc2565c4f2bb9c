package me.golemcore.memory.domain.model;

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

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

/**
 * A single persisted fact about a user together with its provenance metadata.
 *
 * <p>
 * Entries are immutable. {@link me.golemcore.memory.domain.service.SemanticMemoryService}
 * owns their lifecycle: callers receive entries but never build or change them.
 * The only sanctioned mutation, a confidence update, produces a new instance via
 * {@link #withConfidence(double, Instant)}.
 *
 * <p>
 * Invariants enforced on construction:
 * <ul>
 * <li>{@code id}, {@code ownerId} and {@code text} are non-blank</li>
 * <li>{@code confidence} lies in [0.0, 1.0]</li>
 * <li>{@code topics} is never empty, defaulting to {@code ["general"]}</li>
 * <li>{@code proxyAgent} is only kept for proxy entries</li>
 * </ul>
 */
@Getter
@EqualsAndHashCode
@ToString
public final class MemoryEntry {

    public static final String DEFAULT_TOPIC = "general";
    public static final double DEFAULT_CONFIDENCE = 1.0;

    private final String id;
    private final String ownerId;
    private final String text;
    private final List<String> topics;
    private final double confidence;
    private final boolean proxy;
    private final String proxyAgent;
    private final Instant createdAt;
    private final Instant updatedAt;

    @Builder(toBuilder = true)
    private MemoryEntry(String id, String ownerId, String text, List<String> topics, Double confidence,
            Boolean proxy, String proxyAgent, Instant createdAt, Instant updatedAt) {
        this.id = requireText(id, "id");
        this.ownerId = requireText(ownerId, "ownerId");
        this.text = requireText(text, "text");
        this.topics = topics == null || topics.isEmpty() ? List.of(DEFAULT_TOPIC) : List.copyOf(topics);
        this.confidence = confidence != null ? requireConfidence(confidence) : DEFAULT_CONFIDENCE;
        this.proxy = Boolean.TRUE.equals(proxy);
        this.proxyAgent = this.proxy && proxyAgent != null && !proxyAgent.isBlank() ? proxyAgent : null;
        this.createdAt = createdAt != null ? createdAt : Instant.EPOCH;
        this.updatedAt = updatedAt != null ? updatedAt : this.createdAt;
    }

    /**
     * Returns a copy carrying the new confidence and modification timestamp.
     */
    public MemoryEntry withConfidence(double newConfidence, Instant modifiedAt) {
        return toBuilder()
                .confidence(newConfidence)
                .updatedAt(modifiedAt)
                .build();
    }

    public boolean hasTopic(String topic) {
        if (topic == null) {
            return false;
        }
        for (String own : topics) {
            if (own.equalsIgnoreCase(topic)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks that a confidence value lies in the closed unit interval.
     */
    public static boolean isValidConfidence(double value) {
        return !Double.isNaN(value) && value >= 0.0 && value <= 1.0;
    }

    private static double requireConfidence(double value) {
        if (!isValidConfidence(value)) {
            throw new IllegalArgumentException("confidence must be within [0.0, 1.0], got " + value);
        }
        return value;
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
