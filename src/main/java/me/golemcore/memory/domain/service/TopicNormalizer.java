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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.MemoryEntry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Single normalization point for topic lists.
 *
 * <p>
 * Topics reach the store as lists, as comma-separated strings or as JSON-array
 * strings. Every write path funnels them through {@link #normalize(Object)} so
 * that persisted topics are always a non-empty, lower-case, duplicate-free list.
 */
@Slf4j
public final class TopicNormalizer {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {
    };

    private TopicNormalizer() {
    }

    /**
     * Normalize a raw topics value.
     *
     * @param raw
     *            {@code null}, a {@link String} or a {@link Collection}
     * @return ordered, de-duplicated topics, {@code ["general"]} when empty
     */
    public static List<String> normalize(Object raw) {
        Set<String> topics = new LinkedHashSet<>();
        collect(raw, topics);
        if (topics.isEmpty()) {
            return List.of(MemoryEntry.DEFAULT_TOPIC);
        }
        return List.copyOf(topics);
    }

    /**
     * Merge topic lists preserving first-seen order. The {@code general}
     * placeholder is dropped when any specific topic is present.
     */
    public static List<String> merge(Collection<String> first, Collection<String> second) {
        List<Object> all = new ArrayList<>();
        if (first != null) {
            all.addAll(first);
        }
        if (second != null) {
            all.addAll(second);
        }
        List<String> merged = normalize(all);
        if (merged.size() > 1 && merged.contains(MemoryEntry.DEFAULT_TOPIC)) {
            List<String> specific = new ArrayList<>(merged);
            specific.remove(MemoryEntry.DEFAULT_TOPIC);
            return List.copyOf(specific);
        }
        return merged;
    }

    private static void collect(Object raw, Set<String> sink) {
        if (raw == null) {
            return;
        }
        if (raw instanceof Collection<?> collection) {
            for (Object item : collection) {
                collect(item, sink);
            }
            return;
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return;
        }
        if (text.startsWith("[") && text.endsWith("]")) {
            collectJsonArray(text, sink);
            return;
        }
        Arrays.stream(text.split(","))
                .map(topic -> topic.trim().toLowerCase(Locale.ROOT))
                .filter(topic -> !topic.isEmpty())
                .forEach(sink::add);
    }

    private static void collectJsonArray(String text, Set<String> sink) {
        try {
            List<Object> items = JSON.readValue(text, LIST_TYPE);
            collect(items, sink);
        } catch (JsonProcessingException e) {
            log.debug("[Topics] Not a JSON array, splitting as text: {}", text);
            collect(text.substring(1, text.length() - 1).replace("'", "").replace("\"", ""), sink);
        }
    }
}
