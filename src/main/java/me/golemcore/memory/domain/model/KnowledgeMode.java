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

import java.util.Locale;
import java.util.Optional;

/**
 * Routing mode for a knowledge query. {@code LOCAL} targets the local index,
 * {@code AUTO} lets the coordinator decide, every other mode is a LightRAG
 * retrieval mode and targets the graph service.
 */
public enum KnowledgeMode {

    LOCAL("local"),
    GLOBAL("global"),
    HYBRID("hybrid"),
    MIX("mix"),
    NAIVE("naive"),
    BYPASS("bypass"),
    AUTO("auto");

    private final String wireName;

    KnowledgeMode(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isGraphMode() {
        return this != LOCAL && this != AUTO;
    }

    /**
     * Parses a mode name. Blank input and {@code "none"} mean {@code AUTO};
     * unrecognized names yield empty.
     */
    public static Optional<KnowledgeMode> parse(String value) {
        if (value == null) {
            return Optional.of(AUTO);
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty() || "none".equals(normalized)) {
            return Optional.of(AUTO);
        }
        for (KnowledgeMode mode : values()) {
            if (mode.wireName.equals(normalized)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
