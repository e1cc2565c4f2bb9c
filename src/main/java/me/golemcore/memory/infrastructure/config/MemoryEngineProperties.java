package me.golemcore.memory.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration binding for the memory engine, read from
 * {@code application.properties} under the {@code memory-engine.*} prefix.
 *
 * <p>
 * This object is mutable and only used at startup:
 * {@link EngineConfiguration} turns it into the immutable settings values the
 * domain services receive.
 */
@Component
@ConfigurationProperties(prefix = "memory-engine")
@Data
public class MemoryEngineProperties {

    private MemoryProperties memory = new MemoryProperties();
    private IntentProperties intent = new IntentProperties();
    private KnowledgeProperties knowledge = new KnowledgeProperties();
    private RagProperties rag = new RagProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();

    // ==================== MEMORY ====================

    @Data
    public static class MemoryProperties {
        private int maxContentLength = 500;
        private double semanticThreshold = 0.8;
        private double preferenceThreshold = 0.65;
        private boolean exactDedupEnabled = true;
        private boolean semanticDedupEnabled = true;
        private boolean topicClassificationEnabled = true;
        private int defaultSearchLimit = 10;
        private double defaultSearchThreshold = 0.3;
        private boolean queryExpansionEnabled = true;
    }

    // ==================== INTENT ====================

    @Data
    public static class IntentProperties {
        private boolean strictMode = true;
    }

    // ==================== KNOWLEDGE ====================

    @Data
    public static class KnowledgeProperties {
        private int timeoutSeconds = 30;
        private boolean fallbackEnabled = true;
        private String defaultGraphMode = "hybrid";
        private int defaultLimit = 5;
        private String documentsPath = "${user.home}/.golemcore/knowledge";
    }

    // ==================== RAG ====================

    @Data
    public static class RagProperties {
        private boolean enabled = false;
        private String url = "http://localhost:9621";
        private String apiKey = "";
        private String responseType = "Multiple Paragraphs";
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/memory";
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
