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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.IntentSettings;
import me.golemcore.memory.domain.model.KnowledgeMode;
import me.golemcore.memory.domain.model.KnowledgeSettings;
import me.golemcore.memory.domain.model.MemorySettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Builds the immutable settings values from {@link MemoryEngineProperties}
 * once at startup, plus the shared {@link Clock} and {@link ObjectMapper}.
 *
 * <p>
 * Invalid values fail startup with {@link IllegalArgumentException}.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class EngineConfiguration {

    private final MemoryEngineProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public MemorySettings memorySettings() {
        return memorySettings(properties.getMemory());
    }

    @Bean
    public IntentSettings intentSettings() {
        return IntentSettings.builder()
                .strictMode(properties.getIntent().isStrictMode())
                .build();
    }

    @Bean
    public KnowledgeSettings knowledgeSettings() {
        return knowledgeSettings(properties.getKnowledge());
    }

    @PostConstruct
    public void init() {
        log.info("Memory storage path: {}", properties.getStorage().getBasePath());
        log.info("Knowledge documents path: {}", properties.getKnowledge().getDocumentsPath());
        log.info("LightRAG: {} ({})", properties.getRag().isEnabled() ? "enabled" : "disabled",
                properties.getRag().getUrl());
    }

    static MemorySettings memorySettings(MemoryEngineProperties.MemoryProperties memory) {
        requirePositive(memory.getMaxContentLength(), "memory.max-content-length");
        requirePositive(memory.getDefaultSearchLimit(), "memory.default-search-limit");
        requireUnitInterval(memory.getSemanticThreshold(), "memory.semantic-threshold");
        requireUnitInterval(memory.getPreferenceThreshold(), "memory.preference-threshold");
        requireUnitInterval(memory.getDefaultSearchThreshold(), "memory.default-search-threshold");

        return MemorySettings.builder()
                .maxContentLength(memory.getMaxContentLength())
                .semanticThreshold(memory.getSemanticThreshold())
                .preferenceThreshold(memory.getPreferenceThreshold())
                .exactDedupEnabled(memory.isExactDedupEnabled())
                .semanticDedupEnabled(memory.isSemanticDedupEnabled())
                .topicClassificationEnabled(memory.isTopicClassificationEnabled())
                .defaultSearchLimit(memory.getDefaultSearchLimit())
                .defaultSearchThreshold(memory.getDefaultSearchThreshold())
                .queryExpansionEnabled(memory.isQueryExpansionEnabled())
                .build();
    }

    static KnowledgeSettings knowledgeSettings(MemoryEngineProperties.KnowledgeProperties knowledge) {
        requirePositive(knowledge.getTimeoutSeconds(), "knowledge.timeout-seconds");
        requirePositive(knowledge.getDefaultLimit(), "knowledge.default-limit");
        KnowledgeMode graphMode = KnowledgeMode.parse(knowledge.getDefaultGraphMode())
                .filter(KnowledgeMode::isGraphMode)
                .orElseThrow(() -> new IllegalArgumentException(
                        "knowledge.default-graph-mode must be one of global, hybrid, mix, naive, bypass: "
                                + knowledge.getDefaultGraphMode()));

        return KnowledgeSettings.builder()
                .timeout(Duration.ofSeconds(knowledge.getTimeoutSeconds()))
                .fallbackEnabled(knowledge.isFallbackEnabled())
                .defaultGraphMode(graphMode)
                .defaultLimit(knowledge.getDefaultLimit())
                .build();
    }

    private static void requirePositive(long value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }

    private static void requireUnitInterval(double value, String name) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0.0, 1.0], got " + value);
        }
    }
}
