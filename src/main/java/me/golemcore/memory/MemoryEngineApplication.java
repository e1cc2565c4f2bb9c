package me.golemcore.memory;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point of the GolemCore memory engine.
 *
 * <p>
 * The engine is a library surface for an agent runtime: it decides which facts
 * are worth remembering, tags them with topics, recognizes queries that can be
 * answered straight from memory, and routes knowledge questions between a
 * local index and a LightRAG knowledge graph. It exposes no network port.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Inbound ports      → MemoryStorePort, KnowledgeQueryPort
 * Domain Layer       → SemanticMemoryService, KnowledgeCoordinator, classifiers
 * Outbound adapters  → JSONL memory files, local document index, LightRAG
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code memory-engine.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MemoryEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoryEngineApplication.class, args);
    }

}
