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

/**
 * Backend chosen for a knowledge query and why.
 *
 * @param backend
 *            target backend
 * @param graphMode
 *            LightRAG mode used if the graph service is reached
 * @param autoDetected
 *            whether the decision came from query heuristics
 * @param reason
 *            human-readable reasoning
 */
public record RoutingDecision(KnowledgeBackend backend, KnowledgeMode graphMode, boolean autoDetected,
        String reason) {
}
