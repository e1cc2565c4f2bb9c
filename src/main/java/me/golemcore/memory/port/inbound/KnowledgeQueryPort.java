package me.golemcore.memory.port.inbound;

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

import me.golemcore.memory.domain.model.KnowledgeResult;
import me.golemcore.memory.domain.model.RoutingStats;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Library surface of the knowledge query coordinator. Never throws for backend
 * failures: they are reported as fallback or error results.
 */
public interface KnowledgeQueryPort {

    /**
     * Route and execute a query with the configured timeout.
     *
     * @param query
     *            question text
     * @param mode
     *            local, global, hybrid, mix, naive, bypass or auto
     * @param limit
     *            result count for local search, top_k for the graph service
     */
    KnowledgeResult query(String query, String mode, int limit);

    /**
     * Route and execute a query with a caller-supplied deadline for the
     * external call.
     */
    KnowledgeResult query(String query, String mode, int limit, Duration timeout);

    CompletableFuture<KnowledgeResult> queryAsync(String query, String mode, int limit);

    RoutingStats getRoutingStats();

    void resetStats();
}
