package me.golemcore.memory.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Port for the external graph-based retrieval service (LightRAG).
 */
public interface GraphRagPort {

    /**
     * Ask the graph service a question.
     *
     * <p>
     * The returned future completes exceptionally on transport or HTTP errors.
     * Cancelling it cancels the underlying call.
     *
     * @param query
     *            the question
     * @param mode
     *            retrieval mode name (global, hybrid, mix, naive, bypass)
     * @param topK
     *            number of top entities/chunks to retrieve
     * @return answer text
     */
    CompletableFuture<String> query(String query, String mode, int topK);

    /**
     * Check if the graph service is configured for use.
     */
    boolean isAvailable();
}
