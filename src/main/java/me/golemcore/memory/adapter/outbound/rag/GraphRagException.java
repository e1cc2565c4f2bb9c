package me.golemcore.memory.adapter.outbound.rag;

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
 * Failure talking to the LightRAG server: transport error or non-2xx reply.
 */
public class GraphRagException extends RuntimeException {

    private final int statusCode;

    public GraphRagException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public GraphRagException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status of the failed reply, or -1 for transport errors.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
