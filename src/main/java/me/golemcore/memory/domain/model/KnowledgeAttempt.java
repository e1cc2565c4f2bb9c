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
 * Record of one backend attempt made while answering a knowledge query.
 */
public record KnowledgeAttempt(KnowledgeBackend backend, boolean success, String detail) {

    public static KnowledgeAttempt succeeded(KnowledgeBackend backend) {
        return new KnowledgeAttempt(backend, true, "ok");
    }

    public static KnowledgeAttempt failed(KnowledgeBackend backend, String reason) {
        return new KnowledgeAttempt(backend, false, reason);
    }
}
