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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Formatted answer to a knowledge query, tagged with the path that produced it.
 * A {@link KnowledgeSource#FALLBACK} or {@link KnowledgeSource#ERROR} result
 * carries every attempt made, including the failed ones.
 */
@Value
@Builder
public class KnowledgeResult {

    KnowledgeSource source;
    String content;
    RoutingDecision routing;
    @Singular
    List<KnowledgeAttempt> attempts;

    public boolean isError() {
        return source == KnowledgeSource.ERROR;
    }

    public boolean isFallback() {
        return source == KnowledgeSource.FALLBACK;
    }
}
