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
import lombok.Value;

/**
 * Immutable admission and search settings for the memory store.
 */
@Value
@Builder
public class MemorySettings {

    @Builder.Default
    int maxContentLength = 500;
    @Builder.Default
    double semanticThreshold = 0.8;
    @Builder.Default
    double preferenceThreshold = 0.65;
    @Builder.Default
    boolean exactDedupEnabled = true;
    @Builder.Default
    boolean semanticDedupEnabled = true;
    @Builder.Default
    boolean topicClassificationEnabled = true;
    @Builder.Default
    int defaultSearchLimit = 10;
    @Builder.Default
    double defaultSearchThreshold = 0.3;
    @Builder.Default
    boolean queryExpansionEnabled = true;

    public static MemorySettings defaults() {
        return MemorySettings.builder().build();
    }
}
