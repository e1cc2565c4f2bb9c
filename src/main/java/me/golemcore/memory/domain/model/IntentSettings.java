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
 * Immutable query intent settings.
 */
@Value
@Builder
public class IntentSettings {

    public static final double STRICT_THRESHOLD = 0.9;
    public static final double LENIENT_THRESHOLD = 0.85;

    @Builder.Default
    boolean strictMode = true;

    /**
     * Minimum confidence a memory-list classification needs to take the fast
     * path.
     */
    public double getFastPathThreshold() {
        return strictMode ? STRICT_THRESHOLD : LENIENT_THRESHOLD;
    }

    public static IntentSettings defaults() {
        return IntentSettings.builder().build();
    }
}
