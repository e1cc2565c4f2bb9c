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
 * Snapshot of knowledge routing counters.
 */
@Value
@Builder
public class RoutingStats {

    long localQueries;
    long graphQueries;
    long autoDetectedLocal;
    long autoDetectedGraph;
    long fallbackUsed;

    public long getTotalQueries() {
        return localQueries + graphQueries;
    }

    public double percentage(long count) {
        long total = getTotalQueries();
        return total == 0 ? 0.0 : count * 100.0 / total;
    }
}
