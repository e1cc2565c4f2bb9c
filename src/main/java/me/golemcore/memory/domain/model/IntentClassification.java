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
 * Result of query intent classification.
 *
 * @param intent
 *            the classified intent
 * @param confidence
 *            classification confidence in [0.0, 1.0]
 * @param reason
 *            human-readable reason
 * @param matchedPattern
 *            regex that matched, or {@code null}
 */
public record IntentClassification(QueryIntent intent, double confidence, String reason, String matchedPattern) {

    public static IntentClassification of(QueryIntent intent, double confidence, String reason) {
        return new IntentClassification(intent, confidence, reason, null);
    }
}
