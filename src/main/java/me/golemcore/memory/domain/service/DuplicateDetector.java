package me.golemcore.memory.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.DuplicateVerdict;
import me.golemcore.memory.domain.model.MemoryEntry;
import me.golemcore.memory.domain.model.MemorySettings;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Admission control for candidate memories.
 *
 * <p>
 * A candidate is first compared for exact equality after normalization, then
 * scored against every existing entry with
 * {@link TextSimilarity#blendedScore(String, String)}. The semantic threshold
 * drops from {@code semanticThreshold} (0.8) to {@code preferenceThreshold}
 * (0.65) when either text expresses a preference.
 *
 * <p>
 * Known limitation: with the lowered threshold two preference statements that
 * share only their opening phrase can be reported as duplicates, for example
 * "I really love chocolate ice cream" and "I really love vanilla ice cream".
 * The thresholds are kept as configured; callers that need stricter admission
 * should raise {@code preferenceThreshold}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DuplicateDetector {

    private static final Pattern PREFERENCE_INDICATOR = Pattern.compile(
            "\\b(?:prefer|like|enjoy|love|hate|dislike|favou?rite|best|worst)");

    private final MemorySettings settings;

    /**
     * Check a candidate text against an owner's existing entries.
     */
    public DuplicateVerdict check(String candidate, Iterable<MemoryEntry> existing) {
        String normalizedCandidate = TextSimilarity.normalize(candidate);

        if (settings.isExactDedupEnabled()) {
            for (MemoryEntry entry : existing) {
                if (normalizedCandidate.equals(TextSimilarity.normalize(entry.getText()))) {
                    log.debug("[Dedup] Exact duplicate of {}: '{}'", entry.getId(), candidate);
                    return DuplicateVerdict.exact(entry);
                }
            }
        }

        if (!settings.isSemanticDedupEnabled()) {
            return DuplicateVerdict.unique();
        }

        MemoryEntry bestMatch = null;
        double bestScore = 0.0;
        double bestSeen = 0.0;
        for (MemoryEntry entry : existing) {
            double score = TextSimilarity.blendedScore(candidate, entry.getText());
            bestSeen = Math.max(bestSeen, score);
            if (score >= thresholdFor(candidate, entry.getText()) && score > bestScore) {
                bestMatch = entry;
                bestScore = score;
            }
        }

        if (bestMatch == null) {
            log.debug("[Dedup] Unique (best score {})", String.format("%.3f", bestSeen));
            return DuplicateVerdict.unique(bestSeen);
        }
        log.debug("[Dedup] Semantic duplicate of {} (score {}): '{}' ~ '{}'",
                bestMatch.getId(), String.format("%.3f", bestScore), candidate, bestMatch.getText());
        return DuplicateVerdict.semantic(bestMatch, bestScore);
    }

    /**
     * Semantic threshold applying to a pair of texts.
     */
    double thresholdFor(String first, String second) {
        if (isPreference(first) || isPreference(second)) {
            return settings.getPreferenceThreshold();
        }
        return settings.getSemanticThreshold();
    }

    static boolean isPreference(String text) {
        return PREFERENCE_INDICATOR.matcher(TextSimilarity.normalize(text)).find();
    }
}
