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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.IntentClassification;
import me.golemcore.memory.domain.model.IntentSettings;
import me.golemcore.memory.domain.model.QueryIntent;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Pattern-based query intent classifier deciding whether a query may take the
 * memory fast path instead of full agent inference.
 *
 * <p>
 * Strategies run in order:
 * <ol>
 * <li>Compound queries (" and ", " but ", ...) are {@code GENERAL}: a fast path
 * would only serve one of the requests</li>
 * <li>List phrasing ("list all memories") is {@code MEMORY_LIST}</li>
 * <li>Recall phrasing ("do you remember") is {@code MEMORY_SEARCH}</li>
 * <li>Anything else is {@code GENERAL} with low confidence</li>
 * </ol>
 */
@Component
@Slf4j
public class QueryIntentClassifier {

    static final double COMPOUND_CONFIDENCE = 0.95;
    static final double LIST_CONFIDENCE = 0.95;
    static final double SEARCH_CONFIDENCE = 0.85;
    static final double DEFAULT_CONFIDENCE = 0.5;

    private static final List<String> COMPOUND_CONNECTORS = List.of(
            " and ", " but ", " also ", ", then ", ", also ", " plus ");

    private static final List<Pattern> MEMORY_LIST_PATTERNS = compile(
            "^list\\s+(all\\s+)?memories",
            "^list\\s+(my\\s+)?memories",
            "^show\\s+(all\\s+)?memories",
            "^show\\s+(my\\s+)?memories",
            "^what\\s+memories",
            "^my\\s+memories",
            "^all\\s+my\\s+memories",
            "^memories\\s+list");

    private static final List<Pattern> MEMORY_SEARCH_PATTERNS = compile(
            "do\\s+you\\s+remember",
            "what\\s+do\\s+you\\s+know\\s+about",
            "search\\s+memories",
            "find\\s+memories");

    private final IntentSettings settings;

    public QueryIntentClassifier(IntentSettings settings) {
        this.settings = settings;
    }

    public IntentClassification classify(String query) {
        String normalized = query == null ? "" : query.strip().toLowerCase(Locale.ROOT);

        if (isCompound(normalized)) {
            return IntentClassification.of(QueryIntent.GENERAL, COMPOUND_CONFIDENCE,
                    "Compound query detected (multiple topics)");
        }

        String listMatch = firstMatch(normalized, MEMORY_LIST_PATTERNS);
        if (listMatch != null) {
            return new IntentClassification(QueryIntent.MEMORY_LIST, LIST_CONFIDENCE,
                    "Matched memory list pattern", listMatch);
        }

        String searchMatch = firstMatch(normalized, MEMORY_SEARCH_PATTERNS);
        if (searchMatch != null) {
            return new IntentClassification(QueryIntent.MEMORY_SEARCH, SEARCH_CONFIDENCE,
                    "Matched memory search pattern", searchMatch);
        }

        return IntentClassification.of(QueryIntent.GENERAL, DEFAULT_CONFIDENCE, "No specific pattern matched");
    }

    /**
     * Only high-confidence memory list queries skip agent inference.
     */
    public boolean shouldUseFastPath(String query) {
        return isFastPathEligible(classify(query));
    }

    public boolean isFastPathEligible(IntentClassification classification) {
        boolean eligible = classification.intent() == QueryIntent.MEMORY_LIST
                && classification.confidence() >= settings.getFastPathThreshold();
        log.debug("[Intent] {} ({}) -> fast path: {}", classification.intent(), classification.confidence(),
                eligible);
        return eligible;
    }

    private static boolean isCompound(String query) {
        return COMPOUND_CONNECTORS.stream().anyMatch(query::contains);
    }

    private static String firstMatch(String query, List<Pattern> patterns) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(query).find()) {
                return pattern.pattern();
            }
        }
        return null;
    }

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes)
                .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE))
                .toList();
    }
}
