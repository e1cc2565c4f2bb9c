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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text similarity primitives shared by duplicate detection and memory search.
 *
 * <p>
 * The blended score is {@code 0.6 * stringSimilarity + 0.4 * jaccard(keyTerms)}
 * where string similarity is the Ratcliff/Obershelp ratio {@code 2M / (|a| + |b|)}
 * over normalized text and key terms are content words with stop words and
 * tokens of two characters or fewer removed.
 */
public final class TextSimilarity {

    public static final double STRING_WEIGHT = 0.6;
    public static final double TERMS_WEIGHT = 0.4;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PUNCTUATION = Pattern.compile("[.,!?;:]");
    private static final Pattern WORD = Pattern.compile("\\b\\w+\\b");
    private static final int SHORT_QUERY_WORDS = 3;

    private static final Set<String> STOP_WORDS = Set.of(
            "i", "me", "my", "myself", "we", "our", "ours", "ourselves",
            "you", "your", "yours", "yourself", "yourselves",
            "he", "him", "his", "himself", "she", "her", "hers", "herself",
            "it", "its", "itself", "they", "them", "their", "theirs", "themselves",
            "what", "which", "who", "whom", "this", "that", "these", "those",
            "am", "is", "are", "was", "were", "be", "been", "being",
            "have", "has", "had", "having", "do", "does", "did", "doing",
            "a", "an", "the", "and", "but", "if", "or", "because", "as", "until", "while",
            "of", "at", "by", "for", "with", "through", "during", "before", "after",
            "above", "below", "up", "down", "in", "out", "on", "off", "over", "under",
            "again", "further", "then", "once");

    private TextSimilarity() {
    }

    /**
     * Trim, lower-case and collapse internal whitespace. Two texts are exact
     * duplicates iff their normalized forms are equal.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }

    /**
     * Content words of a text: punctuation stripped, stop words and short
     * tokens removed. Insertion order is preserved.
     */
    public static Set<String> keyTerms(String text) {
        String stripped = PUNCTUATION.matcher(normalize(text)).replaceAll("");
        Set<String> terms = new LinkedHashSet<>();
        for (String word : WHITESPACE.split(stripped)) {
            if (word.length() > 2 && !STOP_WORDS.contains(word)) {
                terms.add(word);
            }
        }
        return terms;
    }

    /**
     * Ratcliff/Obershelp similarity of the normalized texts, in [0.0, 1.0].
     * Two empty texts are identical.
     */
    public static double stringSimilarity(String first, String second) {
        String a = normalize(first);
        String b = normalize(second);
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(a, b) / total;
    }

    /**
     * Jaccard index of two term sets. Two empty sets are identical, one empty
     * set shares nothing.
     */
    public static double jaccard(Set<String> first, Set<String> second) {
        if (first.isEmpty() && second.isEmpty()) {
            return 1.0;
        }
        if (first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }
        Set<String> union = new LinkedHashSet<>(first);
        union.addAll(second);
        int intersection = first.size() + second.size() - union.size();
        return (double) intersection / union.size();
    }

    /**
     * Blended semantic similarity used for duplicate detection and ranking.
     */
    public static double blendedScore(String first, String second) {
        double stringScore = stringSimilarity(first, second);
        double termsScore = jaccard(keyTerms(first), keyTerms(second));
        return STRING_WEIGHT * stringScore + TERMS_WEIGHT * termsScore;
    }

    /**
     * Search relevance of a memory text for a query. Short queries (up to three
     * words) sharing whole words with the text score at least
     * {@code 0.6 + 0.4 * matchedWordRatio}, so a one-word query hitting a long
     * memory is not drowned by the length difference.
     */
    public static double searchScore(String query, String text) {
        double blended = blendedScore(query, text);
        Set<String> queryWords = words(query);
        if (queryWords.isEmpty() || queryWords.size() > SHORT_QUERY_WORDS) {
            return blended;
        }
        Set<String> textWords = words(text);
        long matches = queryWords.stream().filter(textWords::contains).count();
        if (matches == 0) {
            return blended;
        }
        double exactWordScore = 0.6 + 0.4 * matches / queryWords.size();
        return Math.max(exactWordScore, blended);
    }

    private static Set<String> words(String text) {
        String stripped = PUNCTUATION.matcher(normalize(text)).replaceAll("");
        Set<String> words = new LinkedHashSet<>();
        Matcher matcher = WORD.matcher(stripped);
        while (matcher.find()) {
            words.add(matcher.group());
        }
        return words;
    }

    /**
     * Total size of the matching blocks found by recursively taking the
     * longest common substring and repeating on both sides of it. Ties resolve
     * to the earliest position in {@code a}, then in {@code b}.
     */
    static int matchingCharacters(String a, String b) {
        Map<Character, List<Integer>> positionsInB = new HashMap<>();
        for (int j = 0; j < b.length(); j++) {
            positionsInB.computeIfAbsent(b.charAt(j), key -> new ArrayList<>()).add(j);
        }

        int matched = 0;
        Deque<int[]> ranges = new ArrayDeque<>();
        ranges.push(new int[] { 0, a.length(), 0, b.length() });
        while (!ranges.isEmpty()) {
            int[] range = ranges.pop();
            int[] match = longestMatch(a, positionsInB, range[0], range[1], range[2], range[3]);
            int size = match[2];
            if (size == 0) {
                continue;
            }
            matched += size;
            int i = match[0];
            int j = match[1];
            if (range[0] < i && range[2] < j) {
                ranges.push(new int[] { range[0], i, range[2], j });
            }
            if (i + size < range[1] && j + size < range[3]) {
                ranges.push(new int[] { i + size, range[1], j + size, range[3] });
            }
        }
        return matched;
    }

    private static int[] longestMatch(String a, Map<Character, List<Integer>> positionsInB,
            int aLow, int aHigh, int bLow, int bHigh) {
        int bestI = aLow;
        int bestJ = bLow;
        int bestSize = 0;
        Map<Integer, Integer> lengthEndingAt = new HashMap<>();
        for (int i = aLow; i < aHigh; i++) {
            Map<Integer, Integer> next = new HashMap<>();
            List<Integer> positions = positionsInB.get(a.charAt(i));
            if (positions != null) {
                for (int j : positions) {
                    if (j < bLow) {
                        continue;
                    }
                    if (j >= bHigh) {
                        break;
                    }
                    int length = lengthEndingAt.getOrDefault(j - 1, 0) + 1;
                    next.put(j, length);
                    if (length > bestSize) {
                        bestI = i - length + 1;
                        bestJ = j - length + 1;
                        bestSize = length;
                    }
                }
            }
            lengthEndingAt = next;
        }
        return new int[] { bestI, bestJ, bestSize };
    }
}
