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
import me.golemcore.memory.domain.model.MemoryEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Rule-based topic tagger.
 *
 * <p>
 * Each topic has a keyword list and a pattern list. A topic is assigned when
 * {@code keywordHits + 2 * patternHits >= 2}; several topics may be assigned
 * at once. Text matching no topic is tagged {@code general}. Keywords match at
 * a word start, so {@code plan} also hits {@code plans} and {@code planning}.
 */
@Component
@Slf4j
public class TopicClassifier {

    static final int ASSIGNMENT_SCORE = 2;
    private static final int KEYWORD_WEIGHT = 1;
    private static final int PATTERN_WEIGHT = 2;

    private final Map<String, TopicRule> rules = buildRules();

    /**
     * Classify text into topics, in rule-table order.
     *
     * @return assigned topics, {@code ["general"]} when nothing scores
     */
    public List<String> classify(String text) {
        String normalized = TextSimilarity.normalize(text);
        if (normalized.isEmpty()) {
            return List.of(MemoryEntry.DEFAULT_TOPIC);
        }

        List<String> topics = new ArrayList<>();
        for (Map.Entry<String, TopicRule> entry : rules.entrySet()) {
            int score = entry.getValue().score(normalized);
            if (score >= ASSIGNMENT_SCORE) {
                topics.add(entry.getKey());
            }
        }
        if (topics.isEmpty()) {
            return List.of(MemoryEntry.DEFAULT_TOPIC);
        }
        log.debug("[Topics] '{}' -> {}", text, topics);
        return List.copyOf(topics);
    }

    private static Map<String, TopicRule> buildRules() {
        Map<String, TopicRule> table = new LinkedHashMap<>();
        table.put("personal_info", TopicRule.of(
                List.of("name", "age", "birthday", "born", "address", "phone", "email"),
                List.of("\\bmy name is\\b", "\\bi (?:am|'m) \\d+\\b", "\\bcall me\\b", "\\bi was born\\b")));
        table.put("work", TopicRule.of(
                List.of("work", "job", "career", "company", "office", "boss", "colleague", "salary", "employed",
                        "engineer", "developer", "manager"),
                List.of("\\bi work\\b", "\\bmy job\\b", "\\bwork(?:s|ing)? as\\b", "\\bi(?:'m| am) employed\\b")));
        table.put("education", TopicRule.of(
                List.of("school", "university", "college", "degree", "study", "student", "graduate", "major",
                        "course"),
                List.of("\\bi study\\b", "\\bi graduated\\b", "\\bmy degree\\b", "\\bi(?:'m| am) studying\\b")));
        table.put("family", TopicRule.of(
                List.of("family", "parent", "mother", "father", "mom", "dad", "sibling", "brother", "sister",
                        "child", "kids", "married", "spouse", "wife", "husband"),
                List.of("\\bmy family\\b", "\\bmy parents\\b", "\\bi have \\d+ (?:kids|children)\\b",
                        "\\bmarried to\\b")));
        table.put("hobbies", TopicRule.of(
                List.of("hobby", "enjoy", "play", "watch", "read", "listen", "music", "sport", "game", "hiking"),
                List.of("\\bi enjoy\\b", "\\bi like to\\b", "\\bmy hobby\\b", "\\bin my free time\\b")));
        table.put("preferences", TopicRule.of(
                List.of("prefer", "favorite", "favourite", "best", "worst", "hate", "dislike", "love", "like",
                        "can't stand"),
                List.of("\\bi prefer\\b", "\\bmy favou?rite\\b", "\\bi hate\\b", "\\bi (?:don't|do not) like\\b",
                        "\\bi love\\b")));
        table.put("health", TopicRule.of(
                List.of("health", "doctor", "medicine", "sick", "illness", "allergy", "allergic", "diet",
                        "exercise", "gym"),
                List.of("\\ballergic to\\b", "\\bmy doctor\\b", "\\bi exercise\\b", "\\bi (?:have|suffer from) "
                        + "(?:an? )?(?:allergy|asthma|diabetes|migraines?)\\b")));
        table.put("location", TopicRule.of(
                List.of("city", "town", "country", "state", "neighborhood", "address", "zip", "postal", "live"),
                List.of("\\bi live in\\b", "\\blocated in\\b", "\\bi(?:'m| am) from\\b", "\\bzip code\\b")));
        table.put("pets", TopicRule.of(
                List.of("pet", "dog", "cat", "puppy", "kitten", "parrot", "hamster", "vet"),
                List.of("\\bmy (?:dog|cat|pet)\\b", "\\bi have an? (?:dog|cat|pet)\\b")));
        table.put("technology", TopicRule.of(
                List.of("computer", "software", "programming", "code", "java", "python", "linux", "laptop"),
                List.of("\\bi (?:code|program) in\\b", "\\bprogramming language\\b")));
        table.put("food", TopicRule.of(
                List.of("food", "eat", "cook", "meal", "restaurant", "vegetarian", "vegan", "coffee", "tea",
                        "pizza"),
                List.of("\\bi(?:'m| am) (?:a )?(?:vegetarian|vegan)\\b", "\\bfavou?rite (?:food|dish|meal)\\b")));
        table.put("goals", TopicRule.of(
                List.of("goal", "plan", "want", "hope", "dream", "aspire", "achieve", "target"),
                List.of("\\bmy goal\\b", "\\bi want to\\b", "\\bi plan to\\b", "\\bi hope to\\b")));
        return Collections.unmodifiableMap(table);
    }

    private record TopicRule(List<Pattern> keywords, List<Pattern> patterns) {

        static TopicRule of(List<String> keywords, List<String> patterns) {
            return new TopicRule(
                    keywords.stream().map(keyword -> Pattern.compile("\\b" + Pattern.quote(keyword))).toList(),
                    patterns.stream().map(Pattern::compile).toList());
        }

        int score(String normalized) {
            int score = 0;
            for (Pattern keyword : keywords) {
                if (keyword.matcher(normalized).find()) {
                    score += KEYWORD_WEIGHT;
                }
            }
            for (Pattern pattern : patterns) {
                if (pattern.matcher(normalized).find()) {
                    score += PATTERN_WEIGHT;
                }
            }
            return score;
        }
    }
}
