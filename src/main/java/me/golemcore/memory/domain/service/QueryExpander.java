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
import me.golemcore.memory.domain.model.MemorySettings;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Expands a search query with synonym variants from the work, education and
 * personal vocabularies. For each query word with synonyms, both the query
 * with the word replaced and the bare synonym are added.
 */
@Component
@RequiredArgsConstructor
public class QueryExpander {

    private static final Map<String, List<String>> SYNONYMS = buildSynonyms();

    private final MemorySettings settings;

    /**
     * @return the original query first, followed by its expansions
     */
    public List<String> expand(String query) {
        Set<String> expanded = new LinkedHashSet<>();
        expanded.add(query);
        if (!settings.isQueryExpansionEnabled()) {
            return List.copyOf(expanded);
        }

        String normalized = TextSimilarity.normalize(query);
        for (String word : normalized.split(" ")) {
            List<String> synonyms = SYNONYMS.get(word);
            if (synonyms == null) {
                continue;
            }
            for (String synonym : synonyms) {
                expanded.add(replaceWord(normalized, word, synonym));
                expanded.add(synonym);
            }
        }
        return new ArrayList<>(expanded);
    }

    private static String replaceWord(String text, String word, String replacement) {
        StringBuilder result = new StringBuilder();
        for (String token : text.split(" ")) {
            if (!result.isEmpty()) {
                result.append(' ');
            }
            result.append(token.equals(word) ? replacement : token);
        }
        return result.toString();
    }

    private static Map<String, List<String>> buildSynonyms() {
        Map<String, List<String>> synonyms = new HashMap<>();
        // work
        synonyms.put("work", List.of("job", "employment", "career", "occupation", "position", "company",
                "employer", "workplace"));
        synonyms.put("workplace", List.of("work", "job", "office", "company", "employer", "business"));
        synonyms.put("job", List.of("work", "employment", "career", "position", "occupation", "role"));
        synonyms.put("company", List.of("employer", "business", "organization", "workplace", "firm"));
        synonyms.put("career", List.of("job", "work", "profession", "occupation", "employment"));
        // education
        synonyms.put("school", List.of("university", "college", "education", "academic", "institution"));
        synonyms.put("university", List.of("college", "school", "education", "academic", "institution"));
        synonyms.put("degree", List.of("education", "qualification", "diploma", "certification"));
        synonyms.put("study", List.of("education", "learning", "academic", "school", "university"));
        // personal
        synonyms.put("hobby", List.of("interest", "activity", "pastime", "recreation", "leisure"));
        synonyms.put("interest", List.of("hobby", "passion", "activity", "like", "enjoy"));
        synonyms.put("like", List.of("enjoy", "prefer", "love", "interest", "hobby"));
        synonyms.put("preference", List.of("like", "prefer", "choice", "favorite"));
        return Map.copyOf(synonyms);
    }
}
