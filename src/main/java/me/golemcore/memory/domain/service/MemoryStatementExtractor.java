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

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Picks sentences worth remembering out of free text: first-person statements
 * about identity, work, residence, likes, plans and the like.
 */
@Component
public class MemoryStatementExtractor {

    static final int MIN_STATEMENT_LENGTH = 10;

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("[.!?]+");

    private static final List<Pattern> MEMORABLE = List.of(
            "\\bi am\\b", "\\bmy name is\\b", "\\bi work\\b", "\\bi live\\b", "\\bi like\\b",
            "\\bi love\\b", "\\bi hate\\b", "\\bi prefer\\b", "\\bi have\\b", "\\bi study\\b",
            "\\bi graduated\\b", "\\bmy favorite\\b", "\\bmy goal\\b", "\\bi want to\\b", "\\bi plan to\\b")
            .stream()
            .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE))
            .toList();

    public List<String> extract(String text) {
        List<String> statements = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return statements;
        }
        for (String raw : SENTENCE_BOUNDARY.split(text)) {
            String sentence = raw.strip();
            if (sentence.length() < MIN_STATEMENT_LENGTH) {
                continue;
            }
            if (MEMORABLE.stream().anyMatch(pattern -> pattern.matcher(sentence).find())) {
                statements.add(sentence);
            }
        }
        return statements;
    }
}
