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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Admission-control verdict for a candidate memory: unique, an exact repeat of
 * an existing entry, or a semantic near-duplicate with its similarity score.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DuplicateVerdict {

    public enum Kind {
        UNIQUE, EXACT, SEMANTIC
    }

    private static final DuplicateVerdict UNIQUE = new DuplicateVerdict(Kind.UNIQUE, null, null, 0.0);

    Kind kind;
    String matchId;
    String matchText;
    double score;

    public static DuplicateVerdict unique() {
        return UNIQUE;
    }

    /**
     * Unique verdict that still records the best score seen, for diagnostics.
     */
    public static DuplicateVerdict unique(double bestScore) {
        return new DuplicateVerdict(Kind.UNIQUE, null, null, bestScore);
    }

    public static DuplicateVerdict exact(MemoryEntry match) {
        return new DuplicateVerdict(Kind.EXACT, match.getId(), match.getText(), 1.0);
    }

    public static DuplicateVerdict semantic(MemoryEntry match, double score) {
        return new DuplicateVerdict(Kind.SEMANTIC, match.getId(), match.getText(), score);
    }

    public boolean isDuplicate() {
        return kind != Kind.UNIQUE;
    }
}
