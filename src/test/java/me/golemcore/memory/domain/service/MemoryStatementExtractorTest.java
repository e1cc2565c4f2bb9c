package me.golemcore.memory.domain.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemoryStatementExtractorTest {

    private final MemoryStatementExtractor extractor = new MemoryStatementExtractor();

    @Test
    void shouldKeepFirstPersonStatements() {
        List<String> statements = extractor.extract(
                "My name is Eric. I work as a software engineer! The weather is nice today? I love hiking.");

        assertEquals(List.of("My name is Eric", "I work as a software engineer", "I love hiking"), statements);
    }

    @Test
    void shouldDropShortFragments() {
        // "I am Bo" matches a cue but is under the minimum length
        assertTrue(extractor.extract("I am Bo.").isEmpty());
    }

    @Test
    void shouldMatchCuesCaseInsensitively() {
        assertEquals(List.of("MY FAVORITE color is green"), extractor.extract("MY FAVORITE color is green..."));
    }

    @Test
    void shouldHandleEmptyInput() {
        assertTrue(extractor.extract(null).isEmpty());
        assertTrue(extractor.extract("   ").isEmpty());
    }
}
