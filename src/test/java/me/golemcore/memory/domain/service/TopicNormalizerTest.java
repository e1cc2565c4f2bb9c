package me.golemcore.memory.domain.service;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TopicNormalizerTest {

    @Test
    void shouldDefaultToGeneralForMissingTopics() {
        assertEquals(List.of("general"), TopicNormalizer.normalize(null));
        assertEquals(List.of("general"), TopicNormalizer.normalize(""));
        assertEquals(List.of("general"), TopicNormalizer.normalize(List.of()));
    }

    @Test
    void shouldSplitCommaSeparatedString() {
        assertEquals(List.of("work", "personal_info"), TopicNormalizer.normalize(" Work, personal_info ,"));
    }

    @Test
    void shouldParseStringifiedJsonArray() {
        assertEquals(List.of("food", "preferences"), TopicNormalizer.normalize("[\"Food\", \"preferences\"]"));
    }

    @Test
    void shouldParseSingleQuotedListString() {
        assertEquals(List.of("food", "preferences"), TopicNormalizer.normalize("['food', 'preferences']"));
    }

    @Test
    void shouldLowercaseDeduplicateAndPreserveOrder() {
        assertEquals(List.of("pets", "family"),
                TopicNormalizer.normalize(Arrays.asList("Pets", null, "family", "PETS", " ")));
    }

    @Test
    void shouldFlattenStringElementsOfCollections() {
        assertEquals(List.of("work", "goals", "education"),
                TopicNormalizer.normalize(List.of("work, goals", "education")));
    }

    @Test
    void shouldMergeAndDropGeneralPlaceholder() {
        assertEquals(List.of("drinks", "preferences", "food"),
                TopicNormalizer.merge(List.of("Drinks", "general"), List.of("preferences", "food")));
        assertEquals(List.of("general"), TopicNormalizer.merge(List.of(), List.of("general")));
        assertEquals(List.of("general"), TopicNormalizer.merge(null, null));
    }
}
