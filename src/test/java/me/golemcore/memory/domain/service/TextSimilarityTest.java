package me.golemcore.memory.domain.service;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextSimilarityTest {

    private static final double EPSILON = 1e-9;
    private static final String TEA = "I prefer tea over coffee";
    private static final String TEA_MORNING = "I prefer tea over coffee in the morning";

    @Test
    void shouldNormalizeCaseAndWhitespace() {
        assertEquals("my dog is named max", TextSimilarity.normalize("  My   dog\tis named\nMax  "));
        assertEquals("", TextSimilarity.normalize(null));
    }

    @Test
    void shouldComputeRatcliffObershelpRatio() {
        assertEquals(0.75, TextSimilarity.stringSimilarity("abcd", "bcde"), EPSILON);
        assertEquals(48.0 / 63.0, TextSimilarity.stringSimilarity(TEA, TEA_MORNING), EPSILON);
        assertEquals(0.0, TextSimilarity.stringSimilarity("abc", "xyz"), EPSILON);
    }

    @Test
    void shouldTreatTwoEmptyStringsAsIdentical() {
        assertEquals(1.0, TextSimilarity.stringSimilarity("", "  "), EPSILON);
    }

    @Test
    void shouldReturnFullSimilarityForTextsEqualAfterNormalization() {
        assertEquals(1.0, TextSimilarity.stringSimilarity("Hello  World", "hello world"), EPSILON);
    }

    @Test
    void shouldCountMatchingBlocksOnBothSidesOfLongestMatch() {
        // "i really love " + "la" + " ice cream"
        assertEquals(26, TextSimilarity.matchingCharacters(
                "i really love chocolate ice cream", "i really love vanilla ice cream"));
    }

    @Test
    void shouldExtractKeyTermsWithoutStopWordsAndShortTokens() {
        assertEquals(Set.of("prefer", "tea", "coffee"), TextSimilarity.keyTerms("I prefer tea over coffee."));
        assertEquals(Set.of("dog", "named", "max"), TextSimilarity.keyTerms("My dog is named Max!"));
        assertTrue(TextSimilarity.keyTerms("I am at it").isEmpty());
    }

    @Test
    void shouldComputeJaccardWithEmptySetConventions() {
        assertEquals(1.0, TextSimilarity.jaccard(Set.of(), Set.of()), EPSILON);
        assertEquals(0.0, TextSimilarity.jaccard(Set.of("tea"), Set.of()), EPSILON);
        assertEquals(0.5, TextSimilarity.jaccard(Set.of("tea", "coffee"), Set.of("tea", "milk", "coffee", "sugar")),
                EPSILON);
    }

    @Test
    void shouldBlendStringAndTermSimilarity() {
        double expected = 0.6 * (48.0 / 63.0) + 0.4 * 0.75;
        assertEquals(expected, TextSimilarity.blendedScore(TEA, TEA_MORNING), EPSILON);
    }

    @Test
    void shouldBoostShortQueriesSharingWholeWords() {
        assertEquals(1.0, TextSimilarity.searchScore("coffee", TEA), EPSILON);
        assertEquals(0.8, TextSimilarity.searchScore("coffee beans", TEA), EPSILON);
    }

    @Test
    void shouldNotBoostLongQueries() {
        String query = "what do I drink in the morning";
        assertEquals(TextSimilarity.blendedScore(query, TEA_MORNING), TextSimilarity.searchScore(query, TEA_MORNING),
                EPSILON);
    }
}
