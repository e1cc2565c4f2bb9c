package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.model.IntentClassification;
import me.golemcore.memory.domain.model.IntentSettings;
import me.golemcore.memory.domain.model.QueryIntent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryIntentClassifierTest {

    private final QueryIntentClassifier classifier = new QueryIntentClassifier(IntentSettings.defaults());

    @ParameterizedTest
    @ValueSource(strings = { "List all memories", "list my memories", "Show memories", "  what memories do you have",
            "my memories", "All my memories please", "memories list" })
    void shouldClassifyListQueries(String query) {
        IntentClassification classification = classifier.classify(query);

        assertEquals(QueryIntent.MEMORY_LIST, classification.intent());
        assertEquals(0.95, classification.confidence());
        assertNotNull(classification.matchedPattern());
        assertTrue(classifier.shouldUseFastPath(query));
    }

    @Test
    void shouldClassifyRecallQueriesAsSearch() {
        IntentClassification classification = classifier.classify("Do you remember my dog's name?");

        assertEquals(QueryIntent.MEMORY_SEARCH, classification.intent());
        assertEquals(0.85, classification.confidence());
        assertFalse(classifier.shouldUseFastPath("Do you remember my dog's name?"));
    }

    @Test
    void shouldTreatCompoundQueriesAsGeneral() {
        IntentClassification classification = classifier.classify("list all memories and tell me a joke");

        assertEquals(QueryIntent.GENERAL, classification.intent());
        assertEquals(0.95, classification.confidence());
        assertFalse(classifier.shouldUseFastPath("list all memories and tell me a joke"));
    }

    @Test
    void shouldNotMatchListPatternMidSentence() {
        IntentClassification classification = classifier.classify("please list memories");

        assertEquals(QueryIntent.GENERAL, classification.intent());
        assertEquals(0.5, classification.confidence());
    }

    @Test
    void shouldHandleNullQuery() {
        assertEquals(QueryIntent.GENERAL, classifier.classify(null).intent());
    }

    @Test
    void shouldApplyConfiguredThreshold() {
        IntentClassification borderline = new IntentClassification(QueryIntent.MEMORY_LIST, 0.87, "test", null);
        QueryIntentClassifier lenient = new QueryIntentClassifier(IntentSettings.builder().strictMode(false).build());

        assertFalse(classifier.isFastPathEligible(borderline));
        assertTrue(lenient.isFastPathEligible(borderline));
    }
}
