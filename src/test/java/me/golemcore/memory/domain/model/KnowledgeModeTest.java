package me.golemcore.memory.domain.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KnowledgeModeTest {

    @Test
    void shouldParseWireNamesCaseInsensitively() {
        assertEquals(Optional.of(KnowledgeMode.HYBRID), KnowledgeMode.parse(" Hybrid "));
        assertEquals(Optional.of(KnowledgeMode.LOCAL), KnowledgeMode.parse("local"));
        assertEquals(Optional.of(KnowledgeMode.BYPASS), KnowledgeMode.parse("BYPASS"));
    }

    @Test
    void shouldTreatMissingModeAsAuto() {
        assertEquals(Optional.of(KnowledgeMode.AUTO), KnowledgeMode.parse(null));
        assertEquals(Optional.of(KnowledgeMode.AUTO), KnowledgeMode.parse(""));
        assertEquals(Optional.of(KnowledgeMode.AUTO), KnowledgeMode.parse("none"));
    }

    @Test
    void shouldRejectUnknownMode() {
        assertTrue(KnowledgeMode.parse("quantum").isEmpty());
    }

    @Test
    void shouldClassifyGraphModes() {
        assertFalse(KnowledgeMode.LOCAL.isGraphMode());
        assertFalse(KnowledgeMode.AUTO.isGraphMode());
        assertTrue(KnowledgeMode.MIX.isGraphMode());
        assertTrue(KnowledgeMode.NAIVE.isGraphMode());
    }

    @Test
    void shouldComputeRoutingPercentages() {
        RoutingStats stats = RoutingStats.builder().localQueries(3).graphQueries(1).build();

        assertEquals(4, stats.getTotalQueries());
        assertEquals(75.0, stats.percentage(3));
        assertEquals(0.0, RoutingStats.builder().build().percentage(5));
    }
}
