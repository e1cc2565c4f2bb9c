package me.golemcore.memory.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemoryEntryTest {

    @Test
    void shouldApplyDefaults() {
        MemoryEntry entry = MemoryEntry.builder().id("m1").ownerId("alice").text("I live in Berlin").build();

        assertEquals(List.of("general"), entry.getTopics());
        assertEquals(1.0, entry.getConfidence());
        assertFalse(entry.isProxy());
        assertEquals(Instant.EPOCH, entry.getCreatedAt());
        assertEquals(entry.getCreatedAt(), entry.getUpdatedAt());
    }

    @Test
    void shouldRejectBlankFields() {
        assertThrows(IllegalArgumentException.class,
                () -> MemoryEntry.builder().id(" ").ownerId("alice").text("x").build());
        assertThrows(IllegalArgumentException.class,
                () -> MemoryEntry.builder().id("m1").ownerId(null).text("x").build());
        assertThrows(IllegalArgumentException.class,
                () -> MemoryEntry.builder().id("m1").ownerId("alice").text("").build());
    }

    @Test
    void shouldRejectConfidenceOutsideUnitInterval() {
        assertThrows(IllegalArgumentException.class,
                () -> MemoryEntry.builder().id("m1").ownerId("alice").text("x").confidence(1.01).build());
        assertThrows(IllegalArgumentException.class,
                () -> MemoryEntry.builder().id("m1").ownerId("alice").text("x").confidence(Double.NaN).build());
        assertTrue(MemoryEntry.isValidConfidence(0.0));
        assertTrue(MemoryEntry.isValidConfidence(1.0));
    }

    @Test
    void shouldKeepProxyAgentOnlyForProxyEntries() {
        MemoryEntry direct = MemoryEntry.builder().id("m1").ownerId("alice").text("x")
                .proxyAgent("assistant").build();
        MemoryEntry proxied = MemoryEntry.builder().id("m2").ownerId("alice").text("x")
                .proxy(true).proxyAgent("assistant").build();

        assertNull(direct.getProxyAgent());
        assertEquals("assistant", proxied.getProxyAgent());
    }

    @Test
    void shouldCopyWithNewConfidence() {
        Instant created = Instant.parse("2026-01-01T00:00:00Z");
        Instant modified = Instant.parse("2026-02-01T00:00:00Z");
        MemoryEntry entry = MemoryEntry.builder().id("m1").ownerId("alice").text("x")
                .topics(List.of("pets")).createdAt(created).build();

        MemoryEntry updated = entry.withConfidence(0.3, modified);

        assertEquals(0.3, updated.getConfidence());
        assertEquals(created, updated.getCreatedAt());
        assertEquals(modified, updated.getUpdatedAt());
        assertEquals(1.0, entry.getConfidence());
        assertTrue(updated.hasTopic("PETS"));
        assertFalse(updated.hasTopic(null));
    }
}
