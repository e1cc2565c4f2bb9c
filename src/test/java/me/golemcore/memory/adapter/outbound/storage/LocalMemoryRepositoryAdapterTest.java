package me.golemcore.memory.adapter.outbound.storage;

import me.golemcore.memory.domain.model.MemoryEntry;
import me.golemcore.memory.infrastructure.config.EngineConfiguration;
import me.golemcore.memory.infrastructure.config.MemoryEngineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalMemoryRepositoryAdapterTest {

    private static final Instant CREATED = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private LocalMemoryRepositoryAdapter adapter;

    @BeforeEach
    void setUp() {
        MemoryEngineProperties properties = new MemoryEngineProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        adapter = new LocalMemoryRepositoryAdapter(properties, EngineConfiguration.objectMapper(),
                new MemoryRecordMapper());
        adapter.init();
    }

    @Test
    void shouldPersistAndReadBackEntries() {
        MemoryEntry entry = entry("m1", "alice", "I live in Berlin");

        assertEquals("m1", adapter.write(entry));

        List<MemoryEntry> entries = adapter.readAll("alice");
        assertEquals(List.of(entry), entries);
        assertTrue(Files.exists(tempDir.resolve("owner-alice.jsonl")));
    }

    @Test
    void shouldReplaceEntryWithSameId() {
        adapter.write(entry("m1", "alice", "I live in Berlin"));
        adapter.write(entry("m2", "alice", "My dog is named Max"));

        adapter.write(entry("m1", "alice", "I live in Berlin").withConfidence(0.5, CREATED.plusSeconds(60)));

        List<MemoryEntry> entries = adapter.readAll("alice");
        assertEquals(2, entries.size());
        assertEquals("m1", entries.get(0).getId());
        assertEquals(0.5, entries.get(0).getConfidence());
    }

    @Test
    void shouldIsolateOwners() {
        adapter.write(entry("m1", "alice", "I live in Berlin"));
        adapter.write(entry("m2", "bob@example.com/x", "I live in Paris"));

        assertEquals(1, adapter.readAll("alice").size());
        assertEquals("I live in Paris", adapter.readAll("bob@example.com/x").get(0).getText());
        assertTrue(adapter.readAll("carol").isEmpty());
    }

    @Test
    void shouldDeleteWithinOwnerFileOnly() {
        adapter.write(entry("m1", "alice", "I live in Berlin"));
        adapter.write(entry("m2", "bob", "I live in Paris"));

        assertFalse(adapter.delete("m2", "alice"));
        assertTrue(adapter.delete("m2", "bob"));
        assertFalse(adapter.delete("m2", "bob"));
        assertTrue(adapter.readAll("bob").isEmpty());
        assertEquals(1, adapter.readAll("alice").size());
    }

    @Test
    void shouldKeepOtherOwnersEntryWithSameId() {
        adapter.write(entry("1", "alice", "I live in Berlin"));
        adapter.write(entry("1", "bob", "I live in Paris"));

        assertTrue(adapter.delete("1", "bob"));

        assertEquals(1, adapter.readAll("alice").size());
        assertTrue(adapter.readAll("bob").isEmpty());
    }

    @Test
    void shouldRoundTripProxyEntryExactly() {
        MemoryEntry proxyEntry = MemoryEntry.builder()
                .id("p1")
                .ownerId("alice")
                .text("User mentioned a trip to Lisbon")
                .topics(List.of("travel", "personal_info"))
                .confidence(0.37)
                .proxy(true)
                .proxyAgent("scout")
                .createdAt(CREATED)
                .updatedAt(CREATED.plusSeconds(90))
                .build();

        adapter.write(proxyEntry);

        List<MemoryEntry> entries = adapter.readAll("alice");
        assertEquals(List.of(proxyEntry), entries);
        MemoryEntry restored = entries.get(0);
        assertEquals(0.37, restored.getConfidence());
        assertTrue(restored.isProxy());
        assertEquals("scout", restored.getProxyAgent());
        assertEquals(List.of("travel", "personal_info"), restored.getTopics());
    }

    @Test
    void shouldReadLegacyRowsAndSkipCorruptLines() throws IOException {
        String legacy = "{\"memory_id\":\"legacy-1\",\"user_id\":\"alice\",\"memory\":\"I like tea\","
                + "\"topics\":\"food, preferences\",\"last_updated\":\"2025-06-01T12:00:00\"}";
        Files.writeString(tempDir.resolve("owner-alice.jsonl"),
                legacy + "\nnot json at all\n\n{\"id\":\"broken\",\"text\":\"no confidence\",\"confidence\":7}\n",
                StandardCharsets.UTF_8);

        List<MemoryEntry> entries = adapter.readAll("alice");

        assertEquals(1, entries.size());
        MemoryEntry entry = entries.get(0);
        assertEquals("legacy-1", entry.getId());
        assertEquals("I like tea", entry.getText());
        assertEquals(List.of("food", "preferences"), entry.getTopics());
        assertEquals(1.0, entry.getConfidence());
        assertFalse(entry.isProxy());
        assertEquals(Instant.parse("2025-06-01T12:00:00Z"), entry.getUpdatedAt());
        assertEquals(entry.getUpdatedAt(), entry.getCreatedAt());
    }

    @Test
    void shouldWriteSnakeCaseRecords() throws IOException {
        adapter.write(MemoryEntry.builder()
                .id("m1")
                .ownerId("alice")
                .text("I live in Berlin")
                .topics(List.of("location"))
                .confidence(0.9)
                .proxy(true)
                .proxyAgent("assistant")
                .createdAt(CREATED)
                .build());

        String line = Files.readString(tempDir.resolve("owner-alice.jsonl"), StandardCharsets.UTF_8).strip();

        assertTrue(line.contains("\"owner_id\":\"alice\""));
        assertTrue(line.contains("\"is_proxy\":true"));
        assertTrue(line.contains("\"proxy_agent\":\"assistant\""));
        assertTrue(line.contains("\"created_at\":\"2026-03-01T10:00:00Z\""));
        assertTrue(line.contains("\"topics\":[\"location\"]"));
        assertFalse(Files.exists(tempDir.resolve("owner-alice.jsonl.tmp")));
    }

    private static MemoryEntry entry(String id, String ownerId, String text) {
        return MemoryEntry.builder()
                .id(id)
                .ownerId(ownerId)
                .text(text)
                .topics(List.of("general"))
                .createdAt(CREATED)
                .build();
    }
}
