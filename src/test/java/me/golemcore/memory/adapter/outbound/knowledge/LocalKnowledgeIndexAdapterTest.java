package me.golemcore.memory.adapter.outbound.knowledge;

import me.golemcore.memory.domain.model.KnowledgeDocument;
import me.golemcore.memory.infrastructure.config.MemoryEngineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalKnowledgeIndexAdapterTest {

    @TempDir
    Path tempDir;

    private LocalKnowledgeIndexAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(tempDir.resolve("geo"));
        Files.writeString(tempDir.resolve("geo/france.md"),
                "Paris is the capital of France.\n\nLyon is known for its food.\n");
        Files.writeString(tempDir.resolve("germany.txt"), "Berlin is the capital of Germany.");
        Files.writeString(tempDir.resolve("ignored.json"), "{\"capital\":\"France\"}");

        MemoryEngineProperties properties = new MemoryEngineProperties();
        properties.getKnowledge().setDocumentsPath(tempDir.toString());
        adapter = new LocalKnowledgeIndexAdapter(properties);
        adapter.init();
    }

    @Test
    void shouldRankPassagesByQueryTermCoverage() {
        List<KnowledgeDocument> results = adapter.search("What is the capital of France?", 5);

        assertEquals(2, results.size());
        assertEquals("Paris is the capital of France.", results.get(0).content());
        assertEquals(Path.of("geo", "france.md").toString(), results.get(0).source());
        assertEquals("Berlin is the capital of Germany.", results.get(1).content());
        assertTrue(results.get(0).score() > results.get(1).score());
    }

    @Test
    void shouldRespectLimit() {
        assertEquals(1, adapter.search("capital", 1).size());
        assertTrue(adapter.search("capital", 0).isEmpty());
    }

    @Test
    void shouldReturnNothingWithoutMatchingTerms() {
        assertTrue(adapter.search("quantum entanglement", 5).isEmpty());
        assertTrue(adapter.search("is it", 5).isEmpty());
    }

    @Test
    void shouldBeUnavailableWithoutDocuments() {
        MemoryEngineProperties properties = new MemoryEngineProperties();
        properties.getKnowledge().setDocumentsPath(tempDir.resolve("missing").toString());
        LocalKnowledgeIndexAdapter empty = new LocalKnowledgeIndexAdapter(properties);
        empty.init();

        assertTrue(adapter.isAvailable());
        assertFalse(empty.isAvailable());
        assertTrue(empty.search("capital", 5).isEmpty());
    }

    @Test
    void shouldPickUpNewDocumentsOnReload() throws IOException {
        Files.writeString(tempDir.resolve("quantum.txt"), "Quantum entanglement links particles.");

        adapter.reload();

        assertEquals(1, adapter.search("quantum entanglement", 5).size());
    }
}
