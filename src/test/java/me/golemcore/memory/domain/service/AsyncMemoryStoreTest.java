package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.model.MemorySettings;
import me.golemcore.memory.domain.model.ScoredMemory;
import me.golemcore.memory.domain.model.StorageResult;
import me.golemcore.memory.testsupport.InMemoryMemoryRepository;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AsyncMemoryStoreTest {

    private final MemorySettings settings = MemorySettings.defaults();
    private final AsyncMemoryStore store = new AsyncMemoryStore(new SemanticMemoryService(
            new InMemoryMemoryRepository(),
            new TopicClassifier(),
            new DuplicateDetector(settings),
            new QueryExpander(settings),
            new MemoryStatementExtractor(),
            settings,
            Clock.systemUTC()));

    @Test
    void shouldDelegateWritesAndReads() throws Exception {
        StorageResult added = store.add("My dog is named Max", "alice").get(5, TimeUnit.SECONDS);
        StorageResult proxy = store.add("I live in Berlin", "alice", List.of("home"), 0.7, true, "assistant")
                .get(5, TimeUnit.SECONDS);

        assertTrue(added.isSuccess());
        assertTrue(proxy.isSuccess());
        assertEquals(2, store.listAll("alice").get(5, TimeUnit.SECONDS).size());

        List<ScoredMemory> hits = store.search("dog", "alice", 5, 0.3, 0.0).get(5, TimeUnit.SECONDS);
        assertEquals("My dog is named Max", hits.get(0).entry().getText());

        assertTrue(store.delete(added.getMemoryId(), "alice").get(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldRunConcurrentIdenticalAddsWithSingleSuccess() {
        List<CompletableFuture<StorageResult>> futures = List.of(
                store.add("I prefer tea over coffee", "bob"),
                store.add("I prefer tea over coffee", "bob"),
                store.add("I prefer tea over coffee", "bob"));

        long successes = futures.stream().map(CompletableFuture::join).filter(StorageResult::isSuccess).count();

        assertEquals(1, successes);
    }

    @Test
    void shouldIngestAsynchronously() {
        assertEquals(2, store.ingest("I live in Berlin. I have a cat named Tom.", "carol").join().getAddedCount());
    }
}
