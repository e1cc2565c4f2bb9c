package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.model.IntentSettings;
import me.golemcore.memory.domain.model.MemoryEntry;
import me.golemcore.memory.port.inbound.MemoryStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MemoryFastPathServiceTest {

    private MemoryStorePort memoryStore;
    private MemoryFastPathService fastPath;

    @BeforeEach
    void setUp() {
        memoryStore = mock(MemoryStorePort.class);
        fastPath = new MemoryFastPathService(new QueryIntentClassifier(IntentSettings.defaults()), memoryStore);
    }

    @Test
    void shouldListMemoriesForListQuery() {
        when(memoryStore.listAll("alice")).thenReturn(List.of(
                entry("m1", "My dog is named Max", List.of("pets")),
                entry("m2", "I work at Acme", List.of("work", "personal_info"))));

        Optional<String> answer = fastPath.tryFastPath("list all memories", "alice");

        assertTrue(answer.isPresent());
        assertEquals("Stored memories (2):\n1. My dog is named Max [pets]\n2. I work at Acme [work, personal_info]",
                answer.get());
    }

    @Test
    void shouldReportEmptyStore() {
        when(memoryStore.listAll("alice")).thenReturn(List.of());

        assertEquals(Optional.of("No memories stored yet."), fastPath.tryFastPath("show my memories", "alice"));
    }

    @Test
    void shouldDeclineNonListQueries() {
        assertTrue(fastPath.tryFastPath("do you remember my dog", "alice").isEmpty());
        assertTrue(fastPath.tryFastPath("list memories and then delete them", "alice").isEmpty());
        verify(memoryStore, never()).listAll(anyString());
    }

    private static MemoryEntry entry(String id, String text, List<String> topics) {
        return MemoryEntry.builder().id(id).ownerId("alice").text(text).topics(topics).build();
    }
}
