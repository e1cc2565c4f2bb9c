package me.golemcore.memory.testsupport;

import me.golemcore.memory.domain.model.MemoryEntry;
import me.golemcore.memory.port.outbound.MemoryRepositoryPort;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe in-memory repository for domain tests. Counts writes so tests
 * can assert how many inserts reached persistence.
 */
public class InMemoryMemoryRepository implements MemoryRepositoryPort {

    private final Map<String, MemoryEntry> entries = new LinkedHashMap<>();
    private final AtomicInteger writes = new AtomicInteger();

    @Override
    public synchronized List<MemoryEntry> readAll(String ownerId) {
        List<MemoryEntry> result = new ArrayList<>();
        for (MemoryEntry entry : entries.values()) {
            if (entry.getOwnerId().equals(ownerId)) {
                result.add(entry);
            }
        }
        return result;
    }

    @Override
    public synchronized String write(MemoryEntry entry) {
        entries.put(key(entry.getId(), entry.getOwnerId()), entry);
        writes.incrementAndGet();
        return entry.getId();
    }

    @Override
    public synchronized boolean delete(String memoryId, String ownerId) {
        return entries.remove(key(memoryId, ownerId)) != null;
    }

    public synchronized void put(MemoryEntry entry) {
        entries.put(key(entry.getId(), entry.getOwnerId()), entry);
    }

    public synchronized int size() {
        return entries.size();
    }

    public int getWriteCount() {
        return writes.get();
    }

    private static String key(String memoryId, String ownerId) {
        return ownerId + '\u0000' + memoryId;
    }
}
