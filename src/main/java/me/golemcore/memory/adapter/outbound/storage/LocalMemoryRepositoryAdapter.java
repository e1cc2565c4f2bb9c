package me.golemcore.memory.adapter.outbound.storage;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.MemoryEntry;
import me.golemcore.memory.infrastructure.config.MemoryEngineProperties;
import me.golemcore.memory.port.outbound.MemoryRepositoryPort;
import me.golemcore.memory.port.outbound.MemoryStorageException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Local filesystem implementation of {@link MemoryRepositoryPort}.
 *
 * <p>
 * Each owner gets one JSONL file, {@code owner-<url-encoded id>.jsonl}, with one
 * {@link MemoryRecord} per line. Files are rewritten through a temp file and an
 * atomic rename. Lines that fail to parse are skipped with a warning so one
 * corrupt row does not hide the rest of an owner's memories.
 *
 * <p>
 * Base path configured via {@code memory-engine.storage.base-path}, defaults to
 * {@code ${user.home}/.golemcore/memory}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalMemoryRepositoryAdapter implements MemoryRepositoryPort {

    private static final String FILE_PREFIX = "owner-";
    private static final String FILE_SUFFIX = ".jsonl";

    private final MemoryEngineProperties properties;
    private final ObjectMapper objectMapper;
    private final MemoryRecordMapper recordMapper;

    private Path basePath;

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        try {
            Files.createDirectories(basePath);
            log.info("[MemoryRepo] Memory storage initialized at: {}", basePath);
        } catch (IOException e) {
            throw new MemoryStorageException("Failed to create memory storage directory: " + basePath, e);
        }
    }

    @Override
    public synchronized List<MemoryEntry> readAll(String ownerId) {
        return readFile(ownerFile(ownerId), ownerId);
    }

    @Override
    public synchronized String write(MemoryEntry entry) {
        Path file = ownerFile(entry.getOwnerId());
        List<MemoryEntry> entries = readFile(file, entry.getOwnerId());
        boolean replaced = false;
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).getId().equals(entry.getId())) {
                entries.set(i, entry);
                replaced = true;
                break;
            }
        }
        if (!replaced) {
            entries.add(entry);
        }
        writeFile(file, entries);
        log.debug("[MemoryRepo] {} memory {} for {}", replaced ? "Replaced" : "Inserted", entry.getId(),
                entry.getOwnerId());
        return entry.getId();
    }

    @Override
    public synchronized boolean delete(String memoryId, String ownerId) {
        Path file = ownerFile(ownerId);
        List<MemoryEntry> entries = readFile(file, ownerId);
        boolean removed = entries.removeIf(
                entry -> entry.getId().equals(memoryId) && ownerId.equals(entry.getOwnerId()));
        if (removed) {
            writeFile(file, entries);
            log.debug("[MemoryRepo] Deleted memory {} for {}", memoryId, ownerId);
        }
        return removed;
    }

    private List<MemoryEntry> readFile(Path file, String ownerId) {
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MemoryStorageException("Failed to read memories: " + file.getFileName(), e);
        }

        List<MemoryEntry> entries = new ArrayList<>();
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            try {
                MemoryRecord memoryRecord = objectMapper.readValue(line, MemoryRecord.class);
                entries.add(recordMapper.toEntry(memoryRecord, ownerId));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("[MemoryRepo] Skipping invalid memory line in {}: {}", file.getFileName(), e.getMessage());
            }
        }
        return entries;
    }

    private void writeFile(Path file, List<MemoryEntry> entries) {
        Path tempPath = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            StringBuilder content = new StringBuilder();
            for (MemoryEntry entry : entries) {
                content.append(objectMapper.writeValueAsString(recordMapper.toRecord(entry))).append('\n');
            }

            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.SYNC)) {
                os.write(content.toString().getBytes(StandardCharsets.UTF_8));
            }

            try {
                Files.move(tempPath, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[MemoryRepo] Atomic move not supported, using regular move");
                Files.move(tempPath, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupEx) {
                log.warn("[MemoryRepo] Failed to cleanup temp file: {}", tempPath);
            }
            throw new MemoryStorageException("Failed to write memories: " + file.getFileName(), e);
        }
    }

    private Path ownerFile(String ownerId) {
        if (basePath == null) {
            throw new MemoryStorageException("Memory repository is not initialized");
        }
        return basePath.resolve(FILE_PREFIX + URLEncoder.encode(ownerId, StandardCharsets.UTF_8) + FILE_SUFFIX);
    }
}
