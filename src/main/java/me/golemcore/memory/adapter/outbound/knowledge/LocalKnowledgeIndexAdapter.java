package me.golemcore.memory.adapter.outbound.knowledge;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.KnowledgeDocument;
import me.golemcore.memory.domain.service.TextSimilarity;
import me.golemcore.memory.infrastructure.config.MemoryEngineProperties;
import me.golemcore.memory.port.outbound.KnowledgeIndexPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Paragraph index over the text and markdown files of a local directory.
 *
 * <p>
 * Files are split into paragraphs at blank lines. A paragraph is relevant when
 * it contains at least one key term of the query; relevance is
 * {@code 0.7 * termCoverage + 0.3 * stringSimilarity}.
 *
 * <p>
 * Directory configured via {@code memory-engine.knowledge.documents-path}. The
 * index is built at startup and on {@link #reload()}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalKnowledgeIndexAdapter implements KnowledgeIndexPort {

    private static final double COVERAGE_WEIGHT = 0.7;
    private static final double STRING_WEIGHT = 0.3;
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\R\\s*\\R");
    private static final Set<String> EXTENSIONS = Set.of(".txt", ".md", ".markdown");

    private final MemoryEngineProperties properties;

    private volatile List<Passage> passages = List.of();

    @PostConstruct
    public void init() {
        reload();
    }

    /**
     * Rebuild the index from the documents directory.
     */
    public void reload() {
        Path root = documentsPath();
        if (!Files.isDirectory(root)) {
            log.info("[KnowledgeIndex] Documents directory {} not found, local index is empty", root);
            passages = List.of();
            return;
        }

        List<Passage> loaded = new ArrayList<>();
        try (Stream<Path> files = Files.walk(root)) {
            List<Path> documents = files.filter(Files::isRegularFile).filter(this::isIndexable).sorted().toList();
            for (Path document : documents) {
                loaded.addAll(readPassages(root, document));
            }
        } catch (IOException e) {
            log.warn("[KnowledgeIndex] Failed to scan {}: {}", root, e.getMessage());
        }
        passages = List.copyOf(loaded);
        log.info("[KnowledgeIndex] Indexed {} passages from {}", loaded.size(), root);
    }

    @Override
    public List<KnowledgeDocument> search(String query, int limit) {
        Set<String> queryTerms = TextSimilarity.keyTerms(query);
        if (queryTerms.isEmpty() || limit <= 0) {
            return List.of();
        }

        List<KnowledgeDocument> hits = new ArrayList<>();
        for (Passage passage : passages) {
            long matched = queryTerms.stream().filter(passage.terms()::contains).count();
            if (matched == 0) {
                continue;
            }
            double coverage = (double) matched / queryTerms.size();
            double score = COVERAGE_WEIGHT * coverage
                    + STRING_WEIGHT * TextSimilarity.stringSimilarity(query, passage.content());
            hits.add(new KnowledgeDocument(passage.content(), passage.source(), score));
        }
        hits.sort(Comparator.comparingDouble(KnowledgeDocument::score).reversed());
        return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : List.copyOf(hits);
    }

    @Override
    public boolean isAvailable() {
        return !passages.isEmpty();
    }

    private List<Passage> readPassages(Path root, Path document) {
        String content;
        try {
            content = Files.readString(document, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("[KnowledgeIndex] Skipping unreadable document {}: {}", document, e.getMessage());
            return List.of();
        }

        String source = root.relativize(document).toString();
        List<Passage> result = new ArrayList<>();
        for (String paragraph : PARAGRAPH_BREAK.split(content)) {
            String text = paragraph.strip();
            if (!text.isEmpty()) {
                result.add(new Passage(text, source, TextSimilarity.keyTerms(text)));
            }
        }
        return result;
    }

    private boolean isIndexable(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return EXTENSIONS.stream().anyMatch(name::endsWith);
    }

    private Path documentsPath() {
        String path = properties.getKnowledge().getDocumentsPath();
        return Paths.get(path.replace("${user.home}", System.getProperty("user.home"))).toAbsolutePath().normalize();
    }

    private record Passage(String content, String source, Set<String> terms) {
    }
}
