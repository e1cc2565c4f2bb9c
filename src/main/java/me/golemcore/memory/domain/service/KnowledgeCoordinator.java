package me.golemcore.memory.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.KnowledgeAttempt;
import me.golemcore.memory.domain.model.KnowledgeBackend;
import me.golemcore.memory.domain.model.KnowledgeDocument;
import me.golemcore.memory.domain.model.KnowledgeMode;
import me.golemcore.memory.domain.model.KnowledgeResult;
import me.golemcore.memory.domain.model.KnowledgeSettings;
import me.golemcore.memory.domain.model.KnowledgeSource;
import me.golemcore.memory.domain.model.RoutingDecision;
import me.golemcore.memory.domain.model.RoutingStats;
import me.golemcore.memory.port.inbound.KnowledgeQueryPort;
import me.golemcore.memory.port.outbound.GraphRagPort;
import me.golemcore.memory.port.outbound.KnowledgeIndexPort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Routes knowledge queries between the local similarity index and the LightRAG
 * knowledge graph.
 *
 * <p>
 * Routing:
 * <ul>
 * <li>{@code local} goes to the local index</li>
 * <li>{@code global}, {@code hybrid}, {@code mix}, {@code naive} and
 * {@code bypass} go to the graph service with that mode</li>
 * <li>{@code auto} sends simple fact lookups to the local index, relationship
 * and analysis questions to the graph service, and everything else to the
 * local index</li>
 * <li>unknown modes go to the local index</li>
 * </ul>
 *
 * <p>
 * A failed primary attempt (error, timeout, empty result, unavailable backend)
 * is retried once on the other backend and tagged
 * {@link KnowledgeSource#FALLBACK}. When both fail the result is
 * {@link KnowledgeSource#ERROR}. Every attempt is recorded on the result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeCoordinator implements KnowledgeQueryPort {

    static final String LOCAL_HEADER = "Local Knowledge Search Results";
    static final String GRAPH_HEADER = "LightRAG Knowledge Graph Results";

    private static final int SIMPLE_QUERY_MAX_WORDS = 3;

    private static final List<Pattern> SIMPLE_FACT_PATTERNS = List.of(
            Pattern.compile("^what is\\s+\\w+"),
            Pattern.compile("^who is\\s+\\w+"),
            Pattern.compile("^when did\\s+\\w+"),
            Pattern.compile("^where is\\s+\\w+"),
            Pattern.compile("^how much\\s+\\w+"),
            Pattern.compile("^define\\s+\\w+"),
            Pattern.compile("^\\w+\\s+definition"));

    private static final List<String> RELATIONSHIP_KEYWORDS = List.of(
            "relationship", "relate", "connection", "connected", "linked", "associated",
            "compare", "contrast", "difference", "similarity", "versus",
            "how does", "why does", "what causes", "impact of", "effect of",
            "analyze", "analysis", "explain", "reasoning", "because",
            "correlation", "influence", "affect", "consequence", "result",
            "pattern", "trend", "network", "graph", "hierarchy");

    private static final List<Pattern> COMPLEX_PATTERNS = List.of(
            Pattern.compile("how\\s+\\w+\\s+\\w+\\s+\\w+"),
            Pattern.compile("why\\s+\\w+\\s+\\w+"),
            Pattern.compile("what\\s+causes?\\s+\\w+"),
            Pattern.compile("explain\\s+\\w+"));

    private final KnowledgeIndexPort knowledgeIndex;
    private final GraphRagPort graphRag;
    private final KnowledgeSettings settings;

    private final AtomicLong localQueries = new AtomicLong();
    private final AtomicLong graphQueries = new AtomicLong();
    private final AtomicLong autoDetectedLocal = new AtomicLong();
    private final AtomicLong autoDetectedGraph = new AtomicLong();
    private final AtomicLong fallbackUsed = new AtomicLong();

    @Override
    public KnowledgeResult query(String query, String mode, int limit) {
        return query(query, mode, limit, settings.getTimeout());
    }

    @Override
    public KnowledgeResult query(String query, String mode, int limit, Duration timeout) {
        if (query == null || query.isBlank()) {
            return KnowledgeResult.builder()
                    .source(KnowledgeSource.ERROR)
                    .content("Query cannot be empty. Please provide a search term.")
                    .build();
        }

        String text = query.strip();
        int effectiveLimit = limit > 0 ? limit : settings.getDefaultLimit();
        RoutingDecision routing = determineRouting(text, mode);
        recordRouting(routing);
        log.info("[Knowledge] Routing '{}' to {} ({})", text, routing.backend(), routing.reason());

        Outcome primary = execute(routing.backend(), text, routing.graphMode(), effectiveLimit, timeout);
        KnowledgeResult.KnowledgeResultBuilder result = KnowledgeResult.builder().routing(routing);
        if (primary.success()) {
            return result
                    .source(routing.backend() == KnowledgeBackend.LOCAL ? KnowledgeSource.LOCAL
                            : KnowledgeSource.GRAPH)
                    .content(primary.content())
                    .attempt(KnowledgeAttempt.succeeded(routing.backend()))
                    .build();
        }

        result.attempt(KnowledgeAttempt.failed(routing.backend(), primary.content()));
        if (!settings.isFallbackEnabled()) {
            return result
                    .source(KnowledgeSource.ERROR)
                    .content(primary.content())
                    .build();
        }

        KnowledgeBackend fallbackBackend = routing.backend().other();
        log.info("[Knowledge] {} failed ({}), falling back to {}", routing.backend(), primary.content(),
                fallbackBackend);
        fallbackUsed.incrementAndGet();
        Outcome fallback = execute(fallbackBackend, text, settings.getDefaultGraphMode(), effectiveLimit, timeout);
        if (fallback.success()) {
            return result
                    .source(KnowledgeSource.FALLBACK)
                    .content(fallback.content())
                    .attempt(KnowledgeAttempt.succeeded(fallbackBackend))
                    .build();
        }

        log.warn("[Knowledge] Both backends failed for '{}': {} / {}", text, primary.content(),
                fallback.content());
        return result
                .source(KnowledgeSource.ERROR)
                .content("Knowledge query failed. " + routing.backend() + ": " + primary.content() + "; "
                        + fallbackBackend + ": " + fallback.content())
                .attempt(KnowledgeAttempt.failed(fallbackBackend, fallback.content()))
                .build();
    }

    @Override
    public CompletableFuture<KnowledgeResult> queryAsync(String query, String mode, int limit) {
        return CompletableFuture.supplyAsync(() -> query(query, mode, limit));
    }

    @Override
    public RoutingStats getRoutingStats() {
        return RoutingStats.builder()
                .localQueries(localQueries.get())
                .graphQueries(graphQueries.get())
                .autoDetectedLocal(autoDetectedLocal.get())
                .autoDetectedGraph(autoDetectedGraph.get())
                .fallbackUsed(fallbackUsed.get())
                .build();
    }

    @Override
    public void resetStats() {
        localQueries.set(0);
        graphQueries.set(0);
        autoDetectedLocal.set(0);
        autoDetectedGraph.set(0);
        fallbackUsed.set(0);
        log.info("[Knowledge] Routing statistics reset");
    }

    // ==================== ROUTING ====================

    RoutingDecision determineRouting(String query, String mode) {
        Optional<KnowledgeMode> parsed = KnowledgeMode.parse(mode);
        KnowledgeMode defaultGraphMode = settings.getDefaultGraphMode();
        if (parsed.isEmpty()) {
            log.warn("[Knowledge] Unknown mode '{}', defaulting to local search", mode);
            return new RoutingDecision(KnowledgeBackend.LOCAL, defaultGraphMode, false,
                    "Unknown mode '" + mode + "', defaulting to local search");
        }

        KnowledgeMode requested = parsed.get();
        if (requested == KnowledgeMode.LOCAL) {
            return new RoutingDecision(KnowledgeBackend.LOCAL, defaultGraphMode, false, "Explicit mode=local");
        }
        if (requested.isGraphMode()) {
            return new RoutingDecision(KnowledgeBackend.GRAPH, requested, false,
                    "Explicit mode=" + requested.getWireName() + " routing to LightRAG");
        }

        if (isSimpleFactQuery(query)) {
            return new RoutingDecision(KnowledgeBackend.LOCAL, defaultGraphMode, true,
                    "Auto-detected simple fact query");
        }
        if (hasRelationshipCues(query)) {
            return new RoutingDecision(KnowledgeBackend.GRAPH, defaultGraphMode, true,
                    "Auto-detected relationship query");
        }
        return new RoutingDecision(KnowledgeBackend.LOCAL, defaultGraphMode, true,
                "Auto-detected default to local search for speed");
    }

    static boolean isSimpleFactQuery(String query) {
        String normalized = query.strip().toLowerCase(Locale.ROOT);
        for (Pattern pattern : SIMPLE_FACT_PATTERNS) {
            if (pattern.matcher(normalized).lookingAt()) {
                return true;
            }
        }
        return normalized.split("\\s+").length <= SIMPLE_QUERY_MAX_WORDS;
    }

    static boolean hasRelationshipCues(String query) {
        String normalized = query.toLowerCase(Locale.ROOT);
        for (String keyword : RELATIONSHIP_KEYWORDS) {
            if (normalized.contains(keyword)) {
                return true;
            }
        }
        for (Pattern pattern : COMPLEX_PATTERNS) {
            if (pattern.matcher(normalized).find()) {
                return true;
            }
        }
        return false;
    }

    private void recordRouting(RoutingDecision routing) {
        if (routing.backend() == KnowledgeBackend.LOCAL) {
            localQueries.incrementAndGet();
            if (routing.autoDetected()) {
                autoDetectedLocal.incrementAndGet();
            }
        } else {
            graphQueries.incrementAndGet();
            if (routing.autoDetected()) {
                autoDetectedGraph.incrementAndGet();
            }
        }
    }

    // ==================== EXECUTION ====================

    private Outcome execute(KnowledgeBackend backend, String query, KnowledgeMode graphMode, int limit,
            Duration timeout) {
        return backend == KnowledgeBackend.LOCAL
                ? queryLocal(query, limit)
                : queryGraph(query, graphMode, limit, timeout);
    }

    private Outcome queryLocal(String query, int limit) {
        if (!knowledgeIndex.isAvailable()) {
            return Outcome.failure("Local knowledge index is not available");
        }
        List<KnowledgeDocument> documents;
        try {
            documents = knowledgeIndex.search(query, limit);
        } catch (RuntimeException e) {
            log.warn("[Knowledge] Local search failed: {}", e.getMessage(), e);
            return Outcome.failure("Error searching local knowledge base: " + e.getMessage());
        }
        if (documents.isEmpty()) {
            return Outcome.failure("No results found in local knowledge base for '" + query + "'");
        }

        StringBuilder sb = new StringBuilder();
        sb.append(LOCAL_HEADER).append(" for '").append(query).append("':\n\n");
        for (int i = 0; i < documents.size(); i++) {
            KnowledgeDocument document = documents.get(i);
            if (i > 0) {
                sb.append("\n\n");
            }
            sb.append("Result ").append(i + 1);
            if (document.source() != null && !document.source().isBlank()) {
                sb.append(" (Source: ").append(document.source()).append(")");
            }
            sb.append('\n').append(document.content());
        }
        log.debug("[Knowledge] Local search returned {} results", documents.size());
        return Outcome.success(sb.toString());
    }

    private Outcome queryGraph(String query, KnowledgeMode mode, int topK, Duration timeout) {
        if (!graphRag.isAvailable()) {
            return Outcome.failure("LightRAG service is not available");
        }

        CompletableFuture<String> call = null;
        String answer;
        try {
            call = graphRag.query(query, mode.getWireName(), topK);
            if (call == null) {
                return Outcome.failure("LightRAG returned no pending call");
            }
            answer = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("[Knowledge] LightRAG timed out after {} ms", timeout.toMillis());
            return Outcome.failure("Timeout after " + timeout.toMillis() + " ms waiting for LightRAG");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            return Outcome.failure("Interrupted while waiting for LightRAG");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Knowledge] LightRAG query failed: {}", cause.getMessage());
            return Outcome.failure("Error querying LightRAG: " + cause.getMessage());
        } catch (CancellationException e) {
            log.warn("[Knowledge] LightRAG call was cancelled");
            return Outcome.failure("LightRAG call was cancelled");
        } catch (RuntimeException e) {
            log.warn("[Knowledge] LightRAG client failed: {}", e.getMessage(), e);
            return Outcome.failure("Error querying LightRAG: " + e.getMessage());
        }

        if (answer == null || answer.isBlank()) {
            return Outcome.failure("Empty response from LightRAG");
        }
        return Outcome.success(GRAPH_HEADER + " (mode: " + mode.getWireName() + ") for '" + query + "':\n\n"
                + answer.strip());
    }

    private record Outcome(boolean success, String content) {

        static Outcome success(String content) {
            return new Outcome(true, content);
        }

        static Outcome failure(String reason) {
            return new Outcome(false, reason);
        }
    }
}
