package me.golemcore.memory.adapter.outbound.rag;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.memory.domain.model.KnowledgeSettings;
import me.golemcore.memory.infrastructure.config.MemoryEngineProperties;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LightRagAdapterTest {

    private static final String CONTENT_TYPE = "Content-Type";
    private static final String APPLICATION_JSON = "application/json";
    private static final String TEST_QUERY = "How does X relate to Y?";

    private MockWebServer mockServer;
    private MemoryEngineProperties properties;
    private LightRagAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        properties = new MemoryEngineProperties();
        properties.getRag().setEnabled(true);
        properties.getRag().setUrl(mockServer.url("").toString().replaceAll("/$", ""));

        adapter = createAdapter(KnowledgeSettings.defaults());
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    @Test
    void shouldPostQueryAndReadResponseField() throws Exception {
        mockServer.enqueue(new MockResponse()
                .setBody("{\"response\": \"X and Y share a parent\"}")
                .setHeader(CONTENT_TYPE, APPLICATION_JSON));

        String result = adapter.query(TEST_QUERY, "hybrid", 7).get(5, TimeUnit.SECONDS);
        assertEquals("X and Y share a parent", result);

        RecordedRequest request = mockServer.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/query", request.getPath());
        assertNull(request.getHeader("Authorization"));
        String body = request.getBody().readUtf8();
        assertTrue(body.contains("\"query\":\"How does X relate to Y?\""));
        assertTrue(body.contains("\"mode\":\"hybrid\""));
        assertTrue(body.contains("\"top_k\":7"));
        assertTrue(body.contains("\"response_type\":\"Multiple Paragraphs\""));
    }

    @Test
    void shouldSendBearerTokenWhenApiKeyConfigured() throws Exception {
        properties.getRag().setApiKey("secret");
        mockServer.enqueue(new MockResponse().setBody("{\"content\": \"ok\"}"));

        assertEquals("ok", adapter.query(TEST_QUERY, "mix", 5).get(5, TimeUnit.SECONDS));
        assertEquals("Bearer secret", mockServer.takeRequest().getHeader("Authorization"));
    }

    @Test
    void shouldReturnPlainTextBodyAsIs() throws Exception {
        mockServer.enqueue(new MockResponse()
                .setBody("  plain text answer \n")
                .setHeader(CONTENT_TYPE, "text/plain"));

        assertEquals("plain text answer", adapter.query(TEST_QUERY, "naive", 5).get(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldFailWithStatusCodeOnServerError() {
        mockServer.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        CompletableFuture<String> future = adapter.query(TEST_QUERY, "hybrid", 5);

        ExecutionException error = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        GraphRagException cause = assertInstanceOf(GraphRagException.class, error.getCause());
        assertEquals(500, cause.getStatusCode());
        assertEquals("LightRAG server error 500: boom", cause.getMessage());
    }

    @Test
    void shouldFailWithoutCallingServerWhenDisabled() {
        properties.getRag().setEnabled(false);

        CompletableFuture<String> future = adapter.query(TEST_QUERY, "hybrid", 5);

        assertTrue(future.isCompletedExceptionally());
        assertFalse(adapter.isAvailable());
        assertEquals(0, mockServer.getRequestCount());
    }

    @Test
    void shouldFailWhenServerExceedsKnowledgeTimeout() {
        LightRagAdapter impatient = createAdapter(KnowledgeSettings.builder().timeout(Duration.ofMillis(300)).build());
        mockServer.enqueue(new MockResponse()
                .setBody("{\"response\": \"late\"}")
                .setHeadersDelay(3, TimeUnit.SECONDS));

        CompletableFuture<String> future = impatient.query(TEST_QUERY, "hybrid", 5);

        ExecutionException error = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        GraphRagException cause = assertInstanceOf(GraphRagException.class, error.getCause());
        assertEquals(-1, cause.getStatusCode());
    }

    @Test
    void shouldParseResponseFieldsInPriorityOrder() {
        assertEquals("first", adapter.parseQueryResponse("{\"answer\":\"third\",\"response\":\"first\"}"));
        assertEquals("third", adapter.parseQueryResponse("{\"answer\":\"third\"}"));
        assertEquals("{\"data\":1}", adapter.parseQueryResponse("{\"data\":1}"));
    }

    private LightRagAdapter createAdapter(KnowledgeSettings settings) {
        return new LightRagAdapter(properties, settings, new OkHttpClient(), new ObjectMapper());
    }
}
