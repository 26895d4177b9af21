package org.learningjava.embbench.infrastructure.adapter.out.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.embbench.application.port.EmbeddingClientPort;
import org.learningjava.embbench.application.port.EmbeddingRequestException;
import org.learningjava.embbench.domain.model.DispatchOutcome;
import org.learningjava.embbench.domain.service.dispatch.BoundedDispatcher;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OpenAiEmbeddingAdapterTest {

    private static final String OK_BODY =
            "{\"object\":\"list\",\"data\":[{\"object\":\"embedding\",\"index\":0,\"embedding\":[0.1,0.2]}],"
                    + "\"model\":\"BAAI/bge-m3\"}";

    private MockWebServer server;
    private final ObjectMapper om = new ObjectMapper();

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    private String baseUrl() {
        return server.url("/").toString();   // trailing slash on purpose
    }

    @Test
    void embed_postsModelAndInput_andReturnsLatency() throws Exception {
        // Arrange
        server.enqueue(new MockResponse().setResponseCode(200).setBody(OK_BODY));
        OpenAiEmbeddingAdapter adapter = new OpenAiEmbeddingAdapter(baseUrl(), new OkHttpClient(), om);

        // Act
        double ms = adapter.embed("BAAI/bge-m3", List.of("alpha beta", "gamma"));

        // Assert
        assertTrue(ms >= 0.0);
        RecordedRequest req = server.takeRequest();
        assertEquals("POST", req.getMethod());
        assertEquals("/v1/embeddings", req.getPath());
        JsonNode body = om.readTree(req.getBody().readUtf8());
        assertEquals("BAAI/bge-m3", body.get("model").asText());
        assertEquals(2, body.get("input").size());
        assertEquals("gamma", body.get("input").get(1).asText());
    }

    @Test
    void non2xx_throwsWithStatus() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("overloaded"));
        OpenAiEmbeddingAdapter adapter = new OpenAiEmbeddingAdapter(baseUrl(), new OkHttpClient(), om);

        EmbeddingRequestException e = assertThrows(EmbeddingRequestException.class,
                () -> adapter.embed("m", List.of("x")));

        assertEquals(503, e.status());
    }

    @Test
    void unparseableBody_isAFailedRequest() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>"));
        OpenAiEmbeddingAdapter adapter = new OpenAiEmbeddingAdapter(baseUrl(), new OkHttpClient(), om);

        EmbeddingRequestException e = assertThrows(EmbeddingRequestException.class,
                () -> adapter.embed("m", List.of("x")));

        assertEquals(-1, e.status());
    }

    @Test
    void factory_opensWorkingClientsPerPoint() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(OK_BODY));
        server.enqueue(new MockResponse().setResponseCode(200).setBody(OK_BODY));
        OpenAiEmbeddingClientFactory factory = new OpenAiEmbeddingClientFactory(
                new OkHttpClient(), om, baseUrl(), Duration.ofSeconds(5), 4);

        try (EmbeddingClientPort first = factory.open(1)) {
            first.embed("m", List.of("a"));
        }
        try (EmbeddingClientPort second = factory.open(16)) {
            second.embed("m", List.of("b"));
        }

        assertEquals(2, server.getRequestCount());
    }

    @Test
    void requestOverTheTimeout_failsWithoutStatus() {
        // Arrange
        server.enqueue(new MockResponse().setResponseCode(200).setBody(OK_BODY)
                .setHeadersDelay(2, TimeUnit.SECONDS));
        OpenAiEmbeddingClientFactory factory = new OpenAiEmbeddingClientFactory(
                new OkHttpClient(), om, baseUrl(), Duration.ofMillis(300), 4);

        // Act
        long t0 = System.nanoTime();
        EmbeddingRequestException e;
        try (EmbeddingClientPort client = factory.open(1)) {
            e = assertThrows(EmbeddingRequestException.class, () -> client.embed("m", List.of("x")));
        }
        long tookMs = (System.nanoTime() - t0) / 1_000_000;

        // Assert
        assertEquals(-1, e.status());
        assertTrue(tookMs < 1_500, "gave up after " + tookMs + " ms");
    }

    @Test
    void refusedConnection_failsWithoutStatus() throws Exception {
        MockWebServer gone = new MockWebServer();
        gone.start();
        String url = gone.url("/").toString();
        gone.shutdown();
        OpenAiEmbeddingAdapter adapter = new OpenAiEmbeddingAdapter(url, new OkHttpClient(), om);

        EmbeddingRequestException e = assertThrows(EmbeddingRequestException.class,
                () -> adapter.embed("m", List.of("x")));

        assertEquals(-1, e.status());
    }

    @Test
    void failedRequests_areCountedByTheDispatcher_andLeaveNoLatency() throws Exception {
        MockWebServer gone = new MockWebServer();
        gone.start();
        String url = gone.url("/").toString();
        gone.shutdown();
        OpenAiEmbeddingAdapter adapter = new OpenAiEmbeddingAdapter(url, new OkHttpClient(), om);

        DispatchOutcome outcome = new BoundedDispatcher().dispatch(
                List.of(List.of("a"), List.of("b"), List.of("c")), 2, batch -> adapter.embed("m", batch));

        assertEquals(3, outcome.failedRequests());
        assertEquals(0, outcome.completedRequests());
        assertTrue(outcome.latenciesMs().isEmpty());
    }
}
