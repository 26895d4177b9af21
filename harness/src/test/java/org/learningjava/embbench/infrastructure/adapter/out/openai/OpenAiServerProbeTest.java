package org.learningjava.embbench.infrastructure.adapter.out.openai;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class OpenAiServerProbeTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void becomesReady_afterServerStopsReturningErrors() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(200));
        OpenAiServerProbe probe = new OpenAiServerProbe(server.url("/").toString(), new OkHttpClient(), Duration.ofMillis(10));

        assertTrue(probe.awaitReady(Duration.ofSeconds(5)));
        assertEquals(3, server.getRequestCount());
        assertEquals("/health", server.takeRequest().getPath());
    }

    @Test
    void givesUp_whenDeadlinePasses() {
        for (int i = 0; i < 50; i++) server.enqueue(new MockResponse().setResponseCode(500));
        OpenAiServerProbe probe = new OpenAiServerProbe(server.url("/").toString(), new OkHttpClient(), Duration.ofMillis(20));

        assertFalse(probe.awaitReady(Duration.ofMillis(100)));
    }
}
