package org.learningjava.embbench.infrastructure.adapter.out.openai;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.learningjava.embbench.application.port.ServerReadinessPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;

/**
 * Polls {@code GET /health} once per interval until the server answers 2xx.
 */
public class OpenAiServerProbe implements ServerReadinessPort {

    private static final Logger log = LoggerFactory.getLogger(OpenAiServerProbe.class);

    private final OkHttpClient http;
    private final String healthUrl;
    private final Duration interval;

    public OpenAiServerProbe(String baseUrl, OkHttpClient http, Duration interval) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.healthUrl = base + "/health";
        this.http = http;
        this.interval = interval;
    }

    @Override
    public boolean awaitReady(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        Request req = new Request.Builder().url(healthUrl).get().build();
        int attempts = 0;
        while (true) {
            attempts++;
            try (Response resp = http.newCall(req).execute()) {
                if (resp.isSuccessful()) {
                    log.info("Server ready at {} after {} attempt(s)", healthUrl, attempts);
                    return true;
                }
                log.debug("Health check returned HTTP {}", resp.code());
            } catch (IOException e) {
                log.debug("Health check failed: {}", e.getMessage());
            }
            if (System.nanoTime() + interval.toNanos() > deadline) {
                log.warn("Server at {} not ready after {} attempt(s)", healthUrl, attempts);
                return false;
            }
            try {
                Thread.sleep(interval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }
}
