package org.learningjava.embbench.infrastructure.adapter.out.openai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.learningjava.embbench.application.port.EmbeddingClientPort;
import org.learningjava.embbench.application.port.EmbeddingRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Client for the OpenAI-compatible {@code /v1/embeddings} route (vLLM, TEI, ...).
 * The response is read to the end and parsed, then thrown away; only its latency matters here.
 */
public class OpenAiEmbeddingAdapter implements EmbeddingClientPort {

    private static final Logger log = LoggerFactory.getLogger(OpenAiEmbeddingAdapter.class);

    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient http;
    private final ObjectMapper om;
    private final String url;

    public OpenAiEmbeddingAdapter(String baseUrl, OkHttpClient http, ObjectMapper om) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.url = base + "/v1/embeddings";
        this.http = http;
        this.om = om;
    }

    @Override
    public double embed(String model, List<String> texts) {
        Request req = new Request.Builder()
                .url(url)
                .post(RequestBody.create(payload(model, texts), JSON))
                .build();

        long t0 = System.nanoTime();
        try (Response resp = http.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                throw new EmbeddingRequestException(
                        "Embedding request failed: HTTP " + resp.code() + " " + resp.message(), resp.code());
            }
            ResponseBody body = resp.body();
            if (body != null) {
                om.readTree(body.byteStream());
            }
            long t1 = System.nanoTime();
            return (t1 - t0) / 1_000_000.0;
        } catch (IOException e) {
            log.debug("Embedding call to {} failed: {}", url, e.toString());
            throw new EmbeddingRequestException("Embedding request to " + url + " failed: " + e.getMessage(), e);
        }
    }

    private byte[] payload(String model, List<String> texts) {
        ObjectNode body = om.createObjectNode();
        body.put("model", model);
        ArrayNode input = body.putArray("input");
        texts.forEach(input::add);
        try {
            return om.writeValueAsBytes(body);
        } catch (IOException e) {
            throw new EmbeddingRequestException("Could not serialise embedding payload", e);
        }
    }

    @Override
    public void close() {
        http.connectionPool().evictAll();
    }
}
