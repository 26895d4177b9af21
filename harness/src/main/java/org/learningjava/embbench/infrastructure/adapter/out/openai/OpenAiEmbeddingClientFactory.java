package org.learningjava.embbench.infrastructure.adapter.out.openai;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import org.learningjava.embbench.application.port.EmbeddingClientFactory;
import org.learningjava.embbench.application.port.EmbeddingClientPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Builds one OkHttp client per sweep point, with a connection pool large enough that the
 * transport never becomes the thing limiting concurrency.
 */
public class OpenAiEmbeddingClientFactory implements EmbeddingClientFactory {

    private static final Logger log = LoggerFactory.getLogger(OpenAiEmbeddingClientFactory.class);

    private final OkHttpClient base;
    private final ObjectMapper om;
    private final String baseUrl;
    private final Duration requestTimeout;
    private final int headroom;

    public OpenAiEmbeddingClientFactory(OkHttpClient base,
                                        ObjectMapper om,
                                        String baseUrl,
                                        Duration requestTimeout,
                                        int headroom) {
        this.base = base;
        this.om = om;
        this.baseUrl = baseUrl;
        this.requestTimeout = requestTimeout;
        this.headroom = headroom;
    }

    @Override
    public EmbeddingClientPort open(int concurrency) {
        int connections = Math.max(1, concurrency) + Math.max(0, headroom);

        Dispatcher dispatcher = new Dispatcher();
        dispatcher.setMaxRequests(connections);
        dispatcher.setMaxRequestsPerHost(connections);

        OkHttpClient http = base.newBuilder()
                .dispatcher(dispatcher)
                .connectionPool(new ConnectionPool(connections, 5, TimeUnit.MINUTES))
                .callTimeout(requestTimeout)
                .readTimeout(requestTimeout)
                .build();

        log.debug("Opened embedding client for {} with {} connections, timeout {}", baseUrl, connections, requestTimeout);
        return new OpenAiEmbeddingAdapter(baseUrl, http, om);
    }

    public String baseUrl() { return baseUrl; }
}
