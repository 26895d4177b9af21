package org.learningjava.embbench.application.port;

import java.util.List;

public interface EmbeddingClientPort extends AutoCloseable {

    /**
     * Sends one embedding request and waits for the full response.
     *
     * @return wall-clock latency in milliseconds, body included
     * @throws EmbeddingRequestException on a non-2xx status, a transport error or a timeout
     */
    double embed(String model, List<String> texts);

    @Override
    default void close() { }
}
