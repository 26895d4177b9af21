package org.learningjava.embbench.application.port;

public interface EmbeddingClientFactory {
    /** Opens a client whose transport can hold at least {@code concurrency} connections at once. */
    EmbeddingClientPort open(int concurrency);
}
