package org.learningjava.embbench.domain.model;

/**
 * One (batch size, concurrency) configuration measured as a unit.
 *
 * @param model       model id sent with every request
 * @param chunkSize   approximate tokens per generated text
 * @param batchSize   texts per request
 * @param concurrency max requests in flight
 * @param numRequests requests issued for this point
 */
public record SweepPoint(
        String model,
        int chunkSize,
        int batchSize,
        int concurrency,
        int numRequests
) {
    public SweepPoint {
        if (model == null || model.isBlank()) throw new IllegalArgumentException("model is required");
        if (chunkSize < 1) throw new IllegalArgumentException("chunkSize must be >= 1, got " + chunkSize);
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1, got " + batchSize);
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1, got " + concurrency);
        if (numRequests < 0) throw new IllegalArgumentException("numRequests must be >= 0, got " + numRequests);
    }
}
