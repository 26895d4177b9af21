package org.learningjava.embbench.domain.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything a sweep run needs: the cartesian product of chunk sizes, batch sizes and
 * concurrencies for one model, plus where to put the results.
 */
public record SweepPlan(
        String model,
        List<Integer> chunkSizes,
        List<Integer> batchSizes,
        List<Integer> concurrencies,
        int numRequests,
        Path resultDir,
        boolean force
) {
    public SweepPlan {
        if (model == null || model.isBlank()) throw new IllegalArgumentException("model is required");
        requirePositive("chunk size", chunkSizes);
        requirePositive("batch size", batchSizes);
        requirePositive("concurrency", concurrencies);
        if (numRequests < 0) throw new IllegalArgumentException("numRequests must be >= 0, got " + numRequests);
        chunkSizes = List.copyOf(chunkSizes);
        batchSizes = List.copyOf(batchSizes);
        concurrencies = List.copyOf(concurrencies);
    }

    private static void requirePositive(String what, List<Integer> values) {
        if (values == null || values.isEmpty()) throw new IllegalArgumentException("at least one " + what + " is required");
        for (Integer v : values) {
            if (v == null || v < 1) throw new IllegalArgumentException(what + " must be >= 1, got " + v);
        }
    }

    public int size() {
        return chunkSizes.size() * batchSizes.size() * concurrencies.size();
    }
}
