package org.learningjava.embbench.application.usecase;

/** Aggregation cannot produce a summary at all. */
public class AggregationException extends RuntimeException {
    public AggregationException(String message) {
        super(message);
    }
}
