package org.learningjava.embbench.domain.model;

import java.util.List;

/**
 * What the dispatcher observed: latencies of the requests that succeeded, in completion order,
 * and how many failed.
 */
public record DispatchOutcome(List<Double> latenciesMs, int failedRequests) {

    public DispatchOutcome {
        latenciesMs = List.copyOf(latenciesMs);
    }

    public int completedRequests() {
        return latenciesMs.size();
    }
}
