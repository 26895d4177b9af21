package org.learningjava.embbench.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Measured outcome of one {@link SweepPoint}. Written once per point as a JSON file.
 * The three power-derived fields are null when no power data was collected.
 */
@JsonPropertyOrder({
        "model", "chunk_size", "batch_size", "concurrency", "num_requests",
        "completed_requests", "elapsed_sec", "p50_latency_ms", "p99_latency_ms",
        "throughput_emb_per_sec", "throughput_per_user",
        "power_avg_w", "energy_joules", "emb_per_joule"
})
public record SweepResult(
        @JsonProperty("model") String model,
        @JsonProperty("chunk_size") int chunkSize,
        @JsonProperty("batch_size") int batchSize,
        @JsonProperty("concurrency") int concurrency,
        @JsonProperty("num_requests") int numRequests,
        @JsonProperty("completed_requests") int completedRequests,
        @JsonProperty("elapsed_sec") double elapsedSec,
        @JsonProperty("p50_latency_ms") double p50LatencyMs,
        @JsonProperty("p99_latency_ms") double p99LatencyMs,
        @JsonProperty("throughput_emb_per_sec") double throughputEmbPerSec,
        @JsonProperty("throughput_per_user") double throughputPerUser,
        @JsonProperty("power_avg_w") Double powerAvgW,
        @JsonProperty("energy_joules") Double energyJoules,
        @JsonProperty("emb_per_joule") Double embPerJoule
) {
    @JsonIgnore
    public SweepPoint point() {
        return new SweepPoint(model, chunkSize, batchSize, concurrency, numRequests);
    }
}
