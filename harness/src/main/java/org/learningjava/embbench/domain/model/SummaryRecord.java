package org.learningjava.embbench.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Comparator;

/**
 * A {@link SweepResult} tagged with the hardware it ran on, as written to {@code summary.json}.
 */
@JsonPropertyOrder({
        "model", "chunk_size", "batch_size", "concurrency", "num_requests",
        "completed_requests", "elapsed_sec", "p50_latency_ms", "p99_latency_ms",
        "throughput_emb_per_sec", "throughput_per_user",
        "power_avg_w", "energy_joules", "emb_per_joule",
        "hardware", "latency_per_text_ms"
})
public record SummaryRecord(
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
        @JsonProperty("emb_per_joule") Double embPerJoule,
        @JsonProperty("hardware") String hardware,
        @JsonProperty("latency_per_text_ms") double latencyPerTextMs
) {

    /** model, hardware, chunk, batch, concurrency */
    public static final Comparator<SummaryRecord> ORDER = Comparator
            .comparing((SummaryRecord r) -> r.model() == null ? "" : r.model())
            .thenComparing(r -> r.hardware() == null ? "" : r.hardware())
            .thenComparingInt(SummaryRecord::chunkSize)
            .thenComparingInt(SummaryRecord::batchSize)
            .thenComparingInt(SummaryRecord::concurrency);

    public static SummaryRecord of(SweepResult r, String hardware, double latencyPerTextMs) {
        return new SummaryRecord(
                r.model(), r.chunkSize(), r.batchSize(), r.concurrency(), r.numRequests(),
                r.completedRequests(), r.elapsedSec(), r.p50LatencyMs(), r.p99LatencyMs(),
                r.throughputEmbPerSec(), r.throughputPerUser(),
                r.powerAvgW(), r.energyJoules(), r.embPerJoule(),
                hardware, latencyPerTextMs
        );
    }
}
