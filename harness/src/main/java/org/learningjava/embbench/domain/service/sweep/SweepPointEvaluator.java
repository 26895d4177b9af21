package org.learningjava.embbench.domain.service.sweep;

import org.learningjava.embbench.application.port.EmbeddingClientFactory;
import org.learningjava.embbench.application.port.EmbeddingClientPort;
import org.learningjava.embbench.domain.model.DispatchOutcome;
import org.learningjava.embbench.domain.model.SweepPoint;
import org.learningjava.embbench.domain.model.SweepResult;
import org.learningjava.embbench.domain.service.dispatch.BoundedDispatcher;
import org.learningjava.embbench.domain.service.power.PowerSampler;
import org.learningjava.embbench.domain.service.power.SamplingWindow;
import org.learningjava.embbench.domain.service.stats.LatencyStatistics;
import org.learningjava.embbench.domain.service.text.SyntheticTextGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.OptionalDouble;
import java.util.function.LongSupplier;

import static org.learningjava.embbench.domain.service.stats.LatencyStatistics.round;

/**
 * Measures one sweep point: payloads are generated up front, then the power sampler and the
 * wall clock bracket the dispatch of all requests.
 */
public class SweepPointEvaluator {

    private static final Logger log = LoggerFactory.getLogger(SweepPointEvaluator.class);
    private static final double NANOS_PER_SEC = 1_000_000_000.0;

    private final SyntheticTextGenerator texts;
    private final EmbeddingClientFactory clients;
    private final BoundedDispatcher dispatcher;
    private final PowerSampler sampler;
    private final LongSupplier nanoClock;

    public SweepPointEvaluator(SyntheticTextGenerator texts,
                               EmbeddingClientFactory clients,
                               BoundedDispatcher dispatcher,
                               PowerSampler sampler) {
        this(texts, clients, dispatcher, sampler, System::nanoTime);
    }

    public SweepPointEvaluator(SyntheticTextGenerator texts,
                               EmbeddingClientFactory clients,
                               BoundedDispatcher dispatcher,
                               PowerSampler sampler,
                               LongSupplier nanoClock) {
        this.texts = texts;
        this.clients = clients;
        this.dispatcher = dispatcher;
        this.sampler = sampler;
        this.nanoClock = nanoClock;
    }

    public SweepResult evaluate(SweepPoint point) {
        List<List<String>> batches = texts.batches(point.numRequests(), point.batchSize(), point.chunkSize());

        DispatchOutcome outcome;
        long elapsedNanos;
        OptionalDouble power;
        try (EmbeddingClientPort client = clients.open(point.concurrency())) {
            SamplingWindow window = sampler.start();
            long start = nanoClock.getAsLong();
            try {
                outcome = dispatcher.dispatch(batches, point.concurrency(),
                        batch -> client.embed(point.model(), batch));
            } finally {
                elapsedNanos = nanoClock.getAsLong() - start;
                power = window.stop();
            }
        }

        log.debug("Dispatched {} requests in {} ns ({} failed)",
                point.numRequests(), elapsedNanos, outcome.failedRequests());
        return toResult(point, outcome, elapsedNanos / NANOS_PER_SEC, power);
    }

    static SweepResult toResult(SweepPoint point, DispatchOutcome outcome, double elapsedSec, OptionalDouble power) {
        LatencyStatistics latency = LatencyStatistics.of(outcome.latenciesMs());
        int completed = latency.count();
        long embeddings = (long) completed * point.batchSize();

        double throughput = elapsedSec > 0 ? embeddings / elapsedSec : 0.0;
        double perUser = point.concurrency() > 0 ? throughput / point.concurrency() : 0.0;

        Double powerAvg = null;
        Double energy = null;
        Double efficiency = null;
        if (power.isPresent()) {
            powerAvg = power.getAsDouble();
            energy = powerAvg * elapsedSec;
            efficiency = energy > 0 ? embeddings / energy : null;
        }

        return new SweepResult(
                point.model(),
                point.chunkSize(),
                point.batchSize(),
                point.concurrency(),
                point.numRequests(),
                completed,
                round(elapsedSec, 3),
                round(latency.p50(), 2),
                round(latency.p99(), 2),
                round(throughput, 2),
                round(perUser, 2),
                round(powerAvg, 2),
                round(energy, 2),
                round(efficiency, 4)
        );
    }
}
