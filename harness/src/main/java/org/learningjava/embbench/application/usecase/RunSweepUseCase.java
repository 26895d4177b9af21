package org.learningjava.embbench.application.usecase;

import org.learningjava.embbench.application.port.ResultStorePort;
import org.learningjava.embbench.domain.model.SweepPlan;
import org.learningjava.embbench.domain.model.SweepPoint;
import org.learningjava.embbench.domain.model.SweepResult;
import org.learningjava.embbench.domain.service.sweep.SweepPointEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks chunk size × batch size × concurrency for one model and stores a result file per point.
 */
public class RunSweepUseCase {

    private static final Logger log = LoggerFactory.getLogger(RunSweepUseCase.class);

    private final SweepPointEvaluator evaluator;
    private final ResultStorePort store;

    public RunSweepUseCase(SweepPointEvaluator evaluator, ResultStorePort store) {
        this.evaluator = evaluator;
        this.store = store;
    }

    /**
     * @return results of the points actually measured in this run (skipped points are not included)
     */
    public List<SweepResult> run(SweepPlan plan) {
        log.info("Sweep {}: {} point(s), {} requests each, results in {}",
                plan.model(), plan.size(), plan.numRequests(), plan.resultDir());

        List<SweepResult> results = new ArrayList<>(plan.size());
        int skipped = 0;
        for (int chunkSize : plan.chunkSizes()) {
            for (int batchSize : plan.batchSizes()) {
                for (int concurrency : plan.concurrencies()) {
                    SweepPoint point = new SweepPoint(plan.model(), chunkSize, batchSize, concurrency, plan.numRequests());

                    Path existing = store.resultFile(plan.resultDir(), point);
                    if (!plan.force() && Files.exists(existing)) {
                        log.info("  chunk={} batch={} concurrency={} already done ({}), skipping",
                                chunkSize, batchSize, concurrency, existing.getFileName());
                        skipped++;
                        continue;
                    }

                    log.info("  chunk={} batch={} concurrency={} ...", chunkSize, batchSize, concurrency);
                    SweepResult result = evaluator.evaluate(point);
                    Path saved = store.save(plan.resultDir(), result);
                    log.info("    -> p50={}ms  p99={}ms  tput={} emb/s  completed={}/{}  saved {}",
                            result.p50LatencyMs(), result.p99LatencyMs(), result.throughputEmbPerSec(),
                            result.completedRequests(), result.numRequests(), saved.getFileName());
                    results.add(result);
                }
            }
        }

        log.info("Sweep {} finished: {} measured, {} skipped", plan.model(), results.size(), skipped);
        return results;
    }
}
