package org.learningjava.embbench.application.usecase;

import org.learningjava.embbench.application.port.ResultStorePort;
import org.learningjava.embbench.application.port.ResultStorePort.StoredResult;
import org.learningjava.embbench.domain.model.SummaryRecord;
import org.learningjava.embbench.domain.model.SweepResult;
import org.learningjava.embbench.domain.service.stats.LatencyStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Collects every result file below a directory, tags each with its hardware and writes one
 * sorted summary.
 */
public class AggregateResultsUseCase {

    private static final Logger log = LoggerFactory.getLogger(AggregateResultsUseCase.class);

    static final String UNKNOWN_HARDWARE = "unknown";

    private final ResultStorePort store;

    public AggregateResultsUseCase(ResultStorePort store) {
        this.store = store;
    }

    public record Report(Path output, List<SummaryRecord> records) { }

    /**
     * @param hardwareOverride label applied to every record; null to infer it from directory names
     * @param output           summary path; null for {@code <resultsDir>/summary.json}
     */
    public Report aggregate(Path resultsDir, String hardwareOverride, Path output) {
        if (!Files.isDirectory(resultsDir)) {
            throw new AggregationException("Error: results directory not found: " + resultsDir);
        }

        List<SummaryRecord> records = store.loadAll(resultsDir).stream()
                .map(s -> toSummary(s, hardwareOverride))
                .sorted(SummaryRecord.ORDER)
                .toList();
        if (records.isEmpty()) {
            throw new AggregationException("No result JSON files found.");
        }

        Path out = output != null ? output : resultsDir.resolve("summary.json");
        store.writeSummary(out, records);
        log.info("Wrote {} records to {}", records.size(), out);
        return new Report(out, records);
    }

    static SummaryRecord toSummary(StoredResult stored, String hardwareOverride) {
        SweepResult r = stored.result();
        String hardware = hardwareOverride != null ? hardwareOverride : inferHardware(stored.source());
        double perText = r.batchSize() != 0
                ? LatencyStatistics.round(r.p99LatencyMs() / r.batchSize(), 3)
                : 0.0;
        return SummaryRecord.of(r, hardware, perText);
    }

    /** {@code results/BAAI_bge-m3__h100/x.json -> h100}; the part after the first "__" of the parent dir. */
    static String inferHardware(Path file) {
        Path parent = file.getParent();
        if (parent == null || parent.getFileName() == null) return UNKNOWN_HARDWARE;
        String dir = parent.getFileName().toString();
        int sep = dir.indexOf("__");
        return sep >= 0 ? dir.substring(sep + 2) : UNKNOWN_HARDWARE;
    }
}
