package org.learningjava.embbench.application.port;

import org.learningjava.embbench.domain.model.SummaryRecord;
import org.learningjava.embbench.domain.model.SweepPoint;
import org.learningjava.embbench.domain.model.SweepResult;

import java.nio.file.Path;
import java.util.List;

public interface ResultStorePort {

    // Sweep side
    Path resultFile(Path resultDir, SweepPoint point);

    Path save(Path resultDir, SweepResult result);

    // Aggregation side
    List<StoredResult> loadAll(Path resultsDir);

    void writeSummary(Path output, List<SummaryRecord> records);

    /** A parsed result file together with where it was found. */
    record StoredResult(Path source, SweepResult result) { }
}
