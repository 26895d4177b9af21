package org.learningjava.embbench.infrastructure.adapter.out.fs;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.learningjava.embbench.application.port.ResultStorePort;
import org.learningjava.embbench.domain.model.SummaryRecord;
import org.learningjava.embbench.domain.model.SweepPoint;
import org.learningjava.embbench.domain.model.SweepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One pretty-printed JSON file per sweep point, named
 * {@code <model_slug>__chunk<c>__bs<b>__conc<n>.json}.
 */
public class JsonFileResultStore implements ResultStorePort {

    private static final Logger log = LoggerFactory.getLogger(JsonFileResultStore.class);

    public static final String SUMMARY_FILE = "summary.json";

    private final ObjectMapper om;
    private final ObjectWriter writer;

    public JsonFileResultStore(ObjectMapper om) {
        this.om = om;
        this.writer = om.writerWithDefaultPrettyPrinter();
    }

    public static String modelSlug(String model) {
        return model.replace("/", "_");
    }

    @Override
    public Path resultFile(Path resultDir, SweepPoint point) {
        String name = modelSlug(point.model())
                + "__chunk" + point.chunkSize()
                + "__bs" + point.batchSize()
                + "__conc" + point.concurrency()
                + ".json";
        return resultDir.resolve(name);
    }

    @Override
    public Path save(Path resultDir, SweepResult result) {
        Path out = resultFile(resultDir, result.point());
        try {
            Files.createDirectories(resultDir);
            writer.writeValue(out.toFile(), result);
            return out;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write result " + out, e);
        }
    }

    @Override
    public List<StoredResult> loadAll(Path resultsDir) {
        List<Path> files;
        try (var s = Files.walk(resultsDir)) {
            files = s.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .filter(p -> !SUMMARY_FILE.equals(p.getFileName().toString()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list " + resultsDir, e);
        }

        List<StoredResult> out = new ArrayList<>(files.size());
        for (Path f : files) {
            try {
                SweepResult r = om.readValue(f.toFile(), SweepResult.class);
                if (r == null || r.model() == null) {
                    log.warn("Warning: skipping {}: not a sweep result", f);
                    continue;
                }
                out.add(new StoredResult(f, r));
            } catch (IOException e) {
                log.warn("Warning: skipping {}: {}", f, e.getMessage());
            }
        }
        log.debug("Loaded {} of {} result files under {}", out.size(), files.size(), resultsDir);
        return out;
    }

    @Override
    public void writeSummary(Path output, List<SummaryRecord> records) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            writer.writeValue(output.toFile(), records);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write summary " + output, e);
        }
    }
}
