package org.learningjava.embbench.infrastructure.adapter.in.cli;

import org.learningjava.embbench.application.port.ServerReadinessPort;
import org.learningjava.embbench.application.usecase.AggregateResultsUseCase;
import org.learningjava.embbench.application.usecase.AggregationException;
import org.learningjava.embbench.application.usecase.RunSweepUseCase;
import org.learningjava.embbench.config.BenchProperties;
import org.learningjava.embbench.domain.model.SweepPlan;
import org.learningjava.embbench.domain.model.SweepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Entry point for both stages:
 * <pre>
 *   sweep --model=BAAI/bge-m3 --chunk-size=256 [--batch-sizes=1,4,16] [--concurrencies=1,4] ...
 *   aggregate [--results-dir=../results] [--hardware=h100] [--output=summary.json]
 * </pre>
 */
@Component
public class BenchCommandRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BenchCommandRunner.class);

    static final String DEFAULT_BATCH_SIZES = "1,4,16,64,256";
    static final String DEFAULT_CONCURRENCIES = "1,4,16,64";
    static final int DEFAULT_NUM_REQUESTS = 200;
    static final String DEFAULT_RESULTS_DIR = "../results";

    static final String USAGE = """
            Usage:
              sweep --model=<hf model> --chunk-size=<n[,n...]>
                    [--base-url=http://localhost:8000] [--batch-sizes=1,4,16,64,256]
                    [--concurrencies=1,4,16,64] [--num-requests=200] [--result-dir=../results]
                    [--force] [--wait-ready-seconds=0]
              aggregate [--results-dir=../results] [--hardware=<label>] [--output=<path>]
            """;

    private final RunSweepUseCase sweep;
    private final AggregateResultsUseCase aggregate;
    private final ServerReadinessPort readiness;
    private final MarkdownTableRenderer table;
    private final BenchProperties props;
    private final CliExitCode exitCode;
    private final PrintStream out;

    @Autowired
    public BenchCommandRunner(RunSweepUseCase sweep,
                              AggregateResultsUseCase aggregate,
                              ServerReadinessPort readiness,
                              MarkdownTableRenderer table,
                              BenchProperties props,
                              CliExitCode exitCode) {
        this(sweep, aggregate, readiness, table, props, exitCode, System.out);
    }

    BenchCommandRunner(RunSweepUseCase sweep,
                       AggregateResultsUseCase aggregate,
                       ServerReadinessPort readiness,
                       MarkdownTableRenderer table,
                       BenchProperties props,
                       CliExitCode exitCode,
                       PrintStream out) {
        this.sweep = sweep;
        this.aggregate = aggregate;
        this.readiness = readiness;
        this.table = table;
        this.props = props;
        this.exitCode = exitCode;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        if (commands.isEmpty()) {
            out.print(USAGE);
            exitCode.set(CliExitCode.USAGE);
            return;
        }

        CliOptions options = new CliOptions(args);
        try {
            int code = switch (commands.get(0)) {
                case "sweep" -> sweep(options);
                case "aggregate" -> aggregate(options);
                default -> {
                    out.println("Unknown command: " + commands.get(0));
                    out.print(USAGE);
                    yield CliExitCode.USAGE;
                }
            };
            exitCode.set(code);
        } catch (IllegalArgumentException e) {
            out.println("Error: " + e.getMessage());
            out.print(USAGE);
            exitCode.set(CliExitCode.USAGE);
        }
    }

    int sweep(CliOptions options) {
        SweepPlan plan = new SweepPlan(
                options.required("model"),
                options.intList("chunk-size", null),
                options.intList("batch-sizes", DEFAULT_BATCH_SIZES),
                options.intList("concurrencies", DEFAULT_CONCURRENCIES),
                options.integer("num-requests", DEFAULT_NUM_REQUESTS),
                Path.of(options.string("result-dir", DEFAULT_RESULTS_DIR)),
                options.flag("force")
        );
        int waitSeconds = options.integer("wait-ready-seconds", 0);
        if (waitSeconds > 0) {
            log.info("Waiting up to {}s for {}", waitSeconds, props.getBaseUrl());
            if (!readiness.awaitReady(Duration.ofSeconds(waitSeconds))) {
                out.println("Error: server at " + props.getBaseUrl() + " not ready after " + waitSeconds + "s");
                return CliExitCode.FAILURE;
            }
        }

        log.info("Model: {}  base URL: {}", plan.model(), props.getBaseUrl());
        List<SweepResult> results = sweep.run(plan);
        out.printf("Done. %d point(s) measured, results in %s%n", results.size(), plan.resultDir());
        return CliExitCode.OK;
    }

    int aggregate(CliOptions options) {
        Path resultsDir = Path.of(options.string("results-dir", DEFAULT_RESULTS_DIR));
        String hardware = options.string("hardware", null);
        String output = options.string("output", null);
        try {
            AggregateResultsUseCase.Report report =
                    aggregate.aggregate(resultsDir, hardware, output == null ? null : Path.of(output));
            out.printf("Wrote %d records to %s%n%n", report.records().size(), report.output());
            out.print(table.render(report.records()));
            return CliExitCode.OK;
        } catch (AggregationException e) {
            out.println(e.getMessage());
            return CliExitCode.FAILURE;
        }
    }
}
