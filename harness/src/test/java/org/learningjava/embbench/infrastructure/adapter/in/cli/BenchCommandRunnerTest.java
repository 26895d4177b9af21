package org.learningjava.embbench.infrastructure.adapter.in.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.embbench.application.port.ServerReadinessPort;
import org.learningjava.embbench.application.usecase.AggregateResultsUseCase;
import org.learningjava.embbench.application.usecase.AggregationException;
import org.learningjava.embbench.application.usecase.RunSweepUseCase;
import org.learningjava.embbench.config.BenchProperties;
import org.learningjava.embbench.domain.model.SummaryRecord;
import org.learningjava.embbench.domain.model.SweepPlan;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class BenchCommandRunnerTest {

    private RunSweepUseCase sweep;
    private AggregateResultsUseCase aggregate;
    private ServerReadinessPort readiness;
    private CliExitCode exitCode;
    private ByteArrayOutputStream buffer;
    private BenchCommandRunner runner;

    @BeforeEach
    void setUp() {
        sweep = mock(RunSweepUseCase.class);
        aggregate = mock(AggregateResultsUseCase.class);
        readiness = mock(ServerReadinessPort.class);
        exitCode = new CliExitCode();
        buffer = new ByteArrayOutputStream();
        runner = new BenchCommandRunner(sweep, aggregate, readiness, new MarkdownTableRenderer(),
                new BenchProperties(), exitCode, new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private void run(String... args) {
        runner.run(new DefaultApplicationArguments(args));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void noCommand_printsUsage() {
        run();

        assertEquals(CliExitCode.USAGE, exitCode.getExitCode());
        assertTrue(output().contains("Usage:"));
    }

    @Test
    void unknownCommand_isUsageError() {
        run("bench");

        assertEquals(CliExitCode.USAGE, exitCode.getExitCode());
        assertTrue(output().contains("Unknown command: bench"));
    }

    @Test
    void sweep_parsesOptions_intoPlan() {
        // Arrange
        when(sweep.run(any())).thenReturn(List.of());

        // Act
        run("sweep", "--model=BAAI/bge-m3", "--chunk-size=256,512", "--batch-sizes=1,8",
                "--concurrencies=2", "--num-requests=50", "--result-dir=/tmp/res", "--force");

        // Assert
        ArgumentCaptor<SweepPlan> cap = ArgumentCaptor.forClass(SweepPlan.class);
        verify(sweep).run(cap.capture());
        SweepPlan plan = cap.getValue();
        assertEquals("BAAI/bge-m3", plan.model());
        assertEquals(List.of(256, 512), plan.chunkSizes());
        assertEquals(List.of(1, 8), plan.batchSizes());
        assertEquals(List.of(2), plan.concurrencies());
        assertEquals(50, plan.numRequests());
        assertEquals(Path.of("/tmp/res"), plan.resultDir());
        assertTrue(plan.force());
        assertEquals(CliExitCode.OK, exitCode.getExitCode());
        verifyNoInteractions(readiness);
    }

    @Test
    void sweep_defaults() {
        when(sweep.run(any())).thenReturn(List.of());

        run("sweep", "--model=m", "--chunk-size=128");

        ArgumentCaptor<SweepPlan> cap = ArgumentCaptor.forClass(SweepPlan.class);
        verify(sweep).run(cap.capture());
        SweepPlan plan = cap.getValue();
        assertEquals(List.of(1, 4, 16, 64, 256), plan.batchSizes());
        assertEquals(List.of(1, 4, 16, 64), plan.concurrencies());
        assertEquals(200, plan.numRequests());
        assertFalse(plan.force());
    }

    @Test
    void sweep_withoutModel_isUsageError() {
        run("sweep", "--chunk-size=256");

        assertEquals(CliExitCode.USAGE, exitCode.getExitCode());
        assertTrue(output().contains("--model is required"));
        verifyNoInteractions(sweep);
    }

    @Test
    void sweep_withBadIntegerList_isUsageError() {
        run("sweep", "--model=m", "--chunk-size=256", "--concurrencies=1,x");

        assertEquals(CliExitCode.USAGE, exitCode.getExitCode());
        verifyNoInteractions(sweep);
    }

    @Test
    void sweep_withZeroConcurrency_isUsageError() {
        run("sweep", "--model=m", "--chunk-size=256", "--concurrencies=0");

        assertEquals(CliExitCode.USAGE, exitCode.getExitCode());
        verifyNoInteractions(sweep);
    }

    @Test
    void sweep_serverNeverReady_failsWithoutMeasuring() {
        when(readiness.awaitReady(Duration.ofSeconds(3))).thenReturn(false);

        run("sweep", "--model=m", "--chunk-size=256", "--wait-ready-seconds=3");

        assertEquals(CliExitCode.FAILURE, exitCode.getExitCode());
        verifyNoInteractions(sweep);
    }

    @Test
    void aggregate_printsCountAndTable() {
        // Arrange
        SummaryRecord rec = new SummaryRecord("BAAI/bge-m3", 256, 1, 1, 10, 10, 1.0, 5.0, 9.0, 10.0, 10.0,
                null, null, null, "h100", 9.0);
        when(aggregate.aggregate(Path.of("res"), "h100", null))
                .thenReturn(new AggregateResultsUseCase.Report(Path.of("res", "summary.json"), List.of(rec)));

        // Act
        run("aggregate", "--results-dir=res", "--hardware=h100");

        // Assert
        assertEquals(CliExitCode.OK, exitCode.getExitCode());
        assertTrue(output().contains("Wrote 1 records to"));
        assertTrue(output().contains("| bge-m3"));
    }

    @Test
    void aggregate_failure_exitsWithOne() {
        when(aggregate.aggregate(any(), isNull(), isNull()))
                .thenThrow(new AggregationException("No result JSON files found."));

        run("aggregate");

        assertEquals(CliExitCode.FAILURE, exitCode.getExitCode());
        assertTrue(output().contains("No result JSON files found."));
    }
}
