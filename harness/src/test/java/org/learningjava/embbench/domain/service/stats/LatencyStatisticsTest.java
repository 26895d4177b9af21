package org.learningjava.embbench.domain.service.stats;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LatencyStatisticsTest {

    @Test
    void empty_sampleGivesZeroPercentiles() {
        LatencyStatistics s = LatencyStatistics.of(List.of());

        assertEquals(0, s.count());
        assertEquals(0.0, s.p50());
        assertEquals(0.0, s.p99());
    }

    @Test
    void singleSample_isClampedInsteadOfWrapping() {
        LatencyStatistics s = LatencyStatistics.of(List.of(12.5));

        // floor(1 * 0.99) - 1 == -1 -> clamped to index 0
        assertEquals(12.5, s.p99());
        assertEquals(12.5, s.p50());
    }

    @Test
    void percentiles_useFloorMinusOneOnSortedSample() {
        List<Double> latencies = new ArrayList<>();
        for (int i = 100; i >= 1; i--) latencies.add((double) i);

        LatencyStatistics s = LatencyStatistics.of(latencies);

        assertEquals(50.0, s.p50());  // index 49
        assertEquals(99.0, s.p99());  // index 98
    }

    @Test
    void of_doesNotMutateInput() {
        List<Double> input = new ArrayList<>(List.of(3.0, 1.0, 2.0));

        LatencyStatistics.of(input);

        assertEquals(List.of(3.0, 1.0, 2.0), input);
    }

    @Test
    void round_usesHalfUp() {
        assertEquals(1.24, LatencyStatistics.round(1.235, 2));
        assertEquals(0.123, LatencyStatistics.round(0.12345, 3));
        assertNull(LatencyStatistics.round((Double) null, 2));
    }
}
