package org.learningjava.embbench.domain.service.stats;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class LatencyStatistics {

    private final List<Double> sorted;

    private LatencyStatistics(List<Double> sorted) {
        this.sorted = sorted;
    }

    public static LatencyStatistics of(List<Double> latenciesMs) {
        List<Double> copy = new ArrayList<>(latenciesMs);
        Collections.sort(copy);
        return new LatencyStatistics(copy);
    }

    public int count() { return sorted.size(); }

    public double p50() { return percentile(0.50); }

    public double p99() { return percentile(0.99); }

    /**
     * Nearest-rank style lookup at {@code floor(fraction * n) - 1}, clamped into the list so
     * small samples (n=1 for p99) pick the first element instead of wrapping around.
     * Returns 0 for an empty sample.
     */
    public double percentile(double fraction) {
        int n = sorted.size();
        if (n == 0) return 0.0;
        int idx = (int) Math.floor(n * fraction) - 1;
        idx = Math.max(0, Math.min(n - 1, idx));
        return sorted.get(idx);
    }

    public static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return value;
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }

    public static Double round(Double value, int places) {
        return value == null ? null : round(value.doubleValue(), places);
    }
}
