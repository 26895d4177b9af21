package org.learningjava.embbench.infrastructure.adapter.in.cli;

import org.learningjava.embbench.domain.model.SummaryRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders the aggregated summary as a padded markdown table.
 */
@Component
public class MarkdownTableRenderer {

    private static final List<String> HEADERS = List.of(
            "Model", "Hardware", "Chunk", "Batch", "Conc",
            "p50 (ms)", "p99 (ms)", "Tput (emb/s)", "Tput/User", "Power (W)", "Emb/Joule");

    public String render(List<SummaryRecord> records) {
        List<List<String>> rows = new ArrayList<>(records.size());
        for (SummaryRecord r : records) {
            rows.add(List.of(
                    shortModel(r.model()),
                    r.hardware() == null ? "" : r.hardware(),
                    String.valueOf(r.chunkSize()),
                    String.valueOf(r.batchSize()),
                    String.valueOf(r.concurrency()),
                    fmt(r.p50LatencyMs(), 1),
                    fmt(r.p99LatencyMs(), 1),
                    fmt(r.throughputEmbPerSec(), 1),
                    fmt(r.throughputPerUser(), 1),
                    r.powerAvgW() == null ? "-" : fmt(r.powerAvgW(), 1),
                    r.embPerJoule() == null ? "-" : fmt(r.embPerJoule(), 2)
            ));
        }

        int[] widths = new int[HEADERS.size()];
        for (int i = 0; i < widths.length; i++) widths[i] = HEADERS.get(i).length();
        for (List<String> row : rows) {
            for (int i = 0; i < row.size(); i++) widths[i] = Math.max(widths[i], row.get(i).length());
        }

        StringBuilder sb = new StringBuilder();
        sb.append(line(HEADERS, widths)).append('\n');
        sb.append(separator(widths)).append('\n');
        for (List<String> row : rows) sb.append(line(row, widths)).append('\n');
        return sb.toString();
    }

    static String shortModel(String model) {
        if (model == null) return "";
        int slash = model.lastIndexOf('/');
        return slash >= 0 ? model.substring(slash + 1) : model;
    }

    private static String fmt(double v, int places) {
        return String.format(Locale.ROOT, "%." + places + "f", v);
    }

    private static String line(List<String> cells, int[] widths) {
        StringBuilder sb = new StringBuilder("|");
        for (int i = 0; i < cells.size(); i++) {
            sb.append(' ').append(pad(cells.get(i), widths[i])).append(" |");
        }
        return sb.toString();
    }

    private static String separator(int[] widths) {
        StringBuilder sb = new StringBuilder("|");
        for (int w : widths) sb.append('-').append("-".repeat(w)).append("-|");
        return sb.toString();
    }

    private static String pad(String s, int width) {
        return s + " ".repeat(width - s.length());
    }
}
