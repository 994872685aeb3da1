package com.judgmentbell.common.report;

import com.judgmentbell.common.aggregation.DropReason;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Plain-text rendering of reports for terminals and logs. */
public final class ReportRenderer {

    private static final String RULE = "=".repeat(78);

    private ReportRenderer() {}

    public static String render(ChshReport report) {
        StringBuilder out = new StringBuilder();
        out.append(RULE).append('\n');
        out.append("CHSH REPORT");
        if (report.source() != null) out.append("  source=").append(report.source());
        if (report.auditHash() != null) out.append("  audit=").append(report.auditHash());
        out.append('\n').append(RULE).append('\n');
        out.append(String.format(Locale.ROOT, "results=%d configurations=%d violations=%d threshold=%.1fσ%n",
            report.resultsSeen(), report.rows().size(), report.violations(), report.significanceThreshold()));

        for (Map.Entry<String, List<ChshSummaryRow>> partition : report.byCrossType().entrySet()) {
            out.append('\n').append("[").append(partition.getKey()).append("]\n");
            out.append(String.format(Locale.ROOT, "  %-48s %5s %7s %7s %7s  %s%n",
                "configuration", "n", "S", "se", "sigma", "violation"));
            for (ChshSummaryRow row : partition.getValue()) {
                out.append(String.format(Locale.ROOT, "  %-48s %5d %+7.3f %7s %7.2f  %s%n",
                    truncate(row.key().label(), 48), row.sampleCount(), row.s(),
                    number(row.standardError()), row.significance(), row.violation() ? "YES" : "no"));
            }
        }

        if (!report.flagged().isEmpty()) {
            out.append('\n').append("Flagged (significance > ")
               .append(String.format(Locale.ROOT, "%.1f", report.significanceThreshold())).append("):\n");
            for (ChshSummaryRow row : report.flagged()) {
                out.append(String.format(Locale.ROOT, "  %s  S=%+.3f  %.2fσ%n",
                    row.key().label(), row.s(), row.significance()));
            }
        }

        int dropped = 0;
        for (int c : report.drops().values()) dropped += c;
        if (dropped > 0) {
            out.append('\n').append("Dropped trials:\n");
            for (Map.Entry<DropReason, Integer> drop : report.drops().entrySet()) {
                if (drop.getValue() > 0) {
                    out.append(String.format(Locale.ROOT, "  %-18s %d%n", drop.getKey(), drop.getValue()));
                }
            }
        }
        return out.toString();
    }

    public static String render(SourceComparison comparison) {
        StringBuilder out = new StringBuilder();
        out.append(RULE).append('\n').append("CROSS-SOURCE COMPARISON\n").append(RULE).append('\n');
        out.append(String.format(Locale.ROOT, "  %-24s %-20s %8s %7s %7s%n",
            "scenario", "source", "mean S", "se", "maxσ"));
        for (SourceSummary s : comparison.summaries()) {
            out.append(String.format(Locale.ROOT, "  %-24s %-20s %+8.3f %7s %7.2f%n",
                truncate(s.scenarioId(), 24), truncate(s.source(), 20), s.meanS(),
                number(s.standardError()), s.maxSignificance()));
        }
        out.append('\n');
        for (ScenarioConsistency c : comparison.scenarios()) {
            out.append(String.format(Locale.ROOT, "  %-24s CV=%.3f  %s%n",
                truncate(c.scenarioId(), 24), c.variation(), c.consistent() ? "consistent" : "divergent"));
        }
        return out.toString();
    }

    static String number(double value) {
        return Double.isInfinite(value) ? "inf" : String.format(Locale.ROOT, "%.3f", value);
    }

    private static String truncate(String text, int width) {
        return text.length() <= width ? text : text.substring(0, width - 1) + "…";
    }
}
