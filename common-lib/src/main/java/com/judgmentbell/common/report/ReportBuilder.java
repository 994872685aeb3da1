package com.judgmentbell.common.report;

import com.judgmentbell.common.aggregation.AggregationOutcome;
import com.judgmentbell.common.model.ChshResult;
import com.judgmentbell.common.model.ConfigurationKey;
import com.judgmentbell.common.model.CrossType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partitions, ranks and flags CHSH results. Derivational only: no new statistics.
 */
public class ReportBuilder {

    /** Conventional 3σ flagging threshold. */
    public static final double DEFAULT_SIGNIFICANCE_THRESHOLD = 3.0;

    static final Comparator<ChshResult> RANKING = Comparator
        .comparingDouble((ChshResult r) -> -r.significance())
        .thenComparingDouble(r -> -r.absS())
        .thenComparing(ChshResult::key, ConfigurationKey.ORDER);

    private final double significanceThreshold;

    public ReportBuilder() {
        this(DEFAULT_SIGNIFICANCE_THRESHOLD);
    }

    public ReportBuilder(double significanceThreshold) {
        this.significanceThreshold = significanceThreshold;
    }

    public double significanceThreshold() {
        return significanceThreshold;
    }

    public ChshReport build(List<ChshResult> results, AggregationOutcome outcome, String source, String auditHash) {
        List<ChshResult> ranked = rank(results);

        Map<String, List<ChshSummaryRow>> byCrossType = new LinkedHashMap<>();
        partitionByCrossType(results).forEach((type, group) ->
            byCrossType.put(type.tag(), rows(group)));

        List<ChshSummaryRow> flagged = rows(flagged(ranked));
        int violations = (int) results.stream().filter(ChshResult::violation).count();

        return new ChshReport(source, auditHash, significanceThreshold,
            outcome == null ? 0 : outcome.resultsSeen(),
            violations, rows(ranked), byCrossType, flagged,
            outcome == null ? Map.of() : outcome.drops().asMap());
    }

    public static List<ChshResult> rank(List<ChshResult> results) {
        List<ChshResult> ranked = new ArrayList<>(results);
        ranked.sort(RANKING);
        return ranked;
    }

    /** Cross-types in declaration order, each partition ranked. Empty partitions are omitted. */
    public static Map<CrossType, List<ChshResult>> partitionByCrossType(List<ChshResult> results) {
        Map<CrossType, List<ChshResult>> partitions = new EnumMap<>(CrossType.class);
        for (ChshResult r : results) {
            partitions.computeIfAbsent(r.key().crossType(), k -> new ArrayList<>()).add(r);
        }
        partitions.replaceAll((type, group) -> rank(group));
        return partitions;
    }

    /** Source label → ranked results; a missing source is grouped under {@code "default"}. */
    public static Map<String, List<ChshResult>> partitionBySource(List<ChshResult> results) {
        Map<String, List<ChshResult>> partitions = new LinkedHashMap<>();
        for (ChshResult r : rank(results)) {
            String source = r.key().source() == null ? "default" : r.key().source();
            partitions.computeIfAbsent(source, k -> new ArrayList<>()).add(r);
        }
        return partitions;
    }

    public List<ChshResult> flagged(List<ChshResult> results) {
        List<ChshResult> flagged = new ArrayList<>();
        for (ChshResult r : rank(results)) {
            if (r.significance() > significanceThreshold) flagged.add(r);
        }
        return flagged;
    }

    private static List<ChshSummaryRow> rows(List<ChshResult> results) {
        List<ChshSummaryRow> rows = new ArrayList<>(results.size());
        for (ChshResult r : results) rows.add(ChshSummaryRow.from(r));
        return rows;
    }
}
