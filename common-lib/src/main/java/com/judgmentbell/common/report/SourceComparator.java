package com.judgmentbell.common.report;

import com.judgmentbell.common.model.ChshResult;
import com.judgmentbell.common.statistics.SampleStatistics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Compares CHSH results of the same scenarios judged by different sources.
 *
 * <p>Only non-cross (mono) configurations enter the per-scenario average, so each source is
 * compared on its own judgments. Consistency is CV = (max − min) / |mean| over the
 * per-source averages, below {@link #DEFAULT_CONSISTENCY_THRESHOLD} by convention.
 */
public class SourceComparator {

    public static final double DEFAULT_CONSISTENCY_THRESHOLD = 0.25;

    private final double consistencyThreshold;

    public SourceComparator() {
        this(DEFAULT_CONSISTENCY_THRESHOLD);
    }

    public SourceComparator(double consistencyThreshold) {
        this.consistencyThreshold = consistencyThreshold;
    }

    /**
     * @param bySource source label → that source's results
     */
    public SourceComparison compare(Map<String, List<ChshResult>> bySource) {
        List<SourceSummary> summaries = new ArrayList<>();
        Map<String, Map<String, Double>> meanByScenario = new TreeMap<>();

        for (Map.Entry<String, List<ChshResult>> source : bySource.entrySet()) {
            Map<String, List<ChshResult>> perScenario = new TreeMap<>();
            for (ChshResult r : source.getValue()) {
                if (r.key().crossType().isCross()) continue;
                perScenario.computeIfAbsent(r.key().scenarioId(), k -> new ArrayList<>()).add(r);
            }

            perScenario.forEach((scenario, results) -> {
                SourceSummary summary = summarize(source.getKey(), scenario, results);
                summaries.add(summary);
                meanByScenario.computeIfAbsent(scenario, k -> new LinkedHashMap<>())
                    .put(source.getKey(), summary.meanS());
            });
        }

        List<ScenarioConsistency> scenarios = new ArrayList<>();
        meanByScenario.forEach((scenario, means) -> {
            if (means.size() < 2) return;
            scenarios.add(consistency(scenario, means));
        });

        return new SourceComparison(consistencyThreshold, summaries, scenarios);
    }

    private static SourceSummary summarize(String source, String scenario, List<ChshResult> results) {
        double sumS = 0.0;
        double[] errors = new double[results.size()];
        double maxSignificance = 0.0;
        int violations = 0;
        for (int i = 0; i < results.size(); i++) {
            ChshResult r = results.get(i);
            sumS += r.s();
            errors[i] = r.standardError();
            maxSignificance = Math.max(maxSignificance, r.significance());
            if (r.violation()) violations++;
        }
        int n = results.size();
        return new SourceSummary(source, scenario, sumS / n,
            SampleStatistics.quadrature(errors) / n, maxSignificance, violations, n);
    }

    ScenarioConsistency consistency(String scenario, Map<String, Double> means) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0.0;
        for (double s : means.values()) {
            min = Math.min(min, s);
            max = Math.max(max, s);
            sum += s;
        }
        double mean = sum / means.size();
        // signed: a negative mean gives a negative CV, which always passes the threshold
        double cv = mean != 0.0 ? (max - min) / mean : 0.0;
        return new ScenarioConsistency(scenario, means, mean, cv, cv < consistencyThreshold);
    }
}
