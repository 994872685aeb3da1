package com.judgmentbell.common.statistics;

import com.judgmentbell.common.model.SettingEstimate;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Timing variant: compares the interleaved condition with the classical midpoint.
 *
 * <pre>
 *   classical    = (mean_before + mean_after) / 2
 *   interference = mean_during − classical
 *   se_classical = sqrt(se_before² + se_after²) / 2
 *   se           = sqrt(se_during² + se_classical²)
 * </pre>
 * Groups are (scenario, axis); a group missing any timing is skipped.
 */
public final class InterferenceAnalyzer {

    static final double T_THRESHOLD = 2.0;
    static final double DETECTION_PERCENT = 10.0;

    private InterferenceAnalyzer() {}

    public static InterferenceReport analyze(List<TimedObservation> observations) {
        Map<String, Map<String, EnumMap<Timing, List<Double>>>> groups = new TreeMap<>();
        EnumMap<Timing, List<Double>> pooled = emptyTimings();

        for (TimedObservation o : observations) {
            groups.computeIfAbsent(o.scenarioId(), k -> new TreeMap<>())
                .computeIfAbsent(o.axis(), k -> emptyTimings())
                .get(o.timing()).add(o.answer() ? 1.0 : 0.0);
        }

        List<InterferenceEffect> effects = new ArrayList<>();
        boolean detected = false;
        for (Map.Entry<String, Map<String, EnumMap<Timing, List<Double>>>> scenario : groups.entrySet()) {
            for (Map.Entry<String, EnumMap<Timing, List<Double>>> axis : scenario.getValue().entrySet()) {
                EnumMap<Timing, List<Double>> timings = axis.getValue();
                if (!complete(timings)) continue;

                InterferenceEffect effect = effect(scenario.getKey(), axis.getKey(), timings);
                effects.add(effect);
                timings.forEach((timing, values) -> pooled.get(timing).addAll(values));
                if (effect.significant() && Math.abs(effect.interferencePercent()) > DETECTION_PERCENT) {
                    detected = true;
                }
            }
        }

        InterferenceEffect aggregate = complete(pooled) ? effect(null, null, pooled) : null;
        return new InterferenceReport(effects, aggregate, detected);
    }

    private static InterferenceEffect effect(String scenarioId, String axis, EnumMap<Timing, List<Double>> timings) {
        SettingEstimate before = SampleStatistics.estimate(timings.get(Timing.BEFORE));
        SettingEstimate during = SampleStatistics.estimate(timings.get(Timing.DURING));
        SettingEstimate after = SampleStatistics.estimate(timings.get(Timing.AFTER));

        double classical = (before.mean() + after.mean()) / 2.0;
        double interference = during.mean() - classical;
        double percent = classical != 0.0 ? interference / classical * 100.0 : 0.0;

        double seClassical = SampleStatistics.quadrature(before.standardError(), after.standardError()) / 2.0;
        double se = SampleStatistics.quadrature(during.standardError(), seClassical);
        double t = SampleStatistics.tStatistic(interference, se);
        int n = before.sampleCount() + during.sampleCount() + after.sampleCount();

        return new InterferenceEffect(scenarioId, axis, before.mean(), during.mean(), after.mean(),
            classical, interference, percent, se, t, n, t > T_THRESHOLD);
    }

    private static boolean complete(EnumMap<Timing, List<Double>> timings) {
        for (List<Double> values : timings.values()) {
            if (values.isEmpty()) return false;
        }
        return true;
    }

    private static EnumMap<Timing, List<Double>> emptyTimings() {
        EnumMap<Timing, List<Double>> timings = new EnumMap<>(Timing.class);
        for (Timing timing : Timing.values()) {
            timings.put(timing, new ArrayList<>());
        }
        return timings;
    }
}
