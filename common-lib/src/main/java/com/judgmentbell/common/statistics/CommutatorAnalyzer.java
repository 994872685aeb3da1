package com.judgmentbell.common.statistics;

import com.judgmentbell.common.model.SettingEstimate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Ordering variant: does asking one framework first change the answer to another?
 *
 * <p>For every target axis the baseline is its YES rate when asked first; for every other
 * context axis the comparison is the target's YES rate when asked right after the context.
 * Means and errors use {@link SampleStatistics}; an effect is significant when
 * |effect| / se &gt; {@link #T_THRESHOLD}. Results are ordered by |effect|, largest first.
 */
public final class CommutatorAnalyzer {

    static final double T_THRESHOLD = 2.0;

    private CommutatorAnalyzer() {}

    public static List<CommutatorEffect> analyze(List<OrderedObservation> observations) {
        Map<String, List<Double>> firstAsked = new TreeMap<>();
        Map<String, Map<String, List<Double>>> afterContext = new TreeMap<>();
        TreeSet<String> axes = new TreeSet<>();

        for (OrderedObservation o : observations) {
            axes.add(o.firstAxis());
            axes.add(o.secondAxis());
            firstAsked.computeIfAbsent(o.firstAxis(), k -> new ArrayList<>())
                .add(o.firstAnswer() ? 1.0 : 0.0);
            afterContext.computeIfAbsent(o.secondAxis(), k -> new TreeMap<>())
                .computeIfAbsent(o.firstAxis(), k -> new ArrayList<>())
                .add(o.secondAnswer() ? 1.0 : 0.0);
        }

        List<CommutatorEffect> effects = new ArrayList<>();
        for (String target : axes) {
            List<Double> baselineValues = firstAsked.get(target);
            if (baselineValues == null) continue;
            SettingEstimate baseline = SampleStatistics.estimate(baselineValues);

            for (String context : axes) {
                if (context.equals(target)) continue;
                List<Double> contextValues = afterContext.getOrDefault(target, Map.of()).get(context);
                if (contextValues == null) continue;

                SettingEstimate withContext = SampleStatistics.estimate(contextValues);
                double effect = withContext.mean() - baseline.mean();
                double se = SampleStatistics.quadrature(baseline.standardError(), withContext.standardError());
                double t = SampleStatistics.tStatistic(effect, se);

                effects.add(new CommutatorEffect(target, context, baseline.mean(), withContext.mean(),
                    effect, se, t, baseline.sampleCount(), withContext.sampleCount(), t > T_THRESHOLD));
            }
        }

        effects.sort(Comparator.comparingDouble((CommutatorEffect e) -> -Math.abs(e.effect()))
            .thenComparing(CommutatorEffect::target)
            .thenComparing(CommutatorEffect::context));
        return effects;
    }
}
