package com.judgmentbell.common.statistics;

import com.judgmentbell.common.model.SettingEstimate;

import java.util.Collection;

/**
 * Mean and standard error of a sample, with explicit sentinels for thin data.
 *
 * <pre>
 *   n = 0   → mean 0.0, se +∞     (no information)
 *   n = 1   → mean x,   se 1.0    (maximum uncertainty)
 *   n ≥ 2   → se = sqrt(s² / n),  s² = Σ(x − mean)² / (n − 1)
 * </pre>
 */
public final class SampleStatistics {

    private SampleStatistics() {}

    public static SettingEstimate estimate(double[] values) {
        int n = values.length;
        if (n == 0) return SettingEstimate.EMPTY;

        double sum = 0.0;
        for (double v : values) sum += v;
        double mean = sum / n;
        if (n == 1) return new SettingEstimate(mean, 1.0, 1);

        double squares = 0.0;
        for (double v : values) squares += (v - mean) * (v - mean);
        double variance = squares / (n - 1);
        return new SettingEstimate(mean, Math.sqrt(variance / n), n);
    }

    public static SettingEstimate estimate(Collection<? extends Number> values) {
        double[] array = new double[values.size()];
        int i = 0;
        for (Number v : values) array[i++] = v.doubleValue();
        return estimate(array);
    }

    /** Quadrature sum sqrt(Σ se²); infinite if any input is infinite. */
    public static double quadrature(double... standardErrors) {
        double sum = 0.0;
        for (double se : standardErrors) sum += se * se;
        return Math.sqrt(sum);
    }

    /** |effect| / se, or 0 when se is not finite and positive. */
    public static double tStatistic(double effect, double standardError) {
        if (!Double.isFinite(standardError) || standardError <= 0.0) return 0.0;
        return Math.abs(effect) / standardError;
    }
}
