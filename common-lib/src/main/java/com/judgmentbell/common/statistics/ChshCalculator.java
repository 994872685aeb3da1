package com.judgmentbell.common.statistics;

import com.judgmentbell.common.aggregation.CorrelationTable;
import com.judgmentbell.common.model.ChshResult;
import com.judgmentbell.common.model.ConfigurationKey;
import com.judgmentbell.common.model.CorrelationSample;
import com.judgmentbell.common.model.MeasurementSetting;
import com.judgmentbell.common.model.SettingEstimate;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * CHSH statistic with error propagation.
 *
 * <h3>Statistic</h3>
 * <pre>
 *   S   = E(pp) − E(ps) + E(sp) + E(ss)
 *   se  = sqrt(se_pp² + se_ps² + se_sp² + se_ss²)
 *   violation    = |S| &gt; 2
 *   significance = (|S| − 2) / se   when violation and se finite and positive, else 0
 * </pre>
 *
 * <p>A setting without samples contributes E = 0 and se = +∞, so the configuration
 * reports no significance rather than failing.
 *
 * <p>Pure and stateless: identical input yields identical results.
 */
public final class ChshCalculator {

    /** Upper bound of |S| for any local (classical) assignment of verdicts. */
    public static final double CLASSICAL_BOUND = 2.0;

    private ChshCalculator() {}

    public static List<ChshResult> compute(CorrelationTable table) {
        List<ChshResult> results = new ArrayList<>(table.size());
        for (ConfigurationKey key : table.configurations()) {
            results.add(compute(key, table.row(key)));
        }
        return results;
    }

    public static ChshResult compute(ConfigurationKey key, Map<MeasurementSetting, List<CorrelationSample>> row) {
        EnumMap<MeasurementSetting, SettingEstimate> estimates = new EnumMap<>(MeasurementSetting.class);
        double s = 0.0;
        double[] errors = new double[MeasurementSetting.values().length];
        int sampleCount = 0;

        for (MeasurementSetting setting : MeasurementSetting.values()) {
            List<CorrelationSample> samples = row.getOrDefault(setting, List.of());
            double[] products = new double[samples.size()];
            for (int i = 0; i < products.length; i++) {
                products[i] = samples.get(i).product();
            }

            SettingEstimate estimate = SampleStatistics.estimate(products);
            estimates.put(setting, estimate);
            s += setting.chshSign() * estimate.mean();
            errors[setting.ordinal()] = estimate.standardError();
            sampleCount += estimate.sampleCount();
        }

        double standardError = SampleStatistics.quadrature(errors);
        boolean violation = Math.abs(s) > CLASSICAL_BOUND;
        double significance = significance(s, standardError);

        return new ChshResult(key, estimates, s, standardError, violation, significance, sampleCount);
    }

    /** (|S| − 2) / se when |S| exceeds the bound and se is finite and positive; 0 otherwise. */
    public static double significance(double s, double standardError) {
        if (Math.abs(s) <= CLASSICAL_BOUND) return 0.0;
        if (!Double.isFinite(standardError) || standardError <= 0.0) return 0.0;
        return (Math.abs(s) - CLASSICAL_BOUND) / standardError;
    }
}
