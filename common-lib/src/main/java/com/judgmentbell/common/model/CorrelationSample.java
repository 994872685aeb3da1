package com.judgmentbell.common.model;

/**
 * Product of two matched per-party verdicts for one configuration, setting and trial.
 *
 * @param product always −1 or +1
 */
public record CorrelationSample(
    ConfigurationKey key,
    MeasurementSetting setting,
    int trialIndex,
    int product
) {
    public CorrelationSample {
        if (product != 1 && product != -1) {
            throw new IllegalArgumentException("product must be ±1: " + product);
        }
    }

    public static CorrelationSample of(ConfigurationKey key, MeasurementSetting setting,
                                       int trialIndex, Verdict alpha, Verdict beta) {
        return new CorrelationSample(key, setting, trialIndex, alpha.sign() * beta.sign());
    }
}
