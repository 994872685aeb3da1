package com.judgmentbell.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Expectation value of one measurement setting.
 *
 * <p>An empty setting is {@code mean = 0.0, standardError = +∞, sampleCount = 0}.
 */
public record SettingEstimate(
    @JsonProperty("mean")          double mean,
    @JsonProperty("standardError") double standardError,
    @JsonProperty("n")             int sampleCount
) {
    public static final SettingEstimate EMPTY = new SettingEstimate(0.0, Double.POSITIVE_INFINITY, 0);

    public boolean hasData() {
        return sampleCount > 0;
    }
}
