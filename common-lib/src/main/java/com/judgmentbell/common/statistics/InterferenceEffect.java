package com.judgmentbell.common.statistics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Deviation of the interleaved ({@code during}) condition from the midpoint of the two
 * boundary conditions.
 *
 * @param scenarioId {@code null} for the aggregate over all groups
 * @param axis       {@code null} for the aggregate over all groups
 */
public record InterferenceEffect(
    @JsonProperty("scenario")      String scenarioId,
    @JsonProperty("axis")          String axis,
    @JsonProperty("before")        double meanBefore,
    @JsonProperty("during")        double meanDuring,
    @JsonProperty("after")         double meanAfter,
    @JsonProperty("classical")     double classicalExpectation,
    @JsonProperty("interference")  double interference,
    @JsonProperty("percent")       double interferencePercent,
    @JsonProperty("standardError") double standardError,
    @JsonProperty("t")             double tStatistic,
    @JsonProperty("n")             int sampleCount,
    @JsonProperty("significant")   boolean significant
) {
}
