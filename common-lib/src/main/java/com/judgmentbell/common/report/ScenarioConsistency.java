package com.judgmentbell.common.report;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Cross-source agreement on one scenario.
 *
 * @param meanSBySource per-source average S over non-cross configurations
 * @param variation     (max − min) / |mean| across sources, 0 when the mean is 0
 */
public record ScenarioConsistency(
    @JsonProperty("scenario")   String scenarioId,
    @JsonProperty("bySource")   Map<String, Double> meanSBySource,
    @JsonProperty("mean")       double mean,
    @JsonProperty("cv")         double variation,
    @JsonProperty("consistent") boolean consistent
) {
}
