package com.judgmentbell.common.report;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One source's view of one scenario, over its non-cross configurations.
 *
 * @param standardError sqrt(Σ se²) / count
 */
public record SourceSummary(
    @JsonProperty("source")          String source,
    @JsonProperty("scenario")        String scenarioId,
    @JsonProperty("meanS")           double meanS,
    @JsonProperty("se")              double standardError,
    @JsonProperty("maxSignificance") double maxSignificance,
    @JsonProperty("violations")      int violations,
    @JsonProperty("configurations")  int configurations
) {
}
