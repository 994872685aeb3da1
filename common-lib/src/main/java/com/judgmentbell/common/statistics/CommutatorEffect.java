package com.judgmentbell.common.statistics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Order effect of asking {@code context} before {@code target}.
 *
 * @param effect P(YES to target | context asked first) − P(YES to target | target asked first)
 */
public record CommutatorEffect(
    @JsonProperty("target")       String target,
    @JsonProperty("context")      String context,
    @JsonProperty("baseline")     double baseline,
    @JsonProperty("withContext")  double withContext,
    @JsonProperty("effect")       double effect,
    @JsonProperty("standardError") double standardError,
    @JsonProperty("t")            double tStatistic,
    @JsonProperty("nBaseline")    int baselineCount,
    @JsonProperty("nContext")     int contextCount,
    @JsonProperty("significant")  boolean significant
) {
}
