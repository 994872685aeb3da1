package com.judgmentbell.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.judgmentbell.common.statistics.InterferenceReport;

public record InterferenceResponse(
    @JsonProperty("report")     InterferenceReport report,
    @JsonProperty("used")       int used,
    @JsonProperty("unresolved") int unresolved
) {
}
