package com.judgmentbell.common.report;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param consistencyThreshold CV below which a scenario counts as consistent
 * @param summaries            per (source, scenario) averages
 * @param scenarios            scenarios judged by at least two sources
 */
public record SourceComparison(
    @JsonProperty("consistencyThreshold") double consistencyThreshold,
    @JsonProperty("summaries")            List<SourceSummary> summaries,
    @JsonProperty("scenarios")            List<ScenarioConsistency> scenarios
) {
    public boolean allConsistent() {
        return scenarios.stream().allMatch(ScenarioConsistency::consistent);
    }
}
