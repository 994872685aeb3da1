package com.judgmentbell.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.judgmentbell.common.format.ResultRecord;

import java.util.Map;

/**
 * Result set of a collected run, in the shape the analysis service reads
 * ({@code source} + {@code results} keyed by identifier), plus collection counts.
 */
public record CollectedResults(
    @JsonProperty("runId")    String runId,
    @JsonProperty("source")   String source,
    @JsonProperty("requests") int requests,
    @JsonProperty("resolved") int resolved,
    @JsonProperty("failed")   int failed,
    @JsonProperty("missing")  int missing,
    @JsonProperty("results")  Map<String, ResultRecord> results
) {
}
