package com.judgmentbell.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** Result sets keyed by source label; each label overrides the source inside its result set. */
public record CompareRequest(
    @JsonProperty("sources") Map<String, ChshRequest> sources
) {
}
