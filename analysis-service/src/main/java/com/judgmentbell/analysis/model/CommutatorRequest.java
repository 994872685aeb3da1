package com.judgmentbell.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CommutatorRequest(
    @JsonProperty("observations") List<OrderedTrial> observations
) {
}
