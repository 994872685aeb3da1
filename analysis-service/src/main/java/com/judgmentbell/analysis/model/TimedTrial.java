package com.judgmentbell.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.judgmentbell.common.statistics.Timing;

/** One timing-variant trial; {@code answer} or {@code raw} text. */
public record TimedTrial(
    @JsonProperty("scenario") String scenarioId,
    @JsonProperty("axis")     String axis,
    @JsonProperty("timing")   Timing timing,
    @JsonProperty("answer")   Boolean answer,
    @JsonProperty("raw")      String raw
) {
}
