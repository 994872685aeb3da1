package com.judgmentbell.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One ordering-variant trial. Answers may be given directly or left {@code null} with the
 * oracle's {@code raw} text, from which both answers are extracted.
 */
public record OrderedTrial(
    @JsonProperty("scenario")     String scenarioId,
    @JsonProperty("firstAxis")    String firstAxis,
    @JsonProperty("secondAxis")   String secondAxis,
    @JsonProperty("firstAnswer")  Boolean firstAnswer,
    @JsonProperty("secondAnswer") Boolean secondAnswer,
    @JsonProperty("raw")          String raw
) {
}
