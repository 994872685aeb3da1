package com.judgmentbell.common.design;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.judgmentbell.common.model.TrialCondition;

/**
 * One rendered judgment request handed to the oracle.
 *
 * @param source judgment source selector; {@code null} means the oracle's default
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrialRequest(
    @JsonProperty("identifier") String identifier,
    @JsonProperty("prompt")     String prompt,
    @JsonProperty("source")     String source,
    @JsonProperty("condition")  TrialCondition condition
) {
}
