package com.judgmentbell.common.format;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.judgmentbell.common.model.TrialCondition;

/**
 * Stored form of one judgment in a result set, keyed by identifier.
 *
 * @param verdict   −1 / 0 / +1
 * @param condition design-time condition, embedded so the set stays usable without its manifest
 * @param raw       oracle text
 * @param error     oracle failure reason or parse diagnostic
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResultRecord(
    @JsonProperty("verdict")   int verdict,
    @JsonProperty("condition") TrialCondition condition,
    @JsonProperty("raw")       String raw,
    @JsonProperty("error")     String error
) {
}
