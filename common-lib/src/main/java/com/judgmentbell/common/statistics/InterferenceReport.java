package com.judgmentbell.common.statistics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param detected  some group is significant with |percent| above {@link InterferenceAnalyzer#DETECTION_PERCENT}
 * @param aggregate pooled effect, {@code null} when a timing has no observations at all
 */
public record InterferenceReport(
    @JsonProperty("groups")    List<InterferenceEffect> groups,
    @JsonProperty("aggregate") InterferenceEffect aggregate,
    @JsonProperty("detected")  boolean detected
) {
}
