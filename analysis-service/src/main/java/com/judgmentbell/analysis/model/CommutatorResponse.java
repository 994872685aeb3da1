package com.judgmentbell.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.judgmentbell.common.statistics.CommutatorEffect;

import java.util.List;

/**
 * @param used        trials whose two answers were recovered
 * @param unresolved  trials dropped because an answer could not be recovered
 * @param significant at least one effect is significant
 */
public record CommutatorResponse(
    @JsonProperty("effects")     List<CommutatorEffect> effects,
    @JsonProperty("used")        int used,
    @JsonProperty("unresolved")  int unresolved,
    @JsonProperty("significant") boolean significant
) {
}
