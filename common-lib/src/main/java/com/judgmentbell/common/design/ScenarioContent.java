package com.judgmentbell.common.design;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.judgmentbell.common.model.Axis;

/** One scenario localized into one language. */
public record ScenarioContent(
    @JsonProperty("title")     String title,
    @JsonProperty("content")   String content,
    @JsonProperty("primary")   AxisFraming primary,
    @JsonProperty("secondary") AxisFraming secondary
) {
    public AxisFraming framing(Axis axis) {
        return axis == Axis.PRIMARY ? primary : secondary;
    }

    /** Title, content and both framings present; anything less cannot be rendered. */
    public boolean isComplete() {
        return title != null && content != null
            && primary != null && primary.isComplete()
            && secondary != null && secondary.isComplete();
    }
}
