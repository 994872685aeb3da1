package com.judgmentbell.common.design;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A questioning framework: its name and the question asked, where {@code {subject}}
 * stands for the judged party.
 */
public record AxisFraming(
    @JsonProperty("name")     String name,
    @JsonProperty("question") String question
) {
    public boolean isComplete() {
        return name != null && question != null;
    }
}
