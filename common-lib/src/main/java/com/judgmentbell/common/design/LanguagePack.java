package com.judgmentbell.common.design;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.judgmentbell.common.model.Tense;

import java.util.Map;

/**
 * Per-language prompt template and tense markers.
 *
 * <p>Template placeholders: {@code {tense_marker}}, {@code {title}}, {@code {content}},
 * {@code {axis_name}}, {@code {axis_question}}, {@code {subject}}.
 */
public record LanguagePack(
    @JsonProperty("template")     String template,
    @JsonProperty("tenseMarkers") Map<String, String> tenseMarkers
) {
    public LanguagePack {
        tenseMarkers = tenseMarkers == null ? Map.of() : Map.copyOf(tenseMarkers);
    }

    public boolean isComplete() {
        return template != null;
    }

    public String marker(Tense tense) {
        return tenseMarkers.getOrDefault(tense.label(), "");
    }
}
