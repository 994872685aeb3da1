package com.judgmentbell.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Per-party dimension values: the language and tense a party's scenario is rendered in,
 * plus the judgment source asked about that party.
 *
 * <p>{@code source} is {@code null} when the run's default source judges both parties;
 * it is only set for cross-model instances.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PartyFrame(
    @JsonProperty("language") Language language,
    @JsonProperty("tense")    Tense tense,
    @JsonProperty("source")   String source
) {
    public PartyFrame {
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(tense, "tense");
        if (source != null && source.isBlank()) {
            source = null;
        }
    }

    public PartyFrame(Language language, Tense tense) {
        this(language, tense, null);
    }

    /** Identifier tag, e.g. {@code en-pas}. Source is carried by the manifest, not the tag. */
    public String tag() {
        return language.code() + "-" + tense.tag();
    }

    public PartyFrame withSource(String newSource) {
        return new PartyFrame(language, tense, newSource);
    }

    @Override
    public String toString() {
        return source == null
            ? language.code() + "/" + tense.label()
            : language.code() + "/" + tense.label() + "/" + source;
    }
}
