package com.judgmentbell.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/** Temporal frame in which a scenario is narrated. */
public enum Tense {

    PAST("past"),
    PRESENT("present"),
    FUTURE("future");

    private final String label;

    Tense(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Three-letter tag used in identifiers ({@code pas}, {@code pre}, {@code fut}). */
    public String tag() {
        return label.substring(0, 3);
    }

    public static Optional<Tense> fromLabel(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String v = value.trim().toLowerCase();
        for (Tense tense : values()) {
            if (tense.label.equals(v) || tense.tag().equals(v)) {
                return Optional.of(tense);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static Tense fromJson(String value) {
        return fromLabel(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown tense: " + value));
    }
}
