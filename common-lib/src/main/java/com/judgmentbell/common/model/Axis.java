package com.judgmentbell.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * One of the two questioning frameworks used to elicit a verdict.
 * Plays the role of a measurement basis in the Bell-type analysis.
 */
public enum Axis {

    PRIMARY("p", "primary"),
    SECONDARY("s", "secondary");

    private final String code;
    private final String label;

    Axis(String code, String label) {
        this.code = code;
        this.label = label;
    }

    /** Single-letter code used inside axis-pair tokens ({@code "p"} / {@code "s"}). */
    public String code() {
        return code;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static Axis fromLabel(String value) {
        if (value == null) {
            throw new IllegalArgumentException("axis must not be null");
        }
        String v = value.trim().toLowerCase();
        for (Axis axis : values()) {
            if (axis.label.equals(v) || axis.code.equals(v)) {
                return axis;
            }
        }
        throw new IllegalArgumentException("Unknown axis: " + value);
    }
}
