package com.judgmentbell.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Classifies a Bell-test instance by which dimension differs between the two parties.
 */
public enum CrossType {

    /** Both parties share every dimension value. */
    MONO("mono"),
    CROSS_LINGUAL("xlang"),
    CROSS_TEMPORAL("xtemp"),
    /** Language and tense both differ. */
    CROSS_DIMENSIONAL("xdim"),
    /** Same language and tense, different judgment sources. */
    CROSS_MODEL("xmodel");

    private final String tag;

    CrossType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public boolean isCross() {
        return this != MONO;
    }

    /**
     * Accepts the current tags plus older spellings: {@code m} / {@code mono} /
     * {@code monolingual}, {@code x} / {@code cross} / {@code crosslingual}, and enum names.
     */
    public static Optional<CrossType> fromTag(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String v = value.trim().toLowerCase().replace("-", "_");
        for (CrossType type : values()) {
            if (type.tag.equals(v) || type.name().toLowerCase().equals(v)) {
                return Optional.of(type);
            }
        }
        switch (v) {
            case "m": case "monolingual": case "mono_lingual":
                return Optional.of(MONO);
            case "x": case "cross": case "crosslingual": case "cross_lingual":
                return Optional.of(CROSS_LINGUAL);
            case "crosstemporal":
                return Optional.of(CROSS_TEMPORAL);
            case "crossdimensional":
                return Optional.of(CROSS_DIMENSIONAL);
            case "crossmodel":
                return Optional.of(CROSS_MODEL);
            default:
                return Optional.empty();
        }
    }

    @JsonCreator
    public static CrossType fromJson(String value) {
        return fromTag(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown cross type: " + value));
    }
}
