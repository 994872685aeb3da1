package com.judgmentbell.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * The two counterparts of a Bell-test instance. Each party is judged separately;
 * their verdicts are multiplied to form one correlation sample.
 */
public enum Party {

    ALPHA("a", "alpha", "A"),
    BETA("b", "beta", "B");

    private final String code;
    private final String label;
    private final String letter;

    Party(String code, String label, String letter) {
        this.code = code;
        this.label = label;
        this.letter = letter;
    }

    /** One-letter subject code appended to the axis-pair token of an identifier. */
    public String code() {
        return code;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Name used when rendering prompts ("Person A"). */
    public String displayName() {
        return "Person " + letter;
    }

    /**
     * Recognizes every subject spelling observed in identifiers and embedded result
     * fields: {@code a}, {@code alpha}, {@code persona}, {@code person_a}, {@code A} and
     * their beta counterparts. Case-insensitive.
     */
    public static Optional<Party> fromCode(String token) {
        if (token == null) return Optional.empty();
        String t = token.trim().toLowerCase().replace("_", "").replace(" ", "");
        switch (t) {
            case "a": case "alpha": case "persona":
                return Optional.of(ALPHA);
            case "b": case "beta": case "personb":
                return Optional.of(BETA);
            default:
                return Optional.empty();
        }
    }

    @JsonCreator
    public static Party fromLabel(String value) {
        return fromCode(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown party: " + value));
    }
}
