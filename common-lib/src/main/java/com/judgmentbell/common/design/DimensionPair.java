package com.judgmentbell.common.design;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.judgmentbell.common.model.Language;
import com.judgmentbell.common.model.PartyFrame;
import com.judgmentbell.common.model.Tense;

import java.util.Objects;

/**
 * Declared cross-cutting pair: party A receives {@code first}, party B {@code second}.
 */
public record DimensionPair<T>(
    @JsonProperty("first")  T first,
    @JsonProperty("second") T second
) {
    public DimensionPair {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
    }

    /** {@code "en-ja"} */
    public static DimensionPair<Language> languages(String text) {
        String[] parts = split(text, "-");
        return new DimensionPair<>(Language.fromJson(parts[0]), Language.fromJson(parts[1]));
    }

    /** {@code "past-future"} */
    public static DimensionPair<Tense> tenses(String text) {
        String[] parts = split(text, "-");
        return new DimensionPair<>(Tense.fromJson(parts[0]), Tense.fromJson(parts[1]));
    }

    /** {@code "en:past-ja:future"} */
    public static DimensionPair<PartyFrame> frames(String text) {
        String[] parts = split(text, "-");
        return new DimensionPair<>(frame(parts[0]), frame(parts[1]));
    }

    private static PartyFrame frame(String text) {
        String[] parts = split(text, ":");
        return new PartyFrame(Language.fromJson(parts[0]), Tense.fromJson(parts[1]));
    }

    private static String[] split(String value, String delimiter) {
        String[] parts = value == null ? new String[0] : value.trim().split(delimiter);
        if (parts.length != 2) {
            throw new IllegalArgumentException("Expected two values separated by '" + delimiter + "': " + value);
        }
        return parts;
    }
}
