package com.judgmentbell.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Map;
import java.util.Optional;

/**
 * Prompt languages. Serialized as the two-letter code.
 */
public enum Language {

    ENGLISH("en"),
    CHINESE("zh"),
    JAPANESE("ja"),
    ARABIC("ar"),
    HINDI("hi"),
    ICELANDIC("is"),
    SPANISH("es"),
    GERMAN("de"),
    FRENCH("fr");

    private static final Map<String, String> ALIASES = Map.ofEntries(
        Map.entry("english", "en"),
        Map.entry("chinese", "zh"),
        Map.entry("mandarin", "zh"),
        Map.entry("zh-cn", "zh"),
        Map.entry("japanese", "ja"),
        Map.entry("jp", "ja"),
        Map.entry("arabic", "ar"),
        Map.entry("hindi", "hi"),
        Map.entry("icelandic", "is"),
        Map.entry("spanish", "es"),
        Map.entry("german", "de"),
        Map.entry("french", "fr")
    );

    private final String code;

    Language(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** Normalizes codes and full names ({@code "Japanese"}, {@code "JA"}, {@code "jp"}). */
    public static Optional<Language> fromCode(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String v = value.trim().toLowerCase();
        String code = ALIASES.getOrDefault(v, v);
        for (Language language : values()) {
            if (language.code.equals(code)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static Language fromJson(String value) {
        return fromCode(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown language: " + value));
    }
}
