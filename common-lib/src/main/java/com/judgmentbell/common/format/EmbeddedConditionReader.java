package com.judgmentbell.common.format;

import com.fasterxml.jackson.databind.JsonNode;
import com.judgmentbell.common.model.ConditionFields;
import com.judgmentbell.common.model.CrossType;
import com.judgmentbell.common.model.Language;
import com.judgmentbell.common.model.Party;
import com.judgmentbell.common.model.PartyFrame;
import com.judgmentbell.common.model.Tense;

import java.util.Optional;

/**
 * Normalizes condition fields written by older generators, e.g.
 * <pre>
 *   {"scenario": "kidney_gift", "alpha_lang": "English", "beta_lang": "ja", "subject": "alpha"}
 *   {"scenario": "trolley_standoff", "lang_a": "en", "lang_b": "en", "tense_a": "past",
 *    "tense_b": "future", "cross_type": "xtemp", "subject": "A"}
 * </pre>
 * Also reads the current nested form ({@code alpha} / {@code beta} objects).
 */
final class EmbeddedConditionReader {

    private EmbeddedConditionReader() {}

    static Optional<ConditionFields> read(JsonNode spec) {
        if (spec == null || !spec.isObject()) return Optional.empty();

        String scenario = text(spec, "scenario", "scenario_key", "scenarioId");
        if (scenario == null) return Optional.empty();

        Optional<PartyFrame> alpha = frame(spec.path("alpha"));
        Optional<PartyFrame> beta = frame(spec.path("beta"));
        if (alpha.isEmpty() || beta.isEmpty()) {
            Optional<Language> langA = Language.fromCode(
                text(spec, "lang_a", "alpha_lang", "language_a", "language", "lang"));
            if (langA.isEmpty()) return Optional.empty();
            Language langB = Language.fromCode(text(spec, "lang_b", "beta_lang", "language_b", "language", "lang"))
                .orElse(langA.get());
            Tense tenseA = Tense.fromLabel(text(spec, "tense_a", "tense")).orElse(Tense.PRESENT);
            Tense tenseB = Tense.fromLabel(text(spec, "tense_b", "tense")).orElse(tenseA);
            alpha = Optional.of(new PartyFrame(langA.get(), tenseA, text(spec, "source_a")));
            beta = Optional.of(new PartyFrame(langB, tenseB, text(spec, "source_b")));
        }

        Optional<CrossType> tagged = CrossType.fromTag(text(spec, "cross_type", "crossType"));
        CrossType crossType;
        if (tagged.isPresent()) {
            crossType = tagged.get();
        } else if (spec.has("is_crosslingual")) {
            crossType = spec.path("is_crosslingual").asBoolean() ? CrossType.CROSS_LINGUAL : CrossType.MONO;
        } else {
            crossType = infer(alpha.get(), beta.get());
        }

        Party subject = Party.fromCode(text(spec, "subject")).orElse(null);
        String source = text(spec, "source", "model");

        return Optional.of(new ConditionFields(scenario, alpha.get(), beta.get(), crossType, subject, source));
    }

    static CrossType infer(PartyFrame alpha, PartyFrame beta) {
        boolean language = alpha.language() != beta.language();
        boolean tense = alpha.tense() != beta.tense();
        if (language && tense) return CrossType.CROSS_DIMENSIONAL;
        if (language) return CrossType.CROSS_LINGUAL;
        if (tense) return CrossType.CROSS_TEMPORAL;
        if (alpha.source() != null && !alpha.source().equals(beta.source())) return CrossType.CROSS_MODEL;
        return CrossType.MONO;
    }

    private static Optional<PartyFrame> frame(JsonNode node) {
        if (!node.isObject()) return Optional.empty();
        Optional<Language> language = Language.fromCode(text(node, "language"));
        if (language.isEmpty()) return Optional.empty();
        Tense tense = Tense.fromLabel(text(node, "tense")).orElse(Tense.PRESENT);
        return Optional.of(new PartyFrame(language.get(), tense, text(node, "source")));
    }

    /** First non-blank textual value among the given field names. */
    static String text(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.path(field);
            if (value.isValueNode() && !value.isNull() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }
}
