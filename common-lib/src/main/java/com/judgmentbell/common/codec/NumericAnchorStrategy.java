package com.judgmentbell.common.codec;

import com.judgmentbell.common.model.Party;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Anchors on a purely numeric token as the trial index and requires the next token to be
 * an axis-pair token. A subject is taken from a fused suffix ({@code psa}) or from the
 * token after the pair ({@code ps_PersonA}).
 *
 * <p>Matches the current layout and the older {@code m_scenario_lang_3_pp_PersonA_salt} one.
 */
public class NumericAnchorStrategy implements DecodeStrategy {

    @Override
    public String name() {
        return "numeric-anchor";
    }

    @Override
    public Optional<DecodedIdentifier> decode(List<String> tokens) {
        for (int i = 0; i + 1 < tokens.size(); i++) {
            OptionalInt trialIndex = AxisToken.trialIndex(tokens.get(i));
            if (trialIndex.isEmpty()) continue;

            Optional<AxisToken> axis = AxisToken.parse(tokens.get(i + 1));
            if (axis.isEmpty()) continue;

            Party subject = axis.get().subject();
            if (subject == null && i + 2 < tokens.size()) {
                subject = Party.fromCode(tokens.get(i + 2)).orElse(null);
            }
            return Optional.of(new DecodedIdentifier(
                trialIndex.getAsInt(), axis.get().setting(), subject, name()));
        }
        return Optional.empty();
    }
}
