package com.judgmentbell.common.codec;

import com.judgmentbell.common.model.Party;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Fallback: anchors on the first axis-pair token anywhere, then takes the nearest numeric
 * token before it as the trial index (0 when there is none) and a subject after it.
 * A numeric token that overflows an int rejects the identifier.
 */
public class AxisAnchorStrategy implements DecodeStrategy {

    @Override
    public String name() {
        return "axis-anchor";
    }

    @Override
    public Optional<DecodedIdentifier> decode(List<String> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            Optional<AxisToken> axis = AxisToken.parse(tokens.get(i));
            if (axis.isEmpty()) continue;

            int trialIndex = 0;
            for (int j = i - 1; j >= 0; j--) {
                if (AxisToken.isNumeric(tokens.get(j))) {
                    OptionalInt parsed = AxisToken.trialIndex(tokens.get(j));
                    // an index too large for an int is a malformed identifier, not trial 0
                    if (parsed.isEmpty()) return Optional.empty();
                    trialIndex = parsed.getAsInt();
                    break;
                }
            }

            Party subject = axis.get().subject();
            if (subject == null && i + 1 < tokens.size()) {
                subject = Party.fromCode(tokens.get(i + 1)).orElse(null);
            }
            return Optional.of(new DecodedIdentifier(trialIndex, axis.get().setting(), subject, name()));
        }
        return Optional.empty();
    }
}
