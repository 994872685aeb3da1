package com.judgmentbell.common.codec;

import com.judgmentbell.common.model.TrialCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Bidirectional mapping between a {@link TrialCondition} and its compact identifier.
 *
 * <h3>Layout</h3>
 * <pre>
 *   {crossType}_{scenarioTag}_{alphaTag}_{betaTag}_{trial:03d}_{pair}{subject}_{salt}
 *   xdim_trolle_en-pas_ja-fut_007_psa_9f3c21ab
 * </pre>
 * The scenario tag keeps at most six letters of the scenario id. Source and full scenario id
 * travel in the manifest; the identifier only has to round-trip trial index, axis pair and
 * subject.
 *
 * <h3>Decoding</h3>
 * Identifiers from older generator versions use other token orders, so decoding tries an
 * ordered list of {@link DecodeStrategy} readers and returns the first match. Empty means
 * the identifier matched no known layout; callers drop the trial and count it.
 */
public class TrialIdentifierCodec {

    private static final Logger log = LoggerFactory.getLogger(TrialIdentifierCodec.class);

    static final int SCENARIO_TAG_LENGTH = 6;
    static final String DELIMITER = "_";

    private static final SecureRandom RANDOM = new SecureRandom();

    private final List<DecodeStrategy> strategies;

    public TrialIdentifierCodec() {
        this(List.of(new NumericAnchorStrategy(), new AxisAnchorStrategy()));
    }

    public TrialIdentifierCodec(List<DecodeStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    // ── encode ───────────────────────────────────────────────────────────────

    public String encode(TrialCondition condition) {
        return String.join(DELIMITER,
            condition.crossType().tag(),
            scenarioTag(condition.scenarioId()),
            condition.alpha().tag(),
            condition.beta().tag(),
            String.format(Locale.ROOT, "%03d", condition.trialIndex()),
            condition.setting().code() + condition.subject().code(),
            condition.salt());
    }

    /** Lower-case letters of the scenario id, truncated; {@code scn} when none remain. */
    static String scenarioTag(String scenarioId) {
        StringBuilder tag = new StringBuilder();
        for (char c : scenarioId.toLowerCase(Locale.ROOT).toCharArray()) {
            if (c >= 'a' && c <= 'z') {
                tag.append(c);
                if (tag.length() == SCENARIO_TAG_LENGTH) break;
            }
        }
        return tag.length() == 0 ? "scn" : tag.toString();
    }

    /** Default salt source: eight random hex characters. */
    public static Supplier<String> randomSalt() {
        return () -> {
            byte[] bytes = new byte[4];
            RANDOM.nextBytes(bytes);
            return HexFormat.of().formatHex(bytes);
        };
    }

    // ── decode ───────────────────────────────────────────────────────────────

    public Optional<DecodedIdentifier> decode(String identifier) {
        if (identifier == null || identifier.isBlank()) return Optional.empty();

        List<String> tokens = Arrays.asList(identifier.trim().split(DELIMITER));
        for (DecodeStrategy strategy : strategies) {
            Optional<DecodedIdentifier> decoded = strategy.decode(tokens);
            if (decoded.isPresent()) {
                return decoded;
            }
        }
        log.debug("[Codec] No layout matched. identifier={}", identifier);
        return Optional.empty();
    }
}
