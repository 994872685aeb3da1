package com.judgmentbell.common.model;

import java.util.Objects;

/**
 * The subset of a trial condition the aggregator needs: enough to rebuild the
 * {@link ConfigurationKey} and to know which party was judged.
 *
 * <p>Comes either from the design manifest or from condition fields embedded in a
 * result record. {@code subject} may be {@code null} when the embedded fields omit it;
 * the aggregator then relies on the subject decoded from the identifier.
 */
public record ConditionFields(
    String scenarioId,
    PartyFrame alpha,
    PartyFrame beta,
    CrossType crossType,
    Party subject,
    String source
) {
    public ConditionFields {
        Objects.requireNonNull(scenarioId, "scenarioId");
        Objects.requireNonNull(alpha, "alpha");
        Objects.requireNonNull(beta, "beta");
        Objects.requireNonNull(crossType, "crossType");
    }

    public ConfigurationKey configurationKey() {
        return new ConfigurationKey(scenarioId, alpha, beta, crossType, source);
    }
}
