package com.judgmentbell.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies one Bell-test instance: scenario, per-party dimension values, cross-type and
 * (for multi-source comparison) the source the result set came from.
 *
 * <p>Used as a map key throughout aggregation; record equality defines grouping.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConfigurationKey(
    @JsonProperty("scenario")  String scenarioId,
    @JsonProperty("alpha")     PartyFrame alpha,
    @JsonProperty("beta")      PartyFrame beta,
    @JsonProperty("crossType") CrossType crossType,
    @JsonProperty("source")    String source
) {
    /** Orders keys by scenario, cross-type, then the textual frames and source. */
    public static final Comparator<ConfigurationKey> ORDER = Comparator
        .comparing(ConfigurationKey::scenarioId)
        .thenComparing(ConfigurationKey::crossType)
        .thenComparing(k -> k.alpha().toString())
        .thenComparing(k -> k.beta().toString())
        .thenComparing(k -> k.source() == null ? "" : k.source());

    public ConfigurationKey {
        Objects.requireNonNull(scenarioId, "scenarioId");
        Objects.requireNonNull(alpha, "alpha");
        Objects.requireNonNull(beta, "beta");
        Objects.requireNonNull(crossType, "crossType");
    }

    public ConfigurationKey withSource(String newSource) {
        return new ConfigurationKey(scenarioId, alpha, beta, crossType, newSource);
    }

    /** Compact label used in logs and text reports. */
    public String label() {
        String base = scenarioId + " [" + crossType.tag() + "] " + alpha + " | " + beta;
        return source == null ? base : base + " @" + source;
    }
}
