package com.judgmentbell.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Immutable description of one judgment request, fixed at design time.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code scenarioId}: catalog id of the scenario</li>
 *   <li>{@code alpha}, {@code beta}: per-party dimension values</li>
 *   <li>{@code setting}: axis pair; the measured party is questioned on its own axis</li>
 *   <li>{@code subject}: the party this request asks about</li>
 *   <li>{@code trialIndex}: repetition index, shared by the two halves of a pair</li>
 *   <li>{@code crossType}: which dimension differs between the parties</li>
 *   <li>{@code salt}: random hex disambiguating otherwise identical identifiers</li>
 * </ul>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrialCondition(
    @JsonProperty("scenario")   String scenarioId,
    @JsonProperty("alpha")      PartyFrame alpha,
    @JsonProperty("beta")       PartyFrame beta,
    @JsonProperty("setting")    MeasurementSetting setting,
    @JsonProperty("subject")    Party subject,
    @JsonProperty("trial")      int trialIndex,
    @JsonProperty("crossType")  CrossType crossType,
    @JsonProperty("salt")       String salt
) {
    public TrialCondition {
        Objects.requireNonNull(scenarioId, "scenarioId");
        Objects.requireNonNull(alpha, "alpha");
        Objects.requireNonNull(beta, "beta");
        Objects.requireNonNull(setting, "setting");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(crossType, "crossType");
        if (trialIndex < 0) {
            throw new IllegalArgumentException("trialIndex must be >= 0: " + trialIndex);
        }
    }

    /** Dimension values of the party being judged. */
    @JsonIgnore
    public PartyFrame measuredFrame() {
        return subject == Party.ALPHA ? alpha : beta;
    }

    @JsonIgnore
    public Axis measuredAxis() {
        return setting.axisFor(subject);
    }

    @JsonIgnore
    public ConfigurationKey configurationKey() {
        return new ConfigurationKey(scenarioId, alpha, beta, crossType, null);
    }

    @JsonIgnore
    public ConditionFields fields() {
        return new ConditionFields(scenarioId, alpha, beta, crossType, subject, null);
    }
}
