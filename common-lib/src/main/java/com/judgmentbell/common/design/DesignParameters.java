package com.judgmentbell.common.design;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.judgmentbell.common.model.Language;
import com.judgmentbell.common.model.PartyFrame;
import com.judgmentbell.common.model.Tense;

import java.util.List;

/**
 * Inputs of one design run.
 *
 * <p>Empty language / tense sets default to English / present. {@code includeMono}
 * defaults to {@code true}; cross-pair lists default to empty.
 */
public record DesignParameters(
    @JsonProperty("trials")           int trialCount,
    @JsonProperty("scenarios")        List<String> scenarioIds,
    @JsonProperty("languages")        List<Language> languages,
    @JsonProperty("tenses")           List<Tense> tenses,
    @JsonProperty("includeMono")      Boolean includeMono,
    @JsonProperty("crossLingual")     List<DimensionPair<Language>> crossLingual,
    @JsonProperty("crossTemporal")    List<DimensionPair<Tense>> crossTemporal,
    @JsonProperty("crossDimensional") List<DimensionPair<PartyFrame>> crossDimensional,
    @JsonProperty("crossModel")       List<DimensionPair<String>> crossModel,
    @JsonProperty("defaultSource")    String defaultSource
) {
    public DesignParameters {
        if (trialCount < 1) {
            throw new IllegalArgumentException("trials must be >= 1: " + trialCount);
        }
        if (scenarioIds == null || scenarioIds.isEmpty()) {
            throw new IllegalArgumentException("at least one scenario is required");
        }
        scenarioIds      = List.copyOf(scenarioIds);
        languages        = languages == null || languages.isEmpty() ? List.of(Language.ENGLISH) : List.copyOf(languages);
        tenses           = tenses == null || tenses.isEmpty() ? List.of(Tense.PRESENT) : List.copyOf(tenses);
        includeMono      = includeMono == null ? Boolean.TRUE : includeMono;
        crossLingual     = crossLingual == null ? List.of() : List.copyOf(crossLingual);
        crossTemporal    = crossTemporal == null ? List.of() : List.copyOf(crossTemporal);
        crossDimensional = crossDimensional == null ? List.of() : List.copyOf(crossDimensional);
        crossModel       = crossModel == null ? List.of() : List.copyOf(crossModel);
    }

    /** Mono-only design over the given scenarios and languages. */
    public static DesignParameters mono(int trialCount, List<String> scenarioIds, List<Language> languages) {
        return new DesignParameters(trialCount, scenarioIds, languages, null, true,
                                    null, null, null, null, null);
    }
}
