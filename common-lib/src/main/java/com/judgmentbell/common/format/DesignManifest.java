package com.judgmentbell.common.format;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.judgmentbell.common.design.DesignParameters;
import com.judgmentbell.common.design.TrialDesign;
import com.judgmentbell.common.model.TrialCondition;

import java.time.Instant;
import java.util.Map;

/**
 * Persisted design: audit hash plus every trial condition keyed by identifier.
 *
 * @param parameters may be {@code null} for manifests converted from older layouts
 */
public record DesignManifest(
    @JsonProperty("auditHash")   String auditHash,
    @JsonProperty("generatedAt") Instant generatedAt,
    @JsonProperty("parameters")  DesignParameters parameters,
    @JsonProperty("conditions")  Map<String, TrialCondition> conditions
) {
    public DesignManifest {
        conditions = conditions == null ? Map.of() : conditions;
    }

    public static DesignManifest of(TrialDesign design, Instant generatedAt) {
        return new DesignManifest(design.auditHash(), generatedAt, design.parameters(), design.conditions());
    }
}
