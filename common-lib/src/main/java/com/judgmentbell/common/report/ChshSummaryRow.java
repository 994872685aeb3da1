package com.judgmentbell.common.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.judgmentbell.common.model.ChshResult;
import com.judgmentbell.common.model.ConfigurationKey;
import com.judgmentbell.common.model.MeasurementSetting;

/**
 * Flat, re-loadable summary of one {@link ChshResult}.
 *
 * <p>Infinite standard errors serialize as the string {@code "Infinity"}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChshSummaryRow(
    @JsonProperty("key")          ConfigurationKey key,
    @JsonProperty("n")            int sampleCount,
    @JsonProperty("s")            double s,
    @JsonProperty("se")           double standardError,
    @JsonProperty("significance") double significance,
    @JsonProperty("violation")    boolean violation,

    // ── per-setting expectation values ──
    @JsonProperty("E_pp") double expectationPp,
    @JsonProperty("E_ps") double expectationPs,
    @JsonProperty("E_sp") double expectationSp,
    @JsonProperty("E_ss") double expectationSs,

    // ── per-setting sample counts ──
    @JsonProperty("n_pp") int countPp,
    @JsonProperty("n_ps") int countPs,
    @JsonProperty("n_sp") int countSp,
    @JsonProperty("n_ss") int countSs
) {
    public static ChshSummaryRow from(ChshResult r) {
        return new ChshSummaryRow(r.key(), r.sampleCount(), r.s(), r.standardError(),
            r.significance(), r.violation(),
            r.expectation(MeasurementSetting.PP), r.expectation(MeasurementSetting.PS),
            r.expectation(MeasurementSetting.SP), r.expectation(MeasurementSetting.SS),
            r.settings().get(MeasurementSetting.PP).sampleCount(),
            r.settings().get(MeasurementSetting.PS).sampleCount(),
            r.settings().get(MeasurementSetting.SP).sampleCount(),
            r.settings().get(MeasurementSetting.SS).sampleCount());
    }
}
