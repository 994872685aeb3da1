package com.judgmentbell.common.aggregation;

import com.judgmentbell.common.model.ConditionFields;
import com.judgmentbell.common.model.Verdict;

import java.util.Objects;

/**
 * One recovered judgment, keyed externally by its trial identifier.
 *
 * @param verdict  resolved verdict or UNRESOLVED
 * @param embedded condition fields carried by the result record itself, may be {@code null}
 * @param error    oracle failure reason or parse diagnostic, may be {@code null}
 */
public record ResultEntry(Verdict verdict, ConditionFields embedded, String error) {

    public ResultEntry {
        Objects.requireNonNull(verdict, "verdict");
    }

    public static ResultEntry of(Verdict verdict) {
        return new ResultEntry(verdict, null, null);
    }

    public static ResultEntry failed(String error) {
        return new ResultEntry(Verdict.UNRESOLVED, null, error);
    }
}
