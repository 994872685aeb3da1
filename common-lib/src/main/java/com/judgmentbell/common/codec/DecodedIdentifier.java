package com.judgmentbell.common.codec;

import com.judgmentbell.common.model.MeasurementSetting;
import com.judgmentbell.common.model.Party;

import java.util.Optional;

/**
 * Fields recovered from a trial identifier.
 *
 * @param trialIndex repetition index
 * @param setting    axis pair
 * @param subject    judged party, {@code null} when the layout does not carry one
 * @param strategy   name of the decode strategy that matched
 */
public record DecodedIdentifier(int trialIndex, MeasurementSetting setting, Party subject, String strategy) {

    public Optional<Party> subjectIfPresent() {
        return Optional.ofNullable(subject);
    }

    /** Trial key disambiguating repeated trial indices across axis pairs. */
    public String trialKey() {
        return trialIndex + "_" + setting.code();
    }
}
