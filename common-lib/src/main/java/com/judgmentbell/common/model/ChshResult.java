package com.judgmentbell.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * CHSH outcome for one configuration.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code key}: the Bell-test instance</li>
 *   <li>{@code settings}: expectation value, standard error and n for each of the four settings</li>
 *   <li>{@code s}: E(pp) − E(ps) + E(sp) + E(ss), always within [−4, 4]</li>
 *   <li>{@code standardError}: quadrature sum of the four setting errors</li>
 *   <li>{@code violation}: |S| &gt; 2</li>
 *   <li>{@code significance}: (|S| − 2) / standardError, or 0 when not computable</li>
 *   <li>{@code sampleCount}: total matched samples across the settings</li>
 * </ul>
 */
public record ChshResult(
    @JsonProperty("key")           ConfigurationKey key,
    @JsonProperty("settings")      Map<MeasurementSetting, SettingEstimate> settings,
    @JsonProperty("s")             double s,
    @JsonProperty("standardError") double standardError,
    @JsonProperty("violation")     boolean violation,
    @JsonProperty("significance")  double significance,
    @JsonProperty("n")             int sampleCount
) {
    public ChshResult {
        EnumMap<MeasurementSetting, SettingEstimate> copy = new EnumMap<>(MeasurementSetting.class);
        for (MeasurementSetting setting : MeasurementSetting.values()) {
            SettingEstimate estimate = settings == null ? null : settings.get(setting);
            copy.put(setting, estimate == null ? SettingEstimate.EMPTY : estimate);
        }
        settings = Collections.unmodifiableMap(copy);
    }

    public double expectation(MeasurementSetting setting) {
        return settings.get(setting).mean();
    }

    public double standardError(MeasurementSetting setting) {
        return settings.get(setting).standardError();
    }

    @JsonIgnore
    public double absS() {
        return Math.abs(s);
    }

    public ChshResult withKey(ConfigurationKey newKey) {
        return new ChshResult(newKey, settings, s, standardError, violation, significance, sampleCount);
    }
}
