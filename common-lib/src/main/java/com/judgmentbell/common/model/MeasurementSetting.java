package com.judgmentbell.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * One of the four axis pairs drawn from {primary, secondary} × {primary, secondary}.
 * The first axis is measured on {@link Party#ALPHA}, the second on {@link Party#BETA}.
 *
 * <p>{@link #chshSign()} is the coefficient of this setting's expectation value in
 * S = E(pp) − E(ps) + E(sp) + E(ss).
 */
public enum MeasurementSetting {

    PP(Axis.PRIMARY,   Axis.PRIMARY,    1),
    PS(Axis.PRIMARY,   Axis.SECONDARY, -1),
    SP(Axis.SECONDARY, Axis.PRIMARY,    1),
    SS(Axis.SECONDARY, Axis.SECONDARY,  1);

    private final Axis alphaAxis;
    private final Axis betaAxis;
    private final int chshSign;

    MeasurementSetting(Axis alphaAxis, Axis betaAxis, int chshSign) {
        this.alphaAxis = alphaAxis;
        this.betaAxis = betaAxis;
        this.chshSign = chshSign;
    }

    public Axis alphaAxis() { return alphaAxis; }

    public Axis betaAxis() { return betaAxis; }

    public int chshSign() { return chshSign; }

    /** The axis the given party is questioned on under this setting. */
    public Axis axisFor(Party party) {
        return party == Party.ALPHA ? alphaAxis : betaAxis;
    }

    /** Two-letter pair code, e.g. {@code "ps"}. */
    @JsonValue
    public String code() {
        return alphaAxis.code() + betaAxis.code();
    }

    public static Optional<MeasurementSetting> fromCode(String token) {
        if (token == null) return Optional.empty();
        String t = token.trim().toLowerCase();
        for (MeasurementSetting setting : values()) {
            if (setting.code().equals(t)) {
                return Optional.of(setting);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static MeasurementSetting fromJson(String value) {
        return fromCode(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown measurement setting: " + value));
    }
}
