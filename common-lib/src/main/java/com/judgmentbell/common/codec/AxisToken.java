package com.judgmentbell.common.codec;

import com.judgmentbell.common.model.MeasurementSetting;
import com.judgmentbell.common.model.Party;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * An identifier token naming an axis pair, optionally with the subject fused on:
 * {@code pp}, {@code psa}, {@code sp-b}, {@code ssbeta}.
 */
record AxisToken(MeasurementSetting setting, Party subject) {

    private static final int MAX_INDEX_DIGITS = 10;

    static Optional<AxisToken> parse(String token) {
        if (token == null || token.length() < 2) return Optional.empty();
        String t = token.toLowerCase();
        Optional<MeasurementSetting> setting = MeasurementSetting.fromCode(t.substring(0, 2));
        if (setting.isEmpty()) return Optional.empty();

        String rest = t.substring(2);
        if (rest.startsWith("-")) rest = rest.substring(1);
        if (rest.isEmpty()) {
            return Optional.of(new AxisToken(setting.get(), null));
        }
        return Party.fromCode(rest).map(p -> new AxisToken(setting.get(), p));
    }

    static boolean isNumeric(String token) {
        if (token == null || token.isEmpty()) return false;
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c < '0' || c > '9') return false;
        }
        return true;
    }

    /** The token as a trial index, empty when it is not numeric or does not fit an int. */
    static OptionalInt trialIndex(String token) {
        if (!isNumeric(token) || token.length() > MAX_INDEX_DIGITS) return OptionalInt.empty();
        long value = Long.parseLong(token);
        return value > Integer.MAX_VALUE ? OptionalInt.empty() : OptionalInt.of((int) value);
    }
}
