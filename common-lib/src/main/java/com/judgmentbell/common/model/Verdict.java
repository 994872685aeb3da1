package com.judgmentbell.common.model;

import java.util.Locale;

/**
 * Tri-state outcome of one judgment.
 *
 * <p>Only resolved verdicts carry a sign; {@link #sign()} refuses {@link #UNRESOLVED}
 * so the sentinel can never leak into arithmetic. Serialized results still use the
 * integer convention −1 / 0 / +1 via {@link #legacyValue()}.
 */
public enum Verdict {

    UNRESOLVED(0, null),
    /** Acted wrongly. */
    GUILTY(-1, "GUILTY"),
    /** Acted permissibly. */
    NOT_GUILTY(1, "NOT_GUILTY");

    private final int value;
    private final String label;

    Verdict(int value, String label) {
        this.value = value;
        this.label = label;
    }

    public boolean isResolved() {
        return this != UNRESOLVED;
    }

    /**
     * Signed value for correlation products.
     *
     * @throws IllegalStateException for {@link #UNRESOLVED}
     */
    public int sign() {
        if (this == UNRESOLVED) {
            throw new IllegalStateException("UNRESOLVED verdict has no sign");
        }
        return value;
    }

    /** −1 / 0 / +1 for result files. */
    public int legacyValue() {
        return value;
    }

    /** Canonical response label, {@code null} for UNRESOLVED. */
    public String label() {
        return label;
    }

    public static Verdict fromLegacyValue(int value) {
        if (value > 0) return NOT_GUILTY;
        if (value < 0) return GUILTY;
        return UNRESOLVED;
    }

    /**
     * Reads a stored verdict: an integer, a numeric string or a canonical label
     * ({@code GUILTY}, {@code NOT_GUILTY}, {@code NOT GUILTY}). Anything else is UNRESOLVED.
     */
    public static Verdict fromStored(String value) {
        if (value == null || value.isBlank()) return UNRESOLVED;
        String v = value.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        switch (v) {
            case "GUILTY": return GUILTY;
            case "NOT_GUILTY": case "NOTGUILTY": return NOT_GUILTY;
            default:
                try {
                    return fromLegacyValue((int) Math.signum(Double.parseDouble(v)));
                } catch (NumberFormatException e) {
                    return UNRESOLVED;
                }
        }
    }
}
