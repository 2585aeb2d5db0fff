package io.github.riemr.roster.domain.model;

/**
 * Shift granularity. Both schemes share the same eligibility and model rules.
 */
public enum ShiftScheme {
    /** Morning / evening slots per day class. */
    SPLIT,
    /** One slot per day (evening only on weekdays). */
    FULL_DAY;

    public static ShiftScheme fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        String normalized = code.trim().toUpperCase().replace('-', '_').replace(' ', '_');
        try {
            return ShiftScheme.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown shift scheme: " + code);
        }
    }
}
