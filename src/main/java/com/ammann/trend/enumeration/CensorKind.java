/* (C)2026 */
package com.ammann.trend.enumeration;

/**
 * Censoring state of a single observation.
 *
 * <p>A censored observation carries only a detection limit: {@link #LEFT} means the true
 * value is below the limit ({@code "<5"}), {@link #RIGHT} means it is above ({@code ">10"}).
 */
public enum CensorKind {
    /** Exact measured value. */
    NONE,
    /** True value is strictly below the detection limit. */
    LEFT,
    /** True value is strictly above the detection limit. */
    RIGHT;

    public boolean isCensored() {
        return this != NONE;
    }

    /**
     * Case-insensitive conversion accepting both the enum names and the short labels
     * {@code "not"}, {@code "lt"} and {@code "gt"}.
     *
     * @param value label to convert
     * @return matching censor kind
     * @throws IllegalArgumentException if the label is unknown
     */
    public static CensorKind fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("CensorKind value cannot be null");
        }
        switch (value.trim().toLowerCase()) {
            case "none":
            case "not":
                return NONE;
            case "left":
            case "lt":
                return LEFT;
            case "right":
            case "gt":
                return RIGHT;
            default:
                throw new IllegalArgumentException(
                        "Invalid censor kind: " + value + ". Must be NONE, LEFT or RIGHT (case-insensitive).");
        }
    }
}
