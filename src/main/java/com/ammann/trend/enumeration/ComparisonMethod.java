/* (C)2026 */
package com.ammann.trend.enumeration;

/**
 * How pairs of observations are ordered when computing the Mann-Kendall score.
 *
 * <ul>
 *   <li>ROBUST: signs follow only from provable relations between censored bounds
 *   <li>SUBSTITUTION: censored values are replaced by a numeric shadow series once per
 *       analysis (legacy LWP-TRENDS emulation, configured as {@code lwp})
 * </ul>
 */
public enum ComparisonMethod {
    ROBUST,
    SUBSTITUTION;

    /**
     * Accepts the enum names and the configuration labels {@code robust} and {@code lwp}.
     *
     * @param value label to convert
     * @return comparison method
     * @throws IllegalArgumentException if the label is unknown
     */
    public static ComparisonMethod fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("ComparisonMethod value cannot be null");
        }
        String normalized = value.trim().toLowerCase();
        if (normalized.equals("robust")) {
            return ROBUST;
        }
        if (normalized.equals("lwp") || normalized.equals("substitution")) {
            return SUBSTITUTION;
        }
        throw new IllegalArgumentException(
                "Invalid mk test method: " + value + ". Must be robust or lwp (case-insensitive).");
    }
}
