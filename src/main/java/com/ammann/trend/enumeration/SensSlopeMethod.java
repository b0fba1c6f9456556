/* (C)2026 */
package com.ammann.trend.enumeration;

/**
 * Treatment of ambiguous pairwise slopes in the Sen's slope pool.
 */
public enum SensSlopeMethod {
    /** Ambiguous slopes are dropped from the pool. */
    NAN,
    /** Ambiguous slopes enter the pool as literal zeros (LWP-TRENDS emulation). */
    LWP;

    public static SensSlopeMethod fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("SensSlopeMethod value cannot be null");
        }
        for (SensSlopeMethod m : values()) {
            if (m.name().equalsIgnoreCase(value.trim())) {
                return m;
            }
        }
        throw new IllegalArgumentException(
                "Invalid sens slope method: " + value + ". Must be nan or lwp (case-insensitive).");
    }
}
