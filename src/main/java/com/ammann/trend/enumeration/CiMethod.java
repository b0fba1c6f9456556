/* (C)2026 */
package com.ammann.trend.enumeration;

/**
 * Confidence interval selection for the Sen's slope.
 */
public enum CiMethod {
    /** Integer rank indices into the sorted slope pool. */
    DIRECT,
    /** Linear interpolation between adjacent ranks (LWP-TRENDS emulation). */
    LWP;

    public static CiMethod fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("CiMethod value cannot be null");
        }
        for (CiMethod m : values()) {
            if (m.name().equalsIgnoreCase(value.trim())) {
                return m;
            }
        }
        throw new IllegalArgumentException(
                "Invalid ci method: " + value + ". Must be direct or lwp (case-insensitive).");
    }
}
