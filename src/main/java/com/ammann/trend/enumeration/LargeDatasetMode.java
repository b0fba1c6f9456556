/* (C)2026 */
package com.ammann.trend.enumeration;

/**
 * Requested strategy for very long series.
 */
public enum LargeDatasetMode {
    /** FULL up to the configured size threshold, FAST above it. */
    AUTO,
    FULL,
    FAST;

    public static LargeDatasetMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("LargeDatasetMode value cannot be null");
        }
        for (LargeDatasetMode m : values()) {
            if (m.name().equalsIgnoreCase(value.trim())) {
                return m;
            }
        }
        throw new IllegalArgumentException(
                "Invalid large dataset mode: " + value + ". Must be AUTO, FULL or FAST (case-insensitive).");
    }
}
