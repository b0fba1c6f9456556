/* (C)2026 */
package com.ammann.trend.enumeration;

/**
 * Size of the increment that places right-censored substitutes above every other value
 * in a substituted series.
 */
public enum TieBreakMethod {
    /** Half the smallest gap between distinct values. */
    STANDARD(0.5),
    /** The smallest gap divided by 1000, as in the LWP-TRENDS script. */
    LWP(0.001);

    private final double gapFraction;

    TieBreakMethod(double gapFraction) {
        this.gapFraction = gapFraction;
    }

    public double getGapFraction() { return gapFraction; }

    public static TieBreakMethod fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("TieBreakMethod value cannot be null");
        }
        String normalized = value.trim().toLowerCase();
        if (normalized.equals("standard") || normalized.equals("robust")) {
            return STANDARD;
        }
        if (normalized.equals("lwp")) {
            return LWP;
        }
        throw new IllegalArgumentException(
                "Invalid tie break method: " + value + ". Must be standard or lwp (case-insensitive).");
    }
}
