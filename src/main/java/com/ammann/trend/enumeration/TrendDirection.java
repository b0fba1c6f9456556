/* (C)2026 */
package com.ammann.trend.enumeration;

/**
 * Direction of a monotonic trend, derived from the sign of the Mann-Kendall score.
 */
public enum TrendDirection {
    INCREASING("Increasing"),
    DECREASING("Decreasing"),
    NONE("No Trend");

    private final String label;

    TrendDirection(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }

    public static TrendDirection fromScore(double s) {
        if (s > 0) return INCREASING;
        if (s < 0) return DECREASING;
        return NONE;
    }

    /**
     * Accepts the enum names plus {@code inc}, {@code dec} and {@code no trend}.
     */
    public static TrendDirection fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("TrendDirection value cannot be null");
        }
        switch (value.trim().toLowerCase()) {
            case "increasing":
            case "inc":
                return INCREASING;
            case "decreasing":
            case "dec":
                return DECREASING;
            case "none":
            case "no trend":
                return NONE;
            default:
                throw new IllegalArgumentException("Invalid trend direction: " + value);
        }
    }
}
