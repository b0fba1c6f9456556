/* (C)2026 */
package com.ammann.trend.enumeration;

/**
 * Outcome of comparing a later observation against an earlier one.
 */
public enum PairSign {
    NEGATIVE(-1),
    TIE(0),
    POSITIVE(1),
    /** The ordering cannot be decided from the censored bounds. */
    AMBIGUOUS(0);

    private final int contribution;

    PairSign(int contribution) {
        this.contribution = contribution;
    }

    /** Contribution of this pair to the Mann-Kendall score. */
    public int contribution() { return contribution; }

    public PairSign negate() {
        if (this == NEGATIVE) return POSITIVE;
        if (this == POSITIVE) return NEGATIVE;
        return this;
    }

    public static PairSign of(double difference) {
        if (difference > 0) return POSITIVE;
        if (difference < 0) return NEGATIVE;
        return TIE;
    }
}
