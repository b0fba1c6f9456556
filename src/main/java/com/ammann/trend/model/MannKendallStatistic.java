/* (C)2026 */
package com.ammann.trend.model;

import java.util.List;

/**
 * Mann-Kendall score of one group of observations together with the tie bookkeeping
 * needed to pool several groups.
 *
 * @param s                   sum of pair signs over pairs with distinct times
 * @param varS                tie-corrected variance of {@code s}
 * @param z                   continuity-corrected normal score
 * @param p                   two-sided p-value
 * @param tau                 Kendall's tau-b
 * @param tauDenominator      {@code sqrt((n0 - n1)(n0 - n2))}, summed when seasons are pooled
 * @param ambiguousPairs      pairs whose ordering could not be decided
 * @param leftAmbiguousPairs  ambiguous pairs touching a left-censored value
 * @param rightAmbiguousPairs ambiguous pairs touching a right-censored value
 * @param tiedTimePairs       pairs excluded from {@code s} because their times are equal
 * @param n                   number of observations in the group
 * @param notes               advisories raised while computing the statistic
 */
public record MannKendallStatistic(
        long s,
        double varS,
        double z,
        double p,
        double tau,
        double tauDenominator,
        long ambiguousPairs,
        long leftAmbiguousPairs,
        long rightAmbiguousPairs,
        long tiedTimePairs,
        int n,
        List<String> notes
) {

    public static final String NOTE_ZERO_VARIANCE = "variance of S is zero; Z set to 0 and p to 1";
    public static final String NOTE_TAU_DENOMINATOR = "Denominator near zero in Tau calculation";

    public MannKendallStatistic {
        notes = List.copyOf(notes);
    }
}
