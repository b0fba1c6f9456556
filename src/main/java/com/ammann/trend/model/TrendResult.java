/* (C)2026 */
package com.ammann.trend.model;

import com.ammann.trend.enumeration.ComputationMode;
import com.ammann.trend.enumeration.TrendDirection;
import java.util.List;

/**
 * Outcome of one trend analysis. The shape is the same for every path; statistics that
 * could not be computed are {@code NaN}.
 *
 * @param s                    Mann-Kendall score
 * @param varS                 tie-corrected variance of S
 * @param z                    continuity-corrected normal score
 * @param p                    two-sided p-value
 * @param tau                  Kendall's tau-b
 * @param slope                Sen's slope per time unit of the input axis
 * @param intercept            intercept of the Sen line
 * @param lowerCi              lower confidence bound of the slope
 * @param upperCi              upper confidence bound of the slope
 * @param confidence           {@code 1 - p/2}, confidence in the detected direction
 * @param confidenceDecreasing confidence that the trend is decreasing
 * @param direction            sign of S
 * @param significant          {@code p < alpha}
 * @param classification       likelihood label with direction word
 * @param notes                data-quality advisories in the order they were raised
 * @param n                    observations analysed
 * @param nCensored            censored observations
 * @param nUniqueCensorLevels  distinct (kind, limit) censor levels
 * @param alpha                significance level used
 * @param propCensored         share of censored observations
 * @param propUnique           share of distinct face values
 * @param senProbability       probability that the true slope is below zero
 * @param senProbabilityMax    same, highest tie rank
 * @param senProbabilityMin    same, lowest tie rank
 * @param ambiguousPairs       pairs whose ordering could not be decided
 * @param leftAmbiguousPairs   ambiguous pairs touching a left-censored value
 * @param rightAmbiguousPairs  ambiguous pairs touching a right-censored value
 * @param tiedTimePairs        pairs sharing a timestamp
 * @param computationMode      whether every slope pair was evaluated
 * @param pairsUsed            slope pairs drawn in FAST mode, {@code null} otherwise
 * @param seasonsSkipped       season keys dropped for having too few observations
 * @param seasonCount          seasons that contributed to the result, 0 when not seasonal
 * @param scaledSlope          slope expressed per {@code slopeUnits}, {@code NaN} without scaling
 * @param slopeUnits           unit label of {@code scaledSlope}, {@code null} without scaling
 * @param scaledLowerCi        lower bound in scaled units
 * @param scaledUpperCi        upper bound in scaled units
 */
public record TrendResult(
        double s,
        double varS,
        double z,
        double p,
        double tau,
        double slope,
        double intercept,
        double lowerCi,
        double upperCi,
        double confidence,
        double confidenceDecreasing,
        TrendDirection direction,
        boolean significant,
        String classification,
        List<String> notes,
        int n,
        int nCensored,
        int nUniqueCensorLevels,
        double alpha,
        double propCensored,
        double propUnique,
        double senProbability,
        double senProbabilityMax,
        double senProbabilityMin,
        long ambiguousPairs,
        long leftAmbiguousPairs,
        long rightAmbiguousPairs,
        long tiedTimePairs,
        ComputationMode computationMode,
        Long pairsUsed,
        List<Integer> seasonsSkipped,
        int seasonCount,
        double scaledSlope,
        String slopeUnits,
        double scaledLowerCi,
        double scaledUpperCi
) {

    public static final String INSUFFICIENT_DATA = "Insufficient Data";

    public TrendResult {
        notes = List.copyOf(notes);
        seasonsSkipped = seasonsSkipped == null ? List.of() : List.copyOf(seasonsSkipped);
    }

    public boolean isSeasonal() {
        return seasonCount > 0;
    }
}
