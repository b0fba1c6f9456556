/* (C)2026 */
package com.ammann.trend.model;

import java.util.List;

/**
 * Sen's slope with its intercept, confidence bounds and the probability that the true
 * slope is negative.
 *
 * @param slope             median of the slope pool, {@code NaN} for an empty pool
 * @param intercept         intercept of the line through the median point
 * @param lowerCi           lower confidence bound
 * @param upperCi           upper confidence bound
 * @param senProbability    probability that the true slope is below zero
 * @param senProbabilityMax same, using the highest rank of zero among tied entries
 * @param senProbabilityMin same, using the lowest rank of zero among tied entries
 * @param poolSize          number of slopes the median was taken over
 * @param notes             advisories about the estimate
 */
public record SensSlopeEstimate(
        double slope,
        double intercept,
        double lowerCi,
        double upperCi,
        double senProbability,
        double senProbabilityMax,
        double senProbabilityMin,
        int poolSize,
        List<String> notes
) {

    public SensSlopeEstimate {
        notes = List.copyOf(notes);
    }

    public static SensSlopeEstimate undefined(List<String> notes) {
        return new SensSlopeEstimate(Double.NaN, Double.NaN, Double.NaN, Double.NaN,
                Double.NaN, Double.NaN, Double.NaN, 0, notes);
    }
}
