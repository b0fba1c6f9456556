/* (C)2026 */
package com.ammann.trend.model;

import com.ammann.trend.enumeration.PairSign;

/**
 * Comparison of the observations at positions {@code i < j} of a time-sorted series.
 *
 * @param i              index of the earlier observation
 * @param j              index of the later observation
 * @param sign           ordering of the later value against the earlier one
 * @param slope          value change per time unit, {@code NaN} for equal times or ambiguous slopes
 * @param slopeAmbiguous the slope magnitude cannot be identified from the censored bounds
 * @param leftInvolved   at least one member is left-censored
 * @param rightInvolved  at least one member is right-censored
 * @param bothCensored   both members are censored
 */
public record PairResult(
        int i,
        int j,
        PairSign sign,
        double slope,
        boolean slopeAmbiguous,
        boolean leftInvolved,
        boolean rightInvolved,
        boolean bothCensored
) {

    public boolean isAmbiguous() {
        return sign == PairSign.AMBIGUOUS;
    }

    public boolean hasSlope() {
        return !Double.isNaN(slope) || slopeAmbiguous;
    }
}
