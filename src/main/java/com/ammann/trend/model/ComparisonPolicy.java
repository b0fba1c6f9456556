/* (C)2026 */
package com.ammann.trend.model;

import com.ammann.trend.enumeration.CensorKind;
import com.ammann.trend.enumeration.ComparisonMethod;
import com.ammann.trend.enumeration.TieBreakMethod;
import java.util.List;

/**
 * Rules for ordering and differencing censored observations.
 *
 * <p>Under {@link ComparisonMethod#SUBSTITUTION} every censored value is replaced by a
 * numeric shadow: left-censored values by {@code limit * ltMult}, right-censored values by
 * one constant placed just above the largest value of the series. That constant depends on
 * the whole series, so a substitution policy must be {@link #resolveFor(List) resolved}
 * once per analysis before pairs are compared.
 *
 * @param method                how pairs are ordered
 * @param ltMult                multiplier applied to left-censored limits
 * @param gtMult                multiplier applied to right-censored limits in slope values
 * @param tieBreak              increment rule for the right-censored substitute
 * @param rightCensorSubstitute resolved substitute, {@code NaN} until resolved
 */
public record ComparisonPolicy(
        ComparisonMethod method,
        double ltMult,
        double gtMult,
        TieBreakMethod tieBreak,
        double rightCensorSubstitute
) {

    public static final double DEFAULT_LT_MULT = 0.5;
    public static final double DEFAULT_GT_MULT = 1.0;

    public ComparisonPolicy {
        if (method == null) {
            throw new IllegalArgumentException("Comparison method must not be null");
        }
        if (tieBreak == null) {
            tieBreak = TieBreakMethod.STANDARD;
        }
        if (!Double.isFinite(ltMult) || ltMult < 0) {
            throw new IllegalArgumentException("ltMult must be a finite, non-negative number, got " + ltMult);
        }
        if (!Double.isFinite(gtMult) || gtMult < 0) {
            throw new IllegalArgumentException("gtMult must be a finite, non-negative number, got " + gtMult);
        }
    }

    public static ComparisonPolicy robust() {
        return new ComparisonPolicy(ComparisonMethod.ROBUST, DEFAULT_LT_MULT, DEFAULT_GT_MULT,
                TieBreakMethod.STANDARD, Double.NaN);
    }

    public static ComparisonPolicy substitution(double ltMult, double gtMult) {
        return new ComparisonPolicy(ComparisonMethod.SUBSTITUTION, ltMult, gtMult,
                TieBreakMethod.STANDARD, Double.NaN);
    }

    public static ComparisonPolicy of(ComparisonMethod method, double ltMult, double gtMult, TieBreakMethod tieBreak) {
        return new ComparisonPolicy(method, ltMult, gtMult, tieBreak, Double.NaN);
    }

    public boolean isSubstitution() {
        return method == ComparisonMethod.SUBSTITUTION;
    }

    public boolean isResolved() {
        return !isSubstitution() || !Double.isNaN(rightCensorSubstitute);
    }

    /**
     * Fixes the right-censored substitute for one series. Robust policies are returned
     * unchanged.
     *
     * @param series observations of the analysis
     * @return policy whose shadow values are fully determined
     */
    public ComparisonPolicy resolveFor(List<Observation> series) {
        if (!isSubstitution()) {
            return this;
        }
        double[] values = series.stream()
                .filter(Observation::isFinite)
                .mapToDouble(o -> o.censorKind() == CensorKind.LEFT ? o.detectionLimit() * ltMult : o.faceValue())
                .sorted()
                .toArray();
        if (values.length == 0) {
            return new ComparisonPolicy(method, ltMult, gtMult, tieBreak, 0.0);
        }

        double max = values[values.length - 1];
        double smallestGap = Double.POSITIVE_INFINITY;
        for (int i = 1; i < values.length; i++) {
            double gap = values[i] - values[i - 1];
            if (gap > 0 && gap < smallestGap) {
                smallestGap = gap;
            }
        }
        // a single distinct value leaves no gap to scale; fall back to a unit gap
        double gap = Double.isInfinite(smallestGap) ? 1.0 : smallestGap;
        double increment = gap * tieBreak.getGapFraction();

        return new ComparisonPolicy(method, ltMult, gtMult, tieBreak, max + increment);
    }

    /**
     * Numeric stand-in used to order an observation under substitution.
     *
     * @throws IllegalStateException if a right-censored value meets an unresolved policy
     */
    public double rankValue(Observation observation) {
        return switch (observation.censorKind()) {
            case NONE -> observation.value();
            case LEFT -> observation.detectionLimit() * ltMult;
            case RIGHT -> {
                if (Double.isNaN(rightCensorSubstitute)) {
                    throw new IllegalStateException(
                            "Substitution policy must be resolved for the series before comparing right-censored values");
                }
                yield rightCensorSubstitute;
            }
        };
    }

    /** Numeric stand-in used for slope magnitudes under substitution. */
    public double slopeValue(Observation observation) {
        return switch (observation.censorKind()) {
            case NONE -> observation.value();
            case LEFT -> observation.detectionLimit() * ltMult;
            case RIGHT -> observation.detectionLimit() * gtMult;
        };
    }

    @Override
    public String toString() {
        return "ComparisonPolicy[" + method + ", ltMult=" + ltMult + ", gtMult=" + gtMult
                + ", tieBreak=" + tieBreak
                + (isSubstitution() ? ", rightSubstitute=" + rightCensorSubstitute : "") + "]";
    }
}
