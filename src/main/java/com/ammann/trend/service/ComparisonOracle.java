/* (C)2026 */
package com.ammann.trend.service;

import com.ammann.trend.enumeration.CensorKind;
import com.ammann.trend.enumeration.PairSign;
import com.ammann.trend.model.ComparisonPolicy;
import com.ammann.trend.model.Observation;
import com.ammann.trend.model.PairResult;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Orders two observations under censoring.
 *
 * <p>The robust rules only decide a pair when the censored bounds prove the ordering:
 * <pre>
 *   a \ b   NONE              LEFT(Lb)           RIGHT(Lb)
 *   NONE    sign(vb - va)     va >= Lb : -1      va <= Lb : +1
 *   LEFT    vb >= La : +1     ambiguous          La <= Lb : +1
 *   RIGHT   vb <= La : -1     Lb <= La : -1      ambiguous
 * </pre>
 * Every undecided cell is {@link PairSign#AMBIGUOUS}. Under substitution the shadow
 * values of a resolved {@link ComparisonPolicy} are compared as plain numbers.
 */
@ApplicationScoped
public class ComparisonOracle
{

    /**
     * Sign of {@code b} relative to the earlier observation {@code a}.
     *
     * @throws IllegalStateException if a substitution policy meets right-censored data unresolved
     */
    public PairSign compare(Observation a, Observation b, ComparisonPolicy policy)
    {
        if (policy.isSubstitution()) {
            return PairSign.of(policy.rankValue(b) - policy.rankValue(a));
        }
        return compareRobust(a, b);
    }

    /** Robust case table; never fabricates a value for a censored member. */
    public PairSign compareRobust(Observation a, Observation b)
    {
        CensorKind ka = a.censorKind();
        CensorKind kb = b.censorKind();

        if (ka == CensorKind.NONE && kb == CensorKind.NONE) {
            return PairSign.of(b.value() - a.value());
        }
        if (ka == CensorKind.NONE) {
            if (kb == CensorKind.LEFT) {
                return a.value() >= b.detectionLimit() ? PairSign.NEGATIVE : PairSign.AMBIGUOUS;
            }
            return a.value() <= b.detectionLimit() ? PairSign.POSITIVE : PairSign.AMBIGUOUS;
        }
        if (kb == CensorKind.NONE) {
            // mirror of the rows above
            return compareRobust(b, a).negate();
        }
        if (ka == kb) {
            return PairSign.AMBIGUOUS;
        }
        if (ka == CensorKind.LEFT) {
            return a.detectionLimit() <= b.detectionLimit() ? PairSign.POSITIVE : PairSign.AMBIGUOUS;
        }
        return b.detectionLimit() <= a.detectionLimit() ? PairSign.NEGATIVE : PairSign.AMBIGUOUS;
    }

    /**
     * Evaluates sign and slope of the pair {@code (i, j)}.
     *
     * <p>The slope is {@code NaN} when the times are equal. Two censored observations
     * reporting the same bound have a zero slope. Otherwise a robust policy marks every
     * slope that involves a censored member as ambiguous, while substitution uses the
     * slope shadow values and only marks pairs the robust table cannot order.
     */
    public PairResult evaluate(int i, int j, Observation a, Observation b, ComparisonPolicy policy)
    {
        PairSign sign = compare(a, b, policy);
        boolean left = a.censorKind() == CensorKind.LEFT || b.censorKind() == CensorKind.LEFT;
        boolean right = a.censorKind() == CensorKind.RIGHT || b.censorKind() == CensorKind.RIGHT;
        boolean both = a.isCensored() && b.isCensored();

        double dt = b.time() - a.time();
        if (dt == 0.0) {
            return new PairResult(i, j, sign, Double.NaN, false, left, right, both);
        }
        if (a.sameCensorLevel(b)) {
            return new PairResult(i, j, sign, 0.0, false, left, right, both);
        }
        if (!a.isCensored() && !b.isCensored()) {
            return new PairResult(i, j, sign, (b.value() - a.value()) / dt, false, false, false, false);
        }

        if (!policy.isSubstitution()) {
            return new PairResult(i, j, sign, Double.NaN, true, left, right, both);
        }
        boolean ambiguous = compareRobust(a, b) == PairSign.AMBIGUOUS;
        double slope = ambiguous ? Double.NaN : (policy.slopeValue(b) - policy.slopeValue(a)) / dt;
        return new PairResult(i, j, sign, slope, ambiguous, left, right, both);
    }
}
