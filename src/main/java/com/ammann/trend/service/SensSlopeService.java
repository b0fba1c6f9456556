/* (C)2026 */
package com.ammann.trend.service;

import com.ammann.trend.enumeration.CiMethod;
import com.ammann.trend.enumeration.SensSlopeMethod;
import com.ammann.trend.model.ComparisonPolicy;
import com.ammann.trend.model.Observation;
import com.ammann.trend.model.SensSlopeEstimate;
import com.ammann.trend.model.SlopePool;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.jboss.logging.Logger;

/**
 * Sen's slope estimator: median of the pairwise slope pool, intercept through the median
 * point, rank-based confidence interval and the probability that the true slope is
 * negative.
 */
@ApplicationScoped
public class SensSlopeService
{
    private static final Logger LOG = Logger.getLogger(SensSlopeService.class);

    public static final String NOTE_EMPTY_POOL = "no valid pairwise slopes; Sen slope undefined";
    public static final String NOTE_CI_UNDEFINED = "confidence interval undefined: no slopes or invalid variance";
    public static final String NOTE_CI_LOWER_OUT_OF_RANGE =
            "lower confidence limit rank outside the slope pool for the requested alpha";
    public static final String NOTE_CI_UPPER_OUT_OF_RANGE =
            "upper confidence limit rank outside the slope pool for the requested alpha";

    public static final String NOTE_TIED_NON_CENSORED = "WARNING: Sen slope based on tied non-censored values";
    public static final String NOTE_TWO_CENSORED = "CRITICAL: Sen slope is based on a pair of two censored values.";
    public static final String NOTE_LEFT_CENSORED = "WARNING: Sen slope influenced by left-censored values.";
    public static final String NOTE_RIGHT_CENSORED = "WARNING: Sen slope influenced by right-censored values.";
    public static final String NOTE_BOTH_CENSORED =
            "WARNING: Sen slope influenced by left- and right-censored values.";

    private final ComparisonOracle oracle;

    @Inject
    public SensSlopeService(ComparisonOracle oracle)
    {
        this.oracle = oracle;
    }

    /**
     * Draws a seeded random sample of pairs instead of the full O(n^2) pool.
     *
     * <p>Pairs are drawn with replacement; pairs sharing a timestamp are drawn but add no
     * slope. When the series has no more pairs than {@code maxPairs} every pair is used.
     *
     * @param series   time-sorted observations
     * @param policy   resolved comparison policy
     * @param method   treatment of ambiguous slopes
     * @param maxPairs number of pairs to draw
     * @param random   seeded generator shared by all strata of one analysis
     * @return the sampled pool
     */
    public SlopePool samplePool(List<Observation> series, ComparisonPolicy policy, SensSlopeMethod method,
                                long maxPairs, Random random)
    {
        int n = series.size();
        long totalPairs = (long) n * (n - 1) / 2;
        if (totalPairs <= maxPairs) {
            return fullPool(series, policy, method);
        }

        int draws = (int) Math.min(maxPairs, Integer.MAX_VALUE - 8);
        SlopePool.Builder pool = SlopePool.builder(draws);
        for (int k = 0; k < draws; k++) {
            int i = random.nextInt(n);
            int j = random.nextInt(n - 1);
            if (j >= i) {
                j++;
            } else {
                int swap = i;
                i = j;
                j = swap;
            }
            Observation a = series.get(i);
            Observation b = series.get(j);
            if (a.time() == b.time()) {
                continue;
            }
            pool.addPair(oracle.evaluate(i, j, a, b, policy), method);
        }
        LOG.debugf("Sampled %d of %d pairs, %d slopes kept", draws, totalPairs, pool.size());
        return pool.build();
    }

    /** Every distinct-time pair of the series. */
    public SlopePool fullPool(List<Observation> series, ComparisonPolicy policy, SensSlopeMethod method)
    {
        int n = series.size();
        SlopePool.Builder pool = SlopePool.builder((int) Math.min((long) n * (n - 1) / 2, 1 << 20));
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                Observation a = series.get(i);
                Observation b = series.get(j);
                if (a.time() != b.time()) {
                    pool.addPair(oracle.evaluate(i, j, a, b, policy), method);
                }
            }
        }
        return pool.build();
    }

    /**
     * Computes Sen's slope from a pool.
     *
     * @param pool     slope pool of the analysis (union of season pools when seasonal)
     * @param series   observations, used for the intercept
     * @param varS     variance of S, used by the confidence interval and the probabilities
     * @param alpha    significance level of the interval
     * @param ciMethod rank selection rule of the interval
     * @return the estimate; an empty pool yields {@code NaN} fields and a note
     */
    public SensSlopeEstimate estimate(SlopePool pool, List<Observation> series, double varS,
                                      double alpha, CiMethod ciMethod)
    {
        List<String> notes = new ArrayList<>();
        if (pool == null || pool.isEmpty()) {
            notes.add(NOTE_EMPTY_POOL);
            notes.add(NOTE_CI_UNDEFINED);
            return SensSlopeEstimate.undefined(notes);
        }

        SlopePool sorted = pool.sortedEntries();
        double[] slopes = sorted.slopes();
        int size = slopes.length;
        double slope = sortedMedian(slopes);
        double intercept = intercept(series, slope);

        double[] ci = confidenceInterval(slopes, varS, alpha, ciMethod, notes);

        double probability = Double.NaN;
        double probabilityMax = Double.NaN;
        double probabilityMin = Double.NaN;
        if (Double.isFinite(varS) && varS > 0) {
            double sd = Math.sqrt(varS);
            probability = normalCdf((2 * rankOfZero(slopes, RankTie.MEDIAN) - size) / sd);
            probabilityMax = normalCdf((2 * rankOfZero(slopes, RankTie.MAX) - size) / sd);
            probabilityMin = normalCdf((2 * rankOfZero(slopes, RankTie.MIN) - size) / sd);
        }

        String slopeNote = slopeNote(sorted, slope);
        if (slopeNote != null) {
            notes.add(slopeNote);
        }

        LOG.debugf("Sen slope %.6g from %d slopes, CI [%.6g, %.6g]", slope, size, ci[0], ci[1]);
        return new SensSlopeEstimate(slope, intercept, ci[0], ci[1],
                probability, probabilityMax, probabilityMin, size, notes);
    }

    /** {@code median(faceValue) - median(time) * slope}. */
    public double intercept(List<Observation> series, double slope)
    {
        if (series.isEmpty() || Double.isNaN(slope)) {
            return Double.NaN;
        }
        double[] values = series.stream().mapToDouble(Observation::faceValue).toArray();
        double[] times = series.stream().mapToDouble(Observation::time).toArray();
        Median median = new Median();
        return median.evaluate(values) - median.evaluate(times) * slope;
    }

    /**
     * Confidence interval of the slope.
     *
     * <p>With {@code C = Z(1 - alpha/2) * sqrt(varS)} and {@code N} slopes, DIRECT takes the
     * 1-indexed ranks {@code floor((N - C)/2)} and {@code ceil((N + C)/2) + 1}; a rank one
     * position outside {@code [1, N]} is clamped, a rank further out gives {@code NaN}.
     * LWP interpolates the ranks {@code (N -/+ C)/2} and falls back to the pool extremes.
     */
    double[] confidenceInterval(double[] sortedSlopes, double varS, double alpha, CiMethod method, List<String> notes)
    {
        int size = sortedSlopes.length;
        if (size == 0 || !Double.isFinite(varS) || varS < 0) {
            notes.add(NOTE_CI_UNDEFINED);
            return new double[] {Double.NaN, Double.NaN};
        }
        double c = MannKendallService.STANDARD_NORMAL.inverseCumulativeProbability(1.0 - alpha / 2.0) * Math.sqrt(varS);

        if (method == CiMethod.LWP) {
            double lowerRank = (size - c) / 2.0;
            double upperRank = (size + c) / 2.0;
            double lower = interpolateRank(sortedSlopes, lowerRank);
            double upper = interpolateRank(sortedSlopes, upperRank);
            return new double[] {
                    Double.isNaN(lower) ? sortedSlopes[0] : lower,
                    Double.isNaN(upper) ? sortedSlopes[size - 1] : upper
            };
        }

        long lowerRank = (long) Math.floor((size - c) / 2.0);
        long upperRank = (long) Math.ceil((size + c) / 2.0) + 1;

        double lower;
        if (lowerRank >= 1 && lowerRank <= size) {
            lower = sortedSlopes[(int) lowerRank - 1];
        } else if (lowerRank == 0) {
            lower = sortedSlopes[0];
        } else {
            notes.add(NOTE_CI_LOWER_OUT_OF_RANGE);
            lower = Double.NaN;
        }

        double upper;
        if (upperRank >= 1 && upperRank <= size) {
            upper = sortedSlopes[(int) upperRank - 1];
        } else if (upperRank == size + 1) {
            upper = sortedSlopes[size - 1];
        } else {
            notes.add(NOTE_CI_UPPER_OUT_OF_RANGE);
            upper = Double.NaN;
        }
        return new double[] {lower, upper};
    }

    /** Linear interpolation at a 1-indexed fractional rank; {@code NaN} outside {@code [1, N]}. */
    static double interpolateRank(double[] sorted, double rank)
    {
        int size = sorted.length;
        if (Double.isNaN(rank) || rank < 1.0 || rank > size) {
            return Double.NaN;
        }
        int lowerIndex = (int) Math.floor(rank) - 1;
        double fraction = rank - Math.floor(rank);
        if (lowerIndex >= size - 1 || fraction == 0.0) {
            return sorted[lowerIndex];
        }
        return sorted[lowerIndex] + fraction * (sorted[lowerIndex + 1] - sorted[lowerIndex]);
    }

    enum RankTie { MEDIAN, MAX, MIN }

    /**
     * 1-indexed rank of zero in the sorted pool, interpolated between neighbouring slopes.
     * Equal slopes collapse to one point whose rank is the median, maximum or minimum of
     * their ranks. A pool without non-negative slopes ranks zero last, a pool without
     * non-positive slopes ranks it first.
     */
    static double rankOfZero(double[] sorted, RankTie tie)
    {
        int size = sorted.length;
        if (sorted[size - 1] < 0) {
            return size;
        }
        if (sorted[0] > 0) {
            return 1;
        }

        List<double[]> points = new ArrayList<>();
        int start = 0;
        while (start < size) {
            int end = start;
            while (end + 1 < size && sorted[end + 1] == sorted[start]) {
                end++;
            }
            double firstRank = start + 1;
            double lastRank = end + 1;
            double rank = switch (tie) {
                case MEDIAN -> (firstRank + lastRank) / 2.0;
                case MAX -> lastRank;
                case MIN -> firstRank;
            };
            points.add(new double[] {sorted[start], rank});
            start = end + 1;
        }

        for (int k = 0; k < points.size(); k++) {
            double[] point = points.get(k);
            if (point[0] == 0.0) {
                return point[1];
            }
            if (point[0] > 0.0) {
                double[] previous = points.get(k - 1);
                double fraction = (0.0 - previous[0]) / (point[0] - previous[0]);
                return previous[1] + fraction * (point[1] - previous[1]);
            }
        }
        return size;
    }

    /**
     * Advisory describing which pairs produced the median. Every entry equal to one of the
     * middle slopes is inspected.
     *
     * @return the note, or {@code null} when the median comes from uncensored, non-tied pairs
     */
    static String slopeNote(SlopePool sorted, double median)
    {
        int size = sorted.size();
        if (size == 0 || Double.isNaN(median)) {
            return null;
        }
        double lowMiddle = sorted.slopeAt((size - 1) / 2);
        double highMiddle = sorted.slopeAt(size / 2);

        boolean anyCensored = false;
        boolean allBothCensored = true;
        boolean left = false;
        boolean right = false;
        for (int k = 0; k < size; k++) {
            double value = sorted.slopeAt(k);
            if (value != lowMiddle && value != highMiddle) {
                continue;
            }
            byte flags = sorted.flagsAt(k);
            boolean censored = (flags & (SlopePool.LEFT | SlopePool.RIGHT)) != 0;
            anyCensored |= censored;
            allBothCensored &= (flags & SlopePool.BOTH_CENSORED) != 0;
            left |= (flags & SlopePool.LEFT) != 0;
            right |= (flags & SlopePool.RIGHT) != 0;
        }

        if (!anyCensored) {
            return median == 0.0 ? NOTE_TIED_NON_CENSORED : null;
        }
        if (allBothCensored) {
            return NOTE_TWO_CENSORED;
        }
        if (left && right) {
            return NOTE_BOTH_CENSORED;
        }
        return left ? NOTE_LEFT_CENSORED : NOTE_RIGHT_CENSORED;
    }

    static double sortedMedian(double[] sorted)
    {
        int size = sorted.length;
        if (size == 0) {
            return Double.NaN;
        }
        if (size % 2 == 1) {
            return sorted[size / 2];
        }
        return (sorted[size / 2 - 1] + sorted[size / 2]) / 2.0;
    }

    private static double normalCdf(double x)
    {
        return MannKendallService.STANDARD_NORMAL.cumulativeProbability(x);
    }
}
