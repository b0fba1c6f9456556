/* (C)2026 */
package com.ammann.trend.model;

import com.ammann.trend.enumeration.SensSlopeMethod;
import java.util.Arrays;
import java.util.Collection;

/**
 * Multiset of pairwise slopes with the censoring provenance of every entry.
 *
 * <p>Entries are unordered; {@link #sortedEntries()} returns a copy ordered by slope
 * together with the matching flags, which is what the median, confidence interval and
 * slope advisories read.
 */
public final class SlopePool {

    public static final byte LEFT = 1;
    public static final byte RIGHT = 1 << 1;
    public static final byte BOTH_CENSORED = 1 << 2;
    public static final byte AMBIGUOUS = 1 << 3;

    private static final SlopePool EMPTY = new SlopePool(new double[0], new byte[0], 0);

    private final double[] slopes;
    private final byte[] flags;
    private final long candidatePairs;

    private SlopePool(double[] slopes, byte[] flags, long candidatePairs) {
        this.slopes = slopes;
        this.flags = flags;
        this.candidatePairs = candidatePairs;
    }

    public static SlopePool empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder(16);
    }

    public static Builder builder(int expectedSize) {
        return new Builder(expectedSize);
    }

    /** Union of several pools, used for chunked scans and seasonal pooling. */
    public static SlopePool union(Collection<SlopePool> pools) {
        int total = pools.stream().mapToInt(SlopePool::size).sum();
        Builder builder = new Builder(total);
        for (SlopePool pool : pools) {
            builder.addAll(pool);
        }
        return builder.build();
    }

    public int size() {
        return slopes.length;
    }

    public boolean isEmpty() {
        return slopes.length == 0;
    }

    /** Distinct-time pairs that were examined, including the ones dropped as ambiguous. */
    public long candidatePairs() {
        return candidatePairs;
    }

    public double slopeAt(int index) {
        return slopes[index];
    }

    public byte flagsAt(int index) {
        return flags[index];
    }

    public double[] slopes() {
        return slopes.clone();
    }

    /** Copy of the pool ordered by slope; flags follow their slopes. */
    public SlopePool sortedEntries() {
        double[] sortedSlopes = slopes.clone();
        Arrays.sort(sortedSlopes);

        // equal slopes receive their flags in insertion order
        byte[] sortedFlags = new byte[flags.length];
        int[] filled = new int[slopes.length];
        for (int k = 0; k < slopes.length; k++) {
            int first = firstIndexOf(sortedSlopes, slopes[k]);
            sortedFlags[first + filled[first]++] = flags[k];
        }
        return new SlopePool(sortedSlopes, sortedFlags, candidatePairs);
    }

    private static int firstIndexOf(double[] sorted, double slope) {
        int low = 0;
        int high = sorted.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (Double.compare(sorted[mid], slope) < 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    public static byte flagsOf(PairResult pair) {
        byte f = 0;
        if (pair.leftInvolved()) f |= LEFT;
        if (pair.rightInvolved()) f |= RIGHT;
        if (pair.bothCensored()) f |= BOTH_CENSORED;
        if (pair.slopeAmbiguous()) f |= AMBIGUOUS;
        return f;
    }

    @Override
    public String toString() {
        return "SlopePool[size=" + slopes.length + ", candidatePairs=" + candidatePairs + "]";
    }

    /**
     * Growable accumulator. Not thread-safe; parallel scans use one builder per chunk and
     * {@link SlopePool#union(Collection) union} the results.
     */
    public static final class Builder {

        private double[] slopes;
        private byte[] flags;
        private int size;
        private long candidatePairs;

        private Builder(int expectedSize) {
            int capacity = Math.max(expectedSize, 4);
            this.slopes = new double[capacity];
            this.flags = new byte[capacity];
        }

        public Builder add(double slope, byte entryFlags) {
            if (size == slopes.length) {
                int capacity = slopes.length * 2;
                slopes = Arrays.copyOf(slopes, capacity);
                flags = Arrays.copyOf(flags, capacity);
            }
            slopes[size] = slope;
            flags[size] = entryFlags;
            size++;
            return this;
        }

        /**
         * Adds the slope of a distinct-time pair; ambiguous slopes are dropped under
         * {@link SensSlopeMethod#NAN} and kept as zero under {@link SensSlopeMethod#LWP}.
         * Equal-time pairs are ignored.
         */
        public Builder addPair(PairResult pair, SensSlopeMethod method) {
            if (!pair.hasSlope()) {
                return this;
            }
            candidatePairs++;
            if (!pair.slopeAmbiguous()) {
                return add(pair.slope(), flagsOf(pair));
            }
            if (method == SensSlopeMethod.LWP) {
                add(0.0, flagsOf(pair));
            }
            return this;
        }

        public Builder addAll(SlopePool pool) {
            for (int k = 0; k < pool.size(); k++) {
                add(pool.slopes[k], pool.flags[k]);
            }
            candidatePairs += pool.candidatePairs;
            return this;
        }

        public int size() {
            return size;
        }

        public SlopePool build() {
            return new SlopePool(Arrays.copyOf(slopes, size), Arrays.copyOf(flags, size), candidatePairs);
        }
    }
}
