/* (C)2026 */
package com.ammann.trend.model;

import com.ammann.trend.enumeration.CiMethod;
import com.ammann.trend.enumeration.ComparisonMethod;
import com.ammann.trend.enumeration.LargeDatasetMode;
import com.ammann.trend.enumeration.SeasonType;
import com.ammann.trend.enumeration.SensSlopeMethod;
import com.ammann.trend.enumeration.TieBreakMethod;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable settings of one trend analysis.
 *
 * <p>Every component receives the same instance; there are no module-level defaults.
 * The robust comparison is the default path, the {@code LWP} options emulate the
 * LWP-TRENDS R script.
 */
public final class AnalysisConfig {

    public static final double DEFAULT_ALPHA = 0.05;
    public static final int DEFAULT_MIN_SIZE = 10;
    public static final int DEFAULT_MIN_SIZE_PER_SEASON = 5;
    public static final int DEFAULT_MIN_SEASON_OBSERVATIONS = 2;
    public static final int DEFAULT_LARGE_DATASET_THRESHOLD = 5000;
    public static final long DEFAULT_MAX_PAIRS = 1_000_000L;
    public static final long DEFAULT_RANDOM_SEED = 42L;

    private static final Set<ChronoUnit> SCALING_UNITS = EnumSet.of(
            ChronoUnit.SECONDS, ChronoUnit.MINUTES, ChronoUnit.HOURS, ChronoUnit.DAYS,
            ChronoUnit.WEEKS, ChronoUnit.MONTHS, ChronoUnit.YEARS);

    private final ComparisonMethod mkTestMethod;
    private final SensSlopeMethod sensSlopeMethod;
    private final CiMethod ciMethod;
    private final TieBreakMethod tieBreakMethod;
    private final double alpha;
    private final double ltMult;
    private final double gtMult;
    private final boolean hicensor;
    private final Double hicensorLimit;
    private final SeasonType seasonType;
    private final int period;
    private final Integer minSize;
    private final Integer minSizePerSeason;
    private final int minSeasonObservations;
    private final ConfidenceCategories categories;
    private final boolean strict;
    private final LargeDatasetMode largeDatasetMode;
    private final int largeDatasetThreshold;
    private final long maxPairs;
    private final long randomSeed;
    private final ChronoUnit slopeScaling;
    private final String valueUnit;

    private AnalysisConfig(Builder b) {
        this.mkTestMethod = b.mkTestMethod;
        this.sensSlopeMethod = b.sensSlopeMethod;
        this.ciMethod = b.ciMethod;
        this.tieBreakMethod = b.tieBreakMethod;
        this.alpha = b.alpha;
        this.ltMult = b.ltMult;
        this.gtMult = b.gtMult;
        this.hicensor = b.hicensor;
        this.hicensorLimit = b.hicensorLimit;
        this.seasonType = b.seasonType;
        this.period = b.period;
        this.minSize = b.minSize;
        this.minSizePerSeason = b.minSizePerSeason;
        this.minSeasonObservations = b.minSeasonObservations;
        this.categories = b.categories;
        this.strict = b.strict;
        this.largeDatasetMode = b.largeDatasetMode;
        this.largeDatasetThreshold = b.largeDatasetThreshold;
        this.maxPairs = b.maxPairs;
        this.randomSeed = b.randomSeed;
        this.slopeScaling = b.slopeScaling;
        this.valueUnit = b.valueUnit;
    }

    public static AnalysisConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder pre-filled with the values of this configuration. */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.mkTestMethod = mkTestMethod;
        b.sensSlopeMethod = sensSlopeMethod;
        b.ciMethod = ciMethod;
        b.tieBreakMethod = tieBreakMethod;
        b.alpha = alpha;
        b.ltMult = ltMult;
        b.gtMult = gtMult;
        b.hicensor = hicensor;
        b.hicensorLimit = hicensorLimit;
        b.seasonType = seasonType;
        b.period = period;
        b.minSize = minSize;
        b.minSizePerSeason = minSizePerSeason;
        b.minSeasonObservations = minSeasonObservations;
        b.categories = categories;
        b.strict = strict;
        b.largeDatasetMode = largeDatasetMode;
        b.largeDatasetThreshold = largeDatasetThreshold;
        b.maxPairs = maxPairs;
        b.randomSeed = randomSeed;
        b.slopeScaling = slopeScaling;
        b.valueUnit = valueUnit;
        return b;
    }

    /** Unresolved comparison policy derived from the method, multipliers and tie break. */
    public ComparisonPolicy comparisonPolicy() {
        return ComparisonPolicy.of(mkTestMethod, ltMult, gtMult, tieBreakMethod);
    }

    public ComparisonMethod getMkTestMethod() { return mkTestMethod; }
    public SensSlopeMethod getSensSlopeMethod() { return sensSlopeMethod; }
    public CiMethod getCiMethod() { return ciMethod; }
    public TieBreakMethod getTieBreakMethod() { return tieBreakMethod; }
    public double getAlpha() { return alpha; }
    public double getLtMult() { return ltMult; }
    public double getGtMult() { return gtMult; }
    public boolean isHicensor() { return hicensor; }
    public Double getHicensorLimit() { return hicensorLimit; }
    public SeasonType getSeasonType() { return seasonType; }
    public int getPeriod() { return period; }
    public Integer getMinSize() { return minSize; }
    public Integer getMinSizePerSeason() { return minSizePerSeason; }
    public int getMinSeasonObservations() { return minSeasonObservations; }
    public ConfidenceCategories getCategories() { return categories; }
    public boolean isStrict() { return strict; }
    public LargeDatasetMode getLargeDatasetMode() { return largeDatasetMode; }
    public int getLargeDatasetThreshold() { return largeDatasetThreshold; }
    public long getMaxPairs() { return maxPairs; }
    public long getRandomSeed() { return randomSeed; }
    public ChronoUnit getSlopeScaling() { return slopeScaling; }
    public String getValueUnit() { return valueUnit; }

    @Override
    public String toString() {
        return "AnalysisConfig[mk=" + mkTestMethod + ", sens=" + sensSlopeMethod + ", ci=" + ciMethod
                + ", tieBreak=" + tieBreakMethod + ", alpha=" + alpha + ", ltMult=" + ltMult
                + ", gtMult=" + gtMult + ", hicensor=" + hicensor + ", season=" + seasonType
                + ", period=" + period + ", mode=" + largeDatasetMode + "]";
    }

    public static final class Builder {

        private ComparisonMethod mkTestMethod = ComparisonMethod.ROBUST;
        private SensSlopeMethod sensSlopeMethod = SensSlopeMethod.NAN;
        private CiMethod ciMethod = CiMethod.DIRECT;
        private TieBreakMethod tieBreakMethod = TieBreakMethod.STANDARD;
        private double alpha = DEFAULT_ALPHA;
        private double ltMult = ComparisonPolicy.DEFAULT_LT_MULT;
        private double gtMult = ComparisonPolicy.DEFAULT_GT_MULT;
        private boolean hicensor;
        private Double hicensorLimit;
        private SeasonType seasonType = SeasonType.MONTH;
        private int period = 12;
        private Integer minSize = DEFAULT_MIN_SIZE;
        private Integer minSizePerSeason = DEFAULT_MIN_SIZE_PER_SEASON;
        private int minSeasonObservations = DEFAULT_MIN_SEASON_OBSERVATIONS;
        private ConfidenceCategories categories = ConfidenceCategories.DEFAULT;
        private boolean strict;
        private LargeDatasetMode largeDatasetMode = LargeDatasetMode.AUTO;
        private int largeDatasetThreshold = DEFAULT_LARGE_DATASET_THRESHOLD;
        private long maxPairs = DEFAULT_MAX_PAIRS;
        private long randomSeed = DEFAULT_RANDOM_SEED;
        private ChronoUnit slopeScaling;
        private String valueUnit;

        private Builder() {}

        public Builder mkTestMethod(ComparisonMethod value) { this.mkTestMethod = value; return this; }
        public Builder sensSlopeMethod(SensSlopeMethod value) { this.sensSlopeMethod = value; return this; }
        public Builder ciMethod(CiMethod value) { this.ciMethod = value; return this; }
        public Builder tieBreakMethod(TieBreakMethod value) { this.tieBreakMethod = value; return this; }
        public Builder alpha(double value) { this.alpha = value; return this; }
        public Builder ltMult(double value) { this.ltMult = value; return this; }
        public Builder gtMult(double value) { this.gtMult = value; return this; }
        public Builder hicensor(boolean value) { this.hicensor = value; return this; }
        public Builder hicensorLimit(Double value) { this.hicensorLimit = value; return this; }
        public Builder seasonType(SeasonType value) { this.seasonType = value; return this; }
        public Builder period(int value) { this.period = value; return this; }
        public Builder minSize(Integer value) { this.minSize = value; return this; }
        public Builder minSizePerSeason(Integer value) { this.minSizePerSeason = value; return this; }
        public Builder minSeasonObservations(int value) { this.minSeasonObservations = value; return this; }
        public Builder categories(ConfidenceCategories value) { this.categories = value; return this; }
        public Builder strict(boolean value) { this.strict = value; return this; }
        public Builder largeDatasetMode(LargeDatasetMode value) { this.largeDatasetMode = value; return this; }
        public Builder largeDatasetThreshold(int value) { this.largeDatasetThreshold = value; return this; }
        public Builder maxPairs(long value) { this.maxPairs = value; return this; }
        public Builder randomSeed(long value) { this.randomSeed = value; return this; }
        public Builder slopeScaling(ChronoUnit value) { this.slopeScaling = value; return this; }
        public Builder valueUnit(String value) { this.valueUnit = value; return this; }

        /**
         * @throws IllegalArgumentException if a setting is out of range
         */
        public AnalysisConfig build() {
            if (mkTestMethod == null || sensSlopeMethod == null || ciMethod == null
                    || tieBreakMethod == null || seasonType == null || largeDatasetMode == null
                    || categories == null) {
                throw new IllegalArgumentException("Analysis method settings must not be null");
            }
            if (!(alpha > 0.0 && alpha < 1.0)) {
                throw new IllegalArgumentException("alpha must lie in (0, 1), got " + alpha);
            }
            if (!Double.isFinite(ltMult) || ltMult < 0) {
                throw new IllegalArgumentException("ltMult must be a finite, non-negative number, got " + ltMult);
            }
            if (!Double.isFinite(gtMult) || gtMult < 0) {
                throw new IllegalArgumentException("gtMult must be a finite, non-negative number, got " + gtMult);
            }
            if (period < 1) {
                throw new IllegalArgumentException("period must be >= 1, got " + period);
            }
            if (hicensorLimit != null && !Double.isFinite(hicensorLimit)) {
                throw new IllegalArgumentException("hicensorLimit must be finite, got " + hicensorLimit);
            }
            if (minSize != null && minSize < 0) {
                throw new IllegalArgumentException("minSize must not be negative, got " + minSize);
            }
            if (minSizePerSeason != null && minSizePerSeason < 0) {
                throw new IllegalArgumentException("minSizePerSeason must not be negative, got " + minSizePerSeason);
            }
            if (minSeasonObservations < 2) {
                throw new IllegalArgumentException("minSeasonObservations must be >= 2, got " + minSeasonObservations);
            }
            if (largeDatasetThreshold < 2) {
                throw new IllegalArgumentException("largeDatasetThreshold must be >= 2, got " + largeDatasetThreshold);
            }
            if (maxPairs < 1) {
                throw new IllegalArgumentException("maxPairs must be positive, got " + maxPairs);
            }
            if (slopeScaling != null && !SCALING_UNITS.contains(slopeScaling)) {
                throw new IllegalArgumentException("slopeScaling must be one of " + SCALING_UNITS + ", got " + slopeScaling);
            }
            return new AnalysisConfig(this);
        }
    }
}
