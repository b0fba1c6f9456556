/* (C)2026 */
package com.ammann.trend.config;

import com.ammann.trend.enumeration.CiMethod;
import com.ammann.trend.enumeration.ComparisonMethod;
import com.ammann.trend.enumeration.LargeDatasetMode;
import com.ammann.trend.enumeration.SeasonType;
import com.ammann.trend.enumeration.SensSlopeMethod;
import com.ammann.trend.enumeration.TieBreakMethod;
import com.ammann.trend.model.AnalysisConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Turns the {@code trend.*} configuration properties into the default
 * {@link AnalysisConfig}. Requests that omit a setting inherit it from this instance.
 */
@ApplicationScoped
public class AnalysisDefaultsProducer {

    private static final Logger LOG = Logger.getLogger(AnalysisDefaultsProducer.class);

    @ConfigProperty(name = "trend.mk-test-method", defaultValue = "robust")
    String mkTestMethod = "robust";

    @ConfigProperty(name = "trend.sens-slope-method", defaultValue = "nan")
    String sensSlopeMethod = "nan";

    @ConfigProperty(name = "trend.ci-method", defaultValue = "direct")
    String ciMethod = "direct";

    @ConfigProperty(name = "trend.tie-break-method", defaultValue = "standard")
    String tieBreakMethod = "standard";

    @ConfigProperty(name = "trend.alpha", defaultValue = "0.05")
    double alpha = AnalysisConfig.DEFAULT_ALPHA;

    @ConfigProperty(name = "trend.lt-mult", defaultValue = "0.5")
    double ltMult = 0.5;

    @ConfigProperty(name = "trend.gt-mult", defaultValue = "1.0")
    double gtMult = 1.0;

    @ConfigProperty(name = "trend.hicensor", defaultValue = "false")
    boolean hicensor;

    @ConfigProperty(name = "trend.season-type", defaultValue = "MONTH")
    String seasonType = "MONTH";

    @ConfigProperty(name = "trend.period", defaultValue = "12")
    int period = 12;

    @ConfigProperty(name = "trend.min-size")
    Optional<Integer> minSize = Optional.of(AnalysisConfig.DEFAULT_MIN_SIZE);

    @ConfigProperty(name = "trend.min-size-per-season")
    Optional<Integer> minSizePerSeason = Optional.of(AnalysisConfig.DEFAULT_MIN_SIZE_PER_SEASON);

    @ConfigProperty(name = "trend.min-season-observations", defaultValue = "2")
    int minSeasonObservations = AnalysisConfig.DEFAULT_MIN_SEASON_OBSERVATIONS;

    @ConfigProperty(name = "trend.strict", defaultValue = "false")
    boolean strict;

    @ConfigProperty(name = "trend.large-n.mode", defaultValue = "auto")
    String largeDatasetMode = "auto";

    @ConfigProperty(name = "trend.large-n.threshold", defaultValue = "5000")
    int largeDatasetThreshold = AnalysisConfig.DEFAULT_LARGE_DATASET_THRESHOLD;

    @ConfigProperty(name = "trend.large-n.max-pairs", defaultValue = "1000000")
    long maxPairs = AnalysisConfig.DEFAULT_MAX_PAIRS;

    @ConfigProperty(name = "trend.random-seed", defaultValue = "42")
    long randomSeed = AnalysisConfig.DEFAULT_RANDOM_SEED;

    /**
     * Produces the configured defaults.
     *
     * @throws IllegalArgumentException if a configured value is out of range
     */
    @Produces
    @Singleton
    public AnalysisConfig analysisDefaults() {
        AnalysisConfig config = AnalysisConfig.builder()
                .mkTestMethod(ComparisonMethod.fromString(mkTestMethod))
                .sensSlopeMethod(SensSlopeMethod.fromString(sensSlopeMethod))
                .ciMethod(CiMethod.fromString(ciMethod))
                .tieBreakMethod(TieBreakMethod.fromString(tieBreakMethod))
                .alpha(alpha)
                .ltMult(ltMult)
                .gtMult(gtMult)
                .hicensor(hicensor)
                .seasonType(SeasonType.fromString(seasonType))
                .period(period)
                .minSize(minSize.orElse(null))
                .minSizePerSeason(minSizePerSeason.orElse(null))
                .minSeasonObservations(minSeasonObservations)
                .strict(strict)
                .largeDatasetMode(LargeDatasetMode.fromString(largeDatasetMode))
                .largeDatasetThreshold(largeDatasetThreshold)
                .maxPairs(maxPairs)
                .randomSeed(randomSeed)
                .build();
        LOG.infof("Analysis defaults loaded: %s", config);
        return config;
    }
}
