/* (C)2026 */
package com.ammann.trend.service;

import com.ammann.trend.enumeration.ComputationMode;
import com.ammann.trend.enumeration.LargeDatasetMode;
import com.ammann.trend.enumeration.TrendDirection;
import com.ammann.trend.exception.ValidationException;
import com.ammann.trend.model.AnalysisConfig;
import com.ammann.trend.model.ComparisonPolicy;
import com.ammann.trend.model.MannKendallStatistic;
import com.ammann.trend.model.Observation;
import com.ammann.trend.model.SensSlopeEstimate;
import com.ammann.trend.model.SlopePool;
import com.ammann.trend.model.TrendResult;
import com.ammann.trend.service.SeriesPreparationService.PreparedSeries;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import org.jboss.logging.Logger;

/**
 * Non-seasonal trend analysis: Mann-Kendall test plus Sen's slope on one series.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>prepare the series (drop non-finite rows, sort, hicensor),</li>
 *   <li>resolve the comparison policy once for the whole series,</li>
 *   <li>scan every pair for S and, in FULL mode, the slope pool,</li>
 *   <li>draw a seeded slope sample instead in FAST mode,</li>
 *   <li>derive confidence, direction and classification.</li>
 * </ol>
 * Data-quality problems never throw; they are reported in {@link TrendResult#notes()}.
 * Only a series with fewer than two observations or two distinct times is fatal, and it
 * throws only in strict mode.
 */
@ApplicationScoped
public class TrendAnalysisService
{
    private static final Logger LOG = Logger.getLogger(TrendAnalysisService.class);

    static final String DEFAULT_VALUE_UNIT = "units";

    private final SeriesPreparationService preparation;
    private final MannKendallService mannKendall;
    private final SensSlopeService sensSlope;
    private final AnalysisNoteService analysisNotes;
    private final TrendClassifier classifier;

    @Inject MeterRegistry meterRegistry;

    @Inject
    public TrendAnalysisService(SeriesPreparationService preparation,
                                MannKendallService mannKendall,
                                SensSlopeService sensSlope,
                                AnalysisNoteService analysisNotes,
                                TrendClassifier classifier)
    {
        this.preparation = preparation;
        this.mannKendall = mannKendall;
        this.sensSlope = sensSlope;
        this.analysisNotes = analysisNotes;
        this.classifier = classifier;
    }

    /**
     * Runs the non-seasonal analysis.
     *
     * @param input  observations in any order
     * @param config analysis settings
     * @return the fixed-shape result
     * @throws ValidationException in strict mode, when no statistic is computable
     */
    public TrendResult analyze(List<Observation> input, AnalysisConfig config)
    {
        PreparedSeries prepared = preparation.prepare(input, config);
        List<Observation> series = prepared.observations();
        int n = series.size();

        String fatal = fatalNote(prepared, config);
        if (fatal != null) {
            LOG.infof("Trend analysis skipped: %s (n=%d)", fatal, n);
            TrendResult result = insufficient(series, config, List.of(fatal), List.of(), 0);
            recordMetrics("non_seasonal", result);
            return result;
        }

        ComparisonPolicy policy = config.comparisonPolicy().resolveFor(series);
        ComputationMode mode = resolveMode(config, n);

        MannKendallService.PairScan scan = mannKendall.scan(series, policy,
                mode == ComputationMode.FULL ? config.getSensSlopeMethod() : null);
        MannKendallStatistic statistic = mannKendall.compute(series, policy, scan);

        SlopePool pool;
        Long pairsUsed = null;
        if (mode == ComputationMode.FULL) {
            pool = scan.pool();
        } else {
            Random random = new Random(config.getRandomSeed());
            pool = sensSlope.samplePool(series, policy, config.getSensSlopeMethod(), config.getMaxPairs(), random);
            pairsUsed = pairsDrawn(n, config.getMaxPairs());
        }
        SensSlopeEstimate estimate = sensSlope.estimate(pool, series, statistic.varS(),
                config.getAlpha(), config.getCiMethod());

        List<String> notes = new ArrayList<>();
        addIfPresent(notes, analysisNotes.seriesNote(series));
        addIfPresent(notes, analysisNotes.minSizeNote(n, config.getMinSize()));
        notes.addAll(analysisNotes.structuralNotes(series, statistic.tiedTimePairs()));
        notes.addAll(statistic.notes());
        notes.addAll(estimate.notes());

        TrendResult result = assemble(series, config, statistic, estimate, notes, mode, pairsUsed, List.of(), 0);
        LOG.infof("Trend analysis completed: n=%d S=%.0f p=%.4g slope=%.4g classification='%s' mode=%s",
                n, result.s(), result.p(), result.slope(), result.classification(), mode);
        recordMetrics("non_seasonal", result);
        return result;
    }

    /**
     * Explains why no statistic can be computed, or throws in strict mode.
     *
     * @return the fatal note, or {@code null} when the series is computable
     */
    String fatalNote(PreparedSeries prepared, AnalysisConfig config)
    {
        int n = prepared.size();
        if (n < 2) {
            if (config.isStrict()) {
                throw ValidationException.insufficientData("observations", 2, n);
            }
            return AnalysisNoteService.NOTE_TOO_FEW_OBSERVATIONS;
        }
        long distinctTimes = prepared.distinctTimes();
        if (distinctTimes < 2) {
            if (config.isStrict()) {
                throw ValidationException.insufficientData("distinct time values", 2, (int) distinctTimes);
            }
            return AnalysisNoteService.NOTE_TOO_FEW_TIMES;
        }
        return null;
    }

    static ComputationMode resolveMode(AnalysisConfig config, int n)
    {
        LargeDatasetMode mode = config.getLargeDatasetMode();
        if (mode == LargeDatasetMode.FAST) {
            return ComputationMode.FAST;
        }
        if (mode == LargeDatasetMode.FULL) {
            return ComputationMode.FULL;
        }
        return n > config.getLargeDatasetThreshold() ? ComputationMode.FAST : ComputationMode.FULL;
    }

    static long pairsDrawn(int n, long maxPairs)
    {
        return Math.min((long) n * (n - 1) / 2, maxPairs);
    }

    /**
     * Builds the result record from the computed pieces; shared with the seasonal analysis.
     */
    TrendResult assemble(List<Observation> series, AnalysisConfig config, MannKendallStatistic statistic,
                         SensSlopeEstimate estimate, List<String> notes, ComputationMode mode, Long pairsUsed,
                         List<Integer> seasonsSkipped, int seasonCount)
    {
        double p = statistic.p();
        long s = statistic.s();
        double confidence = 1.0 - p / 2.0;
        double confidenceDecreasing = s > 0 ? p / 2.0 : 1.0 - p / 2.0;
        TrendDirection direction = TrendDirection.fromScore(s);
        String classification = classifier.classify(confidence, direction, config.getCategories());

        int n = series.size();
        int censored = (int) series.stream().filter(Observation::isCensored).count();
        Scaling scaling = scaling(config, estimate);

        return new TrendResult(
                s, statistic.varS(), statistic.z(), p, statistic.tau(),
                estimate.slope(), estimate.intercept(), estimate.lowerCi(), estimate.upperCi(),
                confidence, confidenceDecreasing, direction, p < config.getAlpha(), classification,
                notes, n, censored, preparation.uniqueCensorLevels(series),
                config.getAlpha(),
                n == 0 ? Double.NaN : (double) censored / n,
                n == 0 ? Double.NaN : (double) SeriesPreparationService.uniqueReports(series) / n,
                estimate.senProbability(), estimate.senProbabilityMax(), estimate.senProbabilityMin(),
                statistic.ambiguousPairs(), statistic.leftAmbiguousPairs(), statistic.rightAmbiguousPairs(),
                statistic.tiedTimePairs(),
                mode, pairsUsed, seasonsSkipped, seasonCount,
                scaling.slope(), scaling.units(), scaling.lower(), scaling.upper());
    }

    /**
     * Result for a series on which no statistic is computable.
     */
    TrendResult insufficient(List<Observation> series, AnalysisConfig config, List<String> notes,
                             List<Integer> seasonsSkipped, int seasonCount)
    {
        int n = series.size();
        int censored = (int) series.stream().filter(Observation::isCensored).count();
        double nan = Double.NaN;
        return new TrendResult(
                nan, nan, nan, nan, nan, nan, nan, nan, nan, nan, nan,
                TrendDirection.NONE, false, TrendResult.INSUFFICIENT_DATA,
                notes, n, censored, preparation.uniqueCensorLevels(series),
                config.getAlpha(),
                n == 0 ? nan : (double) censored / n,
                n == 0 ? nan : (double) SeriesPreparationService.uniqueReports(series) / n,
                nan, nan, nan, 0L, 0L, 0L, 0L, ComputationMode.FULL, null, seasonsSkipped, seasonCount,
                nan, null, nan, nan);
    }

    private record Scaling(double slope, double lower, double upper, String units) {}

    private static Scaling scaling(AnalysisConfig config, SensSlopeEstimate estimate)
    {
        ChronoUnit unit = config.getSlopeScaling();
        if (unit == null) {
            return new Scaling(Double.NaN, Double.NaN, Double.NaN, null);
        }
        double seconds = unit.getDuration().getSeconds();
        String valueUnit = config.getValueUnit() == null || config.getValueUnit().isBlank()
                ? DEFAULT_VALUE_UNIT : config.getValueUnit();
        return new Scaling(estimate.slope() * seconds, estimate.lowerCi() * seconds,
                estimate.upperCi() * seconds, valueUnit + " per " + singular(unit));
    }

    static String singular(ChronoUnit unit)
    {
        String name = unit.toString().toLowerCase(Locale.ROOT);
        return name.endsWith("s") ? name.substring(0, name.length() - 1) : name;
    }

    static void addIfPresent(List<String> notes, String note)
    {
        if (note != null) {
            notes.add(note);
        }
    }

    void recordMetrics(String kind, TrendResult result)
    {
        if (meterRegistry == null) {
            return;
        }

        Counter.builder("trend_analyses_total")
                .description("Total number of trend analyses by kind and computation mode")
                .tag("kind", kind)
                .tag("mode", result.computationMode().name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();

        if (result.ambiguousPairs() > 0) {
            Counter.builder("trend_ambiguous_pairs_total")
                    .description("Total number of observation pairs whose ordering was ambiguous under censoring")
                    .tag("kind", kind)
                    .register(meterRegistry)
                    .increment(result.ambiguousPairs());
        }
    }
}
