/* (C)2026 */
package com.ammann.trend.service;

import com.ammann.trend.enumeration.ComputationMode;
import com.ammann.trend.enumeration.SeasonType;
import com.ammann.trend.exception.ValidationException;
import com.ammann.trend.model.AnalysisConfig;
import com.ammann.trend.model.ComparisonPolicy;
import com.ammann.trend.model.MannKendallStatistic;
import com.ammann.trend.model.Observation;
import com.ammann.trend.model.SeasonGroup;
import com.ammann.trend.model.SensSlopeEstimate;
import com.ammann.trend.model.SlopePool;
import com.ammann.trend.model.TrendResult;
import com.ammann.trend.service.SeriesPreparationService.PreparedSeries;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;
import org.jboss.logging.Logger;

/**
 * Seasonal Kendall test: the series is split by season key, every season is scanned on
 * its own and the per-season scores are pooled.
 *
 * <p>S and varS are summed across seasons, which assumes the seasons are independent.
 * Tau is the pooled score over the summed tau denominators. Sen's slope is the median of
 * the union of the season slope pools, never an average of season slopes. Pairs never
 * cross a season boundary.
 */
@ApplicationScoped
public class SeasonalTrendService {

    private static final Logger LOG = Logger.getLogger(SeasonalTrendService.class);

    private final SeriesPreparationService preparation;
    private final MannKendallService mannKendall;
    private final SensSlopeService sensSlope;
    private final AnalysisNoteService analysisNotes;
    private final TrendAnalysisService trendAnalysis;

    @Inject
    public SeasonalTrendService(SeriesPreparationService preparation,
                                MannKendallService mannKendall,
                                SensSlopeService sensSlope,
                                AnalysisNoteService analysisNotes,
                                TrendAnalysisService trendAnalysis) {
        this.preparation = preparation;
        this.mannKendall = mannKendall;
        this.sensSlope = sensSlope;
        this.analysisNotes = analysisNotes;
        this.trendAnalysis = trendAnalysis;
    }

    /**
     * Runs the seasonal analysis.
     *
     * @param input  observations in any order
     * @param config analysis settings; {@code seasonType} and {@code period} select the season key
     * @return the pooled result
     * @throws ValidationException in strict mode, when no statistic is computable
     */
    public TrendResult analyze(List<Observation> input, AnalysisConfig config) {
        PreparedSeries prepared = preparation.prepare(input, config);
        List<Observation> series = prepared.observations();

        String fatal = trendAnalysis.fatalNote(prepared, config);
        if (fatal != null) {
            LOG.infof("Seasonal trend analysis skipped: %s (n=%d)", fatal, series.size());
            TrendResult result = trendAnalysis.insufficient(series, config, List.of(fatal), List.of(), 0);
            trendAnalysis.recordMetrics("seasonal", result);
            return result;
        }

        List<SeasonGroup> seasons = partition(series, config.getSeasonType(), config.getPeriod());
        List<SeasonGroup> used = new ArrayList<>();
        List<Integer> skipped = new ArrayList<>();
        for (SeasonGroup season : seasons) {
            if (season.size() < config.getMinSeasonObservations()) {
                skipped.add(season.key());
            } else {
                used.add(season);
            }
        }
        String skippedNote = analysisNotes.seasonsSkippedNote(skipped, config.getMinSeasonObservations());

        if (used.isEmpty()) {
            if (config.isStrict()) {
                int largest = seasons.stream().mapToInt(SeasonGroup::size).max().orElse(0);
                throw ValidationException.insufficientData("observations per season",
                        config.getMinSeasonObservations(), largest);
            }
            LOG.infof("Seasonal trend analysis skipped: all %d seasons below %d observations",
                    seasons.size(), config.getMinSeasonObservations());
            List<String> notes = new ArrayList<>();
            TrendAnalysisService.addIfPresent(notes, skippedNote);
            TrendResult result = trendAnalysis.insufficient(series, config, notes, skipped, 0);
            trendAnalysis.recordMetrics("seasonal", result);
            return result;
        }

        List<Observation> usedSeries = used.stream()
                .flatMap(g -> g.observations().stream())
                .sorted(Comparator.comparingDouble(Observation::time))
                .toList();
        ComparisonPolicy policy = config.comparisonPolicy().resolveFor(series);
        ComputationMode mode = TrendAnalysisService.resolveMode(config, usedSeries.size());

        List<MannKendallStatistic> statistics = new ArrayList<>(used.size());
        List<SlopePool> pools = new ArrayList<>(used.size());
        long totalPairs = used.stream().mapToLong(g -> (long) g.size() * (g.size() - 1) / 2).sum();
        long pairsUsed = 0;
        Random random = new Random(config.getRandomSeed());

        for (SeasonGroup season : used) {
            List<Observation> members = season.observations();
            MannKendallService.PairScan scan = mannKendall.scan(members, policy,
                    mode == ComputationMode.FULL ? config.getSensSlopeMethod() : null);
            statistics.add(mannKendall.compute(members, policy, scan));

            if (mode == ComputationMode.FULL) {
                pools.add(scan.pool());
            } else {
                long seasonPairs = (long) members.size() * (members.size() - 1) / 2;
                long share = Math.max(1L, Math.round((double) config.getMaxPairs() * seasonPairs / totalPairs));
                pools.add(sensSlope.samplePool(members, policy, config.getSensSlopeMethod(), share, random));
                pairsUsed += TrendAnalysisService.pairsDrawn(members.size(), share);
            }
        }

        MannKendallStatistic pooled = mannKendall.pool(statistics);
        SensSlopeEstimate estimate = sensSlope.estimate(SlopePool.union(pools), usedSeries, pooled.varS(),
                config.getAlpha(), config.getCiMethod());

        List<String> notes = new ArrayList<>();
        TrendAnalysisService.addIfPresent(notes, analysisNotes.seasonalNote(usedSeries, used));
        int smallestSeason = used.stream().mapToInt(SeasonGroup::size).min().orElse(0);
        TrendAnalysisService.addIfPresent(notes,
                analysisNotes.minSeasonSizeNote(smallestSeason, config.getMinSizePerSeason()));
        TrendAnalysisService.addIfPresent(notes, skippedNote);
        notes.addAll(analysisNotes.structuralNotes(usedSeries, pooled.tiedTimePairs()));
        notes.addAll(pooled.notes());
        notes.addAll(estimate.notes());

        TrendResult result = trendAnalysis.assemble(usedSeries, config, pooled, estimate, notes, mode,
                mode == ComputationMode.FAST ? pairsUsed : null, skipped, used.size());
        LOG.infof("Seasonal trend analysis completed: n=%d seasons=%d skipped=%d S=%.0f p=%.4g slope=%.4g classification='%s'",
                usedSeries.size(), used.size(), skipped.size(), result.s(), result.p(), result.slope(),
                result.classification());
        trendAnalysis.recordMetrics("seasonal", result);
        return result;
    }

    /**
     * Splits a time-sorted series by season key.
     *
     * @return groups ordered by key, members in time order
     */
    public List<SeasonGroup> partition(List<Observation> series, SeasonType seasonType, int period) {
        if (series.isEmpty()) {
            return List.of();
        }
        double origin = series.stream().mapToDouble(Observation::time).min().orElse(0.0);
        Map<Integer, List<Observation>> byKey = new TreeMap<>();
        for (Observation o : series) {
            int key = seasonType.seasonOf(o.time(), origin, period);
            byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(o);
        }
        List<SeasonGroup> groups = new ArrayList<>(byKey.size());
        byKey.forEach((key, members) -> groups.add(new SeasonGroup(key, members)));
        return groups;
    }
}
