/* (C)2026 */
package com.ammann.trend.service;

import com.ammann.trend.model.Observation;
import com.ammann.trend.model.SeasonGroup;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Data-quality advisories attached to trend results.
 *
 * <p>The sufficiency check runs in two tiers and reports only the first failure: the
 * first tier looks at the uncensored values of the whole series, the second at runs of
 * identical values (per season for seasonal analyses).
 */
@ApplicationScoped
public class AnalysisNoteService
{
    public static final String NOTE_FEW_UNIQUE = "< 3 unique values";
    public static final String NOTE_FEW_NON_CENSORED = "< 5 Non-censored values";
    public static final String NOTE_LONG_RUN = "Long run of single value";
    public static final String NOTE_FEW_IN_SEASON = "< 3 non-NA values in Season";
    public static final String NOTE_FEW_UNIQUE_IN_SEASON = "< 2 unique values in Season";
    public static final String NOTE_LONG_RUN_IN_SEASON = "Long run of single value in a Season";
    public static final String NOTE_TIED_TIMESTAMPS = "tied timestamps present without aggregation";
    public static final String NOTE_ALL_CENSORED = "all observations censored";
    public static final String NOTE_TOO_FEW_OBSERVATIONS = "< 2 observations; no statistic computable";
    public static final String NOTE_TOO_FEW_TIMES = "< 2 distinct time values; no statistic computable";

    static final int MIN_UNIQUE = 3;
    static final int MIN_NON_CENSORED = 5;
    static final int MIN_IN_SEASON = 3;
    static final int MIN_UNIQUE_IN_SEASON = 2;
    static final double LONG_RUN_SHARE = 0.5;
    static final double LONG_RUN_SHARE_IN_SEASON = 0.75;

    /**
     * Sufficiency advisory for a non-seasonal series.
     *
     * @return the first failing check, or {@code null} when the series is adequate
     */
    public String seriesNote(List<Observation> series)
    {
        String firstTier = firstTier(series);
        if (firstTier != null) {
            return firstTier;
        }
        if (!series.isEmpty() && (double) longestRun(series) / series.size() > LONG_RUN_SHARE) {
            return NOTE_LONG_RUN;
        }
        return null;
    }

    /**
     * Sufficiency advisory for a seasonal series.
     *
     * @param series all observations of the analysis
     * @param seasons the season partition
     * @return the first failing check, or {@code null} when the series is adequate
     */
    public String seasonalNote(List<Observation> series, List<SeasonGroup> seasons)
    {
        String firstTier = firstTier(series);
        if (firstTier != null) {
            return firstTier;
        }
        if (seasons.stream().anyMatch(g -> g.size() < MIN_IN_SEASON)) {
            return NOTE_FEW_IN_SEASON;
        }
        if (seasons.stream().anyMatch(g -> SeriesPreparationService.uniqueReports(g.observations()) < MIN_UNIQUE_IN_SEASON)) {
            return NOTE_FEW_UNIQUE_IN_SEASON;
        }
        for (SeasonGroup season : seasons) {
            if (season.size() > 1
                    && (double) longestRun(season.observations()) / season.size() > LONG_RUN_SHARE_IN_SEASON) {
                return NOTE_LONG_RUN_IN_SEASON;
            }
        }
        return null;
    }

    /** Advisories that do not stop at the first failure. */
    public List<String> structuralNotes(List<Observation> series, long tiedTimePairs)
    {
        List<String> notes = new ArrayList<>();
        if (tiedTimePairs > 0) {
            notes.add(NOTE_TIED_TIMESTAMPS);
        }
        if (!series.isEmpty() && series.stream().allMatch(Observation::isCensored)) {
            notes.add(NOTE_ALL_CENSORED);
        }
        return notes;
    }

    public String minSizeNote(int n, Integer minSize)
    {
        if (minSize == null || n >= minSize) {
            return null;
        }
        return String.format("sample size (%d) below minimum (%d)", n, minSize);
    }

    public String minSeasonSizeNote(int smallestSeason, Integer minSizePerSeason)
    {
        if (minSizePerSeason == null || smallestSeason >= minSizePerSeason) {
            return null;
        }
        return String.format("minimum season size (%d) below minimum (%d)", smallestSeason, minSizePerSeason);
    }

    public String seasonsSkippedNote(List<Integer> skipped, int minSeasonObservations)
    {
        if (skipped.isEmpty()) {
            return null;
        }
        return String.format("seasons skipped (fewer than %d observations): %s", minSeasonObservations, skipped);
    }

    private static String firstTier(List<Observation> series)
    {
        Set<Double> unique = new HashSet<>();
        int nonCensored = 0;
        for (Observation o : series) {
            if (!o.isCensored()) {
                unique.add(o.value() + 0.0);
                nonCensored++;
            }
        }
        if (unique.size() < MIN_UNIQUE) {
            return NOTE_FEW_UNIQUE;
        }
        if (nonCensored < MIN_NON_CENSORED) {
            return NOTE_FEW_NON_CENSORED;
        }
        return null;
    }

    /** Longest stretch of consecutive observations reporting the same value and censoring. */
    static int longestRun(List<Observation> series)
    {
        int longest = 0;
        int current = 0;
        Observation previous = null;
        for (Observation o : series) {
            boolean same = previous != null
                    && previous.censorKind() == o.censorKind()
                    && Double.compare(previous.faceValue() + 0.0, o.faceValue() + 0.0) == 0;
            current = same ? current + 1 : 1;
            longest = Math.max(longest, current);
            previous = o;
        }
        return longest;
    }
}
