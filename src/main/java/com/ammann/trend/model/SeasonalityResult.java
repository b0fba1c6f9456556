/* (C)2026 */
package com.ammann.trend.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Kruskal-Wallis comparison of the value distributions across seasons.
 *
 * @param h                 tie-corrected H statistic
 * @param p                 p-value from the chi-squared distribution
 * @param degreesOfFreedom  number of seasons minus one
 * @param seasonsTested     seasons that contributed observations
 * @param seasonal          {@code p < alpha}
 * @param seasonCounts      observations per season key
 * @param notes             advisories
 */
public record SeasonalityResult(
        double h,
        double p,
        int degreesOfFreedom,
        int seasonsTested,
        boolean seasonal,
        Map<Integer, Integer> seasonCounts,
        List<String> notes
) {

    public SeasonalityResult {
        seasonCounts = Collections.unmodifiableMap(new TreeMap<>(seasonCounts));
        notes = List.copyOf(notes);
    }

    public static SeasonalityResult notTestable(Map<Integer, Integer> seasonCounts, String note) {
        return new SeasonalityResult(Double.NaN, Double.NaN, 0, seasonCounts.size(), false,
                seasonCounts, List.of(note));
    }
}
