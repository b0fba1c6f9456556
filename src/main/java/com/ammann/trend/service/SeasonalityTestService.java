/* (C)2026 */
package com.ammann.trend.service;

import com.ammann.trend.model.AnalysisConfig;
import com.ammann.trend.model.Observation;
import com.ammann.trend.model.SeasonGroup;
import com.ammann.trend.model.SeasonalityResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.stat.ranking.NaNStrategy;
import org.apache.commons.math3.stat.ranking.NaturalRanking;
import org.apache.commons.math3.stat.ranking.TiesStrategy;
import org.jboss.logging.Logger;

/**
 * Kruskal-Wallis test for a difference in value distribution between seasons.
 *
 * <p>Face values are ranked over the whole series with average ranks for ties, and H is
 * divided by the usual tie correction {@code 1 - sum(t^3 - t)/(N^3 - N)}.
 */
@ApplicationScoped
public class SeasonalityTestService
{
    private static final Logger LOG = Logger.getLogger(SeasonalityTestService.class);

    public static final String NOTE_TOO_FEW_OBSERVATIONS = "< 2 observations; seasonality not testable";
    public static final String NOTE_TOO_FEW_SEASONS = "< 2 seasons with data; seasonality not testable";
    public static final String NOTE_ALL_TIED = "all values tied; seasonality not testable";

    private final SeriesPreparationService preparation;
    private final SeasonalTrendService seasonalTrend;

    @Inject
    public SeasonalityTestService(SeriesPreparationService preparation, SeasonalTrendService seasonalTrend)
    {
        this.preparation = preparation;
        this.seasonalTrend = seasonalTrend;
    }

    /**
     * Tests whether the seasons defined by {@code config} differ in distribution.
     *
     * @param input  observations in any order
     * @param config season key, period, alpha and hicensor settings
     */
    public SeasonalityResult test(List<Observation> input, AnalysisConfig config)
    {
        List<Observation> series = preparation.prepare(input, config).observations();
        List<SeasonGroup> seasons = seasonalTrend.partition(series, config.getSeasonType(), config.getPeriod());

        Map<Integer, Integer> counts = new LinkedHashMap<>();
        seasons.forEach(g -> counts.put(g.key(), g.size()));

        if (series.size() < 2) {
            return SeasonalityResult.notTestable(counts, NOTE_TOO_FEW_OBSERVATIONS);
        }
        if (seasons.size() < 2) {
            return SeasonalityResult.notTestable(counts, NOTE_TOO_FEW_SEASONS);
        }

        double[] values = new double[series.size()];
        int[] seasonIndex = new int[series.size()];
        int position = 0;
        for (int g = 0; g < seasons.size(); g++) {
            for (Observation o : seasons.get(g).observations()) {
                values[position] = o.faceValue();
                seasonIndex[position] = g;
                position++;
            }
        }

        NaturalRanking ranking = new NaturalRanking(NaNStrategy.FAILED, TiesStrategy.AVERAGE);
        double[] ranks = ranking.rank(values);

        double[] rankSums = new double[seasons.size()];
        for (int k = 0; k < ranks.length; k++) {
            rankSums[seasonIndex[k]] += ranks[k];
        }

        double total = values.length;
        double h = 0.0;
        for (int g = 0; g < seasons.size(); g++) {
            h += rankSums[g] * rankSums[g] / seasons.get(g).size();
        }
        h = 12.0 / (total * (total + 1)) * h - 3.0 * (total + 1);

        double correction = 1.0 - tieSum(values) / (total * total * total - total);
        if (!(correction > 0.0)) {
            return SeasonalityResult.notTestable(counts, NOTE_ALL_TIED);
        }
        h /= correction;

        int degreesOfFreedom = seasons.size() - 1;
        double p = 1.0 - new ChiSquaredDistribution(null, degreesOfFreedom).cumulativeProbability(h);
        boolean seasonal = p < config.getAlpha();

        LOG.debugf("Kruskal-Wallis H=%.4f df=%d p=%.6g seasonal=%s", h, degreesOfFreedom, p, seasonal);
        return new SeasonalityResult(h, p, degreesOfFreedom, seasons.size(), seasonal, counts, new ArrayList<>());
    }

    private static double tieSum(double[] values)
    {
        Map<Double, Integer> groups = new HashMap<>();
        for (double value : values) {
            groups.merge(value + 0.0, 1, Integer::sum);
        }
        double sum = 0.0;
        for (int t : groups.values()) {
            sum += (double) t * t * t - t;
        }
        return sum;
    }
}
