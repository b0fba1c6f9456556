/* (C)2026 */
package com.ammann.trend.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.assertj.core.api.Assertions.withinPercentage;

import com.ammann.trend.enumeration.ComputationMode;
import com.ammann.trend.enumeration.LargeDatasetMode;
import com.ammann.trend.enumeration.SeasonType;
import com.ammann.trend.enumeration.TrendDirection;
import com.ammann.trend.exception.ValidationException;
import com.ammann.trend.model.AnalysisConfig;
import com.ammann.trend.model.Observation;
import com.ammann.trend.model.SeasonGroup;
import com.ammann.trend.model.TrendResult;
import com.ammann.trend.support.TestSeries;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SeasonalTrendServiceTest {

    private static final double YEAR_SECONDS = 365.25 * 86_400.0;

    private SeasonalTrendService service;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        SeriesPreparationService preparation = new SeriesPreparationService();
        AnalysisNoteService notes = new AnalysisNoteService();
        TrendAnalysisService trendAnalysis = new TrendAnalysisService(preparation,
                TestSeries.sequentialMannKendall(), TestSeries.sensSlope(), notes, new TrendClassifier());
        registry = new SimpleMeterRegistry();
        trendAnalysis.meterRegistry = registry;
        service = new SeasonalTrendService(preparation, TestSeries.sequentialMannKendall(),
                TestSeries.sensSlope(), notes, trendAnalysis);
    }

    /** Four years of monthly data, each month one unit higher than a year earlier. */
    private static List<Observation> fourYearsMonthly() {
        double[] values = new double[48];
        for (int i = 0; i < values.length; i++) {
            values[i] = 10.0 * (i % 12) + i / 12;
        }
        return TestSeries.monthly(2000, 1, values);
    }

    @Test
    @DisplayName("Monthly seasons pool their scores")
    void monthlySeasonsArePooled() {
        TrendResult result = service.analyze(fourYearsMonthly(), AnalysisConfig.defaults());

        assertThat(result.seasonCount()).isEqualTo(12);
        assertThat(result.isSeasonal()).isTrue();
        assertThat(result.s()).isEqualTo(72.0);
        assertThat(result.varS()).isCloseTo(104.0, within(1e-9));
        assertThat(result.tau()).isCloseTo(1.0, within(1e-12));
        assertThat(result.direction()).isEqualTo(TrendDirection.INCREASING);
        assertThat(result.slope()).isCloseTo(1.0 / YEAR_SECONDS, withinPercentage(1));
        assertThat(result.seasonsSkipped()).isEmpty();
        assertThat(result.notes()).contains("minimum season size (4) below minimum (5)");
        assertThat(registry.get("trend_analyses_total").tag("kind", "seasonal").counter().count()).isEqualTo(1.0);
    }

    @Test
    void pairsNeverCrossSeasons() {
        // each season falls, while every later value of the other season is higher
        List<Observation> series = TestSeries.series(0, 3, 13, 2, 12, 1, 11);
        AnalysisConfig config = AnalysisConfig.builder().seasonType(SeasonType.PERIOD).period(2).build();

        TrendResult result = service.analyze(series, config);

        assertThat(result.s()).isEqualTo(-6.0);
        assertThat(result.direction()).isEqualTo(TrendDirection.DECREASING);
        assertThat(result.seasonCount()).isEqualTo(2);
    }

    @Test
    void smallSeasonsAreSkipped() {
        AnalysisConfig config = AnalysisConfig.builder()
                .seasonType(SeasonType.PERIOD)
                .period(4)
                .minSeasonObservations(3)
                .build();

        TrendResult result = service.analyze(TestSeries.series(0, 1, 2, 3, 4, 5, 6, 7, 8, 9), config);

        assertThat(result.seasonsSkipped()).containsExactly(1, 2, 3);
        assertThat(result.seasonCount()).isEqualTo(1);
        assertThat(result.n()).isEqualTo(3);
        assertThat(result.s()).isEqualTo(3.0);
        assertThat(result.notes()).contains("seasons skipped (fewer than 3 observations): [1, 2, 3]");
    }

    @Test
    void allSeasonsSkippedIsInsufficient() {
        AnalysisConfig config = AnalysisConfig.builder()
                .seasonType(SeasonType.PERIOD)
                .period(4)
                .minSeasonObservations(10)
                .build();

        TrendResult result = service.analyze(TestSeries.series(0, 1, 2, 3, 4, 5, 6, 7, 8, 9), config);

        assertThat(result.classification()).isEqualTo(TrendResult.INSUFFICIENT_DATA);
        assertThat(result.s()).isNaN();
        assertThat(result.seasonsSkipped()).containsExactly(0, 1, 2, 3);
    }

    @Test
    void allSeasonsSkippedThrowsInStrictMode() {
        AnalysisConfig config = AnalysisConfig.builder()
                .seasonType(SeasonType.PERIOD)
                .period(4)
                .minSeasonObservations(10)
                .strict(true)
                .build();

        assertThatThrownBy(() -> service.analyze(TestSeries.series(0, 1, 2, 3, 4, 5, 6, 7, 8, 9), config))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("observations per season");
    }

    @Test
    void fastModeSplitsPairBudgetAcrossSeasons() {
        AnalysisConfig config = AnalysisConfig.builder()
                .largeDatasetMode(LargeDatasetMode.FAST)
                .maxPairs(12)
                .build();

        TrendResult result = service.analyze(fourYearsMonthly(), config);

        assertThat(result.computationMode()).isEqualTo(ComputationMode.FAST);
        assertThat(result.pairsUsed()).isEqualTo(12L);
        assertThat(result.s()).isEqualTo(72.0);
        assertThat(result.slope()).isCloseTo(1.0 / YEAR_SECONDS, withinPercentage(1));
    }

    @Test
    void periodPartitionStartsAtEarliestTime() {
        List<SeasonGroup> groups = service.partition(TestSeries.series(5, 1, 2, 3, 4, 5, 6), SeasonType.PERIOD, 3);

        assertThat(groups).extracting(SeasonGroup::key).containsExactly(0, 1, 2);
        assertThat(groups.get(0).observations()).extracting(Observation::time).containsExactly(5.0, 8.0);
        assertThat(service.partition(List.of(), SeasonType.MONTH, 12)).isEmpty();
    }
}
