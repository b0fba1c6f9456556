/* (C)2026 */
package com.ammann.trend.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ammann.trend.enumeration.SeasonType;
import com.ammann.trend.model.AnalysisConfig;
import com.ammann.trend.model.SeasonalityResult;
import com.ammann.trend.support.TestSeries;
import org.junit.jupiter.api.Test;

class SeasonalityTestServiceTest
{
    private final SeriesPreparationService preparation = new SeriesPreparationService();
    private final SeasonalityTestService service = new SeasonalityTestService(preparation,
            new SeasonalTrendService(preparation, TestSeries.sequentialMannKendall(), TestSeries.sensSlope(),
                    new AnalysisNoteService(), null));

    private static AnalysisConfig everyThird()
    {
        return AnalysisConfig.builder().seasonType(SeasonType.PERIOD).period(3).build();
    }

    @Test
    void separatedSeasonsAreSeasonal()
    {
        // seasons hold 1..4, 11..14 and 21..24
        SeasonalityResult result = service.test(
                TestSeries.series(0, 1, 11, 21, 2, 12, 22, 3, 13, 23, 4, 14, 24), everyThird());

        assertThat(result.h()).isCloseTo(9.846154, within(1e-5));
        assertThat(result.degreesOfFreedom()).isEqualTo(2);
        assertThat(result.p()).isCloseTo(0.0072767, within(1e-6));
        assertThat(result.seasonal()).isTrue();
        assertThat(result.seasonsTested()).isEqualTo(3);
        assertThat(result.seasonCounts()).containsEntry(0, 4).containsEntry(1, 4).containsEntry(2, 4);
        assertThat(result.notes()).isEmpty();
    }

    @Test
    void balancedRankSumsAreNotSeasonal()
    {
        // seasons {1,6,7,12}, {2,5,8,11} and {3,4,9,10} share the same rank sum
        SeasonalityResult result = service.test(
                TestSeries.series(0, 1, 2, 3, 6, 5, 4, 7, 8, 9, 12, 11, 10), everyThird());

        assertThat(result.h()).isCloseTo(0.0, within(1e-9));
        assertThat(result.p()).isCloseTo(1.0, within(1e-9));
        assertThat(result.seasonal()).isFalse();
    }

    @Test
    void tooFewObservations()
    {
        SeasonalityResult result = service.test(TestSeries.series(0, 1), everyThird());

        assertThat(result.notes()).containsExactly(SeasonalityTestService.NOTE_TOO_FEW_OBSERVATIONS);
        assertThat(result.h()).isNaN();
        assertThat(result.seasonal()).isFalse();
    }

    @Test
    void singleSeasonIsNotTestable()
    {
        AnalysisConfig config = AnalysisConfig.builder().seasonType(SeasonType.PERIOD).period(1).build();

        SeasonalityResult result = service.test(TestSeries.series(0, 1, 2, 3, 4), config);

        assertThat(result.notes()).containsExactly(SeasonalityTestService.NOTE_TOO_FEW_SEASONS);
        assertThat(result.seasonCounts()).containsEntry(0, 4);
    }

    @Test
    void allTiedValuesAreNotTestable()
    {
        SeasonalityResult result = service.test(TestSeries.series(0, 5, 5, 5, 5, 5, 5), everyThird());

        assertThat(result.notes()).containsExactly(SeasonalityTestService.NOTE_ALL_TIED);
        assertThat(result.p()).isNaN();
    }
}
