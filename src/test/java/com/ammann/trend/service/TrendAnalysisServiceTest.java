/* (C)2026 */
package com.ammann.trend.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.trend.enumeration.ComputationMode;
import com.ammann.trend.enumeration.LargeDatasetMode;
import com.ammann.trend.enumeration.SensSlopeMethod;
import com.ammann.trend.enumeration.TrendDirection;
import com.ammann.trend.exception.ValidationException;
import com.ammann.trend.model.AnalysisConfig;
import com.ammann.trend.model.Observation;
import com.ammann.trend.model.TrendResult;
import com.ammann.trend.support.TestSeries;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TrendAnalysisServiceTest
{
    private static final double DAY = 86_400.0;

    private TrendAnalysisService service;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp()
    {
        service = new TrendAnalysisService(new SeriesPreparationService(), TestSeries.sequentialMannKendall(),
                TestSeries.sensSlope(), new AnalysisNoteService(), new TrendClassifier());
        registry = new SimpleMeterRegistry();
        service.meterRegistry = registry;
    }

    @Test
    void annualIncreasingSeries()
    {
        TrendResult result = service.analyze(TestSeries.annualIncreasing(), AnalysisConfig.defaults());

        assertThat(result.s()).isEqualTo(55.0);
        assertThat(result.varS()).isCloseTo(165.0, within(1e-9));
        assertThat(result.tau()).isCloseTo(1.0, within(1e-12));
        assertThat(result.p()).isCloseTo(2.6e-5, within(1e-6));
        assertThat(result.slope()).isCloseTo(0.38889, within(1e-4));
        assertThat(result.direction()).isEqualTo(TrendDirection.INCREASING);
        assertThat(result.significant()).isTrue();
        assertThat(result.classification()).isEqualTo("Highly Likely Increasing");
        assertThat(result.confidence() + result.confidenceDecreasing()).isCloseTo(1.0, within(1e-12));
        assertThat(result.n()).isEqualTo(11);
        assertThat(result.nCensored()).isZero();
        assertThat(result.propUnique()).isEqualTo(1.0);
        assertThat(result.computationMode()).isEqualTo(ComputationMode.FULL);
        assertThat(result.pairsUsed()).isNull();
        assertThat(result.isSeasonal()).isFalse();
        assertThat(result.notes()).doesNotContain(AnalysisNoteService.NOTE_FEW_UNIQUE,
                AnalysisNoteService.NOTE_TIED_TIMESTAMPS);
    }

    @Test
    void decreasingSeriesHasHighDecreasingConfidence()
    {
        double[] reversed = new double[TestSeries.ANNUAL_VALUES.length];
        for (int i = 0; i < reversed.length; i++) {
            reversed[i] = TestSeries.ANNUAL_VALUES[reversed.length - 1 - i];
        }

        TrendResult result = service.analyze(TestSeries.series(2000, reversed), AnalysisConfig.defaults());

        assertThat(result.s()).isEqualTo(-55.0);
        assertThat(result.classification()).isEqualTo("Highly Likely Decreasing");
        assertThat(result.confidenceDecreasing()).isEqualTo(result.confidence());
    }

    @Test
    void inputOrderDoesNotMatter()
    {
        List<Observation> shuffled = new ArrayList<>(TestSeries.annualIncreasing());
        Collections.reverse(shuffled);

        TrendResult result = service.analyze(shuffled, AnalysisConfig.defaults());

        assertThat(result.s()).isEqualTo(55.0);
    }

    @Test
    void rescalingTimeScalesSlopeInversely()
    {
        List<Observation> stretched = TestSeries.annualIncreasing().stream()
                .map(o -> o.withTime(2.0 * o.time() + 100.0))
                .toList();

        TrendResult original = service.analyze(TestSeries.annualIncreasing(), AnalysisConfig.defaults());
        TrendResult rescaled = service.analyze(stretched, AnalysisConfig.defaults());

        assertThat(rescaled.s()).isEqualTo(original.s());
        assertThat(rescaled.p()).isEqualTo(original.p());
        assertThat(rescaled.slope()).isCloseTo(original.slope() / 2.0, within(1e-12));
    }

    @Test
    void singleObservationIsReportedNotThrown()
    {
        TrendResult result = service.analyze(TestSeries.series(1, 5.0), AnalysisConfig.defaults());

        assertThat(result.classification()).isEqualTo(TrendResult.INSUFFICIENT_DATA);
        assertThat(result.notes()).containsExactly(AnalysisNoteService.NOTE_TOO_FEW_OBSERVATIONS);
        assertThat(result.s()).isNaN();
        assertThat(result.slope()).isNaN();
        assertThat(result.n()).isEqualTo(1);
    }

    @Test
    void singleTimestampIsReported()
    {
        List<Observation> series = List.of(Observation.of(3, 1.0), Observation.of(3, 2.0), Observation.of(3, 4.0));

        TrendResult result = service.analyze(series, AnalysisConfig.defaults());

        assertThat(result.notes()).containsExactly(AnalysisNoteService.NOTE_TOO_FEW_TIMES);
        assertThat(result.p()).isNaN();
    }

    @Test
    void strictModeThrowsForUncomputableSeries()
    {
        AnalysisConfig strict = AnalysisConfig.builder().strict(true).build();

        assertThatThrownBy(() -> service.analyze(List.of(), strict))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("observations");
    }

    @Test
    void minimumSizeIsAdvisory()
    {
        AnalysisConfig config = AnalysisConfig.builder().minSize(20).build();

        TrendResult result = service.analyze(TestSeries.annualIncreasing(), config);

        assertThat(result.notes()).contains("sample size (11) below minimum (20)");
        assertThat(result.s()).isEqualTo(55.0);
    }

    @Test
    void fastModeSamplesSlopesButKeepsExactScore()
    {
        AnalysisConfig config = AnalysisConfig.builder()
                .largeDatasetMode(LargeDatasetMode.FAST)
                .maxPairs(20)
                .build();

        TrendResult first = service.analyze(TestSeries.annualIncreasing(), config);
        TrendResult second = service.analyze(TestSeries.annualIncreasing(), config);

        assertThat(first.computationMode()).isEqualTo(ComputationMode.FAST);
        assertThat(first.pairsUsed()).isEqualTo(20L);
        assertThat(first.s()).isEqualTo(55.0);
        // every pairwise slope of the annual series lies in [0.3, 0.6]
        assertThat(first.slope()).isBetween(0.3, 0.6);
        assertThat(second.slope()).isEqualTo(first.slope());
    }

    @Test
    void autoModeSwitchesAboveThreshold()
    {
        AnalysisConfig config = AnalysisConfig.builder().largeDatasetThreshold(5).maxPairs(100).build();

        TrendResult result = service.analyze(TestSeries.annualIncreasing(), config);

        assertThat(result.computationMode()).isEqualTo(ComputationMode.FAST);
        assertThat(result.pairsUsed()).isEqualTo(55L);
    }

    @Test
    void slopeIsScaledToRequestedUnit()
    {
        List<Observation> daily = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            daily.add(Observation.of(i * DAY, 2.0 * i));
        }
        AnalysisConfig config = AnalysisConfig.builder().slopeScaling(ChronoUnit.DAYS).valueUnit("mg/L").build();

        TrendResult result = service.analyze(daily, config);

        assertThat(result.scaledSlope()).isCloseTo(2.0, within(1e-9));
        assertThat(result.scaledLowerCi()).isCloseTo(2.0, within(1e-9));
        assertThat(result.scaledUpperCi()).isCloseTo(2.0, within(1e-9));
        assertThat(result.slopeUnits()).isEqualTo("mg/L per day");
    }

    @Test
    void unscaledResultHasNoUnits()
    {
        TrendResult result = service.analyze(TestSeries.annualIncreasing(), AnalysisConfig.defaults());

        assertThat(result.scaledSlope()).isNaN();
        assertThat(result.slopeUnits()).isNull();
        assertThat(TrendAnalysisService.singular(ChronoUnit.HOURS)).isEqualTo("hour");
    }

    @Test
    void ambiguousSlopeMethodChangesSlopeButNotSignificance()
    {
        List<Observation> series = TestSeries.labelled(2015, "<5", "6", "7", "<8", "9", "10");

        TrendResult dropped = service.analyze(series,
                AnalysisConfig.builder().sensSlopeMethod(SensSlopeMethod.NAN).build());
        TrendResult zeroed = service.analyze(series,
                AnalysisConfig.builder().sensSlopeMethod(SensSlopeMethod.LWP).build());

        assertThat(dropped.slope()).isCloseTo(1.0, within(1e-12));
        assertThat(zeroed.slope()).isCloseTo(0.0, within(1e-12));
        assertThat(zeroed.s()).isEqualTo(dropped.s()).isEqualTo(12.0);
        assertThat(zeroed.varS()).isEqualTo(dropped.varS());
        assertThat(zeroed.p()).isEqualTo(dropped.p());
        assertThat(zeroed.classification()).isEqualTo(dropped.classification());
        assertThat(dropped.ambiguousPairs()).isEqualTo(3);
        assertThat(dropped.leftAmbiguousPairs()).isEqualTo(3);
        assertThat(dropped.rightAmbiguousPairs()).isZero();
    }

    @Test
    void identicalCensoredSeriesHasFlatSlopeAndNoTrend()
    {
        TrendResult result = service.analyze(TestSeries.labelled(1, "<5", "<5", "<5", "<5"),
                AnalysisConfig.defaults());

        assertThat(result.s()).isZero();
        assertThat(result.p()).isEqualTo(1.0);
        assertThat(result.slope()).isZero();
        assertThat(result.direction()).isEqualTo(TrendDirection.NONE);
        assertThat(result.leftAmbiguousPairs()).isEqualTo(6);
    }

    @Test
    void identicalSeriesHasFlatSlopeAndNoTrend()
    {
        TrendResult result = service.analyze(TestSeries.series(1, 5, 5, 5, 5), AnalysisConfig.defaults());

        assertThat(result.s()).isZero();
        assertThat(result.p()).isEqualTo(1.0);
        assertThat(result.slope()).isZero();
        assertThat(result.direction()).isEqualTo(TrendDirection.NONE);
        assertThat(result.ambiguousPairs()).isZero();
    }

    @Test
    void signedZeroTimesAreOneTimestamp()
    {
        List<Observation> series = List.of(Observation.of(-0.0, 1.0), Observation.of(0.0, 2.0));

        TrendResult result = service.analyze(series, AnalysisConfig.defaults());

        assertThat(result.classification()).isEqualTo(TrendResult.INSUFFICIENT_DATA);
        assertThat(result.notes()).containsExactly(AnalysisNoteService.NOTE_TOO_FEW_TIMES);
    }

    @Test
    void metricsCountAnalysesAndAmbiguousPairs()
    {
        service.analyze(TestSeries.annualIncreasing(), AnalysisConfig.defaults());
        service.analyze(TestSeries.labelled(2015, "<5", "6", "7", "<8", "9", "10"), AnalysisConfig.defaults());
        service.analyze(TestSeries.series(1, 5.0), AnalysisConfig.defaults());

        assertThat(registry.get("trend_analyses_total").tag("kind", "non_seasonal").tag("mode", "full")
                .counter().count()).isEqualTo(3.0);
        assertThat(registry.get("trend_ambiguous_pairs_total").counter().count()).isEqualTo(3.0);
    }

    @Test
    void metricsAreOptional()
    {
        service.meterRegistry = null;

        assertThat(service.analyze(TestSeries.annualIncreasing(), AnalysisConfig.defaults()).s()).isEqualTo(55.0);
    }
}
