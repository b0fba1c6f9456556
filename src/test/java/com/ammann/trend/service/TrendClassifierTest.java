/* (C)2026 */
package com.ammann.trend.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.trend.enumeration.TrendDirection;
import com.ammann.trend.model.AnalysisConfig;
import com.ammann.trend.model.ConfidenceCategories;
import com.ammann.trend.model.TrendResult;
import com.ammann.trend.support.TestSeries;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TrendClassifierTest {

    private final TrendClassifier classifier = new TrendClassifier();

    @ParameterizedTest(name = "{0} {1} -> {2}")
    @CsvSource({
            "0.99, INCREASING, Highly Likely Increasing",
            "0.95, INCREASING, Highly Likely Increasing",
            "0.94, DECREASING, Very Likely Decreasing",
            "0.90, DECREASING, Very Likely Decreasing",
            "0.70, INCREASING, Likely Increasing",
            "0.50, DECREASING, As Likely as Not Decreasing"
    })
    @DisplayName("Default table follows the likelihood ladder")
    void defaultTable(double confidence, TrendDirection direction, String expected) {
        assertThat(classifier.classify(confidence, direction, ConfidenceCategories.DEFAULT)).isEqualTo(expected);
        assertThat(classifier.classify(confidence, direction, null)).isEqualTo(expected);
    }

    @Test
    void nanConfidenceIsInsufficientData() {
        assertThat(classifier.classify(Double.NaN, TrendDirection.INCREASING, ConfidenceCategories.DEFAULT))
                .isEqualTo(TrendResult.INSUFFICIENT_DATA);
    }

    @Test
    void zeroScoreHasNoTrend() {
        assertThat(classifier.classify(0.99, TrendDirection.NONE, ConfidenceCategories.DEFAULT))
                .isEqualTo(TrendClassifier.NO_TREND);
    }

    @Test
    void confidenceBelowEveryThresholdHasNoTrend() {
        ConfidenceCategories strict = ConfidenceCategories.of(Map.of(0.8, "Probable"));

        assertThat(classifier.classify(0.5, TrendDirection.INCREASING, strict)).isEqualTo("No Trend");
        assertThat(classifier.classify(0.85, TrendDirection.INCREASING, strict)).isEqualTo("Probable Increasing");
    }

    @Test
    void finishedResultCanBeReclassified() {
        TrendAnalysisService analysis = new TrendAnalysisService(new SeriesPreparationService(),
                TestSeries.sequentialMannKendall(), TestSeries.sensSlope(), new AnalysisNoteService(), classifier);
        TrendResult result = analysis.analyze(TestSeries.annualIncreasing(), AnalysisConfig.defaults());

        assertThat(classifier.classify(result)).isEqualTo(result.classification());
        assertThat(classifier.classify(result, ConfidenceCategories.of(Map.of(0.0, "Certain"))))
                .isEqualTo("Certain Increasing");
    }
}
