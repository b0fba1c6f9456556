/* (C)2026 */
package com.ammann.trend.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.trend.dto.ClassificationResponseDTO;
import com.ammann.trend.dto.ClassifyRequestDTO;
import com.ammann.trend.dto.SeasonalityResponseDTO;
import com.ammann.trend.dto.TrendResultDTO;
import com.ammann.trend.exception.ValidationException;
import com.ammann.trend.model.AnalysisConfig;
import com.ammann.trend.service.AnalysisNoteService;
import com.ammann.trend.service.MannKendallService;
import com.ammann.trend.service.SensSlopeService;
import com.ammann.trend.service.SeasonalTrendService;
import com.ammann.trend.service.SeasonalityTestService;
import com.ammann.trend.service.SeriesPreparationService;
import com.ammann.trend.service.TrendAnalysisService;
import com.ammann.trend.service.TrendClassifier;
import com.ammann.trend.support.TestRequests;
import com.ammann.trend.support.TestSeries;
import jakarta.ws.rs.core.Response;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TrendResourceTest {

    @Test
    void analyzeTrendReturnsResult() {
        TrendResource resource = buildResource();

        Response response = resource.analyzeTrend(TestRequests.of(2000, TestSeries.ANNUAL_VALUES));
        TrendResultDTO dto = (TrendResultDTO) response.getEntity();

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(dto.s()).isEqualTo(55.0);
        assertThat(dto.classification()).isEqualTo("Highly Likely Increasing");
    }

    @Test
    void analyzeTrendRejectsMissingBody() {
        TrendResource resource = buildResource();

        assertThatThrownBy(() -> resource.analyzeTrend(null))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Request body is required");
    }

    @Test
    void strictRequestWithSingleObservationIsRejected() {
        TrendResource resource = buildResource();

        assertThatThrownBy(() -> resource.analyzeTrend(TestRequests.fromJson(
                "{\"observations\": [{\"time\": 1, \"value\": 2}], \"strict\": true}")))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void analyzeSeasonalTrendUsesRequestedSeasons() {
        TrendResource resource = buildResource();

        Response response = resource.analyzeSeasonalTrend(TestRequests.fromJson("""
                {
                  "observations": [
                    {"time": 0, "value": 3}, {"time": 1, "value": 13},
                    {"time": 2, "value": 2}, {"time": 3, "value": 12},
                    {"time": 4, "value": 1}, {"time": 5, "value": 11}
                  ],
                  "seasonType": "PERIOD",
                  "period": 2
                }
                """));
        TrendResultDTO dto = (TrendResultDTO) response.getEntity();

        assertThat(dto.s()).isEqualTo(-6.0);
        assertThat(dto.seasonCount()).isEqualTo(2);
        assertThat(dto.direction()).isEqualTo("DECREASING");
    }

    @Test
    void classifyWithDefaultTable() {
        TrendResource resource = buildResource();

        Response response = resource.classify(new ClassifyRequestDTO(0.93, "decreasing", null));
        ClassificationResponseDTO dto = (ClassificationResponseDTO) response.getEntity();

        assertThat(dto.classification()).isEqualTo("Very Likely Decreasing");
        assertThat(dto.direction()).isEqualTo("DECREASING");
        assertThat(dto.categories()).containsEntry(0.95, "Highly Likely");
    }

    @Test
    void classifyWithCustomTable() {
        TrendResource resource = buildResource();

        Response response = resource.classify(new ClassifyRequestDTO(0.6, "INCREASING", Map.of(0.75, "Probable")));
        ClassificationResponseDTO dto = (ClassificationResponseDTO) response.getEntity();

        assertThat(dto.classification()).isEqualTo("No Trend");
    }

    @Test
    void classifyWithoutConfidenceIsInsufficientData() {
        TrendResource resource = buildResource();

        Response response = resource.classify(new ClassifyRequestDTO(null, "INCREASING", null));

        assertThat(((ClassificationResponseDTO) response.getEntity()).classification())
                .isEqualTo("Insufficient Data");
    }

    @Test
    void classifyRejectsInvalidInput() {
        TrendResource resource = buildResource();

        assertThatThrownBy(() -> resource.classify(new ClassifyRequestDTO(1.2, "INCREASING", null)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("confidence");
        assertThatThrownBy(() -> resource.classify(new ClassifyRequestDTO(0.9, null, null)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("direction");
        assertThatThrownBy(() -> resource.classify(new ClassifyRequestDTO(0.9, "upwards", null)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> resource.classify(new ClassifyRequestDTO(0.9, "INCREASING", Map.of())))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void testSeasonalityReturnsKruskalWallis() {
        TrendResource resource = buildResource();

        Response response = resource.testSeasonality(TestRequests.fromJson("""
                {
                  "observations": [
                    {"time": 0, "value": 1}, {"time": 1, "value": 11}, {"time": 2, "value": 21},
                    {"time": 3, "value": 2}, {"time": 4, "value": 12}, {"time": 5, "value": 22},
                    {"time": 6, "value": 3}, {"time": 7, "value": 13}, {"time": 8, "value": 23}
                  ],
                  "seasonType": "PERIOD",
                  "period": 3
                }
                """));
        SeasonalityResponseDTO dto = (SeasonalityResponseDTO) response.getEntity();

        assertThat(dto.seasonsTested()).isEqualTo(3);
        assertThat(dto.degreesOfFreedom()).isEqualTo(2);
        assertThat(dto.seasonal()).isTrue();
        assertThat(dto.notes()).isNull();
    }

    private TrendResource buildResource() {
        SeriesPreparationService preparation = new SeriesPreparationService();
        MannKendallService mannKendall = TestSeries.sequentialMannKendall();
        SensSlopeService sensSlope = TestSeries.sensSlope();
        AnalysisNoteService notes = new AnalysisNoteService();
        TrendClassifier classifier = new TrendClassifier();
        TrendAnalysisService trendAnalysis = new TrendAnalysisService(preparation, mannKendall, sensSlope, notes,
                classifier);
        SeasonalTrendService seasonalTrend = new SeasonalTrendService(preparation, mannKendall, sensSlope, notes,
                trendAnalysis);

        TrendResource resource = new TrendResource();
        resource.trendAnalysisService = trendAnalysis;
        resource.seasonalTrendService = seasonalTrend;
        resource.seasonalityTestService = new SeasonalityTestService(preparation, seasonalTrend);
        resource.trendClassifier = classifier;
        resource.analysisDefaults = AnalysisConfig.defaults();
        return resource;
    }
}
