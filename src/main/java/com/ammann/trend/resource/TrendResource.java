/* (C)2026 */
package com.ammann.trend.resource;

import com.ammann.trend.dto.ClassificationResponseDTO;
import com.ammann.trend.dto.ClassifyRequestDTO;
import com.ammann.trend.dto.SeasonalityResponseDTO;
import com.ammann.trend.dto.TrendRequestDTO;
import com.ammann.trend.dto.TrendResultDTO;
import com.ammann.trend.enumeration.TrendDirection;
import com.ammann.trend.exception.ValidationException;
import com.ammann.trend.model.AnalysisConfig;
import com.ammann.trend.model.ConfidenceCategories;
import com.ammann.trend.model.Observation;
import com.ammann.trend.model.SeasonalityResult;
import com.ammann.trend.model.TrendResult;
import com.ammann.trend.properties.ApiProperties;
import com.ammann.trend.service.SeasonalTrendService;
import com.ammann.trend.service.SeasonalityTestService;
import com.ammann.trend.service.TrendAnalysisService;
import com.ammann.trend.service.TrendClassifier;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for trend analysis of censored environmental time series.
 *
 * <p>Each request carries the full series; nothing is stored between requests. Settings
 * missing from a request are taken from the configured defaults.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Trend API", description = "Mann-Kendall trend test and Sen's slope for censored data")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class TrendResource {

    private static final Logger LOG = Logger.getLogger(TrendResource.class);

    @Inject
    TrendAnalysisService trendAnalysisService;

    @Inject
    SeasonalTrendService seasonalTrendService;

    @Inject
    SeasonalityTestService seasonalityTestService;

    @Inject
    TrendClassifier trendClassifier;

    @Inject
    AnalysisConfig analysisDefaults;

    @POST
    @Path(ApiProperties.Trends.MANN_KENDALL)
    @Operation(
            summary = "Mann-Kendall Trend Test",
            description = "Runs the censoring-aware Mann-Kendall test with Sen's slope and confidence interval on one series"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Trend analysis completed",
                    content = @Content(schema = @Schema(implementation = TrendResultDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid observations or settings, or insufficient data in strict mode"),
            @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response analyzeTrend(TrendRequestDTO request) {
        requireBody(request);
        List<Observation> observations = request.toObservations();
        AnalysisConfig config = request.toConfig(analysisDefaults);

        LOG.debugf("Mann-Kendall request: %d observations, config=%s", observations.size(), config);

        TrendResult result = trendAnalysisService.analyze(observations, config);
        return Response.ok(TrendResultDTO.from(result)).build();
    }

    @POST
    @Path(ApiProperties.Trends.SEASONAL)
    @Operation(
            summary = "Seasonal Kendall Trend Test",
            description = "Splits the series by season key, pools the per-season scores and estimates Sen's slope over the union of season slopes"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Seasonal trend analysis completed",
                    content = @Content(schema = @Schema(implementation = TrendResultDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid observations or settings, or insufficient data in strict mode"),
            @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response analyzeSeasonalTrend(TrendRequestDTO request) {
        requireBody(request);
        List<Observation> observations = request.toObservations();
        AnalysisConfig config = request.toConfig(analysisDefaults);

        LOG.debugf("Seasonal request: %d observations, season=%s", observations.size(), config.getSeasonType());

        TrendResult result = seasonalTrendService.analyze(observations, config);
        return Response.ok(TrendResultDTO.from(result)).build();
    }

    @POST
    @Path(ApiProperties.Trends.CLASSIFY)
    @Operation(
            summary = "Classify Trend Confidence",
            description = "Maps a confidence and direction to a likelihood label using the default or a custom threshold table"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Classification computed",
                    content = @Content(schema = @Schema(implementation = ClassificationResponseDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid confidence, direction or table"),
            @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response classify(ClassifyRequestDTO request) {
        requireBody(request);
        if (request.direction() == null) {
            throw ValidationException.invalidParameter("direction", null, "INCREASING, DECREASING or NONE");
        }
        Double confidence = request.confidence();
        if (confidence != null && !(confidence >= 0.0 && confidence <= 1.0)) {
            throw ValidationException.invalidParameter("confidence", confidence, "a value in [0, 1]");
        }

        TrendDirection direction;
        ConfidenceCategories categories;
        try {
            direction = TrendDirection.fromString(request.direction());
            categories = request.categoryMap() == null
                    ? analysisDefaults.getCategories()
                    : ConfidenceCategories.of(request.categoryMap());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }

        String classification = trendClassifier.classify(
                confidence == null ? Double.NaN : confidence, direction, categories);
        return Response.ok(new ClassificationResponseDTO(
                classification, confidence, direction.name(), categories.asMap())).build();
    }

    @POST
    @Path(ApiProperties.Trends.SEASONALITY)
    @Operation(
            summary = "Kruskal-Wallis Seasonality Test",
            description = "Tests whether the value distributions differ between seasons, to decide between the seasonal and non-seasonal test"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Seasonality test completed",
                    content = @Content(schema = @Schema(implementation = SeasonalityResponseDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid observations or settings"),
            @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response testSeasonality(TrendRequestDTO request) {
        requireBody(request);
        List<Observation> observations = request.toObservations();
        AnalysisConfig config = request.toConfig(analysisDefaults);

        SeasonalityResult result = seasonalityTestService.test(observations, config);
        LOG.infof("Seasonality test completed: n=%d seasons=%d H=%.4f p=%.4g",
                observations.size(), result.seasonsTested(), result.h(), result.p());
        return Response.ok(SeasonalityResponseDTO.from(result)).build();
    }

    private static void requireBody(Object request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
    }
}
