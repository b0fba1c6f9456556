/* (C)2026 */
package com.ammann.trend.dto;

import com.ammann.trend.model.TrendResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * JSON view of a {@link TrendResult}. Statistics that could not be computed are omitted
 * instead of being written as {@code NaN}.
 */
@Schema(description = "Mann-Kendall test and Sen's slope result with data-quality notes")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrendResultDTO(
        @Schema(description = "Mann-Kendall score S")
        Double s,

        @Schema(description = "Tie-corrected variance of S")
        Double varS,

        @Schema(description = "Continuity-corrected normal score")
        Double z,

        @Schema(description = "Two-sided p-value")
        Double p,

        @Schema(description = "Kendall's tau-b")
        Double tau,

        @Schema(description = "Sen's slope per unit of the input time axis")
        Double slope,

        @Schema(description = "Intercept of the Sen line")
        Double intercept,

        @Schema(description = "Lower confidence bound of the slope")
        Double lowerCi,

        @Schema(description = "Upper confidence bound of the slope")
        Double upperCi,

        @Schema(description = "Confidence in the detected direction (1 - p/2)")
        Double confidence,

        @Schema(description = "Confidence that the trend is decreasing")
        Double confidenceDecreasing,

        @Schema(description = "Trend direction", enumeration = {"INCREASING", "DECREASING", "NONE"})
        String direction,

        @Schema(description = "p below alpha")
        Boolean significant,

        @Schema(description = "Likelihood classification, e.g. 'Very Likely Increasing'")
        String classification,

        @Schema(description = "Data-quality advisories")
        List<String> notes,

        @Schema(description = "Observations analysed")
        Integer n,

        @Schema(description = "Censored observations")
        Integer nCensored,

        @Schema(description = "Distinct censor levels")
        Integer nUniqueCensorLevels,

        @Schema(description = "Significance level used")
        Double alpha,

        @Schema(description = "Share of censored observations")
        Double propCensored,

        @Schema(description = "Share of distinct reported values")
        Double propUnique,

        @Schema(description = "Probability that the true slope is below zero")
        Double senProbability,

        @Schema(description = "Sen probability using the highest tie rank")
        Double senProbabilityMax,

        @Schema(description = "Sen probability using the lowest tie rank")
        Double senProbabilityMin,

        @Schema(description = "Pairs whose ordering was ambiguous under censoring")
        Long ambiguousPairs,

        @Schema(description = "Ambiguous pairs involving a left-censored value")
        Long leftAmbiguousPairs,

        @Schema(description = "Ambiguous pairs involving a right-censored value")
        Long rightAmbiguousPairs,

        @Schema(description = "Pairs sharing a timestamp")
        Long tiedTimePairs,

        @Schema(description = "FULL when every slope pair was evaluated, FAST when sampled")
        String computationMode,

        @Schema(description = "Slope pairs sampled in FAST mode")
        Long pairsUsed,

        @Schema(description = "Season keys skipped for having too few observations")
        List<Integer> seasonsSkipped,

        @Schema(description = "Seasons contributing to a seasonal result")
        Integer seasonCount,

        @Schema(description = "Slope expressed per slopeUnits")
        Double scaledSlope,

        @Schema(description = "Unit text of the scaled slope, e.g. 'mg/L per year'")
        String slopeUnits,

        @Schema(description = "Lower confidence bound in scaled units")
        Double scaledLowerCi,

        @Schema(description = "Upper confidence bound in scaled units")
        Double scaledUpperCi
) {
    public static TrendResultDTO from(TrendResult result) {
        return new TrendResultDTO(
                finite(result.s()),
                finite(result.varS()),
                finite(result.z()),
                finite(result.p()),
                finite(result.tau()),
                finite(result.slope()),
                finite(result.intercept()),
                finite(result.lowerCi()),
                finite(result.upperCi()),
                finite(result.confidence()),
                finite(result.confidenceDecreasing()),
                result.direction().name(),
                result.significant(),
                result.classification(),
                result.notes(),
                result.n(),
                result.nCensored(),
                result.nUniqueCensorLevels(),
                result.alpha(),
                finite(result.propCensored()),
                finite(result.propUnique()),
                finite(result.senProbability()),
                finite(result.senProbabilityMax()),
                finite(result.senProbabilityMin()),
                result.ambiguousPairs(),
                result.leftAmbiguousPairs(),
                result.rightAmbiguousPairs(),
                result.tiedTimePairs(),
                result.computationMode().name(),
                result.pairsUsed(),
                result.seasonsSkipped().isEmpty() ? null : result.seasonsSkipped(),
                result.isSeasonal() ? result.seasonCount() : null,
                finite(result.scaledSlope()),
                result.slopeUnits(),
                finite(result.scaledLowerCi()),
                finite(result.scaledUpperCi())
        );
    }

    static Double finite(double value) {
        return Double.isFinite(value) ? value : null;
    }
}
