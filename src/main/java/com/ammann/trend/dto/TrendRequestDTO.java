/* (C)2026 */
package com.ammann.trend.dto;

import com.ammann.trend.enumeration.CiMethod;
import com.ammann.trend.enumeration.ComparisonMethod;
import com.ammann.trend.enumeration.LargeDatasetMode;
import com.ammann.trend.enumeration.SeasonType;
import com.ammann.trend.enumeration.SensSlopeMethod;
import com.ammann.trend.enumeration.TieBreakMethod;
import com.ammann.trend.exception.ValidationException;
import com.ammann.trend.model.AnalysisConfig;
import com.ammann.trend.model.ConfidenceCategories;
import com.ammann.trend.model.Observation;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Series plus optional analysis settings. Every setting left out of the request is taken
 * from the configured defaults.
 */
@Schema(description = "Observations to analyse plus optional settings overriding the configured defaults")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrendRequestDTO(
        @Schema(description = "Observations in any order", required = true)
        List<ObservationDTO> observations,

        @Schema(description = "Pair comparison: ROBUST (default) or SUBSTITUTION / lwp")
        String mkTestMethod,

        @Schema(description = "Treatment of ambiguous slopes: NAN (drop) or LWP (count as 0)")
        String sensSlopeMethod,

        @Schema(description = "Confidence interval method: DIRECT or LWP")
        String ciMethod,

        @Schema(description = "Tie-break increment for substituted values: STANDARD or LWP")
        String tieBreakMethod,

        @Schema(description = "Significance level in (0, 1)", example = "0.05")
        Double alpha,

        @Schema(description = "Multiplier applied to left-censor limits under SUBSTITUTION", example = "0.5")
        Double ltMult,

        @Schema(description = "Multiplier applied to right-censor limits under SUBSTITUTION", example = "1.0")
        Double gtMult,

        @Schema(description = "Re-censor everything below the highest left-censor limit")
        Boolean hicensor,

        @Schema(description = "Explicit hicensor limit instead of the highest left-censor limit")
        Double hicensorLimit,

        @Schema(description = "Season key: MONTH, QUARTER, DAY_OF_WEEK, HOUR, MINUTE, DAY_OF_YEAR, WEEK_OF_YEAR or PERIOD")
        String seasonType,

        @Schema(description = "Cycle length for PERIOD seasons")
        Integer period,

        @Schema(description = "Advisory minimum sample size")
        Integer minSize,

        @Schema(description = "Advisory minimum observations per season")
        Integer minSizePerSeason,

        @Schema(description = "Seasons with fewer observations are skipped")
        Integer minSeasonObservations,

        @Schema(description = "Reject series on which no statistic is computable instead of returning 'Insufficient Data'")
        Boolean strict,

        @Schema(description = "Large-series handling: AUTO, FULL or FAST")
        String largeDatasetMode,

        @Schema(description = "Upper bound of sampled slope pairs in FAST mode")
        Long maxPairs,

        @Schema(description = "Seed for FAST mode sampling")
        Long randomSeed,

        @Schema(description = "Express the slope per SECONDS, MINUTES, HOURS, DAYS, WEEKS, MONTHS or YEARS")
        String slopeScaling,

        @Schema(description = "Unit label of the values, used in the slope unit text")
        String valueUnit,

        @Schema(description = "Custom confidence table: lower bound in [0, 1] to label")
        Map<Double, String> categoryMap
) {
    /**
     * @throws ValidationException if the list is missing or an entry is incomplete
     */
    public List<Observation> toObservations() {
        if (observations == null || observations.isEmpty()) {
            throw ValidationException.invalidParameter("observations", observations == null ? null : "[]",
                    "a non-empty list");
        }
        List<Observation> result = new ArrayList<>(observations.size());
        for (int i = 0; i < observations.size(); i++) {
            ObservationDTO entry = observations.get(i);
            if (entry == null) {
                throw ValidationException.invalidParameter("observations[" + i + "]", null, "an observation");
            }
            result.add(entry.toObservation(i));
        }
        return result;
    }

    /**
     * Merges the request settings onto {@code defaults}.
     *
     * @throws ValidationException if a setting is unknown or out of range
     */
    public AnalysisConfig toConfig(AnalysisConfig defaults) {
        AnalysisConfig.Builder builder = defaults.toBuilder();
        if (mkTestMethod != null) builder.mkTestMethod(parse("mkTestMethod", mkTestMethod, ComparisonMethod::fromString));
        if (sensSlopeMethod != null) builder.sensSlopeMethod(parse("sensSlopeMethod", sensSlopeMethod, SensSlopeMethod::fromString));
        if (ciMethod != null) builder.ciMethod(parse("ciMethod", ciMethod, CiMethod::fromString));
        if (tieBreakMethod != null) builder.tieBreakMethod(parse("tieBreakMethod", tieBreakMethod, TieBreakMethod::fromString));
        if (alpha != null) builder.alpha(alpha);
        if (ltMult != null) builder.ltMult(ltMult);
        if (gtMult != null) builder.gtMult(gtMult);
        if (hicensor != null) builder.hicensor(hicensor);
        if (hicensorLimit != null) builder.hicensorLimit(hicensorLimit);
        if (seasonType != null) builder.seasonType(parse("seasonType", seasonType, SeasonType::fromString));
        if (period != null) builder.period(period);
        if (minSize != null) builder.minSize(minSize);
        if (minSizePerSeason != null) builder.minSizePerSeason(minSizePerSeason);
        if (minSeasonObservations != null) builder.minSeasonObservations(minSeasonObservations);
        if (strict != null) builder.strict(strict);
        if (largeDatasetMode != null) builder.largeDatasetMode(parse("largeDatasetMode", largeDatasetMode, LargeDatasetMode::fromString));
        if (maxPairs != null) builder.maxPairs(maxPairs);
        if (randomSeed != null) builder.randomSeed(randomSeed);
        if (slopeScaling != null) builder.slopeScaling(parse("slopeScaling", slopeScaling, TrendRequestDTO::scalingUnit));
        if (valueUnit != null) builder.valueUnit(valueUnit);
        if (categoryMap != null) builder.categories(parse("categoryMap", categoryMap, ConfidenceCategories::of));

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }
    }

    static ChronoUnit scalingUnit(String value) {
        String name = value.trim().toUpperCase(Locale.ROOT);
        return ChronoUnit.valueOf(name.endsWith("S") ? name : name + "S");
    }

    private static <S, T> T parse(String field, S value, Function<S, T> parser) {
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(
                    String.format("Invalid parameter '%s': %s", field, e.getMessage()), e);
        }
    }
}
