/* (C)2026 */
package com.ammann.trend.dto;

import com.ammann.trend.model.SeasonalityResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Kruskal-Wallis test for a difference between seasons")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SeasonalityResponseDTO(
        @Schema(description = "Tie-corrected H statistic")
        Double h,

        @Schema(description = "p-value from the chi-squared distribution")
        Double p,

        @Schema(description = "Degrees of freedom (seasons - 1)")
        Integer degreesOfFreedom,

        @Schema(description = "Seasons that contributed observations")
        Integer seasonsTested,

        @Schema(description = "p below alpha")
        Boolean seasonal,

        @Schema(description = "Observations per season key")
        Map<Integer, Integer> seasonCounts,

        @Schema(description = "Advisories")
        List<String> notes
) {
    public static SeasonalityResponseDTO from(SeasonalityResult result) {
        return new SeasonalityResponseDTO(
                TrendResultDTO.finite(result.h()),
                TrendResultDTO.finite(result.p()),
                result.degreesOfFreedom(),
                result.seasonsTested(),
                result.seasonal(),
                result.seasonCounts(),
                result.notes().isEmpty() ? null : result.notes()
        );
    }
}
