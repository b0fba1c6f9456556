/* (C)2026 */
package com.ammann.trend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Likelihood classification of a trend")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClassificationResponseDTO(
        @Schema(description = "Classification label, e.g. 'Likely Decreasing'")
        String classification,

        @Schema(description = "Confidence that was classified")
        Double confidence,

        @Schema(description = "Direction that was classified")
        String direction,

        @Schema(description = "Threshold table used, highest bound first")
        Map<Double, String> categories
) {}
