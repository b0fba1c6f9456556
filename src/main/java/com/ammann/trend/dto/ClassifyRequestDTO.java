/* (C)2026 */
package com.ammann.trend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Confidence and direction to classify, optionally against a custom table")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClassifyRequestDTO(
        @Schema(description = "Confidence in the direction, in [0, 1]; absent for insufficient data", example = "0.93")
        Double confidence,

        @Schema(description = "INCREASING, DECREASING or NONE", required = true)
        String direction,

        @Schema(description = "Custom confidence table: lower bound in [0, 1] to label")
        Map<Double, String> categoryMap
) {}
