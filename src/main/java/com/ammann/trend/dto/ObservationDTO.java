/* (C)2026 */
package com.ammann.trend.dto;

import com.ammann.trend.enumeration.CensorKind;
import com.ammann.trend.exception.ValidationException;
import com.ammann.trend.model.Observation;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "One sample of the series; censored samples carry a detection limit instead of a value")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ObservationDTO(
        @Schema(description = "Numeric time; epoch seconds when calendar seasons are used", required = true)
        Double time,

        @Schema(description = "Measured value; for censored samples it is read as the limit when 'limit' is absent")
        Double value,

        @Schema(description = "Censoring state: NONE, LEFT ('<limit') or RIGHT ('>limit')", defaultValue = "NONE")
        String censor,

        @Schema(description = "Detection limit of a censored sample")
        Double limit
) {
    /**
     * Converts to the engine representation.
     *
     * @param index position in the request, used in error messages
     * @throws ValidationException if time, value or limit is missing or the censor label is unknown
     */
    public Observation toObservation(int index) {
        String field = "observations[" + index + "]";
        if (time == null) {
            throw ValidationException.invalidParameter(field + ".time", null, "a number");
        }

        CensorKind kind;
        try {
            kind = censor == null || censor.isBlank() ? CensorKind.NONE : CensorKind.fromString(censor);
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidParameter(field + ".censor", censor, "NONE, LEFT or RIGHT");
        }

        if (kind == CensorKind.NONE) {
            if (value == null) {
                throw ValidationException.invalidParameter(field + ".value", null, "a number");
            }
            return Observation.of(time, value);
        }

        Double bound = limit != null ? limit : value;
        if (bound == null) {
            throw ValidationException.invalidParameter(field + ".limit", null, "a detection limit for a censored sample");
        }
        return Observation.censored(time, bound, kind);
    }
}
