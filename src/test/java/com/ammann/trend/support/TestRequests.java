/* (C)2026 */
package com.ammann.trend.support;

import com.ammann.trend.dto.ObservationDTO;
import com.ammann.trend.dto.TrendRequestDTO;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;

/**
 * Request bodies for DTO and resource tests, read through Jackson the way the REST layer
 * reads them.
 */
public final class TestRequests {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TestRequests() {}

    public static TrendRequestDTO fromJson(String json) {
        try {
            return MAPPER.readValue(json, TrendRequestDTO.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid test request: " + json, e);
        }
    }

    /** Uncensored observations at consecutive integer times, without any settings. */
    public static TrendRequestDTO of(double firstTime, double... values) {
        return withObservations(observations(firstTime, values));
    }

    public static TrendRequestDTO withObservations(List<ObservationDTO> observations) {
        return new TrendRequestDTO(observations, null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public static List<ObservationDTO> observations(double firstTime, double... values) {
        List<ObservationDTO> result = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            result.add(new ObservationDTO(firstTime + i, values[i], null, null));
        }
        return result;
    }
}
