/* (C)2026 */
package com.ammann.trend.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * REST path constants shared by the JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Trend analysis endpoints
     */
    public static final class Trends {
        private Trends() {}

        public static final String BASE = "/trends";
        public static final String MANN_KENDALL = BASE + "/mann-kendall";
        public static final String SEASONAL = BASE + "/seasonal";
        public static final String CLASSIFY = BASE + "/classify";
        public static final String SEASONALITY = BASE + "/seasonality";
    }
}
