/* (C)2026 */
package com.ammann.trend.health;

import com.ammann.trend.model.ComparisonPolicy;
import com.ammann.trend.model.MannKendallStatistic;
import com.ammann.trend.model.Observation;
import com.ammann.trend.service.MannKendallService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

/**
 * Readiness check that runs the Mann-Kendall scan on a fixed strictly increasing series
 * and compares the score with its known value.
 *
 * <p>The series is below the parallel threshold, so the scan runs on the calling thread
 * and the check does not report on the pair-scan executor. The analysis services are
 * bypassed so readiness calls do not count towards the analysis metrics.
 */
@Readiness
@ApplicationScoped
public class TrendEngineHealthCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(TrendEngineHealthCheck.class);
    private static final String HEALTH_CHECK_NAME = "trend-engine";

    static final List<Observation> CHECK_SERIES = List.of(
            Observation.of(1, 1.0),
            Observation.of(2, 2.0),
            Observation.of(3, 3.0),
            Observation.of(4, 4.0),
            Observation.of(5, 5.0));
    static final long EXPECTED_S = 10;

    private final MannKendallService mannKendall;

    @Inject
    public TrendEngineHealthCheck(MannKendallService mannKendall) {
        this.mannKendall = mannKendall;
    }

    @Override
    public HealthCheckResponse call() {
        long startTime = System.currentTimeMillis();
        HealthCheckResponseBuilder builder = HealthCheckResponse.named(HEALTH_CHECK_NAME)
                .withData("expected-s", EXPECTED_S);

        try {
            MannKendallStatistic statistic = mannKendall.compute(CHECK_SERIES, ComparisonPolicy.robust());
            builder.withData("s", statistic.s())
                    .withData("last-check-ms", System.currentTimeMillis() - startTime);

            if (statistic.s() == EXPECTED_S) {
                return builder.up().build();
            }
            LOG.warnf("Trend engine check returned S=%d, expected %d", statistic.s(), EXPECTED_S);
            return builder.down().build();

        } catch (RuntimeException e) {
            LOG.error("Trend engine check failed", e);
            return builder.withData("error", String.valueOf(e.getMessage())).down().build();
        }
    }
}
