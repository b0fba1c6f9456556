/* (C)2026 */
package com.ammann.trend.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for the named ManagedExecutor used by the pair scan.
 *
 * <p>Provides the "pair-scan-executor" bean on which {@code MannKendallService} runs the
 * row blocks of long series. Pair evaluation is pure computation, so no request or
 * transaction context is propagated.
 */
@ApplicationScoped
public class ExecutorProducer {

    @ConfigProperty(name = "trend.pair-scan.max-threads", defaultValue = "4")
    int maxThreads = 4;

    @ConfigProperty(name = "trend.pair-scan.queue-size", defaultValue = "-1")
    int queueSize = -1;

    /**
     * Produces the pair-scan executor.
     *
     * <p>Configuration properties:
     * <ul>
     *   <li>trend.pair-scan.max-threads</li>
     *   <li>trend.pair-scan.queue-size (-1 for unbounded)</li>
     * </ul>
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named("pair-scan-executor")
    @ApplicationScoped
    public ManagedExecutor createPairScanExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(Math.max(1, maxThreads))
                .maxQueued(queueSize)
                .propagated()
                .cleared(ThreadContext.ALL_REMAINING)
                .build();
    }
}
