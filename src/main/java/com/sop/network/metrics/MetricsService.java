package com.sop.network.metrics;

import com.sop.network.core.model.ReferenceStatus;

import java.time.Duration;

/**
 * Records metrics for parsing, building and deep-link resolution.
 * The default {@link NoOpMetricsService} does nothing, so the library runs
 * without any metrics dependency on the classpath.
 */
public interface MetricsService {

    /**
     * Time to parse and build one document.
     */
    void recordParseDuration(Duration duration);

    /**
     * Time for one {@code resolveAll} pass.
     */
    void recordResolutionDuration(Duration duration);

    /**
     * Final status of one reference resolution attempt.
     */
    void incrementReferenceOutcome(ReferenceStatus status);

    /**
     * Number of nodes copied into the main network by one merge.
     */
    void recordMergedNodes(int count);

    void recordLocatorCacheHit();

    void recordLocatorCacheMiss();
}
