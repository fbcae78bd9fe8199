package com.sop.network.metrics;

import com.sop.network.core.model.ReferenceStatus;

import java.time.Duration;

/**
 * Metrics sink that drops everything.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordParseDuration(Duration duration) {
    }

    @Override
    public void recordResolutionDuration(Duration duration) {
    }

    @Override
    public void incrementReferenceOutcome(ReferenceStatus status) {
    }

    @Override
    public void recordMergedNodes(int count) {
    }

    @Override
    public void recordLocatorCacheHit() {
    }

    @Override
    public void recordLocatorCacheMiss() {
    }
}
