package com.sop.network.metrics;

import com.sop.network.core.model.ReferenceStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code sop.parse.duration}: Timer</li>
 *   <li>{@code sop.resolution.duration}: Timer</li>
 *   <li>{@code sop.reference.outcome}: Counter (tag: status)</li>
 *   <li>{@code sop.merge.nodes}: DistributionSummary</li>
 *   <li>{@code sop.locator.cache.hit} and {@code sop.locator.cache.miss}: Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Timer parseTimer;
    private final Timer resolutionTimer;
    private final Map<ReferenceStatus, Counter> outcomeCounters = new EnumMap<>(ReferenceStatus.class);
    private final DistributionSummary mergedNodesSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.parseTimer = Timer.builder("sop.parse.duration")
                .description("Duration of parsing and building one document")
                .register(registry);
        this.resolutionTimer = Timer.builder("sop.resolution.duration")
                .description("Duration of one deep-link resolution pass")
                .register(registry);
        for (ReferenceStatus status : ReferenceStatus.values()) {
            outcomeCounters.put(status, Counter.builder("sop.reference.outcome")
                    .description("Reference resolution outcomes")
                    .tag("status", status.getTag())
                    .register(registry));
        }
        this.mergedNodesSummary = DistributionSummary.builder("sop.merge.nodes")
                .description("Nodes copied into the main network per merge")
                .register(registry);
        this.cacheHitCounter = Counter.builder("sop.locator.cache.hit")
                .description("Document locator cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("sop.locator.cache.miss")
                .description("Document locator cache misses")
                .register(registry);
    }

    @Override
    public void recordParseDuration(Duration duration) {
        parseTimer.record(duration);
    }

    @Override
    public void recordResolutionDuration(Duration duration) {
        resolutionTimer.record(duration);
    }

    @Override
    public void incrementReferenceOutcome(ReferenceStatus status) {
        outcomeCounters.get(status).increment();
    }

    @Override
    public void recordMergedNodes(int count) {
        mergedNodesSummary.record(count);
    }

    @Override
    public void recordLocatorCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordLocatorCacheMiss() {
        cacheMissCounter.increment();
    }
}
