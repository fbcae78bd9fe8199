package com.sop.network.resolve;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.sop.network.cache.CacheConfig;
import com.sop.network.metrics.MetricsService;
import com.sop.network.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Caffeine-backed cache in front of another {@link DocumentLocator}.
 * Codes are cached case-insensitively; read failures are never cached.
 */
public class CachingDocumentLocator implements DocumentLocator {
    private static final Logger log = LoggerFactory.getLogger(CachingDocumentLocator.class);

    private final DocumentLocator delegate;
    private final CacheConfig config;
    private final Cache<String, LocatorResult> cache;
    private final MetricsService metricsService;

    public CachingDocumentLocator(DocumentLocator delegate, CacheConfig config) {
        this(delegate, config, new NoOpMetricsService());
    }

    public CachingDocumentLocator(DocumentLocator delegate, CacheConfig config, MetricsService metricsService) {
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CachingDocumentLocator initialized: enabled={}, maxSize={}, ttl={}s",
                config.enabled(), config.maxSize(), config.ttlSeconds());
    }

    @Override
    public LocatorResult locate(String referenceCode) throws IOException {
        if (!config.enabled()) {
            return delegate.locate(referenceCode);
        }
        String key = referenceCode.toUpperCase(Locale.ROOT);
        LocatorResult cached = cache.getIfPresent(key);
        if (cached != null) {
            metricsService.recordLocatorCacheHit();
            log.debug("locator.cacheHit code={}", key);
            return cached;
        }
        metricsService.recordLocatorCacheMiss();
        LocatorResult result = delegate.locate(referenceCode);
        if (result != null && (result.found() || config.cacheNotFound())) {
            cache.put(key, result);
        }
        return result;
    }

    public void invalidate(String referenceCode) {
        cache.invalidate(referenceCode.toUpperCase(Locale.ROOT));
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }
}
