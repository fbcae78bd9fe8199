package com.sop.network.cache;

/**
 * Configuration for caching located documents.
 *
 * @param maxSize       maximum number of cached documents
 * @param ttlSeconds    time-to-live in seconds for each entry
 * @param enabled       whether caching is enabled
 * @param cacheNotFound whether "not found" answers are cached as well
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled, boolean cacheNotFound) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 500 documents for 10 minutes; misses are not cached.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(500, 600, true, false);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false, false);
    }
}
