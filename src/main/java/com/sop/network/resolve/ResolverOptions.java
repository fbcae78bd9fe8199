package com.sop.network.resolve;

import java.time.Duration;

/**
 * Options for a deep-link resolution pass.
 */
public class ResolverOptions {

    private static final int DEFAULT_MAX_DEPTH = 3;
    private static final int DEFAULT_MAX_CONCURRENCY = 1;

    private final int maxDepth;
    private final Duration timeout;
    private final int maxConcurrency;
    private final boolean retryFailed;

    private ResolverOptions(Builder builder) {
        this.maxDepth = builder.maxDepth;
        this.timeout = builder.timeout;
        this.maxConcurrency = builder.maxConcurrency;
        this.retryFailed = builder.retryFailed;
    }

    /**
     * References found at this many document hops from the main document or more stay pending.
     */
    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Overall time budget, or null for none.
     */
    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Number of documents fetched, parsed and built in parallel within one depth level.
     */
    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    /**
     * Whether {@code not_found} and {@code error} references are attempted again.
     */
    public boolean isRetryFailed() {
        return retryFailed;
    }

    public static ResolverOptions defaults() {
        return builder().build();
    }

    public static ResolverOptions withMaxDepth(int maxDepth) {
        return builder().maxDepth(maxDepth).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private Duration timeout;
        private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;
        private boolean retryFailed = false;

        public Builder maxDepth(int maxDepth) {
            if (maxDepth < 0) {
                throw new IllegalArgumentException("maxDepth must be >= 0");
            }
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout != null && timeout.isNegative()) {
                throw new IllegalArgumentException("timeout must not be negative");
            }
            this.timeout = timeout;
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            if (maxConcurrency <= 0) {
                throw new IllegalArgumentException("maxConcurrency must be > 0");
            }
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder retryFailed(boolean retryFailed) {
            this.retryFailed = retryFailed;
            return this;
        }

        public ResolverOptions build() {
            return new ResolverOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ResolverOptions{" +
                "maxDepth=" + maxDepth +
                ", timeout=" + timeout +
                ", maxConcurrency=" + maxConcurrency +
                ", retryFailed=" + retryFailed +
                '}';
    }
}
