package com.openapi.simpleSDK.http.retry;

import java.time.Duration;
import java.util.Set;

/**
 * How often a remote document fetch may be repeated after a transient failure.
 * The analysis core never retries on its own; a policy with more than one attempt
 * has to be configured on the fetcher explicitly.
 */
public class RetryPolicy {
    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Set<Integer> retryableStatusCodes;

    /** One attempt, no retries. */
    public static final RetryPolicy SINGLE_ATTEMPT = new Builder().maxAttempts(1).build();

    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay;
        this.retryableStatusCodes = Set.copyOf(builder.retryableStatusCodes);
    }

    public static RetryPolicy ofAttempts(int maxAttempts) {
        return maxAttempts == 1 ? SINGLE_ATTEMPT : new Builder().maxAttempts(maxAttempts).build();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public boolean isRetryableStatus(int statusCode) {
        return retryableStatusCodes.contains(statusCode);
    }

    /** True when another attempt may follow the given (1-based) attempt. */
    public boolean allowsAttemptAfter(int attempt) {
        return attempt < maxAttempts;
    }

    public static class Builder {
        private int maxAttempts = 1;
        private Duration baseDelay = Duration.ofMillis(200);
        private Duration maxDelay = Duration.ofSeconds(5);
        private Set<Integer> retryableStatusCodes = Set.of(429, 502, 503, 504);

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            if (baseDelay.isNegative() || baseDelay.isZero()) {
                throw new IllegalArgumentException("baseDelay must be positive");
            }
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("maxDelay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder retryableStatusCodes(Set<Integer> statusCodes) {
            this.retryableStatusCodes = statusCodes;
            return this;
        }

        public RetryPolicy build() {
            if (maxDelay.compareTo(baseDelay) < 0) {
                throw new IllegalArgumentException("maxDelay must not be shorter than baseDelay");
            }
            return new RetryPolicy(this);
        }
    }
}
