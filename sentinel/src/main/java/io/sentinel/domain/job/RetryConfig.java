package io.sentinel.domain.job;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry policy with exponential backoff for a job type.
 *
 * Semantics:
 * - maxRetries: failed attempts retried on the backoff schedule, -1 = unlimited
 * - initialInterval: delay before the first retry
 * - maxCooloff: ceiling for the doubled delay
 *
 * The store applies this policy when deciding whether a failed job is due again;
 * see {@link #retryDelay(int)} and {@link #isExhausted(int)}.
 *
 * Usage:
 * <pre>
 * RetryConfig config = RetryConfig.builder()
 *     .maxRetries(5)
 *     .initialInterval(Duration.ofSeconds(30))
 *     .maxCooloff(Duration.ofMinutes(5))
 *     .build();
 *
 * if (!config.isExhausted(failures)) {
 *     Duration wait = config.retryDelay(failures);
 * }
 * </pre>
 */
public final class RetryConfig {

    public static final int UNLIMITED = -1;

    // Doubling seed used when initialInterval is zero
    private static final Duration ZERO_INTERVAL_SEED = Duration.ofSeconds(1);

    private final int maxRetries;
    private final Duration initialInterval;
    private final Duration maxCooloff;

    private RetryConfig(int maxRetries, Duration initialInterval, Duration maxCooloff) {
        this.maxRetries = maxRetries;
        this.initialInterval = initialInterval;
        this.maxCooloff = maxCooloff;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Duration initialInterval() {
        return initialInterval;
    }

    public Duration maxCooloff() {
        return maxCooloff;
    }

    public boolean isUnlimited() {
        return maxRetries == UNLIMITED;
    }

    /**
     * True once more consecutive failures have accumulated than the policy retries.
     * An exhausted job stops retrying early and falls back to its regular interval.
     */
    public boolean isExhausted(int consecutiveFailures) {
        return !isUnlimited() && consecutiveFailures > maxRetries;
    }

    /**
     * Delay before the next attempt after {@code consecutiveFailures} failures in a row.
     *
     * initialInterval * 2^(failures-1), capped at maxCooloff. A zero initialInterval
     * retries the first failure immediately and doubles from one second afterwards.
     *
     * @param consecutiveFailures failures since the last success, must be positive
     */
    public Duration retryDelay(int consecutiveFailures) {
        if (consecutiveFailures <= 0) {
            throw new IllegalArgumentException("consecutiveFailures must be positive");
        }

        Duration seed = initialInterval;
        int exponent = consecutiveFailures - 1;
        if (seed.isZero()) {
            if (consecutiveFailures == 1) {
                return Duration.ZERO;
            }
            seed = ZERO_INTERVAL_SEED;
            exponent = consecutiveFailures - 2;
        }

        // 2^30 seconds is already far beyond any sane cooloff
        long factor = 1L << Math.min(exponent, 30);
        long delayMillis = seed.toMillis() > Long.MAX_VALUE / factor
            ? Long.MAX_VALUE
            : seed.toMillis() * factor;
        return Duration.ofMillis(Math.min(delayMillis, maxCooloff.toMillis()));
    }

    /**
     * Wait after the last attempt before the next one is due: the regular interval
     * with no failures or once retries are exhausted, otherwise the retry delay,
     * never longer than the interval.
     */
    public Duration waitAfter(int consecutiveFailures, Duration interval) {
        if (consecutiveFailures <= 0 || isExhausted(consecutiveFailures)) {
            return interval;
        }
        Duration delay = retryDelay(consecutiveFailures);
        return delay.compareTo(interval) < 0 ? delay : interval;
    }

    /**
     * Default policy: 3 retries, 30s initial, 5m ceiling.
     */
    public static RetryConfig defaults() {
        return new RetryConfig(3, Duration.ofSeconds(30), Duration.ofMinutes(5));
    }

    /**
     * Broker and price sync jobs: 5 retries, 30s initial, 5m ceiling.
     */
    public static RetryConfig forSync() {
        return new RetryConfig(5, Duration.ofSeconds(30), Duration.ofMinutes(5));
    }

    /**
     * Heavy analytics and ML jobs: 3 retries, 1m initial, 30m ceiling.
     */
    public static RetryConfig forAnalytics() {
        return new RetryConfig(3, Duration.ofMinutes(1), Duration.ofMinutes(30));
    }

    /**
     * Jobs that must eventually succeed: unlimited retries, immediate first retry, 5m ceiling.
     */
    public static RetryConfig infinite() {
        return new RetryConfig(UNLIMITED, Duration.ZERO, Duration.ofMinutes(5));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RetryConfig other)) return false;
        return maxRetries == other.maxRetries
            && initialInterval.equals(other.initialInterval)
            && maxCooloff.equals(other.maxCooloff);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxRetries, initialInterval, maxCooloff);
    }

    @Override
    public String toString() {
        return "RetryConfig[maxRetries=" + maxRetries
            + ", initialInterval=" + initialInterval
            + ", maxCooloff=" + maxCooloff + "]";
    }

    /**
     * Builder for RetryConfig.
     */
    public static class Builder {
        private int maxRetries = 3;
        private Duration initialInterval = Duration.ofSeconds(30);
        private Duration maxCooloff = Duration.ofMinutes(5);

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < UNLIMITED) {
                throw new IllegalArgumentException("Max retries must be -1 (unlimited) or non-negative");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder initialInterval(Duration initialInterval) {
            if (initialInterval.isNegative()) {
                throw new IllegalArgumentException("Initial interval cannot be negative");
            }
            this.initialInterval = initialInterval;
            return this;
        }

        public Builder maxCooloff(Duration maxCooloff) {
            if (maxCooloff.isNegative() || maxCooloff.isZero()) {
                throw new IllegalArgumentException("Max cooloff must be positive");
            }
            this.maxCooloff = maxCooloff;
            return this;
        }

        public RetryConfig build() {
            if (initialInterval.compareTo(maxCooloff) > 0) {
                throw new IllegalArgumentException("Initial interval cannot exceed max cooloff");
            }
            return new RetryConfig(maxRetries, initialInterval, maxCooloff);
        }
    }
}
