package io.sentinel.config;

import io.sentinel.util.Env;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Timing knobs for the scheduler, processor and market checker.
 *
 * @param heartbeatInterval period between scheduler checks
 * @param jobTimeout        hard ceiling on one job execution, applied over the job's own timeout
 * @param shutdownGrace     how long processor stop waits for the running job before cancelling it
 * @param idleDelay         processor sleep when the queue is empty
 * @param marketStatusTtl   age after which the market snapshot is refetched
 */
public record SchedulerConfig(
    Duration heartbeatInterval,
    Duration jobTimeout,
    Duration shutdownGrace,
    Duration idleDelay,
    Duration marketStatusTtl
) {
    public static final Duration DEFAULT_HEARTBEAT = Duration.ofSeconds(2);
    public static final Duration DEFAULT_JOB_TIMEOUT = Duration.ofMinutes(15);
    public static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofSeconds(30);
    public static final Duration DEFAULT_IDLE_DELAY = Duration.ofMillis(250);
    public static final Duration DEFAULT_MARKET_STATUS_TTL = Duration.ofMinutes(5);

    public SchedulerConfig {
        requirePositive(heartbeatInterval, "heartbeatInterval");
        requirePositive(jobTimeout, "jobTimeout");
        requirePositive(shutdownGrace, "shutdownGrace");
        requirePositive(idleDelay, "idleDelay");
        requirePositive(marketStatusTtl, "marketStatusTtl");
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(DEFAULT_HEARTBEAT, DEFAULT_JOB_TIMEOUT, DEFAULT_SHUTDOWN_GRACE,
            DEFAULT_IDLE_DELAY, DEFAULT_MARKET_STATUS_TTL);
    }

    /**
     * Defaults overridden by SCHEDULER_HEARTBEAT_MS, JOB_TIMEOUT_MINUTES,
     * PROCESSOR_SHUTDOWN_GRACE_SECONDS, PROCESSOR_IDLE_MS and MARKET_STATUS_TTL_SECONDS.
     */
    public static SchedulerConfig fromEnv() {
        return new SchedulerConfig(
            Env.getDuration("SCHEDULER_HEARTBEAT_MS", ChronoUnit.MILLIS, DEFAULT_HEARTBEAT),
            Env.getDuration("JOB_TIMEOUT_MINUTES", ChronoUnit.MINUTES, DEFAULT_JOB_TIMEOUT),
            Env.getDuration("PROCESSOR_SHUTDOWN_GRACE_SECONDS", ChronoUnit.SECONDS, DEFAULT_SHUTDOWN_GRACE),
            Env.getDuration("PROCESSOR_IDLE_MS", ChronoUnit.MILLIS, DEFAULT_IDLE_DELAY),
            Env.getDuration("MARKET_STATUS_TTL_SECONDS", ChronoUnit.SECONDS, DEFAULT_MARKET_STATUS_TTL)
        );
    }

    public SchedulerConfig withHeartbeatInterval(Duration heartbeat) {
        return new SchedulerConfig(heartbeat, jobTimeout, shutdownGrace, idleDelay, marketStatusTtl);
    }

    public SchedulerConfig withJobTimeout(Duration timeout) {
        return new SchedulerConfig(heartbeatInterval, timeout, shutdownGrace, idleDelay, marketStatusTtl);
    }

    public SchedulerConfig withShutdownGrace(Duration grace) {
        return new SchedulerConfig(heartbeatInterval, jobTimeout, grace, idleDelay, marketStatusTtl);
    }

    public SchedulerConfig withIdleDelay(Duration delay) {
        return new SchedulerConfig(heartbeatInterval, jobTimeout, shutdownGrace, delay, marketStatusTtl);
    }

    private static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
