package io.sentinel.infrastructure.metrics;

import java.time.Duration;

/**
 * Metrics sink for the job pipeline.
 *
 * Implementations must be thread-safe and must never throw into the caller.
 */
public interface JobMetrics {

    void recordEnqueued(String jobType);

    /**
     * @param status completed or failed
     */
    void recordExecution(String jobType, String status, Duration duration);

    /**
     * @param reason dependencies or market_timing
     */
    void recordNotReady(String jobType, String reason);

    void recordHeartbeat(int queueDepth);

    void updateQueueDepth(int depth);

    void updateMarketsOpen(boolean anyOpen);

    /**
     * No-op sink for tests and embedding without a metrics backend.
     */
    JobMetrics NOOP = new JobMetrics() {
        @Override public void recordEnqueued(String jobType) {}
        @Override public void recordExecution(String jobType, String status, Duration duration) {}
        @Override public void recordNotReady(String jobType, String reason) {}
        @Override public void recordHeartbeat(int queueDepth) {}
        @Override public void updateQueueDepth(int depth) {}
        @Override public void updateMarketsOpen(boolean anyOpen) {}
    };
}
