package io.sentinel.domain.job;

import java.time.Instant;

/**
 * One row of the execution log.
 */
public record JobExecution(
    String jobId,
    String jobType,
    ExecutionStatus status,
    String error,
    long durationMs,
    Instant executedAt,
    int retryCount
) {}
