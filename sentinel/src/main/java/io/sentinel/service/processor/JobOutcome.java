package io.sentinel.service.processor;

import java.time.Duration;

/**
 * What happened to one job handed to the processor.
 *
 * @param error failure or skip reason, null on success
 */
public record JobOutcome(String jobId, String jobType, Status status, String error, Duration duration) {

    public enum Status {
        COMPLETED,
        FAILED,
        SKIPPED
    }

    public static JobOutcome completed(String jobId, String jobType, Duration duration) {
        return new JobOutcome(jobId, jobType, Status.COMPLETED, null, duration);
    }

    public static JobOutcome failed(String jobId, String jobType, String error, Duration duration) {
        return new JobOutcome(jobId, jobType, Status.FAILED, error, duration);
    }

    public static JobOutcome skipped(String jobId, String jobType, String reason) {
        return new JobOutcome(jobId, jobType, Status.SKIPPED, reason, Duration.ZERO);
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }
}
