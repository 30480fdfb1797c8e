package io.sentinel.application.port.output;

import io.sentinel.domain.job.ExecutionStatus;
import io.sentinel.domain.job.JobExecution;
import io.sentinel.domain.job.JobSchedule;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Schedule table and execution log.
 *
 * Every call is independent (no multi-call transactions) and may throw; callers
 * decide how conservatively to react. Expiry and retry backoff are computed here.
 */
public interface JobScheduleStore {

    /**
     * last_run sentinel meaning "never ran / force immediate eligibility".
     */
    long LAST_RUN_NEVER = 0L;

    List<JobSchedule> getJobSchedules();

    Optional<JobSchedule> getJobSchedule(String jobType);

    /**
     * True when the job type is due: never ran, forced, or its interval (or retry
     * backoff after failures) has elapsed. Unknown job types are never expired.
     *
     * @param marketOpen use the market-open interval when one is configured
     */
    boolean isJobExpired(String jobType, boolean marketOpen);

    /**
     * @param epochSeconds last run time, {@link #LAST_RUN_NEVER} to force the job due
     */
    void setJobLastRun(String jobType, long epochSeconds);

    /**
     * Set last run to now and clear the failure streak.
     */
    void markJobCompleted(String jobType);

    /**
     * Set last run to now and extend the failure streak, engaging backoff.
     */
    void markJobFailed(String jobType);

    Optional<Instant> getLastJobCompletionById(String jobId);

    Optional<Instant> getLastJobCompletion(String jobType);

    Optional<Instant> getLastJobFailureById(String jobId);

    /**
     * Failed executions of {@code jobId} logged after its most recent completion.
     * Drives retry backoff for parameterized instances, which have no schedule row of their own.
     */
    int countFailuresSinceLastCompletion(String jobId);

    void logJobExecution(String jobId, String jobType, ExecutionStatus status,
                         String errorMessage, long durationMs, int retryCount);

    /**
     * Most recent executions first.
     */
    List<JobExecution> getJobHistory(int limit);

    /**
     * Entities of a named parameter source, each holding at least the schedule's
     * parameter field. Empty if no lister exists under that name.
     */
    Optional<List<Map<String, Object>>> findParameterEntities(String parameterSource);
}
