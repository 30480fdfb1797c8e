package io.sentinel.testing;

import io.sentinel.application.port.output.JobScheduleStore;
import io.sentinel.domain.job.ExecutionStatus;
import io.sentinel.domain.job.JobExecution;
import io.sentinel.domain.job.JobSchedule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory schedule store for scheduler and processor scenarios.
 *
 * Expiry ignores retry backoff: a job is due once its effective interval has
 * elapsed since the last run, or immediately when last run is 0.
 */
public final class FakeJobScheduleStore implements JobScheduleStore {

    private final Clock clock;
    private final Map<String, JobSchedule> schedules = new LinkedHashMap<>();
    private final Map<String, Long> lastRuns = new HashMap<>();
    private final Map<String, Integer> failures = new HashMap<>();
    private final Map<String, List<Map<String, Object>>> parameterSources = new HashMap<>();
    private final List<JobExecution> history = new ArrayList<>();

    private volatile boolean failBookkeeping = false;
    private volatile boolean failReads = false;

    public FakeJobScheduleStore(Clock clock) {
        this.clock = clock;
    }

    public synchronized void addSchedule(JobSchedule schedule) {
        addSchedule(schedule, LAST_RUN_NEVER);
    }

    public synchronized void addSchedule(JobSchedule schedule, long lastRun) {
        schedules.put(schedule.jobType(), schedule);
        lastRuns.put(schedule.jobType(), lastRun);
        failures.put(schedule.jobType(), 0);
    }

    public synchronized void setParameterSource(String name, List<Map<String, Object>> entities) {
        parameterSources.put(name, List.copyOf(entities));
    }

    /**
     * Record a completed execution of {@code jobId} at {@code at}.
     */
    public synchronized void recordCompletion(String jobId, String jobType, Instant at) {
        history.add(new JobExecution(jobId, jobType, ExecutionStatus.COMPLETED, null, 0, at, 0));
    }

    /**
     * Record a failed execution of {@code jobId} at {@code at}.
     */
    public synchronized void recordFailure(String jobId, String jobType, Instant at) {
        history.add(new JobExecution(jobId, jobType, ExecutionStatus.FAILED, "failed", 0, at, 0));
    }

    /**
     * Make markJobCompleted, markJobFailed and logJobExecution throw.
     */
    public void failBookkeeping(boolean fail) {
        this.failBookkeeping = fail;
    }

    /**
     * Make schedule lookups, expiry checks and completion lookups throw.
     */
    public void failReads(boolean fail) {
        this.failReads = fail;
    }

    public synchronized long lastRun(String jobType) {
        return lastRuns.getOrDefault(jobType, LAST_RUN_NEVER);
    }

    public synchronized int consecutiveFailures(String jobType) {
        return failures.getOrDefault(jobType, 0);
    }

    public synchronized List<JobExecution> history() {
        return List.copyOf(history);
    }

    public synchronized List<JobExecution> history(String jobId) {
        List<JobExecution> matching = new ArrayList<>();
        for (JobExecution execution : history) {
            if (execution.jobId().equals(jobId)) {
                matching.add(execution);
            }
        }
        return matching;
    }

    @Override
    public synchronized List<JobSchedule> getJobSchedules() {
        checkReads();
        return List.copyOf(schedules.values());
    }

    @Override
    public synchronized Optional<JobSchedule> getJobSchedule(String jobType) {
        checkReads();
        return Optional.ofNullable(schedules.get(jobType));
    }

    @Override
    public synchronized boolean isJobExpired(String jobType, boolean marketOpen) {
        checkReads();
        JobSchedule schedule = schedules.get(jobType);
        if (schedule == null) {
            return false;
        }
        long lastRun = lastRuns.getOrDefault(jobType, LAST_RUN_NEVER);
        if (lastRun == LAST_RUN_NEVER) {
            return true;
        }
        Duration elapsed = Duration.between(Instant.ofEpochSecond(lastRun), clock.instant());
        return elapsed.compareTo(schedule.effectiveInterval(marketOpen)) >= 0;
    }

    @Override
    public synchronized void setJobLastRun(String jobType, long epochSeconds) {
        if (schedules.containsKey(jobType)) {
            lastRuns.put(jobType, epochSeconds);
        }
    }

    @Override
    public synchronized void markJobCompleted(String jobType) {
        checkBookkeeping();
        if (schedules.containsKey(jobType)) {
            lastRuns.put(jobType, clock.instant().getEpochSecond());
            failures.put(jobType, 0);
        }
    }

    @Override
    public synchronized void markJobFailed(String jobType) {
        checkBookkeeping();
        if (schedules.containsKey(jobType)) {
            lastRuns.put(jobType, clock.instant().getEpochSecond());
            failures.merge(jobType, 1, Integer::sum);
        }
    }

    @Override
    public synchronized Optional<Instant> getLastJobCompletionById(String jobId) {
        checkReads();
        Instant latest = null;
        for (JobExecution execution : history) {
            if (execution.jobId().equals(jobId) && execution.status() == ExecutionStatus.COMPLETED
                    && (latest == null || execution.executedAt().isAfter(latest))) {
                latest = execution.executedAt();
            }
        }
        return Optional.ofNullable(latest);
    }

    @Override
    public synchronized Optional<Instant> getLastJobFailureById(String jobId) {
        checkReads();
        Instant latest = null;
        for (JobExecution execution : history) {
            if (execution.jobId().equals(jobId) && execution.status() == ExecutionStatus.FAILED
                    && (latest == null || execution.executedAt().isAfter(latest))) {
                latest = execution.executedAt();
            }
        }
        return Optional.ofNullable(latest);
    }

    @Override
    public synchronized int countFailuresSinceLastCompletion(String jobId) {
        checkReads();
        int count = 0;
        for (JobExecution execution : history) {
            if (!execution.jobId().equals(jobId)) {
                continue;
            }
            if (execution.status() == ExecutionStatus.COMPLETED) {
                count = 0;
            } else if (execution.status() == ExecutionStatus.FAILED) {
                count++;
            }
        }
        return count;
    }

    @Override
    public synchronized Optional<Instant> getLastJobCompletion(String jobType) {
        checkReads();
        Instant latest = null;
        for (JobExecution execution : history) {
            if (execution.jobType().equals(jobType) && execution.status() == ExecutionStatus.COMPLETED
                    && (latest == null || execution.executedAt().isAfter(latest))) {
                latest = execution.executedAt();
            }
        }
        return Optional.ofNullable(latest);
    }

    @Override
    public synchronized void logJobExecution(String jobId, String jobType, ExecutionStatus status,
                                             String errorMessage, long durationMs, int retryCount) {
        checkBookkeeping();
        history.add(new JobExecution(jobId, jobType, status, errorMessage, durationMs, clock.instant(), retryCount));
    }

    @Override
    public synchronized List<JobExecution> getJobHistory(int limit) {
        List<JobExecution> newestFirst = new ArrayList<>(history);
        Collections.reverse(newestFirst);
        return newestFirst.subList(0, Math.min(limit, newestFirst.size()));
    }

    @Override
    public synchronized Optional<List<Map<String, Object>>> findParameterEntities(String parameterSource) {
        return Optional.ofNullable(parameterSources.get(parameterSource));
    }

    private void checkReads() {
        if (failReads) {
            throw new IllegalStateException("store unavailable");
        }
    }

    private void checkBookkeeping() {
        if (failBookkeeping) {
            throw new IllegalStateException("store write failed");
        }
    }
}
