package io.sentinel.service.processor;

import io.sentinel.application.port.output.JobScheduleStore;
import io.sentinel.domain.job.Job;
import io.sentinel.domain.job.JobIds;
import io.sentinel.domain.job.JobSchedule;
import io.sentinel.service.market.MarketChecker;
import io.sentinel.service.queue.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether every dependency of a job is fresh.
 *
 * A dependency entry is one of:
 * - a parameterized job type: every live instance must be fresh
 * - an instance id of a parameterized type ({@code "ml:retrain:AAPL.US"}): that instance must be fresh
 * - a simple job type: fresh when not expired and not queued; an expired, unqueued
 *   dependency has its last run reset so the next heartbeat picks it up
 *
 * Any store failure makes the job not ready.
 */
final class DependencyGate {
    private static final Logger log = LoggerFactory.getLogger(DependencyGate.class);

    private final JobScheduleStore store;
    private final JobQueue queue;
    private final MarketChecker marketChecker;
    private final Clock clock;

    DependencyGate(JobScheduleStore store, JobQueue queue, MarketChecker marketChecker, Clock clock) {
        this.store = store;
        this.queue = queue;
        this.marketChecker = marketChecker;
        this.clock = clock;
    }

    Readiness check(Job job) {
        List<String> dependencies = job.dependencies();
        if (dependencies.isEmpty()) {
            return Readiness.ready();
        }

        boolean marketOpen = marketChecker.isAnyMarketOpen();
        for (String dependency : dependencies) {
            Readiness readiness;
            try {
                readiness = checkDependency(dependency, marketOpen);
            } catch (Exception e) {
                log.warn("[PROCESSOR] Could not verify dependency {} of {}: {}",
                    dependency, job.id(), e.getMessage());
                return Readiness.notReady("dependency " + dependency + " could not be verified");
            }
            if (!readiness.isReady()) {
                return readiness;
            }
        }
        return Readiness.ready();
    }

    private Readiness checkDependency(String dependency, boolean marketOpen) {
        Optional<JobSchedule> schedule = store.getJobSchedule(dependency);
        if (schedule.isPresent() && schedule.get().parameterized()) {
            return checkAllInstances(schedule.get(), marketOpen);
        }

        if (schedule.isEmpty()) {
            for (JobSchedule candidate : store.getJobSchedules()) {
                if (candidate.parameterized() && JobIds.isInstanceOf(dependency, candidate.jobType())) {
                    return checkInstance(dependency, candidate.effectiveInterval(marketOpen));
                }
            }
        }

        return checkSimple(dependency, marketOpen);
    }

    private Readiness checkSimple(String jobType, boolean marketOpen) {
        if (queue.contains(jobType)) {
            return Readiness.notReady("dependency " + jobType + " is queued");
        }
        if (store.isJobExpired(jobType, marketOpen)) {
            store.setJobLastRun(jobType, JobScheduleStore.LAST_RUN_NEVER);
            log.debug("[PROCESSOR] Dependency {} expired, forced due for next heartbeat", jobType);
            return Readiness.notReady("dependency " + jobType + " is stale");
        }
        return Readiness.ready();
    }

    private Readiness checkAllInstances(JobSchedule schedule, boolean marketOpen) {
        Optional<List<Map<String, Object>>> entities = store.findParameterEntities(schedule.parameterSource());
        if (entities.isEmpty()) {
            return Readiness.notReady("no parameter source " + schedule.parameterSource()
                + " for dependency " + schedule.jobType());
        }

        Duration interval = schedule.effectiveInterval(marketOpen);
        for (Map<String, Object> entity : entities.get()) {
            Optional<String> parameter = schedule.parameterValue(entity);
            if (parameter.isEmpty()) {
                continue;
            }
            Readiness readiness = checkInstance(JobIds.of(schedule.jobType(), parameter.get()), interval);
            if (!readiness.isReady()) {
                return readiness;
            }
        }
        return Readiness.ready();
    }

    private Readiness checkInstance(String jobId, Duration interval) {
        if (queue.contains(jobId)) {
            return Readiness.notReady("dependency " + jobId + " is queued");
        }
        Optional<Instant> lastCompletion = store.getLastJobCompletionById(jobId);
        if (lastCompletion.isEmpty()) {
            return Readiness.notReady("dependency " + jobId + " never completed");
        }
        if (Duration.between(lastCompletion.get(), clock.instant()).compareTo(interval) >= 0) {
            return Readiness.notReady("dependency " + jobId + " is stale");
        }
        return Readiness.ready();
    }
}
