package io.sentinel.service.scheduler;

import io.sentinel.application.port.output.JobScheduleStore;
import io.sentinel.domain.job.Job;
import io.sentinel.domain.job.JobIds;
import io.sentinel.domain.job.JobSchedule;
import io.sentinel.domain.job.ScheduleConfigurationException;
import io.sentinel.infrastructure.metrics.JobMetrics;
import io.sentinel.service.market.MarketChecker;
import io.sentinel.service.queue.JobQueue;
import io.sentinel.service.registry.JobRegistry;
import io.sentinel.service.registry.UnknownJobTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * Heartbeat-driven scheduler: on every tick, re-reads the schedule table and
 * enqueues each job that is due.
 *
 * Per heartbeat:
 * - Refresh the market snapshot if stale and note whether any market is open
 * - Skip disabled schedules and unregistered job types
 * - Simple schedules: enqueue when not queued, not executing and expired in the store
 * - Parameterized schedules: expand the parameter source and enqueue each instance
 *   that has no completion within the effective interval and is not backing off
 *   after a recent failure
 *
 * A broken schedule row is logged and skipped; it never stops the heartbeat.
 *
 * Usage:
 * <pre>
 * JobScheduler scheduler = new JobScheduler(store, queue, registry, marketChecker,
 *     processor::isExecuting, Duration.ofSeconds(2), metrics);
 * scheduler.start();
 * ...
 * scheduler.stop();
 * </pre>
 */
public final class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final JobScheduleStore store;
    private final JobQueue queue;
    private final JobRegistry registry;
    private final MarketChecker marketChecker;
    private final Predicate<String> inFlight;
    private final Duration heartbeatInterval;
    private final Clock clock;
    private final JobMetrics metrics;

    private ScheduledExecutorService executor;
    private volatile boolean running = false;

    public JobScheduler(JobScheduleStore store, JobQueue queue, JobRegistry registry,
                        MarketChecker marketChecker, Predicate<String> inFlight,
                        Duration heartbeatInterval, JobMetrics metrics) {
        this(store, queue, registry, marketChecker, inFlight, heartbeatInterval, metrics, Clock.systemUTC());
    }

    public JobScheduler(JobScheduleStore store, JobQueue queue, JobRegistry registry,
                        MarketChecker marketChecker, Predicate<String> inFlight,
                        Duration heartbeatInterval, JobMetrics metrics, Clock clock) {
        this.store = store;
        this.queue = queue;
        this.registry = registry;
        this.marketChecker = marketChecker;
        this.inFlight = inFlight == null ? id -> false : inFlight;
        this.heartbeatInterval = heartbeatInterval;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Run one check immediately, then one per heartbeat. No-op if already running.
     */
    public synchronized void start() {
        if (running) {
            log.warn("[SCHEDULER] Already running");
            return;
        }

        log.info("[SCHEDULER] Starting (heartbeat: {}ms)", heartbeatInterval.toMillis());
        running = true;

        heartbeat();

        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "job-scheduler");
            t.setDaemon(true);
            return t;
        });
        long period = heartbeatInterval.toMillis();
        executor.scheduleWithFixedDelay(this::heartbeat, period, period, TimeUnit.MILLISECONDS);
    }

    /**
     * Stop the heartbeat. A check already in progress finishes first. No-op if not running.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        log.info("[SCHEDULER] Stopping");
        running = false;

        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Evaluate every schedule once.
     *
     * @return number of jobs enqueued
     */
    public int checkSchedules() {
        boolean marketOpen;
        try {
            marketChecker.ensureFresh();
            marketOpen = marketChecker.isAnyMarketOpen();
        } catch (Exception e) {
            log.warn("[SCHEDULER] Market state unavailable, assuming closed: {}", e.getMessage());
            marketOpen = false;
        }
        metrics.updateMarketsOpen(marketOpen);

        List<JobSchedule> schedules;
        try {
            schedules = store.getJobSchedules();
        } catch (Exception e) {
            log.error("[SCHEDULER] Failed to load job schedules: {}", e.getMessage());
            return 0;
        }

        int enqueued = 0;
        for (JobSchedule schedule : schedules) {
            if (!schedule.enabled()) {
                continue;
            }
            if (!registry.isRegistered(schedule.jobType())) {
                log.debug("[SCHEDULER] No factory registered for {}, skipping", schedule.jobType());
                continue;
            }

            try {
                enqueued += schedule.parameterized()
                    ? checkParameterized(schedule, marketOpen)
                    : checkSimple(schedule, marketOpen);
            } catch (UnknownJobTypeException | ScheduleConfigurationException e) {
                log.warn("[SCHEDULER] Skipping {}: {}", schedule.jobType(), e.getMessage());
            } catch (Exception e) {
                log.error("[SCHEDULER] Error checking {}: {}", schedule.jobType(), e.getMessage(), e);
            }
        }

        if (enqueued > 0) {
            log.debug("[SCHEDULER] Enqueued {} job(s), queue depth {}", enqueued, queue.size());
        }
        return enqueued;
    }

    private void heartbeat() {
        if (!running) {
            return;
        }
        try {
            checkSchedules();
            metrics.recordHeartbeat(queue.size());
        } catch (Exception e) {
            // Never let an exception cancel the periodic task
            log.error("[SCHEDULER] Heartbeat failed", e);
        }
    }

    private int checkSimple(JobSchedule schedule, boolean marketOpen) {
        String jobType = schedule.jobType();
        if (isOutstanding(jobType)) {
            return 0;
        }
        if (!store.isJobExpired(jobType, marketOpen)) {
            return 0;
        }

        Job job = registry.create(jobType, Map.of());
        schedule.applyTo(job);
        return enqueue(job) ? 1 : 0;
    }

    private int checkParameterized(JobSchedule schedule, boolean marketOpen) {
        String jobType = schedule.jobType();
        Optional<List<Map<String, Object>>> entities = store.findParameterEntities(schedule.parameterSource());
        if (entities.isEmpty()) {
            log.warn("[SCHEDULER] Unknown parameter source {} for {}, skipping",
                schedule.parameterSource(), jobType);
            return 0;
        }

        Duration interval = schedule.effectiveInterval(marketOpen);
        Instant now = clock.instant();
        int enqueued = 0;

        for (Map<String, Object> entity : entities.get()) {
            Optional<String> value = schedule.parameterValue(entity);
            if (value.isEmpty()) {
                continue;
            }

            String parameter = value.get();
            String jobId = JobIds.of(jobType, parameter);
            if (isOutstanding(jobId) || !isInstanceDue(jobType, jobId, interval, now)) {
                continue;
            }

            Map<String, Object> params = new HashMap<>(entity);
            params.put(schedule.parameterField(), parameter);
            Job job = registry.create(jobType, params);
            if (!jobId.equals(job.id())) {
                log.warn("[SCHEDULER] Factory for {} built id {} for parameter {}, expected {}; skipping",
                    jobType, job.id(), parameter, jobId);
                continue;
            }
            schedule.applyTo(job);
            if (enqueue(job)) {
                enqueued++;
            }
        }
        return enqueued;
    }

    /**
     * An instance is due once the wait after its last attempt has elapsed: the
     * interval after a completion, the retry delay of its failure streak after a
     * failure, and the interval again once the streak exhausts its retries.
     */
    private boolean isInstanceDue(String jobType, String jobId, Duration interval, Instant now) {
        Optional<Instant> lastCompletion = store.getLastJobCompletionById(jobId);
        Optional<Instant> lastFailure = store.getLastJobFailureById(jobId);

        Instant lastAttempt = latest(lastCompletion, lastFailure);
        if (lastAttempt == null) {
            return true;
        }

        int failures = 0;
        if (lastFailure.isPresent() && (lastCompletion.isEmpty() || lastFailure.get().isAfter(lastCompletion.get()))) {
            failures = store.countFailuresSinceLastCompletion(jobId);
        }
        Duration wait = registry.getRetryConfig(jobType).waitAfter(failures, interval);
        return Duration.between(lastAttempt, now).compareTo(wait) >= 0;
    }

    private static Instant latest(Optional<Instant> a, Optional<Instant> b) {
        if (a.isEmpty()) {
            return b.orElse(null);
        }
        if (b.isEmpty()) {
            return a.get();
        }
        return a.get().isAfter(b.get()) ? a.get() : b.get();
    }

    // Queue first: the processor claims an id before removing it from the queue
    private boolean isOutstanding(String jobId) {
        return queue.contains(jobId) || inFlight.test(jobId);
    }

    private boolean enqueue(Job job) {
        if (!queue.enqueue(job)) {
            return false;
        }
        metrics.recordEnqueued(job.type());
        log.debug("[SCHEDULER] Enqueued {}", job.id());
        return true;
    }
}
