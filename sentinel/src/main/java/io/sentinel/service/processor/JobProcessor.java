package io.sentinel.service.processor;

import io.sentinel.application.port.output.JobScheduleStore;
import io.sentinel.config.SchedulerConfig;
import io.sentinel.domain.job.ExecutionStatus;
import io.sentinel.domain.job.Job;
import io.sentinel.domain.job.JobSchedule;
import io.sentinel.infrastructure.metrics.JobMetrics;
import io.sentinel.service.market.MarketChecker;
import io.sentinel.service.queue.JobQueue;
import io.sentinel.service.registry.JobRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Serial job executor draining the {@link JobQueue}.
 *
 * One job runs at a time. For the job at the head of the queue:
 * 1. Dependencies must be fresh, else the job is dropped for the scheduler to replay
 * 2. Market timing must hold, else the job is dropped the same way
 * 3. The job is removed from the queue and executed on the runner thread under
 *    min(job timeout, configured ceiling)
 * 4. Success or failure is written to the store; bookkeeping errors are logged only
 *
 * Stopping waits for the running job up to the shutdown grace, then interrupts it
 * and waits for the runner thread to finish. A stopped processor cannot be restarted.
 *
 * Usage:
 * <pre>
 * JobProcessor processor = new JobProcessor(queue, registry, store, marketChecker,
 *     SchedulerConfig.fromEnv(), metrics);
 * processor.start();
 * ...
 * processor.stop();
 * </pre>
 */
public final class JobProcessor {
    private static final Logger log = LoggerFactory.getLogger(JobProcessor.class);

    private final JobQueue queue;
    private final JobRegistry registry;
    private final JobScheduleStore store;
    private final SchedulerConfig config;
    private final JobMetrics metrics;
    private final DependencyGate dependencyGate;
    private final MarketTimingGate marketTimingGate;

    private final ExecutorService loopExecutor;
    private final ExecutorService runner;

    // Held for the whole readiness-check + execution of one job
    private final Object executionLock = new Object();

    // Consecutive failures per job id since its last success
    private final Map<String, Integer> failureStreaks = new ConcurrentHashMap<>();

    private volatile boolean running = false;
    private volatile boolean terminated = false;
    private volatile String executingJobId;
    private volatile Future<?> currentExecution;

    public JobProcessor(JobQueue queue, JobRegistry registry, JobScheduleStore store,
                        MarketChecker marketChecker, SchedulerConfig config, JobMetrics metrics) {
        this(queue, registry, store, marketChecker, config, metrics, Clock.systemUTC());
    }

    public JobProcessor(JobQueue queue, JobRegistry registry, JobScheduleStore store,
                        MarketChecker marketChecker, SchedulerConfig config, JobMetrics metrics,
                        Clock clock) {
        this.queue = queue;
        this.registry = registry;
        this.store = store;
        this.config = config;
        this.metrics = metrics;
        this.dependencyGate = new DependencyGate(store, queue, marketChecker, clock);
        this.marketTimingGate = new MarketTimingGate(marketChecker);
        this.loopExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "job-processor");
            t.setDaemon(true);
            return t;
        });
        this.runner = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "job-runner");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start draining the queue on the processor thread.
     */
    public synchronized void start() {
        if (terminated) {
            throw new IllegalStateException("Processor has been stopped and cannot be restarted");
        }
        if (running) {
            log.warn("[PROCESSOR] Already running");
            return;
        }

        log.info("[PROCESSOR] Starting (job timeout ceiling: {}m, shutdown grace: {}s)",
            config.jobTimeout().toMinutes(), config.shutdownGrace().getSeconds());
        running = true;
        loopExecutor.submit(this::runLoop);
    }

    /**
     * Stop the loop. Waits up to the shutdown grace for a running job, then cancels
     * it and waits for the cancellation to take effect.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        log.info("[PROCESSOR] Stopping");
        running = false;
        terminated = true;

        Future<?> execution = currentExecution;
        if (execution != null && !execution.isDone()) {
            String jobId = executingJobId;
            log.info("[PROCESSOR] Waiting up to {}s for {} to finish",
                config.shutdownGrace().getSeconds(), jobId);
            try {
                execution.get(config.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.warn("[PROCESSOR] {} still running after {}s, cancelling",
                    jobId, config.shutdownGrace().getSeconds());
                execution.cancel(true);
            } catch (ExecutionException | CancellationException e) {
                log.debug("[PROCESSOR] {} ended during shutdown: {}", jobId, e.getMessage());
            } catch (InterruptedException e) {
                execution.cancel(true);
                Thread.currentThread().interrupt();
            }
        }

        shutdownAndAwait(runner, "runner");
        shutdownAndAwait(loopExecutor, "loop");
        log.info("[PROCESSOR] Stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * True from the moment the job with this id is claimed until its outcome is recorded.
     */
    public boolean isExecuting(String jobId) {
        return jobId != null && jobId.equals(executingJobId);
    }

    public Optional<String> currentJobId() {
        return Optional.ofNullable(executingJobId);
    }

    /**
     * Build and execute a job immediately, bypassing market timing.
     * Dependencies are still checked; the job's schedule row, if any, supplies them.
     *
     * @throws IllegalStateException if the processor is not running
     * @throws io.sentinel.service.registry.UnknownJobTypeException if the type is not registered
     */
    public JobOutcome runNow(String jobType, Map<String, Object> params) {
        if (!running) {
            throw new IllegalStateException("Processor is not running");
        }

        Job job = registry.create(jobType, params);
        try {
            Optional<JobSchedule> schedule = store.getJobSchedule(jobType);
            if (schedule.isPresent()) {
                schedule.get().applyTo(job);
            }
        } catch (Exception e) {
            log.warn("[PROCESSOR] Could not apply schedule to manual run of {}: {}", job.id(), e.getMessage());
        }

        synchronized (executionLock) {
            Readiness dependencies = dependencyGate.check(job);
            if (!dependencies.isReady()) {
                log.info("[PROCESSOR] Manual run of {} skipped: {}", job.id(), dependencies.reason());
                metrics.recordNotReady(job.type(), "dependencies");
                return JobOutcome.skipped(job.id(), job.type(), dependencies.reason());
            }

            log.info("[PROCESSOR] Manual run of {}", job.id());
            executingJobId = job.id();
            queue.remove(job.id());
            return execute(job);
        }
    }

    /**
     * Handle the head of the queue once.
     *
     * @return the outcome, empty if the queue was empty
     */
    Optional<JobOutcome> processNext() {
        Optional<Job> head = queue.peek();
        if (head.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(process(head.get()));
    }

    private void runLoop() {
        log.info("[PROCESSOR] Loop started");
        while (running) {
            try {
                if (processNext().isEmpty()) {
                    Thread.sleep(config.idleDelay().toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("[PROCESSOR] Unexpected error in processing loop", e);
                try {
                    Thread.sleep(config.idleDelay().toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        log.info("[PROCESSOR] Loop exited");
    }

    private JobOutcome process(Job job) {
        synchronized (executionLock) {
            String jobId = job.id();
            if (terminated) {
                return JobOutcome.skipped(jobId, job.type(), "processor stopped");
            }

            Readiness dependencies = dependencyGate.check(job);
            if (!dependencies.isReady()) {
                return drop(job, "dependencies", dependencies);
            }

            Readiness timing = marketTimingGate.check(job);
            if (!timing.isReady()) {
                return drop(job, "market_timing", timing);
            }

            // Claim before removing so the scheduler always sees the id as queued or executing
            executingJobId = jobId;
            queue.remove(jobId);
            metrics.updateQueueDepth(queue.size());
            return execute(job);
        }
    }

    private JobOutcome drop(Job job, String reason, Readiness readiness) {
        queue.remove(job.id());
        metrics.recordNotReady(job.type(), reason);
        metrics.updateQueueDepth(queue.size());
        log.debug("[PROCESSOR] {} not ready: {}", job.id(), readiness.reason());
        return JobOutcome.skipped(job.id(), job.type(), readiness.reason());
    }

    // Caller holds executionLock and has set executingJobId
    private JobOutcome execute(Job job) {
        String jobId = job.id();
        Duration timeout = effectiveTimeout(job);
        long startNanos = System.nanoTime();

        log.info("[PROCESSOR] Executing {} (timeout {})", jobId, describe(timeout));

        Future<?> future;
        try {
            future = runner.submit(() -> {
                job.execute();
                return null;
            });
        } catch (RuntimeException e) {
            executingJobId = null;
            log.error("[PROCESSOR] Could not dispatch {}: {}", jobId, e.getMessage());
            return JobOutcome.failed(jobId, job.type(), "not dispatched: " + e.getMessage(), Duration.ZERO);
        }
        currentExecution = future;

        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return onSuccess(job, elapsedSince(startNanos));

        } catch (TimeoutException e) {
            future.cancel(true);
            return onFailure(job, "timed out after " + describe(timeout), elapsedSince(startNanos), true);

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return onFailure(job, messageOf(cause), elapsedSince(startNanos), true);

        } catch (CancellationException e) {
            // Cancelled by stop() after the grace period
            return onFailure(job, "cancelled by shutdown", elapsedSince(startNanos), false);

        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return onFailure(job, "interrupted", elapsedSince(startNanos), false);

        } finally {
            currentExecution = null;
            executingJobId = null;
        }
    }

    private JobOutcome onSuccess(Job job, Duration duration) {
        String jobId = job.id();
        int retryCount = failureStreaks.getOrDefault(jobId, 0);
        failureStreaks.remove(jobId);

        log.info("[PROCESSOR] {} completed in {}ms", jobId, duration.toMillis());

        if (!job.isParameterized()) {
            bookkeeping("markJobCompleted", jobId, () -> store.markJobCompleted(job.type()));
        }
        bookkeeping("logJobExecution", jobId, () -> store.logJobExecution(
            jobId, job.type(), ExecutionStatus.COMPLETED, null, duration.toMillis(), retryCount));
        metrics.recordExecution(job.type(), ExecutionStatus.COMPLETED.dbValue(), duration);

        return JobOutcome.completed(jobId, job.type(), duration);
    }

    /**
     * @param markFailed false when the failure came from shutdown rather than the job itself
     */
    private JobOutcome onFailure(Job job, String reason, Duration duration, boolean markFailed) {
        String jobId = job.id();
        int retryCount = failureStreaks.getOrDefault(jobId, 0);
        if (markFailed) {
            failureStreaks.merge(jobId, 1, Integer::sum);
        }

        log.error("[PROCESSOR] {} failed after {}ms: {}", jobId, duration.toMillis(), reason);

        if (markFailed && !job.isParameterized()) {
            bookkeeping("markJobFailed", jobId, () -> store.markJobFailed(job.type()));
        }
        bookkeeping("logJobExecution", jobId, () -> store.logJobExecution(
            jobId, job.type(), ExecutionStatus.FAILED, reason, duration.toMillis(), retryCount));
        metrics.recordExecution(job.type(), ExecutionStatus.FAILED.dbValue(), duration);

        return JobOutcome.failed(jobId, job.type(), reason, duration);
    }

    private void bookkeeping(String operation, String jobId, Runnable call) {
        try {
            call.run();
        } catch (Exception e) {
            log.warn("[PROCESSOR] {} failed for {}: {}", operation, jobId, e.getMessage());
        }
    }

    private Duration effectiveTimeout(Job job) {
        Duration own = job.timeout();
        if (own == null || own.isNegative() || own.isZero()) {
            return config.jobTimeout();
        }
        return own.compareTo(config.jobTimeout()) < 0 ? own : config.jobTimeout();
    }

    private Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private void shutdownAndAwait(ExecutorService executor, String name) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(config.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[PROCESSOR] {} thread did not terminate, forcing", name);
                Future<?> execution = currentExecution;
                if (execution != null) {
                    execution.cancel(true);
                }
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static String messageOf(Throwable t) {
        String message = t.getMessage();
        return message != null && !message.isEmpty() ? message : t.getClass().getSimpleName();
    }

    static String describe(Duration duration) {
        long millis = duration.toMillis();
        if (millis >= 60_000 && millis % 60_000 == 0) {
            long minutes = millis / 60_000;
            return minutes + (minutes == 1 ? " minute" : " minutes");
        }
        if (millis >= 1_000 && millis % 1_000 == 0) {
            long seconds = millis / 1_000;
            return seconds + (seconds == 1 ? " second" : " seconds");
        }
        return millis + " ms";
    }
}
