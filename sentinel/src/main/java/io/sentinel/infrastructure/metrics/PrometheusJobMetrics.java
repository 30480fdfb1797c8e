package io.sentinel.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of JobMetrics.
 *
 * Key Metrics:
 * - sentinel_jobs_enqueued_total{job_type} - Jobs put on the queue by the scheduler
 * - sentinel_jobs_executed_total{job_type, status} - Finished executions
 * - sentinel_jobs_not_ready_total{job_type, reason} - Jobs dropped back to the scheduler
 * - sentinel_job_duration_seconds{job_type} - Execution time distribution
 * - sentinel_queue_depth - Jobs waiting
 * - sentinel_heartbeats_total - Scheduler checks performed
 * - sentinel_markets_open - 1 while any market is open
 *
 * Usage:
 * <pre>
 * PrometheusJobMetrics metrics = new PrometheusJobMetrics();
 * server.setHandler(Handlers.path().addExactPath("/metrics",
 *     new PrometheusMetricsHandler(metrics.getRegistry())));
 * </pre>
 */
public final class PrometheusJobMetrics implements JobMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusJobMetrics.class);

    private final CollectorRegistry registry;

    private final Counter enqueuedCounter;
    private final Counter executedCounter;
    private final Counter notReadyCounter;
    private final Histogram durationHistogram;
    private final Gauge queueDepth;
    private final Counter heartbeatCounter;
    private final Gauge marketsOpen;

    public PrometheusJobMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusJobMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.enqueuedCounter = Counter.build()
            .name("sentinel_jobs_enqueued_total")
            .help("Total number of jobs enqueued by the scheduler")
            .labelNames("job_type")
            .register(registry);

        this.executedCounter = Counter.build()
            .name("sentinel_jobs_executed_total")
            .help("Total number of job executions")
            .labelNames("job_type", "status")
            .register(registry);

        this.notReadyCounter = Counter.build()
            .name("sentinel_jobs_not_ready_total")
            .help("Jobs removed from the queue without running")
            .labelNames("job_type", "reason")
            .register(registry);

        this.durationHistogram = Histogram.build()
            .name("sentinel_job_duration_seconds")
            .help("Job execution time in seconds")
            .labelNames("job_type")
            .buckets(0.1, 0.5, 1.0, 5.0, 15.0, 60.0, 300.0, 900.0)
            .register(registry);

        this.queueDepth = Gauge.build()
            .name("sentinel_queue_depth")
            .help("Jobs waiting in the queue")
            .register(registry);

        this.heartbeatCounter = Counter.build()
            .name("sentinel_heartbeats_total")
            .help("Scheduler heartbeats performed")
            .register(registry);

        this.marketsOpen = Gauge.build()
            .name("sentinel_markets_open")
            .help("Whether any market is open (1=open, 0=closed)")
            .register(registry);

        log.info("[METRICS] Job metrics registered");
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    @Override
    public void recordEnqueued(String jobType) {
        enqueuedCounter.labels(jobType).inc();
    }

    @Override
    public void recordExecution(String jobType, String status, Duration duration) {
        executedCounter.labels(jobType, status).inc();
        durationHistogram.labels(jobType).observe(duration.toMillis() / 1000.0);
    }

    @Override
    public void recordNotReady(String jobType, String reason) {
        notReadyCounter.labels(jobType, reason).inc();
    }

    @Override
    public void recordHeartbeat(int depth) {
        heartbeatCounter.inc();
        queueDepth.set(depth);
    }

    @Override
    public void updateQueueDepth(int depth) {
        queueDepth.set(depth);
    }

    @Override
    public void updateMarketsOpen(boolean anyOpen) {
        marketsOpen.set(anyOpen ? 1 : 0);
    }
}
