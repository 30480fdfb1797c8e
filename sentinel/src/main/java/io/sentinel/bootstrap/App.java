package io.sentinel.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.sentinel.config.SchedulerConfig;
import io.sentinel.infrastructure.market.HttpMarketStatusProvider;
import io.sentinel.infrastructure.metrics.PrometheusJobMetrics;
import io.sentinel.infrastructure.metrics.PrometheusMetricsHandler;
import io.sentinel.infrastructure.persistence.PostgresJobScheduleStore;
import io.sentinel.infrastructure.persistence.PostgresSecurityMarketLookup;
import io.sentinel.migration.JobScheduleMigration;
import io.sentinel.service.market.CachedMarketChecker;
import io.sentinel.service.processor.JobProcessor;
import io.sentinel.service.queue.JobQueue;
import io.sentinel.service.registry.JobRegistry;
import io.sentinel.service.scheduler.JobScheduler;
import io.sentinel.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Host process: wires the scheduling backbone and runs it until the JVM exits.
 *
 * Order: DataSource -> migration -> registry -> store -> market checker -> queue
 * -> processor -> scheduler -> /metrics. Shutdown stops the scheduler first so no
 * new work is queued while the processor drains.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("=== Sentinel job scheduler starting ===");

        SchedulerConfig config = SchedulerConfig.fromEnv();
        int metricsPort = Env.getInt("METRICS_PORT", 9091);
        String marketStatusUrl = Env.get("MARKET_STATUS_URL", "http://localhost:8080/api/markets/status");

        // Database
        HikariDataSource dataSource = createDataSource();
        new JobScheduleMigration(dataSource).migrate();

        // Registry: task bodies for catalog types are bound by the modules that own them
        JobRegistry registry = new JobRegistry();

        PostgresJobScheduleStore store = new PostgresJobScheduleStore(
            dataSource, registry::getRetryConfig, Clock.systemUTC());
        if (Env.getBool("SEED_DEFAULT_SCHEDULES", true)) {
            store.seedDefaultJobSchedules(JobCatalog.defaultSchedules());
        }

        // Market state
        CachedMarketChecker marketChecker = new CachedMarketChecker(
            new HttpMarketStatusProvider(marketStatusUrl),
            new PostgresSecurityMarketLookup(dataSource),
            config.marketStatusTtl(),
            Clock.systemUTC());
        JobCatalog.bind(registry, JobCatalog.TRADING_CHECK_MARKETS, parameter -> marketChecker.refresh());

        // Metrics
        PrometheusJobMetrics metrics = new PrometheusJobMetrics();
        log.info("Prometheus metrics initialized");

        // Pipeline
        JobQueue queue = new JobQueue();
        JobProcessor processor = new JobProcessor(queue, registry, store, marketChecker, config, metrics);
        JobScheduler scheduler = new JobScheduler(store, queue, registry, marketChecker,
            processor::isExecuting, config.heartbeatInterval(), metrics);

        log.info("Registered job types: {}", registry.listTypes());
        List<String> unbound = new ArrayList<>(JobCatalog.jobTypes());
        unbound.removeAll(registry.listTypes());
        if (!unbound.isEmpty()) {
            log.info("Catalog types without a task body (schedules kept, never enqueued): {}", unbound);
        }

        Undertow metricsServer = Undertow.builder()
            .addHttpListener(metricsPort, "0.0.0.0")
            .setHandler(Handlers.path().addExactPath("/metrics",
                new PrometheusMetricsHandler(metrics.getRegistry())))
            .build();
        metricsServer.start();
        log.info("Metrics endpoint on http://localhost:{}/metrics", metricsPort);

        processor.start();
        scheduler.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("=== Sentinel job scheduler shutting down ===");
            scheduler.stop();
            processor.stop();
            metricsServer.stop();
            dataSource.close();
            log.info("Shutdown complete");
        }, "shutdown-hook"));

        log.info("=== Sentinel job scheduler started ===");
    }

    private static HikariDataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/sentinel");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 5);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(5000);
        config.setPoolName("sentinel-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }

    private App() {}
}
