package io.sentinel.bootstrap;

import io.sentinel.domain.job.JobSchedule;
import io.sentinel.domain.job.MarketTiming;
import io.sentinel.domain.job.RetryConfig;
import io.sentinel.domain.job.TaskJob;
import io.sentinel.infrastructure.persistence.PostgresJobScheduleStore;
import io.sentinel.service.registry.JobRegistry;
import io.sentinel.service.registry.UnknownJobTypeException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical job types: retry policy, timeout and default schedule row for each.
 *
 * The host binds a task body to a type with {@link #bind}; types without a bound
 * body stay unregistered and the scheduler skips them.
 */
public final class JobCatalog {

    public static final String SYNC_PORTFOLIO = "sync:portfolio";
    public static final String SYNC_PRICES = "sync:prices";
    public static final String SYNC_QUOTES = "sync:quotes";
    public static final String SYNC_METADATA = "sync:metadata";
    public static final String SYNC_EXCHANGE_RATES = "sync:exchange_rates";
    public static final String SCORING_CALCULATE = "scoring:calculate";
    public static final String ANALYTICS_CORRELATION = "analytics:correlation";
    public static final String ANALYTICS_REGIME = "analytics:regime";
    public static final String TRADING_CHECK_MARKETS = "trading:check_markets";
    public static final String TRADING_EXECUTE = "trading:execute";
    public static final String PLANNING_REFRESH = "planning:refresh";
    public static final String BACKUP_R2 = "backup:r2";
    public static final String ML_RETRAIN = "ml:retrain";
    public static final String ML_MONITOR = "ml:monitor";

    public static final String SYMBOL_FIELD = "symbol";

    private static final Map<String, Entry> ENTRIES = new LinkedHashMap<>();

    static {
        add(simple(SYNC_PORTFOLIO, 30, 5, MarketTiming.ANY_TIME, "sync",
            "Sync portfolio positions from broker"), RetryConfig.forSync(), Duration.ofMinutes(5));
        add(simple(SYNC_PRICES, 30, 5, MarketTiming.ANY_TIME, "sync",
            "Sync historical prices for securities"), RetryConfig.forSync(), Duration.ofMinutes(10));
        add(simple(SYNC_QUOTES, 1440, 1440, MarketTiming.ANY_TIME, "sync",
            "Sync current quotes"), RetryConfig.forSync(), Duration.ofMinutes(5));
        add(simple(SYNC_METADATA, 1440, 1440, MarketTiming.ANY_TIME, "sync",
            "Sync security metadata"), RetryConfig.forSync(), Duration.ofMinutes(10));
        add(simple(SYNC_EXCHANGE_RATES, 60, 60, MarketTiming.ANY_TIME, "sync",
            "Sync exchange rates"), RetryConfig.forSync(), Duration.ofMinutes(2));
        add(simple(SCORING_CALCULATE, 1440, 1440, MarketTiming.ANY_TIME, "scoring",
            "Calculate security scores").withDependencies(deps(SYNC_PRICES)),
            RetryConfig.defaults(), Duration.ofMinutes(10));
        add(simple(ANALYTICS_CORRELATION, 10080, 10080, MarketTiming.ALL_MARKETS_CLOSED, "analytics",
            "Compute correlation matrices").withDependencies(deps(SYNC_PRICES)),
            RetryConfig.forAnalytics(), Duration.ofMinutes(15));
        add(simple(ANALYTICS_REGIME, 10080, 10080, MarketTiming.ALL_MARKETS_CLOSED, "analytics",
            "Train regime detection model").withDependencies(deps(SYNC_PRICES)),
            RetryConfig.forAnalytics(), Duration.ofMinutes(15));
        add(simple(TRADING_CHECK_MARKETS, 30, 30, MarketTiming.DURING_MARKET_OPEN, "trading",
            "Check which markets are open"), RetryConfig.infinite(), Duration.ofMinutes(1));
        add(simple(TRADING_EXECUTE, 30, 15, MarketTiming.DURING_MARKET_OPEN, "trading",
            "Execute pending trade recommendations").withDependencies(deps(PLANNING_REFRESH)),
            RetryConfig.defaults(), Duration.ofMinutes(5));
        add(simple(PLANNING_REFRESH, 60, 30, MarketTiming.ANY_TIME, "trading",
            "Refresh trading plan and recommendations").withDependencies(deps(SYNC_PORTFOLIO)),
            RetryConfig.defaults(), Duration.ofMinutes(10));
        add(simple(BACKUP_R2, 1440, 1440, MarketTiming.ANY_TIME, "backup",
            "Backup data folder to object storage"), RetryConfig.defaults(), Duration.ofMinutes(15));
        add(JobSchedule.parameterized(ML_RETRAIN, 10080, 10080, MarketTiming.ALL_MARKETS_CLOSED,
                PostgresJobScheduleStore.ML_ENABLED_SECURITIES, SYMBOL_FIELD)
            .withDependencies(deps(SYNC_PRICES))
            .withDescription("ml", "Retrain ML models for all ML-enabled securities"),
            RetryConfig.forAnalytics(), Duration.ofMinutes(15));
        add(JobSchedule.parameterized(ML_MONITOR, 10080, 10080, MarketTiming.ANY_TIME,
                PostgresJobScheduleStore.ML_ENABLED_SECURITIES, SYMBOL_FIELD)
            .withDependencies(deps(ML_RETRAIN))
            .withDescription("ml", "Monitor ML performance for all ML-enabled securities"),
            RetryConfig.defaults(), Duration.ofMinutes(10));
    }

    /**
     * Default schedule rows, in catalog order.
     */
    public static List<JobSchedule> defaultSchedules() {
        List<JobSchedule> schedules = new ArrayList<>();
        for (Entry entry : ENTRIES.values()) {
            schedules.add(entry.schedule());
        }
        return schedules;
    }

    public static List<String> jobTypes() {
        return List.copyOf(ENTRIES.keySet());
    }

    /**
     * Register a task body for a catalog type with its retry policy and timeout.
     * Parameterized types get a per-security factory keyed on the schedule's parameter field.
     *
     * @throws UnknownJobTypeException if the type is not in the catalog
     */
    public static void bind(JobRegistry registry, String jobType, TaskJob.Body body) {
        Entry entry = ENTRIES.get(jobType);
        if (entry == null) {
            throw new UnknownJobTypeException(jobType);
        }

        JobSchedule schedule = entry.schedule();
        if (schedule.parameterized()) {
            registry.register(jobType,
                TaskJob.perEntity(jobType, schedule.parameterField(), entry.timeout(), body),
                entry.retryConfig());
        } else {
            registry.register(jobType, TaskJob.simple(jobType, entry.timeout(), body), entry.retryConfig());
        }
    }

    private static JobSchedule simple(String jobType, int interval, int intervalMarketOpen,
                                      MarketTiming timing, String category, String description) {
        return JobSchedule.simple(jobType, interval, intervalMarketOpen, timing)
            .withDescription(category, description);
    }

    private static String deps(String... jobTypes) {
        return JobSchedule.encodeDependencies(List.of(jobTypes));
    }

    private static void add(JobSchedule schedule, RetryConfig retryConfig, Duration timeout) {
        ENTRIES.put(schedule.jobType(), new Entry(schedule, retryConfig, timeout));
    }

    private record Entry(JobSchedule schedule, RetryConfig retryConfig, Duration timeout) {}

    private JobCatalog() {}
}
