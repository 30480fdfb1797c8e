package io.sentinel.bootstrap;

import io.sentinel.domain.job.Job;
import io.sentinel.domain.job.JobSchedule;
import io.sentinel.domain.job.MarketTiming;
import io.sentinel.domain.job.RetryConfig;
import io.sentinel.service.registry.JobRegistry;
import io.sentinel.service.registry.UnknownJobTypeException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JobCatalog.
 */
class JobCatalogTest {

    @Test
    void testDefaultSchedulesAreWellFormed() {
        List<JobSchedule> schedules = JobCatalog.defaultSchedules();

        assertEquals(JobCatalog.jobTypes().size(), schedules.size());
        for (JobSchedule schedule : schedules) {
            assertNotNull(schedule.timing(), schedule.jobType());
            for (String dependency : schedule.dependencyList()) {
                assertTrue(JobCatalog.jobTypes().contains(dependency), schedule.jobType() + " -> " + dependency);
            }
            assertNotNull(schedule.category(), schedule.jobType());
        }
    }

    @Test
    void testKnownScheduleDefaults() {
        JobSchedule prices = find(JobCatalog.SYNC_PRICES);
        assertEquals(30, prices.intervalMinutes());
        assertEquals(5, prices.intervalMarketOpenMinutes());

        JobSchedule retrain = find(JobCatalog.ML_RETRAIN);
        assertTrue(retrain.parameterized());
        assertEquals(JobCatalog.SYMBOL_FIELD, retrain.parameterField());
        assertEquals(MarketTiming.ALL_MARKETS_CLOSED, retrain.timing());
    }

    @Test
    void testBindCarriesRetryPolicy() {
        JobRegistry registry = new JobRegistry();
        JobCatalog.bind(registry, JobCatalog.TRADING_CHECK_MARKETS, parameter -> {});
        JobCatalog.bind(registry, JobCatalog.ML_RETRAIN, parameter -> {});

        assertTrue(registry.getRetryConfig(JobCatalog.TRADING_CHECK_MARKETS).isUnlimited());
        assertEquals(RetryConfig.forAnalytics(), registry.getRetryConfig(JobCatalog.ML_RETRAIN));
        assertEquals(RetryConfig.defaults(), registry.getRetryConfig(JobCatalog.BACKUP_R2), "Not bound");
    }

    @Test
    void testBindSimpleType() throws Exception {
        JobRegistry registry = new JobRegistry();
        List<String> calls = new ArrayList<>();

        JobCatalog.bind(registry, JobCatalog.SYNC_PRICES, calls::add);
        Job job = registry.create(JobCatalog.SYNC_PRICES, Map.of());
        job.execute();

        assertEquals(JobCatalog.SYNC_PRICES, job.id());
        assertEquals(List.of(""), calls);
        assertEquals(RetryConfig.forSync(), registry.getRetryConfig(JobCatalog.SYNC_PRICES));
    }

    @Test
    void testBindParameterizedType() throws Exception {
        JobRegistry registry = new JobRegistry();
        List<String> calls = new ArrayList<>();

        JobCatalog.bind(registry, JobCatalog.ML_RETRAIN, calls::add);
        Job job = registry.create(JobCatalog.ML_RETRAIN, Map.of(JobCatalog.SYMBOL_FIELD, "AAPL.US"));
        job.execute();

        assertEquals("ml:retrain:AAPL.US", job.id());
        assertEquals("AAPL.US", job.subject());
        assertTrue(job.isParameterized());
        assertEquals(List.of("AAPL.US"), calls);
        assertThrows(IllegalArgumentException.class, () -> registry.create(JobCatalog.ML_RETRAIN, Map.of()));
    }

    @Test
    void testBindUnknownTypeRejected() {
        assertThrows(UnknownJobTypeException.class,
            () -> JobCatalog.bind(new JobRegistry(), "custom:job", parameter -> {}));
    }

    private static JobSchedule find(String jobType) {
        return JobCatalog.defaultSchedules().stream()
            .filter(schedule -> schedule.jobType().equals(jobType))
            .findFirst()
            .orElseThrow();
    }
}
