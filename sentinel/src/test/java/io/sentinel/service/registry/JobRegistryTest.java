package io.sentinel.service.registry;

import io.sentinel.domain.job.Job;
import io.sentinel.domain.job.RetryConfig;
import io.sentinel.testing.TestJob;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for JobRegistry.
 */
class JobRegistryTest {

    private final JobRegistry registry = new JobRegistry();

    @Test
    void testCreateUsesRegisteredFactory() {
        registry.register("sync:prices", params -> TestJob.simple("sync:prices"), RetryConfig.forSync());

        Job job = registry.create("sync:prices", Map.of());

        assertEquals("sync:prices", job.id());
        assertEquals(RetryConfig.forSync(), registry.getRetryConfig("sync:prices"));
    }

    @Test
    void testFactoryReceivesParams() {
        registry.register("ml:retrain",
            params -> TestJob.forSymbol("ml:retrain", (String) params.get("symbol")));

        Job job = registry.create("ml:retrain", Map.of("symbol", "AAPL.US"));

        assertEquals("ml:retrain:AAPL.US", job.id());
        assertEquals("AAPL.US", job.subject());
    }

    @Test
    void testNullParamsBecomeEmptyMap() {
        registry.register("a", params -> {
            assertNotNull(params);
            return TestJob.simple("a");
        });

        assertEquals("a", registry.create("a", null).id());
    }

    @Test
    void testUnknownTypeThrows() {
        UnknownJobTypeException e = assertThrows(UnknownJobTypeException.class,
            () -> registry.create("nope", Map.of()));
        assertEquals("nope", e.getJobType());
    }

    @Test
    void testUnregisteredTypeGetsDefaultRetryConfig() {
        assertEquals(RetryConfig.defaults(), registry.getRetryConfig("nope"));
    }

    @Test
    void testReRegistrationOverwrites() {
        registry.register("a", params -> TestJob.simple("first"), RetryConfig.forSync());
        registry.register("a", params -> TestJob.simple("second"), RetryConfig.forAnalytics());

        assertEquals("second", registry.create("a", Map.of()).id());
        assertEquals(RetryConfig.forAnalytics(), registry.getRetryConfig("a"));
    }

    @Test
    void testListTypesSorted() {
        registry.register("sync:prices", params -> TestJob.simple("sync:prices"));
        registry.register("backup:r2", params -> TestJob.simple("backup:r2"));
        registry.register("ml:retrain", params -> TestJob.simple("ml:retrain"));

        assertEquals(List.of("backup:r2", "ml:retrain", "sync:prices"), registry.listTypes());
        assertTrue(registry.isRegistered("backup:r2"));
        assertFalse(registry.isRegistered("sync:quotes"));
    }
}
