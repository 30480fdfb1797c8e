package io.sentinel.domain.job;

import io.sentinel.testing.TestJob;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for JobSchedule, MarketTiming codes and JobIds.
 */
class JobScheduleTest {

    @Test
    void testEffectiveIntervalUsesMarketOpenIntervalOnlyWhileOpen() {
        JobSchedule schedule = JobSchedule.simple("sync:prices", 30, 5, MarketTiming.ANY_TIME);

        assertEquals(Duration.ofMinutes(5), schedule.effectiveInterval(true));
        assertEquals(Duration.ofMinutes(30), schedule.effectiveInterval(false));
    }

    @Test
    void testEffectiveIntervalWithoutMarketOpenInterval() {
        JobSchedule schedule = JobSchedule.simple("sync:quotes", 1440, null, MarketTiming.ANY_TIME);

        assertEquals(Duration.ofMinutes(1440), schedule.effectiveInterval(true));
        assertEquals(Duration.ofMinutes(1440), schedule.effectiveInterval(false));
    }

    @Test
    void testDependencyListDecoding() {
        JobSchedule schedule = JobSchedule.simple("scoring:calculate", 60, null, MarketTiming.ANY_TIME)
            .withDependencies("[\"sync:prices\", \"ml:retrain:AAPL.US\"]");

        assertEquals(List.of("sync:prices", "ml:retrain:AAPL.US"), schedule.dependencyList());
    }

    @Test
    void testBlankDependenciesDecodeToEmptyList() {
        JobSchedule base = JobSchedule.simple("a", 60, null, MarketTiming.ANY_TIME);

        assertEquals(List.of(), base.dependencyList());
        assertEquals(List.of(), base.withDependencies(null).dependencyList());
        assertEquals(List.of(), base.withDependencies("  ").dependencyList());
        assertEquals(List.of(), base.withDependencies("null").dependencyList());
    }

    @Test
    void testMalformedDependenciesRejected() {
        JobSchedule base = JobSchedule.simple("a", 60, null, MarketTiming.ANY_TIME);

        assertThrows(ScheduleConfigurationException.class,
            () -> base.withDependencies("sync:prices").dependencyList());
        assertThrows(ScheduleConfigurationException.class,
            () -> base.withDependencies("{\"a\":1}").dependencyList());
        assertThrows(ScheduleConfigurationException.class,
            () -> base.withDependencies("[\"a\", null]").dependencyList());
    }

    @Test
    void testEncodeDependenciesRoundTripsThroughSchedule() {
        String encoded = JobSchedule.encodeDependencies(List.of("sync:portfolio", "sync:prices"));
        JobSchedule schedule = JobSchedule.simple("planning:refresh", 60, 30, MarketTiming.ANY_TIME)
            .withDependencies(encoded);

        assertEquals(List.of("sync:portfolio", "sync:prices"), schedule.dependencyList());
        assertEquals("[]", JobSchedule.encodeDependencies(null));
    }

    @Test
    void testApplyToCopiesTimingAndDependencies() {
        JobSchedule schedule = JobSchedule.simple("trading:execute", 30, 15, MarketTiming.DURING_MARKET_OPEN)
            .withDependencies("[\"planning:refresh\"]");
        TestJob job = TestJob.simple("trading:execute");

        schedule.applyTo(job);

        assertEquals(MarketTiming.DURING_MARKET_OPEN, job.marketTiming());
        assertEquals(List.of("planning:refresh"), job.dependencies());
    }

    @Test
    void testApplyToLeavesJobUntouchedOnBadRow() {
        JobSchedule schedule = new JobSchedule("x", true, 60, null, 9, "[\"y\"]",
            false, null, null, null, null);
        TestJob job = TestJob.simple("x");

        assertThrows(ScheduleConfigurationException.class, () -> schedule.applyTo(job));
        assertEquals(MarketTiming.ANY_TIME, job.marketTiming());
        assertEquals(List.of(), job.dependencies());
    }

    @Test
    void testMarketTimingCodes() {
        assertEquals(MarketTiming.ANY_TIME, MarketTiming.fromCode(0));
        assertEquals(MarketTiming.AFTER_MARKET_CLOSE, MarketTiming.fromCode(1));
        assertEquals(MarketTiming.DURING_MARKET_OPEN, MarketTiming.fromCode(2));
        assertEquals(MarketTiming.ALL_MARKETS_CLOSED, MarketTiming.fromCode(3));
        assertThrows(ScheduleConfigurationException.class, () -> MarketTiming.fromCode(4));
        assertThrows(ScheduleConfigurationException.class, () -> MarketTiming.fromCode(-1));

        for (MarketTiming timing : MarketTiming.values()) {
            assertEquals(timing, MarketTiming.fromCode(timing.code()));
        }
    }

    @Test
    void testJobIds() {
        assertEquals("ml:retrain:AAPL.US", JobIds.of("ml:retrain", "AAPL.US"));

        assertTrue(JobIds.isInstanceOf("ml:retrain:AAPL.US", "ml:retrain"));
        assertFalse(JobIds.isInstanceOf("ml:retrain", "ml:retrain"), "Type itself is not an instance");
        assertFalse(JobIds.isInstanceOf("ml:retrain:", "ml:retrain"), "Empty parameter");
        assertFalse(JobIds.isInstanceOf("ml:retrainer:X", "ml:retrain"));
        assertFalse(JobIds.isInstanceOf("sync:prices", "ml:retrain"));
    }

    @Test
    void testParameterValueSkipsMissingAndEmptyValues() {
        JobSchedule schedule = JobSchedule.parameterized("ml:retrain", 60, null, MarketTiming.ANY_TIME,
            "ml_enabled_securities", "symbol");
        Map<String, Object> nullSymbol = new HashMap<>();
        nullSymbol.put("symbol", null);

        assertEquals(Optional.of("AAPL.US"), schedule.parameterValue(Map.of("symbol", "AAPL.US")));
        assertEquals(Optional.of("42"), schedule.parameterValue(Map.of("symbol", 42)));
        assertEquals(Optional.empty(), schedule.parameterValue(Map.of("symbol", "")));
        assertEquals(Optional.empty(), schedule.parameterValue(Map.of("name", "no symbol")));
        assertEquals(Optional.empty(), schedule.parameterValue(nullSymbol));
    }

    @Test
    void testJobIsParameterizedWhenIdCarriesParameter() {
        assertFalse(TestJob.simple("sync:prices").isParameterized());
        assertTrue(TestJob.forSymbol("ml:retrain", "AAPL.US").isParameterized());
    }
}
