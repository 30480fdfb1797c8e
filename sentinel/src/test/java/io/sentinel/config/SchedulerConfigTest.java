package io.sentinel.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SchedulerConfig. Overrides go through system properties,
 * which Env reads when the environment variable is unset.
 */
class SchedulerConfigTest {

    private static final String[] KEYS = {
        "SCHEDULER_HEARTBEAT_MS", "JOB_TIMEOUT_MINUTES", "PROCESSOR_SHUTDOWN_GRACE_SECONDS",
        "PROCESSOR_IDLE_MS", "MARKET_STATUS_TTL_SECONDS"
    };

    @AfterEach
    void tearDown() {
        for (String key : KEYS) {
            System.clearProperty(key);
        }
    }

    @Test
    void testDefaults() {
        SchedulerConfig config = SchedulerConfig.defaults();

        assertEquals(Duration.ofSeconds(2), config.heartbeatInterval());
        assertEquals(Duration.ofMinutes(15), config.jobTimeout());
        assertEquals(Duration.ofSeconds(30), config.shutdownGrace());
        assertEquals(Duration.ofMinutes(5), config.marketStatusTtl());
    }

    @Test
    void testFromEnvOverrides() {
        System.setProperty("SCHEDULER_HEARTBEAT_MS", "500");
        System.setProperty("JOB_TIMEOUT_MINUTES", "20");
        System.setProperty("PROCESSOR_SHUTDOWN_GRACE_SECONDS", "10");

        SchedulerConfig config = SchedulerConfig.fromEnv();

        assertEquals(Duration.ofMillis(500), config.heartbeatInterval());
        assertEquals(Duration.ofMinutes(20), config.jobTimeout());
        assertEquals(Duration.ofSeconds(10), config.shutdownGrace());
        assertEquals(SchedulerConfig.DEFAULT_IDLE_DELAY, config.idleDelay());
    }

    @Test
    void testInvalidValuesFallBackToDefaults() {
        System.setProperty("SCHEDULER_HEARTBEAT_MS", "fast");
        System.setProperty("JOB_TIMEOUT_MINUTES", "0");
        System.setProperty("MARKET_STATUS_TTL_SECONDS", "-5");

        SchedulerConfig config = SchedulerConfig.fromEnv();

        assertEquals(SchedulerConfig.DEFAULT_HEARTBEAT, config.heartbeatInterval());
        assertEquals(SchedulerConfig.DEFAULT_JOB_TIMEOUT, config.jobTimeout());
        assertEquals(SchedulerConfig.DEFAULT_MARKET_STATUS_TTL, config.marketStatusTtl());
    }

    @Test
    void testRejectsNonPositiveDurations() {
        SchedulerConfig defaults = SchedulerConfig.defaults();

        assertThrows(IllegalArgumentException.class, () -> defaults.withJobTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> defaults.withHeartbeatInterval(Duration.ofSeconds(-1)));
        assertThrows(NullPointerException.class, () -> defaults.withShutdownGrace(null));
    }

    @Test
    void testWithersReplaceOneValue() {
        SchedulerConfig config = SchedulerConfig.defaults().withIdleDelay(Duration.ofMillis(10));

        assertEquals(Duration.ofMillis(10), config.idleDelay());
        assertEquals(SchedulerConfig.DEFAULT_HEARTBEAT, config.heartbeatInterval());
    }
}
