package io.sentinel.domain.job;

/**
 * Market-state constraint on when a job may execute.
 *
 * Persisted as an integer code in job_schedules.market_timing:
 * 0 = ANY_TIME, 1 = AFTER_MARKET_CLOSE, 2 = DURING_MARKET_OPEN, 3 = ALL_MARKETS_CLOSED.
 */
public enum MarketTiming {
    ANY_TIME(0),
    AFTER_MARKET_CLOSE(1),
    DURING_MARKET_OPEN(2),
    ALL_MARKETS_CLOSED(3);

    private final int code;

    MarketTiming(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Resolve a persisted code.
     *
     * @throws ScheduleConfigurationException if the code is outside 0-3
     */
    public static MarketTiming fromCode(int code) {
        for (MarketTiming timing : values()) {
            if (timing.code == code) {
                return timing;
            }
        }
        throw new ScheduleConfigurationException("Unknown market timing code: " + code);
    }
}
