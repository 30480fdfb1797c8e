package io.sentinel.domain.job;

import java.time.Duration;
import java.util.List;

/**
 * A schedulable unit of work.
 *
 * Producer contract for {@link #execute()}:
 * - it may be abandoned mid-way; the processor interrupts the executing thread
 *   on timeout or shutdown, and the body must stop promptly when interrupted
 * - it must leave shared state consistent if abandoned (idempotent-safe)
 * - it must not assume it holds any global lock
 *
 * Two jobs with the same {@link #id()} are the same unit of work for queue
 * deduplication. The id never changes for the lifetime of an instance.
 */
public interface Job {

    Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

    /**
     * Unique id: the job type for simple jobs, {@code "{type}:{parameter}"} for
     * parameterized instances.
     */
    String id();

    /**
     * Registered job type (factory and retry-policy key).
     */
    String type();

    /**
     * Job types or parameterized job ids that must be fresh before this job may run.
     */
    List<String> dependencies();

    /**
     * Maximum wall-clock time for {@link #execute()}.
     */
    Duration timeout();

    MarketTiming marketTiming();

    /**
     * Security symbol for per-security market checks, empty when symbol-independent.
     */
    String subject();

    /**
     * Schedule override applied by the scheduler after construction.
     */
    void setMarketTiming(MarketTiming marketTiming);

    /**
     * Schedule override applied by the scheduler after construction.
     */
    void setDependencies(List<String> dependencies);

    void execute() throws Exception;

    /**
     * A job is parameterized when its id carries a parameter beyond the type.
     */
    default boolean isParameterized() {
        return !id().equals(type());
    }
}
