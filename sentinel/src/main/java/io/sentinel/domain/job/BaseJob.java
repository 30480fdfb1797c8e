package io.sentinel.domain.job;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Convenience base for job implementations.
 * Holds identity and the mutable schedule overrides; subclasses supply {@link #execute()}.
 */
public abstract class BaseJob implements Job {

    private final String id;
    private final String type;
    private final String subject;
    private final Duration timeout;
    private volatile MarketTiming marketTiming;
    private volatile List<String> dependencies;

    protected BaseJob(String type) {
        this(type, type, "", DEFAULT_TIMEOUT);
    }

    protected BaseJob(String id, String type, String subject, Duration timeout) {
        this.id = Objects.requireNonNull(id, "id");
        this.type = Objects.requireNonNull(type, "type");
        this.subject = subject == null ? "" : subject;
        this.timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        this.marketTiming = MarketTiming.ANY_TIME;
        this.dependencies = List.of();
    }

    @Override
    public final String id() {
        return id;
    }

    @Override
    public final String type() {
        return type;
    }

    @Override
    public String subject() {
        return subject;
    }

    @Override
    public Duration timeout() {
        return timeout;
    }

    @Override
    public MarketTiming marketTiming() {
        return marketTiming;
    }

    @Override
    public List<String> dependencies() {
        return dependencies;
    }

    @Override
    public void setMarketTiming(MarketTiming marketTiming) {
        this.marketTiming = marketTiming == null ? MarketTiming.ANY_TIME : marketTiming;
    }

    @Override
    public void setDependencies(List<String> dependencies) {
        this.dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + "]";
    }
}
