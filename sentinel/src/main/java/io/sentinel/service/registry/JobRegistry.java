package io.sentinel.service.registry;

import io.sentinel.domain.job.Job;
import io.sentinel.domain.job.JobFactory;
import io.sentinel.domain.job.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Job type registry: type name -> factory and retry policy.
 *
 * Types are registered once at startup by the composition root. Registering the
 * same type again replaces the previous entry.
 */
public final class JobRegistry {
    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

    /**
     * Register a job type with the default retry policy.
     */
    public void register(String jobType, JobFactory factory) {
        register(jobType, factory, RetryConfig.defaults());
    }

    public void register(String jobType, JobFactory factory, RetryConfig retryConfig) {
        Objects.requireNonNull(jobType, "jobType");
        Objects.requireNonNull(factory, "factory");
        Registration previous = registrations.put(jobType,
            new Registration(factory, retryConfig == null ? RetryConfig.defaults() : retryConfig));
        if (previous != null) {
            log.debug("[REGISTRY] Replaced registration for {}", jobType);
        } else {
            log.debug("[REGISTRY] Registered {}", jobType);
        }
    }

    /**
     * Build a job through the registered factory.
     *
     * @throws UnknownJobTypeException if the type is not registered
     */
    public Job create(String jobType, Map<String, Object> params) {
        Registration registration = registrations.get(jobType);
        if (registration == null) {
            throw new UnknownJobTypeException(jobType);
        }
        return registration.factory().create(params == null ? Map.of() : params);
    }

    /**
     * Retry policy for a type, {@link RetryConfig#defaults()} if unregistered.
     */
    public RetryConfig getRetryConfig(String jobType) {
        Registration registration = registrations.get(jobType);
        return registration == null ? RetryConfig.defaults() : registration.retryConfig();
    }

    public boolean isRegistered(String jobType) {
        return registrations.containsKey(jobType);
    }

    /**
     * Registered type names, sorted.
     */
    public List<String> listTypes() {
        List<String> types = new ArrayList<>(registrations.keySet());
        Collections.sort(types);
        return types;
    }

    private record Registration(JobFactory factory, RetryConfig retryConfig) {}
}
