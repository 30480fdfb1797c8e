package io.sentinel.domain.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persisted schedule definition for one job type (row of job_schedules).
 *
 * Schedules are data: interval, enabled flag and dependency list can change at
 * runtime and are re-read on every scheduler heartbeat.
 */
public record JobSchedule(
    String jobType,
    boolean enabled,
    int intervalMinutes,
    Integer intervalMarketOpenMinutes,  // shorter interval while any market is open, nullable
    int marketTiming,                   // MarketTiming code 0-3
    String dependencies,                // JSON array of job types / job ids
    boolean parameterized,
    String parameterSource,             // entity lister name, e.g. ml_enabled_securities
    String parameterField,              // key holding the parameter value in each entity
    String description,
    String category
) {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    /**
     * Simple (non-parameterized) schedule with no dependencies.
     */
    public static JobSchedule simple(String jobType, int intervalMinutes,
                                     Integer intervalMarketOpenMinutes, MarketTiming timing) {
        return new JobSchedule(jobType, true, intervalMinutes, intervalMarketOpenMinutes,
            timing.code(), "[]", false, null, null, null, null);
    }

    /**
     * Parameterized schedule expanded once per entity of {@code parameterSource}.
     */
    public static JobSchedule parameterized(String jobType, int intervalMinutes,
                                            Integer intervalMarketOpenMinutes, MarketTiming timing,
                                            String parameterSource, String parameterField) {
        return new JobSchedule(jobType, true, intervalMinutes, intervalMarketOpenMinutes,
            timing.code(), "[]", true, parameterSource, parameterField, null, null);
    }

    public JobSchedule withEnabled(boolean enabled) {
        return new JobSchedule(jobType, enabled, intervalMinutes, intervalMarketOpenMinutes, marketTiming,
            dependencies, parameterized, parameterSource, parameterField, description, category);
    }

    public JobSchedule withDependencies(String dependenciesJson) {
        return new JobSchedule(jobType, enabled, intervalMinutes, intervalMarketOpenMinutes, marketTiming,
            dependenciesJson, parameterized, parameterSource, parameterField, description, category);
    }

    public JobSchedule withDescription(String category, String description) {
        return new JobSchedule(jobType, enabled, intervalMinutes, intervalMarketOpenMinutes, marketTiming,
            dependencies, parameterized, parameterSource, parameterField, description, category);
    }

    /**
     * Interval in force: the market-open interval when any market is open and one
     * is configured, otherwise the regular interval.
     */
    public Duration effectiveInterval(boolean marketOpen) {
        if (marketOpen && intervalMarketOpenMinutes != null && intervalMarketOpenMinutes > 0) {
            return Duration.ofMinutes(intervalMarketOpenMinutes);
        }
        return Duration.ofMinutes(intervalMinutes);
    }

    /**
     * Parameter value an entity supplies for this schedule; empty when the field is
     * missing, null or an empty string.
     */
    public Optional<String> parameterValue(Map<String, Object> entity) {
        Object value = entity.get(parameterField);
        if (value == null) {
            return Optional.empty();
        }
        String parameter = value.toString();
        return parameter.isEmpty() ? Optional.empty() : Optional.of(parameter);
    }

    /**
     * Copy this schedule's market timing and dependency list onto a freshly built job.
     *
     * @throws ScheduleConfigurationException if either column is invalid; the job is left untouched
     */
    public void applyTo(Job job) {
        MarketTiming timing = timing();
        List<String> deps = dependencyList();
        job.setMarketTiming(timing);
        job.setDependencies(deps);
    }

    /**
     * @throws ScheduleConfigurationException for an unknown timing code
     */
    public MarketTiming timing() {
        return MarketTiming.fromCode(marketTiming);
    }

    /**
     * Decode the dependency list.
     *
     * @throws ScheduleConfigurationException if the column is not a JSON array of strings
     */
    public List<String> dependencyList() {
        if (dependencies == null || dependencies.isBlank()) {
            return List.of();
        }
        try {
            List<String> parsed = MAPPER.readValue(dependencies, STRING_LIST);
            if (parsed == null) {
                return List.of();
            }
            if (parsed.contains(null)) {
                throw new ScheduleConfigurationException(
                    "Null dependency entry for " + jobType + ": " + dependencies);
            }
            return List.copyOf(parsed);
        } catch (JsonProcessingException e) {
            throw new ScheduleConfigurationException(
                "Malformed dependencies for " + jobType + ": " + dependencies, e);
        }
    }

    /**
     * Encode a dependency list for the dependencies column.
     */
    public static String encodeDependencies(List<String> dependencies) {
        try {
            return MAPPER.writeValueAsString(dependencies == null ? List.of() : dependencies);
        } catch (JsonProcessingException e) {
            throw new ScheduleConfigurationException("Cannot encode dependencies " + dependencies, e);
        }
    }
}
