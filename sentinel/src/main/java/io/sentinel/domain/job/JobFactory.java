package io.sentinel.domain.job;

import java.util.Map;

/**
 * Builds a job instance from schedule parameters.
 * Simple job types receive an empty map; parameterized types receive
 * {@code {parameterField: value}}.
 */
@FunctionalInterface
public interface JobFactory {
    Job create(Map<String, Object> params);
}
