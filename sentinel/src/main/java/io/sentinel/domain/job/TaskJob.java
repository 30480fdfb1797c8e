package io.sentinel.domain.job;

import java.time.Duration;

/**
 * Job whose body is supplied as a lambda by the host process.
 *
 * Per-entity jobs carry the parameter value as both id suffix and subject, so
 * market timing is checked against that security's exchange.
 */
public final class TaskJob extends BaseJob {

    @FunctionalInterface
    public interface Body {
        /**
         * @param parameter the entity parameter, empty for simple jobs
         */
        void run(String parameter) throws Exception;
    }

    private final Body body;

    private TaskJob(String id, String type, String subject, Duration timeout, Body body) {
        super(id, type, subject, timeout);
        this.body = body;
    }

    @Override
    public void execute() throws Exception {
        body.run(subject());
    }

    /**
     * Factory for a job type that runs once globally.
     */
    public static JobFactory simple(String jobType, Duration timeout, Body body) {
        return params -> new TaskJob(jobType, jobType, "", timeout, body);
    }

    /**
     * Factory for a job type instantiated once per entity; {@code parameterField}
     * names the params entry holding the parameter value.
     *
     * @throws IllegalArgumentException from the factory if the parameter is missing
     */
    public static JobFactory perEntity(String jobType, String parameterField, Duration timeout, Body body) {
        return params -> {
            Object value = params.get(parameterField);
            if (value == null || value.toString().isEmpty()) {
                throw new IllegalArgumentException(jobType + " requires parameter " + parameterField);
            }
            String parameter = value.toString();
            return new TaskJob(JobIds.of(jobType, parameter), jobType, parameter, timeout, body);
        };
    }
}
