package io.sentinel.service.registry;

/**
 * Exception thrown when a job is requested for a type that was never registered.
 */
public class UnknownJobTypeException extends RuntimeException {

    private final String jobType;

    public UnknownJobTypeException(String jobType) {
        super("Unknown job type: " + jobType);
        this.jobType = jobType;
    }

    public String getJobType() {
        return jobType;
    }
}
