package io.sentinel.infrastructure.persistence;

/**
 * Failure of a job store or lookup query.
 */
public class JobStoreException extends RuntimeException {

    private final String operation;

    public JobStoreException(String operation, Throwable cause) {
        super("Job store operation failed: " + operation, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
