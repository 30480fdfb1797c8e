package io.sentinel.domain.job;

/**
 * Outcome recorded in job_history.status.
 */
public enum ExecutionStatus {
    COMPLETED("completed"),
    FAILED("failed");

    private final String dbValue;

    ExecutionStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static ExecutionStatus fromDbValue(String value) {
        for (ExecutionStatus status : values()) {
            if (status.dbValue.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown execution status: " + value);
    }
}
