package io.sentinel.domain.job;

/**
 * Thrown when a persisted schedule row cannot be interpreted
 * (malformed dependency JSON, unknown market timing code).
 */
public class ScheduleConfigurationException extends RuntimeException {

    public ScheduleConfigurationException(String message) {
        super(message);
    }

    public ScheduleConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
