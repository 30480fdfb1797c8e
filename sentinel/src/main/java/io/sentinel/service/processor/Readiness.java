package io.sentinel.service.processor;

/**
 * Result of a pre-execution check. A not-ready job is dropped from the queue and
 * picked up again by a later scheduler heartbeat.
 */
public record Readiness(boolean isReady, String reason) {

    private static final Readiness READY = new Readiness(true, null);

    public static Readiness ready() {
        return READY;
    }

    public static Readiness notReady(String reason) {
        return new Readiness(false, reason);
    }
}
