package io.sentinel.infrastructure.market;

/**
 * The broker's market status endpoint could not be read.
 */
public class MarketStatusException extends RuntimeException {

    public MarketStatusException(String message) {
        super(message);
    }

    public MarketStatusException(String message, Throwable cause) {
        super(message, cause);
    }
}
