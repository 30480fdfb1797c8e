package io.sentinel.application.port.output;

import java.util.Optional;

/**
 * Resolves the exchange a security trades on.
 */
public interface SecurityMarketLookup {

    /**
     * Broker market id for a symbol, empty if the symbol is unknown or carries no market metadata.
     */
    Optional<String> findMarketId(String symbol);
}
