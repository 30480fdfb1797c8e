package io.sentinel.application.port.output;

import io.sentinel.domain.market.MarketStatus;

import java.util.List;

/**
 * Market data collaborator polled by the market checker.
 */
public interface MarketStatusProvider {

    String ALL_MARKETS = "*";

    /**
     * Fetch current market states.
     *
     * @param filter market filter, {@link #ALL_MARKETS} for every market
     * @throws RuntimeException if the broker cannot be reached
     */
    List<MarketStatus> getMarketStatus(String filter);
}
