package io.sentinel.service.market;

/**
 * Answers market-state questions for scheduling decisions.
 */
public interface MarketChecker {

    boolean isAnyMarketOpen();

    /**
     * True if the exchange the security trades on is open. Unknown securities count as closed.
     */
    boolean isSecurityMarketOpen(String symbol);

    boolean areAllMarketsClosed();

    /**
     * Reload market state if the cached snapshot is older than its TTL.
     */
    void ensureFresh();

    /**
     * Reload market state now.
     */
    void refresh();
}
