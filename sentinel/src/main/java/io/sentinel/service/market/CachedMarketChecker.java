package io.sentinel.service.market;

import io.sentinel.application.port.output.MarketStatusProvider;
import io.sentinel.application.port.output.SecurityMarketLookup;
import io.sentinel.domain.market.MarketStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Market checker backed by a TTL-cached snapshot from the broker.
 *
 * Features:
 * - Lazy first fetch, refresh on demand once the snapshot is older than the TTL
 * - In-flight guard: concurrent refresh calls are dropped, not queued
 * - A failed refresh keeps the previous snapshot
 * - Empty snapshot means no market is open
 */
public final class CachedMarketChecker implements MarketChecker {
    private static final Logger log = LoggerFactory.getLogger(CachedMarketChecker.class);

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final MarketStatusProvider provider;
    private final SecurityMarketLookup securityLookup;
    private final Duration ttl;
    private final Clock clock;

    private final Object snapshotLock = new Object();
    private final AtomicBoolean refreshing = new AtomicBoolean(false);

    // market name -> status, guarded by snapshotLock
    private Map<String, MarketStatus> markets = Map.of();
    private Instant lastFetch;

    public CachedMarketChecker(MarketStatusProvider provider, SecurityMarketLookup securityLookup) {
        this(provider, securityLookup, DEFAULT_TTL, Clock.systemUTC());
    }

    public CachedMarketChecker(MarketStatusProvider provider, SecurityMarketLookup securityLookup,
                               Duration ttl, Clock clock) {
        this.provider = provider;
        this.securityLookup = securityLookup;
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public boolean isAnyMarketOpen() {
        for (MarketStatus market : snapshot().values()) {
            if (market.isOpen()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean areAllMarketsClosed() {
        return !isAnyMarketOpen();
    }

    @Override
    public boolean isSecurityMarketOpen(String symbol) {
        if (symbol == null || symbol.isEmpty()) {
            return false;
        }

        Optional<String> marketId;
        try {
            marketId = securityLookup.findMarketId(symbol);
        } catch (Exception e) {
            log.warn("[MARKET] Market lookup failed for {}: {}", symbol, e.getMessage());
            return false;
        }
        if (marketId.isEmpty()) {
            log.debug("[MARKET] No market metadata for {}", symbol);
            return false;
        }

        for (MarketStatus market : snapshot().values()) {
            if (marketId.get().equals(market.id())) {
                return market.isOpen();
            }
        }
        return false;
    }

    @Override
    public void ensureFresh() {
        if (isStale()) {
            refresh();
        }
    }

    @Override
    public void refresh() {
        if (!refreshing.compareAndSet(false, true)) {
            log.debug("[MARKET] Refresh already in flight, skipping");
            return;
        }

        try {
            List<MarketStatus> statuses = provider.getMarketStatus(MarketStatusProvider.ALL_MARKETS);
            Map<String, MarketStatus> byName = new LinkedHashMap<>();
            if (statuses != null) {
                for (MarketStatus status : statuses) {
                    String key = status.name() != null ? status.name() : status.id();
                    byName.putIfAbsent(key, status);
                }
            }

            synchronized (snapshotLock) {
                markets = Map.copyOf(byName);
                lastFetch = clock.instant();
            }
            log.debug("[MARKET] Refreshed {} markets, any open: {}", byName.size(), isAnyMarketOpen());

        } catch (Exception e) {
            log.error("[MARKET] Failed to refresh market status: {}", e.getMessage());
        } finally {
            refreshing.set(false);
        }
    }

    /**
     * Time of the last successful fetch, null before the first one.
     */
    public Instant getLastFetch() {
        synchronized (snapshotLock) {
            return lastFetch;
        }
    }

    /**
     * Open/closed state per market name.
     */
    public Map<String, Boolean> getMarketStates() {
        Map<String, Boolean> states = new LinkedHashMap<>();
        snapshot().forEach((name, status) -> states.put(name, status.isOpen()));
        return states;
    }

    private boolean isStale() {
        synchronized (snapshotLock) {
            return lastFetch == null || Duration.between(lastFetch, clock.instant()).compareTo(ttl) >= 0;
        }
    }

    private Map<String, MarketStatus> snapshot() {
        synchronized (snapshotLock) {
            return markets;
        }
    }
}
