package io.sentinel.service.processor;

import io.sentinel.domain.job.Job;
import io.sentinel.domain.job.MarketTiming;
import io.sentinel.service.market.MarketChecker;

/**
 * Checks a job's market-timing requirement against current market state.
 *
 * Jobs with a subject (a security symbol) are checked against that security's
 * exchange for DURING_MARKET_OPEN and AFTER_MARKET_CLOSE.
 */
final class MarketTimingGate {

    private final MarketChecker marketChecker;

    MarketTimingGate(MarketChecker marketChecker) {
        this.marketChecker = marketChecker;
    }

    Readiness check(Job job) {
        MarketTiming timing = job.marketTiming();
        String subject = job.subject();

        boolean eligible = switch (timing) {
            case ANY_TIME -> true;
            case DURING_MARKET_OPEN -> hasSubject(subject)
                ? marketChecker.isSecurityMarketOpen(subject)
                : marketChecker.isAnyMarketOpen();
            case AFTER_MARKET_CLOSE -> hasSubject(subject)
                ? !marketChecker.isSecurityMarketOpen(subject)
                : !marketChecker.isAnyMarketOpen();
            case ALL_MARKETS_CLOSED -> marketChecker.areAllMarketsClosed();
        };

        if (eligible) {
            return Readiness.ready();
        }
        return Readiness.notReady(hasSubject(subject)
            ? "market timing " + timing + " not met for " + subject
            : "market timing " + timing + " not met");
    }

    private static boolean hasSubject(String subject) {
        return subject != null && !subject.isEmpty();
    }
}
