package io.sentinel.domain.market;

/**
 * Status of one exchange as reported by the broker.
 *
 * @param id     broker market id (matches securities.data.mrkt.mkt_id)
 * @param name   short market name, e.g. NASDAQ
 * @param status raw broker status, OPEN when trading
 */
public record MarketStatus(String id, String name, String status) {

    public static final String OPEN = "OPEN";

    public boolean isOpen() {
        return OPEN.equalsIgnoreCase(status);
    }
}
