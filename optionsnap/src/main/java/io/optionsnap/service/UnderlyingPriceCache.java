package io.optionsnap.service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last trade price per spot pair (e.g. BTCUSDT), kept as exchange decimal text.
 */
public final class UnderlyingPriceCache {

    private final ConcurrentHashMap<String, String> prices = new ConcurrentHashMap<>();

    public void update(String pair, String price) {
        prices.put(pair, price);
    }

    /**
     * Last price, or empty string if the pair is not tracked yet.
     */
    public String priceOf(String pair) {
        return prices.getOrDefault(pair, "");
    }

    public Map<String, String> snapshotCopy() {
        return Map.copyOf(prices);
    }

    public int size() {
        return prices.size();
    }
}
