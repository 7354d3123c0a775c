package io.optionsnap.service;

import io.optionsnap.domain.model.QuoteUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory cache of the latest ticker per option symbol.
 *
 * Written by every quote stream session, read by the snapshot scheduler and
 * pruned by the daily metadata refresh. Holds at most one entry per symbol;
 * a newer update replaces the older one in a single put, so readers never see
 * a partially written entry.
 */
public final class QuoteCache {
    private static final Logger log = LoggerFactory.getLogger(QuoteCache.class);

    private final ConcurrentHashMap<String, QuoteUpdate> latest = new ConcurrentHashMap<>();

    /**
     * Replace the entry for the update's symbol.
     */
    public void upsert(QuoteUpdate update) {
        if (update == null || update.symbol() == null || update.symbol().isEmpty()) {
            throw new IllegalArgumentException("update must carry a symbol");
        }
        latest.put(update.symbol(), update);
    }

    /**
     * Latest update for a symbol, or null if none received.
     */
    public QuoteUpdate get(String symbol) {
        return latest.get(symbol);
    }

    /**
     * Remove a symbol.
     *
     * @return true if an entry was removed
     */
    public boolean remove(String symbol) {
        boolean removed = latest.remove(symbol) != null;
        if (removed) {
            log.debug("Evicted {} from quote cache", symbol);
        }
        return removed;
    }

    /**
     * Point-in-time copy for a snapshot pass. Later upserts do not affect it.
     */
    public Map<String, QuoteUpdate> snapshotCopy() {
        return Map.copyOf(latest);
    }

    /**
     * Symbols currently cached (copy).
     */
    public Set<String> symbols() {
        return Set.copyOf(latest.keySet());
    }

    public int size() {
        return latest.size();
    }
}
