package io.optionsnap.service.instrument;

import io.optionsnap.infrastructure.exchange.InstrumentFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Current option universe. Replaced as a whole on each successful fetch;
 * a failed fetch leaves the previous universe in place.
 */
public final class InstrumentRegistry {
    private static final Logger log = LoggerFactory.getLogger(InstrumentRegistry.class);

    private final InstrumentFetcher fetcher;
    private final AtomicReference<Set<String>> universe = new AtomicReference<>(Set.of());

    public InstrumentRegistry(InstrumentFetcher fetcher) {
        this.fetcher = fetcher;
    }

    /**
     * Fetch and install a new universe.
     *
     * @return the installed universe, in exchange order
     * @throws io.optionsnap.infrastructure.exchange.TransportException if the exchange cannot be read
     * @throws io.optionsnap.infrastructure.exchange.EmptyUniverseException if it lists no options
     */
    public Set<String> refresh() {
        List<String> fetched = fetcher.fetchUniverse();
        Set<String> next = Collections.unmodifiableSet(new LinkedHashSet<>(fetched));
        Set<String> previous = universe.getAndSet(next);
        log.info("[REGISTRY] {} universe: {} symbols (was {})",
            fetcher.getExchangeCode(), next.size(), previous.size());
        return next;
    }

    public Set<String> currentUniverse() {
        return universe.get();
    }

    public boolean contains(String symbol) {
        return universe.get().contains(symbol);
    }
}
