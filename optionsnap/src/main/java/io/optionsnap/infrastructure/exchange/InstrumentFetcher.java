package io.optionsnap.infrastructure.exchange;

import java.util.List;

/**
 * Fetches the tradable option symbols from the exchange.
 */
public interface InstrumentFetcher {

    /**
     * Fetch the current universe, already restricted to the configured underlyings.
     *
     * @return symbols in exchange order, without duplicates
     * @throws TransportException on network, HTTP status or decoding failure
     * @throws EmptyUniverseException if the exchange lists no option symbols
     */
    List<String> fetchUniverse();

    /**
     * Exchange code for logs.
     */
    String getExchangeCode();
}
