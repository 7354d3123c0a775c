package io.optionsnap.service.instrument;

import io.optionsnap.infrastructure.exchange.InstrumentFetcher;
import io.optionsnap.infrastructure.exchange.TransportException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class InstrumentRegistryTest {

    @Test
    void testRefreshReplacesUniverseWholesale() {
        InstrumentFetcher fetcher = mock(InstrumentFetcher.class);
        when(fetcher.getExchangeCode()).thenReturn("BINANCE_OPTIONS");
        when(fetcher.fetchUniverse())
            .thenReturn(List.of("ETH-250301-2200-C", "ETH-250301-2200-P", "ETH-250301-2200-C"))
            .thenReturn(List.of("BTC-250301-90000-C"));
        InstrumentRegistry registry = new InstrumentRegistry(fetcher);

        assertTrue(registry.currentUniverse().isEmpty());

        Set<String> first = registry.refresh();
        assertEquals(List.of("ETH-250301-2200-C", "ETH-250301-2200-P"), List.copyOf(first));
        assertTrue(registry.contains("ETH-250301-2200-P"));

        registry.refresh();
        assertEquals(Set.of("BTC-250301-90000-C"), registry.currentUniverse());
        assertFalse(registry.contains("ETH-250301-2200-P"));
    }

    @Test
    void testFailedRefreshKeepsPreviousUniverse() {
        InstrumentFetcher fetcher = mock(InstrumentFetcher.class);
        when(fetcher.getExchangeCode()).thenReturn("BINANCE_OPTIONS");
        when(fetcher.fetchUniverse())
            .thenReturn(List.of("ETH-250301-2200-C"))
            .thenThrow(new TransportException("exchangeInfo", "timeout"));
        InstrumentRegistry registry = new InstrumentRegistry(fetcher);
        registry.refresh();

        assertThrows(TransportException.class, registry::refresh);
        assertEquals(Set.of("ETH-250301-2200-C"), registry.currentUniverse());
    }

    @Test
    void testUniverseIsUnmodifiable() {
        InstrumentFetcher fetcher = mock(InstrumentFetcher.class);
        when(fetcher.getExchangeCode()).thenReturn("BINANCE_OPTIONS");
        when(fetcher.fetchUniverse()).thenReturn(List.of("ETH-250301-2200-C"));
        InstrumentRegistry registry = new InstrumentRegistry(fetcher);

        Set<String> universe = registry.refresh();

        assertThrows(UnsupportedOperationException.class, () -> universe.add("X"));
    }
}
