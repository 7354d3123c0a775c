package io.optionsnap.service.instrument;

import io.optionsnap.domain.model.QuoteUpdate;
import io.optionsnap.infrastructure.exchange.EmptyUniverseException;
import io.optionsnap.infrastructure.exchange.InstrumentFetcher;
import io.optionsnap.infrastructure.exchange.TransportException;
import io.optionsnap.infrastructure.metrics.CollectorMetrics;
import io.optionsnap.service.QuoteCache;
import io.optionsnap.service.TestQuotes;
import io.optionsnap.service.stream.QuoteStreamManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MetadataRefresherTest {

    private static final Instant NOW = Instant.parse("2025-03-01T08:01:00Z");
    private static final QuoteStreamManager.Resubscription NO_CHANGE =
        new QuoteStreamManager.Resubscription(List.of(), List.of(), 0);

    @Mock
    private InstrumentFetcher fetcher;
    @Mock
    private QuoteStreamManager streamManager;
    @Mock
    private CollectorMetrics metrics;

    private QuoteCache cache;
    private InstrumentRegistry registry;
    private MetadataRefresher refresher;

    @BeforeEach
    void setUp() {
        cache = new QuoteCache();
        registry = new InstrumentRegistry(fetcher);
        refresher = new MetadataRefresher(registry, cache, streamManager, metrics,
            Clock.fixed(NOW, ZoneOffset.UTC), LocalTime.of(8, 1), LocalTime.of(8, 0));
    }

    @AfterEach
    void tearDown() {
        refresher.shutdown();
    }

    @Test
    void refreshNow_removesSymbolsAbsentFromNewUniverse() {
        QuoteUpdate kept = TestQuotes.quote("ETH-250314-2200-C", "5", "105");
        cache.upsert(kept);
        cache.upsert(TestQuotes.quote("ETH-250314-2400-C", "5", "80"));
        cache.upsert(TestQuotes.quote("BTC-250314-90000-P", "5", "900"));
        lenient().when(fetcher.getExchangeCode()).thenReturn("BINANCE_OPTIONS");
        when(fetcher.fetchUniverse()).thenReturn(List.of("ETH-250314-2200-C", "BTC-250314-90000-P"));
        when(streamManager.resubscribe(anyCollection())).thenReturn(NO_CHANGE);

        MetadataRefresher.RefreshResult result = refresher.refreshNow();

        assertTrue(result.success());
        assertEquals(1, result.pruned());
        assertEquals(Set.of("ETH-250314-2200-C", "BTC-250314-90000-P"), cache.symbols());
        assertSame(kept, cache.get("ETH-250314-2200-C"), "Surviving entries are left untouched");
        assertEquals(Set.of("ETH-250314-2200-C", "BTC-250314-90000-P"), registry.currentUniverse());
        verify(metrics).recordMetadataRefresh(true, 2, 1);
    }

    @Test
    void refreshNow_removesExpiredAndUnparsableEntries() {
        cache.upsert(TestQuotes.quote("ETH-250301-2200-C", "5", "105"));   // expired at 08:00 today
        cache.upsert(TestQuotes.quote("ETH-250301", "5", "105"));          // unparsable
        cache.upsert(TestQuotes.quote("ETH-250302-2200-C", "5", "105"));   // valid
        lenient().when(fetcher.getExchangeCode()).thenReturn("BINANCE_OPTIONS");
        when(fetcher.fetchUniverse()).thenReturn(List.of("ETH-250301-2200-C", "ETH-250301", "ETH-250302-2200-C"));
        when(streamManager.resubscribe(anyCollection())).thenReturn(NO_CHANGE);

        MetadataRefresher.RefreshResult result = refresher.refreshNow();

        assertEquals(2, result.pruned());
        assertEquals(Set.of("ETH-250302-2200-C"), cache.symbols());
        verify(streamManager).resubscribe(List.of("ETH-250302-2200-C"));
    }

    @Test
    void refreshNow_subscribesNewlyListedSymbols() {
        lenient().when(fetcher.getExchangeCode()).thenReturn("BINANCE_OPTIONS");
        when(fetcher.fetchUniverse()).thenReturn(List.of("ETH-250314-2200-C", "ETH-250321-2200-C"));
        when(streamManager.resubscribe(anyCollection())).thenReturn(new QuoteStreamManager.Resubscription(
            List.of("ETH-250321-2200-C"), List.of("ETH-250307-2200-C"), 1));

        MetadataRefresher.RefreshResult result = refresher.refreshNow();

        assertEquals(List.of("ETH-250321-2200-C"), result.newlySubscribed());
        assertEquals(List.of("ETH-250307-2200-C"), result.released());
        verify(streamManager).resubscribe(List.of("ETH-250314-2200-C", "ETH-250321-2200-C"));
    }

    @Test
    void refreshNow_releasesStreamsBeforePruning() {
        cache.upsert(TestQuotes.quote("ETH-250314-2400-C", "5", "80"));
        lenient().when(fetcher.getExchangeCode()).thenReturn("BINANCE_OPTIONS");
        when(fetcher.fetchUniverse()).thenReturn(List.of("ETH-250314-2200-C"));
        // A frame that lands while the streams are being reconciled
        when(streamManager.resubscribe(anyCollection())).thenAnswer(invocation -> {
            cache.upsert(TestQuotes.quote("ETH-250314-2400-C", "5", "81"));
            return new QuoteStreamManager.Resubscription(List.of(), List.of("ETH-250314-2400-C"), 1);
        });

        MetadataRefresher.RefreshResult result = refresher.refreshNow();

        assertEquals(1, result.pruned());
        assertTrue(cache.symbols().isEmpty());
    }

    @Test
    void refreshNow_transportFailureKeepsCacheAndUniverse() {
        lenient().when(fetcher.getExchangeCode()).thenReturn("BINANCE_OPTIONS");
        when(fetcher.fetchUniverse())
            .thenReturn(List.of("ETH-250314-2200-C"))
            .thenThrow(new TransportException("https://eapi.binance.com/eapi/v1/exchangeInfo", "HTTP 503"));
        when(streamManager.resubscribe(anyCollection())).thenReturn(NO_CHANGE);
        refresher.refreshNow();
        cache.upsert(TestQuotes.quote("ETH-250314-2200-C", "5", "105"));
        cache.upsert(TestQuotes.quote("ETH-250314-2400-C", "5", "105"));

        MetadataRefresher.RefreshResult result = refresher.refreshNow();

        assertFalse(result.success());
        assertEquals(2, cache.size(), "Failed refresh must not prune");
        assertEquals(Set.of("ETH-250314-2200-C"), registry.currentUniverse());
        verify(metrics).recordMetadataRefresh(false, 0, 0);
        verify(streamManager, times(1)).resubscribe(anyCollection());
    }

    @Test
    void refreshNow_emptyUniverseIsAFailure() {
        when(fetcher.fetchUniverse()).thenThrow(new EmptyUniverseException("https://eapi.binance.com/eapi/v1/exchangeInfo"));
        cache.upsert(TestQuotes.quote("ETH-250314-2200-C", "5", "105"));

        MetadataRefresher.RefreshResult result = refresher.refreshNow();

        assertFalse(result.success());
        assertEquals(1, cache.size());
        verifyNoInteractions(streamManager);
    }

    @Test
    void nextRunAfter_sameDayWhenBeforeTime() {
        assertEquals(Instant.parse("2025-03-01T08:01:00Z"),
            MetadataRefresher.nextRunAfter(Instant.parse("2025-03-01T07:00:00Z"), LocalTime.of(8, 1)));
    }

    @Test
    void nextRunAfter_nextDayWhenAtOrAfterTime() {
        assertEquals(Instant.parse("2025-03-02T08:01:00Z"),
            MetadataRefresher.nextRunAfter(Instant.parse("2025-03-01T08:01:00Z"), LocalTime.of(8, 1)));
        assertEquals(Instant.parse("2025-03-02T08:01:00Z"),
            MetadataRefresher.nextRunAfter(Instant.parse("2025-03-01T23:59:00Z"), LocalTime.of(8, 1)));
    }
}
