package io.optionsnap.service.instrument;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.optionsnap.infrastructure.exchange.InstrumentFetcher;
import io.optionsnap.infrastructure.metrics.CollectorMetrics;
import io.optionsnap.infrastructure.stream.StreamConnector;
import io.optionsnap.infrastructure.stream.StreamSession;
import io.optionsnap.service.QuoteCache;
import io.optionsnap.service.stream.QuoteStreamManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Daily refresh against a live stream manager: released symbols stay out of the cache.
 */
@ExtendWith(MockitoExtension.class)
class MetadataRefresherStreamTest {

    private static final Instant NOW = Instant.parse("2099-03-01T08:01:00Z");
    private static final String KEPT = "ETH-990314-2200-C";
    private static final String DELISTED = "ETH-990314-2400-C";

    @Mock
    private InstrumentFetcher fetcher;
    @Mock
    private CollectorMetrics metrics;

    private ScheduledExecutorService scheduler;
    private final List<StreamConnector.StreamListener> listeners = new CopyOnWriteArrayList<>();
    private QuoteCache cache;
    private InstrumentRegistry registry;
    private QuoteStreamManager manager;
    private MetadataRefresher refresher;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        StreamConnector connector = (uri, listener) -> {
            listeners.add(listener);
            return CompletableFuture.completedFuture(() -> {});
        };
        cache = new QuoteCache();
        registry = new InstrumentRegistry(fetcher);
        manager = new QuoteStreamManager(URI.create("wss://nbstream.binance.com/eoptions/stream"), 200,
            Duration.ofSeconds(60), connector, scheduler, cache, new ObjectMapper(), metrics);
        refresher = new MetadataRefresher(registry, cache, manager, metrics,
            Clock.fixed(NOW, ZoneOffset.UTC), LocalTime.of(8, 1), LocalTime.of(8, 0));
    }

    @AfterEach
    void tearDown() {
        refresher.shutdown();
        manager.stop();
        scheduler.shutdownNow();
    }

    @Test
    void delistedSymbolIsNotRestoredByLaterFrames() throws Exception {
        when(fetcher.fetchUniverse())
            .thenReturn(List.of(DELISTED, KEPT))
            .thenReturn(List.of(KEPT));
        manager.subscribe(registry.refresh());
        awaitListeners(1);
        StreamConnector.StreamListener original = listeners.get(0);
        original.onFrame(ticker(DELISTED));
        original.onFrame(ticker(KEPT));
        assertEquals(Set.of(DELISTED, KEPT), cache.symbols());

        MetadataRefresher.RefreshResult result = refresher.refreshNow();

        assertEquals(1, result.pruned());
        assertEquals(List.of(DELISTED), result.released());
        assertEquals(Set.of(KEPT), manager.subscribedSymbols());
        assertEquals(1, manager.sessions().size());
        assertNotEquals(StreamSession.State.STOPPED, manager.sessions().get(0).getState());

        original.onFrame(ticker(DELISTED));
        awaitListeners(2);
        listeners.get(1).onFrame(ticker(DELISTED));
        listeners.get(1).onFrame(ticker(KEPT));

        assertEquals(Set.of(KEPT), cache.symbols());
    }

    @Test
    void sessionCountStaysBoundedAcrossDailyRollovers() throws Exception {
        when(fetcher.fetchUniverse())
            .thenReturn(List.of("ETH-990314-2200-C", "ETH-990314-2400-C"))
            .thenReturn(List.of("ETH-990321-2200-C", "ETH-990321-2400-C"))
            .thenReturn(List.of("ETH-990328-2200-C", "ETH-990328-2400-C"));
        manager.subscribe(registry.refresh());

        refresher.refreshNow();
        refresher.refreshNow();

        assertEquals(Set.of("ETH-990328-2200-C", "ETH-990328-2400-C"), manager.subscribedSymbols());
        assertEquals(1, manager.sessions().size());
    }

    private void awaitListeners(int expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (listeners.size() < expected) {
            if (System.nanoTime() > deadline) {
                fail("Expected " + expected + " connections, got " + listeners.size());
            }
            Thread.sleep(5);
        }
    }

    private static String ticker(String symbol) {
        return "{\"stream\":\"" + symbol + "@ticker\",\"data\":{\"e\":\"24hrTicker\",\"E\":4070908800000,"
            + "\"s\":\"" + symbol + "\",\"c\":\"105\",\"V\":\"5\"}}";
    }
}
