package io.optionsnap.service.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.optionsnap.infrastructure.metrics.CollectorMetrics;
import io.optionsnap.infrastructure.stream.StreamConnector;
import io.optionsnap.service.UnderlyingPriceCache;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UnderlyingPriceTrackerTest {

    @Mock
    private CollectorMetrics metrics;

    private ScheduledExecutorService scheduler;
    private UnderlyingPriceCache prices;
    private BlockingQueue<URI> connects;
    private UnderlyingPriceTracker tracker;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        prices = new UnderlyingPriceCache();
        connects = new LinkedBlockingQueue<>();
        StreamConnector connector = (uri, listener) -> {
            connects.add(uri);
            return new CompletableFuture<>();
        };
        tracker = new UnderlyingPriceTracker(URI.create("wss://stream.binance.com:9443/stream"), "USDT",
            Duration.ofSeconds(60), connector, scheduler, prices, new ObjectMapper(), metrics);
    }

    @AfterEach
    void tearDown() {
        tracker.stop();
        scheduler.shutdownNow();
    }

    @Test
    void testTrackPricesOpensOneTradeStream() throws Exception {
        CompletableFuture<Void> termination = tracker.trackPrices(List.of("BTC", "ETH"));

        URI uri = connects.poll(5, TimeUnit.SECONDS);
        assertNotNull(uri);
        assertEquals("wss://stream.binance.com:9443/stream?streams=btcusdt@trade/ethusdt@trade", uri.toString());
        assertFalse(termination.isDone());

        tracker.stop();
        assertTrue(termination.isDone());
    }

    @Test
    void testTrackPricesTwiceIsRejected() {
        tracker.trackPrices(List.of("BTC"));
        assertThrows(IllegalStateException.class, () -> tracker.trackPrices(List.of("ETH")));
    }

    @Test
    void testHandleFrameUpdatesLastPrice() {
        tracker.handleFrame("{\"stream\":\"btcusdt@trade\",\"data\":{\"e\":\"trade\",\"s\":\"BTCUSDT\",\"p\":\"84250.01\",\"q\":\"0.01\"}}");
        tracker.handleFrame("{\"stream\":\"btcusdt@trade\",\"data\":{\"e\":\"trade\",\"s\":\"BTCUSDT\",\"p\":\"84251.00\",\"q\":\"0.02\"}}");

        assertEquals("84251.00", prices.priceOf("BTCUSDT"));
        assertEquals("", prices.priceOf("ETHUSDT"));
        verify(metrics, times(2)).recordStreamMessage("underlying");
    }

    @Test
    void testHandleFrameRejectsFramesWithoutPrice() {
        assertThrows(IllegalArgumentException.class,
            () -> tracker.handleFrame("{\"data\":{\"s\":\"BTCUSDT\"}}"));
        assertThrows(IllegalArgumentException.class, () -> tracker.handleFrame("{"));
        assertEquals(0, prices.size());
    }
}
