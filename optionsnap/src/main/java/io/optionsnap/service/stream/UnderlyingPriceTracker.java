package io.optionsnap.service.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.optionsnap.infrastructure.metrics.CollectorMetrics;
import io.optionsnap.infrastructure.stream.ReconnectionPolicy;
import io.optionsnap.infrastructure.stream.StreamConnector;
import io.optionsnap.infrastructure.stream.StreamSession;
import io.optionsnap.service.UnderlyingPriceCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Keeps the last spot trade price of each underlying pair (BTCUSDT, ETHUSDT).
 *
 * One session on {@code <base>?streams=btcusdt@trade/ethusdt@trade}, with the
 * same fixed-delay reconnect as the option groups but independent of them.
 */
public class UnderlyingPriceTracker {
    private static final Logger log = LoggerFactory.getLogger(UnderlyingPriceTracker.class);

    static final String STREAM_KIND = "underlying";

    private final URI baseUrl;
    private final String quoteAsset;
    private final Duration reconnectDelay;
    private final StreamConnector connector;
    private final ScheduledExecutorService scheduler;
    private final UnderlyingPriceCache priceCache;
    private final ObjectMapper objectMapper;
    private final CollectorMetrics metrics;

    private volatile StreamSession session;

    public UnderlyingPriceTracker(URI baseUrl, String quoteAsset, Duration reconnectDelay,
                                  StreamConnector connector, ScheduledExecutorService scheduler,
                                  UnderlyingPriceCache priceCache, ObjectMapper objectMapper,
                                  CollectorMetrics metrics) {
        this.baseUrl = baseUrl;
        this.quoteAsset = quoteAsset;
        this.reconnectDelay = reconnectDelay;
        this.connector = connector;
        this.scheduler = scheduler;
        this.priceCache = priceCache;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    /**
     * Start streaming trades for the given assets.
     *
     * @param assets Base assets, e.g. BTC, ETH
     * @return future that completes when the session is stopped
     */
    public synchronized CompletableFuture<Void> trackPrices(Collection<String> assets) {
        if (session != null) {
            throw new IllegalStateException("Underlying prices already tracked");
        }
        if (assets.isEmpty()) {
            throw new IllegalArgumentException("No underlying assets to track");
        }

        List<String> streams = new ArrayList<>(assets.size());
        for (String asset : assets) {
            streams.add((asset + quoteAsset).toLowerCase(Locale.ROOT));
        }

        session = new StreamSession(
            "underlying " + String.join(",", assets),
            STREAM_KIND,
            QuoteStreamManager.streamUri(baseUrl, streams, "@trade"),
            connector,
            ReconnectionPolicy.fixedDelay(reconnectDelay),
            scheduler,
            this::handleFrame,
            metrics
        );
        log.info("[UNDERLYING] Tracking {} pairs: {}", streams.size(), streams);
        return session.start();
    }

    public void stop() {
        StreamSession s = session;
        if (s != null) {
            s.stop();
        }
    }

    /**
     * Apply one trade frame: {@code {"stream": "btcusdt@trade", "data": {"s": "BTCUSDT", "p": "84250.01", ...}}}.
     */
    void handleFrame(String text) {
        JsonNode data;
        try {
            data = objectMapper.readTree(text).path("data");
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON frame: " + e.getOriginalMessage(), e);
        }
        String pair = data.path("s").asText("");
        String price = data.path("p").asText("");
        if (pair.isEmpty() || price.isEmpty()) {
            throw new IllegalArgumentException("Trade frame without data.s or data.p");
        }

        priceCache.update(pair, price);
        metrics.recordStreamMessage(STREAM_KIND);
    }
}
