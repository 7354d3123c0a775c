package io.optionsnap.bootstrap;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Configuration is read through system properties here; the environment
 * variables of the same names are assumed unset on the test machine.
 */
class CollectorConfigTest {

    private static final List<String> KEYS = List.of(
        "UNDERLYING_ASSETS", "STREAM_GROUP_SIZE", "RECONNECT_DELAY_SECONDS",
        "METADATA_REFRESH_UTC", "METRICS_PORT", "QUOTE_STREAM_URL");

    @AfterEach
    void clearProperties() {
        KEYS.forEach(System::clearProperty);
    }

    @Test
    void testDefaults() {
        CollectorConfig config = CollectorConfig.fromEnv();

        assertEquals(List.of("BTC", "ETH"), List.copyOf(config.underlyingAssets()));
        assertEquals("USDT", config.quoteAsset());
        assertEquals(200, config.streamGroupSize());
        assertEquals(Duration.ofSeconds(60), config.reconnectDelay());
        assertEquals(Duration.ofSeconds(60), config.snapshotInterval());
        assertEquals(LocalTime.of(8, 0), config.expirationCutoffUtc());
        assertEquals(LocalTime.of(8, 1), config.metadataRefreshUtc());
        assertEquals(URI.create("https://eapi.binance.com/eapi/v1/exchangeInfo"), config.exchangeInfoUrl());
        assertEquals(URI.create("wss://nbstream.binance.com/eoptions/stream"), config.quoteStreamUrl());
        assertEquals(URI.create("wss://stream.binance.com:9443/stream"), config.underlyingStreamUrl());
        assertEquals(9091, config.metricsPort());
    }

    @Test
    void testOverridesFromProperties() {
        System.setProperty("UNDERLYING_ASSETS", " eth , sol ,");
        System.setProperty("STREAM_GROUP_SIZE", "50");
        System.setProperty("RECONNECT_DELAY_SECONDS", "5");
        System.setProperty("METADATA_REFRESH_UTC", "09:30");
        System.setProperty("METRICS_PORT", "0");
        System.setProperty("QUOTE_STREAM_URL", "ws://localhost:9999/stream");

        CollectorConfig config = CollectorConfig.fromEnv();

        assertEquals(Set.of("ETH", "SOL"), config.underlyingAssets());
        assertEquals(50, config.streamGroupSize());
        assertEquals(Duration.ofSeconds(5), config.reconnectDelay());
        assertEquals(LocalTime.of(9, 30), config.metadataRefreshUtc());
        assertEquals(0, config.metricsPort());
        assertEquals(URI.create("ws://localhost:9999/stream"), config.quoteStreamUrl());
    }

    @Test
    void testGroupSizeAboveExchangeLimitIsRejected() {
        System.setProperty("STREAM_GROUP_SIZE", "201");
        assertThrows(IllegalArgumentException.class, CollectorConfig::fromEnv);
    }

    @Test
    void testMalformedValuesFailFast() {
        System.setProperty("RECONNECT_DELAY_SECONDS", "sixty");
        assertThrows(IllegalArgumentException.class, CollectorConfig::fromEnv);

        System.setProperty("RECONNECT_DELAY_SECONDS", "0");
        assertThrows(IllegalArgumentException.class, CollectorConfig::fromEnv);

        System.clearProperty("RECONNECT_DELAY_SECONDS");
        System.setProperty("METADATA_REFRESH_UTC", "8am");
        assertThrows(IllegalArgumentException.class, CollectorConfig::fromEnv);
    }

    @Test
    void testEmptyAllowListIsRejected() {
        System.setProperty("UNDERLYING_ASSETS", " , ");
        assertThrows(IllegalArgumentException.class, CollectorConfig::fromEnv);
    }
}
