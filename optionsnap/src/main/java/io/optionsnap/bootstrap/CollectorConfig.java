package io.optionsnap.bootstrap;

import io.optionsnap.util.Env;

import java.net.URI;
import java.time.Duration;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable collector configuration, read once at startup.
 */
public record CollectorConfig(
    Set<String> underlyingAssets,     // allow-list, e.g. BTC, ETH
    String quoteAsset,                // suffix stripped from exchange underlyings, e.g. USDT
    int streamGroupSize,              // max stream names per connection
    Duration reconnectDelay,
    Duration snapshotInterval,
    LocalTime expirationCutoffUtc,
    LocalTime metadataRefreshUtc,
    Duration connectTimeout,
    URI exchangeInfoUrl,
    URI quoteStreamUrl,
    URI underlyingStreamUrl,
    String dbUrl,
    String dbUser,
    String dbPassword,
    int dbPoolSize,
    int metricsPort                   // 0 disables the metrics endpoint
) {
    /** Exchange limit on stream names per combined-stream connection. */
    public static final int MAX_STREAM_GROUP_SIZE = 200;

    public CollectorConfig {
        if (underlyingAssets == null || underlyingAssets.isEmpty()) {
            throw new IllegalArgumentException("At least one underlying asset is required");
        }
        if (quoteAsset == null || quoteAsset.isBlank()) {
            throw new IllegalArgumentException("Quote asset is required");
        }
        if (streamGroupSize <= 0 || streamGroupSize > MAX_STREAM_GROUP_SIZE) {
            throw new IllegalArgumentException(
                "Stream group size must be between 1 and " + MAX_STREAM_GROUP_SIZE + ", got " + streamGroupSize);
        }
        requirePositive(reconnectDelay, "Reconnect delay");
        requirePositive(snapshotInterval, "Snapshot interval");
        requirePositive(connectTimeout, "Connect timeout");
        if (expirationCutoffUtc == null || metadataRefreshUtc == null) {
            throw new IllegalArgumentException("Expiration cutoff and metadata refresh times are required");
        }
        if (dbPoolSize <= 0) {
            throw new IllegalArgumentException("DB pool size must be positive");
        }
        if (metricsPort < 0 || metricsPort > 65535) {
            throw new IllegalArgumentException("Metrics port out of range: " + metricsPort);
        }
        underlyingAssets = Collections.unmodifiableSet(new LinkedHashSet<>(underlyingAssets));
    }

    /**
     * Load from environment variables (or system properties of the same name).
     */
    public static CollectorConfig fromEnv() {
        Set<String> assets = new LinkedHashSet<>();
        for (String asset : Env.getList("UNDERLYING_ASSETS", "BTC,ETH")) {
            assets.add(asset.toUpperCase(Locale.ROOT));
        }

        return new CollectorConfig(
            assets,
            Env.get("QUOTE_ASSET", "USDT").toUpperCase(Locale.ROOT),
            Env.getInt("STREAM_GROUP_SIZE", MAX_STREAM_GROUP_SIZE),
            Duration.ofSeconds(Env.getInt("RECONNECT_DELAY_SECONDS", 60)),
            Duration.ofSeconds(Env.getInt("SNAPSHOT_INTERVAL_SECONDS", 60)),
            parseTime("EXPIRATION_CUTOFF_UTC", "08:00"),
            parseTime("METADATA_REFRESH_UTC", "08:01"),
            Duration.ofSeconds(Env.getInt("CONNECT_TIMEOUT_SECONDS", 10)),
            URI.create(Env.get("EXCHANGE_INFO_URL", "https://eapi.binance.com/eapi/v1/exchangeInfo")),
            URI.create(Env.get("QUOTE_STREAM_URL", "wss://nbstream.binance.com/eoptions/stream")),
            URI.create(Env.get("UNDERLYING_STREAM_URL", "wss://stream.binance.com:9443/stream")),
            Env.get("DB_URL", "jdbc:postgresql://localhost:5432/optionsnap"),
            Env.get("DB_USER", "postgres"),
            Env.get("DB_PASS", "postgres"),
            Env.getInt("DB_POOL_SIZE", 4),
            Env.getInt("METRICS_PORT", 9091)
        );
    }

    private static LocalTime parseTime(String key, String defaultValue) {
        String value = Env.get(key, defaultValue);
        try {
            return LocalTime.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(key + " must be HH:mm, got '" + value + "'", e);
        }
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
