package io.optionsnap.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of CollectorMetrics.
 *
 * Key Metrics:
 * - optionsnap_stream_messages_total{stream} - Frames applied to caches
 * - optionsnap_stream_malformed_total{stream} - Frames skipped
 * - optionsnap_stream_reconnects_total{stream, reason} - Lost connections
 * - optionsnap_stream_sessions_connected{stream} - Sessions currently connected
 * - optionsnap_snapshot_rows_total{outcome} - Rows saved / dropped
 * - optionsnap_snapshot_index - Last snapshot index used
 * - optionsnap_quote_cache_size - Symbols in the quote cache
 * - optionsnap_metadata_refresh_total{status} - Daily refresh outcomes
 *
 * Usage:
 * <pre>
 * PrometheusCollectorMetrics metrics = new PrometheusCollectorMetrics();
 * // Expose at /metrics endpoint
 * routes.get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusCollectorMetrics implements CollectorMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusCollectorMetrics.class);

    private final CollectorRegistry registry;

    // Stream metrics
    private final Counter streamMessages;
    private final Counter malformedFrames;
    private final Counter reconnects;
    private final Gauge connectedSessions;

    // Snapshot metrics
    private final Counter snapshotRows;
    private final Counter snapshotFailures;
    private final Histogram snapshotDuration;
    private final Gauge snapshotIndex;
    private final Gauge quoteCacheSize;

    // Refresh metrics
    private final Counter metadataRefreshes;
    private final Gauge universeSize;
    private final Counter prunedSymbols;

    public PrometheusCollectorMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusCollectorMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.streamMessages = Counter.build()
            .name("optionsnap_stream_messages_total")
            .help("Total number of stream frames applied to caches")
            .labelNames("stream")
            .register(registry);

        this.malformedFrames = Counter.build()
            .name("optionsnap_stream_malformed_total")
            .help("Total number of stream frames skipped as malformed")
            .labelNames("stream")
            .register(registry);

        this.reconnects = Counter.build()
            .name("optionsnap_stream_reconnects_total")
            .help("Total number of lost or failed stream connections")
            .labelNames("stream", "reason")
            .register(registry);

        this.connectedSessions = Gauge.build()
            .name("optionsnap_stream_sessions_connected")
            .help("Number of stream sessions currently connected")
            .labelNames("stream")
            .register(registry);

        this.snapshotRows = Counter.build()
            .name("optionsnap_snapshot_rows_total")
            .help("Total number of quote entries saved or dropped by snapshot passes")
            .labelNames("outcome")
            .register(registry);

        this.snapshotFailures = Counter.build()
            .name("optionsnap_snapshot_failures_total")
            .help("Total number of snapshot passes that failed to persist")
            .register(registry);

        this.snapshotDuration = Histogram.build()
            .name("optionsnap_snapshot_duration_seconds")
            .help("Snapshot pass duration in seconds")
            .buckets(0.01, 0.05, 0.1, 0.5, 1.0, 5.0)
            .register(registry);

        this.snapshotIndex = Gauge.build()
            .name("optionsnap_snapshot_index")
            .help("Last snapshot index used")
            .register(registry);

        this.quoteCacheSize = Gauge.build()
            .name("optionsnap_quote_cache_size")
            .help("Number of symbols held in the quote cache")
            .register(registry);

        this.metadataRefreshes = Counter.build()
            .name("optionsnap_metadata_refresh_total")
            .help("Total number of metadata refresh attempts")
            .labelNames("status")
            .register(registry);

        this.universeSize = Gauge.build()
            .name("optionsnap_universe_size")
            .help("Number of option symbols in the current universe")
            .register(registry);

        this.prunedSymbols = Counter.build()
            .name("optionsnap_pruned_symbols_total")
            .help("Total number of quote cache entries removed by metadata refresh")
            .register(registry);

        log.info("[PrometheusCollectorMetrics] Initialized");
    }

    @Override
    public void recordStreamMessage(String stream) {
        streamMessages.labels(stream).inc();
    }

    @Override
    public void recordMalformedFrame(String stream) {
        malformedFrames.labels(stream).inc();
    }

    @Override
    public void recordConnected(String stream) {
        connectedSessions.labels(stream).inc();
    }

    @Override
    public void recordDisconnected(String stream, String reason, boolean wasConnected) {
        reconnects.labels(stream, reason).inc();
        if (wasConnected) {
            connectedSessions.labels(stream).dec();
        }
    }

    @Override
    public void recordStopped(String stream) {
        connectedSessions.labels(stream).dec();
    }

    @Override
    public void recordSnapshotPass(long index, int collected, int saved, Duration duration) {
        snapshotRows.labels("saved").inc(saved);
        snapshotRows.labels("dropped").inc(collected - saved);
        snapshotDuration.observe(duration.toMillis() / 1000.0);
        snapshotIndex.set(index);
    }

    @Override
    public void recordSnapshotFailure(long index) {
        snapshotFailures.inc();
        snapshotIndex.set(index);
    }

    @Override
    public void recordQuoteCacheSize(int size) {
        quoteCacheSize.set(size);
    }

    @Override
    public void recordMetadataRefresh(boolean success, int universe, int pruned) {
        metadataRefreshes.labels(success ? "success" : "failure").inc();
        if (success) {
            universeSize.set(universe);
            prunedSymbols.inc(pruned);
        }
    }

    /**
     * Get Prometheus registry for /metrics endpoint.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}
