package io.optionsnap.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.optionsnap.infrastructure.exchange.BinanceOptionsInstrumentFetcher;
import io.optionsnap.infrastructure.exchange.EmptyUniverseException;
import io.optionsnap.infrastructure.exchange.TransportException;
import io.optionsnap.infrastructure.metrics.PrometheusCollectorMetrics;
import io.optionsnap.infrastructure.metrics.PrometheusMetricsHandler;
import io.optionsnap.infrastructure.persistence.PostgresSnapshotRepository;
import io.optionsnap.infrastructure.stream.JdkWebSocketConnector;
import io.optionsnap.infrastructure.stream.StreamConnector;
import io.optionsnap.migration.SnapshotSchemaMigration;
import io.optionsnap.repository.SnapshotRepository;
import io.optionsnap.service.QuoteCache;
import io.optionsnap.service.UnderlyingPriceCache;
import io.optionsnap.service.instrument.InstrumentRegistry;
import io.optionsnap.service.instrument.MetadataRefresher;
import io.optionsnap.service.snapshot.SnapshotFilter;
import io.optionsnap.service.snapshot.SnapshotIndexCounter;
import io.optionsnap.service.snapshot.SnapshotScheduler;
import io.optionsnap.service.stream.QuoteStreamManager;
import io.optionsnap.service.stream.UnderlyingPriceTracker;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.ResponseCodeHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Option snapshot collector entry point.
 *
 * Wires:
 * - PostgreSQL snapshot store (HikariCP) and schema migration
 * - Binance options universe fetch
 * - Quote and underlying price streams
 * - Snapshot scheduler and daily metadata refresh
 * - Prometheus /metrics endpoint
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== Option Snapshot Collector Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        CollectorConfig config;
        try {
            config = CollectorConfig.fromEnv();
        } catch (IllegalArgumentException e) {
            log.error("❌ INVALID CONFIGURATION: {}", e.getMessage());
            System.exit(1);
            return;
        }
        log.info("Config: assets={}, groupSize={}, snapshotEvery={}s, reconnectDelay={}s, refreshAt={} UTC",
            config.underlyingAssets(), config.streamGroupSize(), config.snapshotInterval().toSeconds(),
            config.reconnectDelay().toSeconds(), config.metadataRefreshUtc());

        Clock clock = Clock.systemUTC();
        ObjectMapper objectMapper = new ObjectMapper();

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource(config);
        new SnapshotSchemaMigration(dataSource).migrate();
        SnapshotRepository snapshotRepo = new PostgresSnapshotRepository(dataSource);

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusCollectorMetrics metrics = new PrometheusCollectorMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Snapshot index recovery
        // ═══════════════════════════════════════════════════════════════
        SnapshotIndexCounter counter = SnapshotIndexCounter.recover(snapshotRepo);

        // ═══════════════════════════════════════════════════════════════
        // Instrument universe (startup fetch must succeed)
        // ═══════════════════════════════════════════════════════════════
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(config.connectTimeout())
            .build();
        BinanceOptionsInstrumentFetcher fetcher = new BinanceOptionsInstrumentFetcher(
            httpClient, config.exchangeInfoUrl(), config.underlyingAssets(), config.quoteAsset(),
            objectMapper, config.connectTimeout());
        InstrumentRegistry registry = new InstrumentRegistry(fetcher);

        Set<String> universe;
        try {
            universe = registry.refresh();
        } catch (TransportException | EmptyUniverseException e) {
            log.error("❌ STARTUP UNIVERSE FETCH FAILED: {}", e.getMessage());
            dataSource.close();
            System.exit(1);
            return;
        }

        // ═══════════════════════════════════════════════════════════════
        // Streams
        // ═══════════════════════════════════════════════════════════════
        ScheduledExecutorService streamScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "stream-reconnect");
            t.setDaemon(true);
            return t;
        });
        StreamConnector connector = new JdkWebSocketConnector(httpClient, config.connectTimeout());

        QuoteCache quoteCache = new QuoteCache();
        UnderlyingPriceCache priceCache = new UnderlyingPriceCache();

        UnderlyingPriceTracker priceTracker = new UnderlyingPriceTracker(
            config.underlyingStreamUrl(), config.quoteAsset(), config.reconnectDelay(),
            connector, streamScheduler, priceCache, objectMapper, metrics);
        priceTracker.trackPrices(config.underlyingAssets());

        QuoteStreamManager quoteManager = new QuoteStreamManager(
            config.quoteStreamUrl(), config.streamGroupSize(), config.reconnectDelay(),
            connector, streamScheduler, quoteCache, objectMapper, metrics);
        quoteManager.subscribe(universe);

        // ═══════════════════════════════════════════════════════════════
        // Snapshot scheduler and daily refresh
        // ═══════════════════════════════════════════════════════════════
        SnapshotScheduler snapshotScheduler = new SnapshotScheduler(
            quoteCache, priceCache, new SnapshotFilter(config.expirationCutoffUtc()), counter,
            snapshotRepo, metrics, clock, config.quoteAsset(), config.snapshotInterval());
        snapshotScheduler.runForever();

        MetadataRefresher refresher = new MetadataRefresher(
            registry, quoteCache, quoteManager, metrics, clock,
            config.metadataRefreshUtc(), config.expirationCutoffUtc());
        refresher.start();

        // ═══════════════════════════════════════════════════════════════
        // Metrics endpoint
        // ═══════════════════════════════════════════════════════════════
        Undertow metricsServer = null;
        if (config.metricsPort() > 0) {
            metricsServer = startMetricsServer(config.metricsPort(), metrics);
        } else {
            log.info("⏭️ Metrics endpoint disabled");
        }

        // ═══════════════════════════════════════════════════════════════
        // Shutdown
        // ═══════════════════════════════════════════════════════════════
        Undertow server = metricsServer;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down collector...");
            refresher.shutdown();
            snapshotScheduler.shutdown();
            quoteManager.stop();
            priceTracker.stop();
            streamScheduler.shutdownNow();
            if (server != null) {
                server.stop();
            }
            dataSource.close();
            log.info("Collector stopped");
        }, "shutdown"));

        log.info("✓ Collector running: {} symbols, next snapshot index {}", universe.size(), counter.current() + 1);
        quoteManager.termination().join();
    }

    private static HikariDataSource createDataSource(CollectorConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.dbUrl());
        hikari.setUsername(config.dbUser());
        hikari.setPassword(config.dbPassword());
        hikari.setMaximumPoolSize(config.dbPoolSize());
        hikari.setMinimumIdle(1);
        hikari.setConnectionTimeout(5000);
        hikari.setPoolName("optionsnap-hikari");

        log.info("DB: url={}, user={}, pool={}", config.dbUrl(), config.dbUser(), config.dbPoolSize());
        return new HikariDataSource(hikari);
    }

    /**
     * GET /metrics and GET /health. Other methods on these paths get 405.
     */
    static RoutingHandler statusRoutes(CollectorRegistry registry) {
        return Handlers.routing()
            .get("/metrics", new PrometheusMetricsHandler(registry))
            .get("/health", exchange -> {
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send("OK");
            })
            .setInvalidMethodHandler(ResponseCodeHandler.HANDLE_405);
    }

    private static Undertow startMetricsServer(int port, PrometheusCollectorMetrics metrics) {
        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(statusRoutes(metrics.getRegistry()))
            .build();
        server.start();
        log.info("✓ Metrics endpoint on http://localhost:{}/metrics", port);
        return server;
    }
}
