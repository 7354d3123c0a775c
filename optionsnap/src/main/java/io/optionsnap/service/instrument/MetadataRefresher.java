package io.optionsnap.service.instrument;

import io.optionsnap.domain.model.InstrumentSymbol;
import io.optionsnap.infrastructure.exchange.EmptyUniverseException;
import io.optionsnap.infrastructure.exchange.TransportException;
import io.optionsnap.infrastructure.metrics.CollectorMetrics;
import io.optionsnap.service.QuoteCache;
import io.optionsnap.service.stream.QuoteStreamManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Daily universe refresh.
 *
 * At the configured UTC time: re-fetch the universe, restream the live
 * symbols (listed, parsable, not expired), then prune quote cache entries
 * that are not live. Streams are reconciled before the prune so a released
 * symbol cannot be written back by a late frame. A failed fetch keeps
 * yesterday's universe, streams and cache; the next attempt is the next
 * day's run.
 */
public final class MetadataRefresher {
    private static final Logger log = LoggerFactory.getLogger(MetadataRefresher.class);

    private final InstrumentRegistry registry;
    private final QuoteCache quoteCache;
    private final QuoteStreamManager streamManager;
    private final CollectorMetrics metrics;
    private final Clock clock;
    private final LocalTime refreshTimeUtc;
    private final LocalTime expirationCutoffUtc;

    private final ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> nextRun;
    private volatile boolean running = false;

    public MetadataRefresher(InstrumentRegistry registry, QuoteCache quoteCache,
                             QuoteStreamManager streamManager, CollectorMetrics metrics,
                             Clock clock, LocalTime refreshTimeUtc, LocalTime expirationCutoffUtc) {
        this.registry = registry;
        this.quoteCache = quoteCache;
        this.streamManager = streamManager;
        this.metrics = metrics;
        this.clock = clock;
        this.refreshTimeUtc = refreshTimeUtc;
        this.expirationCutoffUtc = expirationCutoffUtc;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "metadata-refresh");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Outcome of one refresh.
     *
     * @param success Whether a new universe was installed
     * @param universeSize Size of the installed universe (0 on failure)
     * @param pruned Cache entries removed
     * @param newlySubscribed Symbols that got a stream session in this refresh
     * @param released Symbols no longer streamed after this refresh
     */
    public record RefreshResult(boolean success, int universeSize, int pruned,
                                List<String> newlySubscribed, List<String> released) {
        static RefreshResult failed() {
            return new RefreshResult(false, 0, 0, List.of(), List.of());
        }
    }

    public synchronized void start() {
        if (running) {
            log.warn("[REFRESH] Already running");
            return;
        }
        running = true;
        scheduleNext();
    }

    public synchronized void shutdown() {
        running = false;
        ScheduledFuture<?> f = nextRun;
        if (f != null) {
            f.cancel(false);
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Run one refresh on the calling thread.
     */
    public RefreshResult refreshNow() {
        log.info("[REFRESH] Refreshing option universe");

        Set<String> universe;
        try {
            universe = registry.refresh();
        } catch (TransportException | EmptyUniverseException e) {
            log.error("[REFRESH] Universe fetch failed, keeping {} symbols: {}",
                registry.currentUniverse().size(), e.getMessage());
            metrics.recordMetadataRefresh(false, 0, 0);
            return RefreshResult.failed();
        }

        Instant now = clock.instant();
        QuoteStreamManager.Resubscription streams = streamManager.resubscribe(liveSymbols(universe, now));
        int pruned = prune(universe, now);

        metrics.recordMetadataRefresh(true, universe.size(), pruned);
        metrics.recordQuoteCacheSize(quoteCache.size());
        log.info("[REFRESH] ✓ Universe {} symbols, pruned {}, newly subscribed {}, released {}",
            universe.size(), pruned, streams.added().size(), streams.released().size());
        return new RefreshResult(true, universe.size(), pruned, streams.added(), streams.released());
    }

    /**
     * Universe symbols worth streaming at {@code now}, in universe order.
     */
    List<String> liveSymbols(Set<String> universe, Instant now) {
        List<String> live = new ArrayList<>();
        for (String symbol : universe) {
            if (isLive(symbol, universe, now)) {
                live.add(symbol);
            }
        }
        return live;
    }

    /**
     * Remove cache entries that are not in {@code universe}, do not parse, or
     * have reached their expiration cutoff at {@code now}.
     *
     * @return number of entries removed
     */
    int prune(Set<String> universe, Instant now) {
        int removed = 0;
        for (String symbol : quoteCache.symbols()) {
            if (!isLive(symbol, universe, now) && quoteCache.remove(symbol)) {
                removed++;
                log.debug("[REFRESH] Pruned {}", symbol);
            }
        }
        return removed;
    }

    private boolean isLive(String symbol, Set<String> universe, Instant now) {
        Optional<InstrumentSymbol> parsed = InstrumentSymbol.tryParse(symbol);
        return universe.contains(symbol)
            && parsed.isPresent()
            && !parsed.get().isExpiredAt(now, expirationCutoffUtc);
    }

    private void scheduleNext() {
        if (!running) {
            return;
        }
        Instant now = clock.instant();
        Instant at = nextRunAfter(now, refreshTimeUtc);
        long delayMillis = Duration.between(now, at).toMillis();

        try {
            nextRun = scheduler.schedule(() -> {
                try {
                    refreshNow();
                } catch (Exception e) {
                    log.error("[REFRESH] Unexpected error: {}", e.getMessage(), e);
                } finally {
                    scheduleNext();
                }
            }, delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("[REFRESH] Scheduler shut down, no further refresh");
            return;
        }

        log.info("[REFRESH] Next refresh at {}", at);
    }

    /**
     * First instant strictly after {@code now} whose UTC time of day is {@code timeUtc}.
     */
    public static Instant nextRunAfter(Instant now, LocalTime timeUtc) {
        ZonedDateTime utcNow = now.atZone(ZoneOffset.UTC);
        LocalDate day = utcNow.toLocalDate();
        ZonedDateTime candidate = day.atTime(timeUtc).atZone(ZoneOffset.UTC);
        if (!candidate.isAfter(utcNow)) {
            candidate = day.plusDays(1).atTime(timeUtc).atZone(ZoneOffset.UTC);
        }
        return candidate.toInstant();
    }
}
