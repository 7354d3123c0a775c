package io.optionsnap.service.snapshot;

import io.optionsnap.domain.model.QuoteUpdate;
import io.optionsnap.domain.model.SnapshotRow;
import io.optionsnap.infrastructure.metrics.CollectorMetrics;
import io.optionsnap.repository.PersistenceException;
import io.optionsnap.repository.SnapshotRepository;
import io.optionsnap.service.QuoteCache;
import io.optionsnap.service.UnderlyingPriceCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically turns the quote cache into a persisted snapshot.
 *
 * One pass:
 * 1. Take the next index from the counter
 * 2. Copy the quote cache
 * 3. Filter (symbol, expiry, volume, last price)
 * 4. Join survivors with the underlying spot price
 * 5. Write all rows under the pass's index in one transaction
 *
 * The index advances once per pass, whether or not any row is written.
 */
public final class SnapshotScheduler {
    private static final Logger log = LoggerFactory.getLogger(SnapshotScheduler.class);

    private final QuoteCache quoteCache;
    private final UnderlyingPriceCache priceCache;
    private final SnapshotFilter filter;
    private final SnapshotIndexCounter counter;
    private final SnapshotRepository repository;
    private final CollectorMetrics metrics;
    private final Clock clock;
    private final String quoteAsset;
    private final Duration interval;

    private final ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> task;

    public SnapshotScheduler(QuoteCache quoteCache, UnderlyingPriceCache priceCache,
                             SnapshotFilter filter, SnapshotIndexCounter counter,
                             SnapshotRepository repository, CollectorMetrics metrics,
                             Clock clock, String quoteAsset, Duration interval) {
        this.quoteCache = quoteCache;
        this.priceCache = priceCache;
        this.filter = filter;
        this.counter = counter;
        this.repository = repository;
        this.metrics = metrics;
        this.clock = clock;
        this.quoteAsset = quoteAsset;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "snapshot-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Result of one pass.
     */
    public record PassResult(long snapshotIndex, int collected, int saved, boolean persisted) {
        public int dropped() {
            return collected - saved;
        }

        public String summary() {
            return "collected " + collected + ", saved " + saved + ", dropped " + dropped();
        }
    }

    /**
     * Schedule a pass every interval. The first pass runs one interval from now.
     */
    public synchronized void runForever() {
        if (task != null) {
            log.warn("[SNAPSHOT] Scheduler already running");
            return;
        }
        long millis = interval.toMillis();
        task = scheduler.scheduleAtFixedRate(() -> {
            try {
                runPass();
            } catch (Exception e) {
                log.error("[SNAPSHOT] Pass failed: {}", e.getMessage(), e);
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
        log.info("[SNAPSHOT] Scheduled every {}s", interval.toSeconds());
    }

    /**
     * Run one pass on the calling thread.
     */
    public PassResult runPass() {
        long started = System.nanoTime();
        long index = counter.next();

        Map<String, QuoteUpdate> copy = quoteCache.snapshotCopy();
        metrics.recordQuoteCacheSize(copy.size());

        SnapshotFilter.FilterResult filtered = filter.apply(copy, clock.instant());

        List<SnapshotRow> rows = new ArrayList<>(filtered.accepted().size());
        for (SnapshotFilter.Candidate candidate : filtered.accepted()) {
            String underlyingPrice = priceCache.priceOf(candidate.symbol().underlyingPair(quoteAsset));
            rows.add(new SnapshotRow(index, clock.instant(), candidate.symbol(), underlyingPrice, candidate.quote()));
        }

        try {
            repository.saveSnapshot(index, rows);
        } catch (PersistenceException e) {
            metrics.recordSnapshotFailure(index);
            log.error("[SNAPSHOT] Snapshot {}: failed to persist {} rows: {}", index, rows.size(), e.getMessage());
            return new PassResult(index, filtered.collected(), 0, false);
        }

        PassResult result = new PassResult(index, filtered.collected(), rows.size(), true);
        metrics.recordSnapshotPass(index, result.collected(), result.saved(),
            Duration.ofNanos(System.nanoTime() - started));

        log.info("[SNAPSHOT] Snapshot {}: {}", index, result.summary());
        if (filtered.unparsable() > 0 || filtered.expired() > 0) {
            log.debug("[SNAPSHOT] Snapshot {} drops: unparsable={}, expired={}, illiquid={}",
                index, filtered.unparsable(), filtered.expired(), filtered.illiquid());
        }
        return result;
    }

    public void shutdown() {
        ScheduledFuture<?> t = task;
        if (t != null) {
            t.cancel(false);
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
        log.info("[SNAPSHOT] Scheduler stopped at index {}", counter.current());
    }
}
