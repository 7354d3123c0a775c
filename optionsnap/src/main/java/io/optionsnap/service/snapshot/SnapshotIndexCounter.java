package io.optionsnap.service.snapshot;

import io.optionsnap.repository.SnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory snapshot index. Recovered once from the store, then advanced by one per pass.
 */
public final class SnapshotIndexCounter {
    private static final Logger log = LoggerFactory.getLogger(SnapshotIndexCounter.class);

    private final AtomicLong last;

    public SnapshotIndexCounter(long lastUsed) {
        if (lastUsed < 0) {
            throw new IllegalArgumentException("lastUsed must be >= 0: " + lastUsed);
        }
        this.last = new AtomicLong(lastUsed);
    }

    /**
     * Counter positioned at the store's high-water mark (0 for an empty store).
     */
    public static SnapshotIndexCounter recover(SnapshotRepository repository) {
        long highWater = repository.findHighWaterIndex();
        log.info("[SNAPSHOT] Recovered snapshot index {}, next pass uses {}", highWater, highWater + 1);
        return new SnapshotIndexCounter(highWater);
    }

    /**
     * Consume and return the next index.
     */
    public long next() {
        return last.incrementAndGet();
    }

    /**
     * Last index handed out.
     */
    public long current() {
        return last.get();
    }
}
