package io.optionsnap.infrastructure.metrics;

import java.time.Duration;

/**
 * Collector metrics interface for monitoring and alerting.
 *
 * Key metrics:
 * - Stream messages received and malformed frames, per stream kind
 * - Stream connects and reconnects
 * - Snapshot pass outcome (rows saved, rows dropped, current index)
 * - Quote cache size
 * - Daily metadata refresh outcome
 */
public interface CollectorMetrics {

    /**
     * Record one frame applied to a cache.
     *
     * @param stream Stream kind ("options" or "underlying")
     */
    void recordStreamMessage(String stream);

    /**
     * Record a frame that could not be decoded or carried no symbol.
     */
    void recordMalformedFrame(String stream);

    /**
     * Record a session becoming connected.
     */
    void recordConnected(String stream);

    /**
     * Record a session losing its connection (or failing to connect) and scheduling a retry.
     *
     * @param reason Short cause label (connect_failed, closed, error)
     * @param wasConnected Whether the session had been counted as connected
     */
    void recordDisconnected(String stream, String reason, boolean wasConnected);

    /**
     * Record a connected session closed on purpose (shutdown or regrouping). Not a reconnect.
     */
    void recordStopped(String stream);

    /**
     * Record a completed snapshot pass.
     *
     * @param snapshotIndex Index used by the pass
     * @param collected Quote cache entries considered
     * @param saved Rows written
     * @param duration Wall time of the pass
     */
    void recordSnapshotPass(long snapshotIndex, int collected, int saved, Duration duration);

    /**
     * Record a snapshot pass whose rows could not be persisted.
     */
    void recordSnapshotFailure(long snapshotIndex);

    /**
     * Record current number of symbols held in the quote cache.
     */
    void recordQuoteCacheSize(int size);

    /**
     * Record a metadata refresh attempt.
     *
     * @param success Whether the universe was fetched
     * @param universeSize Symbols in the new universe (0 on failure)
     * @param pruned Cache entries removed
     */
    void recordMetadataRefresh(boolean success, int universeSize, int pruned);
}
