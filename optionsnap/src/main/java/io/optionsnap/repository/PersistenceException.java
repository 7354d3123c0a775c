package io.optionsnap.repository;

/**
 * Exception thrown when a snapshot pass or index query cannot be completed against the store.
 */
public class PersistenceException extends RuntimeException {

    private final long snapshotIndex;

    public PersistenceException(long snapshotIndex, String message, Throwable cause) {
        super(String.format("[snapshot %d] %s", snapshotIndex, message), cause);
        this.snapshotIndex = snapshotIndex;
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
        this.snapshotIndex = -1;
    }

    /**
     * Index of the failed pass, or -1 for failures outside a pass.
     */
    public long getSnapshotIndex() {
        return snapshotIndex;
    }
}
