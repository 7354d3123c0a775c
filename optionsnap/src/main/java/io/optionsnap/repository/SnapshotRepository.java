package io.optionsnap.repository;

import io.optionsnap.domain.model.SnapshotRow;

import java.util.List;

/**
 * Append-only store of snapshot rows and the snapshot index high-water mark.
 */
public interface SnapshotRepository {

    /**
     * Persist one pass atomically: all rows plus the high-water mark advanced to
     * {@code snapshotIndex}. An empty row list still advances the mark.
     *
     * @throws PersistenceException if nothing could be written; no partial pass is left behind
     */
    void saveSnapshot(long snapshotIndex, List<SnapshotRow> rows);

    /**
     * Largest snapshot index used by any pass, with or without rows. 0 for an empty store.
     */
    long findHighWaterIndex();

    /**
     * MAX(snapshot_index) over stored rows. 0 when there are none.
     */
    long findMaxSnapshotIndex();

    /**
     * Rows of one pass, ordered by row id.
     */
    List<SnapshotRow> findBySnapshotIndex(long snapshotIndex);

    /**
     * Number of rows stored for one pass.
     */
    int countBySnapshotIndex(long snapshotIndex);
}
