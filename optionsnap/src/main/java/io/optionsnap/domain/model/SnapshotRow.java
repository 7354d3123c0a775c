package io.optionsnap.domain.model;

import java.time.Instant;

/**
 * One persisted line of a snapshot pass.
 *
 * @param underlyingPrice last spot trade price, empty when the pair is not tracked
 */
public record SnapshotRow(
    long snapshotIndex,
    Instant timestamp,
    InstrumentSymbol symbol,
    String underlyingPrice,
    QuoteUpdate quote
) {
    public SnapshotRow {
        if (timestamp == null || symbol == null || quote == null) {
            throw new IllegalArgumentException("timestamp, symbol and quote cannot be null");
        }
        if (underlyingPrice == null) {
            underlyingPrice = "";
        }
    }
}
