package io.optionsnap.infrastructure.persistence;

import io.optionsnap.domain.model.InstrumentSymbol;
import io.optionsnap.domain.model.QuoteUpdate;
import io.optionsnap.domain.model.SnapshotRow;
import io.optionsnap.repository.PersistenceException;
import io.optionsnap.repository.SnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL implementation of SnapshotRepository.
 *
 * Each pass is one transaction: batch insert of its rows followed by the
 * high-water update. The connection is borrowed from the pool per pass.
 */
public final class PostgresSnapshotRepository implements SnapshotRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresSnapshotRepository.class);

    private static final int BATCH_SIZE = 1000;

    private static final String INSERT_SQL = """
        INSERT INTO option_snapshots (
            snapshot_index, ts, symbol, underlying, expiration, strike, side, underlying_price, event_time,
            open_price, high_price, low_price, last_price, volume, quote_volume, trade_count,
            bid_price, ask_price, bid_qty, ask_qty,
            buy_iv, sell_iv, delta, theta, gamma, vega, mark_iv, mark_price
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private static final String SELECT_COLUMNS = """
        SELECT snapshot_index, ts, symbol, underlying_price, event_time,
               open_price, high_price, low_price, last_price, volume, quote_volume, trade_count,
               bid_price, ask_price, bid_qty, ask_qty,
               buy_iv, sell_iv, delta, theta, gamma, vega, mark_iv, mark_price
        FROM option_snapshots
        """;

    private final DataSource dataSource;

    public PostgresSnapshotRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void saveSnapshot(long snapshotIndex, List<SnapshotRow> rows) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                insertRows(conn, snapshotIndex, rows);
                advanceHighWater(conn, snapshotIndex);
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn);
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
            log.debug("Saved {} rows for snapshot {}", rows.size(), snapshotIndex);

        } catch (SQLException e) {
            log.error("Failed to save snapshot {}: {}", snapshotIndex, e.getMessage());
            throw new PersistenceException(snapshotIndex, "Failed to save " + rows.size() + " rows", e);
        }
    }

    @Override
    public long findHighWaterIndex() {
        long maxRowIndex = findMaxSnapshotIndex();
        long mark = querySingleLong("SELECT snapshot_index FROM snapshot_high_water WHERE id = 1");
        return Math.max(maxRowIndex, mark);
    }

    @Override
    public long findMaxSnapshotIndex() {
        return querySingleLong("SELECT MAX(snapshot_index) FROM option_snapshots");
    }

    @Override
    public List<SnapshotRow> findBySnapshotIndex(long snapshotIndex) {
        String sql = SELECT_COLUMNS + " WHERE snapshot_index = ? ORDER BY id ASC";
        List<SnapshotRow> result = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, snapshotIndex);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapRow(rs));
                }
            }

        } catch (SQLException e) {
            log.error("Failed to load snapshot {}: {}", snapshotIndex, e.getMessage());
            throw new PersistenceException(snapshotIndex, "Failed to load rows", e);
        }

        return result;
    }

    @Override
    public int countBySnapshotIndex(long snapshotIndex) {
        String sql = "SELECT COUNT(*) FROM option_snapshots WHERE snapshot_index = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, snapshotIndex);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }

        } catch (SQLException e) {
            log.error("Failed to count snapshot {}: {}", snapshotIndex, e.getMessage());
            throw new PersistenceException(snapshotIndex, "Failed to count rows", e);
        }
    }

    private void insertRows(Connection conn, long snapshotIndex, List<SnapshotRow> rows) throws SQLException {
        if (rows.isEmpty()) {
            return;
        }

        try (PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
            int count = 0;
            for (SnapshotRow row : rows) {
                if (row.snapshotIndex() != snapshotIndex) {
                    throw new IllegalArgumentException(
                        "Row for " + row.symbol() + " has index " + row.snapshotIndex() + ", expected " + snapshotIndex);
                }
                bindRow(ps, row);
                ps.addBatch();
                count++;

                if (count % BATCH_SIZE == 0) {
                    ps.executeBatch();
                }
            }
            ps.executeBatch();
        }
    }

    private void bindRow(PreparedStatement ps, SnapshotRow row) throws SQLException {
        InstrumentSymbol symbol = row.symbol();
        QuoteUpdate q = row.quote();

        ps.setLong(1, row.snapshotIndex());
        ps.setTimestamp(2, Timestamp.from(row.timestamp()));
        ps.setString(3, symbol.toString());
        ps.setString(4, symbol.underlying());
        ps.setDate(5, Date.valueOf(symbol.expirationDate()));
        ps.setBigDecimal(6, symbol.strikePrice());
        ps.setString(7, symbol.side().code());
        ps.setString(8, row.underlyingPrice());
        ps.setLong(9, q.eventTime());

        ps.setString(10, q.open());
        ps.setString(11, q.high());
        ps.setString(12, q.low());
        ps.setString(13, q.last());
        ps.setString(14, q.volume());
        ps.setString(15, q.quoteVolume());
        ps.setString(16, q.tradeCount());
        ps.setString(17, q.bidPrice());
        ps.setString(18, q.askPrice());
        ps.setString(19, q.bidQty());
        ps.setString(20, q.askQty());

        ps.setString(21, q.buyImpliedVol());
        ps.setString(22, q.sellImpliedVol());
        ps.setString(23, q.delta());
        ps.setString(24, q.theta());
        ps.setString(25, q.gamma());
        ps.setString(26, q.vega());
        ps.setString(27, q.markImpliedVol());
        ps.setString(28, q.markPrice());
    }

    private void advanceHighWater(Connection conn, long snapshotIndex) throws SQLException {
        String sql = "UPDATE snapshot_high_water SET snapshot_index = ? WHERE id = 1 AND snapshot_index < ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, snapshotIndex);
            ps.setLong(2, snapshotIndex);
            ps.executeUpdate();
        }
    }

    private long querySingleLong(String sql) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            if (rs.next()) {
                long value = rs.getLong(1);
                return rs.wasNull() ? 0L : value;
            }
            return 0L;

        } catch (SQLException e) {
            log.error("Failed to read snapshot index: {}", e.getMessage());
            throw new PersistenceException("Failed to read snapshot index", e);
        }
    }

    private SnapshotRow mapRow(ResultSet rs) throws SQLException {
        String symbol = rs.getString("symbol");
        QuoteUpdate quote = new QuoteUpdate(
            symbol,
            rs.getLong("event_time"),
            rs.getString("open_price"),
            rs.getString("high_price"),
            rs.getString("low_price"),
            rs.getString("last_price"),
            rs.getString("volume"),
            rs.getString("quote_volume"),
            rs.getString("trade_count"),
            rs.getString("bid_price"),
            rs.getString("ask_price"),
            rs.getString("bid_qty"),
            rs.getString("ask_qty"),
            rs.getString("buy_iv"),
            rs.getString("sell_iv"),
            rs.getString("delta"),
            rs.getString("theta"),
            rs.getString("gamma"),
            rs.getString("vega"),
            rs.getString("mark_iv"),
            rs.getString("mark_price")
        );

        return new SnapshotRow(
            rs.getLong("snapshot_index"),
            rs.getTimestamp("ts").toInstant(),
            InstrumentSymbol.parse(symbol),
            rs.getString("underlying_price"),
            quote
        );
    }

    private static void rollbackQuietly(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed: {}", e.getMessage());
        }
    }
}
