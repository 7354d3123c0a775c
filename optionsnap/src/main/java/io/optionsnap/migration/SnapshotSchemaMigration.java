package io.optionsnap.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Snapshot schema migration - creates tables on startup.
 *
 * Creates two tables:
 * - option_snapshots: one row per option per snapshot pass (append-only)
 * - snapshot_high_water: single row holding the last snapshot index used
 */
public final class SnapshotSchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(SnapshotSchemaMigration.class);

    private final DataSource dataSource;

    public SnapshotSchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Run migration - creates tables and indexes if they don't exist. Idempotent.
     */
    public void migrate() {
        log.info("[SNAPSHOT MIGRATION] Starting snapshot schema migration");

        try (Connection conn = dataSource.getConnection()) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(createSnapshotsTableSql());
                stmt.execute("""
                    CREATE INDEX IF NOT EXISTS idx_option_snapshots_index
                        ON option_snapshots (snapshot_index)
                    """);
                stmt.execute("""
                    CREATE TABLE IF NOT EXISTS snapshot_high_water (
                        id INT PRIMARY KEY,
                        snapshot_index BIGINT NOT NULL
                    )
                    """);
            }
            seedHighWater(conn);
            log.info("[SNAPSHOT MIGRATION] ✓ Migration completed successfully");

        } catch (SQLException e) {
            log.error("[SNAPSHOT MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Snapshot schema migration failed", e);
        }
    }

    private String createSnapshotsTableSql() {
        return """
            CREATE TABLE IF NOT EXISTS option_snapshots (
                id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                snapshot_index BIGINT NOT NULL,
                ts TIMESTAMP WITH TIME ZONE NOT NULL,
                symbol VARCHAR(64) NOT NULL,
                underlying VARCHAR(16) NOT NULL,
                expiration DATE NOT NULL,
                strike NUMERIC(24, 8) NOT NULL,
                side VARCHAR(1) NOT NULL,
                underlying_price VARCHAR(64) NOT NULL,
                event_time BIGINT NOT NULL,

                -- Raw ticker fields, exchange decimal text
                open_price VARCHAR(64),
                high_price VARCHAR(64),
                low_price VARCHAR(64),
                last_price VARCHAR(64),
                volume VARCHAR(64),
                quote_volume VARCHAR(64),
                trade_count VARCHAR(32),
                bid_price VARCHAR(64),
                ask_price VARCHAR(64),
                bid_qty VARCHAR(64),
                ask_qty VARCHAR(64),

                -- Greeks and implied volatility
                buy_iv VARCHAR(64),
                sell_iv VARCHAR(64),
                delta VARCHAR(64),
                theta VARCHAR(64),
                gamma VARCHAR(64),
                vega VARCHAR(64),
                mark_iv VARCHAR(64),
                mark_price VARCHAR(64)
            )
            """;
    }

    private void seedHighWater(Connection conn) throws SQLException {
        try (PreparedStatement check = conn.prepareStatement(
                "SELECT COUNT(*) FROM snapshot_high_water WHERE id = 1");
             ResultSet rs = check.executeQuery()) {
            if (rs.next() && rs.getInt(1) > 0) {
                return;
            }
        }
        try (PreparedStatement insert = conn.prepareStatement(
                "INSERT INTO snapshot_high_water (id, snapshot_index) VALUES (1, 0)")) {
            insert.executeUpdate();
            log.info("[SNAPSHOT MIGRATION] snapshot_high_water seeded");
        }
    }
}
