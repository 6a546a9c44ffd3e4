package in.fxledger.infrastructure.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the ingestion schema on startup.
 *
 * Tables:
 * - sources: provider dimension
 * - currency_pairs: pair dimension, natural key = symbol
 * - fx_ticks: fact table, PK (time, pair_id, source_id)
 *
 * fx_ticks becomes a TimescaleDB hypertable when the extension is available;
 * otherwise it stays a plain table.
 */
public final class SchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigration.class);

    private final DataSource dataSource;

    public SchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void migrate() {
        log.info("[SCHEMA MIGRATION] Starting");

        try (Connection conn = dataSource.getConnection()) {
            createIfMissing(conn, "sources", """
                CREATE TABLE IF NOT EXISTS sources (
                    id SMALLINT GENERATED ALWAYS AS IDENTITY PRIMARY KEY,
                    name TEXT NOT NULL UNIQUE,
                    priority SMALLINT DEFAULT 0
                )
                """);

            createIfMissing(conn, "currency_pairs", """
                CREATE TABLE IF NOT EXISTS currency_pairs (
                    id SMALLINT GENERATED ALWAYS AS IDENTITY PRIMARY KEY,
                    symbol TEXT NOT NULL UNIQUE,
                    base_currency TEXT NOT NULL,
                    quote_currency TEXT NOT NULL
                )
                """);

            boolean ticksExisted = tableExists(conn, "fx_ticks");
            createIfMissing(conn, "fx_ticks", """
                CREATE TABLE IF NOT EXISTS fx_ticks (
                    time TIMESTAMPTZ NOT NULL,
                    pair_id SMALLINT NOT NULL,
                    source_id SMALLINT NOT NULL,
                    bid NUMERIC(18, 8) NOT NULL,
                    mid NUMERIC(18, 8) NOT NULL,
                    ask NUMERIC(18, 8) NOT NULL,
                    volume NUMERIC(18, 8) DEFAULT NULL,
                    CONSTRAINT fx_ticks_pk PRIMARY KEY (time, pair_id, source_id)
                )
                """);

            if (!ticksExisted) {
                enableHypertable(conn);
            }

            log.info("[SCHEMA MIGRATION] Completed successfully");

        } catch (SQLException e) {
            log.error("[SCHEMA MIGRATION] Failed: {}", e.getMessage(), e);
            throw new RuntimeException("Schema migration failed", e);
        }
    }

    private void createIfMissing(Connection conn, String table, String ddl) throws SQLException {
        if (tableExists(conn, table)) {
            log.info("[SCHEMA MIGRATION] {} table already exists", table);
            return;
        }
        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate(ddl);
        }
        log.info("[SCHEMA MIGRATION] ✓ {} table created", table);
    }

    // Best effort: runs in auto-commit mode so a failure leaves the plain table usable
    private void enableHypertable(Connection conn) {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE EXTENSION IF NOT EXISTS timescaledb");
            stmt.execute("SELECT create_hypertable('fx_ticks', 'time', if_not_exists => TRUE)");
            log.info("[SCHEMA MIGRATION] ✓ fx_ticks converted to hypertable");
        } catch (SQLException e) {
            log.warn("[SCHEMA MIGRATION] TimescaleDB unavailable, fx_ticks stays a plain table: {}", e.getMessage());
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }
}
