package in.fxledger.infrastructure.persistence;

import in.fxledger.application.port.output.IngestionSession;
import in.fxledger.application.port.output.IngestionStore;
import in.fxledger.domain.common.PersistenceException;
import in.fxledger.domain.model.Tick;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.List;
import java.util.function.Function;

/**
 * PostgreSQL implementation of IngestionStore.
 *
 * One connection per transaction, auto-commit off for its duration.
 */
public final class PostgresIngestionStore implements IngestionStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresIngestionStore.class);

    // DO UPDATE (not DO NOTHING) so RETURNING yields the id of an existing row
    static final String UPSERT_SOURCE_SQL = """
        INSERT INTO sources (name, priority)
        VALUES (?, 0)
        ON CONFLICT (name)
        DO UPDATE SET name = EXCLUDED.name
        RETURNING id
        """;

    static final String UPSERT_PAIR_SQL = """
        INSERT INTO currency_pairs (symbol, base_currency, quote_currency)
        VALUES (?, ?, ?)
        ON CONFLICT (symbol)
        DO UPDATE SET symbol = EXCLUDED.symbol
        RETURNING id
        """;

    static final String UPSERT_TICK_SQL = """
        INSERT INTO fx_ticks (time, pair_id, source_id, bid, mid, ask, volume)
        VALUES (?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (time, pair_id, source_id)
        DO UPDATE SET
            bid = EXCLUDED.bid,
            mid = EXCLUDED.mid,
            ask = EXCLUDED.ask,
            volume = EXCLUDED.volume
        """;

    private final DataSource dataSource;

    public PostgresIngestionStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public <T> T inTransaction(Function<IngestionSession, T> work) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.apply(new JdbcIngestionSession(conn));
                conn.commit();
                return result;
            } catch (SQLException e) {
                rollback(conn, e);
                log.error("Failed to commit ingestion transaction: {}", e.getMessage());
                throw new PersistenceException("Failed to commit ingestion transaction", e);
            } catch (RuntimeException e) {
                rollback(conn, e);
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            log.error("Failed to open ingestion transaction: {}", e.getMessage());
            throw new PersistenceException("Failed to open ingestion transaction", e);
        }
    }

    private static void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
            log.warn("Ingestion transaction rolled back: {}", cause.getMessage());
        } catch (SQLException e) {
            log.error("Rollback failed: {}", e.getMessage());
            cause.addSuppressed(e);
        }
    }

    /**
     * Session bound to the transaction's connection.
     */
    static final class JdbcIngestionSession implements IngestionSession {
        private final Connection conn;

        JdbcIngestionSession(Connection conn) {
            this.conn = conn;
        }

        @Override
        public int getOrCreateSource(String name) {
            try (PreparedStatement ps = conn.prepareStatement(UPSERT_SOURCE_SQL)) {
                ps.setString(1, name);
                return returnedId(ps);
            } catch (SQLException e) {
                log.error("Failed to resolve source {}: {}", name, e.getMessage());
                throw new PersistenceException("Failed to resolve source " + name, e);
            }
        }

        @Override
        public int getOrCreatePair(String symbol, String baseCurrency, String quoteCurrency) {
            try (PreparedStatement ps = conn.prepareStatement(UPSERT_PAIR_SQL)) {
                ps.setString(1, symbol);
                ps.setString(2, baseCurrency);
                ps.setString(3, quoteCurrency);
                return returnedId(ps);
            } catch (SQLException e) {
                log.error("Failed to resolve pair {}: {}", symbol, e.getMessage());
                throw new PersistenceException("Failed to resolve currency pair " + symbol, e);
            }
        }

        @Override
        public int upsertTicks(List<Tick> ticks) {
            if (ticks == null || ticks.isEmpty()) {
                return 0;
            }
            try (PreparedStatement ps = conn.prepareStatement(UPSERT_TICK_SQL)) {
                for (Tick tick : ticks) {
                    ps.setTimestamp(1, Timestamp.from(tick.time()));
                    ps.setInt(2, tick.pairId());
                    ps.setInt(3, tick.sourceId());
                    ps.setBigDecimal(4, tick.bid());
                    ps.setBigDecimal(5, tick.mid());
                    ps.setBigDecimal(6, tick.ask());
                    if (tick.volume() != null) {
                        ps.setBigDecimal(7, tick.volume());
                    } else {
                        ps.setNull(7, Types.NUMERIC);
                    }
                    ps.addBatch();
                }
                ps.executeBatch();
                log.debug("Upserted {} ticks", ticks.size());
                return ticks.size();
            } catch (SQLException e) {
                log.error("Failed to upsert batch of {} ticks: {}", ticks.size(), e.getMessage());
                throw new PersistenceException("Failed to upsert ticks", e);
            }
        }

        private static int returnedId(PreparedStatement ps) throws SQLException {
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("Upsert returned no id");
                }
                return rs.getInt(1);
            }
        }
    }
}
