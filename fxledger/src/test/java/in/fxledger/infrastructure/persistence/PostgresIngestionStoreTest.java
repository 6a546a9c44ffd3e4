package in.fxledger.infrastructure.persistence;

import in.fxledger.domain.common.PersistenceException;
import in.fxledger.domain.model.Tick;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PostgresIngestionStoreTest {

    private static final Instant T0 = Instant.parse("2026-01-29T02:25:44Z");

    @Mock
    private DataSource dataSource;
    @Mock
    private Connection conn;
    @Mock
    private PreparedStatement ps;
    @Mock
    private ResultSet rs;

    private PostgresIngestionStore store;

    @BeforeEach
    void setUp() throws SQLException {
        when(dataSource.getConnection()).thenReturn(conn);
        store = new PostgresIngestionStore(dataSource);
    }

    private static Tick tick(BigDecimal volume) {
        return new Tick(T0, 2, 1, new BigDecimal("25350"), new BigDecimal("25380"), new BigDecimal("25410"), volume);
    }

    @Test
    void successfulWorkIsCommitted() throws SQLException {
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        when(ps.executeQuery()).thenReturn(rs);
        when(rs.next()).thenReturn(true);
        when(rs.getInt(1)).thenReturn(4);

        int id = store.inTransaction(session -> session.getOrCreateSource("VietcomBank"));

        assertEquals(4, id);
        InOrder order = inOrder(conn);
        order.verify(conn).setAutoCommit(false);
        order.verify(conn).commit();
        order.verify(conn).setAutoCommit(true);
        verify(conn, never()).rollback();
        verify(ps).setString(1, "VietcomBank");
    }

    @Test
    void ticksAreBatchedWithNullVolume() throws SQLException {
        when(conn.prepareStatement(anyString())).thenReturn(ps);

        int written = store.inTransaction(session -> session.upsertTicks(List.of(tick(null), tick(new BigDecimal("12")))));

        assertEquals(2, written);
        verify(ps, times(2)).setTimestamp(1, Timestamp.from(T0));
        verify(ps).setNull(7, Types.NUMERIC);
        verify(ps).setBigDecimal(7, new BigDecimal("12"));
        verify(ps, times(2)).addBatch();
        verify(ps).executeBatch();
    }

    @Test
    void emptyBatchSkipsDatabase() throws SQLException {
        int written = store.inTransaction(session -> session.upsertTicks(List.of()));

        assertEquals(0, written);

        verify(conn, never()).prepareStatement(anyString());
    }

    @Test
    void sqlFailureRollsBack() throws SQLException {
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        when(ps.executeBatch()).thenThrow(new SQLException("deadlock detected"));

        PersistenceException e = assertThrows(PersistenceException.class,
            () -> store.inTransaction(session -> session.upsertTicks(List.of(tick(null)))));

        assertInstanceOf(SQLException.class, e.getCause());
        verify(conn).rollback();
        verify(conn, never()).commit();
        verify(conn).setAutoCommit(true);
    }

    @Test
    void workFailureRollsBackAndPropagates() throws SQLException {
        IllegalArgumentException boom = new IllegalArgumentException("bad currency");

        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
            () -> store.inTransaction(session -> {
                throw boom;
            }));

        assertSame(boom, thrown);
        verify(conn).rollback();
        verify(conn).close();
    }

    @Test
    void missingReturnedIdIsFailure() throws SQLException {
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        when(ps.executeQuery()).thenReturn(rs);
        when(rs.next()).thenReturn(false);

        assertThrows(PersistenceException.class,
            () -> store.inTransaction(session -> session.getOrCreatePair("USDVND", "USD", "VND")));
        verify(conn).rollback();
    }

    @Test
    void unavailableDatabaseIsPersistenceFailure() throws SQLException {
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused"));

        assertThrows(PersistenceException.class, () -> store.inTransaction(session -> 1));
    }
}
