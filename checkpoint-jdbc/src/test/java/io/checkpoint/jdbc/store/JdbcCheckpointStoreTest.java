package io.checkpoint.jdbc.store;

import io.checkpoint.CheckpointException;
import io.checkpoint.CheckpointLockedException;
import io.checkpoint.CheckpointNotInitializedException;
import io.checkpoint.SequenceNumber;
import io.checkpoint.jdbc.DataSourceConnectionProvider;
import io.checkpoint.jdbc.dialect.H2Dialect;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcCheckpointStoreTest {
    private JdbcDataSource dataSource;

    @BeforeEach
    void setUp() {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    }

    private JdbcCheckpointStore store(String subscriberId) {
        return JdbcCheckpointStore.builder()
                .connectionProvider(new DataSourceConnectionProvider(dataSource))
                .dialect(new H2Dialect())
                .subscriberId(subscriberId)
                .build();
    }

    @Test
    void builderValidatesArguments() {
        assertThrows(NullPointerException.class, () -> JdbcCheckpointStore.builder()
                .dialect(new H2Dialect()).subscriberId("s").build());
        assertThrows(NullPointerException.class, () -> JdbcCheckpointStore.builder()
                .connectionProvider(new DataSourceConnectionProvider(dataSource)).subscriberId("s").build());
        assertThrows(IllegalArgumentException.class, () -> JdbcCheckpointStore.builder()
                .connectionProvider(new DataSourceConnectionProvider(dataSource))
                .dialect(new H2Dialect()).subscriberId("s").tableName("bad name").build());
        assertThrows(IllegalArgumentException.class, () -> store(" "));
    }

    @Test
    void defaultTableName() {
        assertEquals("checkpoints", store("s").tableName());
    }

    @Test
    void fullCycleResetAndReacquire() {
        JdbcCheckpointStore store = store("orders-projector");
        store.setup();

        assertEquals(Optional.empty(), store.acquireLock());
        store.updateAndReleaseLock(SequenceNumber.of(42));

        assertEquals(Optional.of(SequenceNumber.of(42)), store.acquireLock());
        store.releaseLock();

        store.reset();
        assertEquals(Optional.empty(), store.acquireLock());
        store.releaseLock();
    }

    @Test
    void setupIsIdempotentAndKeepsPosition() throws SQLException {
        JdbcCheckpointStore store = store("orders-projector");
        store.setup();
        store.acquireLock();
        store.updateAndReleaseLock(SequenceNumber.of(7));

        store.setup();

        assertEquals(1, countRows());
        assertEquals(Optional.of(SequenceNumber.of(7)), store.acquireLock());
        store.releaseLock();
    }

    @Test
    void setupProvisionsOneRowPerSubscriber() throws SQLException {
        store("a").setup();
        store("b").setup();

        assertEquals(2, countRows());
    }

    @Test
    void acquireWithoutRowThrowsNotInitialized() {
        store("other").setup();
        JdbcCheckpointStore store = store("missing");

        CheckpointNotInitializedException e = assertThrows(CheckpointNotInitializedException.class,
                store::acquireLock);

        assertEquals("missing", e.subscriberId());
        assertFalse(store.isLocked());
    }

    @Test
    void secondHolderIsRejectedUntilRelease() {
        JdbcCheckpointStore first = store("orders-projector");
        JdbcCheckpointStore second = store("orders-projector");
        first.setup();

        first.acquireLock();
        CheckpointLockedException e = assertThrows(CheckpointLockedException.class, second::acquireLock);
        assertEquals("orders-projector", e.subscriberId());
        assertFalse(second.isLocked());

        first.updateAndReleaseLock(SequenceNumber.of(5));
        assertEquals(Optional.of(SequenceNumber.of(5)), second.acquireLock());
        second.releaseLock();
    }

    @Test
    void differentSubscribersDoNotContend() {
        JdbcCheckpointStore a = store("a");
        JdbcCheckpointStore b = store("b");
        a.setup();
        b.setup();

        a.acquireLock();
        assertEquals(Optional.empty(), b.acquireLock());

        a.releaseLock();
        b.releaseLock();
    }

    @Test
    void reentrantAcquireIsRejected() {
        JdbcCheckpointStore store = store("s");
        store.setup();
        store.acquireLock();

        assertThrows(IllegalStateException.class, store::acquireLock);

        store.releaseLock();
    }

    @Test
    void updateWithoutLockIsRejected() {
        JdbcCheckpointStore store = store("s");
        store.setup();

        assertThrows(IllegalStateException.class, () -> store.updateAndReleaseLock(SequenceNumber.of(1)));

        assertEquals(Optional.empty(), store.acquireLock());
        store.releaseLock();
    }

    @Test
    void successiveCyclesReturnWhatWasWritten() {
        JdbcCheckpointStore store = store("s");
        store.setup();
        long[] written = {1, 5, 5, 17, 1000};

        SequenceNumber previous = SequenceNumber.ZERO;
        for (long value : written) {
            SequenceNumber read = store.acquireLock().orElse(SequenceNumber.ZERO);
            assertEquals(previous, read);
            store.updateAndReleaseLock(SequenceNumber.of(value));
            previous = SequenceNumber.of(value);
        }
    }

    @Test
    void updateTwiceIsRejected() {
        JdbcCheckpointStore store = store("s");
        store.setup();
        store.acquireLock();
        store.updateAndReleaseLock(SequenceNumber.of(1));

        assertThrows(IllegalStateException.class, () -> store.updateAndReleaseLock(SequenceNumber.of(2)));
    }

    @Test
    void movingBackwardsIsRejectedAndReleasesLock() {
        JdbcCheckpointStore store = store("s");
        JdbcCheckpointStore other = store("s");
        store.setup();
        store.acquireLock();
        store.updateAndReleaseLock(SequenceNumber.of(42));

        store.acquireLock();
        assertThrows(IllegalArgumentException.class, () -> store.updateAndReleaseLock(SequenceNumber.of(10)));

        assertFalse(store.isLocked());
        assertEquals(Optional.of(SequenceNumber.of(42)), other.acquireLock());
        other.releaseLock();
    }

    @Test
    void sameValueCommitsWithoutChange() {
        JdbcCheckpointStore store = store("s");
        store.setup();
        store.acquireLock();
        store.updateAndReleaseLock(SequenceNumber.of(3));

        assertEquals(Optional.of(SequenceNumber.of(3)), store.acquireLock());
        store.updateAndReleaseLock(SequenceNumber.of(3));

        assertFalse(store.isLocked());
        assertEquals(Optional.of(SequenceNumber.of(3)), store.acquireLock());
        store.releaseLock();
    }

    @Test
    void releaseWithoutWriteKeepsValue() {
        JdbcCheckpointStore store = store("s");
        store.setup();
        store.acquireLock();
        store.updateAndReleaseLock(SequenceNumber.of(9));

        try (JdbcCheckpointStore scoped = store("s")) {
            assertEquals(Optional.of(SequenceNumber.of(9)), scoped.acquireLock());
        }

        assertEquals(Optional.of(SequenceNumber.of(9)), store.acquireLock());
        store.releaseLock();
        store.releaseLock();
    }

    @Test
    void resetWhileHoldingLockIsRejected() {
        JdbcCheckpointStore store = store("s");
        store.setup();
        store.acquireLock();

        assertThrows(IllegalStateException.class, store::reset);

        store.releaseLock();
    }

    @Test
    void resetWithoutRowThrowsNotInitialized() {
        store("other").setup();

        assertThrows(CheckpointNotInitializedException.class, () -> store("missing").reset());
    }

    @Test
    void failedWriteIsReportedAndRolledBack() throws SQLException {
        JdbcCheckpointStore store = store("s");
        store.setup();
        try (Connection conn = dataSource.getConnection()) {
            conn.createStatement().execute(
                    "ALTER TABLE checkpoints ADD CONSTRAINT small_only CHECK (sequence_number < 100)");
        }
        store.acquireLock();

        CheckpointException e = assertThrows(CheckpointException.class,
                () -> store.updateAndReleaseLock(SequenceNumber.of(500)));

        assertEquals("s", e.subscriberId());
        assertNotNull(e.getCause());
        assertFalse(store.isLocked());
        assertEquals(Optional.empty(), store.acquireLock());
        store.releaseLock();
    }

    @Test
    void customTableName() throws SQLException {
        JdbcCheckpointStore store = JdbcCheckpointStore.builder()
                .connectionProvider(new DataSourceConnectionProvider(dataSource))
                .dialect(new H2Dialect())
                .tableName("projector_checkpoints")
                .subscriberId("s")
                .build();
        store.setup();

        try (Connection conn = dataSource.getConnection();
             ResultSet rs = conn.createStatement().executeQuery("SELECT COUNT(*) FROM projector_checkpoints")) {
            assertTrue(rs.next());
            assertEquals(1, rs.getInt(1));
        }
    }

    private int countRows() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             ResultSet rs = conn.createStatement().executeQuery("SELECT COUNT(*) FROM checkpoints")) {
            rs.next();
            return rs.getInt(1);
        }
    }
}
