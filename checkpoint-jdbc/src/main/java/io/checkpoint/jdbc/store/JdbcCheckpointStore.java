package io.checkpoint.jdbc.store;

import io.checkpoint.CheckpointException;
import io.checkpoint.CheckpointLockedException;
import io.checkpoint.CheckpointNotInitializedException;
import io.checkpoint.CheckpointStore;
import io.checkpoint.SequenceNumber;
import io.checkpoint.jdbc.JdbcTemplate;
import io.checkpoint.jdbc.StoreException;
import io.checkpoint.jdbc.TableNames;
import io.checkpoint.jdbc.dialect.Dialect;
import io.checkpoint.jdbc.schema.ColumnDefinition;
import io.checkpoint.jdbc.schema.SchemaSynchronizer;
import io.checkpoint.jdbc.schema.TableDefinition;
import io.checkpoint.jdbc.tx.JdbcTransactionManager;
import io.checkpoint.spi.ConnectionProvider;
import io.checkpoint.spi.ProvidesSetup;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JDBC {@link CheckpointStore} for one subscriber, locking its row with
 * {@code SELECT ... FOR UPDATE NOWAIT}.
 *
 * <p>{@link #acquireLock()} opens a transaction on a dedicated connection and keeps it,
 * together with the locked value, until the cycle ends. The instance is therefore
 * stateful: use one per worker thread, and end every cycle, e.g.
 * <pre>{@code
 * try (JdbcCheckpointStore store = ...) {
 *     Optional<SequenceNumber> from = store.acquireLock();
 *     store.updateAndReleaseLock(process(from));
 * } // rolls back if the update was never reached
 * }</pre>
 *
 * <p>Table layout: {@code subscriber VARCHAR(255)} primary key and
 * {@code sequence_number BIGINT}, one row per subscriber, provisioned by {@link #setup()}.
 */
public final class JdbcCheckpointStore implements CheckpointStore, ProvidesSetup, AutoCloseable {
    private static final Logger logger = Logger.getLogger(JdbcCheckpointStore.class.getName());

    private static final int SUBSCRIBER_LENGTH = 255;

    private final ConnectionProvider connectionProvider;
    private final JdbcTransactionManager txManager;
    private final Dialect dialect;
    private final String tableName;
    private final String subscriberId;

    private LockSession session;

    private JdbcCheckpointStore(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.dialect = Objects.requireNonNull(builder.dialect, "dialect");
        this.tableName = TableNames.validate(builder.tableName);
        this.subscriberId = Objects.requireNonNull(builder.subscriberId, "subscriberId");
        if (subscriberId.isBlank() || subscriberId.length() > SUBSCRIBER_LENGTH) {
            throw new IllegalArgumentException("subscriberId must be 1-" + SUBSCRIBER_LENGTH
                    + " non-blank characters: " + subscriberId);
        }
        this.txManager = new JdbcTransactionManager(connectionProvider);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String subscriberId() {
        return subscriberId;
    }

    public String tableName() {
        return tableName;
    }

    /**
     * Returns {@code true} while a lock cycle is open on this instance.
     */
    public boolean isLocked() {
        return session != null;
    }

    @Override
    public Optional<SequenceNumber> acquireLock() {
        if (session != null) {
            throw new IllegalStateException("Failed to acquire checkpoint lock for subscriber \""
                    + subscriberId + "\" because a transaction is active already");
        }
        JdbcTransactionManager.Transaction tx;
        try {
            tx = txManager.begin();
        } catch (SQLException e) {
            throw new StoreException("Failed to begin checkpoint transaction for subscriber " + subscriberId, e);
        }

        Optional<Long> current;
        try {
            current = JdbcTemplate.queryOne(tx.connection(),
                    "SELECT sequence_number FROM " + tableName + " WHERE subscriber = ?"
                            + dialect.forUpdateNoWait(),
                    rs -> rs.getLong(1), subscriberId);
        } catch (StoreException e) {
            if (dialect.isLockNotAvailable(e.sqlException())) {
                throw rollback(tx, new CheckpointLockedException(subscriberId, e.getCause()));
            }
            throw rollback(tx, e);
        }
        if (current.isEmpty()) {
            throw rollback(tx, new CheckpointNotInitializedException(subscriberId));
        }

        long locked = current.get();
        session = new LockSession(tx, locked);
        return locked == 0 ? Optional.empty() : Optional.of(SequenceNumber.of(locked));
    }

    @Override
    public void updateAndReleaseLock(SequenceNumber sequenceNumber) {
        Objects.requireNonNull(sequenceNumber, "sequenceNumber");
        LockSession current = session;
        if (current == null) {
            throw new IllegalStateException("Failed to update and commit checkpoint for subscriber \""
                    + subscriberId + "\" because the lock has not been acquired successfully before");
        }
        session = null;
        JdbcTransactionManager.Transaction tx = current.transaction();
        if (tx.isCompleted()) {
            throw new IllegalStateException("Failed to update and commit checkpoint for subscriber \""
                    + subscriberId + "\" because no transaction is active");
        }
        if (sequenceNumber.value() < current.lockedValue()) {
            throw rollback(tx, new IllegalArgumentException("Checkpoint of subscriber \"" + subscriberId
                    + "\" must not move backwards from " + current.lockedValue() + " to " + sequenceNumber));
        }

        try {
            if (sequenceNumber.value() != current.lockedValue()) {
                JdbcTemplate.update(tx.connection(),
                        "UPDATE " + tableName + " SET sequence_number = ? WHERE subscriber = ?",
                        sequenceNumber.value(), subscriberId);
            }
            tx.commit();
        } catch (StoreException | SQLException e) {
            throw rollback(tx, new CheckpointException(subscriberId,
                    "Failed to update and commit highest applied sequence number for subscriber \""
                            + subscriberId + "\"", e));
        }
    }

    @Override
    public void releaseLock() {
        LockSession current = session;
        if (current == null) {
            return;
        }
        session = null;
        try {
            current.transaction().rollback();
        } catch (SQLException e) {
            throw new StoreException("Failed to release checkpoint lock for subscriber " + subscriberId, e);
        }
    }

    @Override
    public void reset() {
        if (session != null) {
            throw new IllegalStateException("Cannot reset checkpoint for subscriber \"" + subscriberId
                    + "\" while this store holds its lock");
        }
        int updated;
        try (Connection conn = connectionProvider.getConnection()) {
            updated = JdbcTemplate.update(conn,
                    "UPDATE " + tableName + " SET sequence_number = 0 WHERE subscriber = ?",
                    subscriberId);
        } catch (SQLException e) {
            throw new StoreException("Failed to reset checkpoint for subscriber " + subscriberId, e);
        }
        if (updated == 0) {
            throw new CheckpointNotInitializedException(subscriberId);
        }
    }

    /**
     * Creates the table if needed and inserts the subscriber's zero row if it is missing.
     */
    @Override
    public void setup() {
        try (Connection conn = connectionProvider.getConnection()) {
            new SchemaSynchronizer(dialect).synchronize(conn, tableDefinition(tableName));
            try {
                JdbcTemplate.update(conn,
                        "INSERT INTO " + tableName + " (subscriber, sequence_number) VALUES (?, 0)",
                        subscriberId);
            } catch (StoreException e) {
                if (!dialect.isUniqueViolation(e.sqlException())) {
                    throw e;
                }
                logger.log(Level.FINE, "Checkpoint row for subscriber {0} already exists", subscriberId);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to set up checkpoint table " + tableName, e);
        }
    }

    /**
     * Rolls back an open lock cycle; see {@link #releaseLock()}.
     */
    @Override
    public void close() {
        releaseLock();
    }

    /**
     * Desired shape of the checkpoint table.
     */
    public static TableDefinition tableDefinition(String tableName) {
        return TableDefinition.builder(tableName)
                .column(ColumnDefinition.string("subscriber", SUBSCRIBER_LENGTH))
                .column(ColumnDefinition.bigint("sequence_number"))
                .primaryKey("subscriber")
                .build();
    }

    private static <E extends RuntimeException> E rollback(JdbcTransactionManager.Transaction tx, E failure) {
        try {
            tx.rollback();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
        return failure;
    }

    private record LockSession(JdbcTransactionManager.Transaction transaction, long lockedValue) {
    }

    /**
     * Builder for {@link JdbcCheckpointStore}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private Dialect dialect;
        private String tableName = TableNames.DEFAULT_CHECKPOINT_TABLE;
        private String subscriberId;

        private Builder() {
        }

        /**
         * <b>Required.</b> Source of the connections; each lock cycle holds one.
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <b>Required.</b> See {@link io.checkpoint.jdbc.dialect.Dialects#detect}.
         */
        public Builder dialect(Dialect dialect) {
            this.dialect = dialect;
            return this;
        }

        /**
         * Optional. Defaults to {@value TableNames#DEFAULT_CHECKPOINT_TABLE}.
         */
        public Builder tableName(String tableName) {
            this.tableName = tableName;
            return this;
        }

        /**
         * <b>Required.</b> The subscriber whose checkpoint this store manages.
         */
        public Builder subscriberId(String subscriberId) {
            this.subscriberId = subscriberId;
            return this;
        }

        public JdbcCheckpointStore build() {
            return new JdbcCheckpointStore(this);
        }
    }
}
