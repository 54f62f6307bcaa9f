package io.checkpoint.jdbc.tx;

import io.checkpoint.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Lightweight transaction manager for manual JDBC usage. Obtains a connection
 * and disables auto-commit; the connection is closed when the transaction ends.
 *
 * <p>Use via try-with-resources on the returned {@link Transaction}:
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *     JdbcTemplate.update(tx.connection(), sql, params);
 *     tx.commit();
 * }
 * }</pre>
 *
 * <p>A {@link Transaction} may also outlive the method that began it, as the
 * checkpoint lock cycle does; it then has to be ended explicitly.
 */
public final class JdbcTransactionManager {
    private final ConnectionProvider connectionProvider;

    public JdbcTransactionManager(ConnectionProvider connectionProvider) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    }

    /**
     * Begins a new transaction on a fresh connection.
     *
     * @return a new {@link Transaction} handle
     * @throws SQLException if a connection cannot be obtained or configured
     */
    public Transaction begin() throws SQLException {
        Connection connection = connectionProvider.getConnection();
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            try {
                connection.close();
            } catch (SQLException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        return new Transaction(connection);
    }

    /**
     * An active transaction handle. Supports explicit {@link #commit()} and {@link #rollback()}.
     * If neither is called, {@link #close()} triggers a rollback automatically.
     */
    public static final class Transaction implements AutoCloseable {
        private final Connection connection;
        private boolean completed;

        private Transaction(Connection connection) {
            this.connection = connection;
        }

        /**
         * Returns the connection bound to this transaction.
         *
         * @throws IllegalStateException if the transaction has ended
         */
        public Connection connection() {
            if (completed) {
                throw new IllegalStateException("Transaction has already ended");
            }
            return connection;
        }

        public boolean isCompleted() {
            return completed;
        }

        /**
         * Commits. On failure the transaction is rolled back and the error rethrown;
         * either way the transaction has ended afterwards.
         */
        public void commit() throws SQLException {
            if (completed) {
                return;
            }
            try {
                connection.commit();
            } catch (SQLException e) {
                try {
                    connection.rollback();
                } catch (SQLException rollbackFailure) {
                    e.addSuppressed(rollbackFailure);
                }
                finalizeTx(e);
                throw e;
            }
            finalizeTx(null);
        }

        public void rollback() throws SQLException {
            if (completed) {
                return;
            }
            try {
                connection.rollback();
            } catch (SQLException e) {
                finalizeTx(e);
                throw e;
            }
            finalizeTx(null);
        }

        @Override
        public void close() throws SQLException {
            if (!completed) {
                rollback();
            }
        }

        private void finalizeTx(SQLException primary) throws SQLException {
            completed = true;
            SQLException failure = primary;
            try {
                connection.setAutoCommit(true);
            } catch (SQLException e) {
                failure = chain(failure, e);
            }
            try {
                connection.close();
            } catch (SQLException e) {
                failure = chain(failure, e);
            }
            if (primary == null && failure != null) {
                throw failure;
            }
        }

        private static SQLException chain(SQLException primary, SQLException next) {
            if (primary == null) {
                return next;
            }
            primary.addSuppressed(next);
            return primary;
        }
    }
}
