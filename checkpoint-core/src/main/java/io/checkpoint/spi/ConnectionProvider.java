package io.checkpoint.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to the stores.
 *
 * <p>Each checkpoint lock cycle holds one connection exclusively from
 * {@code acquireLock} until it is committed or rolled back; all other
 * operations borrow a connection per call. Callers are responsible for
 * closing the returned connection.
 *
 * @see io.checkpoint.jdbc.DataSourceConnectionProvider
 */
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
