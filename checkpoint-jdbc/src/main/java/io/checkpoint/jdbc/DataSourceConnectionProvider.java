package io.checkpoint.jdbc;

import io.checkpoint.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionProvider} over a {@link DataSource}, usually a pool.
 *
 * <p>The stores close every connection they borrow, so a pooled DataSource gets
 * each one back at the end of the call, or at the end of the lock cycle for
 * {@link io.checkpoint.jdbc.store.JdbcCheckpointStore}.
 *
 * @param dataSource source of the connections
 */
public record DataSourceConnectionProvider(DataSource dataSource) implements ConnectionProvider {

    public DataSourceConnectionProvider {
        Objects.requireNonNull(dataSource, "dataSource");
    }

    @Override
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }
}
