package io.checkpoint.spring.boot;

import io.checkpoint.jdbc.dialect.Dialect;
import io.checkpoint.jdbc.store.JdbcCheckpointStore;
import io.checkpoint.spi.ConnectionProvider;

import java.util.Objects;

/**
 * Creates {@link JdbcCheckpointStore} instances sharing one connection provider,
 * dialect and table.
 *
 * <p>A checkpoint store keeps its lock cycle as instance state, so it is not a
 * singleton bean: ask the factory for one per worker.
 */
public class CheckpointStoreFactory {
    private final ConnectionProvider connectionProvider;
    private final Dialect dialect;
    private final String tableName;

    public CheckpointStoreFactory(ConnectionProvider connectionProvider, Dialect dialect, String tableName) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.tableName = Objects.requireNonNull(tableName, "tableName");
    }

    public JdbcCheckpointStore create(String subscriberId) {
        return JdbcCheckpointStore.builder()
                .connectionProvider(connectionProvider)
                .dialect(dialect)
                .tableName(tableName)
                .subscriberId(subscriberId)
                .build();
    }

    public String tableName() {
        return tableName;
    }
}
