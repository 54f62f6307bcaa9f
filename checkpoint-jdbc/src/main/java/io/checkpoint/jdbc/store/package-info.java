/**
 * JDBC implementations of the checkpoint and subscription stores.
 *
 * <pre>{@code
 * ConnectionProvider connections = new DataSourceConnectionProvider(dataSource);
 * Dialect dialect = Dialects.detect(dataSource);
 *
 * JdbcSubscriptionStore subscriptions = JdbcSubscriptionStore.builder()
 *     .connectionProvider(connections)
 *     .dialect(dialect)
 *     .build();
 * subscriptions.setup();
 * }</pre>
 */
package io.checkpoint.jdbc.store;
