/**
 * JDBC infrastructure shared across sub-packages.
 *
 * <p>{@link io.checkpoint.jdbc.JdbcTemplate} provides lightweight JDBC helpers.
 * {@link io.checkpoint.jdbc.DataSourceConnectionProvider} adapts a {@link javax.sql.DataSource}
 * to the {@link io.checkpoint.spi.ConnectionProvider} SPI.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code io.checkpoint.jdbc.store}: {@link io.checkpoint.CheckpointStore} and
 *       {@link io.checkpoint.subscription.SubscriptionStore} implementations</li>
 *   <li>{@code io.checkpoint.jdbc.dialect}: database-specific SQL and error classification</li>
 *   <li>{@code io.checkpoint.jdbc.schema}: idempotent table, column and index creation</li>
 *   <li>{@code io.checkpoint.jdbc.tx}: manual transaction management</li>
 * </ul>
 *
 * @see io.checkpoint.jdbc.JdbcTemplate
 * @see io.checkpoint.jdbc.DataSourceConnectionProvider
 */
package io.checkpoint.jdbc;
