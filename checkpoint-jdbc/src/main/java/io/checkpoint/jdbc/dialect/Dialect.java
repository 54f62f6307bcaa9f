package io.checkpoint.jdbc.dialect;

import io.checkpoint.jdbc.schema.ColumnDefinition;
import io.checkpoint.jdbc.schema.ColumnType;
import io.checkpoint.jdbc.schema.IndexDefinition;
import io.checkpoint.jdbc.schema.TableDefinition;

import java.sql.SQLException;
import java.util.List;

/**
 * Database-specific SQL and error classification used by the JDBC stores.
 *
 * <p>Register custom implementations via
 * {@code META-INF/services/io.checkpoint.jdbc.dialect.Dialect}.
 *
 * @see Dialects
 * @see AbstractDialect
 */
public interface Dialect {

    /**
     * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
     */
    String name();

    /**
     * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
     */
    List<String> jdbcUrlPrefixes();

    /**
     * DDL type for a column, e.g. {@code VARCHAR(100)} or {@code TIMESTAMP(6)}.
     */
    String columnType(ColumnType type, int length);

    /**
     * Clause appended to a single-row {@code SELECT} to lock the row, failing
     * immediately instead of waiting when another transaction holds it.
     */
    String forUpdateNoWait();

    /**
     * Whether the exception reports a row lock that could not be acquired without waiting.
     */
    boolean isLockNotAvailable(SQLException e);

    /**
     * Whether the exception reports a primary key or unique constraint violation.
     */
    boolean isUniqueViolation(SQLException e);

    String createTableSql(TableDefinition table);

    String addColumnSql(String table, ColumnDefinition column);

    String createIndexSql(String table, IndexDefinition index);
}
