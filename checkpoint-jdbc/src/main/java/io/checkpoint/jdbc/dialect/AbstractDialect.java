package io.checkpoint.jdbc.dialect;

import io.checkpoint.jdbc.schema.ColumnDefinition;
import io.checkpoint.jdbc.schema.ColumnType;
import io.checkpoint.jdbc.schema.IndexDefinition;
import io.checkpoint.jdbc.schema.TableDefinition;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.util.stream.Collectors;

/**
 * Base dialect with standard SQL implementations.
 *
 * <p>Subclasses override methods to provide database-specific SQL and error codes.
 */
public abstract class AbstractDialect implements Dialect {

    protected static final String UNIQUE_VIOLATION = "23505";

    @Override
    public String columnType(ColumnType type, int length) {
        return switch (type) {
            case STRING -> "VARCHAR(" + length + ")";
            case INTEGER -> "INTEGER";
            case BIGINT -> "BIGINT";
            case BOOLEAN -> "BOOLEAN";
            case TEXT -> "TEXT";
            case TIMESTAMP -> "TIMESTAMP(6)";
        };
    }

    @Override
    public String forUpdateNoWait() {
        return " FOR UPDATE NOWAIT";
    }

    @Override
    public boolean isLockNotAvailable(SQLException e) {
        return e instanceof SQLTimeoutException;
    }

    @Override
    public boolean isUniqueViolation(SQLException e) {
        return e != null && UNIQUE_VIOLATION.equals(e.getSQLState());
    }

    @Override
    public String createTableSql(TableDefinition table) {
        StringBuilder sql = new StringBuilder("CREATE TABLE ").append(table.name()).append(" (");
        sql.append(table.columns().stream()
                .map(this::columnSql)
                .collect(Collectors.joining(", ")));
        if (!table.primaryKey().isEmpty()) {
            sql.append(", PRIMARY KEY (").append(String.join(", ", table.primaryKey())).append(')');
        }
        sql.append(')').append(tableOptions());
        return sql.toString();
    }

    @Override
    public String addColumnSql(String table, ColumnDefinition column) {
        return "ALTER TABLE " + table + " ADD COLUMN " + columnSql(column);
    }

    @Override
    public String createIndexSql(String table, IndexDefinition index) {
        return "CREATE INDEX " + index.name() + " ON " + table
                + " (" + String.join(", ", index.columns()) + ")";
    }

    /**
     * Suffix appended to {@code CREATE TABLE}; empty by default.
     */
    protected String tableOptions() {
        return "";
    }

    protected String columnSql(ColumnDefinition column) {
        StringBuilder sql = new StringBuilder(column.name())
                .append(' ')
                .append(columnType(column.type(), column.length()));
        if (column.defaultValue() != null) {
            sql.append(" DEFAULT ").append(column.defaultValue());
        }
        if (!column.nullable()) {
            sql.append(" NOT NULL");
        }
        return sql.toString();
    }
}
