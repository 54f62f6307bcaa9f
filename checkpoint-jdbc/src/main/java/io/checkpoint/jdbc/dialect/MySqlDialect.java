package io.checkpoint.jdbc.dialect;

import io.checkpoint.jdbc.schema.ColumnType;

import java.sql.SQLException;
import java.util.List;

/**
 * MySQL dialect (8.0 or later, for {@code NOWAIT}). Also compatible with TiDB.
 */
public final class MySqlDialect extends AbstractDialect {

    private static final int ER_DUP_ENTRY = 1062;
    private static final int ER_LOCK_WAIT_TIMEOUT = 1205;
    private static final int ER_LOCK_NOWAIT = 3572;

    @Override
    public String name() {
        return "mysql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:mysql:", "jdbc:tidb:");
    }

    @Override
    public String columnType(ColumnType type, int length) {
        // TIMESTAMP is bound to the 2038 range on MySQL
        return type == ColumnType.TIMESTAMP ? "DATETIME(6)" : super.columnType(type, length);
    }

    @Override
    public boolean isLockNotAvailable(SQLException e) {
        return e != null && (e.getErrorCode() == ER_LOCK_NOWAIT
                || e.getErrorCode() == ER_LOCK_WAIT_TIMEOUT);
    }

    @Override
    public boolean isUniqueViolation(SQLException e) {
        return e != null && e.getErrorCode() == ER_DUP_ENTRY;
    }

    @Override
    protected String tableOptions() {
        return " DEFAULT CHARSET=utf8mb4";
    }
}
