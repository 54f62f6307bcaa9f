package io.checkpoint.jdbc.dialect;

import io.checkpoint.jdbc.schema.ColumnType;

import java.sql.SQLException;
import java.util.List;

/**
 * H2 dialect. Primarily for testing.
 *
 * <p>A row locked by another transaction makes {@code FOR UPDATE NOWAIT} fail with a
 * lock timeout (50200) or, for rows changed concurrently, a concurrent update (90131).
 */
public final class H2Dialect extends AbstractDialect {

    private static final int LOCK_TIMEOUT = 50200;
    private static final int CONCURRENT_UPDATE = 90131;

    @Override
    public String name() {
        return "h2";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:h2:");
    }

    @Override
    public String columnType(ColumnType type, int length) {
        return type == ColumnType.TEXT ? "CLOB" : super.columnType(type, length);
    }

    @Override
    public boolean isLockNotAvailable(SQLException e) {
        return e != null && (e.getErrorCode() == LOCK_TIMEOUT
                || e.getErrorCode() == CONCURRENT_UPDATE
                || super.isLockNotAvailable(e));
    }
}
