package io.checkpoint.jdbc.dialect;

import java.sql.SQLException;
import java.util.List;

/**
 * PostgreSQL dialect.
 */
public final class PostgresDialect extends AbstractDialect {

    private static final String LOCK_NOT_AVAILABLE = "55P03";

    @Override
    public String name() {
        return "postgresql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:postgresql:");
    }

    @Override
    public boolean isLockNotAvailable(SQLException e) {
        return e != null && LOCK_NOT_AVAILABLE.equals(e.getSQLState());
    }
}
