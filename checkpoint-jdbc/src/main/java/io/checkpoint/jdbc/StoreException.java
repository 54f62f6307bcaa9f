package io.checkpoint.jdbc;

import java.sql.SQLException;

/**
 * Unchecked exception wrapping JDBC errors thrown by the JDBC stores.
 */
public final class StoreException extends RuntimeException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns the wrapped {@link SQLException}, or {@code null} if the cause is something else.
     */
    public SQLException sqlException() {
        return getCause() instanceof SQLException e ? e : null;
    }
}
