package io.checkpoint.jdbc.schema;

/**
 * Portable column types; each {@link io.checkpoint.jdbc.dialect.Dialect} maps them to DDL.
 */
public enum ColumnType {
    /** Bounded string; uses {@link ColumnDefinition#length()}. */
    STRING,
    INTEGER,
    BIGINT,
    BOOLEAN,
    /** Unbounded text. */
    TEXT,
    /** Timestamp without time zone, at least millisecond precision. */
    TIMESTAMP
}
