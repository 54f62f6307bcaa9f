package io.checkpoint.jdbc.schema;

import java.util.Objects;

/**
 * A single column of a {@link TableDefinition}.
 *
 * @param name         column name
 * @param type         portable type
 * @param length       maximum length for {@link ColumnType#STRING}, ignored otherwise
 * @param nullable     whether {@code NULL} is allowed
 * @param defaultValue SQL literal used as {@code DEFAULT}, or {@code null} for none.
 *                     Needed for {@code NOT NULL} columns added to a populated table.
 */
public record ColumnDefinition(String name, ColumnType type, int length, boolean nullable, String defaultValue) {

    public ColumnDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (type == ColumnType.STRING && length <= 0) {
            throw new IllegalArgumentException("String column " + name + " requires a positive length");
        }
    }

    public static ColumnDefinition string(String name, int length) {
        return new ColumnDefinition(name, ColumnType.STRING, length, false, null);
    }

    public static ColumnDefinition integer(String name) {
        return new ColumnDefinition(name, ColumnType.INTEGER, 0, false, null);
    }

    public static ColumnDefinition bigint(String name) {
        return new ColumnDefinition(name, ColumnType.BIGINT, 0, false, null);
    }

    public static ColumnDefinition bool(String name) {
        return new ColumnDefinition(name, ColumnType.BOOLEAN, 0, false, null);
    }

    public static ColumnDefinition text(String name) {
        return new ColumnDefinition(name, ColumnType.TEXT, 0, false, null);
    }

    public static ColumnDefinition timestamp(String name) {
        return new ColumnDefinition(name, ColumnType.TIMESTAMP, 0, false, null);
    }

    public ColumnDefinition asNullable() {
        return new ColumnDefinition(name, type, length, true, defaultValue);
    }

    public ColumnDefinition withDefault(String defaultValue) {
        return new ColumnDefinition(name, type, length, nullable, defaultValue);
    }
}
