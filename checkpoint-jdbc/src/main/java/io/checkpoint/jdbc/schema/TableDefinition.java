package io.checkpoint.jdbc.schema;

import io.checkpoint.jdbc.TableNames;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Desired shape of a table: columns, primary key and secondary indexes.
 *
 * <pre>{@code
 * TableDefinition.builder("subscriptions")
 *     .column(ColumnDefinition.string("id", 150))
 *     .column(ColumnDefinition.string("group_name", 100))
 *     .primaryKey("id")
 *     .index("group_name")
 *     .build();
 * }</pre>
 *
 * @see SchemaSynchronizer
 */
public final class TableDefinition {
    /**
     * Longest identifier accepted by every supported database (PostgreSQL truncates past 63 bytes).
     */
    public static final int MAX_IDENTIFIER_LENGTH = 63;

    private final String name;
    private final List<ColumnDefinition> columns;
    private final List<String> primaryKey;
    private final List<IndexDefinition> indexes;

    private TableDefinition(Builder builder) {
        this.name = TableNames.validate(builder.name);
        this.columns = List.copyOf(builder.columns);
        this.primaryKey = List.copyOf(builder.primaryKey);
        this.indexes = List.copyOf(builder.indexes);
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Table " + name + " needs at least one column");
        }
        checkIdentifier("Table", name);
        columns.forEach(c -> checkIdentifier("Column", c.name()));
        indexes.forEach(i -> checkIdentifier("Index", i.name()));
        for (String key : primaryKey) {
            if (column(key).isEmpty()) {
                throw new IllegalArgumentException("Primary key column " + key + " is not defined on " + name);
            }
        }
    }

    private static void checkIdentifier(String kind, String identifier) {
        if (identifier.length() > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException(kind + " name " + identifier + " exceeds "
                    + MAX_IDENTIFIER_LENGTH + " characters");
        }
    }

    /**
     * Fits a generated identifier into {@link #MAX_IDENTIFIER_LENGTH}, replacing the tail
     * with a hash of the full name so distinct long names stay distinct.
     */
    static String shorten(String identifier) {
        if (identifier.length() <= MAX_IDENTIFIER_LENGTH) {
            return identifier;
        }
        String hash = String.format("%08x", identifier.hashCode());
        return identifier.substring(0, MAX_IDENTIFIER_LENGTH - hash.length() - 1) + "_" + hash;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public List<ColumnDefinition> columns() {
        return columns;
    }

    public List<String> primaryKey() {
        return primaryKey;
    }

    public List<IndexDefinition> indexes() {
        return indexes;
    }

    public Optional<ColumnDefinition> column(String columnName) {
        return columns.stream()
                .filter(c -> c.name().equalsIgnoreCase(columnName))
                .findFirst();
    }

    public static final class Builder {
        private final String name;
        private final List<ColumnDefinition> columns = new ArrayList<>();
        private final List<String> primaryKey = new ArrayList<>();
        private final List<IndexDefinition> indexes = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder column(ColumnDefinition column) {
            columns.add(column);
            return this;
        }

        public Builder primaryKey(String... columnNames) {
            primaryKey.addAll(List.of(columnNames));
            return this;
        }

        /**
         * Adds an index named {@code idx_<table>_<first column>}, shortened when that is too long.
         */
        public Builder index(String... columnNames) {
            return index(new IndexDefinition(shorten("idx_" + name + "_" + columnNames[0]), List.of(columnNames)));
        }

        public Builder index(IndexDefinition index) {
            indexes.add(index);
            return this;
        }

        public TableDefinition build() {
            return new TableDefinition(this);
        }
    }
}
