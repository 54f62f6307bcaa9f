package io.checkpoint.jdbc.schema;

import java.util.List;
import java.util.Objects;

/**
 * Non-unique secondary index of a {@link TableDefinition}.
 */
public record IndexDefinition(String name, List<String> columns) {

    public IndexDefinition {
        Objects.requireNonNull(name, "name");
        columns = List.copyOf(columns);
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Index " + name + " needs at least one column");
        }
    }
}
