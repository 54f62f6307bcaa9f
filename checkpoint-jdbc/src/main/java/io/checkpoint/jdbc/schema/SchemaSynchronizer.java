package io.checkpoint.jdbc.schema;

import io.checkpoint.jdbc.JdbcTemplate;
import io.checkpoint.jdbc.StoreException;
import io.checkpoint.jdbc.dialect.Dialect;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Brings an existing database in line with a {@link TableDefinition} without ever
 * dropping anything: creates the table when it is missing, otherwise adds missing
 * columns and indexes. Running it twice is a no-op the second time.
 *
 * <p>Identifiers are matched case-insensitively, since H2 reports them upper-case
 * and PostgreSQL lower-case.
 */
public final class SchemaSynchronizer {
    private static final Logger logger = Logger.getLogger(SchemaSynchronizer.class.getName());

    private final Dialect dialect;

    public SchemaSynchronizer(Dialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    /**
     * Applies the statements returned by {@link #requiredStatements}.
     *
     * @return the statements that were executed, empty if the schema was up to date
     */
    public List<String> synchronize(Connection conn, TableDefinition table) {
        List<String> statements = requiredStatements(conn, table);
        for (String statement : statements) {
            logger.log(Level.INFO, "Applying schema change: {0}", statement);
            JdbcTemplate.execute(conn, statement);
        }
        return statements;
    }

    /**
     * Computes the DDL needed to reach the desired table shape.
     */
    public List<String> requiredStatements(Connection conn, TableDefinition table) {
        try {
            DatabaseMetaData meta = conn.getMetaData();
            String catalog = conn.getCatalog();
            String schema = conn.getSchema();

            Optional<String> existing = findTable(meta, catalog, schema, table.name());
            List<String> statements = new ArrayList<>();
            if (existing.isEmpty()) {
                statements.add(dialect.createTableSql(table));
                for (IndexDefinition index : table.indexes()) {
                    statements.add(dialect.createIndexSql(table.name(), index));
                }
                return statements;
            }

            String actualName = existing.get();
            List<String> columns = existingColumns(meta, catalog, schema, actualName);
            for (ColumnDefinition column : table.columns()) {
                if (!containsIgnoreCase(columns, column.name())) {
                    statements.add(dialect.addColumnSql(table.name(), column));
                }
            }
            List<String> indexes = existingIndexes(meta, catalog, schema, actualName);
            for (IndexDefinition index : table.indexes()) {
                if (!containsIgnoreCase(indexes, index.name())) {
                    statements.add(dialect.createIndexSql(table.name(), index));
                }
            }
            return statements;
        } catch (SQLException e) {
            throw new StoreException("Failed to inspect schema of table " + table.name(), e);
        }
    }

    private static Optional<String> findTable(DatabaseMetaData meta, String catalog, String schema,
            String tableName) throws SQLException {
        try (ResultSet rs = meta.getTables(catalog, schema, "%", new String[]{"TABLE"})) {
            while (rs.next()) {
                String name = rs.getString("TABLE_NAME");
                if (tableName.equalsIgnoreCase(name)) {
                    return Optional.of(name);
                }
            }
        }
        return Optional.empty();
    }

    private static List<String> existingColumns(DatabaseMetaData meta, String catalog, String schema,
            String actualName) throws SQLException {
        List<String> columns = new ArrayList<>();
        try (ResultSet rs = meta.getColumns(catalog, schema, actualName, "%")) {
            while (rs.next()) {
                // the table pattern treats '_' as a wildcard
                if (actualName.equals(rs.getString("TABLE_NAME"))) {
                    columns.add(rs.getString("COLUMN_NAME"));
                }
            }
        }
        return columns;
    }

    private static List<String> existingIndexes(DatabaseMetaData meta, String catalog, String schema,
            String actualName) throws SQLException {
        List<String> indexes = new ArrayList<>();
        try (ResultSet rs = meta.getIndexInfo(catalog, schema, actualName, false, false)) {
            while (rs.next()) {
                String name = rs.getString("INDEX_NAME");
                if (name != null) {
                    indexes.add(name);
                }
            }
        }
        return indexes;
    }

    private static boolean containsIgnoreCase(List<String> names, String name) {
        return names.stream().anyMatch(name::equalsIgnoreCase);
    }
}
