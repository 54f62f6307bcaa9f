package io.checkpoint.jdbc.schema;

import io.checkpoint.jdbc.dialect.H2Dialect;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaSynchronizerTest {
    private Connection conn;
    private final SchemaSynchronizer synchronizer = new SchemaSynchronizer(new H2Dialect());

    private static final TableDefinition TABLE = TableDefinition.builder("widgets")
            .column(ColumnDefinition.string("id", 50))
            .column(ColumnDefinition.string("kind", 20))
            .column(ColumnDefinition.integer("weight").withDefault("0"))
            .column(ColumnDefinition.text("notes").asNullable())
            .primaryKey("id")
            .index("kind")
            .build();

    @BeforeEach
    void setUp() throws SQLException {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:schema_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        conn = ds.getConnection();
    }

    @AfterEach
    void tearDown() throws SQLException {
        conn.close();
    }

    @Test
    void createsMissingTableWithIndexes() {
        List<String> applied = synchronizer.synchronize(conn, TABLE);

        assertEquals(2, applied.size());
        assertTrue(applied.get(0).startsWith("CREATE TABLE widgets"));
        assertEquals("CREATE INDEX idx_widgets_kind ON widgets (kind)", applied.get(1));
    }

    @Test
    void secondRunIsNoOp() {
        synchronizer.synchronize(conn, TABLE);

        assertEquals(List.of(), synchronizer.synchronize(conn, TABLE));
    }

    @Test
    void addsMissingColumnsAndIndexesToExistingTable() throws SQLException {
        conn.createStatement().execute("CREATE TABLE widgets (id VARCHAR(50) PRIMARY KEY, kind VARCHAR(20) NOT NULL)");
        conn.createStatement().execute("INSERT INTO widgets (id, kind) VALUES ('w1', 'bolt')");

        List<String> applied = synchronizer.synchronize(conn, TABLE);

        assertEquals(List.of(
                "ALTER TABLE widgets ADD COLUMN weight INTEGER DEFAULT 0 NOT NULL",
                "ALTER TABLE widgets ADD COLUMN notes CLOB",
                "CREATE INDEX idx_widgets_kind ON widgets (kind)"), applied);
        try (ResultSet rs = conn.createStatement().executeQuery("SELECT weight, notes FROM widgets WHERE id = 'w1'")) {
            assertTrue(rs.next());
            assertEquals(0, rs.getInt(1));
            assertEquals(null, rs.getString(2));
        }
    }

    @Test
    void matchesExistingNamesCaseInsensitively() throws SQLException {
        conn.createStatement().execute("CREATE TABLE \"widgets\" (\"id\" VARCHAR(50) PRIMARY KEY, "
                + "\"kind\" VARCHAR(20) NOT NULL, \"weight\" INTEGER DEFAULT 0 NOT NULL, \"notes\" CLOB)");
        conn.createStatement().execute("CREATE INDEX \"idx_widgets_kind\" ON \"widgets\" (\"kind\")");

        assertEquals(List.of(), synchronizer.requiredStatements(conn, TABLE));
    }
}
