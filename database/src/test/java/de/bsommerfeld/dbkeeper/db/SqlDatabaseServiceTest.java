package de.bsommerfeld.dbkeeper.db;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests against a real temporary SQLite file.
 */
class SqlDatabaseServiceTest {

    @TempDir
    Path tempDir;

    private SqlDatabaseService db;

    @BeforeEach
    void setUp() {
        db = SqlDatabaseService.forFile(tempDir.resolve("test.db"));
        db.applySchema();
        db.execute("CREATE TABLE items (id INTEGER PRIMARY KEY, name TEXT, flag INTEGER, seen TEXT)");
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    // -- Schema --

    @Test
    void applySchema_shouldCreateAllSystemTables() {
        List<Row> rows = db.prepare("SELECT name FROM sqlite_master WHERE type = 'table'").all();
        List<String> names = rows.stream().map(r -> r.getString("name")).toList();
        assertTrue(names.containsAll(SchemaCatalog.SYSTEM_TABLES));
    }

    @Test
    void applySchema_shouldBeIdempotent() {
        assertDoesNotThrow(() -> db.applySchema());
    }

    // -- Statements --

    @Test
    void run_shouldReportChangesForDml() {
        QueryResult result = db.prepare("INSERT INTO items (name) VALUES (?), (?)").bind("a", "b").run();
        assertEquals(2, result.changes());
        assertTrue(result.rows().isEmpty());
    }

    @Test
    void all_shouldReturnRowsInSelectOrder() {
        db.prepare("INSERT INTO items (name) VALUES (?)").bind("a").run();
        db.prepare("INSERT INTO items (name) VALUES (?)").bind("b").run();

        List<Row> rows = db.prepare("SELECT id, name FROM items ORDER BY id").all();
        assertEquals(2, rows.size());
        assertEquals("a", rows.get(0).getString("name"));
        assertEquals(List.of("id", "name"), List.copyOf(rows.get(0).columns()));
    }

    @Test
    void first_shouldReturnNullForEmptyResult() {
        assertNull(db.prepare("SELECT * FROM items").first());
    }

    @Test
    void bind_shouldStoreBooleansAsIntegersAndInstantsAsFixedWidthText() {
        Instant seen = Instant.parse("2024-03-01T10:00:00Z");
        db.prepare("INSERT INTO items (name, flag, seen) VALUES (?, ?, ?)").bind("a", true, seen).run();

        Row row = db.prepare("SELECT flag, seen FROM items").first();
        assertEquals(1, row.getInt("flag"));
        assertTrue(row.getBoolean("flag"));
        assertEquals("2024-03-01T10:00:00.000Z", row.getString("seen"));
    }

    @Test
    void row_shouldRejectUnknownColumns() {
        db.prepare("INSERT INTO items (name) VALUES (?)").bind("a").run();
        Row row = db.prepare("SELECT name FROM items").first();
        assertThrows(IllegalStateException.class, () -> row.getString("missing"));
    }

    @Test
    void executeStatement_shouldWrapSqlErrors() {
        assertThrows(DatabaseAccessException.class,
                () -> db.prepare("SELECT * FROM no_such_table").all());
    }

    @Test
    void explainQueryPlan_shouldNameTheIndexInUse() {
        db.execute("CREATE INDEX idx_items_name ON items(name)");
        List<String> plan = db.explainQueryPlan("SELECT * FROM items WHERE name = ?", List.of("a"));
        assertTrue(plan.stream().anyMatch(line -> line.contains("idx_items_name")), plan.toString());
    }

    // -- Transactions --

    @Test
    void inTransaction_shouldCommitOnSuccess() {
        db.inTransaction(tx -> tx.prepare("INSERT INTO items (name) VALUES (?)").bind("a").run());
        assertEquals(1, db.prepare("SELECT COUNT(*) AS n FROM items").first().getInt("n"));
    }

    @Test
    void inTransaction_shouldRollBackWhenWorkThrows() {
        assertThrows(IOException.class, () -> db.inTransaction(tx -> {
            tx.prepare("INSERT INTO items (name) VALUES (?)").bind("a").run();
            throw new IOException("boom");
        }));
        assertEquals(0, db.prepare("SELECT COUNT(*) AS n FROM items").first().getInt("n"));
    }

    @Test
    void inTransaction_shouldJoinOuterTransactionWhenNested() {
        assertThrows(IllegalStateException.class, () -> db.inTransaction(outer -> {
            outer.inTransaction(inner -> inner.prepare("INSERT INTO items (name) VALUES (?)").bind("a").run());
            throw new IllegalStateException("outer failed");
        }));
        assertEquals(0, db.prepare("SELECT COUNT(*) AS n FROM items").first().getInt("n"));
    }
}
