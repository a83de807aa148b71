package de.bsommerfeld.dbkeeper.db;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaCatalogTest {

    private SqlDatabaseService db;
    private SchemaCatalog catalog;

    @BeforeEach
    void setUp() {
        db = SqlDatabaseService.inMemory();
        db.applySchema();
        db.execute("CREATE TABLE users (id INTEGER PRIMARY KEY, email TEXT UNIQUE, name TEXT, created_at TEXT)");
        db.execute("CREATE TABLE orders (id INTEGER PRIMARY KEY, user_id INTEGER, status TEXT, total REAL)");
        db.execute("CREATE INDEX idx_orders_user_status ON orders(user_id, status)");
        db.execute("CREATE VIEW big_orders AS SELECT * FROM orders WHERE total > 100");
        catalog = new SchemaCatalog(db);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void userTables_shouldExcludeSystemTables() {
        assertEquals(List.of("orders", "users"), catalog.userTables());
        assertTrue(catalog.allTables().containsAll(SchemaCatalog.SYSTEM_TABLES));
    }

    @Test
    void columns_shouldFollowDeclarationOrder() {
        assertEquals(List.of("id", "email", "name", "created_at"), catalog.columnNames("users"));
        assertTrue(catalog.columns("users").get(0).isRowIdAlias());
    }

    @Test
    void isCovered_shouldMatchLeadingIndexColumns() {
        assertTrue(catalog.isCovered("orders", List.of("user_id")));
        assertTrue(catalog.isCovered("orders", List.of("user_id", "status")));
        assertFalse(catalog.isCovered("orders", List.of("status")));
        assertFalse(catalog.isCovered("orders", List.of("status", "user_id")));
    }

    @Test
    void isCovered_shouldCountUniqueConstraintsAndRowId() {
        assertTrue(catalog.isCovered("users", List.of("email")));
        assertTrue(catalog.isCovered("users", List.of("id")));
        assertFalse(catalog.isCovered("users", List.of("name")));
    }

    @Test
    void indexes_shouldListExplicitIndexesOnly() {
        List<String> names = catalog.indexes().stream().map(IndexDefinition::name).toList();
        assertTrue(names.contains("idx_orders_user_status"));
        assertTrue(names.stream().noneMatch(n -> n.startsWith("sqlite_autoindex")));
    }

    @Test
    void schemaObjects_shouldOrderTablesBeforeIndexesAndViews() {
        List<SchemaObject> objects = catalog.schemaObjects();
        List<String> types = objects.stream().map(SchemaObject::type).toList();
        assertEquals(List.of("table", "table", "index", "view"), types);
        assertTrue(objects.stream().noneMatch(o -> SchemaCatalog.isSystemTable(o.tableName())));
    }

    @Test
    void createIndexDdl_shouldQuoteAndBeRepeatable() {
        String ddl = SchemaCatalog.createIndexDdl("idx_orders_status", "orders", List.of("status"));

        assertEquals("CREATE INDEX IF NOT EXISTS \"idx_orders_status\" ON \"orders\"(\"status\")", ddl);
        db.execute(ddl);
        db.execute(ddl);
        assertTrue(catalog.isCovered("orders", List.of("status")));
    }

    @Test
    void quote_shouldEscapeEmbeddedQuotes() {
        assertEquals("\"we\"\"ird\"", SchemaCatalog.quote("we\"ird"));
    }
}
