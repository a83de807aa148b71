package de.bsommerfeld.dbkeeper.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Read-only view of the managed database's schema, backed by
 * {@code sqlite_master} and the {@code pragma_*} table-valued functions.
 *
 * <p>
 * The six dbkeeper tables are part of every schema but never count as
 * user tables: backups skip them and restores never touch them.
 */
@Singleton
public class SchemaCatalog {

    public static final Set<String> SYSTEM_TABLES = Set.of(
            "query_performance_log",
            "backup_metadata",
            "backup_restore_history",
            "table_statistics",
            "optimization_suggestions",
            "system_performance_snapshots");

    private final DatabaseService db;

    @Inject
    public SchemaCatalog(DatabaseService db) {
        this.db = db;
    }

    public static boolean isSystemTable(String table) {
        return SYSTEM_TABLES.contains(table.toLowerCase(Locale.ROOT));
    }

    /** Double-quotes an identifier for interpolation into SQL text. */
    public static String quote(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    /**
     * Idempotent index DDL with every identifier quoted, so replaying a
     * suggestion whose index already exists is a no-op.
     */
    public static String createIndexDdl(String index, String table, List<String> columns) {
        StringBuilder ddl = new StringBuilder("CREATE INDEX IF NOT EXISTS ")
                .append(quote(index)).append(" ON ").append(quote(table)).append('(');
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0)
                ddl.append(", ");
            ddl.append(quote(columns.get(i)));
        }
        return ddl.append(')').toString();
    }

    // ===== Tables =====

    /** All tables except SQLite's internal {@code sqlite_*} ones, sorted by name. */
    public List<String> allTables() {
        List<String> names = new ArrayList<>();
        for (Row row : db.prepare(SqlLoader.load("select-tables")).all()) {
            names.add(row.getString("name"));
        }
        return names;
    }

    /** {@link #allTables()} without the system tables. */
    public List<String> userTables() {
        List<String> names = new ArrayList<>();
        for (String name : allTables()) {
            if (!isSystemTable(name))
                names.add(name);
        }
        return names;
    }

    public boolean tableExists(String table) {
        return db.prepare(SqlLoader.load("select-table-exists")).bind(table).first() != null;
    }

    /** Whether any schema object (table, index, trigger, view) has this name. */
    public boolean objectExists(String name) {
        return db.prepare(SqlLoader.load("select-object-exists")).bind(name).first() != null;
    }

    public List<ColumnInfo> columns(String table) {
        List<ColumnInfo> columns = new ArrayList<>();
        for (Row row : db.prepare(SqlLoader.load("select-table-columns")).bind(table).all()) {
            columns.add(new ColumnInfo(row.getString("name"), row.getString("type"), row.getInt("pk")));
        }
        return columns;
    }

    public List<String> columnNames(String table) {
        List<String> names = new ArrayList<>();
        for (ColumnInfo column : columns(table)) {
            names.add(column.name());
        }
        return names;
    }

    // ===== Indexes =====

    /** Explicitly created indexes across all tables; autoindexes are left out. */
    public List<IndexDefinition> indexes() {
        List<IndexDefinition> indexes = new ArrayList<>();
        for (Row row : db.prepare(SqlLoader.load("select-indexes")).all()) {
            String name = row.getString("name");
            indexes.add(new IndexDefinition(name, row.getString("tbl_name"), indexColumns(name), false));
        }
        return indexes;
    }

    /** Every index on the table, including the autoindexes behind UNIQUE and PRIMARY KEY. */
    public List<IndexDefinition> indexesOf(String table) {
        List<IndexDefinition> indexes = new ArrayList<>();
        for (Row row : db.prepare(SqlLoader.load("select-index-list")).bind(table).all()) {
            String name = row.getString("name");
            indexes.add(new IndexDefinition(name, table, indexColumns(name), row.getBoolean("is_unique")));
        }
        return indexes;
    }

    private List<String> indexColumns(String index) {
        List<String> columns = new ArrayList<>();
        for (Row row : db.prepare(SqlLoader.load("select-index-columns")).bind(index).all()) {
            columns.add(row.getString("name"));
        }
        return columns;
    }

    public int indexCount(String table) {
        Row row = db.prepare(SqlLoader.load("count-table-indexes")).bind(table).first();
        return row == null ? 0 : row.getInt("index_count");
    }

    /**
     * Whether some index on the table starts with exactly these columns, in
     * this order. A single {@code INTEGER PRIMARY KEY} column counts as
     * covered because it is the rowid.
     */
    public boolean isCovered(String table, List<String> columns) {
        if (columns.isEmpty())
            return true;
        if (columns.size() == 1) {
            for (ColumnInfo column : columns(table)) {
                if (column.isRowIdAlias() && column.name().equalsIgnoreCase(columns.get(0)))
                    return true;
            }
        }
        for (IndexDefinition index : indexesOf(table)) {
            if (index.columns().size() < columns.size())
                continue;
            boolean prefix = true;
            for (int i = 0; i < columns.size(); i++) {
                if (!index.columns().get(i).equalsIgnoreCase(columns.get(i))) {
                    prefix = false;
                    break;
                }
            }
            if (prefix)
                return true;
        }
        return false;
    }

    // ===== DDL =====

    /**
     * Creation DDL of user objects ordered tables, indexes, triggers, views, so
     * replaying the list in order rebuilds the schema.
     */
    public List<SchemaObject> schemaObjects() {
        List<SchemaObject> objects = new ArrayList<>();
        for (Row row : db.prepare(SqlLoader.load("select-schema-objects")).all()) {
            String table = row.getString("tbl_name");
            if (isSystemTable(table))
                continue;
            objects.add(new SchemaObject(row.getString("type"), row.getString("name"), table, row.getString("sql")));
        }
        return objects;
    }
}
