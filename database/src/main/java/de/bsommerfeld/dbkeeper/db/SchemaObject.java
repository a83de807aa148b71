package de.bsommerfeld.dbkeeper.db;

/**
 * One entry of {@code sqlite_master} with its creation DDL.
 *
 * @param type      {@code table}, {@code index}, {@code trigger} or {@code view}
 * @param tableName the table the object belongs to (itself for tables)
 */
public record SchemaObject(String type, String name, String tableName, String sql) {

    public boolean isTable() {
        return "table".equals(type);
    }
}
