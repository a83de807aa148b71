package de.bsommerfeld.dbkeeper.db;

/**
 * Column as reported by {@code pragma_table_info}.
 *
 * @param primaryKeyPosition 1-based position in the primary key, 0 if not part of it
 */
public record ColumnInfo(String name, String type, int primaryKeyPosition) {

    /** An {@code INTEGER PRIMARY KEY} column aliases the rowid and needs no index. */
    public boolean isRowIdAlias() {
        return primaryKeyPosition == 1 && "INTEGER".equalsIgnoreCase(type);
    }
}
