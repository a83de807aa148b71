package de.bsommerfeld.dbkeeper.db;

import java.util.List;

/**
 * A named index and its key columns in index order.
 */
public record IndexDefinition(String name, String tableName, List<String> columns, boolean unique) {

    public IndexDefinition {
        columns = List.copyOf(columns);
    }
}
