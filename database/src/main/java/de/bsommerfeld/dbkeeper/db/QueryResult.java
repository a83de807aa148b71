package de.bsommerfeld.dbkeeper.db;

import java.util.List;

/**
 * Outcome of one statement: the rows of a query, or the change count of DML.
 * Exactly one of the two is meaningful; the other is empty/zero.
 */
public record QueryResult(List<Row> rows, int changes) {

    public QueryResult {
        rows = List.copyOf(rows);
    }

    public static QueryResult ofChanges(int changes) {
        return new QueryResult(List.of(), changes);
    }

    public Row firstOrNull() {
        return rows.isEmpty() ? null : rows.get(0);
    }
}
