package de.bsommerfeld.dbkeeper.core.domain;

import java.util.List;

/**
 * Access pattern extracted from a statement and stored next to its metric,
 * so recurring WHERE/JOIN columns can be mined later without re-parsing.
 *
 * @param statementType {@code SELECT}, {@code INSERT}, {@code UPDATE}, {@code DELETE} or {@code OTHER}
 * @param table         primary table, {@code null} if none was recognized
 * @param whereColumns  equality-filtered columns of the primary table, sorted
 * @param joinColumns   columns on both sides of {@code JOIN ... ON} equalities
 */
public record QueryPattern(
        String statementType,
        String table,
        List<String> whereColumns,
        List<ColumnRef> joinColumns) {

    public static final QueryPattern NONE = new QueryPattern("OTHER", null, List.of(), List.of());

    public QueryPattern {
        whereColumns = List.copyOf(whereColumns);
        joinColumns = List.copyOf(joinColumns);
    }

    public record ColumnRef(String table, String column) {
    }
}
