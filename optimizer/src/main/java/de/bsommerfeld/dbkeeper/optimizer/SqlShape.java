package de.bsommerfeld.dbkeeper.optimizer;

import de.bsommerfeld.dbkeeper.core.domain.QueryPattern;
import de.bsommerfeld.dbkeeper.core.domain.QueryPattern.ColumnRef;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * What {@link SqlPatternExtractor} recognized in a statement. Table names
 * are resolved through aliases; columns whose table could not be resolved
 * are left out.
 *
 * @param whereEqualities columns compared with {@code =} in the WHERE clause
 * @param orderBy         leading ORDER BY columns that belong to one table
 */
public record SqlShape(
        String statementType,
        String primaryTable,
        List<ColumnRef> whereEqualities,
        List<JoinCondition> joins,
        List<ColumnRef> orderBy,
        boolean selectStar,
        boolean hasWhere,
        boolean hasLimit,
        boolean inSubquery) {

    private static final Comparator<ColumnRef> COLUMN_ORDER =
            Comparator.comparing(ColumnRef::table).thenComparing(ColumnRef::column);

    public SqlShape {
        whereEqualities = List.copyOf(whereEqualities);
        joins = List.copyOf(joins);
        orderBy = List.copyOf(orderBy);
    }

    public boolean isSelect() {
        return "SELECT".equals(statementType);
    }

    /**
     * Sorted, de-duplicated form for the query log, so that the same access
     * pattern always serializes to the same JSON.
     */
    public QueryPattern toPattern() {
        TreeSet<String> whereColumns = new TreeSet<>();
        for (ColumnRef ref : whereEqualities) {
            if (ref.table().equals(primaryTable))
                whereColumns.add(ref.column());
        }
        TreeSet<ColumnRef> joinColumns = new TreeSet<>(COLUMN_ORDER);
        for (JoinCondition join : joins) {
            joinColumns.add(join.left());
            joinColumns.add(join.right());
        }
        return new QueryPattern(statementType, primaryTable, new ArrayList<>(whereColumns),
                new ArrayList<>(joinColumns));
    }

    /** {@code JOIN ... ON left = right}. */
    public record JoinCondition(ColumnRef left, ColumnRef right) {
    }
}
