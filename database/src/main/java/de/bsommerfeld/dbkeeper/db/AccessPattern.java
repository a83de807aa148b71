package de.bsommerfeld.dbkeeper.db;

import de.bsommerfeld.dbkeeper.core.domain.QueryPattern.ColumnRef;

import java.util.List;

/**
 * A recurring WHERE or JOIN column combination mined from the query log.
 *
 * @param table       filtered table for WHERE patterns, {@code null} for JOIN patterns
 * @param columns     WHERE columns of {@code table}; empty for JOIN patterns
 * @param joinColumns both sides of the join equalities; empty for WHERE patterns
 */
public record AccessPattern(
        String table,
        List<String> columns,
        List<ColumnRef> joinColumns,
        int usageCount,
        double avgExecutionTime) {

    public AccessPattern {
        columns = List.copyOf(columns);
        joinColumns = List.copyOf(joinColumns);
    }
}
