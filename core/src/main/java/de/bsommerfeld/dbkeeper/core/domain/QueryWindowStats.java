package de.bsommerfeld.dbkeeper.core.domain;

/**
 * Aggregates of the query log over a time window. Averages only include
 * successful executions.
 */
public record QueryWindowStats(
        long totalQueries,
        long failedQueries,
        double avgExecutionTime,
        long slowQueries,
        long cacheHits,
        long indexedQueries) {

    public static final QueryWindowStats EMPTY = new QueryWindowStats(0, 0, 0, 0, 0, 0);

    /** Percentage of executions served by the metrics cache; 100 for an empty window. */
    public double cacheHitRate() {
        long successful = totalQueries - failedQueries;
        return successful <= 0 ? 100.0 : cacheHits * 100.0 / successful;
    }

    /** Percentage of executions whose plan used at least one index; 100 for an empty window. */
    public double indexEfficiency() {
        long successful = totalQueries - failedQueries;
        return successful <= 0 ? 100.0 : indexedQueries * 100.0 / successful;
    }

    public double errorRate() {
        return totalQueries == 0 ? 0.0 : failedQueries * 100.0 / totalQueries;
    }
}
