package de.bsommerfeld.dbkeeper.core.domain;

import java.time.Instant;
import java.util.List;

/**
 * One instrumented statement execution. Written once to the query log and
 * never updated.
 *
 * @param queryId       caller-supplied id, or the digest of the SQL text
 * @param sql           statement text as prepared
 * @param executionTime wall-clock milliseconds around the single execution
 * @param rowsReturned  rows in the result set (0 for DML)
 * @param rowsScanned   estimate only; no real cardinality is available
 * @param indexesUsed   index names read from the query plan, in plan order
 * @param cacheHit      whether plan introspection was served from the metrics cache
 * @param timestamp     end of the execution
 */
public record QueryPerformanceMetric(
        String queryId,
        String sql,
        double executionTime,
        int rowsReturned,
        int rowsScanned,
        List<String> indexesUsed,
        boolean cacheHit,
        Instant timestamp) {

    public QueryPerformanceMetric {
        indexesUsed = indexesUsed == null ? List.of() : List.copyOf(indexesUsed);
    }

    public boolean isSlow(double thresholdMs) {
        return executionTime > thresholdMs;
    }
}
