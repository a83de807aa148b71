package de.bsommerfeld.dbkeeper.optimizer;

/**
 * Per-call options for {@link QueryOptimizer#executeWithMetrics}.
 *
 * @param queryId  caller-chosen id; the SQL digest is used when {@code null}
 * @param cacheKey key into the metrics cache; {@code null} disables caching
 */
public record ExecutionOptions(String queryId, String cacheKey) {

    public static final ExecutionOptions NONE = new ExecutionOptions(null, null);

    public static ExecutionOptions cached(String cacheKey) {
        return new ExecutionOptions(null, cacheKey);
    }
}
