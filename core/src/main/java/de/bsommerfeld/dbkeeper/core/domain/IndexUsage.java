package de.bsommerfeld.dbkeeper.core.domain;

import java.time.Instant;

/**
 * Usage of one index over an analysis window.
 *
 * @param lastUsed      {@code null} when no logged query used the index
 * @param effectiveness 0–100 score, see {@code QueryOptimizer#effectivenessScore}
 */
public record IndexUsage(
        String indexName,
        String tableName,
        int usageCount,
        Instant lastUsed,
        double avgExecutionTime,
        double effectiveness) {

    /** Candidate for removal. Removal itself is always left to an operator. */
    public boolean isUnused() {
        return usageCount == 0;
    }
}
