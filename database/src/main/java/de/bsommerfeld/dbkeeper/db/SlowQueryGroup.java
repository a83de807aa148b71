package de.bsommerfeld.dbkeeper.db;

import java.time.Instant;

/**
 * Slow executions of one statement digest, aggregated over a window.
 */
public record SlowQueryGroup(
        String sqlHash,
        String sql,
        int executionCount,
        double avgExecutionTime,
        double maxExecutionTime,
        Instant lastExecuted) {
}
