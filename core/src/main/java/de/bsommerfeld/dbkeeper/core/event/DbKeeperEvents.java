package de.bsommerfeld.dbkeeper.core.event;

import de.bsommerfeld.dbkeeper.core.domain.QueryPerformanceMetric;

import java.util.List;

/**
 * Events crossing module boundaries. Only events that more than one module
 * produces or consumes belong here.
 */
public class DbKeeperEvents {

    /**
     * Fired after an instrumented execution exceeded the slow-query threshold.
     * The metric is already in the query log when this is posted.
     */
    public record SlowQueryDetectedEvent(QueryPerformanceMetric metric, double thresholdMs) {
    }

    /**
     * Fired after a restore committed. Anything derived from the pre-restore
     * state (cached metrics, statistics) is stale from here on.
     */
    public record RestoreCompletedEvent(String backupId, List<String> tables, long restoredRecords) {
    }
}
