package de.bsommerfeld.dbkeeper.core.domain;

import java.util.List;

/**
 * Current performance figures over the last hour.
 *
 * @param cacheHitRate percentage, 0–100
 */
public record PerformanceDashboard(
        int currentConnections,
        double avgQueryTime,
        long slowQueries,
        double cacheHitRate,
        List<TopSlowQuery> topSlowQueries) {

    public PerformanceDashboard {
        topSlowQueries = List.copyOf(topSlowQueries);
    }

    public record TopSlowQuery(String query, double avgTime, int count) {
    }
}
