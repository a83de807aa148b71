package de.bsommerfeld.dbkeeper.core.domain;

import java.time.Instant;

public record PerformanceSnapshot(
        SnapshotType type,
        long totalQueries,
        double avgQueryTime,
        long slowQueries,
        long failedQueries,
        double cacheHitRate,
        Instant periodStart,
        Instant periodEnd) {
}
