package de.bsommerfeld.dbkeeper.core.domain;

import java.time.Instant;

/**
 * Composite health, recomputed on every check and never persisted.
 */
public record SystemHealthStatus(
        HealthLevel overall,
        DatabaseHealth database,
        BackupHealth backup,
        PerformanceHealth performance) {

    public enum DatabaseStatus {
        CONNECTED, SLOW, ERROR
    }

    public enum BackupState {
        CURRENT, OVERDUE, FAILED
    }

    /**
     * @param errorRate percentage of failed executions in the last hour
     */
    public record DatabaseHealth(
            DatabaseStatus status,
            double connectionTimeMs,
            double avgQueryTime,
            long slowQueries,
            double errorRate) {
    }

    /**
     * @param lastBackupTime {@code null} when no completed backup exists
     * @param nextBackupTime {@code null} when no completed backup exists
     */
    public record BackupHealth(
            BackupState status,
            Instant lastBackupTime,
            Instant nextBackupTime,
            long backupSize) {
    }

    public record PerformanceHealth(
            double cacheHitRate,
            double indexEfficiency,
            long pendingOptimizations,
            long appliedOptimizations) {
    }

    /** The synthetic worst-case status reported when the check itself fails. */
    public static SystemHealthStatus critical() {
        return new SystemHealthStatus(
                HealthLevel.CRITICAL,
                new DatabaseHealth(DatabaseStatus.ERROR, 0, 0, 0, 100),
                new BackupHealth(BackupState.FAILED, null, null, 0),
                new PerformanceHealth(0, 0, 0, 0));
    }

    public boolean isCritical() {
        return overall == HealthLevel.CRITICAL;
    }
}
