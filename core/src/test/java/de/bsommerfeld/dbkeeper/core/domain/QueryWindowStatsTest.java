package de.bsommerfeld.dbkeeper.core.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QueryWindowStatsTest {

    @Test
    void emptyWindow_shouldReportFullRatesAndNoErrors() {
        assertEquals(100.0, QueryWindowStats.EMPTY.cacheHitRate(), 0.001);
        assertEquals(100.0, QueryWindowStats.EMPTY.indexEfficiency(), 0.001);
        assertEquals(0.0, QueryWindowStats.EMPTY.errorRate(), 0.001);
    }

    @Test
    void rates_shouldBeComputedOverSuccessfulExecutions() {
        var stats = new QueryWindowStats(10, 2, 50.0, 1, 4, 6);

        assertEquals(50.0, stats.cacheHitRate(), 0.001);
        assertEquals(75.0, stats.indexEfficiency(), 0.001);
        assertEquals(20.0, stats.errorRate(), 0.001);
    }

    @Test
    void criticalStatus_shouldBeWorstOnEveryAxis() {
        SystemHealthStatus status = SystemHealthStatus.critical();

        assertTrue(status.isCritical());
        assertEquals(SystemHealthStatus.DatabaseStatus.ERROR, status.database().status());
        assertEquals(SystemHealthStatus.BackupState.FAILED, status.backup().status());
        assertNull(status.backup().lastBackupTime());
    }
}
