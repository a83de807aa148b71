package de.bsommerfeld.dbkeeper.manager;

import de.bsommerfeld.dbkeeper.core.domain.IndexUsage;
import de.bsommerfeld.dbkeeper.core.domain.PerformanceSnapshot;

import java.util.List;

/**
 * Outcome of {@link DatabaseManager#performRoutineMaintenance()}. Unused
 * indexes are reported only, never dropped.
 */
public record MaintenanceSummary(
        int prunedLogRows,
        List<IndexUsage> unusedIndexes,
        boolean integrityOk,
        PerformanceSnapshot snapshot) {

    public MaintenanceSummary {
        unusedIndexes = List.copyOf(unusedIndexes);
    }
}
