package de.bsommerfeld.dbkeeper.manager;

import java.util.List;

/**
 * Outcome of {@link DatabaseManager#performComprehensiveOptimization()}.
 *
 * @param indexesCreated         DDL of every index that was created
 * @param backupCompleted        whether the scheduled backup check took a backup
 * @param optimizationsSuggested suggestions across all slow-query reports, any priority
 */
public record OptimizationSummary(
        List<String> indexesCreated,
        boolean statisticsUpdated,
        boolean backupCompleted,
        int optimizationsSuggested) {

    public OptimizationSummary {
        indexesCreated = List.copyOf(indexesCreated);
    }
}
