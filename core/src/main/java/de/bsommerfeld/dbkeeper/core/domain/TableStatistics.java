package de.bsommerfeld.dbkeeper.core.domain;

import java.time.Instant;

/**
 * Per-table statistics, superseded on every refresh.
 *
 * @param avgRowSize estimated bytes per row
 */
public record TableStatistics(
        String tableName,
        long rowCount,
        long avgRowSize,
        int indexCount,
        Instant updatedAt) {
}
