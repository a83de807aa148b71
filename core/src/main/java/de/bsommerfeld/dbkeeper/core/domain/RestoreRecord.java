package de.bsommerfeld.dbkeeper.core.domain;

import java.time.Instant;
import java.util.List;

/**
 * One restore attempt as kept in {@code backup_restore_history}.
 *
 * @param restoreType {@code full}, {@code partial}, {@code schema_only} or {@code data_only}
 * @param status      {@code completed} or {@code failed}
 */
public record RestoreRecord(
        String id,
        String backupId,
        String restoreType,
        List<String> tables,
        boolean dropExisting,
        long restoredRecords,
        String status,
        String errorMessage,
        Instant startedAt,
        Instant completedAt) {

    public RestoreRecord {
        tables = List.copyOf(tables);
    }
}
