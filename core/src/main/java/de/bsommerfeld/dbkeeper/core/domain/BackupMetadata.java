package de.bsommerfeld.dbkeeper.core.domain;

import java.time.Instant;
import java.util.List;

/**
 * Describes one stored backup payload. Only successful backups produce a
 * metadata row, and rows are never updated afterwards.
 *
 * @param sizeBytes size of the stored payload (after compression/encryption)
 * @param checksum  SHA-256 hex of the serialized payload before compression
 *                  and encryption
 * @param basedOn   reference time of an incremental backup, {@code null} for full
 */
public record BackupMetadata(
        String id,
        Instant timestamp,
        BackupType type,
        long sizeBytes,
        boolean compressed,
        boolean encrypted,
        String checksum,
        List<String> tables,
        long recordCount,
        String version,
        BackupStatus status,
        Instant basedOn) {

    public BackupMetadata {
        tables = List.copyOf(tables);
    }

    public boolean isIncremental() {
        return type == BackupType.INCREMENTAL;
    }
}
