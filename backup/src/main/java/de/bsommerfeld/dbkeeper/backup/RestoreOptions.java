package de.bsommerfeld.dbkeeper.backup;

import java.util.List;

/**
 * How a backup is applied.
 *
 * @param dropExisting drop the target tables before recreating them; rejected
 *                     for incremental backups, which carry no schema
 * @param tableFilter  restore only these tables, {@code null} for all tables in
 *                     the backup
 * @param skipData     recreate schema objects only
 */
public record RestoreOptions(boolean dropExisting, List<String> tableFilter, boolean skipData) {

    public static final RestoreOptions DEFAULT = new RestoreOptions(false, null, false);

    public RestoreOptions {
        tableFilter = tableFilter == null ? null : List.copyOf(tableFilter);
    }

    public static RestoreOptions replaceAll() {
        return new RestoreOptions(true, null, false);
    }

    public static RestoreOptions tables(List<String> tables) {
        return new RestoreOptions(false, tables, false);
    }

    public static RestoreOptions schemaOnly() {
        return new RestoreOptions(false, null, true);
    }

    /** The value stored as {@code restore_type} in the restore history. */
    String restoreType(boolean incremental) {
        if (skipData)
            return "schema_only";
        if (tableFilter != null)
            return "partial";
        return incremental ? "data_only" : "full";
    }
}
