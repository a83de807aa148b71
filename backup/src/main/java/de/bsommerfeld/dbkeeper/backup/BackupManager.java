package de.bsommerfeld.dbkeeper.backup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.dbkeeper.backup.BackupPayload.Header;
import de.bsommerfeld.dbkeeper.backup.BackupPayload.SchemaEntry;
import de.bsommerfeld.dbkeeper.core.config.BackupConfig;
import de.bsommerfeld.dbkeeper.core.domain.BackupMetadata;
import de.bsommerfeld.dbkeeper.core.domain.BackupStatus;
import de.bsommerfeld.dbkeeper.core.domain.BackupType;
import de.bsommerfeld.dbkeeper.core.domain.RestoreRecord;
import de.bsommerfeld.dbkeeper.core.event.ApplicationEventBus;
import de.bsommerfeld.dbkeeper.core.event.DbKeeperEvents.RestoreCompletedEvent;
import de.bsommerfeld.dbkeeper.core.util.Digests;
import de.bsommerfeld.dbkeeper.core.util.Timestamps;
import de.bsommerfeld.dbkeeper.db.ColumnInfo;
import de.bsommerfeld.dbkeeper.db.DatabaseAccessException;
import de.bsommerfeld.dbkeeper.db.DatabaseService;
import de.bsommerfeld.dbkeeper.db.MetricsStore;
import de.bsommerfeld.dbkeeper.db.Row;
import de.bsommerfeld.dbkeeper.db.SchemaCatalog;
import de.bsommerfeld.dbkeeper.db.SchemaObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Logical backups of the user tables and restores from them.
 *
 * <p>
 * A backup is a JSON document ({@link BackupPayload}) whose SHA-256 is
 * recorded in {@code backup_metadata} before the bytes are compressed and
 * encrypted. Payload bytes go to {@link BackupStorage}. Only successful
 * backups get a metadata row.
 *
 * <p>
 * The dbkeeper system tables are never exported or restored, so a restore
 * cannot erase the record of the backup it came from.
 *
 * <p>
 * Backup ids derive from the creation time. A second backup within the same
 * millisecond gets a numeric suffix, so an existing payload is never
 * overwritten.
 *
 * <pre>
 *   createFullBackup ──▶ export rows + DDL ──▶ JSON ──▶ sha256 ──▶ gzip/aes ──▶ storage
 *                                                                           └──▶ backup_metadata
 *   restoreFromBackup ◀── verify sha256 ◀── decode ◀── storage
 *        └──▶ one transaction: drop ─▶ create schema ─▶ upsert rows
 * </pre>
 */
@Singleton
public class BackupManager {

    private static final Logger LOG = LoggerFactory.getLogger(BackupManager.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String FORMAT_VERSION = "1.0.0";
    static final int RESTORE_HISTORY_LIMIT = 20;

    private final DatabaseService db;
    private final SchemaCatalog catalog;
    private final MetricsStore store;
    private final BackupStorage storage;
    private final BackupConfig config;
    private final ApplicationEventBus eventBus;
    private final Clock clock;

    @Inject
    public BackupManager(DatabaseService db, SchemaCatalog catalog, MetricsStore store, BackupStorage storage,
            BackupConfig config, ApplicationEventBus eventBus, Clock clock) {
        this.db = db;
        this.catalog = catalog;
        this.store = store;
        this.storage = storage;
        this.config = config;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    // =====================================================================
    // Backup Creation
    // =====================================================================

    /**
     * Exports every row and the DDL of all user tables.
     *
     * @throws BackupException if any export or the storage write fails; no
     *                         metadata row is written in that case
     */
    public BackupMetadata createFullBackup() throws BackupException {
        Instant now = clock.instant();
        String id = allocateId("backup_", now);
        try {
            List<String> tables = catalog.userTables();
            Map<String, List<Map<String, Object>>> data = new LinkedHashMap<>();
            long records = 0;
            for (String table : tables) {
                List<Map<String, Object>> rows = exportRows(table, "", List.of());
                data.put(table, rows);
                records += rows.size();
                LOG.debug("[Backup] Exported {} rows from {}", rows.size(), table);
            }
            List<SchemaEntry> schema = catalog.schemaObjects().stream()
                    .map(SchemaEntry::of)
                    .collect(Collectors.toList());
            return storeBackup(id, now, BackupType.FULL, tables, schema, data, records, null);
        } catch (DatabaseAccessException e) {
            throw new BackupException("Full backup " + id + " failed", e);
        }
    }

    /**
     * Exports rows changed after {@code since}, judged by {@code updated_at}
     * and {@code created_at}. A table with neither column is exported whole.
     * The result carries data only, no schema.
     *
     * @throws NothingToBackupException if no table has a row to export
     */
    public BackupMetadata createIncrementalBackup(Instant since) throws BackupException {
        Instant now = clock.instant();
        String id = allocateId("incremental_", now);
        try {
            List<String> tables = new ArrayList<>();
            Map<String, List<Map<String, Object>>> data = new LinkedHashMap<>();
            long records = 0;
            for (String table : catalog.userTables()) {
                List<Map<String, Object>> rows = exportChangedRows(table, since);
                if (rows.isEmpty())
                    continue;
                tables.add(table);
                data.put(table, rows);
                records += rows.size();
                LOG.debug("[Backup] Exported {} changed rows from {}", rows.size(), table);
            }
            if (records == 0)
                throw new NothingToBackupException(since);
            return storeBackup(id, now, BackupType.INCREMENTAL, tables, List.of(), data, records, since);
        } catch (DatabaseAccessException e) {
            throw new BackupException("Incremental backup " + id + " failed", e);
        }
    }

    private String allocateId(String prefix, Instant now) {
        String base = prefix + Timestamps.compact(now);
        String id = base;
        for (int suffix = 2; store.findBackupMetadata(id).isPresent() || storage.exists(id); suffix++)
            id = base + "_" + suffix;
        return id;
    }

    private List<Map<String, Object>> exportChangedRows(String table, Instant since) {
        List<String> columns = catalog.columnNames(table);
        boolean updatedAt = columns.stream().anyMatch("updated_at"::equalsIgnoreCase);
        boolean createdAt = columns.stream().anyMatch("created_at"::equalsIgnoreCase);
        String reference = Timestamps.format(since);

        if (updatedAt && createdAt) {
            return exportRows(table,
                    " WHERE julianday(updated_at) > julianday(?) OR julianday(created_at) > julianday(?)",
                    List.of(reference, reference));
        }
        if (updatedAt || createdAt) {
            String column = updatedAt ? "updated_at" : "created_at";
            return exportRows(table, " WHERE julianday(" + column + ") > julianday(?)", List.of(reference));
        }
        LOG.info("[Backup] {} has no updated_at/created_at column, exporting all rows", table);
        return exportRows(table, "", List.of());
    }

    private List<Map<String, Object>> exportRows(String table, String where, List<Object> params) {
        List<Map<String, Object>> rows = new ArrayList<>();
        String sql = "SELECT * FROM " + SchemaCatalog.quote(table) + where;
        for (Row row : db.prepare(sql).bind(params.toArray()).all()) {
            Map<String, Object> values = new LinkedHashMap<>();
            row.asMap().forEach((column, value) -> values.put(column, BackupPayload.encodeValue(value)));
            rows.add(values);
        }
        return rows;
    }

    private BackupMetadata storeBackup(String id, Instant now, BackupType type, List<String> tables,
            List<SchemaEntry> schema, Map<String, List<Map<String, Object>>> data, long records, Instant basedOn)
            throws BackupException {
        String passphrase = encryptionPassphrase();
        Header header = new Header(id, Timestamps.format(now), type.key(), tables, records, FORMAT_VERSION,
                basedOn == null ? null : Timestamps.format(basedOn));

        byte[] json;
        try {
            json = MAPPER.writeValueAsBytes(new BackupPayload(header, schema, data));
        } catch (JsonProcessingException e) {
            throw new BackupException("Failed to serialize backup " + id, e);
        }
        String checksum = Digests.sha256(json);
        byte[] stored = PayloadCodec.encode(json, config.isCompressionEnabled(), passphrase);

        if (storage.exists(id))
            throw new BackupException("A payload is already stored under " + id);
        try {
            storage.store(id, stored);
        } catch (IOException e) {
            throw new BackupException("Failed to store backup " + id, e);
        }

        BackupMetadata metadata = new BackupMetadata(id, now, type, stored.length, config.isCompressionEnabled(),
                passphrase != null, checksum, tables, records, FORMAT_VERSION, BackupStatus.COMPLETED, basedOn);
        try {
            store.saveBackupMetadata(metadata);
        } catch (DatabaseAccessException e) {
            discardPayload(id);
            throw new BackupException("Failed to record metadata of backup " + id, e);
        }
        LOG.info("[Backup] Created {} backup {}: {} tables, {} records, {} bytes", type.key(), id, tables.size(),
                records, stored.length);
        return metadata;
    }

    private String encryptionPassphrase() throws BackupException {
        if (!config.isEncryptionEnabled())
            return null;
        String passphrase = config.getEncryptionPassphrase();
        if (passphrase == null || passphrase.isEmpty())
            throw new BackupException("Backup encryption is enabled but no passphrase is configured");
        return passphrase;
    }

    private void discardPayload(String id) {
        try {
            storage.delete(id);
        } catch (IOException e) {
            LOG.warn("[Backup] Could not remove orphaned payload {}: {}", id, e.getMessage());
        }
    }

    // =====================================================================
    // Restore
    // =====================================================================

    public RestoreRecord restoreFromBackup(String backupId) throws BackupException {
        return restoreFromBackup(backupId, RestoreOptions.DEFAULT);
    }

    /**
     * Verifies the payload against its checksum, then applies it in a single
     * transaction. On any failure nothing is changed.
     *
     * @throws BackupNotFoundException   if no metadata row has this id
     * @throws BackupIntegrityException  if the payload does not match its checksum
     */
    public RestoreRecord restoreFromBackup(String backupId, RestoreOptions options) throws BackupException {
        Instant started = clock.instant();
        BackupMetadata metadata = store.findBackupMetadata(backupId)
                .orElseThrow(() -> new BackupNotFoundException(backupId));
        List<String> targets = targetTables(metadata, options);
        String restoreType = options.restoreType(metadata.isIncremental());

        try {
            if (metadata.isIncremental() && options.dropExisting()) {
                throw new BackupException("Incremental backup " + backupId
                        + " carries no schema and cannot be restored with dropExisting");
            }
            BackupPayload payload = loadVerified(metadata);
            long restored = db.inTransaction(tx -> applyRestore(payload, targets, options));

            RestoreRecord record = new RestoreRecord(restoreId(), backupId, restoreType, targets,
                    options.dropExisting(), restored, "completed", null, started, clock.instant());
            recordHistory(record);
            LOG.info("[Backup] Restored {} records into {} tables from {}", restored, targets.size(), backupId);
            eventBus.post(new RestoreCompletedEvent(backupId, targets, restored));
            return record;
        } catch (BackupException e) {
            recordFailure(backupId, restoreType, targets, options, started, e);
            throw e;
        } catch (DatabaseAccessException e) {
            recordFailure(backupId, restoreType, targets, options, started, e);
            throw new BackupException("Restore from " + backupId + " failed", e);
        }
    }

    private List<String> targetTables(BackupMetadata metadata, RestoreOptions options) {
        if (options.tableFilter() == null)
            return metadata.tables();
        Set<String> wanted = new LinkedHashSet<>(options.tableFilter());
        return metadata.tables().stream().filter(wanted::contains).collect(Collectors.toList());
    }

    private long applyRestore(BackupPayload payload, List<String> targets, RestoreOptions options) {
        boolean everything = options.tableFilter() == null;
        // Rows are reinserted in table order, not dependency order
        db.execute("PRAGMA defer_foreign_keys = ON");

        if (options.dropExisting())
            dropTables(everything ? catalog.userTables() : targets, everything);

        for (SchemaEntry entry : payload.schema()) {
            boolean wanted = everything || (!"view".equals(entry.type()) && targets.contains(entry.tableName()));
            if (!wanted || catalog.objectExists(entry.name()))
                continue;
            db.execute(entry.sql());
        }

        if (options.skipData())
            return 0;

        long restored = 0;
        for (String table : targets) {
            List<Map<String, Object>> rows = payload.data().getOrDefault(table, List.of());
            Set<String> keyColumns = primaryKeyColumns(table);
            for (Map<String, Object> row : rows) {
                upsertRow(table, keyColumns, row);
            }
            restored += rows.size();
        }
        return restored;
    }

    private void dropTables(List<String> tables, boolean includeViews) {
        if (includeViews) {
            for (SchemaObject object : catalog.schemaObjects()) {
                if ("view".equals(object.type()))
                    db.execute("DROP VIEW IF EXISTS " + SchemaCatalog.quote(object.name()));
            }
        }
        for (String table : tables) {
            if (SchemaCatalog.isSystemTable(table))
                continue;
            db.execute("DROP TABLE IF EXISTS " + SchemaCatalog.quote(table));
            LOG.debug("[Backup] Dropped {}", table);
        }
    }

    private Set<String> primaryKeyColumns(String table) {
        Set<String> keys = new HashSet<>();
        for (ColumnInfo column : catalog.columns(table)) {
            if (column.primaryKeyPosition() > 0)
                keys.add(column.name().toLowerCase(Locale.ROOT));
        }
        return keys;
    }

    /**
     * Inserts the row, or updates the non-key columns of the row it collides
     * with. {@code INSERT OR REPLACE} is not an option: it deletes the old
     * row first, which fires {@code ON DELETE CASCADE} on child tables.
     */
    private void upsertRow(String table, Set<String> keyColumns, Map<String, Object> row) {
        if (row.isEmpty())
            return;
        List<String> names = new ArrayList<>(row.keySet());
        String columns = names.stream().map(SchemaCatalog::quote).collect(Collectors.joining(", "));
        String placeholders = names.stream().map(c -> "?").collect(Collectors.joining(", "));
        String updates = names.stream()
                .filter(c -> !keyColumns.contains(c.toLowerCase(Locale.ROOT)))
                .map(c -> SchemaCatalog.quote(c) + " = excluded." + SchemaCatalog.quote(c))
                .collect(Collectors.joining(", "));
        String onConflict = updates.isEmpty() ? " ON CONFLICT DO NOTHING" : " ON CONFLICT DO UPDATE SET " + updates;

        Object[] values = names.stream().map(c -> BackupPayload.decodeValue(row.get(c))).toArray();
        db.prepare("INSERT INTO " + SchemaCatalog.quote(table) + " (" + columns + ") VALUES (" + placeholders + ")"
                + onConflict)
                .bind(values)
                .run();
    }

    private void recordFailure(String backupId, String restoreType, List<String> targets, RestoreOptions options,
            Instant started, Exception cause) {
        LOG.error("[Backup] Restore from {} failed: {}", backupId, cause.getMessage());
        recordHistory(new RestoreRecord(restoreId(), backupId, restoreType, targets, options.dropExisting(), 0,
                "failed", cause.getMessage(), started, clock.instant()));
    }

    private void recordHistory(RestoreRecord record) {
        try {
            store.saveRestoreRecord(record);
        } catch (DatabaseAccessException e) {
            LOG.warn("[Backup] Could not record restore history for {}: {}", record.backupId(), e.getMessage());
        }
    }

    private static String restoreId() {
        return "restore_" + UUID.randomUUID();
    }

    public List<RestoreRecord> restoreHistory() {
        return store.restoreHistory(RESTORE_HISTORY_LIMIT);
    }

    // =====================================================================
    // Verification
    // =====================================================================

    /**
     * Loads and decodes the stored payload and checks it against the recorded
     * checksum without touching the database.
     */
    public BackupMetadata verifyBackup(String backupId) throws BackupException {
        BackupMetadata metadata = store.findBackupMetadata(backupId)
                .orElseThrow(() -> new BackupNotFoundException(backupId));
        loadVerified(metadata);
        return metadata;
    }

    private BackupPayload loadVerified(BackupMetadata metadata) throws BackupException {
        byte[] stored;
        try {
            stored = storage.load(metadata.id());
        } catch (IOException e) {
            throw new BackupException("Payload of backup " + metadata.id() + " cannot be read", e);
        }
        byte[] json = PayloadCodec.decode(stored, metadata.compressed(),
                metadata.encrypted() ? encryptionPassphraseFor(metadata) : null);

        String actual = Digests.sha256(json);
        if (!actual.equals(metadata.checksum())) {
            throw new BackupIntegrityException("Checksum mismatch for backup " + metadata.id() + ": expected "
                    + metadata.checksum() + ", got " + actual);
        }
        try {
            return MAPPER.readValue(json, BackupPayload.class);
        } catch (IOException e) {
            throw new BackupIntegrityException("Payload of backup " + metadata.id() + " is not readable", e);
        }
    }

    private String encryptionPassphraseFor(BackupMetadata metadata) throws BackupException {
        String passphrase = config.getEncryptionPassphrase();
        if (passphrase == null || passphrase.isEmpty())
            throw new BackupException("Backup " + metadata.id() + " is encrypted but no passphrase is configured");
        return passphrase;
    }

    // =====================================================================
    // Scheduling
    // =====================================================================

    /**
     * Scheduler entry point. Takes a backup when one is due and prunes
     * expired ones afterwards. Never throws: failures are logged.
     *
     * @return the backup taken, if any
     */
    public Optional<BackupMetadata> scheduleAutomaticBackup() {
        if (!config.isEnabled()) {
            LOG.debug("[Backup] Automatic backups disabled");
            return Optional.empty();
        }
        try {
            Instant now = clock.instant();
            Instant last = store.latestCompletedBackup().map(BackupMetadata::timestamp).orElse(null);
            if (!shouldCreateBackup(last, now))
                return Optional.empty();

            BackupMetadata created = last == null || isFullBackupTime(last, now)
                    ? createFullBackup()
                    : createIncrementalBackup(last);
            pruneOldBackups();
            return Optional.of(created);
        } catch (NothingToBackupException e) {
            LOG.debug("[Backup] Scheduled incremental skipped: {}", e.getMessage());
            return Optional.empty();
        } catch (BackupException | RuntimeException e) {
            LOG.error("[Backup] Scheduled backup failed", e);
            return Optional.empty();
        }
    }

    /** A first backup is always due; afterwards once per configured cadence. */
    public boolean shouldCreateBackup(Instant lastBackup, Instant now) {
        if (lastBackup == null)
            return true;
        return Duration.between(lastBackup, now).compareTo(config.getSchedule().interval()) >= 0;
    }

    /** Whether a Sunday 00:00 UTC boundary lies in {@code (lastBackup, now]}. */
    public static boolean isFullBackupTime(Instant lastBackup, Instant now) {
        ZonedDateTime last = lastBackup.atZone(ZoneOffset.UTC);
        ZonedDateTime boundary = last.toLocalDate()
                .with(TemporalAdjusters.next(DayOfWeek.SUNDAY))
                .atStartOfDay(ZoneOffset.UTC);
        return !boundary.toInstant().isAfter(now);
    }

    /** Next scheduled backup after the given one, by cadence. */
    public Instant nextBackupTime(Instant lastBackup) {
        return lastBackup.plus(config.getSchedule().interval());
    }

    // =====================================================================
    // Retention
    // =====================================================================

    /**
     * Deletes metadata and payload of every backup older than the retention
     * period.
     *
     * @return number of backups removed
     */
    public int pruneOldBackups() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(config.getRetentionDays()));
        int removed = 0;
        for (BackupMetadata expired : store.backupsOlderThan(cutoff)) {
            try {
                storage.delete(expired.id());
            } catch (IOException e) {
                LOG.warn("[Backup] Could not delete payload of {}: {}", expired.id(), e.getMessage());
            }
            if (store.deleteBackupMetadata(expired.id()))
                removed++;
        }
        if (removed > 0)
            LOG.info("[Backup] Pruned {} backups older than {} days", removed, config.getRetentionDays());
        return removed;
    }

    public List<BackupMetadata> listBackups() {
        return store.listBackups();
    }

    public Optional<BackupMetadata> latestCompletedBackup() {
        return store.latestCompletedBackup();
    }
}
