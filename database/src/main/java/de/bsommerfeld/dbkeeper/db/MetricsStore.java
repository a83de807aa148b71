package de.bsommerfeld.dbkeeper.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.dbkeeper.core.domain.BackupMetadata;
import de.bsommerfeld.dbkeeper.core.domain.BackupStatus;
import de.bsommerfeld.dbkeeper.core.domain.BackupType;
import de.bsommerfeld.dbkeeper.core.domain.OptimizationSuggestion;
import de.bsommerfeld.dbkeeper.core.domain.PerformanceSnapshot;
import de.bsommerfeld.dbkeeper.core.domain.Priority;
import de.bsommerfeld.dbkeeper.core.domain.QueryPattern;
import de.bsommerfeld.dbkeeper.core.domain.QueryPattern.ColumnRef;
import de.bsommerfeld.dbkeeper.core.domain.QueryPerformanceMetric;
import de.bsommerfeld.dbkeeper.core.domain.QueryWindowStats;
import de.bsommerfeld.dbkeeper.core.domain.RestoreRecord;
import de.bsommerfeld.dbkeeper.core.domain.SnapshotType;
import de.bsommerfeld.dbkeeper.core.domain.StoredSuggestion;
import de.bsommerfeld.dbkeeper.core.domain.SuggestionStatus;
import de.bsommerfeld.dbkeeper.core.domain.SuggestionType;
import de.bsommerfeld.dbkeeper.core.domain.TableStatistics;
import de.bsommerfeld.dbkeeper.core.util.Digests;
import de.bsommerfeld.dbkeeper.core.util.Timestamps;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Typed access to the dbkeeper system tables. All SQL lives in
 * {@code sql/*.sql} and is loaded through {@link SqlLoader}; list-valued
 * columns are stored as JSON arrays.
 *
 * <p>
 * Rows in {@code query_performance_log}, {@code backup_metadata} and
 * {@code system_performance_snapshots} are append-only. Only suggestion
 * status and {@code table_statistics} are ever updated.
 */
@Singleton
public class MetricsStore {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<ColumnRef>> COLUMN_REF_LIST = new TypeReference<>() {
    };

    private final DatabaseService db;

    @Inject
    public MetricsStore(DatabaseService db) {
        this.db = db;
    }

    public DatabaseService database() {
        return db;
    }

    // =====================================================================
    // Query Log
    // =====================================================================

    public void recordExecution(QueryPerformanceMetric metric, QueryPattern pattern) {
        db.prepare(SqlLoader.load("insert-query-metric")).bind(
                metric.queryId(),
                Digests.queryDigest(metric.sql()),
                metric.sql(),
                metric.executionTime(),
                metric.rowsReturned(),
                metric.rowsScanned(),
                toJson(metric.indexesUsed()),
                metric.cacheHit(),
                false,
                null,
                pattern.statementType(),
                pattern.table(),
                toJson(pattern.whereColumns()),
                toJson(pattern.joinColumns()),
                metric.timestamp()).run();
    }

    /** Failed executions are logged so error rates can be derived; they never count as slow. */
    public void recordFailure(String queryId, String sql, double executionTime, String errorMessage,
            QueryPattern pattern, Instant timestamp) {
        db.prepare(SqlLoader.load("insert-query-metric")).bind(
                queryId,
                Digests.queryDigest(sql),
                sql,
                executionTime,
                0,
                0,
                "[]",
                false,
                true,
                errorMessage,
                pattern.statementType(),
                pattern.table(),
                toJson(pattern.whereColumns()),
                toJson(pattern.joinColumns()),
                timestamp).run();
    }

    public QueryWindowStats windowStats(Instant from, Instant to, double slowThresholdMs) {
        Row row = db.prepare(SqlLoader.load("select-window-stats")).bind(slowThresholdMs, from, to).first();
        if (row == null)
            return QueryWindowStats.EMPTY;
        return new QueryWindowStats(
                row.getLong("total_queries"),
                row.getLong("failed_queries"),
                row.getDouble("avg_execution_time"),
                row.getLong("slow_queries"),
                row.getLong("cache_hits"),
                row.getLong("indexed_queries"));
    }

    /** Statements with executions above the threshold, slowest average first. */
    public List<SlowQueryGroup> slowQueryGroups(Instant since, double thresholdMs, int limit) {
        List<SlowQueryGroup> groups = new ArrayList<>();
        for (Row row : db.prepare(SqlLoader.load("select-slow-query-groups")).bind(since, thresholdMs, limit).all()) {
            groups.add(new SlowQueryGroup(
                    row.getString("sql_hash"),
                    row.getString("sql"),
                    row.getInt("execution_count"),
                    row.getDouble("avg_execution_time"),
                    row.getDouble("max_execution_time"),
                    Timestamps.parse(row.getString("last_executed"))));
        }
        return groups;
    }

    /** Matches the quoted index name inside the JSON array, so {@code idx_a} never matches {@code idx_ab}. */
    public IndexUsageStats indexUsage(String indexName, Instant since) {
        Row row = db.prepare(SqlLoader.load("select-index-usage")).bind(since, '"' + indexName + '"').first();
        if (row == null)
            return new IndexUsageStats(0, null, 0.0);
        return new IndexUsageStats(
                row.getInt("usage_count"),
                Timestamps.parse(row.getString("last_used")),
                row.getDouble("avg_execution_time"));
    }

    public List<AccessPattern> frequentWherePatterns(Instant since, int minCount, double minAvgMs) {
        List<AccessPattern> patterns = new ArrayList<>();
        for (Row row : db.prepare(SqlLoader.load("select-frequent-where-patterns"))
                .bind(since, minCount, minAvgMs).all()) {
            patterns.add(new AccessPattern(
                    row.getString("primary_table"),
                    fromJson(row.getString("where_columns"), STRING_LIST),
                    List.of(),
                    row.getInt("usage_count"),
                    row.getDouble("avg_execution_time")));
        }
        return patterns;
    }

    public List<AccessPattern> frequentJoinPatterns(Instant since, int minCount, double minAvgMs) {
        List<AccessPattern> patterns = new ArrayList<>();
        for (Row row : db.prepare(SqlLoader.load("select-frequent-join-patterns"))
                .bind(since, minCount, minAvgMs).all()) {
            patterns.add(new AccessPattern(
                    null,
                    List.of(),
                    fromJson(row.getString("join_columns"), COLUMN_REF_LIST),
                    row.getInt("usage_count"),
                    row.getDouble("avg_execution_time")));
        }
        return patterns;
    }

    /** @return number of deleted log rows */
    public int pruneQueryLog(Instant before) {
        return db.prepare(SqlLoader.load("delete-query-log-before")).bind(before).run().changes();
    }

    // =====================================================================
    // Backup Metadata
    // =====================================================================

    public void saveBackupMetadata(BackupMetadata metadata) {
        db.prepare(SqlLoader.load("insert-backup-metadata")).bind(
                metadata.id(),
                metadata.timestamp(),
                metadata.type().key(),
                metadata.sizeBytes(),
                metadata.compressed(),
                metadata.encrypted(),
                metadata.checksum(),
                toJson(metadata.tables()),
                metadata.recordCount(),
                metadata.version(),
                metadata.status().key(),
                metadata.basedOn()).run();
    }

    public Optional<BackupMetadata> findBackupMetadata(String id) {
        return Optional.ofNullable(db.prepare(SqlLoader.load("select-backup-metadata")).bind(id).first())
                .map(MetricsStore::toBackupMetadata);
    }

    /** Most recent backup row regardless of status. */
    public Optional<BackupMetadata> latestBackup() {
        return Optional.ofNullable(db.prepare(SqlLoader.load("select-latest-backup")).first())
                .map(MetricsStore::toBackupMetadata);
    }

    public Optional<BackupMetadata> latestCompletedBackup() {
        return Optional.ofNullable(db.prepare(SqlLoader.load("select-latest-completed-backup")).first())
                .map(MetricsStore::toBackupMetadata);
    }

    /** All backups, newest first. */
    public List<BackupMetadata> listBackups() {
        return toBackupList(db.prepare(SqlLoader.load("select-all-backups")).all());
    }

    public List<BackupMetadata> backupsOlderThan(Instant cutoff) {
        return toBackupList(db.prepare(SqlLoader.load("select-backups-before")).bind(cutoff).all());
    }

    public boolean deleteBackupMetadata(String id) {
        return db.prepare(SqlLoader.load("delete-backup-metadata")).bind(id).run().changes() > 0;
    }

    private static List<BackupMetadata> toBackupList(List<Row> rows) {
        List<BackupMetadata> backups = new ArrayList<>(rows.size());
        for (Row row : rows) {
            backups.add(toBackupMetadata(row));
        }
        return backups;
    }

    private static BackupMetadata toBackupMetadata(Row row) {
        return new BackupMetadata(
                row.getString("id"),
                Timestamps.parse(row.getString("timestamp")),
                BackupType.fromKey(row.getString("backup_type")),
                row.getLong("size"),
                row.getBoolean("compressed"),
                row.getBoolean("encrypted"),
                row.getString("checksum"),
                fromJson(row.getString("tables"), STRING_LIST),
                row.getLong("record_count"),
                row.getString("version"),
                BackupStatus.fromKey(row.getString("status")),
                Timestamps.parse(row.getString("based_on")));
    }

    // =====================================================================
    // Restore History
    // =====================================================================

    public void saveRestoreRecord(RestoreRecord record) {
        db.prepare(SqlLoader.load("insert-restore-record")).bind(
                record.id(),
                record.backupId(),
                record.restoreType(),
                toJson(record.tables()),
                record.dropExisting(),
                record.status(),
                record.restoredRecords(),
                record.errorMessage(),
                record.startedAt(),
                record.completedAt()).run();
    }

    /** Newest first. */
    public List<RestoreRecord> restoreHistory(int limit) {
        List<RestoreRecord> records = new ArrayList<>();
        for (Row row : db.prepare(SqlLoader.load("select-restore-history")).bind(limit).all()) {
            records.add(new RestoreRecord(
                    row.getString("id"),
                    row.getString("backup_id"),
                    row.getString("restore_type"),
                    fromJson(row.getString("target_tables"), STRING_LIST),
                    row.getBoolean("drop_existing"),
                    row.getLong("restored_records"),
                    row.getString("status"),
                    row.getString("error_message"),
                    Timestamps.parse(row.getString("started_at")),
                    Timestamps.parse(row.getString("completed_at"))));
        }
        return records;
    }

    // =====================================================================
    // Table Statistics
    // =====================================================================

    public void saveTableStatistics(TableStatistics stats) {
        db.prepare(SqlLoader.load("upsert-table-statistics")).bind(
                stats.tableName(),
                stats.rowCount(),
                stats.avgRowSize(),
                stats.indexCount(),
                stats.updatedAt()).run();
    }

    public Optional<TableStatistics> findTableStatistics(String table) {
        return Optional.ofNullable(db.prepare(SqlLoader.load("select-table-statistics")).bind(table).first())
                .map(MetricsStore::toTableStatistics);
    }

    public List<TableStatistics> listTableStatistics() {
        List<TableStatistics> stats = new ArrayList<>();
        for (Row row : db.prepare(SqlLoader.load("select-all-table-statistics")).all()) {
            stats.add(toTableStatistics(row));
        }
        return stats;
    }

    private static TableStatistics toTableStatistics(Row row) {
        return new TableStatistics(
                row.getString("table_name"),
                row.getLong("row_count"),
                row.getLong("avg_row_size"),
                row.getInt("index_count"),
                Timestamps.parse(row.getString("updated_at")));
    }

    // =====================================================================
    // Optimization Suggestions
    // =====================================================================

    /**
     * Persists a suggestion as {@code pending} unless an identical pending one
     * already exists.
     *
     * @return {@code true} if a row was inserted
     */
    public boolean saveSuggestion(OptimizationSuggestion suggestion, String targetQuery, Instant createdAt) {
        String actionSql = suggestion.actionSql();
        Row duplicate = db.prepare(SqlLoader.load("count-pending-duplicate-suggestions")).bind(
                suggestion.type().key(),
                suggestion.message(),
                actionSql == null ? "" : actionSql).first();
        if (duplicate != null && duplicate.getLong("duplicates") > 0)
            return false;

        db.prepare(SqlLoader.load("insert-suggestion")).bind(
                suggestion.type().key(),
                targetQuery,
                titleFor(suggestion),
                suggestion.message(),
                actionSql,
                suggestion.priority().key(),
                null,
                createdAt).run();
        return true;
    }

    private static String titleFor(OptimizationSuggestion suggestion) {
        return switch (suggestion.type()) {
            case INDEX -> "Missing index";
            case REWRITE -> "Query rewrite";
            case CACHE -> "Result caching";
            case PARTITION -> "Table partitioning";
        };
    }

    public SuggestionCounts suggestionCounts() {
        Row row = db.prepare(SqlLoader.load("select-suggestion-counts")).first();
        if (row == null)
            return new SuggestionCounts(0, 0);
        return new SuggestionCounts(row.getInt("pending"), row.getInt("applied"));
    }

    /** Highest priority first, newest first within a priority. */
    public List<StoredSuggestion> listSuggestions(SuggestionStatus status, int limit) {
        List<StoredSuggestion> suggestions = new ArrayList<>();
        for (Row row : db.prepare(SqlLoader.load("select-suggestions-by-status")).bind(status.key(), limit).all()) {
            suggestions.add(toStoredSuggestion(row));
        }
        return suggestions;
    }

    public Optional<StoredSuggestion> findSuggestion(long id) {
        return Optional.ofNullable(db.prepare(SqlLoader.load("select-suggestion")).bind(id).first())
                .map(MetricsStore::toStoredSuggestion);
    }

    public boolean updateSuggestionStatus(long id, SuggestionStatus status, Instant at) {
        Instant appliedAt = status == SuggestionStatus.APPLIED ? at : null;
        return db.prepare(SqlLoader.load("update-suggestion-status"))
                .bind(status.key(), appliedAt, id).run().changes() > 0;
    }

    private static StoredSuggestion toStoredSuggestion(Row row) {
        return new StoredSuggestion(
                row.getLong("id"),
                SuggestionType.fromKey(row.getString("suggestion_type")),
                Priority.fromKey(row.getString("priority")),
                row.getString("target_query_pattern"),
                row.getString("suggestion_description"),
                row.getString("suggested_sql"),
                SuggestionStatus.fromKey(row.getString("status")),
                Timestamps.parse(row.getString("created_at")));
    }

    // =====================================================================
    // Performance Snapshots
    // =====================================================================

    public void saveSnapshot(PerformanceSnapshot snapshot) {
        db.prepare(SqlLoader.load("insert-snapshot")).bind(
                snapshot.type().key(),
                snapshot.totalQueries(),
                snapshot.avgQueryTime(),
                snapshot.slowQueries(),
                snapshot.failedQueries(),
                snapshot.cacheHitRate(),
                snapshot.periodStart(),
                snapshot.periodEnd()).run();
    }

    /** Snapshots whose period ended at or after {@code since}, oldest first. */
    public List<PerformanceSnapshot> snapshotsSince(Instant since) {
        List<PerformanceSnapshot> snapshots = new ArrayList<>();
        for (Row row : db.prepare(SqlLoader.load("select-snapshots-since")).bind(since).all()) {
            snapshots.add(toSnapshot(row));
        }
        return snapshots;
    }

    public Optional<PerformanceSnapshot> latestSnapshot(SnapshotType type) {
        return Optional.ofNullable(db.prepare(SqlLoader.load("select-latest-snapshot")).bind(type.key()).first())
                .map(MetricsStore::toSnapshot);
    }

    private static PerformanceSnapshot toSnapshot(Row row) {
        return new PerformanceSnapshot(
                SnapshotType.fromKey(row.getString("snapshot_type")),
                row.getLong("total_queries"),
                row.getDouble("avg_query_time"),
                row.getLong("slow_queries"),
                row.getLong("failed_queries"),
                row.getDouble("cache_hit_rate"),
                Timestamps.parse(row.getString("period_start")),
                Timestamps.parse(row.getString("period_end")));
    }

    // =====================================================================
    // JSON Columns
    // =====================================================================

    private static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new DatabaseAccessException("Cannot serialize column value", e);
        }
    }

    private static <T> List<T> fromJson(String json, TypeReference<List<T>> type) {
        if (json == null || json.isBlank())
            return List.of();
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new DatabaseAccessException("Corrupt JSON column: " + json, e);
        }
    }
}
