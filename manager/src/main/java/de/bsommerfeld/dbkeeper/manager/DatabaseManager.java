package de.bsommerfeld.dbkeeper.manager;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.dbkeeper.backup.BackupException;
import de.bsommerfeld.dbkeeper.backup.BackupManager;
import de.bsommerfeld.dbkeeper.backup.RestoreOptions;
import de.bsommerfeld.dbkeeper.core.config.BackupConfig;
import de.bsommerfeld.dbkeeper.core.config.MonitoringConfig;
import de.bsommerfeld.dbkeeper.core.domain.BackupMetadata;
import de.bsommerfeld.dbkeeper.core.domain.HealthLevel;
import de.bsommerfeld.dbkeeper.core.domain.IndexUsage;
import de.bsommerfeld.dbkeeper.core.domain.OptimizationSuggestion;
import de.bsommerfeld.dbkeeper.core.domain.PerformanceSnapshot;
import de.bsommerfeld.dbkeeper.core.domain.Priority;
import de.bsommerfeld.dbkeeper.core.domain.QueryWindowStats;
import de.bsommerfeld.dbkeeper.core.domain.SlowQueryReport;
import de.bsommerfeld.dbkeeper.core.domain.SnapshotType;
import de.bsommerfeld.dbkeeper.core.domain.StoredSuggestion;
import de.bsommerfeld.dbkeeper.core.domain.SuggestionStatus;
import de.bsommerfeld.dbkeeper.core.domain.SuggestionType;
import de.bsommerfeld.dbkeeper.core.domain.SystemHealthStatus;
import de.bsommerfeld.dbkeeper.core.domain.SystemHealthStatus.BackupHealth;
import de.bsommerfeld.dbkeeper.core.domain.SystemHealthStatus.BackupState;
import de.bsommerfeld.dbkeeper.core.domain.SystemHealthStatus.DatabaseHealth;
import de.bsommerfeld.dbkeeper.core.domain.SystemHealthStatus.DatabaseStatus;
import de.bsommerfeld.dbkeeper.core.domain.SystemHealthStatus.PerformanceHealth;
import de.bsommerfeld.dbkeeper.core.event.ApplicationEventBus;
import de.bsommerfeld.dbkeeper.core.event.DbKeeperEvents.RestoreCompletedEvent;
import de.bsommerfeld.dbkeeper.db.DatabaseAccessException;
import de.bsommerfeld.dbkeeper.db.DatabaseService;
import de.bsommerfeld.dbkeeper.db.MetricsStore;
import de.bsommerfeld.dbkeeper.db.Row;
import de.bsommerfeld.dbkeeper.db.SchemaCatalog;
import de.bsommerfeld.dbkeeper.db.SuggestionCounts;
import de.bsommerfeld.dbkeeper.optimizer.QueryOptimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Orchestrates the optimizer and the backup manager: startup, composite
 * health, comprehensive optimization, routine maintenance and emergency
 * recovery.
 *
 * <h3>Health</h3>
 * <ul>
 * <li>{@code CRITICAL}: database {@code ERROR} or backup {@code FAILED}, and
 * whenever the check itself throws</li>
 * <li>{@code WARNING}: database {@code SLOW}, backup {@code OVERDUE}, cache hit
 * rate below 50 % or index efficiency below 70 %</li>
 * <li>{@code HEALTHY}: otherwise</li>
 * </ul>
 *
 * <h3>Scheduling</h3>
 * There is no timer thread in here. {@link #onSchedulerTick()} is meant to be
 * called periodically by whoever hosts the manager, and decides from the
 * persisted snapshots what is due.
 */
@Singleton
public class DatabaseManager {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseManager.class);

    static final List<String> ENGINE_PRAGMAS = List.of(
            "PRAGMA journal_mode = WAL",
            "PRAGMA synchronous = NORMAL",
            "PRAGMA cache_size = 10000",
            "PRAGMA foreign_keys = ON",
            "PRAGMA temp_store = MEMORY");

    static final Duration HEALTH_WINDOW = Duration.ofHours(1);
    static final Duration BACKUP_GRACE = Duration.ofHours(1);
    static final double SLOW_CONNECTION_MS = 1000;
    static final double SLOW_AVERAGE_MS = 2000;
    static final double ERROR_RATE_LIMIT = 5;
    static final double MIN_CACHE_HIT_RATE = 50;
    static final double MIN_INDEX_EFFICIENCY = 70;

    static final int SLOW_REPORT_DAYS = 7;
    static final int INDEX_USAGE_DAYS = 30;
    static final int RECOMMENDATION_LIMIT = 10;
    static final Duration TREND_WINDOW = Duration.ofHours(24);
    static final Duration AUTO_OPTIMIZATION_INTERVAL = Duration.ofDays(1);

    private final DatabaseService db;
    private final SchemaCatalog catalog;
    private final MetricsStore store;
    private final QueryOptimizer optimizer;
    private final BackupManager backupManager;
    private final BackupConfig backupConfig;
    private final MonitoringConfig monitoringConfig;
    private final Clock clock;

    private Instant lastAutoOptimization;

    @Inject
    public DatabaseManager(DatabaseService db, SchemaCatalog catalog, MetricsStore store, QueryOptimizer optimizer,
            BackupManager backupManager, BackupConfig backupConfig, MonitoringConfig monitoringConfig,
            ApplicationEventBus eventBus, Clock clock) {
        this.db = db;
        this.catalog = catalog;
        this.store = store;
        this.optimizer = optimizer;
        this.backupManager = backupManager;
        this.backupConfig = backupConfig;
        this.monitoringConfig = monitoringConfig;
        this.clock = clock;
        eventBus.register(this);
    }

    // =====================================================================
    // Startup
    // =====================================================================

    /**
     * Checks the system tables, applies engine pragmas and takes a first full
     * backup when none exists. Missing system tables are reported, not
     * created.
     */
    public void initialize() {
        LOG.info("Initializing database manager...");
        ensureSystemTables();
        applyEnginePragmas();
        checkBackupStatus();
        if (monitoringConfig.isAutoOptimization())
            LOG.info("Automatic optimization enabled, runs at most once per day");
        LOG.info("Database manager initialized.");
    }

    private void ensureSystemTables() {
        for (String table : SchemaCatalog.SYSTEM_TABLES) {
            if (!catalog.tableExists(table))
                LOG.warn("[DB] Required system table missing: {}", table);
        }
    }

    private void applyEnginePragmas() {
        for (String pragma : ENGINE_PRAGMAS) {
            try {
                db.execute(pragma);
            } catch (DatabaseAccessException e) {
                LOG.warn("[DB] Could not apply {}: {}", pragma, e.getMessage());
            }
        }
    }

    private void checkBackupStatus() {
        try {
            Optional<BackupMetadata> last = store.latestBackup();
            if (last.isEmpty()) {
                LOG.info("[Backup] No backup history, taking a first full backup");
                backupManager.createFullBackup();
                return;
            }
            Duration age = Duration.between(last.get().timestamp(), clock.instant());
            if (age.compareTo(backupConfig.getSchedule().interval()) > 0)
                LOG.info("[Backup] Last backup is {} hours old", age.toHours());
        } catch (BackupException | DatabaseAccessException e) {
            LOG.warn("[Backup] Backup status check failed: {}", e.getMessage());
        }
    }

    // =====================================================================
    // Health
    // =====================================================================

    /**
     * Never throws. A failing check reports {@link SystemHealthStatus#critical()}.
     */
    public SystemHealthStatus getSystemHealth() {
        try {
            Instant now = clock.instant();
            QueryWindowStats stats = store.windowStats(now.minus(HEALTH_WINDOW), now,
                    optimizer.slowQueryThresholdMs());
            DatabaseHealth database = checkDatabaseHealth(stats);
            BackupHealth backup = checkBackupHealth(now);
            PerformanceHealth performance = checkPerformanceHealth(stats);
            return new SystemHealthStatus(evaluateOverall(database, backup, performance), database, backup,
                    performance);
        } catch (RuntimeException e) {
            LOG.error("[Health] System health check failed", e);
            return SystemHealthStatus.critical();
        }
    }

    /** Whether a trivial statement round-trips in under a second. */
    public boolean quickHealthCheck() {
        try {
            return probeConnection() < SLOW_CONNECTION_MS;
        } catch (RuntimeException e) {
            LOG.warn("[Health] Connectivity probe failed: {}", e.getMessage());
            return false;
        }
    }

    private double probeConnection() {
        long start = System.nanoTime();
        db.prepare("SELECT 1").first();
        return (System.nanoTime() - start) / 1_000_000.0;
    }

    private DatabaseHealth checkDatabaseHealth(QueryWindowStats stats) {
        double connectionMs = probeConnection();
        double errorRate = stats.errorRate();

        DatabaseStatus status = DatabaseStatus.CONNECTED;
        if (connectionMs > SLOW_CONNECTION_MS || stats.avgExecutionTime() > SLOW_AVERAGE_MS)
            status = DatabaseStatus.SLOW;
        if (errorRate > ERROR_RATE_LIMIT)
            status = DatabaseStatus.ERROR;
        return new DatabaseHealth(status, connectionMs, stats.avgExecutionTime(), stats.slowQueries(), errorRate);
    }

    private BackupHealth checkBackupHealth(Instant now) {
        try {
            Optional<BackupMetadata> last = store.latestCompletedBackup();
            if (last.isEmpty())
                return new BackupHealth(BackupState.OVERDUE, null, null, 0);

            BackupMetadata backup = last.get();
            Duration allowed = backupConfig.getSchedule().interval().plus(BACKUP_GRACE);
            BackupState state = Duration.between(backup.timestamp(), now).compareTo(allowed) > 0
                    ? BackupState.OVERDUE
                    : BackupState.CURRENT;
            return new BackupHealth(state, backup.timestamp(), backupManager.nextBackupTime(backup.timestamp()),
                    backup.sizeBytes());
        } catch (DatabaseAccessException e) {
            LOG.error("[Health] Backup check failed: {}", e.getMessage());
            return new BackupHealth(BackupState.FAILED, null, null, 0);
        }
    }

    private PerformanceHealth checkPerformanceHealth(QueryWindowStats stats) {
        SuggestionCounts counts = store.suggestionCounts();
        return new PerformanceHealth(stats.cacheHitRate(), stats.indexEfficiency(), counts.pending(),
                counts.applied());
    }

    static HealthLevel evaluateOverall(DatabaseHealth database, BackupHealth backup, PerformanceHealth performance) {
        if (database.status() == DatabaseStatus.ERROR || backup.status() == BackupState.FAILED)
            return HealthLevel.CRITICAL;
        if (database.status() == DatabaseStatus.SLOW
                || backup.status() == BackupState.OVERDUE
                || performance.cacheHitRate() < MIN_CACHE_HIT_RATE
                || performance.indexEfficiency() < MIN_INDEX_EFFICIENCY)
            return HealthLevel.WARNING;
        return HealthLevel.HEALTHY;
    }

    // =====================================================================
    // Optimization
    // =====================================================================

    /**
     * Creates the auto-suggested indexes, refreshes statistics, runs the
     * backup schedule and persists the high-priority suggestions of the
     * last week's slow queries. A failing index does not stop the others.
     *
     * @throws DatabaseAccessException if mining the query log fails
     */
    public OptimizationSummary performComprehensiveOptimization() {
        LOG.info("[Optimizer] Comprehensive optimization started...");

        List<String> created = new ArrayList<>();
        for (String ddl : optimizer.suggestAutoIndexes()) {
            try {
                db.execute(ddl);
                created.add(ddl);
                LOG.info("[Optimizer] Created index: {}", ddl);
            } catch (DatabaseAccessException e) {
                LOG.warn("[Optimizer] Index creation failed: {} ({})", ddl, e.getMessage());
            }
        }

        boolean statisticsUpdated = false;
        try {
            optimizer.updateDatabaseStatistics();
            statisticsUpdated = true;
        } catch (DatabaseAccessException e) {
            LOG.warn("[Optimizer] Statistics refresh failed: {}", e.getMessage());
        }

        boolean backupCompleted = backupManager.scheduleAutomaticBackup().isPresent();

        Instant now = clock.instant();
        int suggested = 0;
        int persisted = 0;
        for (SlowQueryReport report : optimizer.generateSlowQueryReport(SLOW_REPORT_DAYS)) {
            suggested += report.suggestions().size();
            for (OptimizationSuggestion suggestion : report.suggestions()) {
                if (suggestion.priority() == Priority.HIGH && store.saveSuggestion(suggestion, report.query(), now))
                    persisted++;
            }
        }

        OptimizationSummary summary = new OptimizationSummary(created, statisticsUpdated, backupCompleted, suggested);
        LOG.info("[Optimizer] Comprehensive optimization done: {} indexes, {} suggestions ({} new high priority)",
                created.size(), suggested, persisted);
        return summary;
    }

    /**
     * Executes the DDL of a pending index suggestion and marks it applied.
     * Rewrite suggestions change caller SQL and cannot be applied here.
     *
     * @throws IllegalArgumentException if no suggestion has this id
     * @throws IllegalStateException    if the suggestion is not a pending index suggestion
     */
    public StoredSuggestion applySuggestion(long id) {
        StoredSuggestion suggestion = store.findSuggestion(id)
                .orElseThrow(() -> new IllegalArgumentException("No suggestion with id " + id));
        if (suggestion.status() != SuggestionStatus.PENDING)
            throw new IllegalStateException("Suggestion " + id + " is " + suggestion.status().key());
        if (suggestion.type() != SuggestionType.INDEX || suggestion.suggestedSql() == null)
            throw new IllegalStateException("Suggestion " + id + " has no index DDL to apply");

        db.execute(suggestion.suggestedSql());
        store.updateSuggestionStatus(id, SuggestionStatus.APPLIED, clock.instant());
        LOG.info("[Optimizer] Applied suggestion {}: {}", id, suggestion.suggestedSql());
        return store.findSuggestion(id).orElseThrow();
    }

    public void rejectSuggestion(long id) {
        if (!store.updateSuggestionStatus(id, SuggestionStatus.REJECTED, clock.instant()))
            throw new IllegalArgumentException("No suggestion with id " + id);
    }

    public PerformanceReport getPerformanceDashboard() {
        Instant now = clock.instant();
        return new PerformanceReport(
                optimizer.getPerformanceDashboardData(),
                store.snapshotsSince(now.minus(TREND_WINDOW)),
                store.listSuggestions(SuggestionStatus.PENDING, RECOMMENDATION_LIMIT));
    }

    // =====================================================================
    // Maintenance
    // =====================================================================

    /**
     * Prunes the query log, reports unused indexes, runs an integrity check and
     * records a daily snapshot.
     */
    public MaintenanceSummary performRoutineMaintenance() {
        LOG.info("Routine maintenance started...");
        Instant now = clock.instant();

        int pruned = store.pruneQueryLog(now.minus(Duration.ofDays(monitoringConfig.getLogRetentionDays())));
        if (pruned > 0)
            LOG.info("[DB] Pruned {} query log rows", pruned);

        List<IndexUsage> unused = optimizer.analyzeIndexUsage(INDEX_USAGE_DAYS).stream()
                .filter(IndexUsage::isUnused)
                .collect(Collectors.toList());
        if (!unused.isEmpty()) {
            LOG.warn("[Optimizer] {} unused indexes: {}", unused.size(),
                    unused.stream().map(IndexUsage::indexName).collect(Collectors.joining(", ")));
        }

        boolean integrityOk = checkIntegrity();
        PerformanceSnapshot snapshot = createPerformanceSnapshot(SnapshotType.DAILY);

        LOG.info("Routine maintenance done.");
        return new MaintenanceSummary(pruned, unused, integrityOk, snapshot);
    }

    private boolean checkIntegrity() {
        List<Row> rows = db.prepare("PRAGMA integrity_check").all();
        boolean ok = rows.size() == 1 && "ok".equalsIgnoreCase(rows.get(0).getString("integrity_check"));
        if (!ok) {
            LOG.error("[DB] Integrity check reported problems: {}",
                    rows.stream().map(r -> r.getString("integrity_check")).collect(Collectors.joining("; ")));
        }
        return ok;
    }

    /** Aggregates the query log over the snapshot type's period ending now. */
    public PerformanceSnapshot createPerformanceSnapshot(SnapshotType type) {
        Instant end = clock.instant();
        Instant start = end.minus(type.period());
        QueryWindowStats stats = store.windowStats(start, end, optimizer.slowQueryThresholdMs());
        PerformanceSnapshot snapshot = new PerformanceSnapshot(type, stats.totalQueries(), stats.avgExecutionTime(),
                stats.slowQueries(), stats.failedQueries(), stats.cacheHitRate(), start, end);
        store.saveSnapshot(snapshot);
        LOG.debug("[DB] Recorded {} snapshot: {} queries", type.key(), stats.totalQueries());
        return snapshot;
    }

    // =====================================================================
    // Recovery
    // =====================================================================

    /**
     * Takes a safety backup of the current state, replaces all user tables
     * with the given backup and re-evaluates health.
     *
     * @throws BackupException         if the safety backup or the restore fails
     * @throws RecoveryFailedException if health is still critical afterwards
     */
    public SystemHealthStatus emergencyRecovery(String backupId) throws BackupException, RecoveryFailedException {
        LOG.warn("[Backup] Emergency recovery from {} started", backupId);
        BackupMetadata safety = backupManager.createFullBackup();
        LOG.info("[Backup] Safety backup of current state: {}", safety.id());

        backupManager.restoreFromBackup(backupId, RestoreOptions.replaceAll());

        SystemHealthStatus health = getSystemHealth();
        if (health.isCritical()) {
            LOG.error("[Backup] Emergency recovery from {} left the system critical", backupId);
            throw new RecoveryFailedException(backupId, safety.id(), health);
        }
        LOG.info("[Backup] Emergency recovery from {} completed, health {}", backupId, health.overall());
        return health;
    }

    // =====================================================================
    // Scheduling
    // =====================================================================

    /**
     * One cooperative scheduler step. Writes the hourly snapshot and daily
     * maintenance when due, runs the backup schedule and, if enabled, a daily
     * comprehensive optimization. Never throws.
     */
    public void onSchedulerTick() {
        Instant now = clock.instant();

        if (monitoringConfig.isEnableRealTimeStats()
                && isDue(SnapshotType.HOURLY, Duration.ofMinutes(monitoringConfig.getSnapshotIntervalMinutes()), now)) {
            runSafely("hourly snapshot", () -> createPerformanceSnapshot(SnapshotType.HOURLY));
        }

        backupManager.scheduleAutomaticBackup();

        if (isDue(SnapshotType.DAILY, SnapshotType.DAILY.period(), now))
            runSafely("routine maintenance", this::performRoutineMaintenance);

        if (monitoringConfig.isAutoOptimization() && (lastAutoOptimization == null
                || Duration.between(lastAutoOptimization, now).compareTo(AUTO_OPTIMIZATION_INTERVAL) >= 0)) {
            lastAutoOptimization = now;
            runSafely("automatic optimization", this::performComprehensiveOptimization);
        }
    }

    private boolean isDue(SnapshotType type, Duration interval, Instant now) {
        try {
            return store.latestSnapshot(type)
                    .map(last -> Duration.between(last.periodEnd(), now).compareTo(interval) >= 0)
                    .orElse(true);
        } catch (DatabaseAccessException e) {
            LOG.error("[DB] Cannot read latest {} snapshot: {}", type.key(), e.getMessage());
            return false;
        }
    }

    private static void runSafely(String task, Runnable work) {
        try {
            work.run();
        } catch (RuntimeException e) {
            LOG.error("Scheduled {} failed", task, e);
        }
    }

    // =====================================================================
    // Events
    // =====================================================================

    @Subscribe
    public void onRestoreCompleted(RestoreCompletedEvent event) {
        LOG.info("[Optimizer] Restore from {} completed, clearing metrics cache", event.backupId());
        optimizer.clearMetricsCache();
    }
}
