package de.bsommerfeld.dbkeeper.manager;

import de.bsommerfeld.dbkeeper.backup.BackupManager;
import de.bsommerfeld.dbkeeper.backup.FileSystemBackupStorage;
import de.bsommerfeld.dbkeeper.core.config.BackupConfig;
import de.bsommerfeld.dbkeeper.core.config.MonitoringConfig;
import de.bsommerfeld.dbkeeper.core.config.OptimizerConfig;
import de.bsommerfeld.dbkeeper.core.domain.BackupMetadata;
import de.bsommerfeld.dbkeeper.core.domain.HealthLevel;
import de.bsommerfeld.dbkeeper.core.domain.IndexUsage;
import de.bsommerfeld.dbkeeper.core.domain.OptimizationSuggestion;
import de.bsommerfeld.dbkeeper.core.domain.PerformanceSnapshot;
import de.bsommerfeld.dbkeeper.core.domain.Priority;
import de.bsommerfeld.dbkeeper.core.domain.QueryPattern;
import de.bsommerfeld.dbkeeper.core.domain.QueryPerformanceMetric;
import de.bsommerfeld.dbkeeper.core.domain.SnapshotType;
import de.bsommerfeld.dbkeeper.core.domain.StoredSuggestion;
import de.bsommerfeld.dbkeeper.core.domain.SuggestionStatus;
import de.bsommerfeld.dbkeeper.core.domain.SuggestionType;
import de.bsommerfeld.dbkeeper.core.domain.SystemHealthStatus;
import de.bsommerfeld.dbkeeper.core.domain.SystemHealthStatus.BackupState;
import de.bsommerfeld.dbkeeper.core.domain.SystemHealthStatus.DatabaseStatus;
import de.bsommerfeld.dbkeeper.core.event.ApplicationEventBus;
import de.bsommerfeld.dbkeeper.db.MetricsStore;
import de.bsommerfeld.dbkeeper.db.SchemaCatalog;
import de.bsommerfeld.dbkeeper.db.SqlDatabaseService;
import de.bsommerfeld.dbkeeper.optimizer.HeuristicQueryAnalyzer;
import de.bsommerfeld.dbkeeper.optimizer.QueryOptimizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the orchestrator against a real SQLite file with the real optimizer
 * and backup manager underneath.
 */
class DatabaseManagerTest {

    // A Monday
    private static final Instant NOW = Instant.parse("2024-06-03T12:00:00Z");
    private static final String ORDERS_BY_USER = "SELECT * FROM orders WHERE orders.user_id = 1";

    @TempDir
    Path tempDir;

    private SqlDatabaseService db;
    private MetricsStore store;
    private SchemaCatalog catalog;
    private MonitoringConfig monitoringConfig;
    private MutableClock clock;
    private BackupManager backups;
    private DatabaseManager manager;

    @BeforeEach
    void setUp() {
        db = SqlDatabaseService.forFile(tempDir.resolve("test.db"));
        db.applySchema();
        db.execute("CREATE TABLE users (id INTEGER PRIMARY KEY, email TEXT NOT NULL)");
        db.execute("CREATE TABLE orders (id INTEGER PRIMARY KEY, user_id INTEGER, total REAL)");
        db.prepare("INSERT INTO users (email) VALUES (?), (?)").bind("alice@example.com", "bob@example.com").run();
        db.prepare("INSERT INTO orders (user_id, total) VALUES (1, 10.0), (2, 20.0)").run();

        store = new MetricsStore(db);
        catalog = new SchemaCatalog(db);
        clock = new MutableClock(NOW);
        monitoringConfig = new MonitoringConfig();
        BackupConfig backupConfig = new BackupConfig();
        ApplicationEventBus eventBus = new ApplicationEventBus();

        QueryOptimizer optimizer = new QueryOptimizer(db, store, catalog,
                new HeuristicQueryAnalyzer(db, catalog, store), eventBus, new OptimizerConfig(), clock);
        backups = new BackupManager(db, catalog, store, new FileSystemBackupStorage(tempDir.resolve("backups")),
                backupConfig, eventBus, clock);
        manager = new DatabaseManager(db, catalog, store, optimizer, backups, backupConfig, monitoringConfig,
                eventBus, clock);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private void logExecution(String sql, double ms, QueryPattern pattern, Instant at) {
        store.recordExecution(new QueryPerformanceMetric("q", sql, ms, 1, 10, List.of(), false, at), pattern);
    }

    private long count(String table) {
        return db.prepare("SELECT COUNT(*) AS n FROM " + table).first().getLong("n");
    }

    // -- Startup --

    @Test
    void initialize_shouldApplyPragmasAndTakeFirstBackup() {
        manager.initialize();

        assertEquals(1, db.prepare("PRAGMA foreign_keys").first().getLong("foreign_keys"));
        assertEquals("wal", db.prepare("PRAGMA journal_mode").first().getString("journal_mode"));
        assertEquals(1, store.listBackups().size());

        manager.initialize();
        assertEquals(1, store.listBackups().size());
    }

    // -- Health --

    @Test
    void getSystemHealth_shouldBeHealthyWithFreshBackupAndNoTraffic() throws Exception {
        BackupMetadata backup = backups.createFullBackup();

        SystemHealthStatus health = manager.getSystemHealth();

        assertEquals(HealthLevel.HEALTHY, health.overall());
        assertEquals(DatabaseStatus.CONNECTED, health.database().status());
        assertEquals(BackupState.CURRENT, health.backup().status());
        assertEquals(NOW, health.backup().lastBackupTime());
        assertEquals(NOW.plus(Duration.ofHours(24)), health.backup().nextBackupTime());
        assertEquals(backup.sizeBytes(), health.backup().backupSize());
        assertTrue(manager.quickHealthCheck());
    }

    @Test
    void getSystemHealth_shouldWarnWhenBackupIsOverdue() throws Exception {
        backups.createFullBackup();
        clock.advance(Duration.ofHours(24));
        assertEquals(BackupState.CURRENT, manager.getSystemHealth().backup().status());

        clock.advance(Duration.ofHours(2));
        SystemHealthStatus health = manager.getSystemHealth();

        assertEquals(BackupState.OVERDUE, health.backup().status());
        assertEquals(HealthLevel.WARNING, health.overall());
    }

    @Test
    void getSystemHealth_shouldWarnWithoutAnyBackup() {
        SystemHealthStatus health = manager.getSystemHealth();

        assertEquals(BackupState.OVERDUE, health.backup().status());
        assertNull(health.backup().lastBackupTime());
        assertEquals(HealthLevel.WARNING, health.overall());
    }

    @Test
    void getSystemHealth_shouldBeCriticalOnHighErrorRate() throws Exception {
        backups.createFullBackup();
        for (int i = 0; i < 5; i++) {
            logExecution("SELECT 1", 5, QueryPattern.NONE, NOW.minusSeconds(60 + i));
            store.recordFailure("q", "SELECT nope", 1, "no such column: nope", QueryPattern.NONE,
                    NOW.minusSeconds(60 + i));
        }

        SystemHealthStatus health = manager.getSystemHealth();

        assertEquals(50.0, health.database().errorRate(), 0.001);
        assertEquals(DatabaseStatus.ERROR, health.database().status());
        assertEquals(HealthLevel.CRITICAL, health.overall());
    }

    // -- Optimization --

    @Test
    void performComprehensiveOptimization_shouldCreateIndexesAndPersistHighPrioritySuggestions() {
        QueryPattern usersByEmail = new QueryPattern("SELECT", "users", List.of("email"), List.of());
        for (int i = 0; i < 12; i++) {
            logExecution("SELECT * FROM users WHERE email = ?", 150, usersByEmail, NOW.minus(Duration.ofHours(i + 1)));
        }
        QueryPattern ordersByUser = new QueryPattern("SELECT", "orders", List.of("user_id"), List.of());
        for (int i = 0; i < 3; i++) {
            logExecution(ORDERS_BY_USER, 1500, ordersByUser, NOW.minus(Duration.ofHours(i + 1)));
        }

        OptimizationSummary summary = manager.performComprehensiveOptimization();

        assertEquals(1, summary.indexesCreated().size());
        assertTrue(summary.indexesCreated().get(0).contains("idx_users_email_auto"));
        assertTrue(catalog.isCovered("users", List.of("email")));
        assertTrue(summary.statisticsUpdated());
        assertTrue(summary.backupCompleted());
        assertTrue(summary.optimizationsSuggested() >= 2);

        long pending = store.suggestionCounts().pending();
        assertTrue(pending >= 1);
        manager.performComprehensiveOptimization();
        assertEquals(pending, store.suggestionCounts().pending());
    }

    @Test
    void applySuggestion_shouldRunIndexDdlAndMarkApplied() {
        store.saveSuggestion(OptimizationSuggestion.index(Priority.HIGH, "Index orders.user_id",
                "CREATE INDEX idx_orders_user_id ON orders(user_id)"), ORDERS_BY_USER, NOW);
        StoredSuggestion pending = store.listSuggestions(SuggestionStatus.PENDING, 10).get(0);

        StoredSuggestion applied = manager.applySuggestion(pending.id());

        assertEquals(SuggestionStatus.APPLIED, applied.status());
        assertTrue(catalog.isCovered("orders", List.of("user_id")));
        assertEquals(1, manager.getSystemHealth().performance().appliedOptimizations());
        assertThrows(IllegalStateException.class, () -> manager.applySuggestion(pending.id()));
    }

    @Test
    void applySuggestion_shouldRejectRewrites() {
        store.saveSuggestion(OptimizationSuggestion.rewrite(Priority.HIGH, "Add LIMIT", ORDERS_BY_USER + " LIMIT 100"),
                ORDERS_BY_USER, NOW);
        StoredSuggestion pending = store.listSuggestions(SuggestionStatus.PENDING, 10).get(0);
        assertEquals(SuggestionType.REWRITE, pending.type());

        assertThrows(IllegalStateException.class, () -> manager.applySuggestion(pending.id()));
        assertThrows(IllegalArgumentException.class, () -> manager.applySuggestion(9999));
    }

    @Test
    void getPerformanceDashboard_shouldCombineCurrentTrendsAndRecommendations() {
        manager.createPerformanceSnapshot(SnapshotType.HOURLY);
        store.saveSuggestion(OptimizationSuggestion.index(Priority.HIGH, "Index orders.user_id",
                "CREATE INDEX idx_orders_user_id ON orders(user_id)"), ORDERS_BY_USER, NOW);

        PerformanceReport report = manager.getPerformanceDashboard();

        assertEquals(1, report.current().currentConnections());
        assertEquals(1, report.trends().size());
        assertEquals(1, report.recommendations().size());
    }

    // -- Maintenance --

    @Test
    void performRoutineMaintenance_shouldPruneReportAndSnapshot() {
        db.execute("CREATE INDEX idx_orders_total ON orders(total)");
        logExecution("SELECT 1", 5, QueryPattern.NONE, NOW.minus(Duration.ofDays(40)));
        logExecution("SELECT 1", 5, QueryPattern.NONE, NOW.minus(Duration.ofMinutes(5)));

        MaintenanceSummary summary = manager.performRoutineMaintenance();

        assertEquals(1, summary.prunedLogRows());
        assertTrue(summary.unusedIndexes().stream().map(IndexUsage::indexName).anyMatch("idx_orders_total"::equals));
        assertTrue(catalog.objectExists("idx_orders_total"));
        assertTrue(summary.integrityOk());
        assertEquals(1, summary.snapshot().totalQueries());
        assertTrue(store.latestSnapshot(SnapshotType.DAILY).isPresent());
    }

    // -- Recovery --

    @Test
    void emergencyRecovery_shouldTakeSafetyBackupAndRestore() throws Exception {
        BackupMetadata target = backups.createFullBackup();
        db.execute("DELETE FROM users");
        clock.advance(Duration.ofMinutes(1));

        SystemHealthStatus health = manager.emergencyRecovery(target.id());

        assertFalse(health.isCritical());
        assertEquals(2, count("users"));
        assertEquals(2, store.listBackups().size());
    }

    // -- Scheduling --

    @Test
    void onSchedulerTick_shouldOnlyRunWhatIsDue() {
        manager.onSchedulerTick();

        PerformanceSnapshot hourly = store.latestSnapshot(SnapshotType.HOURLY).orElseThrow();
        assertEquals(NOW, hourly.periodEnd());
        assertTrue(store.latestSnapshot(SnapshotType.DAILY).isPresent());
        assertEquals(1, store.listBackups().size());

        clock.advance(Duration.ofMinutes(1));
        manager.onSchedulerTick();
        assertEquals(NOW, store.latestSnapshot(SnapshotType.HOURLY).orElseThrow().periodEnd());
        assertEquals(1, store.listBackups().size());

        clock.advance(Duration.ofMinutes(60));
        manager.onSchedulerTick();
        assertEquals(clock.instant(), store.latestSnapshot(SnapshotType.HOURLY).orElseThrow().periodEnd());
        assertEquals(NOW, store.latestSnapshot(SnapshotType.DAILY).orElseThrow().periodEnd());
    }

    @Test
    void onSchedulerTick_shouldSkipSnapshotsWhenRealTimeStatsDisabled() {
        monitoringConfig.setEnableRealTimeStats(false);

        manager.onSchedulerTick();

        assertTrue(store.latestSnapshot(SnapshotType.HOURLY).isEmpty());
    }
}
