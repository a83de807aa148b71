package de.bsommerfeld.dbkeeper.optimizer;

import de.bsommerfeld.dbkeeper.core.config.OptimizerConfig;
import de.bsommerfeld.dbkeeper.core.domain.IndexUsage;
import de.bsommerfeld.dbkeeper.core.domain.PerformanceDashboard;
import de.bsommerfeld.dbkeeper.core.domain.QueryPerformanceMetric;
import de.bsommerfeld.dbkeeper.core.domain.SlowQueryReport;
import de.bsommerfeld.dbkeeper.core.domain.TableStatistics;
import de.bsommerfeld.dbkeeper.core.event.ApplicationEventBus;
import de.bsommerfeld.dbkeeper.core.event.DbKeeperEvents.SlowQueryDetectedEvent;
import de.bsommerfeld.dbkeeper.db.DatabaseAccessException;
import de.bsommerfeld.dbkeeper.db.MetricsStore;
import de.bsommerfeld.dbkeeper.db.SchemaCatalog;
import de.bsommerfeld.dbkeeper.db.SqlDatabaseService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class QueryOptimizerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private ApplicationEventBus eventBus;

    private SqlDatabaseService db;
    private MetricsStore store;
    private OptimizerConfig config;
    private MutableClock clock;
    private QueryOptimizer optimizer;

    @BeforeEach
    void setUp() {
        db = SqlDatabaseService.inMemory();
        db.applySchema();
        db.execute("CREATE TABLE users (id INTEGER PRIMARY KEY, email TEXT, status TEXT)");
        db.execute("CREATE TABLE orders (id INTEGER PRIMARY KEY, user_id INTEGER, total REAL)");
        db.execute("CREATE INDEX idx_users_status ON users(status)");
        for (int i = 0; i < 5; i++) {
            db.prepare("INSERT INTO users (email, status) VALUES (?, ?)").bind("u" + i + "@example.com", "active").run();
        }
        store = new MetricsStore(db);
        SchemaCatalog catalog = new SchemaCatalog(db);
        config = new OptimizerConfig();
        clock = new MutableClock(NOW);
        optimizer = new QueryOptimizer(db, store, catalog, new HeuristicQueryAnalyzer(db, catalog, store),
                eventBus, config, clock);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    // -- Instrumented Execution --

    @Test
    void executeWithMetrics_shouldReturnRowsAndLogMetric() {
        MeasuredResult measured = optimizer.executeWithMetrics(
                db.prepare("SELECT * FROM users WHERE status = ?").bind("active"));

        assertEquals(5, measured.result().rows().size());
        QueryPerformanceMetric metric = measured.metric();
        assertEquals(5, metric.rowsReturned());
        assertEquals(10, metric.rowsScanned());
        assertEquals(List.of("idx_users_status"), metric.indexesUsed());
        assertFalse(metric.cacheHit());
        assertEquals(NOW, metric.timestamp());
        assertEquals(1, store.windowStats(NOW.minusSeconds(60), NOW, 1000).totalQueries());
        verify(eventBus, never()).post(any());
    }

    @Test
    void executeWithMetrics_shouldEstimateTenfoldScanWithoutWhere() {
        QueryPerformanceMetric metric = optimizer.executeWithMetrics(db.prepare("SELECT id FROM users")).metric();
        assertEquals(50, metric.rowsScanned());
        assertTrue(metric.indexesUsed().isEmpty());
    }

    @Test
    void executeWithMetrics_shouldUseSqlDigestAsDefaultQueryId() {
        QueryPerformanceMetric metric = optimizer.executeWithMetrics(db.prepare("SELECT 1")).metric();
        assertEquals(16, metric.queryId().length());
        assertEquals("report-q", optimizer.executeWithMetrics(db.prepare("SELECT 1"),
                new ExecutionOptions("report-q", null)).metric().queryId());
    }

    @Test
    void executeWithMetrics_shouldLogFailureAndRethrow() {
        assertThrows(DatabaseAccessException.class,
                () -> optimizer.executeWithMetrics(db.prepare("SELECT * FROM missing_table")));

        var stats = store.windowStats(NOW.minusSeconds(60), NOW, 1000);
        assertEquals(1, stats.totalQueries());
        assertEquals(1, stats.failedQueries());
    }

    @Test
    void executeWithMetrics_shouldPostEventForSlowQueries() {
        config.setSlowQueryThresholdMs(-1);

        QueryPerformanceMetric metric = optimizer.executeWithMetrics(db.prepare("SELECT 1")).metric();

        verify(eventBus).post(new SlowQueryDetectedEvent(metric, -1));
    }

    @Test
    void executeWithMetrics_shouldNotPersistWhenLoggingDisabled() {
        config.setEnableLogging(false);
        optimizer.executeWithMetrics(db.prepare("SELECT 1"));
        assertEquals(0, store.windowStats(NOW.minusSeconds(60), NOW, 1000).totalQueries());
    }

    // -- Metrics Cache --

    @Test
    void executeWithMetrics_shouldServeCacheHitWithFreshResult() {
        optimizer.executeWithMetrics(db.prepare("SELECT * FROM users WHERE status = ?").bind("active"),
                ExecutionOptions.cached("active-users"));
        db.prepare("INSERT INTO users (email, status) VALUES (?, ?)").bind("new@example.com", "active").run();
        clock.advance(Duration.ofMinutes(4));

        MeasuredResult hit = optimizer.executeWithMetrics(
                db.prepare("SELECT * FROM users WHERE status = ?").bind("active"),
                ExecutionOptions.cached("active-users"));

        assertTrue(hit.metric().cacheHit());
        assertEquals(6, hit.result().rows().size());
        assertEquals(List.of("idx_users_status"), hit.metric().indexesUsed());
        assertEquals(10, hit.metric().rowsScanned());
        assertEquals(NOW.plus(Duration.ofMinutes(4)), hit.metric().timestamp());
    }

    @Test
    void executeWithMetrics_shouldTreatExpiredCacheEntryAsMiss() {
        optimizer.executeWithMetrics(db.prepare("SELECT 1"), ExecutionOptions.cached("k"));
        clock.advance(Duration.ofMinutes(5));

        assertFalse(optimizer.executeWithMetrics(db.prepare("SELECT 1"), ExecutionOptions.cached("k"))
                .metric().cacheHit());
    }

    @Test
    void clearMetricsCache_shouldDropAllEntries() {
        optimizer.executeWithMetrics(db.prepare("SELECT 1"), ExecutionOptions.cached("k"));
        assertEquals(1, optimizer.metricsCacheSize());
        optimizer.clearMetricsCache();
        assertEquals(0, optimizer.metricsCacheSize());
    }

    // -- Reports --

    @Test
    void generateSlowQueryReport_shouldGroupFiftyExecutionsIntoOneReport() {
        String sql = "SELECT * FROM orders WHERE orders.user_id = ?";
        for (int i = 0; i < 50; i++) {
            Instant at = NOW.minus(Duration.ofMinutes(120)).plus(Duration.ofSeconds(144L * i));
            store.recordExecution(new QueryPerformanceMetric("q", sql, 1400 + (i % 2) * 200, 1, 2, List.of(),
                    false, at), SqlPatternExtractor.extract(sql).toPattern());
        }

        List<SlowQueryReport> reports = optimizer.generateSlowQueryReport(1);

        assertEquals(1, reports.size());
        SlowQueryReport report = reports.get(0);
        assertEquals(50, report.totalExecutions());
        assertEquals(1500.0, report.avgExecutionTime(), 0.001);
        assertEquals(1600.0, report.maxExecutionTime(), 0.001);
        assertFalse(report.suggestions().isEmpty());
    }

    @Test
    void effectivenessScore_shouldBeMonotonic() {
        for (double avg : new double[] { 0, 250, 4000, 10000 }) {
            double previous = -1;
            for (int usage = 0; usage <= 300; usage += 10) {
                double score = QueryOptimizer.effectivenessScore(usage, avg);
                assertTrue(score >= previous);
                assertTrue(score >= 0 && score <= 100);
                previous = score;
            }
        }
        for (int usage : new int[] { 0, 40, 100, 500 }) {
            double previous = Double.MAX_VALUE;
            for (double avg = 0; avg <= 8000; avg += 250) {
                double score = QueryOptimizer.effectivenessScore(usage, avg);
                assertTrue(score <= previous);
                previous = score;
            }
        }
        assertEquals(100.0, QueryOptimizer.effectivenessScore(100, 0), 0.001);
    }

    @Test
    void analyzeIndexUsage_shouldReportUnusedUserIndexesOnly() {
        db.execute("CREATE INDEX idx_orders_user_id ON orders(user_id)");
        optimizer.executeWithMetrics(db.prepare("SELECT * FROM users WHERE status = ?").bind("active"));

        List<IndexUsage> usage = optimizer.analyzeIndexUsage(7);

        assertEquals(List.of("idx_users_status", "idx_orders_user_id"),
                usage.stream().map(IndexUsage::indexName).toList());
        assertEquals(1, usage.get(0).usageCount());
        assertTrue(usage.get(1).isUnused());
        assertNull(usage.get(1).lastUsed());
    }

    @Test
    void suggestAutoIndexes_shouldEmitDdlForRecurringSlowPatterns() {
        String whereSql = "SELECT * FROM users WHERE email = ?";
        String joinSql = "SELECT * FROM orders o JOIN users u ON o.user_id = u.id";
        for (int i = 0; i < 10; i++) {
            store.recordExecution(new QueryPerformanceMetric("w", whereSql, 150, 1, 2, List.of(), false,
                    NOW.minusSeconds(i)), SqlPatternExtractor.extract(whereSql).toPattern());
        }
        for (int i = 0; i < 5; i++) {
            store.recordExecution(new QueryPerformanceMetric("j", joinSql, 250, 1, 2, List.of(), false,
                    NOW.minusSeconds(i)), SqlPatternExtractor.extract(joinSql).toPattern());
        }

        List<String> ddl = optimizer.suggestAutoIndexes();

        assertEquals(List.of(
                "CREATE INDEX IF NOT EXISTS \"idx_users_email_auto\" ON \"users\"(\"email\")",
                "CREATE INDEX IF NOT EXISTS \"idx_orders_user_id_join_auto\" ON \"orders\"(\"user_id\")"), ddl);

        ddl.forEach(db::execute);
        assertTrue(optimizer.suggestAutoIndexes().isEmpty());
    }

    @Test
    void updateDatabaseStatistics_shouldRecordEveryUserTable() {
        assertEquals(2, optimizer.updateDatabaseStatistics());

        TableStatistics users = store.findTableStatistics("users").orElseThrow();
        assertEquals(5, users.rowCount());
        assertTrue(users.avgRowSize() > 0);
        assertEquals(1, users.indexCount());
        assertEquals(0, store.findTableStatistics("orders").orElseThrow().rowCount());
    }

    @Test
    void getPerformanceDashboardData_shouldTruncateLongQueries() {
        String longSql = "SELECT * FROM users WHERE email = ? AND status = ? /* " + "x".repeat(200) + " */";
        store.recordExecution(new QueryPerformanceMetric("q", longSql, 3000, 1, 2, List.of(), false,
                NOW.minusSeconds(30)), SqlPatternExtractor.extract(longSql).toPattern());
        store.recordExecution(new QueryPerformanceMetric("q", "SELECT 1", 10, 1, 10, List.of(), true,
                NOW.minusSeconds(30)), SqlPatternExtractor.extract("SELECT 1").toPattern());

        PerformanceDashboard dashboard = optimizer.getPerformanceDashboardData();

        assertEquals(1, dashboard.currentConnections());
        assertEquals(1, dashboard.slowQueries());
        assertEquals(50.0, dashboard.cacheHitRate(), 0.001);
        assertEquals(1, dashboard.topSlowQueries().size());
        assertEquals(103, dashboard.topSlowQueries().get(0).query().length());
        assertTrue(dashboard.topSlowQueries().get(0).query().endsWith("..."));
    }
}
