package de.bsommerfeld.dbkeeper.optimizer;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.dbkeeper.core.config.OptimizerConfig;
import de.bsommerfeld.dbkeeper.core.domain.IndexUsage;
import de.bsommerfeld.dbkeeper.core.domain.OptimizationSuggestion;
import de.bsommerfeld.dbkeeper.core.domain.PerformanceDashboard;
import de.bsommerfeld.dbkeeper.core.domain.PerformanceDashboard.TopSlowQuery;
import de.bsommerfeld.dbkeeper.core.domain.QueryPattern.ColumnRef;
import de.bsommerfeld.dbkeeper.core.domain.QueryPerformanceMetric;
import de.bsommerfeld.dbkeeper.core.domain.QueryWindowStats;
import de.bsommerfeld.dbkeeper.core.domain.SlowQueryReport;
import de.bsommerfeld.dbkeeper.core.domain.TableStatistics;
import de.bsommerfeld.dbkeeper.core.event.ApplicationEventBus;
import de.bsommerfeld.dbkeeper.core.event.DbKeeperEvents.SlowQueryDetectedEvent;
import de.bsommerfeld.dbkeeper.core.util.Digests;
import de.bsommerfeld.dbkeeper.db.AccessPattern;
import de.bsommerfeld.dbkeeper.db.ColumnInfo;
import de.bsommerfeld.dbkeeper.db.DatabaseAccessException;
import de.bsommerfeld.dbkeeper.db.DatabaseService;
import de.bsommerfeld.dbkeeper.db.IndexDefinition;
import de.bsommerfeld.dbkeeper.db.IndexUsageStats;
import de.bsommerfeld.dbkeeper.db.MetricsStore;
import de.bsommerfeld.dbkeeper.db.PreparedQuery;
import de.bsommerfeld.dbkeeper.db.QueryResult;
import de.bsommerfeld.dbkeeper.db.Row;
import de.bsommerfeld.dbkeeper.db.SchemaCatalog;
import de.bsommerfeld.dbkeeper.db.SlowQueryGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Instrumented statement execution and query-performance analysis.
 *
 * <h3>Metrics cache</h3>
 * With a {@code cacheKey} the statement still executes, so results are always
 * current. A cached metric younger than the TTL supplies the plan-derived
 * fields (index names, scan estimate) and the fresh metric is tagged
 * {@code cacheHit}. Expired entries are dropped on lookup.
 *
 * <h3>Failure semantics</h3>
 * Statement failures propagate after a failed row is logged. Everything the
 * optimizer adds on top (plan introspection, metric logging, slow-query
 * handling) is best-effort and only logged when it fails.
 */
@Singleton
public class QueryOptimizer {

    private static final Logger LOG = LoggerFactory.getLogger(QueryOptimizer.class);

    static final int SLOW_REPORT_LIMIT = 20;
    static final int DASHBOARD_TOP_QUERIES = 5;
    static final int DASHBOARD_QUERY_CHARS = 100;
    static final Duration AUTO_INDEX_WINDOW = Duration.ofDays(30);
    static final int WHERE_MIN_OCCURRENCES = 10;
    static final double WHERE_MIN_AVG_MS = 100;
    static final int JOIN_MIN_OCCURRENCES = 5;
    static final double JOIN_MIN_AVG_MS = 200;
    static final int STATISTICS_SAMPLE_ROWS = 1000;

    private static final Pattern PLAN_INDEX = Pattern.compile("USING (?:COVERING )?INDEX (\\S+)");

    private final DatabaseService db;
    private final MetricsStore store;
    private final SchemaCatalog catalog;
    private final QueryAnalyzer analyzer;
    private final ApplicationEventBus eventBus;
    private final OptimizerConfig config;
    private final Clock clock;
    private final Map<String, QueryPerformanceMetric> metricsCache = new ConcurrentHashMap<>();

    @Inject
    public QueryOptimizer(DatabaseService db, MetricsStore store, SchemaCatalog catalog, QueryAnalyzer analyzer,
            ApplicationEventBus eventBus, OptimizerConfig config, Clock clock) {
        this.db = db;
        this.store = store;
        this.catalog = catalog;
        this.analyzer = analyzer;
        this.eventBus = eventBus;
        this.config = config;
        this.clock = clock;
    }

    public double slowQueryThresholdMs() {
        return config.getSlowQueryThresholdMs();
    }

    // =====================================================================
    // Instrumented Execution
    // =====================================================================

    public MeasuredResult executeWithMetrics(PreparedQuery query) {
        return executeWithMetrics(query, ExecutionOptions.NONE);
    }

    /**
     * Executes the statement once and measures it.
     *
     * @throws DatabaseAccessException if the statement itself fails
     */
    public MeasuredResult executeWithMetrics(PreparedQuery query, ExecutionOptions options) {
        String sql = query.sql();
        String queryId = options.queryId() != null ? options.queryId() : Digests.queryDigest(sql);
        QueryPerformanceMetric cached = cachedMetric(options.cacheKey());

        long start = System.nanoTime();
        QueryResult result;
        try {
            result = query.run();
        } catch (DatabaseAccessException e) {
            double elapsed = elapsedMillis(start);
            LOG.error("[Optimizer] Query {} failed after {} ms: {}", queryId, String.format("%.2f", elapsed),
                    e.getMessage());
            logFailure(queryId, sql, elapsed, e);
            throw e;
        }
        double elapsed = elapsedMillis(start);
        Instant finished = clock.instant();
        int rowsReturned = result.rows().size();

        QueryPerformanceMetric metric;
        if (cached != null) {
            metric = new QueryPerformanceMetric(queryId, sql, elapsed, rowsReturned, cached.rowsScanned(),
                    cached.indexesUsed(), true, finished);
        } else {
            metric = new QueryPerformanceMetric(queryId, sql, elapsed, rowsReturned,
                    estimateRowsScanned(sql, rowsReturned), indexesUsed(sql, query.params()), false, finished);
            if (options.cacheKey() != null)
                metricsCache.put(options.cacheKey(), metric);
        }
        LOG.debug("[Optimizer] {} took {} ms, {} rows", queryId, String.format("%.2f", elapsed), rowsReturned);

        logMetric(metric);
        if (metric.isSlow(config.getSlowQueryThresholdMs())) {
            eventBus.post(new SlowQueryDetectedEvent(metric, config.getSlowQueryThresholdMs()));
        }
        return new MeasuredResult(result, metric);
    }

    private QueryPerformanceMetric cachedMetric(String cacheKey) {
        if (cacheKey == null)
            return null;
        QueryPerformanceMetric cached = metricsCache.get(cacheKey);
        if (cached == null)
            return null;
        Duration ttl = Duration.ofSeconds(config.getMetricsCacheTtlSeconds());
        if (Duration.between(cached.timestamp(), clock.instant()).compareTo(ttl) >= 0) {
            metricsCache.remove(cacheKey, cached);
            return null;
        }
        return cached;
    }

    public void clearMetricsCache() {
        metricsCache.clear();
        LOG.debug("[Optimizer] Metrics cache cleared");
    }

    int metricsCacheSize() {
        return metricsCache.size();
    }

    /** Estimate only: two rows read per row returned behind a WHERE, ten without. */
    static int estimateRowsScanned(String sql, int rowsReturned) {
        boolean hasWhere = SqlPatternExtractor.normalize(sql).contains(" where ");
        return rowsReturned * (hasWhere ? 2 : 10);
    }

    private List<String> indexesUsed(String sql, List<Object> params) {
        try {
            Set<String> indexes = new LinkedHashSet<>();
            for (String detail : db.explainQueryPlan(sql, params)) {
                Matcher m = PLAN_INDEX.matcher(detail);
                while (m.find()) {
                    indexes.add(m.group(1));
                }
            }
            return new ArrayList<>(indexes);
        } catch (DatabaseAccessException e) {
            LOG.debug("[Optimizer] No query plan for {}: {}", sql, e.getMessage());
            return List.of();
        }
    }

    private void logMetric(QueryPerformanceMetric metric) {
        if (!config.isEnableLogging())
            return;
        try {
            store.recordExecution(metric, analyzer.extractPattern(metric.sql()));
        } catch (RuntimeException e) {
            LOG.warn("[Optimizer] Failed to log metrics for {}: {}", metric.queryId(), e.getMessage());
        }
    }

    private void logFailure(String queryId, String sql, double elapsed, DatabaseAccessException error) {
        if (!config.isEnableLogging())
            return;
        try {
            store.recordFailure(queryId, sql, elapsed, error.getMessage(), analyzer.extractPattern(sql),
                    clock.instant());
        } catch (RuntimeException e) {
            LOG.warn("[Optimizer] Failed to log failed execution of {}: {}", queryId, e.getMessage());
        }
    }

    private static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    // =====================================================================
    // Analysis
    // =====================================================================

    /** Advisory only; the statement is never changed. */
    public List<OptimizationSuggestion> analyzeAndOptimizeQuery(String sql) {
        return analyzer.analyze(sql);
    }

    /**
     * Slow statements of the trailing window grouped by digest, slowest
     * average first, each with fresh suggestions.
     */
    public List<SlowQueryReport> generateSlowQueryReport(int days) {
        Instant since = clock.instant().minus(Duration.ofDays(days));
        List<SlowQueryReport> reports = new ArrayList<>();
        for (SlowQueryGroup group : store.slowQueryGroups(since, config.getSlowQueryThresholdMs(),
                SLOW_REPORT_LIMIT)) {
            reports.add(new SlowQueryReport(
                    group.sql(),
                    group.avgExecutionTime(),
                    group.executionCount(),
                    group.maxExecutionTime(),
                    group.lastExecuted(),
                    analyzer.analyze(group.sql())));
        }
        return reports;
    }

    /**
     * Usage of every explicitly created user index over the window, most
     * effective first. Unused indexes are only reported, never dropped.
     * Introspection failures yield an empty list.
     */
    public List<IndexUsage> analyzeIndexUsage(int days) {
        Instant since = clock.instant().minus(Duration.ofDays(days));
        try {
            List<IndexUsage> usages = new ArrayList<>();
            for (IndexDefinition index : catalog.indexes()) {
                if (SchemaCatalog.isSystemTable(index.tableName()))
                    continue;
                IndexUsageStats stats = store.indexUsage(index.name(), since);
                usages.add(new IndexUsage(index.name(), index.tableName(), stats.usageCount(), stats.lastUsed(),
                        stats.avgExecutionTime(), effectivenessScore(stats.usageCount(), stats.avgExecutionTime())));
            }
            usages.sort(Comparator.comparingDouble(IndexUsage::effectiveness).reversed());
            return usages;
        } catch (DatabaseAccessException e) {
            LOG.warn("[Optimizer] Index usage analysis failed: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * {@code min(usage/100*50, 50) + max(50 - avgMs/100, 0)}, clamped to
     * [0, 100]. Non-decreasing in usage, non-increasing in latency.
     */
    public static double effectivenessScore(int usageCount, double avgExecutionTimeMs) {
        double usageScore = Math.min(usageCount / 100.0 * 50.0, 50.0);
        double speedScore = Math.max(50.0 - avgExecutionTimeMs / 100.0, 0.0);
        return Math.max(0.0, Math.min(100.0, usageScore + speedScore));
    }

    /**
     * Index DDL for access patterns that recur in the last 30 days and are
     * slow on average: WHERE column sets seen at least 10 times above 100 ms,
     * JOIN columns seen at least 5 times above 200 ms. Combinations an
     * existing index already covers are skipped.
     */
    public List<String> suggestAutoIndexes() {
        Instant since = clock.instant().minus(AUTO_INDEX_WINDOW);
        Set<String> statements = new LinkedHashSet<>();

        for (AccessPattern pattern : store.frequentWherePatterns(since, WHERE_MIN_OCCURRENCES, WHERE_MIN_AVG_MS)) {
            if (qualifies(pattern.table(), pattern.columns()))
                statements.add(autoIndex(pattern.table(), pattern.columns(), "auto"));
        }

        for (AccessPattern pattern : store.frequentJoinPatterns(since, JOIN_MIN_OCCURRENCES, JOIN_MIN_AVG_MS)) {
            Map<String, List<String>> byTable = new LinkedHashMap<>();
            for (ColumnRef ref : pattern.joinColumns()) {
                byTable.computeIfAbsent(ref.table(), t -> new ArrayList<>()).add(ref.column());
            }
            for (Map.Entry<String, List<String>> entry : byTable.entrySet()) {
                if (qualifies(entry.getKey(), entry.getValue()))
                    statements.add(autoIndex(entry.getKey(), entry.getValue(), "join_auto"));
            }
        }

        LOG.info("[Optimizer] {} automatic index suggestion(s)", statements.size());
        return new ArrayList<>(statements);
    }

    private boolean qualifies(String table, List<String> columns) {
        return !columns.isEmpty()
                && !SchemaCatalog.isSystemTable(table)
                && catalog.tableExists(table)
                && !catalog.isCovered(table, columns);
    }

    static String autoIndex(String table, List<String> columns, String suffix) {
        return SchemaCatalog.createIndexDdl("idx_" + table + "_" + String.join("_", columns) + "_" + suffix, table,
                columns);
    }

    // =====================================================================
    // Statistics
    // =====================================================================

    /**
     * Runs {@code ANALYZE}, then records row count, sampled average row size
     * and index count per user table.
     *
     * @return number of tables refreshed
     * @throws DatabaseAccessException on any failure; statistics are operational data
     */
    public int updateDatabaseStatistics() {
        db.execute("ANALYZE");
        Instant now = clock.instant();
        int updated = 0;
        for (String table : catalog.userTables()) {
            String quoted = SchemaCatalog.quote(table);
            Row count = db.prepare("SELECT COUNT(*) AS row_count FROM " + quoted).first();
            long rowCount = count == null ? 0 : count.getLong("row_count");
            store.saveTableStatistics(new TableStatistics(table, rowCount, averageRowSize(table),
                    catalog.indexCount(table), now));
            updated++;
        }
        LOG.info("[Optimizer] Statistics updated for {} table(s)", updated);
        return updated;
    }

    private long averageRowSize(String table) {
        List<ColumnInfo> columns = catalog.columns(table);
        if (columns.isEmpty())
            return 0;
        String sizeExpr = columns.stream()
                .map(c -> "COALESCE(length(" + SchemaCatalog.quote(c.name()) + "), 0)")
                .collect(Collectors.joining(" + "));
        Row row = db.prepare("SELECT AVG(" + sizeExpr + ") AS avg_size FROM (SELECT * FROM "
                + SchemaCatalog.quote(table) + " LIMIT " + STATISTICS_SAMPLE_ROWS + ")").first();
        return row == null ? 0 : Math.round(row.getDouble("avg_size"));
    }

    // =====================================================================
    // Dashboard
    // =====================================================================

    /** Figures over the last hour; the store only ever has one connection. */
    public PerformanceDashboard getPerformanceDashboardData() {
        Instant now = clock.instant();
        Instant hourAgo = now.minus(Duration.ofHours(1));
        double threshold = config.getSlowQueryThresholdMs();
        QueryWindowStats stats = store.windowStats(hourAgo, now, threshold);

        List<TopSlowQuery> top = new ArrayList<>();
        for (SlowQueryGroup group : store.slowQueryGroups(hourAgo, threshold, DASHBOARD_TOP_QUERIES)) {
            top.add(new TopSlowQuery(truncate(group.sql()), group.avgExecutionTime(), group.executionCount()));
        }
        return new PerformanceDashboard(1, stats.avgExecutionTime(), stats.slowQueries(), stats.cacheHitRate(), top);
    }

    private static String truncate(String sql) {
        return sql.length() <= DASHBOARD_QUERY_CHARS ? sql : sql.substring(0, DASHBOARD_QUERY_CHARS) + "...";
    }
}
