package de.bsommerfeld.dbkeeper.optimizer;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.dbkeeper.core.domain.OptimizationSuggestion;
import de.bsommerfeld.dbkeeper.core.domain.Priority;
import de.bsommerfeld.dbkeeper.core.domain.QueryPattern;
import de.bsommerfeld.dbkeeper.core.domain.QueryPattern.ColumnRef;
import de.bsommerfeld.dbkeeper.core.domain.SuggestionType;
import de.bsommerfeld.dbkeeper.db.DatabaseAccessException;
import de.bsommerfeld.dbkeeper.db.DatabaseService;
import de.bsommerfeld.dbkeeper.db.MetricsStore;
import de.bsommerfeld.dbkeeper.db.Row;
import de.bsommerfeld.dbkeeper.db.SchemaCatalog;
import de.bsommerfeld.dbkeeper.optimizer.SqlShape.JoinCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * {@link QueryAnalyzer} built on {@link SqlPatternExtractor} and the live
 * schema. Rules, in the order their suggestions are emitted:
 * <ol>
 * <li>{@code SELECT *}: medium rewrite</li>
 * <li>equality-filtered WHERE column without an index: high index</li>
 * <li>JOIN ON column without an index (both sides): high index</li>
 * <li>ORDER BY tuple without an index in that order: medium composite index</li>
 * <li>SELECT without LIMIT estimated above 1000 rows: medium rewrite adding {@code LIMIT 100}</li>
 * <li>{@code IN (SELECT ...)}: medium rewrite as JOIN, message only</li>
 * </ol>
 */
@Singleton
public class HeuristicQueryAnalyzer implements QueryAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(HeuristicQueryAnalyzer.class);

    static final long LARGE_RESULT_ROWS = 1000;
    private static final Pattern SELECT_STAR = Pattern.compile("(?i)select\\s+\\*");

    private final DatabaseService db;
    private final SchemaCatalog catalog;
    private final MetricsStore store;

    @Inject
    public HeuristicQueryAnalyzer(DatabaseService db, SchemaCatalog catalog, MetricsStore store) {
        this.db = db;
        this.catalog = catalog;
        this.store = store;
    }

    @Override
    public QueryPattern extractPattern(String sql) {
        return SqlPatternExtractor.extract(sql).toPattern();
    }

    @Override
    public List<OptimizationSuggestion> analyze(String sql) {
        SqlShape shape = SqlPatternExtractor.extract(sql);
        List<OptimizationSuggestion> suggestions = new ArrayList<>();
        // WHERE and JOIN rules can name the same column; suggest each index once
        Set<String> suggestedIndexes = new LinkedHashSet<>();

        if (shape.selectStar()) {
            suggestions.add(OptimizationSuggestion.rewrite(Priority.MEDIUM,
                    "Select only the columns you need instead of SELECT *",
                    SELECT_STAR.matcher(sql).replaceFirst("SELECT column1, column2, ...")));
        }

        for (ColumnRef ref : shape.whereEqualities()) {
            if (!isIndexed(ref) && suggestedIndexes.add(indexName(ref.table(), List.of(ref.column())))) {
                suggestions.add(OptimizationSuggestion.index(Priority.HIGH,
                        "Create an index on " + ref.table() + "." + ref.column() + " for the WHERE condition",
                        createIndex(ref.table(), List.of(ref.column()))));
            }
        }

        for (JoinCondition join : shape.joins()) {
            for (ColumnRef ref : List.of(join.left(), join.right())) {
                if (!isIndexed(ref) && suggestedIndexes.add(indexName(ref.table(), List.of(ref.column())))) {
                    suggestions.add(OptimizationSuggestion.index(Priority.HIGH,
                            "JOIN condition on " + ref.table() + "." + ref.column() + " needs an index",
                            createIndex(ref.table(), List.of(ref.column()))));
                }
            }
        }

        if (!shape.orderBy().isEmpty()) {
            String table = shape.orderBy().get(0).table();
            List<String> columns = shape.orderBy().stream().map(ColumnRef::column).collect(Collectors.toList());
            if (!covered(table, columns) && suggestedIndexes.add(indexName(table, columns))) {
                suggestions.add(OptimizationSuggestion.index(Priority.MEDIUM,
                        "Create an index matching ORDER BY " + String.join(", ", columns) + " on " + table,
                        createIndex(table, columns)));
            }
        }

        if (shape.isSelect() && !shape.hasLimit()) {
            long estimated = estimateRows(shape);
            if (estimated > LARGE_RESULT_ROWS) {
                suggestions.add(OptimizationSuggestion.rewrite(Priority.MEDIUM,
                        "Result set of about " + estimated + " rows; add a LIMIT clause",
                        sql.strip() + " LIMIT 100"));
            }
        }

        if (shape.inSubquery()) {
            suggestions.add(new OptimizationSuggestion(SuggestionType.REWRITE, Priority.MEDIUM,
                    "Rewrite IN (SELECT ...) as a JOIN", null, null));
        }

        return suggestions;
    }

    // ===== Index Checks =====

    private boolean isIndexed(ColumnRef ref) {
        return covered(ref.table(), List.of(ref.column()));
    }

    private boolean covered(String table, List<String> columns) {
        try {
            return catalog.isCovered(table, columns);
        } catch (DatabaseAccessException e) {
            LOG.debug("[Optimizer] Cannot inspect indexes of {}: {}", table, e.getMessage());
            return false;
        }
    }

    static String indexName(String table, List<String> columns) {
        return "idx_" + table + "_" + String.join("_", columns);
    }

    static String createIndex(String table, List<String> columns) {
        return SchemaCatalog.createIndexDdl(indexName(table, columns), table, columns);
    }

    // ===== Row Estimate =====

    /**
     * Row count of the primary table, from {@code table_statistics} when
     * available, else a live {@code COUNT(*)}. Halved when a WHERE clause is
     * present. Zero when the table is unknown.
     */
    long estimateRows(SqlShape shape) {
        String table = shape.primaryTable();
        if (table == null)
            return 0;
        try {
            long rows = store.findTableStatistics(table)
                    .map(stats -> stats.rowCount())
                    .or(() -> Optional.ofNullable(countRows(table)))
                    .orElse(0L);
            return shape.hasWhere() ? rows / 2 : rows;
        } catch (DatabaseAccessException e) {
            LOG.debug("[Optimizer] Cannot estimate rows of {}: {}", table, e.getMessage());
            return 0;
        }
    }

    private Long countRows(String table) {
        if (!catalog.tableExists(table))
            return null;
        Row row = db.prepare("SELECT COUNT(*) AS row_count FROM " + SchemaCatalog.quote(table)).first();
        return row == null ? 0L : row.getLong("row_count");
    }
}
