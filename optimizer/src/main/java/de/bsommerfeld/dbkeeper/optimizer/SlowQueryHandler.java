package de.bsommerfeld.dbkeeper.optimizer;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.dbkeeper.core.domain.OptimizationSuggestion;
import de.bsommerfeld.dbkeeper.core.domain.QueryPerformanceMetric;
import de.bsommerfeld.dbkeeper.core.event.ApplicationEventBus;
import de.bsommerfeld.dbkeeper.core.event.DbKeeperEvents.SlowQueryDetectedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Logs slow executions with fresh suggestions. Runs on the posting thread
 * after the caller's result is complete; if it fails, the event bus logs the
 * failure and the caller never notices.
 */
@Singleton
public class SlowQueryHandler {

    private static final Logger LOG = LoggerFactory.getLogger(SlowQueryHandler.class);
    private static final int LOGGED_SQL_CHARS = 200;

    private final QueryAnalyzer analyzer;

    @Inject
    public SlowQueryHandler(QueryAnalyzer analyzer, ApplicationEventBus eventBus) {
        this.analyzer = analyzer;
        eventBus.register(this);
    }

    @Subscribe
    public void onSlowQuery(SlowQueryDetectedEvent event) {
        QueryPerformanceMetric metric = event.metric();
        String sql = metric.sql();
        LOG.warn("[Optimizer] Slow query {} ({} ms > {} ms, {} rows returned, ~{} scanned): {}",
                metric.queryId(),
                String.format("%.2f", metric.executionTime()),
                event.thresholdMs(),
                metric.rowsReturned(),
                metric.rowsScanned(),
                sql.length() > LOGGED_SQL_CHARS ? sql.substring(0, LOGGED_SQL_CHARS) + "..." : sql);

        List<OptimizationSuggestion> suggestions = analyzer.analyze(sql);
        for (OptimizationSuggestion suggestion : suggestions) {
            LOG.info("[Optimizer]   {} ({}): {}{}", suggestion.type().key(), suggestion.priority().key(),
                    suggestion.message(),
                    suggestion.actionSql() == null ? "" : " -> " + suggestion.actionSql());
        }
    }
}
