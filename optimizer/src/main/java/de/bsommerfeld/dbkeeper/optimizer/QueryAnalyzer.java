package de.bsommerfeld.dbkeeper.optimizer;

import de.bsommerfeld.dbkeeper.core.domain.OptimizationSuggestion;
import de.bsommerfeld.dbkeeper.core.domain.QueryPattern;

import java.util.List;

/**
 * Static analysis of SQL text. Implementations may be approximate: their
 * output is advisory and must never drive correctness-critical decisions.
 *
 * @see HeuristicQueryAnalyzer
 */
public interface QueryAnalyzer {

    /**
     * Returns suggestions for the statement, most important first. Never
     * modifies the statement or the schema.
     */
    List<OptimizationSuggestion> analyze(String sql);

    /**
     * Extracts the access pattern stored next to each logged execution.
     * Returns {@link QueryPattern#NONE} when nothing is recognized.
     */
    QueryPattern extractPattern(String sql);
}
