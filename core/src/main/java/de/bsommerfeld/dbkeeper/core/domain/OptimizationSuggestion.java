package de.bsommerfeld.dbkeeper.core.domain;

/**
 * Advisory output of query analysis. Nothing applies a suggestion
 * automatically; callers decide.
 *
 * @param suggestedSql   rewritten statement, if the suggestion is a rewrite
 * @param suggestedIndex ready-to-run index DDL, if the suggestion is an index
 */
public record OptimizationSuggestion(
        SuggestionType type,
        Priority priority,
        String message,
        String suggestedSql,
        String suggestedIndex) {

    public static OptimizationSuggestion index(Priority priority, String message, String ddl) {
        return new OptimizationSuggestion(SuggestionType.INDEX, priority, message, null, ddl);
    }

    public static OptimizationSuggestion rewrite(Priority priority, String message, String sql) {
        return new OptimizationSuggestion(SuggestionType.REWRITE, priority, message, sql, null);
    }

    /** The SQL an operator would run to act on this suggestion, or {@code null}. */
    public String actionSql() {
        return suggestedSql != null ? suggestedSql : suggestedIndex;
    }
}
