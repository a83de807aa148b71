package de.bsommerfeld.dbkeeper.core.domain;

import java.time.Instant;

/**
 * Durable copy of a high-priority {@link OptimizationSuggestion}, as kept in
 * {@code optimization_suggestions}.
 */
public record StoredSuggestion(
        long id,
        SuggestionType type,
        Priority priority,
        String targetQuery,
        String description,
        String suggestedSql,
        SuggestionStatus status,
        Instant createdAt) {
}
