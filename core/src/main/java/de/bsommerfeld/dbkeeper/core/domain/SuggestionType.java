package de.bsommerfeld.dbkeeper.core.domain;

import java.util.Locale;

public enum SuggestionType {
    INDEX,
    REWRITE,
    CACHE,
    PARTITION;

    /** Lower-case form stored in {@code optimization_suggestions.suggestion_type}. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SuggestionType fromKey(String key) {
        return valueOf(key.toUpperCase(Locale.ROOT));
    }
}
