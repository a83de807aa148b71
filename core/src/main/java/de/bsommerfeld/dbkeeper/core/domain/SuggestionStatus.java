package de.bsommerfeld.dbkeeper.core.domain;

import java.util.Locale;

public enum SuggestionStatus {
    PENDING,
    APPLIED,
    REJECTED;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SuggestionStatus fromKey(String key) {
        return valueOf(key.toUpperCase(Locale.ROOT));
    }
}
