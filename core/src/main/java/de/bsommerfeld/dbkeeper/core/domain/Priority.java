package de.bsommerfeld.dbkeeper.core.domain;

import java.util.Locale;

public enum Priority {
    HIGH,
    MEDIUM,
    LOW;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Priority fromKey(String key) {
        return valueOf(key.toUpperCase(Locale.ROOT));
    }
}
