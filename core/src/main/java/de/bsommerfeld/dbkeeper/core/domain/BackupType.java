package de.bsommerfeld.dbkeeper.core.domain;

import java.util.Locale;

public enum BackupType {
    FULL,
    INCREMENTAL;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BackupType fromKey(String key) {
        return valueOf(key.toUpperCase(Locale.ROOT));
    }
}
