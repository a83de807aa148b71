package de.bsommerfeld.dbkeeper.core.domain;

import java.util.Locale;

public enum BackupStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BackupStatus fromKey(String key) {
        return valueOf(key.toUpperCase(Locale.ROOT));
    }
}
