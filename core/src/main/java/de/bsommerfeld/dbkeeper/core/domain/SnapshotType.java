package de.bsommerfeld.dbkeeper.core.domain;

import java.time.Duration;
import java.util.Locale;

public enum SnapshotType {
    HOURLY(Duration.ofHours(1)),
    DAILY(Duration.ofDays(1));

    private final Duration period;

    SnapshotType(Duration period) {
        this.period = period;
    }

    public Duration period() {
        return period;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SnapshotType fromKey(String key) {
        return valueOf(key.toUpperCase(Locale.ROOT));
    }
}
