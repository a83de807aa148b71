package de.bsommerfeld.dbkeeper.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Backup cadence. The interval is the minimum age of the last backup before
 * a scheduled run takes a new one.
 */
public enum BackupSchedule {

    @JsonProperty("daily")
    DAILY(Duration.ofHours(24)),

    @JsonProperty("weekly")
    WEEKLY(Duration.ofHours(24 * 7)),

    @JsonProperty("monthly")
    MONTHLY(Duration.ofHours(24 * 30));

    private final Duration interval;

    BackupSchedule(Duration interval) {
        this.interval = interval;
    }

    public Duration interval() {
        return interval;
    }
}
