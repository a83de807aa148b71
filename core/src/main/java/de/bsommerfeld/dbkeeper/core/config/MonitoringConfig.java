package de.bsommerfeld.dbkeeper.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class MonitoringConfig {

    @JsonProperty("enable-real-time-stats")
    private boolean enableRealTimeStats = true;

    @JsonProperty("snapshot-interval-minutes")
    private int snapshotIntervalMinutes = 60;

    @JsonProperty("auto-optimization")
    private boolean autoOptimization = false;

    @JsonProperty("log-retention-days")
    private int logRetentionDays = 30;

    public boolean isEnableRealTimeStats() {
        return enableRealTimeStats;
    }

    public void setEnableRealTimeStats(boolean enableRealTimeStats) {
        this.enableRealTimeStats = enableRealTimeStats;
    }

    public int getSnapshotIntervalMinutes() {
        return snapshotIntervalMinutes;
    }

    public void setSnapshotIntervalMinutes(int snapshotIntervalMinutes) {
        this.snapshotIntervalMinutes = snapshotIntervalMinutes;
    }

    public boolean isAutoOptimization() {
        return autoOptimization;
    }

    public void setAutoOptimization(boolean autoOptimization) {
        this.autoOptimization = autoOptimization;
    }

    public int getLogRetentionDays() {
        return logRetentionDays;
    }

    public void setLogRetentionDays(int logRetentionDays) {
        this.logRetentionDays = logRetentionDays;
    }
}
