package de.bsommerfeld.dbkeeper.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of the {@code dbkeeper.toml} configuration. Every section is
 * initialized with its defaults so a missing table in the file never yields
 * {@code null}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DbKeeperConfig {

    @JsonProperty("database")
    private DatabaseConfig database = new DatabaseConfig();

    @JsonProperty("optimizer")
    private OptimizerConfig optimizer = new OptimizerConfig();

    @JsonProperty("backup")
    private BackupConfig backup = new BackupConfig();

    @JsonProperty("monitoring")
    private MonitoringConfig monitoring = new MonitoringConfig();

    public DatabaseConfig getDatabase() {
        return database;
    }

    public OptimizerConfig getOptimizer() {
        return optimizer;
    }

    public BackupConfig getBackup() {
        return backup;
    }

    public MonitoringConfig getMonitoring() {
        return monitoring;
    }
}
