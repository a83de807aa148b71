package de.bsommerfeld.dbkeeper.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class BackupConfig {

    @JsonProperty("enabled")
    private boolean enabled = true;

    @JsonProperty("schedule")
    private BackupSchedule schedule = BackupSchedule.DAILY;

    @JsonProperty("retention-days")
    private int retentionDays = 30;

    @JsonProperty("compression-enabled")
    private boolean compressionEnabled = true;

    @JsonProperty("encryption-enabled")
    private boolean encryptionEnabled = false;

    @JsonProperty("encryption-passphrase")
    private String encryptionPassphrase = "";

    // Empty means <app-data>/backups
    @JsonProperty("directory")
    private String directory = "";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public BackupSchedule getSchedule() {
        return schedule;
    }

    public void setSchedule(BackupSchedule schedule) {
        this.schedule = schedule;
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    public void setRetentionDays(int retentionDays) {
        this.retentionDays = retentionDays;
    }

    public boolean isCompressionEnabled() {
        return compressionEnabled;
    }

    public void setCompressionEnabled(boolean compressionEnabled) {
        this.compressionEnabled = compressionEnabled;
    }

    public boolean isEncryptionEnabled() {
        return encryptionEnabled;
    }

    public void setEncryptionEnabled(boolean encryptionEnabled) {
        this.encryptionEnabled = encryptionEnabled;
    }

    public String getEncryptionPassphrase() {
        return encryptionPassphrase;
    }

    public void setEncryptionPassphrase(String encryptionPassphrase) {
        this.encryptionPassphrase = encryptionPassphrase;
    }

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }
}
