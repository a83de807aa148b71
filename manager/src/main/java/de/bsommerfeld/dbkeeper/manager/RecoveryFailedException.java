package de.bsommerfeld.dbkeeper.manager;

import de.bsommerfeld.dbkeeper.core.domain.SystemHealthStatus;

/**
 * Emergency recovery restored the backup but the system still reports
 * critical health. The safety backup taken beforehand can be restored to get
 * back to the pre-recovery state.
 */
public class RecoveryFailedException extends Exception {

    private final String safetyBackupId;
    private final SystemHealthStatus health;

    public RecoveryFailedException(String backupId, String safetyBackupId, SystemHealthStatus health) {
        super("System health still critical after restoring " + backupId + " (safety backup: " + safetyBackupId + ")");
        this.safetyBackupId = safetyBackupId;
        this.health = health;
    }

    public String getSafetyBackupId() {
        return safetyBackupId;
    }

    public SystemHealthStatus getHealth() {
        return health;
    }
}
