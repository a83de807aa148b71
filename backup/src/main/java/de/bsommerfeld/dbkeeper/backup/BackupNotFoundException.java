package de.bsommerfeld.dbkeeper.backup;

public class BackupNotFoundException extends BackupException {

    public BackupNotFoundException(String backupId) {
        super("Backup not found: " + backupId);
    }
}
