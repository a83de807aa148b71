package de.bsommerfeld.dbkeeper.backup;

/**
 * A backup or restore could not be completed. The database is unchanged
 * when this is thrown: creation stores nothing and restores roll back.
 */
public class BackupException extends Exception {

    public BackupException(String message) {
        super(message);
    }

    public BackupException(String message, Throwable cause) {
        super(message, cause);
    }
}
