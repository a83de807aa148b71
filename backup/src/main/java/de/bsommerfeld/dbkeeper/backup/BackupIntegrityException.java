package de.bsommerfeld.dbkeeper.backup;

/**
 * The stored payload does not match its recorded checksum, or could not be
 * decrypted or decompressed. Nothing was restored.
 */
public class BackupIntegrityException extends BackupException {

    public BackupIntegrityException(String message) {
        super(message);
    }

    public BackupIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
