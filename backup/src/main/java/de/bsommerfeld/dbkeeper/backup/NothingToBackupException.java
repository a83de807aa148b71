package de.bsommerfeld.dbkeeper.backup;

import java.time.Instant;

/** An incremental backup found no rows changed since its reference time. */
public class NothingToBackupException extends BackupException {

    public NothingToBackupException(Instant since) {
        super("No changes since " + since);
    }
}
