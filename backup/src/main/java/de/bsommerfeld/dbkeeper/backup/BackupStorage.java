package de.bsommerfeld.dbkeeper.backup;

import java.io.IOException;

/**
 * Where encoded backup payloads live, addressed by backup id. Metadata is
 * kept in the database; this only holds the bytes.
 */
public interface BackupStorage {

    void store(String backupId, byte[] payload) throws IOException;

    /**
     * @throws java.nio.file.NoSuchFileException if no payload is stored under the id
     */
    byte[] load(String backupId) throws IOException;

    /**
     * @return whether a payload existed
     */
    boolean delete(String backupId) throws IOException;

    boolean exists(String backupId);
}
