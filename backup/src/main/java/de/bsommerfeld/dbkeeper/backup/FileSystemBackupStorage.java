package de.bsommerfeld.dbkeeper.backup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * One {@code <id>.bak} file per backup in a single directory. Writes go
 * through a temp file and an atomic move, so a crash never leaves a
 * half-written payload under a valid name.
 */
public class FileSystemBackupStorage implements BackupStorage {

    private static final Logger LOG = LoggerFactory.getLogger(FileSystemBackupStorage.class);
    private static final String EXTENSION = ".bak";

    private final Path directory;

    public FileSystemBackupStorage(Path directory) {
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

    @Override
    public void store(String backupId, byte[] payload) throws IOException {
        Files.createDirectories(directory);
        Path target = fileOf(backupId);
        Path temp = directory.resolve(backupId + EXTENSION + ".tmp");
        Files.write(temp, payload);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        LOG.debug("[Backup] Wrote {} ({} bytes)", target, payload.length);
    }

    @Override
    public byte[] load(String backupId) throws IOException {
        return Files.readAllBytes(fileOf(backupId));
    }

    @Override
    public boolean delete(String backupId) throws IOException {
        return Files.deleteIfExists(fileOf(backupId));
    }

    @Override
    public boolean exists(String backupId) {
        return Files.isRegularFile(fileOf(backupId));
    }

    private Path fileOf(String backupId) {
        if (backupId.contains("/") || backupId.contains("\\") || backupId.contains(".."))
            throw new IllegalArgumentException("Invalid backup id: " + backupId);
        return directory.resolve(backupId + EXTENSION);
    }
}
