package de.bsommerfeld.dbkeeper.core.util;

import java.nio.file.Path;
import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * Where dbkeeper keeps its files. Paths are absolute but are
 * <strong>not</strong> created.
 *
 * <pre>
 * {appDataDir}/
 *   dbkeeper.toml
 *   dbkeeper.db
 *   backups/
 *   logs/
 * </pre>
 *
 * The app-data directory follows each platform's convention:
 * {@code ~/Library/Application Support} on macOS, {@code %APPDATA%} on
 * Windows and {@code $XDG_DATA_HOME} (else {@code ~/.local/share}) elsewhere.
 */
public final class StorageUtils {

    public static final String APP_NAME = "dbkeeper";

    private StorageUtils() {
    }

    public static Path getAppDataDir(String appName) {
        return resolveAppDataDir(appName, System.getProperty("os.name", "generic"),
                System.getProperty("user.home"), System::getenv);
    }

    static Path resolveAppDataDir(String appName, String osName, String userHome, UnaryOperator<String> env) {
        String os = osName.toLowerCase(Locale.ROOT);
        Path base;
        if (os.contains("mac") || os.contains("darwin")) {
            base = Path.of(userHome, "Library", "Application Support");
        } else if (os.contains("win")) {
            base = nonEmpty(env.apply("APPDATA")) ? Path.of(env.apply("APPDATA"))
                    : Path.of(userHome, "AppData", "Roaming");
        } else {
            base = nonEmpty(env.apply("XDG_DATA_HOME")) ? Path.of(env.apply("XDG_DATA_HOME"))
                    : Path.of(userHome, ".local", "share");
        }
        return base.resolve(appName).toAbsolutePath();
    }

    private static boolean nonEmpty(String value) {
        return value != null && !value.isEmpty();
    }

    /** Default location of stored backup payloads. */
    public static Path getBackupsDir(String appName) {
        return getAppDataDir(appName).resolve("backups");
    }

    public static Path getLogsDir(String appName) {
        return getAppDataDir(appName).resolve("logs");
    }

    /** Default managed database, named after the app. */
    public static Path getDatabaseFile(String appName) {
        return getAppDataDir(appName).resolve(appName + ".db");
    }
}
