package de.bsommerfeld.dbkeeper.manager;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.dbkeeper.backup.BackupStorage;
import de.bsommerfeld.dbkeeper.backup.FileSystemBackupStorage;
import de.bsommerfeld.dbkeeper.core.config.ApplicationMode;
import de.bsommerfeld.dbkeeper.core.config.BackupConfig;
import de.bsommerfeld.dbkeeper.core.config.ConfigLoader;
import de.bsommerfeld.dbkeeper.core.config.DatabaseConfig;
import de.bsommerfeld.dbkeeper.core.config.DbKeeperConfig;
import de.bsommerfeld.dbkeeper.core.config.MonitoringConfig;
import de.bsommerfeld.dbkeeper.core.config.OptimizerConfig;
import de.bsommerfeld.dbkeeper.core.util.StorageUtils;
import de.bsommerfeld.dbkeeper.db.DatabaseService;
import de.bsommerfeld.dbkeeper.db.SqlDatabaseService;
import de.bsommerfeld.dbkeeper.optimizer.HeuristicQueryAnalyzer;
import de.bsommerfeld.dbkeeper.optimizer.QueryAnalyzer;
import de.bsommerfeld.dbkeeper.optimizer.SlowQueryHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;

/**
 * Guice wiring for the whole application. {@link ApplicationMode#TEST} swaps
 * the database file for an in-memory database.
 */
public class DbKeeperModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(DbKeeperModule.class);
    static final String CONFIG_FILE = "dbkeeper.toml";

    private final DbKeeperConfig config;
    private final ApplicationMode mode;

    public DbKeeperModule(DbKeeperConfig config, ApplicationMode mode) {
        this.config = config;
        this.mode = mode;
    }

    /** Loads {@code dbkeeper.toml} from the app-data directory, writing defaults if absent. */
    public static DbKeeperModule fromDefaultLocation() {
        Path configPath = StorageUtils.getAppDataDir(StorageUtils.APP_NAME).resolve(CONFIG_FILE);
        LOG.info("Loading Configuration from: {}", configPath);
        try {
            return new DbKeeperModule(ConfigLoader.load(configPath), ApplicationMode.get());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load Application Configuration", e);
        }
    }

    @Override
    protected void configure() {
        LOG.info("Application Mode initialized: {}", mode);

        bind(DbKeeperConfig.class).toInstance(config);
        bind(DatabaseConfig.class).toInstance(config.getDatabase());
        bind(OptimizerConfig.class).toInstance(config.getOptimizer());
        bind(BackupConfig.class).toInstance(config.getBackup());
        bind(MonitoringConfig.class).toInstance(config.getMonitoring());

        bind(Clock.class).toInstance(Clock.systemUTC());
        bind(QueryAnalyzer.class).to(HeuristicQueryAnalyzer.class);

        // Listeners register on the event bus in their constructors
        bind(SlowQueryHandler.class).asEagerSingleton();
        bind(DatabaseManager.class).asEagerSingleton();
    }

    @Provides
    @Singleton
    DatabaseService provideDatabase(DatabaseConfig databaseConfig) {
        SqlDatabaseService database;
        if (mode.isTest()) {
            database = SqlDatabaseService.inMemory();
        } else {
            Path file = databaseConfig.getPath().isBlank()
                    ? StorageUtils.getDatabaseFile(StorageUtils.APP_NAME)
                    : Paths.get(databaseConfig.getPath());
            LOG.info("[DB] Using database file {}", file);
            database = SqlDatabaseService.forFile(file);
        }
        if (databaseConfig.isApplySchema())
            database.applySchema();
        return database;
    }

    @Provides
    @Singleton
    BackupStorage provideBackupStorage(BackupConfig backupConfig) {
        Path directory = backupConfig.getDirectory().isBlank()
                ? StorageUtils.getBackupsDir(StorageUtils.APP_NAME)
                : Paths.get(backupConfig.getDirectory());
        return new FileSystemBackupStorage(directory);
    }
}
