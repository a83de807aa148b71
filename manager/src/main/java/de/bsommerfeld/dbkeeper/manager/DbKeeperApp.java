package de.bsommerfeld.dbkeeper.manager;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.dbkeeper.core.domain.SystemHealthStatus;
import de.bsommerfeld.dbkeeper.core.util.StorageUtils;
import de.bsommerfeld.dbkeeper.db.DatabaseService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Standalone entry point. Builds the injector, initializes the manager and
 * then acts as its external scheduler, calling
 * {@link DatabaseManager#onSchedulerTick()} once per minute until the JVM
 * exits.
 */
public final class DbKeeperApp {

    static {
        // Must run before the first logger is created; logback.xml reads LOG_DIR
        Path logDir = StorageUtils.getLogsDir(StorageUtils.APP_NAME);
        try {
            Files.createDirectories(logDir);
            System.setProperty("LOG_DIR", logDir.toString());
        } catch (IOException e) {
            System.err.println("Failed to create log directory: " + logDir + " (" + e.getMessage() + ")");
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(DbKeeperApp.class);
    static final long TICK_SECONDS = 60;

    private DbKeeperApp() {
    }

    public static void main(String[] args) {
        Injector injector = Guice.createInjector(DbKeeperModule.fromDefaultLocation());
        DatabaseManager manager = injector.getInstance(DatabaseManager.class);
        DatabaseService database = injector.getInstance(DatabaseService.class);

        manager.initialize();
        SystemHealthStatus health = manager.getSystemHealth();
        LOG.info("[Health] Startup health: {} (database {}, backup {})", health.overall(),
                health.database().status(), health.backup().status());

        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(
                runnable -> new Thread(runnable, "dbkeeper-scheduler"));
        // An exception escaping a fixed-rate task cancels all later runs
        scheduler.scheduleAtFixedRate(() -> {
            try {
                manager.onSchedulerTick();
            } catch (RuntimeException e) {
                LOG.error("Scheduler tick failed", e);
            }
        }, TICK_SECONDS, TICK_SECONDS, TimeUnit.SECONDS);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(scheduler, database), "dbkeeper-shutdown"));
        LOG.info("dbkeeper running, ticking every {} seconds", TICK_SECONDS);
    }

    private static void shutdown(ScheduledExecutorService scheduler, DatabaseService database) {
        LOG.info("Shutting down...");
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS))
                LOG.warn("Scheduler did not stop within 30 seconds");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        database.close();
    }
}
