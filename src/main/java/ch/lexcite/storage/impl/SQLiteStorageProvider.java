package ch.lexcite.storage.impl;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.lexcite.storage.CacheStore;
import ch.lexcite.storage.CommentaryStore;
import ch.lexcite.storage.DecisionStore;
import ch.lexcite.storage.SearchQueryLog;
import ch.lexcite.storage.StorageException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

/**
 * CDI producer for the SQLite-backed stores.
 *
 * <p>Opens the database, applies pending migrations at startup and closes all
 * connections at shutdown.</p>
 *
 * <pre>
 * lexcite.storage.sqlite.path=data/lexcite.db
 * lexcite.storage.sqlite.read-pool-size=4
 * lexcite.storage.sqlite.busy-timeout=30000
 * lexcite.storage.sqlite.wal-mode=true
 * </pre>
 */
@ApplicationScoped
public class SQLiteStorageProvider {

    private static final Logger LOG = Logger.getLogger(SQLiteStorageProvider.class);

    @ConfigProperty(name = "lexcite.storage.sqlite.path", defaultValue = "data/lexcite.db")
    String databasePath;

    @ConfigProperty(name = "lexcite.storage.sqlite.read-pool-size", defaultValue = "4")
    int readPoolSize;

    @ConfigProperty(name = "lexcite.storage.sqlite.busy-timeout", defaultValue = "30000")
    long busyTimeoutMs;

    @ConfigProperty(name = "lexcite.storage.sqlite.wal-mode", defaultValue = "true")
    boolean walMode;

    @Inject
    ObjectMapper objectMapper;

    private SQLiteConnectionManager connectionManager;

    @PostConstruct
    void initialize() {
        LOG.infof("Initializing SQLite storage with database: %s", databasePath);
        connectionManager = new SQLiteConnectionManager(databasePath, Duration.ofMillis(busyTimeoutMs), walMode,
            readPoolSize);
        runMigrations();
        LOG.info("SQLite storage initialized");
    }

    @PreDestroy
    void shutdown() {
        LOG.info("Shutting down SQLite storage");
        if (connectionManager != null) {
            connectionManager.close();
        }
    }

    @Produces
    @Singleton
    public Clock produceClock() {
        return Clock.systemUTC();
    }

    @Produces
    @ApplicationScoped
    public CacheStore produceCacheStore(Clock clock) {
        return new SQLiteCacheStore(connectionManager, clock);
    }

    @Produces
    @ApplicationScoped
    public DecisionStore produceDecisionStore(Clock clock) {
        return new SQLiteDecisionStore(connectionManager, objectMapper, clock);
    }

    @Produces
    @ApplicationScoped
    public CommentaryStore produceCommentaryStore(Clock clock) {
        return new SQLiteCommentaryStore(connectionManager, objectMapper, clock);
    }

    @Produces
    @ApplicationScoped
    public SearchQueryLog produceSearchQueryLog(Clock clock) {
        return new SQLiteSearchQueryLog(connectionManager, clock);
    }

    private void runMigrations() {
        SQLiteSchemaMigrator migrator = new SQLiteSchemaMigrator();
        Connection conn = connectionManager.getWriteConnection();
        try {
            int before = migrator.getCurrentVersion(conn);
            migrator.migrateToLatest(conn);
            int after = migrator.getCurrentVersion(conn);
            if (after > before) {
                LOG.infof("Migrated schema from version %d to %d", before, after);
            } else {
                LOG.infof("Schema is up to date at version %d", after);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to run SQLite schema migrations", e);
        } finally {
            connectionManager.releaseWriteConnection(conn);
        }
    }
}
