package ch.lexcite.storage.impl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.locks.ReentrantLock;

import org.jboss.logging.Logger;
import org.sqlite.SQLiteConfig;

import ch.lexcite.storage.StorageException;

/**
 * Hands out SQLite connections to the stores.
 *
 * <p>Reads use a small pool of connections. All writes, and every read that
 * must be atomic with a write (cache hit counting, upsert-then-read), go through
 * one exclusive write connection guarded by a {@link ReentrantLock}, so two
 * writers never interleave inside one transaction.</p>
 *
 * <pre>
 * SQLiteConnectionManager manager = new SQLiteConnectionManager("data/lexcite.db");
 * Connection conn = manager.getWriteConnection();
 * try {
 *     // write
 * } finally {
 *     manager.releaseWriteConnection(conn);
 * }
 * </pre>
 */
public final class SQLiteConnectionManager implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(SQLiteConnectionManager.class);

    private static final Duration DEFAULT_BUSY_TIMEOUT = Duration.ofSeconds(30);
    private static final boolean DEFAULT_WAL_MODE = true;
    private static final int DEFAULT_POOL_SIZE = 4;
    private static final int CACHE_SIZE_KB = -2000;

    private final String databasePath;
    private final Duration busyTimeout;
    private final boolean walMode;
    private final BlockingQueue<Connection> readPool;
    private final ReentrantLock writeLock;

    private Connection writeConnection;
    private volatile boolean closed = false;

    /**
     * @param databasePath path to the database file
     */
    public SQLiteConnectionManager(String databasePath) {
        this(databasePath, DEFAULT_BUSY_TIMEOUT, DEFAULT_WAL_MODE, DEFAULT_POOL_SIZE);
    }

    /**
     * @param databasePath path to the database file
     * @param busyTimeout  how long SQLite waits for a file lock
     * @param walMode      whether to use write-ahead logging
     * @param readPoolSize number of pooled read connections
     */
    public SQLiteConnectionManager(String databasePath, Duration busyTimeout, boolean walMode, int readPoolSize) {
        this.databasePath = databasePath;
        this.busyTimeout = busyTimeout;
        this.walMode = walMode;
        this.readPool = new ArrayBlockingQueue<>(Math.max(1, readPoolSize));
        this.writeLock = new ReentrantLock();
    }

    /**
     * Opens a new, unpooled connection with pragmas applied.
     *
     * @throws StorageException if the database cannot be opened
     */
    public Connection createConnection() {
        ensureOpen();
        createParentDirectory();

        try {
            SQLiteConfig config = new SQLiteConfig();
            config.setBusyTimeout((int) busyTimeout.toMillis());
            config.setCacheSize(CACHE_SIZE_KB);

            Connection conn = DriverManager.getConnection("jdbc:sqlite:" + databasePath, config.toProperties());
            applyPragmas(conn);
            LOG.debugf("Opened SQLite connection to %s", databasePath);
            return conn;
        } catch (SQLException e) {
            throw new StorageException("Failed to open SQLite database " + databasePath, e);
        }
    }

    /**
     * Takes a read connection from the pool, opening one if the pool is empty.
     */
    public Connection getReadConnection() {
        ensureOpen();
        Connection conn = readPool.poll();
        if (conn != null) {
            try {
                if (!conn.isClosed()) {
                    return conn;
                }
            } catch (SQLException e) {
                LOG.debug("Pooled read connection is unusable, opening a new one", e);
            }
        }
        return createConnection();
    }

    public void releaseReadConnection(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            if (closed || conn.isClosed() || !readPool.offer(conn)) {
                conn.close();
            }
        } catch (SQLException e) {
            LOG.debug("Error releasing read connection", e);
        }
    }

    /**
     * Acquires the exclusive write connection. The caller must hand it back with
     * {@link #releaseWriteConnection(Connection)} in a {@code finally} block.
     */
    public Connection getWriteConnection() {
        ensureOpen();
        writeLock.lock();
        try {
            if (writeConnection == null || writeConnection.isClosed()) {
                writeConnection = createConnection();
            }
            return writeConnection;
        } catch (SQLException | RuntimeException e) {
            writeLock.unlock();
            throw new StorageException("Failed to acquire SQLite write connection", e);
        }
    }

    public void releaseWriteConnection(Connection conn) {
        if (conn == writeConnection && writeLock.isHeldByCurrentThread()) {
            writeLock.unlock();
        }
    }

    void applyPragmas(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            if (walMode) {
                stmt.execute("PRAGMA journal_mode = WAL");
            }
            stmt.execute("PRAGMA synchronous = NORMAL");
            stmt.execute("PRAGMA temp_store = MEMORY");
        }
    }

    public String getDatabasePath() {
        return databasePath;
    }

    public boolean isWalModeEnabled() {
        return walMode;
    }

    @Override
    public void close() {
        closed = true;
        if (writeConnection != null) {
            try {
                writeConnection.close();
            } catch (SQLException e) {
                LOG.debug("Error closing write connection", e);
            }
            writeConnection = null;
        }
        Connection conn;
        while ((conn = readPool.poll()) != null) {
            try {
                conn.close();
            } catch (SQLException e) {
                LOG.debug("Error closing pooled connection", e);
            }
        }
        LOG.infof("Closed SQLite connection manager for %s", databasePath);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }
    }

    private void createParentDirectory() {
        if (databasePath.startsWith(":memory:")) {
            return;
        }
        Path parent = Paths.get(databasePath).toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            try {
                Files.createDirectories(parent);
                LOG.infof("Created database directory: %s", parent);
            } catch (IOException e) {
                throw new StorageException("Could not create database directory " + parent, e);
            }
        }
    }
}
