package ch.lexcite.storage.impl;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;

import org.jboss.logging.Logger;

import ch.lexcite.storage.StorageException;

/**
 * Connection handling shared by the SQLite stores.
 *
 * <p>Every operation runs asynchronously and completes exceptionally with a
 * {@link StorageException} when SQLite fails.</p>
 */
abstract class AbstractSQLiteStore {

    private static final Logger LOG = Logger.getLogger(AbstractSQLiteStore.class);

    @FunctionalInterface
    interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    protected final SQLiteConnectionManager connectionManager;
    protected final Clock clock;

    protected AbstractSQLiteStore(SQLiteConnectionManager connectionManager, Clock clock) {
        this.connectionManager = connectionManager;
        this.clock = clock;
    }

    protected <T> CompletableFuture<T> read(String operation, SqlWork<T> work) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getReadConnection();
            try {
                return work.run(conn);
            } catch (SQLException e) {
                throw new StorageException("Failed to " + operation, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    protected <T> CompletableFuture<T> write(String operation, SqlWork<T> work) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getWriteConnection();
            try {
                return work.run(conn);
            } catch (SQLException e) {
                throw new StorageException("Failed to " + operation, e);
            } finally {
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    /**
     * Runs the work in one transaction on the write connection. Either all of
     * its statements take effect or none do.
     */
    protected <T> CompletableFuture<T> writeInTransaction(String operation, SqlWork<T> work) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getWriteConnection();
            try {
                conn.setAutoCommit(false);
                T result = work.run(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(conn);
                if (e instanceof StorageException storageException) {
                    throw storageException;
                }
                throw new StorageException("Failed to " + operation, e);
            } finally {
                resetAutoCommit(conn);
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    protected long now() {
        return clock.millis();
    }

    protected static void setNullableString(PreparedStatement stmt, int index, String value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.VARCHAR);
        } else {
            stmt.setString(index, value);
        }
    }

    private static void rollback(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            LOG.warn("Failed to rollback", e);
        }
    }

    private static void resetAutoCommit(Connection conn) {
        try {
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            LOG.warn("Failed to reset auto-commit", e);
        }
    }
}
