package ch.lexcite.storage.impl;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import ch.lexcite.storage.CacheEntry;
import ch.lexcite.storage.CacheStats;
import ch.lexcite.storage.CacheStore;
import ch.lexcite.storage.CacheType;

/**
 * SQLite implementation of {@link CacheStore} backed by the {@code api_cache} table.
 *
 * <p>Reads run on the write connection inside a transaction: the expiry check,
 * the delete of an expired row and the hit increment are applied atomically, so
 * concurrent readers never lose an increment and never see an expired value.</p>
 */
public final class SQLiteCacheStore extends AbstractSQLiteStore implements CacheStore {

    private static final Logger LOG = Logger.getLogger(SQLiteCacheStore.class);

    public SQLiteCacheStore(SQLiteConnectionManager connectionManager) {
        this(connectionManager, Clock.systemUTC());
    }

    public SQLiteCacheStore(SQLiteConnectionManager connectionManager, Clock clock) {
        super(connectionManager, clock);
    }

    @Override
    public CompletableFuture<Optional<String>> get(@NotNull String key) {
        return writeInTransaction("read cache entry " + key, conn -> {
            long now = now();
            String data;
            long expiresAt;
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT data, expires_at FROM api_cache WHERE cache_key = ?")) {
                stmt.setString(1, key);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    data = rs.getString("data");
                    expiresAt = rs.getLong("expires_at");
                }
            }

            if (now > expiresAt) {
                try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM api_cache WHERE cache_key = ?")) {
                    stmt.setString(1, key);
                    stmt.executeUpdate();
                }
                LOG.debugf("Cache entry %s expired, removed", key);
                return Optional.empty();
            }

            try (PreparedStatement stmt = conn.prepareStatement(
                    "UPDATE api_cache SET hit_count = hit_count + 1, last_accessed_at = ? WHERE cache_key = ?")) {
                stmt.setLong(1, now);
                stmt.setString(2, key);
                stmt.executeUpdate();
            }
            return Optional.of(data);
        });
    }

    @Override
    public CompletableFuture<Void> set(@NotNull String key, @NotNull String value, @NotNull CacheType type,
                                       @NotNull Duration ttl) {
        return write("write cache entry " + key, conn -> {
            String sql = """
                INSERT INTO api_cache (cache_key, cache_type, data, expires_at, hit_count, last_accessed_at, created_at)
                VALUES (?, ?, ?, ?, 0, ?, ?)
                ON CONFLICT(cache_key) DO UPDATE SET
                    cache_type = excluded.cache_type,
                    data = excluded.data,
                    expires_at = excluded.expires_at,
                    last_accessed_at = excluded.last_accessed_at
                """;
            long now = now();
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, key);
                stmt.setString(2, type.value());
                stmt.setString(3, value);
                stmt.setLong(4, now + ttl.toMillis());
                stmt.setLong(5, now);
                stmt.setLong(6, now);
                stmt.executeUpdate();
            }
            LOG.debugf("Cached %s (%s, ttl %s)", key, type.value(), ttl);
            return null;
        });
    }

    @Override
    public CompletableFuture<Boolean> has(@NotNull String key) {
        return read("check cache entry " + key, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT 1 FROM api_cache WHERE cache_key = ? AND expires_at >= ?")) {
                stmt.setString(1, key);
                stmt.setLong(2, now());
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next();
                }
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> delete(@NotNull String key) {
        return write("delete cache entry " + key, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM api_cache WHERE cache_key = ?")) {
                stmt.setString(1, key);
                return stmt.executeUpdate() > 0;
            }
        });
    }

    @Override
    public CompletableFuture<Integer> deleteByPrefix(@NotNull String prefix) {
        return write("delete cache entries with prefix " + prefix, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "DELETE FROM api_cache WHERE substr(cache_key, 1, ?) = ?")) {
                stmt.setInt(1, prefix.length());
                stmt.setString(2, prefix);
                return stmt.executeUpdate();
            }
        });
    }

    @Override
    public CompletableFuture<Integer> sweepExpired() {
        return write("sweep expired cache entries", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM api_cache WHERE expires_at < ?")) {
                stmt.setLong(1, now());
                int removed = stmt.executeUpdate();
                if (removed > 0) {
                    LOG.infof("Swept %d expired cache entries", removed);
                }
                return removed;
            }
        });
    }

    @Override
    public CompletableFuture<Integer> trimToSize(int maxEntries) {
        return writeInTransaction("trim cache", conn -> {
            long excess = countRows(conn) - Math.max(0, maxEntries);
            if (excess <= 0) {
                return 0;
            }
            try (PreparedStatement stmt = conn.prepareStatement("""
                    DELETE FROM api_cache WHERE id IN (
                        SELECT id FROM api_cache ORDER BY last_accessed_at ASC, id ASC LIMIT ?
                    )
                    """)) {
                stmt.setLong(1, excess);
                int removed = stmt.executeUpdate();
                LOG.infof("Trimmed %d least recently used cache entries", removed);
                return removed;
            }
        });
    }

    @Override
    public CompletableFuture<CacheStats> stats() {
        return read("read cache statistics", conn -> {
            long total = 0;
            long hits = 0;
            long expired = 0;
            Map<String, Long> byType = new HashMap<>();
            try (PreparedStatement stmt = conn.prepareStatement("""
                    SELECT cache_type, COUNT(*) AS entries, SUM(hit_count) AS hits,
                           SUM(CASE WHEN expires_at < ? THEN 1 ELSE 0 END) AS expired
                    FROM api_cache GROUP BY cache_type
                    """)) {
                stmt.setLong(1, now());
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        long entries = rs.getLong("entries");
                        byType.put(rs.getString("cache_type"), entries);
                        total += entries;
                        hits += rs.getLong("hits");
                        expired += rs.getLong("expired");
                    }
                }
            }
            return new CacheStats(total, expired, hits, byType);
        });
    }

    @Override
    public CompletableFuture<List<CacheEntry>> mostAccessed(int limit) {
        return read("read most accessed cache entries", conn -> {
            List<CacheEntry> entries = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement("""
                    SELECT cache_key, cache_type, data, expires_at, hit_count, last_accessed_at, created_at
                    FROM api_cache WHERE expires_at >= ?
                    ORDER BY hit_count DESC, last_accessed_at DESC LIMIT ?
                    """)) {
                stmt.setLong(1, now());
                stmt.setInt(2, Math.max(1, limit));
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        entries.add(new CacheEntry(
                            rs.getString("cache_key"),
                            CacheType.fromValue(rs.getString("cache_type")),
                            rs.getString("data"),
                            Instant.ofEpochMilli(rs.getLong("expires_at")),
                            rs.getLong("hit_count"),
                            Instant.ofEpochMilli(rs.getLong("last_accessed_at")),
                            Instant.ofEpochMilli(rs.getLong("created_at"))));
                    }
                }
            }
            return entries;
        });
    }

    @Override
    public CompletableFuture<Integer> clear() {
        return write("clear cache", conn -> {
            try (Statement stmt = conn.createStatement()) {
                return stmt.executeUpdate("DELETE FROM api_cache");
            }
        });
    }

    private static long countRows(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM api_cache")) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }
}
