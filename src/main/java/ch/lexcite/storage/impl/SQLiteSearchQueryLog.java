package ch.lexcite.storage.impl;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;

import ch.lexcite.storage.SearchQueryEntry;
import ch.lexcite.storage.SearchQueryLog;

/**
 * SQLite implementation of {@link SearchQueryLog} backed by the {@code search_queries} table.
 */
public final class SQLiteSearchQueryLog extends AbstractSQLiteStore implements SearchQueryLog {

    public SQLiteSearchQueryLog(SQLiteConnectionManager connectionManager) {
        this(connectionManager, Clock.systemUTC());
    }

    public SQLiteSearchQueryLog(SQLiteConnectionManager connectionManager, Clock clock) {
        super(connectionManager, clock);
    }

    @Override
    public CompletableFuture<Void> record(@NotNull SearchQueryEntry entry) {
        return write("record search query", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("""
                    INSERT INTO search_queries (query_text, query_type, filters, result_count, execution_time_ms,
                                                source, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                    """)) {
                setNullableString(stmt, 1, entry.queryText());
                stmt.setString(2, entry.queryType());
                setNullableString(stmt, 3, entry.filters());
                stmt.setInt(4, entry.resultCount());
                stmt.setLong(5, entry.executionTimeMs());
                stmt.setString(6, entry.source());
                stmt.setLong(7, entry.createdAt() != null ? entry.createdAt().toEpochMilli() : now());
                stmt.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<List<SearchQueryEntry>> recent(int limit) {
        return read("read recent search queries", conn -> {
            List<SearchQueryEntry> entries = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement("""
                    SELECT query_text, query_type, filters, result_count, execution_time_ms, source, created_at
                    FROM search_queries ORDER BY created_at DESC, id DESC LIMIT ?
                    """)) {
                stmt.setInt(1, Math.max(1, limit));
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        entries.add(new SearchQueryEntry(
                            rs.getString("query_text"),
                            rs.getString("query_type"),
                            rs.getString("filters"),
                            rs.getInt("result_count"),
                            rs.getLong("execution_time_ms"),
                            rs.getString("source"),
                            Instant.ofEpochMilli(rs.getLong("created_at"))));
                    }
                }
            }
            return entries;
        });
    }
}
