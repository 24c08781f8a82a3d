package ch.lexcite.storage.impl;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.lexcite.storage.CommentaryRecord;
import ch.lexcite.storage.CommentaryStore;
import ch.lexcite.storage.StorageException;

/**
 * SQLite implementation of {@link CommentaryStore}.
 */
public final class SQLiteCommentaryStore extends AbstractSQLiteStore implements CommentaryStore {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private static final String UPSERT_SQL = """
        INSERT INTO commentaries (external_id, title, authors, legislative_act, language, summary, content,
                                  source_url, updated, last_fetched_at, created_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT(external_id) DO UPDATE SET
            title = excluded.title,
            authors = excluded.authors,
            legislative_act = excluded.legislative_act,
            language = excluded.language,
            summary = excluded.summary,
            content = COALESCE(excluded.content, commentaries.content),
            source_url = excluded.source_url,
            updated = excluded.updated,
            last_fetched_at = MAX(excluded.last_fetched_at, commentaries.last_fetched_at + 1)
        """;

    private final ObjectMapper objectMapper;

    public SQLiteCommentaryStore(SQLiteConnectionManager connectionManager, ObjectMapper objectMapper) {
        this(connectionManager, objectMapper, Clock.systemUTC());
    }

    public SQLiteCommentaryStore(SQLiteConnectionManager connectionManager, ObjectMapper objectMapper, Clock clock) {
        super(connectionManager, clock);
        this.objectMapper = objectMapper;
    }

    @Override
    public CompletableFuture<CommentaryRecord> upsert(@NotNull CommentaryRecord record) {
        return writeInTransaction("upsert commentary " + record.externalId(), conn -> {
            executeUpsert(conn, record, now());
            return find(conn, record.externalId())
                .orElseThrow(() -> new StorageException("Upserted commentary vanished: " + record.externalId()));
        });
    }

    @Override
    public CompletableFuture<Integer> upsertAll(@NotNull List<CommentaryRecord> records) {
        if (records.isEmpty()) {
            return CompletableFuture.completedFuture(0);
        }
        return writeInTransaction("upsert " + records.size() + " commentaries", conn -> {
            long now = now();
            for (CommentaryRecord record : records) {
                executeUpsert(conn, record, now);
            }
            return records.size();
        });
    }

    @Override
    public CompletableFuture<Optional<CommentaryRecord>> findByExternalId(@NotNull String externalId) {
        return read("find commentary " + externalId, conn -> find(conn, externalId));
    }

    private void executeUpsert(Connection conn, CommentaryRecord record, long now) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            stmt.setString(1, record.externalId());
            setNullableString(stmt, 2, record.title());
            stmt.setString(3, toJson(record.authors()));
            setNullableString(stmt, 4, record.legislativeAct());
            setNullableString(stmt, 5, record.language());
            setNullableString(stmt, 6, record.summary());
            setNullableString(stmt, 7, record.content());
            setNullableString(stmt, 8, record.sourceUrl());
            setNullableString(stmt, 9, record.updated());
            stmt.setLong(10, now);
            stmt.setLong(11, now);
            stmt.executeUpdate();
        }
    }

    private Optional<CommentaryRecord> find(Connection conn, String externalId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("""
                SELECT external_id, title, authors, legislative_act, language, summary, content, source_url,
                       updated, last_fetched_at
                FROM commentaries WHERE external_id = ?
                """)) {
            stmt.setString(1, externalId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new CommentaryRecord(
                    rs.getString("external_id"),
                    rs.getString("title"),
                    fromJson(rs.getString("authors")),
                    rs.getString("legislative_act"),
                    rs.getString("language"),
                    rs.getString("summary"),
                    rs.getString("content"),
                    rs.getString("source_url"),
                    rs.getString("updated"),
                    Instant.ofEpochMilli(rs.getLong("last_fetched_at"))));
            }
        }
    }

    private String toJson(List<String> authors) {
        try {
            return objectMapper.writeValueAsString(authors);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize authors", e);
        }
    }

    private List<String> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new StorageException("Corrupt authors column: " + json, e);
        }
    }
}
