package ch.lexcite.storage.impl;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.lexcite.storage.CourtLevel;
import ch.lexcite.storage.DecisionQuery;
import ch.lexcite.storage.DecisionRecord;
import ch.lexcite.storage.DecisionStore;
import ch.lexcite.storage.SearchPage;
import ch.lexcite.storage.StorageException;

/**
 * SQLite implementation of {@link DecisionStore} backed by the {@code decisions} table.
 *
 * <p>Upserts key on {@code external_id}. The stored {@code last_fetched_at} is the
 * larger of the current time and the previous value plus one millisecond, so it
 * strictly increases even when two upserts fall into the same millisecond.</p>
 */
public final class SQLiteDecisionStore extends AbstractSQLiteStore implements DecisionStore {

    private static final Logger LOG = Logger.getLogger(SQLiteDecisionStore.class);

    private static final TypeReference<Set<String>> STRING_SET = new TypeReference<>() {};

    private static final String UPSERT_SQL = """
        INSERT INTO decisions (external_id, court_level, court, canton, citation, chamber, title, summary,
                               decision_date, language, legal_areas, full_text, source_url, last_fetched_at, created_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT(external_id) DO UPDATE SET
            court_level = excluded.court_level,
            court = excluded.court,
            canton = excluded.canton,
            citation = excluded.citation,
            chamber = excluded.chamber,
            title = excluded.title,
            summary = excluded.summary,
            decision_date = excluded.decision_date,
            language = excluded.language,
            legal_areas = excluded.legal_areas,
            full_text = COALESCE(excluded.full_text, decisions.full_text),
            source_url = excluded.source_url,
            last_fetched_at = MAX(excluded.last_fetched_at, decisions.last_fetched_at + 1)
        """;

    private static final String COLUMNS = "external_id, court_level, court, canton, citation, chamber, title, summary, "
        + "decision_date, language, legal_areas, full_text, source_url, last_fetched_at";

    private final ObjectMapper objectMapper;

    public SQLiteDecisionStore(SQLiteConnectionManager connectionManager, ObjectMapper objectMapper) {
        this(connectionManager, objectMapper, Clock.systemUTC());
    }

    public SQLiteDecisionStore(SQLiteConnectionManager connectionManager, ObjectMapper objectMapper, Clock clock) {
        super(connectionManager, clock);
        this.objectMapper = objectMapper;
    }

    @Override
    public CompletableFuture<DecisionRecord> upsert(@NotNull DecisionRecord record) {
        return writeInTransaction("upsert decision " + record.externalId(), conn -> {
            executeUpsert(conn, record, now());
            return findByExternalId(conn, record.externalId())
                .orElseThrow(() -> new StorageException("Upserted decision vanished: " + record.externalId()));
        });
    }

    @Override
    public CompletableFuture<Integer> upsertAll(@NotNull List<DecisionRecord> records) {
        if (records.isEmpty()) {
            return CompletableFuture.completedFuture(0);
        }
        return writeInTransaction("upsert " + records.size() + " decisions", conn -> {
            long now = now();
            for (DecisionRecord record : records) {
                executeUpsert(conn, record, now);
            }
            LOG.debugf("Upserted %d decisions", records.size());
            return records.size();
        });
    }

    @Override
    public CompletableFuture<Optional<DecisionRecord>> findByExternalId(@NotNull String externalId) {
        return read("find decision " + externalId, conn -> findByExternalId(conn, externalId));
    }

    @Override
    public CompletableFuture<Optional<DecisionRecord>> findByCitation(@NotNull String citation) {
        return read("find decision by citation " + citation, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT " + COLUMNS + " FROM decisions WHERE citation = ? COLLATE NOCASE "
                        + "ORDER BY last_fetched_at DESC LIMIT 1")) {
                stmt.setString(1, citation.trim());
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
                }
            }
        });
    }

    @Override
    public CompletableFuture<SearchPage<DecisionRecord>> search(@NotNull DecisionQuery query) {
        return read("search decisions", conn -> {
            StringBuilder where = new StringBuilder(" WHERE 1 = 1");
            List<Object> params = new ArrayList<>();
            if (query.text() != null && !query.text().isBlank()) {
                where.append(" AND (title LIKE ? ESCAPE '\\' OR summary LIKE ? ESCAPE '\\'"
                    + " OR external_id LIKE ? ESCAPE '\\' OR citation LIKE ? ESCAPE '\\')");
                String like = "%" + escapeLike(query.text().trim()) + "%";
                for (int i = 0; i < 4; i++) {
                    params.add(like);
                }
            }
            addFilter(where, params, "court_level = ?", query.courtLevel() == null ? null : query.courtLevel().name());
            addFilter(where, params, "canton = ? COLLATE NOCASE", query.canton());
            addFilter(where, params, "language = ?", query.language());
            addFilter(where, params, "chamber = ? COLLATE NOCASE", query.chamber());
            addFilter(where, params, "decision_date >= ?", query.dateFrom());
            addFilter(where, params, "decision_date <= ?", query.dateTo());
            if (query.legalArea() != null && !query.legalArea().isBlank()) {
                where.append(" AND EXISTS (SELECT 1 FROM json_each(decisions.legal_areas) WHERE json_each.value = ?)");
                params.add(query.legalArea());
            }

            long total;
            try (PreparedStatement stmt = conn.prepareStatement("SELECT COUNT(*) FROM decisions" + where)) {
                bind(stmt, params);
                try (ResultSet rs = stmt.executeQuery()) {
                    total = rs.next() ? rs.getLong(1) : 0;
                }
            }

            List<DecisionRecord> records = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement("SELECT " + COLUMNS + " FROM decisions" + where
                    + " ORDER BY decision_date DESC, id DESC LIMIT ? OFFSET ?")) {
                bind(stmt, params);
                stmt.setInt(params.size() + 1, query.limit());
                stmt.setInt(params.size() + 2, query.offset());
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        records.add(mapRow(rs));
                    }
                }
            }
            return new SearchPage<>(records, total);
        });
    }

    /**
     * Escapes the LIKE wildcards so that search text matches literally.
     */
    static String escapeLike(String text) {
        return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    @Override
    public CompletableFuture<Long> count() {
        return read("count decisions", conn -> {
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM decisions")) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        });
    }

    private void executeUpsert(Connection conn, DecisionRecord record, long now) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            stmt.setString(1, record.externalId());
            stmt.setString(2, record.courtLevel().name());
            setNullableString(stmt, 3, record.court());
            setNullableString(stmt, 4, record.canton());
            setNullableString(stmt, 5, record.citation());
            setNullableString(stmt, 6, record.chamber());
            setNullableString(stmt, 7, record.title());
            setNullableString(stmt, 8, record.summary());
            setNullableString(stmt, 9, record.decisionDate());
            setNullableString(stmt, 10, record.language());
            stmt.setString(11, toJson(record.legalAreas()));
            setNullableString(stmt, 12, record.fullText());
            setNullableString(stmt, 13, record.sourceUrl());
            stmt.setLong(14, now);
            stmt.setLong(15, now);
            stmt.executeUpdate();
        }
    }

    private Optional<DecisionRecord> findByExternalId(Connection conn, String externalId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT " + COLUMNS + " FROM decisions WHERE external_id = ?")) {
            stmt.setString(1, externalId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        }
    }

    private DecisionRecord mapRow(ResultSet rs) throws SQLException {
        return DecisionRecord.builder(rs.getString("external_id"), CourtLevel.valueOf(rs.getString("court_level")))
            .court(rs.getString("court"))
            .canton(rs.getString("canton"))
            .citation(rs.getString("citation"))
            .chamber(rs.getString("chamber"))
            .title(rs.getString("title"))
            .summary(rs.getString("summary"))
            .decisionDate(rs.getString("decision_date"))
            .language(rs.getString("language"))
            .legalAreas(fromJson(rs.getString("legal_areas")))
            .fullText(rs.getString("full_text"))
            .sourceUrl(rs.getString("source_url"))
            .lastFetchedAt(Instant.ofEpochMilli(rs.getLong("last_fetched_at")))
            .build();
    }

    private String toJson(Set<String> legalAreas) {
        try {
            return objectMapper.writeValueAsString(legalAreas);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize legal areas", e);
        }
    }

    private Set<String> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Set.of();
        }
        try {
            return objectMapper.readValue(json, STRING_SET);
        } catch (JsonProcessingException e) {
            throw new StorageException("Corrupt legal_areas column: " + json, e);
        }
    }

    private static void addFilter(StringBuilder where, List<Object> params, String condition, String value) {
        if (value != null && !value.isBlank()) {
            where.append(" AND ").append(condition);
            params.add(value.trim());
        }
    }

    private static void bind(PreparedStatement stmt, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            stmt.setObject(i + 1, params.get(i));
        }
    }
}
