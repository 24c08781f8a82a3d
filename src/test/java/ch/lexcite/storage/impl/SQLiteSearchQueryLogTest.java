package ch.lexcite.storage.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.file.Path;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ch.lexcite.storage.SearchQueryEntry;

class SQLiteSearchQueryLogTest {

    @TempDir
    Path tempDir;

    private SQLiteConnectionManager connectionManager;
    private MutableClock clock;
    private SQLiteSearchQueryLog queryLog;

    @BeforeEach
    void setUp() throws Exception {
        connectionManager = new SQLiteConnectionManager(tempDir.resolve("test.db").toString());
        try (Connection conn = connectionManager.createConnection()) {
            new SQLiteSchemaMigrator().migrateToLatest(conn);
        }
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        queryLog = new SQLiteSearchQueryLog(connectionManager, clock);
    }

    @AfterEach
    void tearDown() {
        if (connectionManager != null) {
            connectionManager.close();
        }
    }

    @Test
    void recentReturnsNewestFirst() {
        queryLog.record(new SearchQueryEntry("Mietrecht", "search_cantonal_decisions", "{}", 3, 120, "api", null)).join();
        clock.advance(Duration.ofSeconds(1));
        queryLog.record(new SearchQueryEntry("Haftung", "search_federal_decisions", null, 0, 80, "database", null)).join();

        List<SearchQueryEntry> recent = queryLog.recent(10).join();

        assertEquals(2, recent.size());
        assertEquals("Haftung", recent.get(0).queryText());
        assertEquals("database", recent.get(0).source());
        assertEquals(clock.instant(), recent.get(0).createdAt());
        assertEquals(1, queryLog.recent(1).join().size());
    }
}
