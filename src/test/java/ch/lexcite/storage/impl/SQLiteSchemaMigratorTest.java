package ch.lexcite.storage.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SQLiteSchemaMigratorTest {

    @TempDir
    Path tempDir;

    private SQLiteConnectionManager connectionManager;
    private SQLiteSchemaMigrator migrator;

    @BeforeEach
    void setUp() {
        connectionManager = new SQLiteConnectionManager(tempDir.resolve("test.db").toString());
        migrator = new SQLiteSchemaMigrator();
    }

    @AfterEach
    void tearDown() {
        connectionManager.close();
    }

    @Test
    void emptyDatabaseHasVersionZero() throws Exception {
        try (Connection conn = connectionManager.createConnection()) {
            assertEquals(0, migrator.getCurrentVersion(conn));
        }
    }

    @Test
    void migrationCreatesAllTables() throws Exception {
        try (Connection conn = connectionManager.createConnection()) {
            migrator.migrateToLatest(conn);

            Set<String> tables = new HashSet<>();
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT name FROM sqlite_master WHERE type='table'")) {
                while (rs.next()) {
                    tables.add(rs.getString(1));
                }
            }
            assertTrue(tables.containsAll(Set.of("schema_version", "decisions", "commentaries", "api_cache",
                "search_queries")), tables.toString());
            assertEquals(migrator.getMigrations().size(), migrator.getCurrentVersion(conn));
        }
    }

    @Test
    void migrationIsIdempotent() throws Exception {
        try (Connection conn = connectionManager.createConnection()) {
            migrator.migrateToLatest(conn);
            migrator.migrateToLatest(conn);

            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM schema_version")) {
                rs.next();
                assertEquals(migrator.getMigrations().size(), rs.getInt(1));
            }
        }
    }
}
