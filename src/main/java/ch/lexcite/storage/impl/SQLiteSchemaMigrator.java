package ch.lexcite.storage.impl;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.jboss.logging.Logger;

/**
 * Applies the SQL migrations under {@code /db/migrations/} in version order.
 *
 * <p>Migration files are named {@code V{version}__{description}.sql}. Each file
 * records itself in the {@code schema_version} table; migrations at or below
 * the recorded version are skipped.</p>
 */
public final class SQLiteSchemaMigrator {

    private static final Logger LOG = Logger.getLogger(SQLiteSchemaMigrator.class);

    private static final String MIGRATION_PATH = "/db/migrations/";
    private static final Pattern FILE_NAME = Pattern.compile("^V(\\d+)__(\\w+)\\.sql$");

    static final List<String> MIGRATION_FILES = List.of(
        "V001__initial_schema.sql"
    );

    private final List<Migration> migrations;

    public SQLiteSchemaMigrator() {
        this(MIGRATION_FILES);
    }

    SQLiteSchemaMigrator(List<String> fileNames) {
        this.migrations = fileNames.stream()
            .map(SQLiteSchemaMigrator::toMigration)
            .sorted(Comparator.comparingInt(Migration::version))
            .collect(Collectors.toList());
    }

    /**
     * @return highest applied version, 0 for an empty database
     */
    public int getCurrentVersion(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                 "SELECT name FROM sqlite_master WHERE type='table' AND name='schema_version'")) {
            if (!rs.next()) {
                return 0;
            }
        }
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT MAX(version) FROM schema_version")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    /**
     * Applies all pending migrations in a single transaction.
     *
     * @throws SQLException if a migration fails; nothing is applied in that case
     */
    public void migrateToLatest(Connection conn) throws SQLException {
        int currentVersion = getCurrentVersion(conn);
        boolean autoCommit = conn.getAutoCommit();
        try {
            conn.setAutoCommit(false);
            for (Migration migration : migrations) {
                if (migration.version() > currentVersion) {
                    LOG.infof("Applying migration V%03d: %s", migration.version(), migration.description());
                    migration.apply(conn);
                }
            }
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    public List<Migration> getMigrations() {
        return List.copyOf(migrations);
    }

    private static Migration toMigration(String fileName) {
        Matcher matcher = FILE_NAME.matcher(fileName);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Migration file name must match V{version}__{description}.sql: " + fileName);
        }
        return new Migration(Integer.parseInt(matcher.group(1)), matcher.group(2).replace('_', ' '),
            MIGRATION_PATH + fileName);
    }

    /**
     * A versioned SQL script on the classpath.
     */
    public record Migration(int version, String description, String resourcePath) {

        void apply(Connection conn) throws SQLException {
            try (Statement stmt = conn.createStatement()) {
                for (String sql : splitStatements(load())) {
                    LOG.tracef("Executing: %s", sql.substring(0, Math.min(60, sql.length())));
                    stmt.execute(sql);
                }
            }
        }

        private String load() {
            InputStream is = SQLiteSchemaMigrator.class.getResourceAsStream(resourcePath);
            if (is == null) {
                throw new IllegalStateException("Migration resource not found: " + resourcePath);
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                return reader.lines().collect(Collectors.joining("\n"));
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read migration: " + resourcePath, e);
            }
        }
    }

    /**
     * Splits a script into statements on semicolons outside quotes, dropping
     * {@code --} comments.
     */
    static List<String> splitStatements(String script) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;

        for (int i = 0; i < script.length(); i++) {
            char c = script.charAt(i);
            if (quote != 0) {
                current.append(c);
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                current.append(c);
                quote = c;
            } else if (c == '-' && i + 1 < script.length() && script.charAt(i + 1) == '-') {
                int lineEnd = script.indexOf('\n', i);
                i = lineEnd < 0 ? script.length() : lineEnd - 1;
            } else if (c == ';') {
                addStatement(statements, current);
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        addStatement(statements, current);
        return statements;
    }

    private static void addStatement(List<String> statements, StringBuilder sql) {
        String trimmed = sql.toString().trim();
        if (!trimmed.isEmpty()) {
            statements.add(trimmed);
        }
    }
}
