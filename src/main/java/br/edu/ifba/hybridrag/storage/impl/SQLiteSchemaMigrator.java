package br.edu.ifba.hybridrag.storage.impl;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.jboss.logging.Logger;

/**
 * Applies the versioned SQLite schema on startup.
 *
 * <p>Migrations live on the classpath under {@code /db/migrations/} and are named
 * {@code V{version}__{description}.sql}. Each migration records itself in the
 * {@code schema_version} table, so re-running the migrator is a no-op.</p>
 */
public final class SQLiteSchemaMigrator {

    private static final Logger LOG = Logger.getLogger(SQLiteSchemaMigrator.class);

    private static final String MIGRATION_PATH = "/db/migrations/";

    private final List<Migration> migrations;

    public SQLiteSchemaMigrator() {
        this.migrations = List.of(
            new ResourceMigration(1, "Corpus schema", MIGRATION_PATH + "V001__corpus_schema.sql"),
            new ResourceMigration(2, "Query memory and feedback", MIGRATION_PATH + "V002__query_memory.sql"),
            new ResourceMigration(3, "Retrieval and chunk evaluations", MIGRATION_PATH + "V003__evaluations.sql")
        );
    }

    /**
     * Gets current schema version from database.
     *
     * @param conn database connection
     * @return current version number, 0 if the schema was never initialized
     */
    public int getCurrentVersion(Connection conn) {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                 "SELECT name FROM sqlite_master WHERE type='table' AND name='schema_version'")) {
            if (!rs.next()) {
                return 0;
            }
        } catch (SQLException e) {
            LOG.debug("Error checking schema_version table", e);
            return 0;
        }

        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT MAX(version) FROM schema_version")) {
            if (rs.next()) {
                int version = rs.getInt(1);
                return rs.wasNull() ? 0 : version;
            }
            return 0;
        } catch (SQLException e) {
            LOG.debug("Error getting current schema version", e);
            return 0;
        }
    }

    /**
     * Applies all pending migrations inside one transaction.
     *
     * @param conn database connection
     * @throws SQLException if a migration fails; nothing is applied in that case
     */
    public void migrateToLatest(Connection conn) throws SQLException {
        int currentVersion = getCurrentVersion(conn);
        LOG.infof("Current schema version: %d", currentVersion);

        boolean autoCommit = conn.getAutoCommit();
        try {
            conn.setAutoCommit(false);
            for (Migration migration : migrations) {
                if (migration.getVersion() > currentVersion) {
                    LOG.infof("Applying migration V%03d: %s", migration.getVersion(), migration.getDescription());
                    migration.apply(conn);
                }
            }
            conn.commit();
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    /**
     * A single schema migration.
     */
    public interface Migration {

        int getVersion();

        String getDescription();

        void apply(Connection conn) throws SQLException;
    }

    /**
     * Migration that loads SQL from a classpath resource.
     */
    private static final class ResourceMigration implements Migration {
        private final int version;
        private final String description;
        private final String resourcePath;

        ResourceMigration(int version, String description, String resourcePath) {
            this.version = version;
            this.description = description;
            this.resourcePath = resourcePath;
        }

        @Override
        public int getVersion() {
            return version;
        }

        @Override
        public String getDescription() {
            return description;
        }

        @Override
        public void apply(Connection conn) throws SQLException {
            try (Statement stmt = conn.createStatement()) {
                for (String statement : splitStatements(loadResource())) {
                    LOG.tracef("Executing: %s", statement.substring(0, Math.min(60, statement.length())));
                    stmt.execute(statement);
                }
            }
        }

        private String loadResource() {
            InputStream is = SQLiteSchemaMigrator.class.getResourceAsStream(resourcePath);
            if (is == null) {
                throw new IllegalStateException("Migration resource not found: " + resourcePath);
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                return reader.lines()
                    .filter(line -> !line.trim().startsWith("--"))
                    .collect(Collectors.joining("\n"));
            } catch (Exception e) {
                throw new IllegalStateException("Failed to load migration: " + resourcePath, e);
            }
        }

        /**
         * Splits a script on semicolons that are not inside a quoted literal.
         */
        private static List<String> splitStatements(String sql) {
            List<String> statements = new ArrayList<>();
            StringBuilder current = new StringBuilder();
            char quoteChar = 0;

            for (int i = 0; i < sql.length(); i++) {
                char c = sql.charAt(i);
                if (quoteChar != 0) {
                    if (c == quoteChar) {
                        quoteChar = 0;
                    }
                    current.append(c);
                } else if (c == '\'' || c == '"') {
                    quoteChar = c;
                    current.append(c);
                } else if (c == ';') {
                    addIfPresent(statements, current);
                    current = new StringBuilder();
                } else {
                    current.append(c);
                }
            }
            addIfPresent(statements, current);
            return statements;
        }

        private static void addIfPresent(List<String> statements, StringBuilder statement) {
            String trimmed = statement.toString().trim();
            if (!trimmed.isEmpty()) {
                statements.add(trimmed);
            }
        }
    }
}
