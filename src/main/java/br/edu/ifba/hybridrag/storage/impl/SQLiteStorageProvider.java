package br.edu.ifba.hybridrag.storage.impl;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

import br.edu.ifba.hybridrag.storage.EvaluationStorage;
import br.edu.ifba.hybridrag.storage.FeedbackStorage;
import br.edu.ifba.hybridrag.storage.GraphStorage;
import br.edu.ifba.hybridrag.storage.QueryCacheStorage;
import br.edu.ifba.hybridrag.storage.VectorStorage;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

/**
 * CDI producer for the SQLite-backed storages.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Creates and owns the SQLiteConnectionManager</li>
 *   <li>Runs schema migrations on startup</li>
 *   <li>Produces the storage interfaces for injection</li>
 * </ul>
 *
 * <p>Example configuration:</p>
 * <pre>
 * hybridrag.storage.sqlite.path=data/hybridrag.db
 * hybridrag.storage.sqlite.read-pool-size=4
 * </pre>
 */
@ApplicationScoped
public class SQLiteStorageProvider {

    private static final Logger LOG = Logger.getLogger(SQLiteStorageProvider.class);

    @ConfigProperty(name = "hybridrag.storage.sqlite.path", defaultValue = "data/hybridrag.db")
    String databasePath;

    @ConfigProperty(name = "hybridrag.storage.sqlite.read-pool-size", defaultValue = "4")
    int readPoolSize;

    @ConfigProperty(name = "hybridrag.storage.sqlite.busy-timeout", defaultValue = "30000")
    long busyTimeoutMs;

    @ConfigProperty(name = "hybridrag.storage.sqlite.wal-mode", defaultValue = "true")
    boolean walMode;

    @Inject
    ObjectMapper objectMapper;

    private SQLiteConnectionManager connectionManager;
    private boolean initialized = false;

    @PostConstruct
    void initialize() {
        LOG.infof("Initializing SQLite storage with database: %s", databasePath);

        connectionManager = new SQLiteConnectionManager(
            databasePath,
            Duration.ofMillis(busyTimeoutMs),
            walMode,
            readPoolSize
        );

        try {
            runMigrations();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to run SQLite schema migrations", e);
        }

        initialized = true;
        LOG.info("SQLite storage initialized successfully");
    }

    @PreDestroy
    void shutdown() {
        LOG.info("Shutting down SQLite storage");
        if (connectionManager != null) {
            connectionManager.close();
        }
    }

    @Produces
    @ApplicationScoped
    public VectorStorage produceVectorStorage() {
        ensureInitialized();
        LOG.info("Created SQLiteVectorStorage instance");
        return new SQLiteVectorStorage(connectionManager);
    }

    @Produces
    @ApplicationScoped
    public GraphStorage produceGraphStorage() {
        ensureInitialized();
        LOG.info("Created SQLiteGraphStorage instance");
        return new SQLiteGraphStorage(connectionManager);
    }

    @Produces
    @ApplicationScoped
    public QueryCacheStorage produceQueryCacheStorage() {
        ensureInitialized();
        LOG.info("Created SQLiteQueryCacheStorage instance");
        return new SQLiteQueryCacheStorage(connectionManager, objectMapper);
    }

    @Produces
    @ApplicationScoped
    public FeedbackStorage produceFeedbackStorage() {
        ensureInitialized();
        LOG.info("Created SQLiteFeedbackStorage instance");
        return new SQLiteFeedbackStorage(connectionManager, objectMapper);
    }

    @Produces
    @ApplicationScoped
    public EvaluationStorage produceEvaluationStorage() {
        ensureInitialized();
        LOG.info("Created SQLiteEvaluationStorage instance");
        return new SQLiteEvaluationStorage(connectionManager);
    }

    /**
     * Gets the connection manager, for tooling that seeds or inspects the database.
     */
    public SQLiteConnectionManager getConnectionManager() {
        ensureInitialized();
        return connectionManager;
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("SQLite storage not initialized");
        }
    }

    private void runMigrations() throws SQLException {
        LOG.info("Running SQLite schema migrations");
        SQLiteSchemaMigrator migrator = new SQLiteSchemaMigrator();
        Connection conn = connectionManager.getWriteConnection();
        try {
            migrator.migrateToLatest(conn);
            LOG.infof("Schema at version %d", migrator.getCurrentVersion(conn));
        } finally {
            connectionManager.releaseWriteConnection(conn);
        }
    }
}
