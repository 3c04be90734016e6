package br.edu.ifba.hybridrag.storage.impl;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.locks.ReentrantLock;

import org.jboss.logging.Logger;
import org.sqlite.SQLiteConfig;

/**
 * Manages SQLite connections for the engine's transactional store.
 *
 * <p>Features:</p>
 * <ul>
 *   <li>WAL mode enabled by default so readers never block the writer</li>
 *   <li>Connection pool for read operations</li>
 *   <li>Exclusive write connection guarded by a ReentrantLock</li>
 *   <li>Foreign key enforcement enabled</li>
 * </ul>
 *
 * <p>Usage:</p>
 * <pre>
 * SQLiteConnectionManager manager = new SQLiteConnectionManager("data/hybridrag.db");
 * Connection conn = manager.getWriteConnection();
 * try {
 *     // write
 * } finally {
 *     manager.releaseWriteConnection(conn);
 * }
 * </pre>
 */
public final class SQLiteConnectionManager implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(SQLiteConnectionManager.class);

    private static final Duration DEFAULT_BUSY_TIMEOUT = Duration.ofSeconds(30);
    private static final int DEFAULT_POOL_SIZE = 4;

    private final String databasePath;
    private final Duration busyTimeout;
    private final boolean walMode;
    private final BlockingQueue<Connection> readPool;
    private final ReentrantLock writeLock;

    private Connection writeConnection;
    private volatile boolean closed = false;

    /**
     * Creates a connection manager with default settings.
     *
     * @param databasePath path to the SQLite database file
     */
    public SQLiteConnectionManager(String databasePath) {
        this(databasePath, DEFAULT_BUSY_TIMEOUT, true, DEFAULT_POOL_SIZE);
    }

    /**
     * Creates a connection manager with custom settings.
     *
     * @param databasePath path to SQLite database file
     * @param busyTimeout how long to wait for locks held by other connections
     * @param walMode whether to enable WAL mode
     * @param readPoolSize number of pooled read connections
     */
    public SQLiteConnectionManager(String databasePath, Duration busyTimeout,
            boolean walMode, int readPoolSize) {
        this.databasePath = databasePath;
        this.busyTimeout = busyTimeout;
        this.walMode = walMode;
        this.readPool = new ArrayBlockingQueue<>(Math.max(1, readPoolSize));
        this.writeLock = new ReentrantLock(true);
    }

    /**
     * Creates a new connection with pragmas configured.
     *
     * @return configured Connection
     */
    public Connection createConnection() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }

        ensureParentDirectory();

        try {
            SQLiteConfig config = new SQLiteConfig();
            config.enforceForeignKeys(true);
            config.setBusyTimeout((int) busyTimeout.toMillis());

            Connection conn = DriverManager.getConnection("jdbc:sqlite:" + databasePath, config.toProperties());
            applyPragmas(conn);

            LOG.debugf("Created SQLite connection to %s", databasePath);
            return conn;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to create SQLite connection to " + databasePath, e);
        }
    }

    /**
     * Gets a connection for read operations, reusing a pooled one when available.
     *
     * @return read Connection, to be handed back with {@link #releaseReadConnection(Connection)}
     */
    public Connection getReadConnection() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }

        Connection conn = readPool.poll();
        if (conn != null) {
            try {
                if (!conn.isClosed()) {
                    return conn;
                }
            } catch (SQLException e) {
                LOG.debug("Pooled read connection was unusable, creating new one", e);
            }
        }
        return createConnection();
    }

    /**
     * Returns a read connection to the pool, closing it when the pool is full.
     *
     * @param conn the connection to release
     */
    public void releaseReadConnection(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            if (!conn.isClosed() && !closed) {
                if (!readPool.offer(conn)) {
                    conn.close();
                }
            } else {
                conn.close();
            }
        } catch (SQLException e) {
            LOG.debug("Error releasing read connection", e);
        }
    }

    /**
     * Gets the exclusive write connection. Only one writer is active at a time;
     * callers must release it with {@link #releaseWriteConnection(Connection)}.
     *
     * @return write Connection with the write lock held
     */
    public Connection getWriteConnection() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }

        writeLock.lock();
        try {
            if (writeConnection == null || writeConnection.isClosed()) {
                writeConnection = createConnection();
            }
            return writeConnection;
        } catch (SQLException | RuntimeException e) {
            writeLock.unlock();
            throw new IllegalStateException("Failed to get write connection", e);
        }
    }

    /**
     * Releases the write lock.
     *
     * @param conn the write connection obtained from {@link #getWriteConnection()}
     */
    public void releaseWriteConnection(Connection conn) {
        if (conn == writeConnection && writeLock.isHeldByCurrentThread()) {
            writeLock.unlock();
        }
    }

    private void applyPragmas(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            if (walMode) {
                stmt.execute("PRAGMA journal_mode = WAL");
            }
            stmt.execute("PRAGMA synchronous = NORMAL");
            stmt.execute("PRAGMA temp_store = MEMORY");
        }
    }

    private void ensureParentDirectory() {
        if (databasePath.startsWith(":memory:")) {
            return;
        }
        try {
            Path parentDir = Paths.get(databasePath).toAbsolutePath().getParent();
            if (parentDir != null && !Files.exists(parentDir)) {
                Files.createDirectories(parentDir);
                LOG.infof("Created database directory: %s", parentDir);
            }
        } catch (Exception e) {
            LOG.warnf("Could not create parent directory for %s: %s", databasePath, e.getMessage());
        }
    }

    /**
     * Closes the write connection and every pooled read connection.
     */
    @Override
    public void close() {
        closed = true;

        if (writeConnection != null) {
            try {
                writeConnection.close();
            } catch (SQLException e) {
                LOG.debug("Error closing write connection", e);
            }
            writeConnection = null;
        }

        Connection conn;
        while ((conn = readPool.poll()) != null) {
            try {
                conn.close();
            } catch (SQLException e) {
                LOG.debug("Error closing pooled connection", e);
            }
        }

        LOG.infof("Closed SQLite connection manager for %s", databasePath);
    }
}
