package com.marginal.data.sqlite;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Manages the SQLite connection to one market database file, in WAL mode.
 * One connection per file, shared by all DAOs reading that file.
 */
public class SqliteConnection {

    private static final Logger log = LoggerFactory.getLogger(SqliteConnection.class);

    private static final Map<Path, SqliteConnection> instances = new ConcurrentHashMap<>();

    private final Path dbFile;
    private volatile Connection connection;
    private final Object lock = new Object();

    private SqliteConnection(Path dbFile) {
        this.dbFile = dbFile;
    }

    /**
     * Get or create the connection for a database file.
     */
    public static SqliteConnection forFile(Path dbFile) {
        return instances.computeIfAbsent(dbFile.toAbsolutePath().normalize(), SqliteConnection::new);
    }

    public Path getDbFile() {
        return dbFile;
    }

    /**
     * Check if the database file exists.
     */
    public boolean exists() {
        return Files.exists(dbFile);
    }

    /**
     * Get or create the SQLite connection.
     */
    public Connection getConnection() throws SQLException {
        Connection conn = connection;
        if (conn != null && !conn.isClosed()) {
            return conn;
        }

        synchronized (lock) {
            if (connection == null || connection.isClosed()) {
                connection = createConnection();
            }
            return connection;
        }
    }

    private Connection createConnection() throws SQLException {
        Connection conn = DriverManager.getConnection("jdbc:sqlite:" + dbFile);

        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA journal_mode=WAL");
            stmt.execute("PRAGMA synchronous=NORMAL");
            // 64MB page cache, 128MB memory map; the backtest reads the same tables every day
            stmt.execute("PRAGMA cache_size=-65536");
            stmt.execute("PRAGMA mmap_size=134217728");
        }

        log.debug("Created SQLite connection at {}", dbFile);
        return conn;
    }

    /**
     * Execute a function within a transaction.
     * Automatically commits on success, rolls back on failure.
     */
    public <T> T executeInTransaction(TransactionFunction<T> function) throws SQLException {
        Connection conn = getConnection();
        synchronized (lock) {
            boolean autoCommitOriginal = conn.getAutoCommit();
            try {
                conn.setAutoCommit(false);
                T result = function.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    log.warn("Rollback failed: {}", rollbackEx.getMessage());
                }
                throw e;
            } finally {
                restoreAutoCommit(conn, autoCommitOriginal);
            }
        }
    }

    /**
     * Execute a void function within a transaction.
     */
    public void executeInTransaction(TransactionConsumer consumer) throws SQLException {
        executeInTransaction(conn -> {
            consumer.accept(conn);
            return null;
        });
    }

    private void restoreAutoCommit(Connection conn, boolean autoCommit) {
        try {
            conn.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            log.warn("Could not restore auto-commit on {}: {}", dbFile, e.getMessage());
        }
    }

    /**
     * Close the connection for this file.
     */
    public void close() {
        synchronized (lock) {
            if (connection != null) {
                try {
                    connection.close();
                    log.debug("Closed SQLite connection at {}", dbFile);
                } catch (SQLException e) {
                    log.warn("Error closing connection at {}: {}", dbFile, e.getMessage());
                }
                connection = null;
            }
        }
        instances.remove(dbFile, this);
    }

    /**
     * Functional interface for transactional operations returning a value.
     */
    @FunctionalInterface
    public interface TransactionFunction<T> {
        T apply(Connection connection) throws SQLException;
    }

    /**
     * Functional interface for transactional operations with no return value.
     */
    @FunctionalInterface
    public interface TransactionConsumer {
        void accept(Connection connection) throws SQLException;
    }
}
