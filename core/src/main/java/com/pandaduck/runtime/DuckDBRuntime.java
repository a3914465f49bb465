package com.pandaduck.runtime;

import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * DuckDB runtime - owns a single DuckDB connection.
 *
 * <p>Each frame session creates one runtime. The runtime is responsible for
 * creating, configuring, and closing the connection.
 *
 * <p>Test usage:
 * <pre>{@code
 * @BeforeEach
 * void setup() {
 *     runtime = DuckDBRuntime.create("jdbc:duckdb::memory:test_" + System.nanoTime());
 * }
 *
 * @AfterEach
 * void teardown() {
 *     runtime.close();
 * }
 * }</pre>
 */
public class DuckDBRuntime implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBRuntime.class);

    private final String jdbcUrl;
    private final DuckDBConnection connection;
    private volatile boolean closed = false;

    private DuckDBRuntime(String jdbcUrl) throws SQLException {
        this.jdbcUrl = jdbcUrl;

        logger.info("Creating DuckDB runtime with URL: {}", jdbcUrl);

        Connection rawConn = DriverManager.getConnection(jdbcUrl);
        this.connection = rawConn.unwrap(DuckDBConnection.class);
        configureConnection();

        logger.info("DuckDB runtime initialized");
    }

    /**
     * Configures the connection.
     *
     * <p>Insertion order is preserved so that unsorted plans over local rows
     * keep their row order, and NULLs sort first by default, matching the
     * explicit sort orders the frame layer generates.
     */
    private void configureConnection() throws SQLException {
        int threads = Runtime.getRuntime().availableProcessors();
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(String.format("SET threads=%d", threads));
            stmt.execute("SET enable_progress_bar=false");
            stmt.execute("SET preserve_insertion_order=true");
            stmt.execute("SET default_null_order='NULLS FIRST'");

            logger.debug("DuckDB configured: threads={}", threads);
        }
    }

    /**
     * Create a new DuckDBRuntime with custom JDBC URL.
     *
     * @param jdbcUrl JDBC URL (e.g., "jdbc:duckdb::memory:session123")
     * @return new DuckDBRuntime instance
     * @throws RuntimeException if connection fails
     */
    public static DuckDBRuntime create(String jdbcUrl) {
        try {
            return new DuckDBRuntime(jdbcUrl);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create DuckDB runtime: " + jdbcUrl, e);
        }
    }

    /**
     * Get the underlying DuckDB connection.
     *
     * <p>The connection is managed by the runtime - callers should NOT close it.
     *
     * @return the DuckDB connection
     * @throws IllegalStateException if runtime is closed
     */
    public DuckDBConnection getConnection() {
        if (closed) {
            throw new IllegalStateException("DuckDB runtime is closed");
        }
        return connection;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Close the runtime and release resources.
     *
     * <p>After closing, the runtime cannot be used.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        logger.info("Closing DuckDB runtime: {}", jdbcUrl);
        try {
            connection.close();
            logger.info("DuckDB connection closed");
        } catch (SQLException e) {
            logger.error("Error closing DuckDB connection", e);
        }
    }
}
