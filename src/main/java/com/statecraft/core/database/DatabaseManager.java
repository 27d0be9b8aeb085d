package com.statecraft.core.database;

import com.statecraft.core.infrastructure.EngineConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

public class DatabaseManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DatabaseManager.class);

    private final HikariDataSource dataSource;

    public DatabaseManager(EngineConfig cfg) {
        this(cfg.jdbcUrl(), cfg.poolMaxSize(), cfg.busyTimeoutMs());
    }

    public DatabaseManager(String jdbcUrl, int maxPoolSize, int busyTimeoutMs) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setPoolName("statecraft-db");

        // Ogni transazione di scrittura parte con BEGIN IMMEDIATE: il lock di scrittura
        // viene preso subito, prima di rileggere i saldi.
        config.addDataSourceProperty("transaction_mode", "IMMEDIATE");
        config.addDataSourceProperty("busy_timeout", String.valueOf(busyTimeoutMs));
        config.addDataSourceProperty("foreign_keys", "true");
        config.addDataSourceProperty("journal_mode", "WAL");

        config.setMaximumPoolSize(maxPoolSize);
        config.setMinimumIdle(1);
        config.setIdleTimeout(30000);
        config.setConnectionTimeout(Math.max(2000, busyTimeoutMs * 2L));

        this.dataSource = new HikariDataSource(config);
        log.info("Connection pool ready on {} (max {} connections)", jdbcUrl, maxPoolSize);
    }

    @FunctionalInterface
    public interface SqlWork<T> {
        T apply(Connection conn) throws SQLException;
    }

    /**
     * Runs {@code work} as a single write transaction. Any exception, checked or not, rolls back everything
     * done on the connection and is rethrown unchanged.
     */
    public <T> T inTransaction(SqlWork<T> work) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                T out = work.apply(conn);
                conn.commit();
                return out;
            } catch (SQLException | RuntimeException ex) {
                rollbackQuietly(conn, ex);
                throw ex;
            } finally {
                conn.setAutoCommit(true);
            }
        }
    }

    /**
     * Read-only work on an autocommit connection.
     */
    public <T> T read(SqlWork<T> work) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            return work.apply(conn);
        }
    }

    private static void rollbackQuietly(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rb) {
            cause.addSuppressed(rb);
        }
    }

    @Override
    public void close() {
        if (dataSource != null) {
            dataSource.close();
        }
    }
}
