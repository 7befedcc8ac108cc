package io.github.yok.tablemailer.db;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.github.yok.tablemailer.config.DbConfig;
import io.github.yok.tablemailer.util.MaskingLogUtil;
import java.sql.Connection;
import java.sql.SQLException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Creates the connection pool used by one job run and verifies it is reachable.
 *
 * <p>
 * Pool bounds: at most {@value #MAX_POOL_SIZE} open connections, {@value #MIN_IDLE} kept idle, no
 * maximum connection lifetime. The caller owns the returned pool and closes it when the run ends.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DataSourceFactory {

    static final int MAX_POOL_SIZE = 25;
    static final int MIN_IDLE = 5;
    static final int PING_TIMEOUT_SECONDS = 5;
    static final String POOL_NAME = "tablemailer-db";

    /**
     * Opens a pool and pings the database.
     *
     * @param config database settings
     * @return pool ready for use
     * @throws SQLException if the pool cannot be created or the ping fails
     */
    public HikariDataSource create(DbConfig config) throws SQLException {
        log.info("Attempting to connect to the database. {}", MaskingLogUtil.describe(config));

        HikariDataSource dataSource;
        try {
            dataSource = new HikariDataSource(toHikariConfig(config));
        } catch (RuntimeException e) {
            log.error("Failed to open database pool: {}", e.getMessage());
            throw new SQLException("Failed to open database pool: " + e.getMessage(), e);
        }

        try {
            ping(dataSource);
        } catch (SQLException e) {
            log.error("Failed to ping database: {}", e.getMessage());
            dataSource.close();
            throw e;
        }

        log.info("Database connection established successfully.");
        return dataSource;
    }

    /**
     * Maps settings onto a Hikari configuration.
     *
     * @param config database settings
     * @return pool configuration
     */
    HikariConfig toHikariConfig(DbConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName(POOL_NAME);
        hikari.setJdbcUrl(config.resolveJdbcUrl());
        hikari.setUsername(config.getUsername());
        hikari.setPassword(config.getPassword());
        if (StringUtils.isNotBlank(config.getDriverClass())) {
            hikari.setDriverClassName(config.getDriverClass().trim());
        }
        hikari.setMaximumPoolSize(MAX_POOL_SIZE);
        hikari.setMinimumIdle(MIN_IDLE);
        // 0 = unlimited lifetime
        hikari.setMaxLifetime(0);
        return hikari;
    }

    private void ping(HikariDataSource dataSource) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            if (!conn.isValid(PING_TIMEOUT_SECONDS)) {
                throw new SQLException("Database did not answer the ping");
            }
        }
    }
}
