package com.example.backendtemplate.service.lifecycle;

import com.zaxxer.hikari.HikariDataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Releases the pooled database connections during shutdown
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionPoolManager {

    private final DataSource dataSource;

    /**
     * Close the connection pool. Safe to call more than once.
     */
    public void dispose() {
        var hikari = unwrap(dataSource);
        if (hikari == null) {
            log.debug("DataSource {} is not a connection pool, nothing to close", dataSource.getClass().getSimpleName());
            return;
        }
        if (hikari.isClosed()) {
            log.debug("Connection pool {} already closed", hikari.getPoolName());
            return;
        }
        hikari.close();
        log.info("Connection pool {} closed", hikari.getPoolName());
    }

    private static HikariDataSource unwrap(DataSource dataSource) {
        if (dataSource instanceof HikariDataSource hikari) {
            return hikari;
        }
        try {
            if (dataSource.isWrapperFor(HikariDataSource.class)) {
                return dataSource.unwrap(HikariDataSource.class);
            }
        } catch (SQLException e) {
            log.debug("Cannot unwrap DataSource: {}", e.getMessage());
        }
        return null;
    }
}
