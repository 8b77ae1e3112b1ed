package com.di.chunkmutator.util;

import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;

/**
 * Logs HikariCP connection pool statistics at pool creation and before close,
 * so pool saturation by the segment workers is visible.
 */
@Slf4j
public final class ConnectionPoolLogger {

    private ConnectionPoolLogger() {}

    /**
     * Logs pool statistics if the DataSource is a HikariCP pool.
     *
     * @param dataSource the DataSource
     * @param phase      description of when this is being logged
     */
    public static void logPoolStats(DataSource dataSource, String phase) {
        if (dataSource == null) {
            return;
        }
        if (!(dataSource instanceof com.zaxxer.hikari.HikariDataSource hikari)) {
            log.debug("Pool stats not available (not HikariCP): phase={}", phase);
            return;
        }
        try {
            var mx = hikari.getHikariPoolMXBean();
            if (mx == null) {
                log.debug("[POOL] {} | pool={} not started yet", phase, hikari.getPoolName());
                return;
            }
            log.info("[POOL] {} | pool={} | maxSize={}, minIdle={} | active={}, idle={}, total={}, waiting={}",
                    phase, hikari.getPoolName(), hikari.getMaximumPoolSize(), hikari.getMinimumIdle(),
                    mx.getActiveConnections(), mx.getIdleConnections(),
                    mx.getTotalConnections(), mx.getThreadsAwaitingConnection());
        } catch (Exception e) {
            log.debug("Could not read pool stats for phase {}: {}", phase, e.getMessage());
        }
    }
}
