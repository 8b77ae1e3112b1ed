package com.di.chunkmutator.util;

import com.di.chunkmutator.config.DbConfigSnapshot;
import com.zaxxer.hikari.HikariConfig;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe DataSource cache: one HikariCP pool per JDBC URL + username.
 *
 * <p>Pools run in auto-commit mode. Each mutation statement, decompress and
 * recompress call is its own transaction, so an interrupted run never leaves
 * an open transaction holding a decompressed segment's locks.
 */
@Slf4j
public enum HikariDataSource {

    INSTANCE;

    private final ConcurrentMap<String, DataSource> dataSourceCache = new ConcurrentHashMap<>();

    /** Incrementing counter for stable, positive pool IDs. */
    private static final AtomicInteger poolIdCounter = new AtomicInteger(0);

    /**
     * Gets or creates a DataSource for the given database configuration.
     */
    public DataSource getOrInit(DbConfigSnapshot snapshot) {
        String connectionKey = snapshot.jdbcUrl() + "|" + snapshot.username();

        return dataSourceCache.computeIfAbsent(connectionKey, key -> {
            log.info("[POOL] Creating HikariCP DataSource for {} (user: {})",
                    sanitizeUrl(snapshot.jdbcUrl()), snapshot.username());

            HikariConfig hikariConfig = new HikariConfig();
            hikariConfig.setJdbcUrl(snapshot.jdbcUrl());
            hikariConfig.setUsername(snapshot.username());
            hikariConfig.setPassword(snapshot.password());
            hikariConfig.setDriverClassName(snapshot.driverClassName());
            hikariConfig.setMaximumPoolSize(snapshot.maximumPoolSize());
            hikariConfig.setMinimumIdle(Math.min(snapshot.minimumIdle(), snapshot.maximumPoolSize()));
            hikariConfig.setIdleTimeout(snapshot.idleTimeoutMs());
            hikariConfig.setConnectionTimeout(snapshot.connectionTimeoutMs());
            hikariConfig.setMaxLifetime(snapshot.maxLifetimeMs());
            hikariConfig.setAutoCommit(true);

            if (snapshot.jdbcUrl() != null && snapshot.jdbcUrl().contains("postgresql")) {
                hikariConfig.addDataSourceProperty("tcpKeepAlive", "true");
                hikariConfig.addDataSourceProperty("ApplicationName", "chunk-mutator");
            }

            hikariConfig.setPoolName("HikariPool-" + poolIdCounter.incrementAndGet() + "-chunk-mutator");

            com.zaxxer.hikari.HikariDataSource newDataSource = new com.zaxxer.hikari.HikariDataSource(hikariConfig);
            log.info("[POOL] Created | url={} | maxPoolSize={}, minIdle={}",
                    sanitizeUrl(snapshot.jdbcUrl()), snapshot.maximumPoolSize(), hikariConfig.getMinimumIdle());
            ConnectionPoolLogger.logPoolStats(newDataSource, "after creation");
            return newDataSource;
        });
    }

    /**
     * Closes all pools and clears the cache. Called once the run has finished.
     */
    public void closeAll() {
        dataSourceCache.forEach((key, dataSource) -> {
            if (dataSource instanceof com.zaxxer.hikari.HikariDataSource hikari) {
                ConnectionPoolLogger.logPoolStats(hikari, "before close");
                hikari.close();
            }
        });
        dataSourceCache.clear();
        log.debug("[POOL] All DataSources closed and cache cleared");
    }

    /**
     * Removes any {@code password=...} parameter from a JDBC URL for logging.
     */
    static String sanitizeUrl(String jdbcUrl) {
        if (jdbcUrl == null) {
            return "null";
        }
        return jdbcUrl.replaceAll("password=[^;&]+", "password=***");
    }
}
