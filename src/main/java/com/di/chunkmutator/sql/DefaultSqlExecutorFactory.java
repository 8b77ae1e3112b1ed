package com.di.chunkmutator.sql;

import com.di.chunkmutator.config.ChunkMutatorProperties;
import com.di.chunkmutator.config.DbConfigSnapshot;
import com.di.chunkmutator.util.HikariDataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Builds a JDBC or psql executor according to {@code chunkmutator.executor}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultSqlExecutorFactory implements SqlExecutorFactory {

    private final ChunkMutatorProperties properties;

    @Override
    public SqlExecutor create(String database, int parallelism) {
        if (properties.getExecutor() == ChunkMutatorProperties.ExecutorMode.PSQL) {
            log.info("[SQL] Using psql executor ({}) for database {}", properties.getPsql().getBinary(), database);
            return new PsqlSqlExecutor(properties.getPsql().getBinary(), database);
        }
        DbConfigSnapshot snapshot = properties.getDatasource().snapshotFor(database, parallelism);
        JdbcTemplate jdbc = new JdbcTemplate(HikariDataSource.INSTANCE.getOrInit(snapshot));
        log.info("[SQL] Using JDBC executor for database {} (pool size {})", database, snapshot.maximumPoolSize());
        return new JdbcSqlExecutor(jdbc, database);
    }
}
