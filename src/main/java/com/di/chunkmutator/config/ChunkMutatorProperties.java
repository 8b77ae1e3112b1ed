package com.di.chunkmutator.config;

import com.di.chunkmutator.mutation.DecompressFailurePolicy;
import com.di.chunkmutator.orchestrator.FastPathStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Single binding for all chunk-mutator configuration.
 *
 * <pre>
 * chunkmutator:
 *   migration: cleanup-address-zero-aircraft
 *   executor: JDBC
 *   decompress-failure-policy: ATTEMPT_MUTATION
 *   fast-path: CONTIGUOUS_RANGES
 *   run-timeout: 0s
 *   max-parallelism: 32
 *   report-file:
 *   datasource:
 *     url-template: jdbc:postgresql://localhost:5432/{database}
 *     username: soar
 *   psql:
 *     binary: psql
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "chunkmutator")
public class ChunkMutatorProperties {

    public enum ExecutorMode { JDBC, PSQL }

    /** Name of the registered mutation spec to run. */
    private String migration = "cleanup-address-zero-aircraft";

    private ExecutorMode executor = ExecutorMode.JDBC;

    /** What to do with the mutation step when the decompress step failed. */
    private DecompressFailurePolicy decompressFailurePolicy = DecompressFailurePolicy.ATTEMPT_MUTATION;

    private FastPathStrategy fastPath = FastPathStrategy.CONTIGUOUS_RANGES;

    /** Caller-level wait limit for the compressed-segment pool. Zero = wait for every segment. */
    private Duration runTimeout = Duration.ZERO;

    /** Upper bound accepted for the parallelism argument. */
    private int maxParallelism = 32;

    /** When non-blank, a JSON run report is written to this path. */
    private String reportFile;

    private Datasource datasource = new Datasource();

    private Psql psql = new Psql();

    @Data
    public static class Datasource {

        /** JDBC URL with a {@code {database}} placeholder filled from the CLI argument. */
        private String urlTemplate = "jdbc:postgresql://localhost:5432/{database}";
        private String username;
        private String password;
        private String driverClassName = "org.postgresql.Driver";

        /** 0 = parallelism + 2 (one connection per worker plus catalog / verification headroom). */
        private int maximumPoolSize = 0;
        private int minimumIdle = 1;
        private long idleTimeoutMs = 600_000L;
        private long connectionTimeoutMs = 30_000L;
        private long maxLifetimeMs = 1_800_000L;

        public DbConfigSnapshot snapshotFor(String database, int parallelism) {
            int poolSize = maximumPoolSize > 0 ? maximumPoolSize : parallelism + 2;
            return new DbConfigSnapshot(
                    urlTemplate.replace("{database}", database),
                    username, password, driverClassName,
                    poolSize, Math.min(minimumIdle, poolSize),
                    idleTimeoutMs, connectionTimeoutMs, maxLifetimeMs);
        }
    }

    @Data
    public static class Psql {
        private String binary = "psql";
    }
}
