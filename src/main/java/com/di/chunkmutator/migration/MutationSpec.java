package com.di.chunkmutator.migration;

import com.di.chunkmutator.sql.SqlExecutor;

import java.util.Optional;

/**
 * One concrete data migration that can be applied segment by segment.
 *
 * <p>Implementations are Spring beans picked up by {@link MutationSpecRegistry}
 * and selected with {@code chunkmutator.migration}.
 */
public interface MutationSpec {

    /** Registry key, matched case-insensitively. */
    String name();

    /** Partitioned relation the migration mutates, optionally schema-qualified. */
    String relation();

    /** Parallelism used when the command line does not give one. */
    int defaultParallelism();

    MutationKind kind();

    /**
     * Discovery step, run once before any segment is touched. Everything the statements
     * depend on is captured in the returned value.
     *
     * @return empty when there is nothing to migrate
     * @throws MutationPrerequisiteException when the database is not ready for this migration
     * @throws com.di.chunkmutator.sql.SqlExecutionException when a discovery query fails
     */
    Optional<PreparedMutation> prepare(SqlExecutor sql);
}
