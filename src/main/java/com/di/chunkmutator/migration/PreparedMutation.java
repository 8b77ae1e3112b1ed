package com.di.chunkmutator.migration;

import com.di.chunkmutator.mutation.StatementGenerator;

import java.util.Objects;

/**
 * Immutable result of a spec's discovery step: everything a run needs, captured once
 * before any worker starts. Workers only ever read it.
 *
 * @param name           spec name, for logs and the run report
 * @param kind           DELETE or UPDATE
 * @param description    one-line human readable summary of what was discovered
 * @param targetCountSql count query for the rows still matching the mutation predicate
 * @param generator      range-scoped statement generator
 */
public record PreparedMutation(String name,
                               MutationKind kind,
                               String description,
                               String targetCountSql,
                               StatementGenerator generator) {

    public PreparedMutation {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(targetCountSql, "targetCountSql");
        Objects.requireNonNull(generator, "generator");
    }
}
