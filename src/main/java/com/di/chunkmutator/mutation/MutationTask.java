package com.di.chunkmutator.mutation;

import com.di.chunkmutator.catalog.Segment;

import java.util.Objects;

/**
 * The work item bound to one compressed segment for one run.
 */
public record MutationTask(Segment segment, StatementGenerator generator) {

    public MutationTask {
        Objects.requireNonNull(segment, "segment");
        Objects.requireNonNull(generator, "generator");
    }

    public String statement() {
        return generator.statementFor(segment.range());
    }
}
