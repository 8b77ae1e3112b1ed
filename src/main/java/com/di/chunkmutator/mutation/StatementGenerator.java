package com.di.chunkmutator.mutation;

import com.di.chunkmutator.catalog.TimeRange;

/**
 * Pure function from a time range to the mutation statement scoped to it.
 * Implementations must only capture immutable values.
 */
@FunctionalInterface
public interface StatementGenerator {

    String statementFor(TimeRange range);
}
