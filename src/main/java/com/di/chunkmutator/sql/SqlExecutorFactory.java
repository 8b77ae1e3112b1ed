package com.di.chunkmutator.sql;

/**
 * Creates the {@link SqlExecutor} for one run against a named database.
 */
@FunctionalInterface
public interface SqlExecutorFactory {

    SqlExecutor create(String database, int parallelism);
}
