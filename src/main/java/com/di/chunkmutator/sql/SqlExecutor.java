package com.di.chunkmutator.sql;

import java.util.List;
import java.util.Map;

/**
 * Runs SQL against the target database.
 *
 * <p>Implementations are thread-safe: the orchestrator calls a single executor
 * from every worker of the segment pool. Every method raises
 * {@link SqlExecutionException} when the round-trip fails.
 */
public interface SqlExecutor {

    /**
     * Runs a scalar query and returns its single value as trimmed text
     * (empty string when the query produced no rows).
     */
    String queryForText(String sql);

    /**
     * Runs a tabular query. Each row is returned as a map keyed by the given
     * column names, in the order the columns appear in the select list.
     */
    List<Map<String, String>> queryForRows(String sql, List<String> columns);

    /**
     * Runs a mutating statement (or a {@code ;}-separated batch ending in one)
     * and returns the command tag of the last statement.
     */
    MutationOutcome execute(String sql);

    /** Short description used in log lines, never containing credentials. */
    String describe();
}
