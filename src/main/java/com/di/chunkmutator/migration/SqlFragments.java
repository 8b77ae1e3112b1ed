package com.di.chunkmutator.migration;

import com.di.chunkmutator.catalog.TimeRange;

/**
 * SQL text shared by the built-in migrations.
 */
final class SqlFragments {

    /**
     * Lets DML touch any number of tuples in a segment that a background policy
     * recompressed after the catalog snapshot was taken.
     */
    static final String SESSION_PREAMBLE =
            "SET timescaledb.max_tuples_decompressed_per_dml_transaction = 0;\n";

    private SqlFragments() {
    }

    /** {@code column >= 'start'::timestamptz AND column < 'end'::timestamptz} */
    static String withinRange(String column, TimeRange range) {
        return column + " >= '" + range.start() + "'::timestamptz"
                + " AND " + column + " < '" + range.end() + "'::timestamptz";
    }
}
