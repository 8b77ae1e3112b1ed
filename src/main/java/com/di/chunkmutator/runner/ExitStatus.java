package com.di.chunkmutator.runner;

/**
 * Process exit codes of a migration run.
 */
public enum ExitStatus {

    /** Verification found no remaining rows, or there was nothing to do. */
    CONVERGED(0),

    /** Rows remain after the run; re-running is safe. */
    PARTIAL(1),

    /** Catalog, prerequisite or SQL failure outside a segment pipeline. */
    FATAL(2),

    USAGE(64);

    private final int code;

    ExitStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
