package com.di.chunkmutator.sql;

import com.di.chunkmutator.aspect.ErrorCategory;
import lombok.Getter;

/**
 * A single SQL round-trip failed.
 *
 * <p>{@code exitCode} is the psql exit status for the subprocess executor and the
 * vendor error code for JDBC. {@code stderrText} holds the server or psql message.
 */
@Getter
public class SqlExecutionException extends RuntimeException {

    private final int    exitCode;
    private final String sqlState;
    private final String stderrText;

    public SqlExecutionException(int exitCode, String sqlState, String stderrText, Throwable cause) {
        super(buildMessage(exitCode, sqlState, stderrText), cause);
        this.exitCode   = exitCode;
        this.sqlState   = sqlState;
        this.stderrText = stderrText;
    }

    public SqlExecutionException(int exitCode, String stderrText) {
        this(exitCode, null, stderrText, null);
    }

    /** Category of the underlying failure, for logging and the run report. */
    public ErrorCategory category() {
        if (getCause() != null) {
            return ErrorCategory.categorize(getCause());
        }
        return ErrorCategory.categorize(new java.sql.SQLException(stderrText, sqlState, exitCode));
    }

    private static String buildMessage(int exitCode, String sqlState, String stderrText) {
        String text = stderrText == null || stderrText.isBlank() ? "<no error text>" : stderrText.trim();
        return sqlState == null
                ? String.format("SQL failed (exit=%d): %s", exitCode, text)
                : String.format("SQL failed (exit=%d, sqlState=%s): %s", exitCode, sqlState, text);
    }
}
