package com.di.chunkmutator.sql;

/**
 * Result of a mutating statement as reported by the server, e.g. {@code "DELETE 42"}.
 *
 * @param commandTag raw command tag text; may be blank when the server reported nothing
 */
public record MutationOutcome(String commandTag) {

    public static MutationOutcome of(String verb, long rows) {
        return new MutationOutcome(verb + " " + rows);
    }

    /** Rows affected, read through {@link RowCountParser}; 0 when the tag has no count. */
    public long rowsAffected() {
        return RowCountParser.parse(commandTag);
    }
}
