package com.di.chunkmutator.migration;

/**
 * A migration cannot start because something it depends on is missing from the database.
 */
public class MutationPrerequisiteException extends RuntimeException {

    public MutationPrerequisiteException(String message) {
        super(message);
    }
}
