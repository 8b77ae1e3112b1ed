package com.di.chunkmutator.migration;

/**
 * Kind of row mutation a spec performs; drives progress wording only.
 */
public enum MutationKind {

    DELETE("deleted"),
    UPDATE("updated");

    private final String pastTense;

    MutationKind(String pastTense) {
        this.pastTense = pastTense;
    }

    public String pastTense() {
        return pastTense;
    }
}
