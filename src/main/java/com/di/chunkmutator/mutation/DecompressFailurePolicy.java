package com.di.chunkmutator.mutation;

/**
 * What the segment pipeline does with its mutation step when decompression failed.
 */
public enum DecompressFailurePolicy {

    /** Run the mutation anyway: a failed decompress usually means the segment is already decompressed. */
    ATTEMPT_MUTATION,

    /** Skip the mutation and report the segment as failed; recompression is still attempted. */
    SKIP_MUTATION
}
