package com.di.chunkmutator.orchestrator;

/**
 * How uncompressed segments are mutated directly, without decompress / recompress.
 */
public enum FastPathStrategy {

    /** One statement per run of adjacent uncompressed segments. */
    CONTIGUOUS_RANGES,

    /** One statement per uncompressed segment. */
    PER_SEGMENT
}
