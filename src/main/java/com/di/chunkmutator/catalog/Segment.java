package com.di.chunkmutator.catalog;

import java.util.Objects;

/**
 * One physical storage partition (TimescaleDB chunk) of a partitioned relation,
 * as seen in a single catalog snapshot.
 *
 * @param identity   schema-qualified chunk name, e.g. {@code _timescaledb_internal._hyper_1_12_chunk}
 * @param range      time range covered by the chunk
 * @param compressed compression flag at snapshot time; not re-read during a run
 */
public record Segment(String identity, TimeRange range, boolean compressed) {

    public Segment {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(range, "range");
    }

    /** Chunk name without schema, used in progress lines. */
    public String shortName() {
        int dot = identity.lastIndexOf('.');
        return dot >= 0 ? identity.substring(dot + 1) : identity;
    }
}
