package com.di.chunkmutator.catalog;

import java.util.List;

/**
 * Lists the segments of a partitioned relation.
 */
public interface SegmentCatalog {

    /**
     * Returns all segments of {@code relationName} ordered by range start, reflecting
     * compression state at call time. An unknown relation or one without segments
     * yields an empty list.
     *
     * @throws CatalogUnavailableException if the catalog cannot be read
     */
    List<Segment> listSegments(String relationName);
}
