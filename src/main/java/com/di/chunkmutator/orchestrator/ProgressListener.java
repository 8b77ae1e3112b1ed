package com.di.chunkmutator.orchestrator;

import com.di.chunkmutator.mutation.MutationResult;

/**
 * Observer of a run's progress. The orchestrator invokes every callback from
 * its own thread, one at a time, so implementations need no synchronization.
 */
public interface ProgressListener {

    ProgressListener NONE = new ProgressListener() {};

    default void onCatalogLoaded(String relation, int total, int compressed, int uncompressed) {}

    default void onFastPathStarted(int groups) {}

    default void onFastPathCompleted(MutationResult result) {}

    default void onParallelPathStarted(int segments, int parallelism) {}

    /**
     * Called once per compressed segment, in completion order.
     *
     * @param completed number of segments completed so far, including this one
     * @param total     number of compressed segments in the run
     */
    default void onSegmentCompleted(MutationResult result, int completed, int total) {}

    default void onStoppedWaiting(int inFlight, int notDispatched) {}

    default void onRunCompleted(RunSummary summary) {}
}
