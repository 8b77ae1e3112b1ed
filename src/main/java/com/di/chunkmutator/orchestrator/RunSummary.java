package com.di.chunkmutator.orchestrator;

import com.di.chunkmutator.mutation.MutationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate outcome of one orchestration run. Only the totals are a stable
 * contract; {@link #results} is in completion order, which varies between runs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunSummary {

    private String runId;
    private String relation;
    private String migration;
    private int    parallelism;

    private int segmentsTotal;
    private int compressedSegments;
    private int uncompressedSegments;

    private long totalRowsAffected;
    private int  segmentsProcessed;
    private int  segmentsFailed;

    /** Compressed segments never handed to a worker because the caller stopped waiting. */
    private int segmentsNotDispatched;

    /** Compressed segments still running when the caller stopped waiting; their results are not counted. */
    private int segmentsAbandoned;

    /** {@code true} when {@code run-timeout} expired before every compressed segment reported back. */
    private boolean timedOut;

    /** {@code true} when the orchestrating thread was interrupted while waiting for compressed segments. */
    private boolean interrupted;

    /** Segments whose recompress step failed (left decompressed, outcome unaffected). */
    @Builder.Default
    private List<String> recompressFailures = new ArrayList<>();

    @Builder.Default
    private List<String> failedSegments = new ArrayList<>();

    @Builder.Default
    private List<MutationResult> results = new ArrayList<>();

    private Duration elapsed;

    /** {@code true} when every segment of the snapshot was processed and none failed. */
    public boolean isComplete() {
        return !timedOut && !interrupted && segmentsFailed == 0 && segmentsProcessed == segmentsTotal;
    }
}
