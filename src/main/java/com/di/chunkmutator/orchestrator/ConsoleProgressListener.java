package com.di.chunkmutator.orchestrator;

import com.di.chunkmutator.migration.MutationKind;
import com.di.chunkmutator.mutation.MutationResult;

import java.io.PrintStream;
import java.time.Duration;
import java.util.Locale;

/**
 * Writes the user-facing progress stream: segment lines and summaries to standard
 * output, failure lines to standard error.
 */
public class ConsoleProgressListener implements ProgressListener {

    private final PrintStream  out;
    private final PrintStream  err;
    private final MutationKind kind;

    public ConsoleProgressListener(PrintStream out, PrintStream err, MutationKind kind) {
        this.out  = out;
        this.err  = err;
        this.kind = kind;
    }

    @Override
    public void onCatalogLoaded(String relation, int total, int compressed, int uncompressed) {
        out.printf("Segments of %s: %d total, %d compressed, %d uncompressed%n",
                relation, total, compressed, uncompressed);
    }

    @Override
    public void onFastPathStarted(int groups) {
        out.println();
        out.printf("Step 1: Mutating uncompressed segments (%d statement(s))...%n", groups);
    }

    @Override
    public void onFastPathCompleted(MutationResult result) {
        if (result.isSuccess()) {
            out.printf("  %s: %s %d rows (%s)%n",
                    result.getDisplayName(), kind.pastTense(), result.getRowsAffected(), seconds(result.getDuration()));
        } else {
            err.printf("  %s: FAILED (%s) %s%n",
                    result.getDisplayName(), result.getFailureCategory(), result.getFailureReason());
        }
    }

    @Override
    public void onParallelPathStarted(int segments, int parallelism) {
        out.println();
        out.printf("Step 2: Processing %d compressed segments (parallelism=%d)...%n", segments, parallelism);
    }

    @Override
    public void onSegmentCompleted(MutationResult result, int completed, int total) {
        if (result.isSuccess()) {
            out.printf("  [%d/%d] %s: %s %d rows (%s)%s%n",
                    completed, total, result.getDisplayName(), kind.pastTense(), result.getRowsAffected(),
                    seconds(result.getDuration()), result.isRecompressOk() ? "" : " [recompress failed]");
        } else {
            err.printf("  [%d/%d] %s: FAILED (%s) %s%n",
                    completed, total, result.getDisplayName(), result.getFailureCategory(), result.getFailureReason());
        }
    }

    @Override
    public void onStoppedWaiting(int inFlight, int notDispatched) {
        err.printf("  Timed out: stopped waiting with %d segment(s) still running and %d not started%n",
                inFlight, notDispatched);
    }

    @Override
    public void onRunCompleted(RunSummary summary) {
        out.printf("  Total: %d rows %s from %d/%d segments, %d failed (%s)%n",
                summary.getTotalRowsAffected(), kind.pastTense(),
                summary.getSegmentsProcessed(), summary.getSegmentsTotal(),
                summary.getSegmentsFailed(), seconds(summary.getElapsed()));
        if (!summary.getFailedSegments().isEmpty()) {
            err.printf("  Failed segments: %s%n", String.join(", ", summary.getFailedSegments()));
        }
    }

    static String seconds(Duration d) {
        if (d == null) {
            return "0.0s";
        }
        return String.format(Locale.ROOT, "%.1fs", d.toMillis() / 1000.0);
    }
}
