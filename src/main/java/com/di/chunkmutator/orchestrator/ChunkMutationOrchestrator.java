package com.di.chunkmutator.orchestrator;

import com.di.chunkmutator.aspect.ErrorCategory;
import com.di.chunkmutator.catalog.Segment;
import com.di.chunkmutator.catalog.SegmentCatalog;
import com.di.chunkmutator.migration.PreparedMutation;
import com.di.chunkmutator.mutation.MutationResult;
import com.di.chunkmutator.mutation.MutationTask;
import com.di.chunkmutator.mutation.SegmentMutator;
import com.di.chunkmutator.util.InputValidator;
import com.di.chunkmutator.util.MdcPropagation;
import com.di.chunkmutator.util.MutationMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one mutation across every segment of a relation.
 *
 * <pre>
 *   1. catalog snapshot     → split into compressed / uncompressed
 *   2. fast path            → one statement per uncompressed group, sequential, always finishes first
 *   3. bounded pool         → one decompress/mutate/recompress task per compressed segment,
 *                             at most {@code parallelism} in flight
 *   4. aggregation          → on this thread, in completion order
 * </pre>
 *
 * A failed segment never cancels its siblings. Once the caller timeout passes, no further
 * segment is dispatched and no further result is counted; tasks already handed to a worker
 * still run to completion before {@link #run} returns. An interrupt is handled the same way
 * and reported as {@link RunSummary#isInterrupted()}.
 */
@Slf4j
public class ChunkMutationOrchestrator {

    private final SegmentCatalog   catalog;
    private final SegmentMutator   mutator;
    private final ProgressListener listener;
    private final MutationMetrics  metrics;
    private final FastPathStrategy fastPathStrategy;
    private final Duration         runTimeout;

    public ChunkMutationOrchestrator(SegmentCatalog catalog,
                                     SegmentMutator mutator,
                                     ProgressListener listener,
                                     MutationMetrics metrics,
                                     FastPathStrategy fastPathStrategy,
                                     Duration runTimeout) {
        this.catalog          = catalog;
        this.mutator          = mutator;
        this.listener         = listener == null ? ProgressListener.NONE : listener;
        this.metrics          = metrics;
        this.fastPathStrategy = fastPathStrategy == null ? FastPathStrategy.CONTIGUOUS_RANGES : fastPathStrategy;
        this.runTimeout       = runTimeout == null ? Duration.ZERO : runTimeout;
    }

    /**
     * @throws com.di.chunkmutator.catalog.CatalogUnavailableException when segments cannot be listed;
     *         nothing has been mutated at that point
     */
    public RunSummary run(String relation, PreparedMutation mutation, int parallelism) {
        InputValidator.validateRelationName(relation);
        InputValidator.validateParallelism(parallelism, Integer.MAX_VALUE);

        boolean ownRunId = MDC.get("runId") == null;
        if (ownRunId) {
            MDC.put("runId", UUID.randomUUID().toString().substring(0, 8));
        }
        MDC.put("migration", mutation.name());
        long startNs = System.nanoTime();
        try {
            RunSummary summary = execute(relation, mutation, parallelism, startNs);
            metrics.recordRun(summary.getElapsed());
            metrics.logSummary();
            listener.onRunCompleted(summary);
            log.info("[ORCHESTRATOR] {} finished: rows={}, processed={}/{}, failed={}, timedOut={}, elapsed={}ms",
                    relation, summary.getTotalRowsAffected(), summary.getSegmentsProcessed(),
                    summary.getSegmentsTotal(), summary.getSegmentsFailed(), summary.isTimedOut(),
                    summary.getElapsed().toMillis());
            return summary;
        } finally {
            MDC.remove("migration");
            if (ownRunId) {
                MDC.remove("runId");
            }
        }
    }

    private RunSummary execute(String relation, PreparedMutation mutation, int parallelism, long startNs) {
        List<Segment> segments = catalog.listSegments(relation);
        List<Segment> compressed   = new ArrayList<>();
        List<Segment> uncompressed = new ArrayList<>();
        for (Segment s : segments) {
            (s.compressed() ? compressed : uncompressed).add(s);
        }
        listener.onCatalogLoaded(relation, segments.size(), compressed.size(), uncompressed.size());
        log.info("[ORCHESTRATOR] {}: {} segments ({} compressed, {} uncompressed), parallelism={}",
                relation, segments.size(), compressed.size(), uncompressed.size(), parallelism);

        RunSummary summary = RunSummary.builder()
                .runId(MDC.get("runId"))
                .relation(relation)
                .migration(mutation.name())
                .parallelism(parallelism)
                .segmentsTotal(segments.size())
                .compressedSegments(compressed.size())
                .uncompressedSegments(uncompressed.size())
                .build();

        runFastPath(uncompressed, mutation, summary);
        runParallelPath(compressed, mutation, parallelism, summary);

        summary.setElapsed(Duration.ofNanos(System.nanoTime() - startNs));
        return summary;
    }

    // =========================================================================
    // Fast path
    // =========================================================================

    private void runFastPath(List<Segment> uncompressed, PreparedMutation mutation, RunSummary summary) {
        if (uncompressed.isEmpty()) {
            return;
        }
        List<FastPathGroup> groups = FastPathGroup.plan(uncompressed, fastPathStrategy);
        listener.onFastPathStarted(groups.size());
        for (FastPathGroup group : groups) {
            String statement = mutation.generator().statementFor(group.range());
            log.debug("[ORCHESTRATOR] fast path {} over {}", group.displayName(), group.range());
            MutationResult result = mutator.mutateInPlace(
                    group.identities(), group.displayName(), group.segments().size(), statement);
            metrics.recordSegment(MutationMetrics.PATH_FAST, result);
            aggregate(summary, result);
            listener.onFastPathCompleted(result);
        }
    }

    // =========================================================================
    // Bounded parallel path
    // =========================================================================

    private void runParallelPath(List<Segment> compressed, PreparedMutation mutation,
                                 int parallelism, RunSummary summary) {
        if (compressed.isEmpty()) {
            return;
        }
        int total = compressed.size();
        listener.onParallelPathStarted(total, parallelism);

        ExecutorService pool = Executors.newFixedThreadPool(parallelism, workerThreadFactory());
        CompletionService<MutationResult> completion = new ExecutorCompletionService<>(pool);
        Map<Future<MutationResult>, Segment> dispatched = new HashMap<>();

        long deadlineNs = runTimeout.isZero() || runTimeout.isNegative()
                ? Long.MAX_VALUE
                : System.nanoTime() + runTimeout.toNanos();

        Iterator<Segment> pending = compressed.iterator();
        int inFlight  = 0;
        int completed = 0;
        boolean stoppedWaiting = false;
        boolean interrupted    = false;
        try {
            while (pending.hasNext() || inFlight > 0) {
                if (pastDeadline(deadlineNs)) {
                    stoppedWaiting = true;
                    break;
                }
                if (pending.hasNext() && inFlight < parallelism) {
                    Segment segment = pending.next();
                    MutationTask task = new MutationTask(segment, mutation.generator());
                    Future<MutationResult> f = completion.submit(MdcPropagation.wrapCallable(
                            () -> MdcPropagation.callWithKey("segment", segment.shortName(), () -> mutator.mutate(task))));
                    dispatched.put(f, segment);
                    inFlight++;
                    continue;
                }

                Future<MutationResult> done;
                try {
                    done = awaitNext(completion, deadlineNs);
                } catch (InterruptedException e) {
                    interrupted = true;
                    break;
                }
                if (done == null) {
                    stoppedWaiting = true;
                    break;
                }
                inFlight--;
                completed++;
                MutationResult result = resultOf(done, dispatched.remove(done));
                metrics.recordSegment(MutationMetrics.PATH_COMPRESSED, result);
                aggregate(summary, result);
                listener.onSegmentCompleted(result, completed, total);
            }

            if (stoppedWaiting || interrupted) {
                int notDispatched = 0;
                while (pending.hasNext()) {
                    pending.next();
                    notDispatched++;
                }
                summary.setTimedOut(stoppedWaiting);
                summary.setInterrupted(interrupted);
                summary.setSegmentsAbandoned(inFlight);
                summary.setSegmentsNotDispatched(notDispatched);
                if (stoppedWaiting) {
                    listener.onStoppedWaiting(inFlight, notDispatched);
                    log.warn("[ORCHESTRATOR] stopped waiting after {}: {} in flight, {} not dispatched",
                            runTimeout, inFlight, notDispatched);
                } else {
                    log.warn("[ORCHESTRATOR] interrupted while waiting for segment results: {} in flight, {} not dispatched",
                            inFlight, notDispatched);
                }
            }
        } finally {
            pool.shutdown();
            drain(pool, dispatched);
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static boolean pastDeadline(long deadlineNs) {
        return deadlineNs != Long.MAX_VALUE && System.nanoTime() - deadlineNs >= 0;
    }

    /** @return the next finished task, or {@code null} once the deadline has passed */
    private static Future<MutationResult> awaitNext(CompletionService<MutationResult> completion, long deadlineNs)
            throws InterruptedException {
        if (deadlineNs == Long.MAX_VALUE) {
            return completion.take();
        }
        long remaining = deadlineNs - System.nanoTime();
        return remaining <= 0 ? null : completion.poll(remaining, TimeUnit.NANOSECONDS);
    }

    private static MutationResult resultOf(Future<MutationResult> future, Segment segment) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("[ORCHESTRATOR] segment {} task failed unexpectedly: {}", segment.identity(), cause.toString(), cause);
            return MutationResult.builder()
                    .segmentIdentity(segment.identity())
                    .displayName(segment.shortName())
                    .duration(Duration.ZERO)
                    .outcome(MutationResult.Outcome.FAILED)
                    .failureReason(cause.toString())
                    .failureCategory(ErrorCategory.categorize(cause))
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted reading a completed segment result", e);
        }
    }

    /**
     * Waits for tasks already handed to workers. No forced abort: a segment interrupted
     * between decompress and recompress would stay decompressed.
     */
    private static void drain(ExecutorService pool, Map<Future<MutationResult>, Segment> dispatched) {
        boolean interrupted = false;
        while (true) {
            try {
                if (pool.awaitTermination(30, TimeUnit.SECONDS)) {
                    break;
                }
                log.info("[ORCHESTRATOR] waiting for in-flight segments to finish: {}", unfinished(dispatched));
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        dispatched.forEach((future, segment) -> {
            if (future.isDone()) {
                log.info("[ORCHESTRATOR] segment {} finished after the caller stopped waiting (not counted)",
                        segment.shortName());
            }
        });
    }

    private static List<String> unfinished(Map<Future<MutationResult>, Segment> dispatched) {
        List<String> names = new ArrayList<>();
        dispatched.forEach((future, segment) -> {
            if (!future.isDone()) {
                names.add(segment.shortName());
            }
        });
        return names;
    }

    private static void aggregate(RunSummary summary, MutationResult result) {
        summary.getResults().add(result);
        summary.setSegmentsProcessed(summary.getSegmentsProcessed() + result.getSegmentCount());
        if (result.isSuccess()) {
            summary.setTotalRowsAffected(summary.getTotalRowsAffected() + result.getRowsAffected());
        } else {
            summary.setSegmentsFailed(summary.getSegmentsFailed() + result.getSegmentCount());
            summary.getFailedSegments().add(result.getSegmentIdentity());
        }
        if (!result.isRecompressOk()) {
            summary.getRecompressFailures().add(result.getSegmentIdentity());
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "segment-worker-" + seq.incrementAndGet());
            t.setDaemon(false);
            return t;
        };
    }
}
