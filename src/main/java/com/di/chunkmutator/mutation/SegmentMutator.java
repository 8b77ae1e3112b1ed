package com.di.chunkmutator.mutation;

import com.di.chunkmutator.aspect.ErrorCategory;
import com.di.chunkmutator.catalog.Segment;
import com.di.chunkmutator.sql.SqlExecutionException;
import com.di.chunkmutator.sql.SqlExecutor;
import com.di.chunkmutator.util.InputValidator;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Runs decompress → mutate → recompress for one compressed segment.
 *
 * <pre>
 *   1. decompress   failure is soft: recorded, then handled per {@link DecompressFailurePolicy}
 *   2. mutate       failure makes the task FAILED; step 3 still runs
 *   3. recompress   best effort, logged only; never changes the outcome of step 2
 * </pre>
 *
 * Stateless apart from its collaborators; one instance serves every worker of the pool.
 */
@Slf4j
public class SegmentMutator {

    private final SqlExecutor             sql;
    private final DecompressFailurePolicy decompressFailurePolicy;

    public SegmentMutator(SqlExecutor sql, DecompressFailurePolicy decompressFailurePolicy) {
        this.sql                     = sql;
        this.decompressFailurePolicy = decompressFailurePolicy;
    }

    public MutationResult mutate(MutationTask task) {
        Segment segment = task.segment();
        long    startNs = System.nanoTime();

        // ── 1. decompress ──────────────────────────────────────────────
        String decompressError = null;
        try {
            sql.queryForText(decompressStatement(segment.identity()));
            log.debug("[MUTATOR] {} decompressed", segment.identity());
        } catch (RuntimeException ex) {
            decompressError = ex.getMessage() == null ? ex.toString() : ex.getMessage();
            log.warn("[MUTATOR] {} decompress failed ({}): {}", segment.identity(), categoryOf(ex), decompressError);
        }

        // ── 2. mutate ──────────────────────────────────────────────────
        long          rows           = 0L;
        String        failureReason  = null;
        ErrorCategory failureCategory = null;
        if (decompressError != null && decompressFailurePolicy == DecompressFailurePolicy.SKIP_MUTATION) {
            failureReason   = "decompress failed, mutation skipped: " + decompressError;
            failureCategory = ErrorCategory.OBJECT_STATE_ERROR;
        } else {
            try {
                rows = sql.execute(task.statement()).rowsAffected();
            } catch (SqlExecutionException ex) {
                failureReason   = ex.getMessage();
                failureCategory = ex.category();
                log.error("[MUTATOR] {} mutation FAILED ({}): {}", segment.identity(), failureCategory, ex.getMessage());
            } catch (RuntimeException ex) {
                failureReason   = ex.toString();
                failureCategory = ErrorCategory.categorize(ex);
                log.error("[MUTATOR] {} mutation FAILED ({}): {}", segment.identity(), failureCategory, ex.toString(), ex);
            }
        }

        // ── 3. recompress ──────────────────────────────────────────────
        boolean recompressOk = true;
        try {
            sql.queryForText(recompressStatement(segment.identity()));
            log.debug("[MUTATOR] {} recompressed", segment.identity());
        } catch (RuntimeException ex) {
            recompressOk = false;
            log.warn("[MUTATOR] {} recompress failed ({}); segment left decompressed until the next run or policy job: {}",
                    segment.identity(), categoryOf(ex), ex.toString());
        }

        Duration duration = Duration.ofNanos(System.nanoTime() - startNs);
        return MutationResult.builder()
                .segmentIdentity(segment.identity())
                .displayName(segment.shortName())
                .rowsAffected(rows)
                .duration(duration)
                .outcome(failureReason == null ? MutationResult.Outcome.SUCCESS : MutationResult.Outcome.FAILED)
                .failureReason(failureReason)
                .failureCategory(failureCategory)
                .decompressOk(decompressError == null)
                .recompressOk(recompressOk)
                .build();
    }

    /**
     * Runs one statement against uncompressed storage, with no decompress or recompress step.
     * Used by the fast path; {@code segmentCount} is the number of catalog segments the statement covers.
     */
    public MutationResult mutateInPlace(String identities, String displayName, int segmentCount, String statement) {
        long          startNs         = System.nanoTime();
        long          rows            = 0L;
        String        failureReason   = null;
        ErrorCategory failureCategory = null;
        try {
            rows = sql.execute(statement).rowsAffected();
        } catch (SqlExecutionException ex) {
            failureReason   = ex.getMessage();
            failureCategory = ex.category();
            log.error("[MUTATOR] fast path {} FAILED ({}): {}", displayName, failureCategory, ex.getMessage());
        } catch (RuntimeException ex) {
            failureReason   = ex.toString();
            failureCategory = ErrorCategory.categorize(ex);
            log.error("[MUTATOR] fast path {} FAILED ({}): {}", displayName, failureCategory, ex.toString(), ex);
        }
        return MutationResult.builder()
                .segmentIdentity(identities)
                .displayName(displayName)
                .segmentCount(segmentCount)
                .rowsAffected(rows)
                .duration(Duration.ofNanos(System.nanoTime() - startNs))
                .outcome(failureReason == null ? MutationResult.Outcome.SUCCESS : MutationResult.Outcome.FAILED)
                .failureReason(failureReason)
                .failureCategory(failureCategory)
                .build();
    }

    static String decompressStatement(String identity) {
        return "SELECT decompress_chunk(" + InputValidator.quoteLiteral(identity) + ", if_compressed => true)";
    }

    static String recompressStatement(String identity) {
        return "SELECT compress_chunk(" + InputValidator.quoteLiteral(identity) + ", if_not_compressed => true)";
    }

    private static ErrorCategory categoryOf(RuntimeException ex) {
        return ex instanceof SqlExecutionException sqlEx ? sqlEx.category() : ErrorCategory.categorize(ex);
    }
}
