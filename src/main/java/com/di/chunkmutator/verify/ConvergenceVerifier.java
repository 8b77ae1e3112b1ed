package com.di.chunkmutator.verify;

import com.di.chunkmutator.sql.SqlExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Re-counts the rows matching a mutation predicate. Zero means the mutation has converged;
 * anything else means the run is incomplete and can be repeated.
 *
 * <p>The count runs against compressed storage directly; no segment is decompressed.
 */
@Slf4j
@RequiredArgsConstructor
public class ConvergenceVerifier {

    private final SqlExecutor sql;

    /* ------------------------------------------------------------------ */
    /* Count                                                               */
    /* ------------------------------------------------------------------ */

    /**
     * @param countSql query returning a single integer
     * @throws com.di.chunkmutator.sql.SqlExecutionException when the query fails
     * @throws IllegalStateException when the query returns something that is not an integer
     */
    public long countRemaining(String countSql) {
        String text = sql.queryForText(countSql);
        if (text == null || text.isBlank()) {
            return 0L;
        }
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Count query returned non-numeric value '" + text + "'", e);
        }
    }

    /* ------------------------------------------------------------------ */
    /* Verify                                                              */
    /* ------------------------------------------------------------------ */

    public VerificationResult verify(String countSql, long rowsBefore, long rowsAffected) {
        long remaining = countRemaining(countSql);
        boolean converged = remaining == 0;
        String detail = converged
                ? String.format("converged: %d rows before, %d affected, 0 remaining", rowsBefore, rowsAffected)
                : String.format("partial: %d rows before, %d affected, %d remaining", rowsBefore, rowsAffected, remaining);
        if (converged) {
            log.info("[VERIFY] {}", detail);
        } else {
            log.warn("[VERIFY] {}", detail);
        }
        return VerificationResult.builder()
                .rowsBefore(rowsBefore)
                .remainingRows(remaining)
                .rowsAffected(rowsAffected)
                .converged(converged)
                .detail(detail)
                .build();
    }
}
