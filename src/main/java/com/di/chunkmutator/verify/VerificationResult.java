package com.di.chunkmutator.verify;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a post-run convergence check.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationResult {

    /** Rows still matching the mutation predicate before the run. */
    private long    rowsBefore;

    /** Rows still matching the mutation predicate after the run. */
    private long    remainingRows;

    /** Rows the run reported as affected. */
    private long    rowsAffected;

    /** {@code true} iff {@link #remainingRows} is zero. */
    private boolean converged;

    private String  detail;
}
