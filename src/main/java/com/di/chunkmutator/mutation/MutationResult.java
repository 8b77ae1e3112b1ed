package com.di.chunkmutator.mutation;

import com.di.chunkmutator.aspect.ErrorCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Outcome of one segment pipeline (or of one fast-path statement).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MutationResult {

    public enum Outcome { SUCCESS, FAILED }

    /** Segment identity; for a fast-path statement, the identities it covered joined with {@code ,}. */
    private String segmentIdentity;

    /** Display name used in progress lines. */
    private String displayName;

    /** Number of catalog segments this result accounts for (1 except for merged fast-path ranges). */
    @Builder.Default
    private int segmentCount = 1;

    private long     rowsAffected;
    private Duration duration;
    private Outcome  outcome;

    /** Set only when {@link #outcome} is {@link Outcome#FAILED}. */
    private String        failureReason;
    private ErrorCategory failureCategory;

    /** {@code false} when the decompress step reported an error (soft condition). */
    @Builder.Default
    private boolean decompressOk = true;

    /** {@code false} when the recompress step reported an error; never changes {@link #outcome}. */
    @Builder.Default
    private boolean recompressOk = true;

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }
}
