package com.di.chunkmutator.runner;

import com.di.chunkmutator.orchestrator.RunSummary;
import com.di.chunkmutator.verify.VerificationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JSON document written to {@code chunkmutator.report-file} at the end of a run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunReport {

    private String     runId;
    private String     migration;
    private String     database;
    private String     relation;
    private int        parallelism;
    private String     executor;
    private Instant    startedAt;
    private Instant    finishedAt;
    private ExitStatus exitStatus;
    private long       rowsBefore;

    private RunSummary         summary;
    private VerificationResult verification;
}
