package com.di.chunkmutator.runner;

import com.di.chunkmutator.catalog.CatalogUnavailableException;
import com.di.chunkmutator.catalog.Segment;
import com.di.chunkmutator.catalog.SegmentCatalog;
import com.di.chunkmutator.catalog.TimescaleSegmentCatalog;
import com.di.chunkmutator.config.ChunkMutatorProperties;
import com.di.chunkmutator.migration.MutationPrerequisiteException;
import com.di.chunkmutator.migration.MutationSpec;
import com.di.chunkmutator.migration.MutationSpecRegistry;
import com.di.chunkmutator.migration.PreparedMutation;
import com.di.chunkmutator.mutation.SegmentMutator;
import com.di.chunkmutator.orchestrator.ChunkMutationOrchestrator;
import com.di.chunkmutator.orchestrator.ConsoleProgressListener;
import com.di.chunkmutator.orchestrator.FastPathGroup;
import com.di.chunkmutator.orchestrator.RunSummary;
import com.di.chunkmutator.sql.SqlExecutionException;
import com.di.chunkmutator.sql.SqlExecutor;
import com.di.chunkmutator.sql.SqlExecutorFactory;
import com.di.chunkmutator.util.HikariDataSource;
import com.di.chunkmutator.util.InputValidator;
import com.di.chunkmutator.util.MutationMetrics;
import com.di.chunkmutator.verify.ConvergenceVerifier;
import com.di.chunkmutator.verify.VerificationResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Drives one migration per process:
 * <pre>
 *   args → prepare (discovery) → pre-count → [dry run] → orchestrate → verify → report
 * </pre>
 * Progress goes to standard output, errors to standard error; diagnostic logging is separate.
 */
@Slf4j
@Component
public class MigrationRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String DRY_RUN_OPTION = "dry-run";

    private final ChunkMutatorProperties properties;
    private final MutationSpecRegistry   registry;
    private final SqlExecutorFactory     executorFactory;
    private final MutationMetrics        metrics;
    private final ObjectMapper           objectMapper;
    private final PrintStream            out;
    private final PrintStream            err;

    private volatile ExitStatus exitStatus = ExitStatus.CONVERGED;

    @Autowired
    public MigrationRunner(ChunkMutatorProperties properties,
                           MutationSpecRegistry registry,
                           SqlExecutorFactory executorFactory,
                           MutationMetrics metrics,
                           ObjectMapper objectMapper) {
        this(properties, registry, executorFactory, metrics, objectMapper, System.out, System.err);
    }

    MigrationRunner(ChunkMutatorProperties properties,
                    MutationSpecRegistry registry,
                    SqlExecutorFactory executorFactory,
                    MutationMetrics metrics,
                    ObjectMapper objectMapper,
                    PrintStream out,
                    PrintStream err) {
        this.properties      = properties;
        this.registry        = registry;
        this.executorFactory = executorFactory;
        this.metrics         = metrics;
        this.objectMapper    = objectMapper;
        this.out             = out;
        this.err             = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitStatus = execute(args.getNonOptionArgs(), args.containsOption(DRY_RUN_OPTION));
    }

    @Override
    public int getExitCode() {
        return exitStatus.code();
    }

    public ExitStatus getExitStatus() {
        return exitStatus;
    }

    ExitStatus execute(List<String> positional, boolean dryRun) {
        if (positional.isEmpty() || positional.size() > 2) {
            printUsage();
            return ExitStatus.USAGE;
        }

        String       database;
        MutationSpec spec;
        String       relation;
        int          parallelism;
        try {
            database    = InputValidator.validateDatabaseName(positional.get(0));
            spec        = registry.getSpec(properties.getMigration());
            relation    = InputValidator.validateRelationName(spec.relation());
            parallelism = positional.size() > 1
                    ? InputValidator.parseParallelism(positional.get(1), properties.getMaxParallelism())
                    : spec.defaultParallelism();
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            printUsage();
            return ExitStatus.USAGE;
        }

        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put("runId", runId);
        MDC.put("migration", spec.name());
        Instant startedAt = Instant.now();
        RunReport.RunReportBuilder report = RunReport.builder()
                .runId(runId)
                .migration(spec.name())
                .database(database)
                .relation(relation)
                .parallelism(parallelism)
                .executor(properties.getExecutor().name())
                .startedAt(startedAt);

        out.printf("=== Data migration: %s ===%n", spec.name());
        out.printf("Database: %s%n", database);
        out.printf("Parallelism: %d%n", parallelism);
        out.println();
        log.info("[RUN] Starting {} on {} (relation={}, parallelism={}, dryRun={})",
                spec.name(), database, relation, parallelism, dryRun);

        ExitStatus status;
        try {
            SqlExecutor sql = executorFactory.create(database, parallelism);
            status = migrate(spec, relation, parallelism, dryRun, sql, report);
        } catch (CatalogUnavailableException | MutationPrerequisiteException e) {
            err.println("ERROR: " + e.getMessage());
            log.error("[RUN] {} aborted: {}", spec.name(), e.getMessage(), e);
            status = ExitStatus.FATAL;
        } catch (SqlExecutionException e) {
            err.println("ERROR: " + e.getMessage());
            log.error("[RUN] {} aborted ({}): {}", spec.name(), e.category(), e.getMessage());
            status = ExitStatus.FATAL;
        } catch (RuntimeException e) {
            err.println("ERROR: " + e);
            log.error("[RUN] {} aborted unexpectedly: {}", spec.name(), e.toString(), e);
            status = ExitStatus.FATAL;
        } finally {
            HikariDataSource.INSTANCE.closeAll();
        }

        report.exitStatus(status).finishedAt(Instant.now());
        writeReport(report.build());
        log.info("[RUN] {} finished with exit status {} ({})", spec.name(), status, status.code());
        MDC.remove("migration");
        MDC.remove("runId");
        return status;
    }

    private ExitStatus migrate(MutationSpec spec, String relation, int parallelism, boolean dryRun,
                               SqlExecutor sql, RunReport.RunReportBuilder report) {
        PreparedMutation prepared = spec.prepare(sql).orElse(null);
        if (prepared == null) {
            out.println("Nothing to do.");
            return ExitStatus.CONVERGED;
        }
        out.printf("Found %s%n", prepared.description());

        ConvergenceVerifier verifier = new ConvergenceVerifier(sql);
        long rowsBefore = verifier.countRemaining(prepared.targetCountSql());
        report.rowsBefore(rowsBefore);
        out.printf("Rows to %s: %d%n", spec.kind().name().toLowerCase(Locale.ROOT), rowsBefore);
        if (rowsBefore == 0) {
            out.println("Nothing to do!");
            return ExitStatus.CONVERGED;
        }
        out.println();

        SegmentCatalog catalog = new TimescaleSegmentCatalog(sql);
        if (dryRun) {
            printPlan(catalog.listSegments(relation));
            return ExitStatus.CONVERGED;
        }

        ChunkMutationOrchestrator orchestrator = new ChunkMutationOrchestrator(
                catalog,
                new SegmentMutator(sql, properties.getDecompressFailurePolicy()),
                new ConsoleProgressListener(out, err, spec.kind()),
                metrics,
                properties.getFastPath(),
                properties.getRunTimeout());
        RunSummary summary = orchestrator.run(relation, prepared, parallelism);
        report.summary(summary);

        out.println();
        out.println("Step 3: Verifying...");
        VerificationResult verification = verifier.verify(
                prepared.targetCountSql(), rowsBefore, summary.getTotalRowsAffected());
        report.verification(verification);
        out.printf("Remaining rows: %d%n", verification.getRemainingRows());
        out.println();
        if (verification.isConverged()) {
            out.println("SUCCESS! All target rows migrated.");
            return ExitStatus.CONVERGED;
        }
        out.printf("WARNING: %d rows remain. Re-run this migration.%n", verification.getRemainingRows());
        return ExitStatus.PARTIAL;
    }

    private void printPlan(List<Segment> segments) {
        List<Segment> uncompressed = segments.stream().filter(s -> !s.compressed()).toList();
        long compressed = segments.size() - uncompressed.size();
        out.printf("Segments: %d total, %d compressed, %d uncompressed%n",
                segments.size(), compressed, uncompressed.size());
        List<FastPathGroup> groups = FastPathGroup.plan(uncompressed, properties.getFastPath());
        out.printf("Fast path: %d statement(s)%n", groups.size());
        groups.forEach(g -> out.printf("  %s %s%n", g.displayName(), g.range()));
        out.println("Dry run: no rows changed.");
    }

    private void writeReport(RunReport report) {
        String file = properties.getReportFile();
        if (file == null || file.isBlank()) {
            return;
        }
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(Path.of(file).toFile(), report);
            log.info("[RUN] Report written to {}", file);
        } catch (IOException e) {
            err.println("WARNING: could not write report to " + file + ": " + e.getMessage());
            log.warn("[RUN] Failed to write report to {}: {}", file, e.getMessage(), e);
        }
    }

    private void printUsage() {
        err.println("Usage: chunk-mutator <database> [parallelism] [--dry-run] [--chunkmutator.migration=<name>]");
        err.println("Migrations: " + registry.getRegisteredNames());
    }
}
