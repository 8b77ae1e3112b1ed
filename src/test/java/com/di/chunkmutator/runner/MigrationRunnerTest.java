package com.di.chunkmutator.runner;

import com.di.chunkmutator.config.ChunkMutatorProperties;
import com.di.chunkmutator.migration.AddressZeroAircraftCleanup;
import com.di.chunkmutator.migration.AircraftMergeFixesUpdate;
import com.di.chunkmutator.migration.MutationSpecRegistry;
import com.di.chunkmutator.support.SimulatedHypertable;
import com.di.chunkmutator.util.MutationMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MigrationRunner Tests")
class MigrationRunnerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant T1 = Instant.parse("2024-01-02T00:00:00Z");
    private static final Instant T2 = Instant.parse("2024-01-03T00:00:00Z");
    private static final Instant T3 = Instant.parse("2024-01-04T00:00:00Z");

    private static final String A = "_timescaledb_internal._hyper_1_1_chunk";
    private static final String B = "_timescaledb_internal._hyper_1_2_chunk";
    private static final String C = "_timescaledb_internal._hyper_1_3_chunk";

    private ChunkMutatorProperties properties;
    private MutationSpecRegistry   registry;
    private ByteArrayOutputStream  out;
    private ByteArrayOutputStream  err;
    private String                 requestedDatabase;
    private int                    requestedParallelism;

    @BeforeEach
    void setUp() throws Exception {
        properties = new ChunkMutatorProperties();
        registry = new MutationSpecRegistry(List.of(new AddressZeroAircraftCleanup(), new AircraftMergeFixesUpdate()));
        Method initialize = MutationSpecRegistry.class.getDeclaredMethod("initialize");
        initialize.setAccessible(true);
        initialize.invoke(registry);
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private MigrationRunner runner(SimulatedHypertable db) {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return new MigrationRunner(properties, registry,
                (database, parallelism) -> {
                    requestedDatabase = database;
                    requestedParallelism = parallelism;
                    return db;
                },
                new MutationMetrics(new SimpleMeterRegistry()),
                mapper,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    /** 4 target rows in A, 6 in B (both compressed), none in C (uncompressed); address=0 aircraft is 'bad'. */
    private static SimulatedHypertable fixesTable() {
        return new SimulatedHypertable("fixes")
                .chunk(A, T0, T1, true)
                .chunk(B, T1, T2, true)
                .chunk(C, T2, T3, false)
                .targetRows(A, 4).targetRows(B, 6).otherRows(C, 2)
                .respondRows("FROM aircraft WHERE address = 0", List.of(Map.of("id", "bad")));
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    // ============================================================================
    // Usage errors
    // ============================================================================

    @Test
    @DisplayName("Should return usage error without a database argument")
    void testMissingDatabase() {
        assertEquals(ExitStatus.USAGE, runner(fixesTable()).execute(List.of(), false));
        assertTrue(err().contains("Usage:"));
        assertEquals(64, ExitStatus.USAGE.code());
    }

    @Test
    @DisplayName("Should return usage error for invalid parallelism")
    void testInvalidParallelism() {
        MigrationRunner runner = runner(fixesTable());

        assertEquals(ExitStatus.USAGE, runner.execute(List.of("soar", "0"), false));
        assertEquals(ExitStatus.USAGE, runner.execute(List.of("soar", "many"), false));
        assertEquals(ExitStatus.USAGE, runner.execute(List.of("soar", "33"), false));
        assertTrue(err().contains("Parallelism"));
    }

    @Test
    @DisplayName("Should return usage error for an unknown migration")
    void testUnknownMigration() {
        properties.setMigration("does-not-exist");

        assertEquals(ExitStatus.USAGE, runner(fixesTable()).execute(List.of("soar"), false));
        assertTrue(err().contains("Unknown migration"));
    }

    // ============================================================================
    // Runs
    // ============================================================================

    @Test
    @DisplayName("Should run, verify and exit 0 on convergence")
    void testConvergedRun() {
        SimulatedHypertable db = fixesTable();

        ExitStatus status = runner(db).execute(List.of("soar_staging", "2"), false);

        assertEquals(ExitStatus.CONVERGED, status);
        assertEquals("soar_staging", requestedDatabase);
        assertEquals(2, requestedParallelism);
        assertEquals(0, db.remainingTargetRows());
        assertTrue(out().contains("Rows to delete: 10"));
        assertTrue(out().contains("Total: 10 rows deleted from 3/3 segments, 0 failed"));
        assertTrue(out().contains("Remaining rows: 0"));
        assertTrue(out().contains("SUCCESS!"));
    }

    @Test
    @DisplayName("Should use the migration's default parallelism")
    void testDefaultParallelism() {
        runner(fixesTable()).execute(List.of("soar"), false);

        assertEquals(2, requestedParallelism);
    }

    @Test
    @DisplayName("Should exit 0 without mutating when discovery finds nothing")
    void testNothingDiscovered() {
        SimulatedHypertable db = fixesTable().respondRows("FROM aircraft WHERE address = 0", List.of());

        assertEquals(ExitStatus.CONVERGED, runner(db).execute(List.of("soar"), false));
        assertTrue(out().contains("Nothing to do."));
        assertTrue(db.executedStatements().isEmpty());
    }

    @Test
    @DisplayName("Should exit 0 without mutating when the pre-count is zero")
    void testNothingToCount() {
        SimulatedHypertable db = new SimulatedHypertable("fixes")
                .chunk(A, T0, T1, true)
                .otherRows(A, 3)
                .respondRows("FROM aircraft WHERE address = 0", List.of(Map.of("id", "bad")));

        assertEquals(ExitStatus.CONVERGED, runner(db).execute(List.of("soar"), false));
        assertTrue(out().contains("Nothing to do!"));
        assertTrue(db.decompressCalls().isEmpty());
    }

    @Test
    @DisplayName("Should exit 1 when rows remain after the run")
    void testPartialConvergence() {
        SimulatedHypertable db = fixesTable().failMutation(B);

        ExitStatus status = runner(db).execute(List.of("soar", "2"), false);

        assertEquals(ExitStatus.PARTIAL, status);
        assertEquals(1, status.code());
        assertTrue(out().contains("WARNING: 6 rows remain"));
        assertTrue(err().contains("FAILED"));
    }

    @Test
    @DisplayName("Should exit 2 when the catalog is unavailable")
    void testCatalogUnavailable() {
        SimulatedHypertable db = fixesTable().catalogUnavailable();

        ExitStatus status = runner(db).execute(List.of("soar"), false);

        assertEquals(ExitStatus.FATAL, status);
        assertEquals(2, status.code());
        assertTrue(err().contains("ERROR:"));
        assertEquals(10, db.remainingTargetRows());
    }

    @Test
    @DisplayName("Should exit 2 when a prerequisite is missing")
    void testMissingPrerequisite() {
        properties.setMigration("merge-aircraft-fixes");
        SimulatedHypertable db = fixesTable().respondText("information_schema.tables", "f");

        assertEquals(ExitStatus.FATAL, runner(db).execute(List.of("soar"), false));
        assertTrue(err().contains("aircraft_merge_mapping"));
    }

    @Test
    @DisplayName("Should exit 2 when the pre-count is not a number")
    void testUnreadableCount() {
        SimulatedHypertable db = fixesTable()
                .respondText("SELECT count(*) FROM fixes WHERE aircraft_id", "count\n-----");

        ExitStatus status = runner(db).execute(List.of("soar"), false);

        assertEquals(ExitStatus.FATAL, status);
        assertTrue(err().contains("ERROR:"));
        assertTrue(db.executedStatements().isEmpty());
        assertEquals(10, db.remainingTargetRows());
    }

    @Test
    @DisplayName("Should print the plan and change nothing in a dry run")
    void testDryRun() {
        SimulatedHypertable db = fixesTable();

        assertEquals(ExitStatus.CONVERGED, runner(db).execute(List.of("soar"), true));
        assertTrue(out().contains("Segments: 3 total, 2 compressed, 1 uncompressed"));
        assertTrue(out().contains("Dry run"));
        assertTrue(db.executedStatements().isEmpty());
        assertTrue(db.decompressCalls().isEmpty());
        assertEquals(10, db.remainingTargetRows());
    }

    @Test
    @DisplayName("Should write a JSON report when configured")
    void testReportFile(@TempDir Path dir) throws Exception {
        Path report = dir.resolve("report.json");
        properties.setReportFile(report.toString());

        runner(fixesTable()).execute(List.of("soar", "2"), false);

        JsonNode json = new ObjectMapper().readTree(Files.readString(report));
        assertEquals("CONVERGED", json.get("exitStatus").asText());
        assertEquals("cleanup-address-zero-aircraft", json.get("migration").asText());
        assertEquals(10, json.get("rowsBefore").asLong());
        assertEquals(10, json.get("summary").get("totalRowsAffected").asLong());
        assertTrue(json.get("verification").get("converged").asBoolean());
        assertTrue(json.get("startedAt").isTextual());
    }
}
