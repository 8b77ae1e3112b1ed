package com.di.chunkmutator.mutation;

import com.di.chunkmutator.aspect.ErrorCategory;
import com.di.chunkmutator.catalog.Segment;
import com.di.chunkmutator.catalog.TimeRange;
import com.di.chunkmutator.sql.MutationOutcome;
import com.di.chunkmutator.sql.SqlExecutor;
import com.di.chunkmutator.support.SimulatedHypertable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SegmentMutator Tests")
class SegmentMutatorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");
    private static final Instant T1 = Instant.parse("2024-03-08T00:00:00Z");
    private static final String  ID = "_timescaledb_internal._hyper_2_7_chunk";

    private static final StatementGenerator DELETE_TARGETS = range ->
            "DELETE FROM fixes WHERE aircraft_id IN ('bad')"
                    + " AND received_at >= '" + range.start() + "'::timestamptz"
                    + " AND received_at < '" + range.end() + "'::timestamptz";

    private static MutationTask task(boolean compressed) {
        return new MutationTask(new Segment(ID, new TimeRange(T0, T1), compressed), DELETE_TARGETS);
    }

    @Test
    @DisplayName("Should decompress, mutate and recompress in order")
    void testHappyPath() {
        SimulatedHypertable db = new SimulatedHypertable("fixes").chunk(ID, T0, T1, true).targetRows(ID, 5).otherRows(ID, 2);

        MutationResult result = new SegmentMutator(db, DecompressFailurePolicy.ATTEMPT_MUTATION).mutate(task(true));

        assertTrue(result.isSuccess());
        assertEquals(5, result.getRowsAffected());
        assertEquals(ID, result.getSegmentIdentity());
        assertEquals("_hyper_2_7_chunk", result.getDisplayName());
        assertTrue(result.isDecompressOk());
        assertTrue(result.isRecompressOk());
        assertEquals(List.of(ID), db.decompressCalls());
        assertEquals(List.of(ID), db.recompressCalls());
        assertTrue(db.isCompressed(ID));
        assertEquals(2, db.totalRows());
    }

    @Test
    @DisplayName("Should still mutate when decompress fails on an already decompressed segment")
    void testDecompressFailureIsSoft() {
        // catalog snapshot says compressed, but another process already decompressed it
        SimulatedHypertable db = new SimulatedHypertable("fixes").chunk(ID, T0, T1, false).targetRows(ID, 3)
                .failDecompress(ID);

        MutationResult result = new SegmentMutator(db, DecompressFailurePolicy.ATTEMPT_MUTATION).mutate(task(true));

        assertTrue(result.isSuccess());
        assertFalse(result.isDecompressOk());
        assertEquals(3, result.getRowsAffected());
        assertEquals(1, db.executedStatements().size());
    }

    @Test
    @DisplayName("Should skip the mutation under SKIP_MUTATION when decompress fails")
    void testSkipMutationPolicy() {
        SimulatedHypertable db = new SimulatedHypertable("fixes").chunk(ID, T0, T1, false).targetRows(ID, 3)
                .failDecompress(ID);

        MutationResult result = new SegmentMutator(db, DecompressFailurePolicy.SKIP_MUTATION).mutate(task(true));

        assertFalse(result.isSuccess());
        assertEquals(ErrorCategory.OBJECT_STATE_ERROR, result.getFailureCategory());
        assertTrue(db.executedStatements().isEmpty());
        assertEquals(3, db.remainingTargetRows());
        assertEquals(List.of(ID), db.recompressCalls());
    }

    @Test
    @DisplayName("Should recompress even when the mutation fails")
    void testMutationFailureStillRecompresses() {
        SimulatedHypertable db = new SimulatedHypertable("fixes").chunk(ID, T0, T1, true).targetRows(ID, 3)
                .failMutation(ID);

        MutationResult result = new SegmentMutator(db, DecompressFailurePolicy.ATTEMPT_MUTATION).mutate(task(true));

        assertFalse(result.isSuccess());
        assertNotNull(result.getFailureReason());
        assertEquals(0, result.getRowsAffected());
        assertEquals(List.of(ID), db.recompressCalls());
        assertTrue(db.isCompressed(ID));
    }

    @Test
    @DisplayName("Should keep a successful outcome when recompress fails")
    void testRecompressFailureDoesNotChangeOutcome() {
        SimulatedHypertable db = new SimulatedHypertable("fixes").chunk(ID, T0, T1, true).targetRows(ID, 4)
                .failRecompress(ID);

        MutationResult result = new SegmentMutator(db, DecompressFailurePolicy.ATTEMPT_MUTATION).mutate(task(true));

        assertTrue(result.isSuccess());
        assertFalse(result.isRecompressOk());
        assertEquals(4, result.getRowsAffected());
        assertFalse(db.isCompressed(ID));
    }

    @Test
    @DisplayName("Should mutate and attempt recompress when compression calls fail with a non-SQL error")
    void testNonSqlCompressionFailuresAreSoft() {
        SimulatedHypertable db = new SimulatedHypertable("fixes").chunk(ID, T0, T1, false).targetRows(ID, 3);
        BrokenCompressionCalls broken = new BrokenCompressionCalls(db);

        MutationResult result = new SegmentMutator(broken, DecompressFailurePolicy.ATTEMPT_MUTATION).mutate(task(true));

        assertTrue(result.isSuccess());
        assertFalse(result.isDecompressOk());
        assertFalse(result.isRecompressOk());
        assertEquals(3, result.getRowsAffected());
        assertEquals(1, db.executedStatements().size());
        assertEquals(2, broken.compressionCalls);
    }

    @Test
    @DisplayName("Should run a fast-path statement without decompress or recompress")
    void testMutateInPlace() {
        SimulatedHypertable db = new SimulatedHypertable("fixes").chunk(ID, T0, T1, false).targetRows(ID, 2);

        MutationResult result = new SegmentMutator(db, DecompressFailurePolicy.ATTEMPT_MUTATION)
                .mutateInPlace(ID, "_hyper_2_7_chunk", 1, DELETE_TARGETS.statementFor(new TimeRange(T0, T1)));

        assertTrue(result.isSuccess());
        assertEquals(2, result.getRowsAffected());
        assertTrue(db.decompressCalls().isEmpty());
        assertTrue(db.recompressCalls().isEmpty());
    }

    @Test
    @DisplayName("Should build idempotent decompress and recompress calls")
    void testStatements() {
        assertEquals("SELECT decompress_chunk('" + ID + "', if_compressed => true)",
                SegmentMutator.decompressStatement(ID));
        assertEquals("SELECT compress_chunk('" + ID + "', if_not_compressed => true)",
                SegmentMutator.recompressStatement(ID));
    }

    /** Delegates mutations to the table; every decompress/compress call fails with a driver-level error. */
    private static final class BrokenCompressionCalls implements SqlExecutor {
        private final SqlExecutor delegate;
        private int compressionCalls;

        BrokenCompressionCalls(SqlExecutor delegate) {
            this.delegate = delegate;
        }

        @Override
        public String queryForText(String sql) {
            if (sql.contains("compress_chunk(")) {
                compressionCalls++;
                throw new IllegalStateException("connection handle already closed");
            }
            return delegate.queryForText(sql);
        }

        @Override
        public List<Map<String, String>> queryForRows(String sql, List<String> columns) {
            return delegate.queryForRows(sql, columns);
        }

        @Override
        public MutationOutcome execute(String sql) {
            return delegate.execute(sql);
        }

        @Override
        public String describe() {
            return "broken-compression";
        }
    }
}
