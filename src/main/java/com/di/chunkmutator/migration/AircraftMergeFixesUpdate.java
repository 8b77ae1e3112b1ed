package com.di.chunkmutator.migration;

import com.di.chunkmutator.sql.SqlExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Repoints fixes from merged FLARM aircraft rows to their ICAO counterparts,
 * using the {@code aircraft_merge_mapping} table produced by the aircraft merge.
 */
@Slf4j
@Component
public class AircraftMergeFixesUpdate implements MutationSpec {

    public static final String NAME = "merge-aircraft-fixes";

    static final String MAPPING_EXISTS_SQL =
            "SELECT EXISTS(SELECT 1 FROM information_schema.tables WHERE table_name = 'aircraft_merge_mapping')";
    static final String MAPPING_COUNT_SQL = "SELECT count(*) FROM aircraft_merge_mapping";
    static final String REMAINING_SQL =
            "SELECT count(*) FROM fixes fx JOIN aircraft_merge_mapping m ON fx.aircraft_id = m.flarm_id";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String relation() {
        return "fixes";
    }

    @Override
    public int defaultParallelism() {
        return 4;
    }

    @Override
    public MutationKind kind() {
        return MutationKind.UPDATE;
    }

    @Override
    public Optional<PreparedMutation> prepare(SqlExecutor sql) {
        String exists = sql.queryForText(MAPPING_EXISTS_SQL);
        if (!"t".equalsIgnoreCase(exists) && !"true".equalsIgnoreCase(exists)) {
            throw new MutationPrerequisiteException(
                    "aircraft_merge_mapping table not found; run the aircraft merge migration first");
        }
        long mapped = Long.parseLong(sql.queryForText(MAPPING_COUNT_SQL).trim());
        if (mapped == 0) {
            log.info("[RUN] aircraft_merge_mapping is empty");
            return Optional.empty();
        }
        log.info("[RUN] Aircraft to merge: {}", mapped);

        return Optional.of(new PreparedMutation(
                NAME,
                kind(),
                mapped + " aircraft to merge",
                REMAINING_SQL,
                range -> SqlFragments.SESSION_PREAMBLE
                        + "UPDATE fixes fx SET aircraft_id = m.icao_id"
                        + " FROM aircraft_merge_mapping m"
                        + " WHERE fx.aircraft_id = m.flarm_id"
                        + " AND " + SqlFragments.withinRange("fx.received_at", range)));
    }
}
