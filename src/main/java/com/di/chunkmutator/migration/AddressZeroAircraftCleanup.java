package com.di.chunkmutator.migration;

import com.di.chunkmutator.sql.SqlExecutor;
import com.di.chunkmutator.util.InputValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Deletes fixes recorded against aircraft whose address is 0.
 * The offending aircraft ids are discovered once and frozen into the statement text.
 */
@Slf4j
@Component
public class AddressZeroAircraftCleanup implements MutationSpec {

    public static final String NAME = "cleanup-address-zero-aircraft";

    static final String DISCOVERY_SQL = "SELECT id FROM aircraft WHERE address = 0";

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
        return 2;
    }

    @Override
    public MutationKind kind() {
        return MutationKind.DELETE;
    }

    @Override
    public Optional<PreparedMutation> prepare(SqlExecutor sql) {
        List<String> ids = sql.queryForRows(DISCOVERY_SQL, List.of("id")).stream()
                .map(row -> row.get("id"))
                .filter(id -> id != null && !id.isEmpty())
                .toList();
        if (ids.isEmpty()) {
            log.info("[RUN] No aircraft with address=0 found");
            return Optional.empty();
        }
        log.info("[RUN] Found {} aircraft with address=0: {}", ids.size(), ids);

        String idList = ids.stream().map(InputValidator::quoteLiteral).collect(Collectors.joining(","));
        String countSql = "SELECT count(*) FROM fixes WHERE aircraft_id IN (" + idList + ")";
        return Optional.of(new PreparedMutation(
                NAME,
                kind(),
                ids.size() + " aircraft with address=0",
                countSql,
                range -> SqlFragments.SESSION_PREAMBLE
                        + "DELETE FROM fixes WHERE aircraft_id IN (" + idList + ")"
                        + " AND " + SqlFragments.withinRange("received_at", range)));
    }
}
