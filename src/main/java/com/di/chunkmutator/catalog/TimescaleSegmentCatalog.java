package com.di.chunkmutator.catalog;

import com.di.chunkmutator.sql.SqlExecutionException;
import com.di.chunkmutator.sql.SqlExecutor;
import com.di.chunkmutator.util.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * {@link SegmentCatalog} over {@code timescaledb_information.chunks}.
 *
 * <p>Range bounds are rendered by the server as UTC ISO-8601 text so they parse
 * into {@link Instant}s regardless of the session time zone. Chunks without a
 * time dimension (integer-partitioned hypertables) have no timestamp range and
 * are skipped.
 */
@Slf4j
@RequiredArgsConstructor
public class TimescaleSegmentCatalog implements SegmentCatalog {

    static final List<String> COLUMNS = List.of("segment", "is_compressed", "range_start", "range_end");

    private static final String ISO_UTC = "'YYYY-MM-DD\"T\"HH24:MI:SS.US\"Z\"'";

    private final SqlExecutor sql;

    @Override
    public List<Segment> listSegments(String relationName) {
        String relation = InputValidator.validateRelationName(relationName);
        List<Map<String, String>> rows;
        try {
            rows = sql.queryForRows(catalogQuery(relation), COLUMNS);
        } catch (SqlExecutionException ex) {
            throw new CatalogUnavailableException(
                    "cannot list segments of '" + relation + "' via " + sql.describe() + ": " + ex.getMessage(), ex);
        }

        List<Segment> segments = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            Segment s = toSegment(row);
            if (s != null) {
                segments.add(s);
            }
        }
        segments.sort(Comparator.comparing(s -> s.range().start()));
        warnOnOverlap(relation, segments);

        long compressed = segments.stream().filter(Segment::compressed).count();
        log.info("[CATALOG] {}: {} segment(s), {} compressed, {} uncompressed",
                relation, segments.size(), compressed, segments.size() - compressed);
        return segments;
    }

    static String catalogQuery(String relation) {
        String hypertable = relation;
        String schemaFilter = "";
        int dot = relation.indexOf('.');
        if (dot >= 0) {
            schemaFilter = " AND hypertable_schema = " + InputValidator.quoteLiteral(relation.substring(0, dot));
            hypertable = relation.substring(dot + 1);
        }
        return "SELECT chunk_schema || '.' || chunk_name AS segment,"
                + " is_compressed::text AS is_compressed,"
                + " to_char(range_start AT TIME ZONE 'UTC', " + ISO_UTC + ") AS range_start,"
                + " to_char(range_end AT TIME ZONE 'UTC', " + ISO_UTC + ") AS range_end"
                + " FROM timescaledb_information.chunks"
                + " WHERE hypertable_name = " + InputValidator.quoteLiteral(hypertable)
                + schemaFilter
                + " ORDER BY range_start";
    }

    private Segment toSegment(Map<String, String> row) {
        String identity = row.get("segment");
        String start    = row.get("range_start");
        String end      = row.get("range_end");
        if (identity == null || identity.isBlank()) {
            return null;
        }
        if (start == null || start.isBlank() || end == null || end.isBlank()) {
            log.warn("[CATALOG] {} has no time range; skipped", identity);
            return null;
        }
        try {
            TimeRange range = new TimeRange(Instant.parse(start), Instant.parse(end));
            boolean compressed = "true".equalsIgnoreCase(row.get("is_compressed"))
                    || "t".equalsIgnoreCase(row.get("is_compressed"));
            return new Segment(identity, range, compressed);
        } catch (DateTimeParseException | IllegalArgumentException ex) {
            log.warn("[CATALOG] {} has an unusable range [{}, {}): {}; skipped", identity, start, end, ex.getMessage());
            return null;
        }
    }

    private static void warnOnOverlap(String relation, List<Segment> segments) {
        for (int i = 1; i < segments.size(); i++) {
            Segment prev = segments.get(i - 1);
            Segment next = segments.get(i);
            if (prev.range().end().isAfter(next.range().start())) {
                log.warn("[CATALOG] {}: {} {} overlaps {} {}; per-segment statements will touch shared rows",
                        relation, prev.identity(), prev.range(), next.identity(), next.range());
            }
        }
    }
}
