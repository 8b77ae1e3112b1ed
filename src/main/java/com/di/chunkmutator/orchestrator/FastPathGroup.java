package com.di.chunkmutator.orchestrator;

import com.di.chunkmutator.catalog.Segment;
import com.di.chunkmutator.catalog.TimeRange;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Uncompressed segments mutated by a single fast-path statement over {@link #range()}.
 */
public record FastPathGroup(TimeRange range, List<Segment> segments) {

    public FastPathGroup {
        segments = List.copyOf(segments);
    }

    public String identities() {
        return segments.stream().map(Segment::identity).collect(Collectors.joining(","));
    }

    public String displayName() {
        if (segments.size() == 1) {
            return segments.get(0).shortName();
        }
        return segments.get(0).shortName() + ".." + segments.get(segments.size() - 1).shortName()
                + " (" + segments.size() + " segments)";
    }

    /**
     * Groups uncompressed segments (ordered by range start) for the fast path.
     * Under {@link FastPathStrategy#CONTIGUOUS_RANGES} adjacent segments are merged;
     * a gap, or a compressed segment in between, starts a new group.
     */
    public static List<FastPathGroup> plan(List<Segment> uncompressed, FastPathStrategy strategy) {
        List<FastPathGroup> groups = new ArrayList<>();
        TimeRange     range   = null;
        List<Segment> members = new ArrayList<>();
        for (Segment s : uncompressed) {
            if (range != null && strategy == FastPathStrategy.CONTIGUOUS_RANGES && range.isFollowedBy(s.range())) {
                range = range.extendTo(s.range());
                members.add(s);
                continue;
            }
            if (range != null) {
                groups.add(new FastPathGroup(range, members));
            }
            range   = s.range();
            members = new ArrayList<>();
            members.add(s);
        }
        if (range != null) {
            groups.add(new FastPathGroup(range, members));
        }
        return groups;
    }
}
