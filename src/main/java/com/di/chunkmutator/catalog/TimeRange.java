package com.di.chunkmutator.catalog;

import java.time.Instant;
import java.util.Objects;

/**
 * Half-open time interval {@code [start, end)}.
 */
public record TimeRange(Instant start, Instant end) {

    public TimeRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("range start " + start + " must be before end " + end);
        }
    }

    /** {@code true} when {@code other} starts exactly where this range ends. */
    public boolean isFollowedBy(TimeRange other) {
        return end.equals(other.start);
    }

    public TimeRange extendTo(TimeRange other) {
        return new TimeRange(start, other.end);
    }

    public boolean contains(Instant t) {
        return !t.isBefore(start) && t.isBefore(end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
