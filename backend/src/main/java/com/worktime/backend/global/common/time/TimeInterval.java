package com.worktime.backend.global.common.time;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Half-open instant interval {@code [start, end)}. Comparing instants keeps entries recorded with
 * different offsets on one time line.
 */
public record TimeInterval(Instant start, Instant end) {

    public TimeInterval {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("interval start must be before end");
        }
    }

    public static TimeInterval of(OffsetDateTime start, OffsetDateTime end) {
        return new TimeInterval(start.toInstant(), end.toInstant());
    }

    /**
     * Touching intervals ({@code a.end == b.start}) do not overlap.
     */
    public boolean overlaps(TimeInterval other) {
        return start.isBefore(other.end) && end.isAfter(other.start);
    }

    public long minutes() {
        return Duration.between(start, end).toMinutes();
    }
}
