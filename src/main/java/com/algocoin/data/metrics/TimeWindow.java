package com.algocoin.data.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * Half-open interval [start, end) of UTC instants.
 */
public final class TimeWindow {

    private final Instant start;
    private final Instant end;

    public TimeWindow(Instant start, Instant end) {
        Preconditions.checkArgument(start != null && end != null, "Window bounds must not be null");
        Preconditions.checkArgument(start.isBefore(end),
                "Window start %s must be before end %s", start, end);
        this.start = start;
        this.end = end;
    }

    public static TimeWindow of(Instant start, Instant end) {
        return new TimeWindow(start, end);
    }

    /**
     * Parses ISO-8601 instants such as {@code 2021-07-01T18:00:00Z}.
     */
    public static TimeWindow parse(String start, String end) {
        return new TimeWindow(Instant.parse(start), Instant.parse(end));
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public Duration getDuration() {
        return Duration.between(start, end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimeWindow)) {
            return false;
        }
        TimeWindow other = (TimeWindow) o;
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
