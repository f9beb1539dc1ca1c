package com.algocoin.data.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * Canonical step of a reindexing grid, e.g. 5 minutes or 1 hour.
 */
public final class Frequency {

    private final Duration step;

    private Frequency(Duration step) {
        Preconditions.checkArgument(step != null && !step.isNegative() && !step.isZero(),
                "Frequency must be a positive duration, got %s", step);
        Preconditions.checkArgument(step.getNano() == 0,
                "Frequency must be a whole number of seconds, got %s", step);
        this.step = step;
    }

    public static Frequency of(Duration step) {
        return new Frequency(step);
    }

    public static Frequency ofMinutes(long minutes) {
        return new Frequency(Duration.ofMinutes(minutes));
    }

    public static Frequency ofHours(long hours) {
        return new Frequency(Duration.ofHours(hours));
    }

    /**
     * Accepts provider style labels ({@code 5m}, {@code 5min}, {@code 1h},
     * {@code hour}, {@code 1d}, {@code 30s}) as well as ISO-8601 durations.
     */
    public static Frequency parse(String text) {
        return new Frequency(parseDuration(text));
    }

    /**
     * Shared by the configuration layer, which uses the same short labels for batch durations.
     */
    public static Duration parseDuration(String text) {
        Preconditions.checkArgument(text != null && !text.trim().isEmpty(), "Duration text must not be empty");
        String value = text.trim().toLowerCase(Locale.ROOT);

        if (value.startsWith("p")) {
            return Duration.parse(value.toUpperCase(Locale.ROOT));
        }
        if (value.equals("hour")) {
            return Duration.ofHours(1);
        }
        if (value.equals("day")) {
            return Duration.ofDays(1);
        }
        if (value.equals("minute")) {
            return Duration.ofMinutes(1);
        }

        int unitIndex = 0;
        while (unitIndex < value.length() && Character.isDigit(value.charAt(unitIndex))) {
            unitIndex++;
        }
        Preconditions.checkArgument(unitIndex > 0 && unitIndex < value.length(),
                "Unrecognised duration '%s'", text);

        long amount = Long.parseLong(value.substring(0, unitIndex));
        String unit = value.substring(unitIndex);
        switch (unit) {
            case "s":
            case "sec":
                return Duration.ofSeconds(amount);
            case "m":
            case "min":
                return Duration.ofMinutes(amount);
            case "h":
                return Duration.ofHours(amount);
            case "d":
                return Duration.ofDays(amount);
            case "w":
                return Duration.ofDays(7 * amount);
            default:
                throw new IllegalArgumentException("Unrecognised duration unit '" + unit + "' in '" + text + "'");
        }
    }

    public Duration getStep() {
        return step;
    }

    /**
     * Label understood by the remote time-series APIs ({@code 5m}, {@code 1h}, {@code 1d}).
     */
    public String toApiInterval() {
        long seconds = step.getSeconds();
        if (seconds % 86400 == 0) {
            return (seconds / 86400) + "d";
        }
        if (seconds % 3600 == 0) {
            return (seconds / 3600) + "h";
        }
        if (seconds % 60 == 0) {
            return (seconds / 60) + "m";
        }
        return seconds + "s";
    }

    /**
     * True when {@code duration} is a whole, positive number of steps.
     */
    public boolean divides(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return false;
        }
        long stepNanos = step.toNanos();
        return duration.toNanos() % stepNanos == 0;
    }

    /**
     * Grid of {@code start, start + step, ...} strictly before the window end.
     */
    public List<Instant> grid(TimeWindow window) {
        List<Instant> points = new ArrayList<>();
        Instant cursor = window.getStart();
        while (cursor.isBefore(window.getEnd())) {
            points.add(cursor);
            cursor = cursor.plus(step);
        }
        return points;
    }

    public int gridSize(TimeWindow window) {
        long windowNanos = window.getDuration().toNanos();
        long stepNanos = step.toNanos();
        return (int) ((windowNanos + stepNanos - 1) / stepNanos);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Frequency)) {
            return false;
        }
        return step.equals(((Frequency) o).step);
    }

    @Override
    public int hashCode() {
        return Objects.hash(step);
    }

    @Override
    public String toString() {
        return toApiInterval();
    }
}
