package com.algocoin.data.store;

import java.time.Instant;
import java.util.Objects;

/**
 * First and last open time the store holds for an instrument and interval.
 * Both ends are null when the store has no rows at all.
 */
public final class AvailableRange {

    private static final AvailableRange NONE = new AvailableRange(null, null);

    private final Instant min;
    private final Instant max;

    private AvailableRange(Instant min, Instant max) {
        this.min = min;
        this.max = max;
    }

    public static AvailableRange of(Instant min, Instant max) {
        if (min == null || max == null) {
            return NONE;
        }
        return new AvailableRange(min, max);
    }

    public static AvailableRange none() {
        return NONE;
    }

    public boolean isEmpty() {
        return min == null;
    }

    public Instant getMin() {
        return min;
    }

    public Instant getMax() {
        return max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AvailableRange)) return false;
        AvailableRange other = (AvailableRange) o;
        return Objects.equals(min, other.min) && Objects.equals(max, other.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, max);
    }

    @Override
    public String toString() {
        return isEmpty() ? "(none)" : min + " … " + max;
    }
}
