package com.algocoin.data.metrics;

import java.time.Instant;
import java.util.Objects;

/**
 * One observation of one metric. The value is null when the provider sent
 * nothing usable for this timestamp.
 */
public final class SeriesPoint {

    private final Instant timestamp;
    private final Double value;

    public SeriesPoint(Instant timestamp, Double value) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.value = value;
    }

    /**
     * Builds a point from a raw JSON value, coercing anything that is not a
     * finite number (or a string holding one) to null.
     */
    public static SeriesPoint coerce(Instant timestamp, Object rawValue) {
        return new SeriesPoint(timestamp, toDouble(rawValue));
    }

    public static Double toDouble(Object rawValue) {
        Double value = null;
        if (rawValue instanceof Number) {
            value = ((Number) rawValue).doubleValue();
        } else if (rawValue instanceof String) {
            try {
                value = Double.valueOf(((String) rawValue).trim());
            } catch (NumberFormatException e) {
                value = null;
            }
        }
        if (value != null && (value.isNaN() || value.isInfinite())) {
            return null;
        }
        return value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SeriesPoint)) {
            return false;
        }
        SeriesPoint other = (SeriesPoint) o;
        return timestamp.equals(other.timestamp) && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return timestamp + "=" + value;
    }
}
