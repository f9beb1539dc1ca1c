package com.algocoin.data.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * Cuts a window into consecutive sub-windows of bounded duration. The last
 * sub-window may be shorter.
 */
public class TimeRangeBatcher {

    private final Duration maxDuration;

    public TimeRangeBatcher(Duration maxDuration) {
        Preconditions.checkArgument(maxDuration != null && !maxDuration.isNegative() && !maxDuration.isZero(),
                "Time batch duration must be positive, got %s", maxDuration);
        this.maxDuration = maxDuration;
    }

    public Duration getMaxDuration() {
        return maxDuration;
    }

    public List<TimeWindow> split(TimeWindow window) {
        List<TimeWindow> windows = new ArrayList<>();
        Instant cursor = window.getStart();
        while (cursor.isBefore(window.getEnd())) {
            Instant next = cursor.plus(maxDuration);
            if (next.isAfter(window.getEnd())) {
                next = window.getEnd();
            }
            windows.add(new TimeWindow(cursor, next));
            cursor = next;
        }
        return windows;
    }
}
