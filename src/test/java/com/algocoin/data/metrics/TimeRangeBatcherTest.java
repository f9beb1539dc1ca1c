package com.algocoin.data.metrics;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;

public class TimeRangeBatcherTest {

    @Test
    public void lastWindowIsShorter() {
        TimeWindow window = TimeWindow.parse("2025-03-01T00:00:00Z", "2025-03-26T00:00:00Z");
        List<TimeWindow> parts = new TimeRangeBatcher(Duration.ofDays(10)).split(window);

        assertEquals(3, parts.size());
        assertEquals(TimeWindow.parse("2025-03-01T00:00:00Z", "2025-03-11T00:00:00Z"), parts.get(0));
        assertEquals(TimeWindow.parse("2025-03-11T00:00:00Z", "2025-03-21T00:00:00Z"), parts.get(1));
        assertEquals(TimeWindow.parse("2025-03-21T00:00:00Z", "2025-03-26T00:00:00Z"), parts.get(2));
    }

    @Test
    public void windowsAreContiguousAndCoverTheWholeRange() {
        TimeWindow window = TimeWindow.parse("2025-01-01T00:00:00Z", "2025-07-01T00:00:00Z");
        List<TimeWindow> parts = new TimeRangeBatcher(Duration.ofDays(30)).split(window);

        assertEquals(window.getStart(), parts.get(0).getStart());
        assertEquals(window.getEnd(), parts.get(parts.size() - 1).getEnd());
        for (int i = 1; i < parts.size(); i++) {
            assertEquals(parts.get(i - 1).getEnd(), parts.get(i).getStart());
            assertFalse(parts.get(i).getDuration().compareTo(Duration.ofDays(30)) > 0);
        }
    }

    @Test
    public void shortWindowIsKeptWhole() {
        TimeWindow window = TimeWindow.parse("2025-07-01T00:00:00Z", "2025-07-01T06:00:00Z");
        assertEquals(List.of(window), new TimeRangeBatcher(Duration.ofDays(1)).split(window));
    }

    @Test
    public void rejectsZeroDuration() {
        assertThrows(IllegalArgumentException.class, () -> new TimeRangeBatcher(Duration.ZERO));
    }
}
