package com.algocoin.data.metrics;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class SeriesMergerTest {

    private static final Frequency FIVE_MINUTES = Frequency.ofMinutes(5);
    private final SeriesMerger merger = new SeriesMerger();

    private static SeriesPoint point(String timestamp, Double value) {
        return new SeriesPoint(Instant.parse(timestamp), value);
    }

    @Test
    public void rowCountEqualsGridSize() {
        TimeWindow full = TimeWindow.parse("2021-07-01T18:00:00Z", "2021-07-01T19:00:00Z");
        TimeWindow first = TimeWindow.parse("2021-07-01T18:00:00Z", "2021-07-01T18:30:00Z");
        TimeWindow second = TimeWindow.parse("2021-07-01T18:30:00Z", "2021-07-01T19:00:00Z");

        WideTable table = merger.merge(List.of(
                new SeriesMerger.TimeBatchRows(second, Map.of("m", List.of(point("2021-07-01T18:35:00Z", 2.0)))),
                new SeriesMerger.TimeBatchRows(first, Map.of("m", List.of(point("2021-07-01T18:00:00Z", 1.0))))),
                full, FIVE_MINUTES);

        assertEquals(12, table.rowCount());
        assertEquals(Instant.parse("2021-07-01T18:00:00Z"), table.firstTimestamp());
        assertEquals(Instant.parse("2021-07-01T18:55:00Z"), table.lastTimestamp());
        assertEquals(1.0, table.getValue(Instant.parse("2021-07-01T18:00:00Z"), "m"));
        assertEquals(2.0, table.getValue(Instant.parse("2021-07-01T18:35:00Z"), "m"));
        assertEquals(2, table.countPresent("m"));
    }

    @Test
    public void offGridPointsAreDropped() {
        TimeWindow window = TimeWindow.parse("2021-07-01T18:00:00Z", "2021-07-01T18:15:00Z");
        WideTable table = merger.merge(List.of(new SeriesMerger.TimeBatchRows(window, Map.of("m", List.of(
                point("2021-07-01T18:02:30Z", 9.0),
                point("2021-07-01T18:05:00Z", 3.0),
                point("2021-07-01T18:20:00Z", 7.0))))), window, FIVE_MINUTES);

        assertEquals(3, table.rowCount());
        assertEquals(1, table.countPresent("m"));
        assertNull(table.getRow(Instant.parse("2021-07-01T18:02:30Z")));
        assertEquals(3.0, table.getValue(Instant.parse("2021-07-01T18:05:00Z"), "m"));
    }

    @Test
    public void laterBatchWinsOnDuplicateTimestamps() {
        TimeWindow full = TimeWindow.parse("2021-07-01T18:00:00Z", "2021-07-01T18:20:00Z");
        TimeWindow early = TimeWindow.parse("2021-07-01T18:00:00Z", "2021-07-01T18:15:00Z");
        TimeWindow late = TimeWindow.parse("2021-07-01T18:10:00Z", "2021-07-01T18:20:00Z");

        WideTable table = merger.merge(List.of(
                new SeriesMerger.TimeBatchRows(early, Map.of("m", List.of(point("2021-07-01T18:10:00Z", 1.0)))),
                new SeriesMerger.TimeBatchRows(late, Map.of("m", List.of(point("2021-07-01T18:10:00Z", 5.0))))),
                full, FIVE_MINUTES);

        assertEquals(4, table.rowCount());
        assertEquals(5.0, table.getValue(Instant.parse("2021-07-01T18:10:00Z"), "m"));
    }

    @Test
    public void missingBatchLeavesNullRowsWithAllColumns() {
        TimeWindow full = TimeWindow.parse("2021-07-01T18:00:00Z", "2021-07-01T18:20:00Z");
        TimeWindow first = TimeWindow.parse("2021-07-01T18:00:00Z", "2021-07-01T18:10:00Z");

        WideTable table = merger.merge(List.of(
                new SeriesMerger.TimeBatchRows(first, Map.of("a", List.of(point("2021-07-01T18:00:00Z", 1.0))))),
                full, FIVE_MINUTES, List.of("a", "b"));

        assertEquals(List.of("a", "b"), table.getColumns());
        assertEquals(4, table.rowCount());
        Map<String, Double> lastRow = table.getRow(Instant.parse("2021-07-01T18:15:00Z"));
        assertTrue(lastRow.containsKey("a"));
        assertTrue(lastRow.containsKey("b"));
        assertNull(lastRow.get("a"));
        assertNull(lastRow.get("b"));
    }

    @Test
    public void nullValuesStayNull() {
        TimeWindow window = TimeWindow.parse("2021-07-01T18:00:00Z", "2021-07-01T18:10:00Z");
        WideTable table = merger.merge(List.of(new SeriesMerger.TimeBatchRows(window, Map.of("m", List.of(
                SeriesPoint.coerce(Instant.parse("2021-07-01T18:00:00Z"), "not a number"),
                SeriesPoint.coerce(Instant.parse("2021-07-01T18:05:00Z"), "4.5"))))), window, FIVE_MINUTES);

        assertNull(table.getValue(Instant.parse("2021-07-01T18:00:00Z"), "m"));
        assertEquals(4.5, table.getValue(Instant.parse("2021-07-01T18:05:00Z"), "m"));
    }
}
