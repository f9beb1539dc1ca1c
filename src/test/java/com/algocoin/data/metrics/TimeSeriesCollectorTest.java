package com.algocoin.data.metrics;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

public class TimeSeriesCollectorTest {

    private static final Frequency FIVE_MINUTES = Frequency.ofMinutes(5);
    private static final TimeWindow WINDOW = TimeWindow.parse("2025-07-01T00:00:00Z", "2025-07-01T03:00:00Z");
    private static final List<String> METRICS = List.of(
            "sentiment_positive_reddit", "sentiment_positive_farcaster",
            "sentiment_negative_reddit", "social_volume_reddit", "sentiment_balance_total");

    @Test
    public void collectsEveryCellOntoTheFullGrid() {
        ScriptedFetcher fetcher = new ScriptedFetcher(FIVE_MINUTES);
        TimeSeriesCollector collector = new TimeSeriesCollector(fetcher, 2, Duration.ofHours(1), FIVE_MINUTES);

        CollectionResult result = collector.collect(METRICS, WINDOW);

        assertEquals(9, result.getCellCount());
        assertEquals(9, fetcher.getCalls().size());
        assertFalse(result.hasFailures());
        WideTable table = result.getTable();
        assertEquals(36, table.rowCount());
        assertEquals(METRICS, table.getColumns());
        for (String metric : METRICS) {
            assertEquals(36, table.countPresent(metric));
        }
    }

    @Test
    public void rejectedMetricIsFilteredInEveryTimeBatch() {
        ScriptedFetcher fetcher = new ScriptedFetcher(FIVE_MINUTES).rejecting("sentiment_positive_farcaster");
        TimeSeriesCollector collector = new TimeSeriesCollector(fetcher, 2, Duration.ofHours(1), FIVE_MINUTES);

        CollectionResult result = collector.collect(METRICS, WINDOW);

        assertEquals(Set.of("sentiment_positive_farcaster"), result.getFilteredMetrics());
        assertFalse(result.getTable().hasColumn("sentiment_positive_farcaster"));
        assertEquals(36, result.getTable().countPresent("sentiment_positive_reddit"));
        // 3 time batches x 3 metric batches, plus one retry for the batch holding farcaster each hour
        assertEquals(12, fetcher.getCalls().size());
        assertFalse(result.hasFailures());
    }

    @Test
    public void failedTimeBatchLeavesNullRows() {
        TimeWindow broken = TimeWindow.parse("2025-07-01T01:00:00Z", "2025-07-01T02:00:00Z");
        ScriptedFetcher fetcher = new ScriptedFetcher(FIVE_MINUTES).failingOn(broken);
        TimeSeriesCollector collector = new TimeSeriesCollector(fetcher, 10, Duration.ofHours(1), FIVE_MINUTES);

        CollectionResult result = collector.collect(METRICS, WINDOW);

        assertEquals(1, result.getFailures().size());
        assertEquals(FetchErrorKind.TRANSPORT, result.getFailures().get(0).getErrorKind());
        assertEquals(broken, result.getFailures().get(0).getCell().getWindow());
        assertEquals(2, result.getSucceededCells());

        WideTable table = result.getTable();
        assertEquals(36, table.rowCount());
        assertNull(table.getValue(Instant.parse("2025-07-01T01:30:00Z"), "sentiment_positive_reddit"));
        assertNotNull(table.getValue(Instant.parse("2025-07-01T02:30:00Z"), "sentiment_positive_reddit"));
    }

    @Test
    public void throwingFetcherIsRecordedAsFailure() {
        RemoteFetcher throwing = (metrics, window) -> {
            throw new IllegalStateException("boom");
        };
        TimeSeriesCollector collector = new TimeSeriesCollector(throwing, 10, Duration.ofDays(1), FIVE_MINUTES);

        CollectionResult result = collector.collect(List.of("a"), WINDOW);

        assertEquals(1, result.getFailures().size());
        assertEquals(FetchErrorKind.UNCLASSIFIED, result.getFailures().get(0).getErrorKind());
        assertEquals(36, result.getTable().rowCount());
        assertEquals(0, result.getTable().countPresent("a"));
    }

    @Test
    public void concurrentRunMatchesSequentialRun() {
        ScriptedFetcher sequentialFetcher = new ScriptedFetcher(FIVE_MINUTES).rejecting("social_volume_reddit");
        ScriptedFetcher concurrentFetcher = new ScriptedFetcher(FIVE_MINUTES).rejecting("social_volume_reddit");

        WideTable sequential = new TimeSeriesCollector(sequentialFetcher, new MetricBatcher(2),
                new TimeRangeBatcher(Duration.ofMinutes(30)), FIVE_MINUTES, 1).collect(METRICS, WINDOW).getTable();
        WideTable concurrent = new TimeSeriesCollector(concurrentFetcher, new MetricBatcher(2),
                new TimeRangeBatcher(Duration.ofMinutes(30)), FIVE_MINUTES, 4).collect(METRICS, WINDOW).getTable();

        assertEquals(sequential.getColumns(), concurrent.getColumns());
        assertEquals(sequential.getRows(), concurrent.getRows());
        assertEquals(sequentialFetcher.getCalls().size(), concurrentFetcher.getCalls().size());
    }

    @Test
    public void rejectsTimeBatchThatIsNotAWholeNumberOfSteps() {
        ScriptedFetcher fetcher = new ScriptedFetcher(Frequency.ofMinutes(7));

        assertThrows(IllegalArgumentException.class,
                () -> new TimeSeriesCollector(fetcher, 10, Duration.ofHours(1), Frequency.ofMinutes(7)));
        assertTrue(fetcher.getCalls().isEmpty());
    }

    @Test
    public void rejectsNonPositiveConcurrency() {
        assertThrows(IllegalArgumentException.class, () -> new TimeSeriesCollector(new ScriptedFetcher(FIVE_MINUTES),
                new MetricBatcher(1), new TimeRangeBatcher(Duration.ofHours(1)), FIVE_MINUTES, 0));
    }
}
