package com.algocoin.data.metrics;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles per-batch metric series into one {@link WideTable} whose index is
 * exactly the canonical grid of the full window.
 *
 * <p>Each time batch is first reindexed onto its own grid, batches are then
 * concatenated chronologically (a timestamp seen twice keeps the later row),
 * and the result is reindexed onto the full grid so failed or skipped batches
 * show up as all-null rows.
 */
public class SeriesMerger {

    private static final Logger logger = LoggerFactory.getLogger(SeriesMerger.class);

    public WideTable merge(List<TimeBatchRows> batches, TimeWindow fullWindow, Frequency frequency) {
        return merge(batches, fullWindow, frequency, List.of());
    }

    /**
     * @param columns metrics that must appear as columns even when no batch returned them
     */
    public WideTable merge(List<TimeBatchRows> batches, TimeWindow fullWindow, Frequency frequency,
            List<String> columns) {

        Set<String> allColumns = new LinkedHashSet<>(columns);
        List<TimeBatchRows> ordered = new ArrayList<>(batches);
        ordered.sort(Comparator.comparing(batch -> batch.getWindow().getStart()));

        TreeMap<Instant, Map<String, Double>> concatenated = new TreeMap<>();
        int duplicateRows = 0;

        for (TimeBatchRows batch : ordered) {
            allColumns.addAll(batch.getRows().keySet());
            Map<Instant, Map<String, Double>> reindexed = reindexBatch(batch, frequency);
            for (Map.Entry<Instant, Map<String, Double>> row : reindexed.entrySet()) {
                if (concatenated.put(row.getKey(), row.getValue()) != null) {
                    duplicateRows++;
                }
            }
        }

        if (duplicateRows > 0) {
            logger.warn("{} duplicate timestamps across time batches, kept the later rows", duplicateRows);
        }

        List<String> columnList = new ArrayList<>(allColumns);
        WideTable.Builder table = WideTable.builder().columns(columnList);
        for (Instant timestamp : frequency.grid(fullWindow)) {
            table.row(timestamp);
            Map<String, Double> row = concatenated.get(timestamp);
            if (row != null) {
                for (Map.Entry<String, Double> cell : row.entrySet()) {
                    table.value(timestamp, cell.getKey(), cell.getValue());
                }
            }
        }

        WideTable merged = table.build();
        logger.debug("Merged {} time batches into {}", ordered.size(), merged);
        return merged;
    }

    private Map<Instant, Map<String, Double>> reindexBatch(TimeBatchRows batch, Frequency frequency) {
        Map<Instant, Map<String, Double>> grid = new LinkedHashMap<>();
        for (Instant timestamp : frequency.grid(batch.getWindow())) {
            Map<String, Double> row = new LinkedHashMap<>();
            for (String metric : batch.getRows().keySet()) {
                row.put(metric, null);
            }
            grid.put(timestamp, row);
        }

        int offGrid = 0;
        for (Map.Entry<String, List<SeriesPoint>> series : batch.getRows().entrySet()) {
            for (SeriesPoint point : series.getValue()) {
                Map<String, Double> row = grid.get(point.getTimestamp());
                if (row == null) {
                    offGrid++;
                    continue;
                }
                row.put(series.getKey(), point.getValue());
            }
        }
        if (offGrid > 0) {
            logger.debug("Dropped {} points outside the {} grid of {}", offGrid, frequency, batch.getWindow());
        }
        return grid;
    }

    /**
     * Series of every metric fetched for one time batch, possibly gathered
     * from several metric batches.
     */
    public static class TimeBatchRows {
        private final TimeWindow window;
        private final Map<String, List<SeriesPoint>> rows;

        public TimeBatchRows(TimeWindow window, Map<String, List<SeriesPoint>> rows) {
            this.window = window;
            this.rows = new LinkedHashMap<>(rows);
        }

        public TimeWindow getWindow() {
            return window;
        }

        public Map<String, List<SeriesPoint>> getRows() {
            return rows;
        }
    }
}
