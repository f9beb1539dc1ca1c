package com.algocoin.data.metrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered grid of (metric batch, time batch) cells for one collection run.
 * Cells are ordered by time batch first, so iterating the plan walks the
 * window chronologically.
 */
public class BatchPlan {

    private final TimeWindow window;
    private final List<String> metrics;
    private final List<TimeWindow> timeBatches;
    private final List<List<String>> metricBatches;
    private final List<Cell> cells;

    private BatchPlan(TimeWindow window, List<String> metrics,
            List<TimeWindow> timeBatches, List<List<String>> metricBatches) {
        this.window = window;
        this.metrics = List.copyOf(metrics);
        this.timeBatches = List.copyOf(timeBatches);
        this.metricBatches = List.copyOf(metricBatches);

        List<Cell> planned = new ArrayList<>();
        int index = 0;
        for (int t = 0; t < timeBatches.size(); t++) {
            for (int m = 0; m < metricBatches.size(); m++) {
                planned.add(new Cell(index++, t, metricBatches.get(m), timeBatches.get(t)));
            }
        }
        this.cells = Collections.unmodifiableList(planned);
    }

    public static BatchPlan create(List<String> metrics, TimeWindow window,
            MetricBatcher metricBatcher, TimeRangeBatcher timeRangeBatcher) {
        return new BatchPlan(window, metrics, timeRangeBatcher.split(window), metricBatcher.split(metrics));
    }

    public TimeWindow getWindow() {
        return window;
    }

    public List<String> getMetrics() {
        return metrics;
    }

    public List<TimeWindow> getTimeBatches() {
        return timeBatches;
    }

    public List<List<String>> getMetricBatches() {
        return metricBatches;
    }

    public List<Cell> getCells() {
        return cells;
    }

    public int size() {
        return cells.size();
    }

    /**
     * One unit of work: a metric subset fetched over a time subset.
     */
    public static class Cell {
        private final int index;
        private final int timeBatchIndex;
        private final List<String> metrics;
        private final TimeWindow window;

        Cell(int index, int timeBatchIndex, List<String> metrics, TimeWindow window) {
            this.index = index;
            this.timeBatchIndex = timeBatchIndex;
            this.metrics = metrics;
            this.window = window;
        }

        public int getIndex() {
            return index;
        }

        public int getTimeBatchIndex() {
            return timeBatchIndex;
        }

        public List<String> getMetrics() {
            return metrics;
        }

        public TimeWindow getWindow() {
            return window;
        }

        @Override
        public String toString() {
            return "cell " + index + " " + metrics.size() + " metrics " + window;
        }
    }
}
