package com.algocoin.data.metrics;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Post-merge check that a "total" metric equals the sum of its component
 * metrics (all columns sharing the total's prefix). Mismatches are reported
 * as warnings only.
 */
public class TotalConsistencyValidator {

    private static final Logger logger = LoggerFactory.getLogger(TotalConsistencyValidator.class);

    public static final double DEFAULT_TOLERANCE = 1e-6;
    public static final String SENTIMENT_TOTAL = "sentiment_balance_total";

    public enum Status {
        OK, MISSING_TOTAL, NO_COMPONENTS, MISMATCH
    }

    private final String totalColumn;
    private final String componentPrefix;
    private final double tolerance;

    public TotalConsistencyValidator() {
        this(SENTIMENT_TOTAL, DEFAULT_TOLERANCE);
    }

    /**
     * @param totalColumn column such as {@code sentiment_balance_total}; its
     *                    components are the other columns starting with
     *                    everything up to and including the last underscore
     */
    public TotalConsistencyValidator(String totalColumn, double tolerance) {
        this.totalColumn = totalColumn;
        int split = totalColumn.lastIndexOf('_');
        this.componentPrefix = split >= 0 ? totalColumn.substring(0, split + 1) : totalColumn;
        this.tolerance = tolerance;
    }

    public Report validate(WideTable table) {
        if (!table.hasColumn(totalColumn)) {
            logger.warn("No {} column for validation", totalColumn);
            return new Report(Status.MISSING_TOTAL, List.of(), 0);
        }

        List<String> components = new ArrayList<>();
        for (String column : table.getColumns()) {
            if (column.startsWith(componentPrefix) && !column.equals(totalColumn)) {
                components.add(column);
            }
        }
        if (components.isEmpty()) {
            logger.warn("No components of {} for sum validation", totalColumn);
            return new Report(Status.NO_COMPONENTS, List.of(), 0);
        }

        List<Instant> mismatches = new ArrayList<>();
        int checked = 0;
        for (Map.Entry<Instant, Map<String, Double>> entry : table.getRows().entrySet()) {
            Double total = entry.getValue().get(totalColumn);
            if (total == null) {
                continue;
            }
            checked++;
            double sum = 0.0;
            for (String component : components) {
                Double value = entry.getValue().get(component);
                if (value != null) {
                    sum += value;
                }
            }
            if (Math.abs(total - sum) > tolerance) {
                mismatches.add(entry.getKey());
            }
        }

        if (!mismatches.isEmpty()) {
            logger.warn("{} differs from the sum of {} components in {} of {} rows (first at {})",
                    totalColumn, components.size(), mismatches.size(), checked, mismatches.get(0));
            return new Report(Status.MISMATCH, mismatches, checked);
        }
        logger.info("Total validation ({}): OK over {} rows", totalColumn, checked);
        return new Report(Status.OK, mismatches, checked);
    }

    public static class Report {
        private final Status status;
        private final List<Instant> mismatchedRows;
        private final int checkedRows;

        Report(Status status, List<Instant> mismatchedRows, int checkedRows) {
            this.status = status;
            this.mismatchedRows = List.copyOf(mismatchedRows);
            this.checkedRows = checkedRows;
        }

        public Status getStatus() {
            return status;
        }

        public List<Instant> getMismatchedRows() {
            return mismatchedRows;
        }

        public int getCheckedRows() {
            return checkedRows;
        }

        @Override
        public String toString() {
            return status + " (" + mismatchedRows.size() + " of " + checkedRows + " rows mismatched)";
        }
    }
}
