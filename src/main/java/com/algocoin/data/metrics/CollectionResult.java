package com.algocoin.data.metrics;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of one collection run: the merged table plus what went wrong on
 * the way. A run with failed cells still yields a table, the failed cells
 * simply stay null.
 */
public class CollectionResult {

    private final WideTable table;
    private final List<CellFailure> failures;
    private final Set<String> filteredMetrics;
    private final int cellCount;

    public CollectionResult(WideTable table, List<CellFailure> failures, Set<String> filteredMetrics,
            int cellCount) {
        this.table = table;
        this.failures = List.copyOf(failures);
        this.filteredMetrics = Collections.unmodifiableSet(new LinkedHashSet<>(filteredMetrics));
        this.cellCount = cellCount;
    }

    public WideTable getTable() {
        return table;
    }

    public List<CellFailure> getFailures() {
        return failures;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * Metrics removed by the provider in at least one cell.
     */
    public Set<String> getFilteredMetrics() {
        return filteredMetrics;
    }

    public int getCellCount() {
        return cellCount;
    }

    public int getSucceededCells() {
        return cellCount - failures.size();
    }

    @Override
    public String toString() {
        return "CollectionResult[" + table + ", " + getSucceededCells() + "/" + cellCount
                + " cells ok, filtered=" + filteredMetrics + "]";
    }

    /**
     * A plan cell that produced no data.
     */
    public static class CellFailure {
        private final BatchPlan.Cell cell;
        private final FetchOutcome outcome;

        public CellFailure(BatchPlan.Cell cell, FetchOutcome outcome) {
            this.cell = cell;
            this.outcome = outcome;
        }

        public BatchPlan.Cell getCell() {
            return cell;
        }

        public FetchOutcome getOutcome() {
            return outcome;
        }

        public FetchErrorKind getErrorKind() {
            return outcome.getErrorKind();
        }

        @Override
        public String toString() {
            return cell + ": " + outcome;
        }
    }
}
