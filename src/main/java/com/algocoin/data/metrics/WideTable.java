package com.algocoin.data.metrics;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

/**
 * Timestamp-indexed table with one column per metric. Missing observations
 * are explicit nulls; every row carries every column.
 */
public final class WideTable {

    private final List<String> columns;
    private final NavigableMap<Instant, Map<String, Double>> rows;

    private WideTable(List<String> columns, NavigableMap<Instant, Map<String, Double>> rows) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.rows = Collections.unmodifiableNavigableMap(rows);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static WideTable empty(List<String> columns) {
        return new Builder().columns(columns).build();
    }

    public List<String> getColumns() {
        return columns;
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public List<Instant> getTimestamps() {
        return new ArrayList<>(rows.keySet());
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Row for a timestamp, or null if the timestamp is not part of the index.
     */
    public Map<String, Double> getRow(Instant timestamp) {
        return rows.get(timestamp);
    }

    public Double getValue(Instant timestamp, String column) {
        Map<String, Double> row = rows.get(timestamp);
        return row == null ? null : row.get(column);
    }

    public List<Double> getColumn(String column) {
        List<Double> values = new ArrayList<>(rows.size());
        for (Map<String, Double> row : rows.values()) {
            values.add(row.get(column));
        }
        return values;
    }

    public NavigableMap<Instant, Map<String, Double>> getRows() {
        return rows;
    }

    public Instant firstTimestamp() {
        return rows.isEmpty() ? null : rows.firstKey();
    }

    public Instant lastTimestamp() {
        return rows.isEmpty() ? null : rows.lastKey();
    }

    /**
     * Number of non-null cells in a column.
     */
    public int countPresent(String column) {
        int count = 0;
        for (Map<String, Double> row : rows.values()) {
            if (row.get(column) != null) {
                count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return "WideTable[" + rows.size() + " rows x " + columns.size() + " columns, "
                + firstTimestamp() + " .. " + lastTimestamp() + "]";
    }

    public static class Builder {
        private final Set<String> columns = new LinkedHashSet<>();
        private final TreeMap<Instant, Map<String, Double>> rows = new TreeMap<>();

        public Builder columns(List<String> names) {
            columns.addAll(names);
            return this;
        }

        public Builder column(String name) {
            columns.add(name);
            return this;
        }

        /**
         * Adds an all-null row if the timestamp is not present yet.
         */
        public Builder row(Instant timestamp) {
            rows.computeIfAbsent(timestamp, ts -> new LinkedHashMap<>());
            return this;
        }

        public Builder value(Instant timestamp, String column, Double value) {
            columns.add(column);
            rows.computeIfAbsent(timestamp, ts -> new LinkedHashMap<>()).put(column, value);
            return this;
        }

        public WideTable build() {
            List<String> columnList = new ArrayList<>(columns);
            TreeMap<Instant, Map<String, Double>> complete = new TreeMap<>();
            for (Map.Entry<Instant, Map<String, Double>> entry : rows.entrySet()) {
                Map<String, Double> row = new LinkedHashMap<>();
                for (String column : columnList) {
                    row.put(column, entry.getValue().get(column));
                }
                complete.put(entry.getKey(), Collections.unmodifiableMap(row));
            }
            return new WideTable(columnList, complete);
        }
    }
}
