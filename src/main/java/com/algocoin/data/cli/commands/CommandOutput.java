package com.algocoin.data.cli.commands;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import com.algocoin.data.metrics.CollectionResult;
import com.algocoin.data.metrics.WideTable;

/**
 * Console output shared by the commands.
 */
final class CommandOutput {

    private CommandOutput() {
    }

    static void printSummary(CollectionResult result, Path target) {
        WideTable table = result.getTable();
        System.out.println("💾 Saved: " + target);
        System.out.println("Time range: " + table.firstTimestamp() + " → " + table.lastTimestamp()
                + " | Rows: " + table.rowCount());
        System.out.println("Columns: " + table.getColumns());
        if (!result.getFilteredMetrics().isEmpty()) {
            System.out.println("⚠️  Filtered out unsupported metrics: " + result.getFilteredMetrics());
        }
        if (result.hasFailures()) {
            System.out.println("❌ " + result.getFailures().size() + " of " + result.getCellCount()
                    + " requests failed:");
            for (CollectionResult.CellFailure failure : result.getFailures()) {
                System.out.println("   " + failure.getCell().getWindow() + " " + failure.getErrorKind() + ": "
                        + failure.getOutcome().getMessages());
            }
        }
    }

    /**
     * Prints at most {@code limit} rows (all when {@code limit <= 0}).
     */
    static void printTable(WideTable table, int limit) {
        List<String> columns = table.getColumns();
        StringBuilder header = new StringBuilder(String.format("%-22s", "timestamp"));
        for (String column : columns) {
            header.append(String.format(" %18s", abbreviate(column, 18)));
        }
        System.out.println(header);

        int printed = 0;
        for (Map.Entry<Instant, Map<String, Double>> row : table.getRows().entrySet()) {
            if (limit > 0 && printed >= limit) {
                System.out.println("... " + (table.rowCount() - printed) + " more rows");
                break;
            }
            StringBuilder line = new StringBuilder(String.format("%-22s", row.getKey()));
            for (String column : columns) {
                Double value = row.getValue().get(column);
                line.append(value == null ? String.format(" %18s", "-") : String.format(" %18.6f", value));
            }
            System.out.println(line);
            printed++;
        }
    }

    private static String abbreviate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max - 1) + "…";
    }
}
