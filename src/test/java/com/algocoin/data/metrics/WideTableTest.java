package com.algocoin.data.metrics;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

public class WideTableTest {

    @Test
    public void everyRowCarriesEveryColumn() {
        Instant t0 = Instant.parse("2025-03-01T00:00:00Z");
        Instant t1 = Instant.parse("2025-03-01T00:05:00Z");
        WideTable table = WideTable.builder()
                .column("a")
                .value(t1, "b", 2.0)
                .row(t0)
                .build();

        assertEquals(List.of("a", "b"), table.getColumns());
        assertEquals(t0, table.firstTimestamp());
        assertEquals(Arrays.asList(null, 2.0), table.getColumn("b"));
        assertTrue(table.getRow(t0).containsKey("a"));
        assertTrue(table.getRow(t0).containsKey("b"));
        assertEquals(1, table.countPresent("b"));
    }

    @Test
    public void emptyTableKeepsColumns() {
        WideTable table = WideTable.empty(List.of("x"));
        assertTrue(table.isEmpty());
        assertTrue(table.hasColumn("x"));
        assertNull(table.firstTimestamp());
    }
}
