package com.algocoin.data.metrics;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

public class FrequencyTest {

    @Test
    public void parsesProviderLabels() {
        assertEquals(Duration.ofMinutes(5), Frequency.parse("5m").getStep());
        assertEquals(Duration.ofMinutes(5), Frequency.parse("5min").getStep());
        assertEquals(Duration.ofHours(1), Frequency.parse("hour").getStep());
        assertEquals(Duration.ofHours(1), Frequency.parse("1h").getStep());
        assertEquals(Duration.ofDays(30), Frequency.parseDuration("30d"));
        assertEquals(Duration.ofMinutes(15), Frequency.parse("PT15M").getStep());
    }

    @Test
    public void rejectsUnknownUnits() {
        assertThrows(IllegalArgumentException.class, () -> Frequency.parse("5y"));
        assertThrows(IllegalArgumentException.class, () -> Frequency.parse("m"));
        assertThrows(IllegalArgumentException.class, () -> Frequency.parse(""));
    }

    @Test
    public void formatsApiInterval() {
        assertEquals("5m", Frequency.ofMinutes(5).toApiInterval());
        assertEquals("1h", Frequency.ofMinutes(60).toApiInterval());
        assertEquals("1d", Frequency.ofHours(24).toApiInterval());
        assertEquals("30s", Frequency.of(Duration.ofSeconds(30)).toApiInterval());
    }

    @Test
    public void gridIsHalfOpen() {
        TimeWindow window = TimeWindow.parse("2021-07-01T18:00:00Z", "2021-07-01T18:30:00Z");
        List<Instant> grid = Frequency.ofMinutes(5).grid(window);

        assertEquals(6, grid.size());
        assertEquals(6, Frequency.ofMinutes(5).gridSize(window));
        assertEquals(Instant.parse("2021-07-01T18:00:00Z"), grid.get(0));
        assertEquals(Instant.parse("2021-07-01T18:25:00Z"), grid.get(5));
    }

    @Test
    public void rejectsSubSecondSteps() {
        assertThrows(IllegalArgumentException.class, () -> Frequency.parse("PT0.5S"));
        assertThrows(IllegalArgumentException.class, () -> Frequency.of(Duration.ofMillis(1500)));
    }

    @Test
    public void dividesWholeMultiplesOnly() {
        Frequency fiveMinutes = Frequency.ofMinutes(5);
        assertTrue(fiveMinutes.divides(Duration.ofDays(30)));
        assertFalse(fiveMinutes.divides(Duration.ofMinutes(7)));
        assertFalse(fiveMinutes.divides(Duration.ZERO));
    }
}
