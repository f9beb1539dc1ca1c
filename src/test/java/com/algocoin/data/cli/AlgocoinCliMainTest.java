package com.algocoin.data.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import picocli.CommandLine;

public class AlgocoinCliMainTest {

    @Test
    public void parsesDatesAndInstants() {
        assertEquals(Instant.parse("2025-03-01T00:00:00Z"), AlgocoinCliMain.parseInstant("2025-03-01"));
        assertEquals(Instant.parse("2025-03-01T12:30:00Z"), AlgocoinCliMain.parseInstant("2025-03-01T12:30:00Z"));
        assertNull(AlgocoinCliMain.parseInstant("  "));
        assertThrows(IllegalArgumentException.class, () -> AlgocoinCliMain.parseInstant("March 1st"));
    }

    @Test
    public void registersEverySubcommand() {
        CommandLine cmd = new CommandLine(new AlgocoinCliMain());
        assertTrue(cmd.getSubcommands().keySet().containsAll(
                List.of("santiment", "lunarcrush", "candles", "sentiment", "upload-json", "help")));
    }

    @Test
    public void missingRequiredOptionFails() {
        assertNotEquals(0, AlgocoinCliMain.run(new String[] { "santiment", "--slug", "bitcoin" }));
    }
}
