package org.carma.coalition.runner;

import org.carma.coalition.model.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CsvExporterTest {

    private static CoalitionFormationInfo pair() {
        CoalitionTable table = CoalitionTable.builder(2)
            .put(CoalitionInfo.builder(CoalitionId.singleton(0)).value(1.0).payoff(0, 1.0).build())
            .put(CoalitionInfo.builder(CoalitionId.singleton(1)).value(0.5).payoff(1, 0.5).build())
            // unsolved: no payoffs
            .put(CoalitionInfo.builder(CoalitionId.grand(2)).build())
            .build();
        return new CoalitionFormationInfo(table, List.of());
    }

    @Test
    void testHeaderAndRows() throws IOException {
        StringWriter w = new StringWriter();
        new CsvExporter().write(w, pair(), false);
        assertEquals(String.join("\n",
            "\"Coalition ID\",\"Payoff(CIP 0)\",\"Payoff(CIP 1)\",\"Value(Coalition)\"",
            "1,1.000000,,1.000000",
            "2,,0.500000,0.500000",
            "3,,,0.000000",
            ""), w.toString());
    }

    @Test
    void testAppendWritesSeparatorLine() throws IOException {
        StringWriter w = new StringWriter();
        new CsvExporter().write(w, pair(), true);
        assertTrue(w.toString().startsWith(",,\n1,1.000000,,1.000000\n"));
    }

    @Test
    void testExportTruncatesThenAppends(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("coalitions.csv");
        Files.writeString(file, "stale content\n");
        CsvExporter exporter = new CsvExporter();

        exporter.export(file, pair(), false);
        exporter.export(file, pair(), true);

        List<String> lines = Files.readAllLines(file);
        assertEquals(8, lines.size());
        assertTrue(lines.get(0).startsWith("\"Coalition ID\""));
        assertEquals(",,", lines.get(4));
        assertFalse(lines.contains("stale content"));
    }

    @Test
    void testSmallPayoffsUseFixedNotation() throws IOException {
        CoalitionTable table = CoalitionTable.builder(1)
            .put(CoalitionInfo.builder(CoalitionId.singleton(0)).value(1e-4).payoff(0, 1e-4).build())
            .build();
        StringWriter w = new StringWriter();
        new CsvExporter().write(w, new CoalitionFormationInfo(table, List.of()), true);
        assertEquals(",\n1,0.000100,0.000100\n", w.toString());
    }
}
