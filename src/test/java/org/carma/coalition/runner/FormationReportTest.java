package org.carma.coalition.runner;

import org.carma.coalition.model.*;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FormationReportTest {

    private static CoalitionTable pair() {
        return CoalitionTable.builder(2)
            .put(CoalitionInfo.builder(CoalitionId.singleton(0)).value(1.0).payoff(0, 1.0)
                .coreEmpty(false).payoffsInCore(true).build())
            .put(CoalitionInfo.builder(CoalitionId.singleton(1)).value(1.0).payoff(1, 1.0)
                .coreEmpty(false).payoffsInCore(true).build())
            .put(CoalitionInfo.builder(CoalitionId.grand(2)).value(3.0).payoff(0, 1.5).payoff(1, 1.5)
                .coreEmpty(false).payoffsInCore(true).build())
            .build();
    }

    private static String print(CoalitionFormationInfo formation) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        new FormationReport(new PrintStream(bytes, true, StandardCharsets.UTF_8)).print(formation);
        return bytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testReportOnGrandCoalition() {
        PartitionInfo grand = new PartitionInfo(List.of(CoalitionId.grand(2)), Map.of(0, 1.5, 1, 1.5), 3.0);
        String report = print(new CoalitionFormationInfo(pair(), List.of(grand)));

        assertTrue(report.contains("### Report on Formed Coalitions:"));
        assertTrue(report.contains(" * Payoffs: {{0 => 1.500000, 1 => 1.500000}}"));
        assertTrue(report.contains(" * Value: 3.000000"));
        assertTrue(report.contains(" * Payoff increments wrt Singleton Coalitions: {{0 => 50.000000%, 1 => 50.000000%}}"));
        assertTrue(report.contains(" * Value increments wrt Grand-Coalition: 0.000000%"));
        assertTrue(report.contains(" * Value increments wrt Singleton Coalitions: 50.000000%"));
        assertTrue(report.contains(" * Payoffs: {{0 => 1.000000}, {1 => 1.000000}}"));
        assertTrue(report.contains(" * Core exists?: {{true}, {true}}"));
    }

    @Test
    void testReportWithoutStablePartition() {
        String report = print(new CoalitionFormationInfo(pair(), List.of()));
        int best = report.indexOf("- Best Partitions:");
        int grand = report.indexOf("- Grand Coalition:");
        assertTrue(best >= 0 && grand > best);
        assertTrue(report.substring(best, grand).contains(" * NOT AVAILABLE"));
    }

    @Test
    void testIncrement() {
        assertEquals(50.0, FormationReport.increment(3.0, 2.0), 1e-12);
        assertEquals(-25.0, FormationReport.increment(1.5, 2.0), 1e-12);
        assertEquals("0.123457", FormationReport.fmt(0.1234567));
    }
}
