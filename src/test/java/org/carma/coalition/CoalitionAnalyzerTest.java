package org.carma.coalition;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

public class CoalitionAnalyzerTest {

    private static String scenarioPath() throws URISyntaxException {
        return Paths.get(CoalitionAnalyzerTest.class.getResource("/scenarios/two-providers.yaml").toURI()).toString();
    }

    @Test
    void testHelp() {
        assertEquals(0, CoalitionAnalyzer.run(new String[] {"--help"}));
    }

    @Test
    void testMissingScenario() {
        assertEquals(1, CoalitionAnalyzer.run(new String[] {"--formation", "nash"}));
    }

    @Test
    void testBadArguments() {
        assertEquals(1, CoalitionAnalyzer.run(new String[] {"--bogus"}));
        assertEquals(1, CoalitionAnalyzer.run(new String[] {"--formation", "core"}));
        assertEquals(1, CoalitionAnalyzer.run(new String[] {"--rnd-numit", "many"}));
        assertEquals(1, CoalitionAnalyzer.run(new String[] {"--scenario"}));
    }

    @Test
    void testUnreadableScenario(@TempDir Path dir) {
        assertEquals(1, CoalitionAnalyzer.run(new String[] {"--scenario", dir.resolve("absent.yaml").toString()}));
    }

    @Test
    void testFullRun(@TempDir Path dir) throws Exception {
        Path csv = dir.resolve("coalitions.csv");
        int code = CoalitionAnalyzer.run(new String[] {
            "--scenario", scenarioPath(),
            "--formation", "merge-split",
            "--payoff", "norm-banzhaf",
            "--csv", csv.toString(),
        });
        assertEquals(0, code);
        assertEquals(4, Files.readAllLines(csv).size());
    }
}
