package org.carma.coalition.simulation;

import org.carma.coalition.config.RunOptions;
import org.carma.coalition.config.ScenarioConfigLoader;
import org.carma.coalition.model.Scenario;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public class ScenarioPerturbatorTest {

    private static Scenario base;

    @BeforeAll
    static void loadScenario() throws IOException {
        base = new ScenarioConfigLoader().loadResource("scenarios/sample-3cips.yaml");
    }

    private static RunOptions allPerturbations(long seed) {
        return RunOptions.builder()
            .randomVms(true)
            .randomPmPowerStates(true)
            .randomPmSwitchCosts(true)
            .randomMigrationCosts(true)
            .iterations(3)
            .seed(seed)
            .build();
    }

    @Test
    void testNoPerturbationReturnsBase() {
        ScenarioPerturbator perturbator = new ScenarioPerturbator(base, RunOptions.defaults());
        assertEquals(1, perturbator.getIterations());
        assertSame(base, perturbator.next());
    }

    @Test
    void testSameSeedSameSequence() {
        ScenarioPerturbator a = new ScenarioPerturbator(base, allPerturbations(42));
        ScenarioPerturbator b = new ScenarioPerturbator(base, allPerturbations(42));
        for (int i = 0; i < a.getIterations(); i++) {
            Scenario sa = a.next();
            Scenario sb = b.next();
            for (int c = 0; c < base.getNumProviders(); c++) {
                for (int v = 0; v < base.getNumVmTypes(); v++) {
                    assertEquals(sa.getVmCount(c, v), sb.getVmCount(c, v));
                }
                for (int k = 0; k < base.getPmCount(c); k++) {
                    assertEquals(sa.isPmPoweredOn(c, k), sb.isPmPoweredOn(c, k));
                }
                assertEquals(sa.getPmAwakeCost(c, 2), sb.getPmAwakeCost(c, 2));
                assertEquals(sa.getMigrationCost(c, (c + 1) % 3, 1), sb.getMigrationCost(c, (c + 1) % 3, 1));
            }
        }
    }

    @Test
    void testDrawsStayWithinBounds() {
        ScenarioPerturbator perturbator = new ScenarioPerturbator(base, allPerturbations(RunOptions.DEFAULT_SEED));
        assertEquals(3, perturbator.getIterations());
        for (int i = 0; i < 3; i++) {
            Scenario s = perturbator.next();
            for (int c = 0; c < 3; c++) {
                assertEquals(base.getPmCount(c), s.getPmCount(c));
                for (int v = 0; v < 3; v++) {
                    assertTrue(s.getVmCount(c, v) >= 0);
                    assertTrue(s.getVmCount(c, v) <= base.getVmCount(c, v));
                    assertEquals(0.0, s.getMigrationCost(c, c, v));
                    assertTrue(s.getMigrationCost(c, (c + 1) % 3, v) >= 0);
                }
                for (int p = 0; p < 3; p++) {
                    assertTrue(s.getPmAwakeCost(c, p) >= 0);
                    assertEquals(s.getPmAwakeCost(c, p), s.getPmAsleepCost(c, p));
                }
            }
        }
    }

    @Test
    void testPowerStatesAreRegeneratedNotAppended() {
        RunOptions options = RunOptions.builder().randomPmPowerStates(true).build();
        Scenario s = new ScenarioPerturbator(base, options).next();
        int on = 0;
        for (int k = 0; k < s.getPmCount(0); k++) {
            if (s.isPmPoweredOn(0, k)) on++;
        }
        // 42 fair coins all landing the same way is not a realistic outcome
        assertTrue(on > 0 && on < 42);
        assertEquals(base.getVmCount(0, 1), s.getVmCount(0, 1));
    }
}
