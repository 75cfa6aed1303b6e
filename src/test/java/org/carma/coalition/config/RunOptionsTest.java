package org.carma.coalition.config;

import org.carma.coalition.formation.FormationCriterion;
import org.carma.coalition.game.PayoffDivisionMethod;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class RunOptionsTest {

    @Test
    void testDefaults() {
        RunOptions o = RunOptions.defaults();
        assertEquals(0.0, o.getOptimizerRelativeGap());
        assertEquals(-1.0, o.getOptimizerTimeLimit());
        assertEquals(FormationCriterion.NASH, o.getFormationCriterion());
        assertEquals(PayoffDivisionMethod.SHAPLEY, o.getPayoffDivision());
        assertEquals(RunOptions.DEFAULT_SEED, o.getSeed());
        assertEquals(1, o.getParallelism());
        assertTrue(o.getCsvFile().isEmpty());
        assertFalse(o.isAnyPerturbation());
    }

    @Test
    void testIterationsOnlyApplyToRandomVms() {
        RunOptions o = RunOptions.builder().iterations(5).randomPmPowerStates(true).build();
        assertTrue(o.isAnyPerturbation());
        assertEquals(1, o.getEffectiveIterations());
        assertEquals(5, o.toBuilder().randomVms(true).build().getEffectiveIterations());
    }

    @Test
    void testInvalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> RunOptions.builder().optimizerRelativeGap(1.5).build());
        assertThrows(IllegalArgumentException.class, () -> RunOptions.builder().optimizerRelativeGap(-0.1).build());
        assertThrows(IllegalArgumentException.class, () -> RunOptions.builder().iterations(0).build());
        assertThrows(IllegalArgumentException.class, () -> RunOptions.builder().parallelism(0).build());
    }

    @Test
    void testToStringListsOptions() {
        String s = RunOptions.builder()
            .formationCriterion(FormationCriterion.PARETO)
            .payoffDivision(PayoffDivisionMethod.BANZHAF)
            .csvFile(Path.of("out.csv"))
            .build()
            .toString();
        assertTrue(s.startsWith("Options: "));
        assertTrue(s.contains("coalition_formation: pareto"));
        assertTrue(s.contains("coalition_value_division: banzhaf"));
        assertTrue(s.contains("csv_file: out.csv"));
    }
}
