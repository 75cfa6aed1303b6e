package org.carma.coalition.safety;

import org.carma.coalition.model.Scenario;
import org.carma.coalition.safety.ScenarioValidator.ValidationError;
import org.carma.coalition.safety.ScenarioValidator.ValidationResult;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ScenarioValidatorTest {

    private static Scenario.Builder twoProviders() {
        return Scenario.builder()
            .name("two-providers")
            .numProviders(2)
            .numPmTypes(1)
            .numVmTypes(1)
            .revenues(new double[][] {{1.0}, {1.0}})
            .pmMinPowers(new double[] {100})
            .pmMaxPowers(new double[] {200})
            .pmCounts(new int[][] {{1}, {1}})
            .vmCounts(new int[][] {{2}, {1}})
            .electricityCosts(new double[] {0.1, 0.1})
            .vmCpuShares(new double[][] {{0.3}})
            .vmRamShares(new double[][] {{0.2}});
    }

    private static List<String> fields(InvalidScenarioException e) {
        return e.getErrors().stream().map(ValidationError::getField).collect(Collectors.toList());
    }

    @Test
    void testValidScenario() {
        ValidationResult result = new ScenarioValidator().validate(twoProviders().build());
        assertTrue(result.isValid());
        assertFalse(result.hasWarnings());
    }

    @Test
    void testProviderCountBounds() {
        InvalidScenarioException e = assertThrows(InvalidScenarioException.class,
            () -> twoProviders().numProviders(0).build());
        assertEquals(List.of("num_cips"), fields(e));
        assertThrows(InvalidScenarioException.class, () -> twoProviders().numProviders(64).build());
    }

    @Test
    void testShapeMismatches() {
        InvalidScenarioException e = assertThrows(InvalidScenarioException.class,
            () -> twoProviders().electricityCosts(new double[] {0.1}).vmCpuShares(new double[][] {{0.3, 0.1}}).build());
        assertTrue(fields(e).contains("cip_electricity_costs"));
        assertTrue(fields(e).contains("vm_spec_cpus[0]"));
    }

    @Test
    void testPowerStatesMustMatchPmCount() {
        InvalidScenarioException e = assertThrows(InvalidScenarioException.class,
            () -> twoProviders().pmPowerStates(new boolean[][] {{true, false}, {false}}).build());
        assertEquals(List.of("cip_pm_power_states[0]"), fields(e));
    }

    @Test
    void testNegativeValues() {
        InvalidScenarioException e = assertThrows(InvalidScenarioException.class,
            () -> twoProviders().vmCounts(new int[][] {{-1}, {1}}).pmMinPowers(new double[] {300}).build());
        assertTrue(fields(e).contains("cip_num_vms[0][0]"));
        assertTrue(fields(e).contains("pm_spec_min_powers[0]"));
        assertTrue(e.getMessage().contains("cip_num_vms[0][0]"));
    }

    @Test
    void testWarnings() {
        Scenario s = twoProviders()
            .revenues(new double[][] {{-1.0}, {1.0}})
            .vmRamShares(new double[][] {{1.5}})
            .build();
        ValidationResult result = new ScenarioValidator().validate(s);
        assertTrue(result.isValid());
        assertEquals(2, result.getWarnings().size());
    }

    @Test
    void testBuildReportsWarningsOnStderr() {
        PrintStream err = System.err;
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        System.setErr(new PrintStream(bytes, true, StandardCharsets.UTF_8));
        try {
            twoProviders().vmCpuShares(new double[][] {{1.5}}).build();
        } finally {
            System.setErr(err);
        }
        String output = bytes.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("(W) vm_spec_cpus[0]: VM type 0 does not fit on any PM type"), output);
    }

    @Test
    void testShapeDoesNotExposeScenarioTables() {
        Scenario s = twoProviders().build();
        s.shape().vmCounts()[0][0] = 99;
        s.shape().pmMinPowers()[0] = -5;
        s.shape().migrationCosts()[0][1][0] = 7;

        assertEquals(2, s.getVmCount(0, 0));
        assertEquals(100, s.getPmMinPower(0));
        assertEquals(0, s.getMigrationCost(0, 1, 0));
        assertTrue(new ScenarioValidator().validate(s).isValid());
    }
}
