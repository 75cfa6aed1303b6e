package org.carma.coalition.config;

import org.carma.coalition.model.Scenario;
import org.carma.coalition.safety.InvalidScenarioException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ScenarioConfigLoaderTest {

    private static final String MINIMAL = String.join("\n",
        "num_cips: 1",
        "num_pm_types: 1",
        "num_vm_types: 1",
        "cip_revenues: [[0.5]]",
        "pm_spec_min_powers: [50]",
        "pm_spec_max_powers: [150]",
        "cip_num_pms: [[2]]",
        "cip_num_vms: [[3]]",
        "vm_spec_cpus: [[0.25]]",
        "vm_spec_rams: [[0.125]]",
        "");

    private final ScenarioConfigLoader loader = new ScenarioConfigLoader();

    @Test
    void testLoadTestScenario() throws IOException {
        Scenario s = loader.loadResource("scenarios/two-providers.yaml");
        assertEquals("two-providers", s.getName());
        assertEquals(2, s.getNumProviders());
        assertEquals(2, s.getVmCount(0));
        assertEquals(1, s.getPmCount(1, 0));
        assertFalse(s.isPmPoweredOn(0, 0));
        assertTrue(s.isPmPoweredOn(1, 0));
        assertEquals(0.3, s.getVmCpuShare(0, 0));
    }

    @Test
    void testLoadBundledSample() throws IOException {
        Scenario s = loader.loadResource("scenarios/sample-3cips.yaml");
        assertEquals(3, s.getNumProviders());
        assertEquals(42, s.getPmCount(0));
        assertEquals(61, s.getVmCount(2, 1));
        assertEquals(0.02, s.getMigrationCost(0, 1, 2));
        assertEquals(0.0, s.getMigrationCost(1, 1, 0));
        assertFalse(s.isPmPoweredOn(0, 41));
    }

    @Test
    void testOptionalTablesDefaultToZero() {
        Scenario s = loader.loadFromString(MINIMAL + "cip_wcosts: [0.2]\n");
        assertEquals(0.2, s.getElectricityCost(0));
        assertEquals(0.0, s.getPmAwakeCost(0, 0));
        assertEquals(0.0, s.getPmAsleepCost(0, 0));
        assertEquals(0.0, s.getMigrationCost(0, 0, 0));
        assertFalse(s.isPmPoweredOn(0, 1));
    }

    @Test
    void testKeysAreCaseInsensitive() {
        Scenario s = loader.loadFromString(MINIMAL.replace("num_cips", "NUM_CIPS") + "CIP_ELECTRICITY_COSTS: [0.3]\n");
        assertEquals(1, s.getNumProviders());
        assertEquals(0.3, s.getElectricityCost(0));
    }

    @Test
    void testPowerStatesAcceptBooleans() {
        Scenario s = loader.loadFromString(MINIMAL + "cip_electricity_costs: [0.3]\ncip_pm_power_states: [[true, 0]]\n");
        assertTrue(s.isPmPoweredOn(0, 0));
        assertFalse(s.isPmPoweredOn(0, 1));
    }

    @Test
    void testFileNameIsDefaultName(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("tiny.yaml");
        Files.writeString(file, MINIMAL + "cip_electricity_costs: [0.3]\n");
        assertEquals("tiny", loader.load(file).getName());
    }

    @Test
    void testMissingFile(@TempDir Path dir) {
        assertThrows(IOException.class, () -> loader.load(dir.resolve("absent.yaml")));
    }

    @Test
    void testDuplicateKeysAreRejected() {
        assertThrows(InvalidScenarioException.class,
            () -> loader.loadFromString(MINIMAL + "cip_electricity_costs: [0.3]\nnum_cips: 1\n"));
    }

    @Test
    void testWrongTypesAreRejected() {
        InvalidScenarioException e = assertThrows(InvalidScenarioException.class,
            () -> loader.loadFromString(MINIMAL.replace("num_cips: 1", "num_cips: one") + "cip_electricity_costs: [0.3]\n"));
        assertEquals("num_cips", e.getErrors().get(0).getField());
    }

    @Test
    void testInconsistentShapesAreRejected() {
        InvalidScenarioException e = assertThrows(InvalidScenarioException.class,
            () -> loader.loadResource("scenarios/invalid-shapes.yaml"));
        assertTrue(e.getErrors().stream().anyMatch(err -> err.getField().equals("cip_revenues")));
    }

    @Test
    void testMissingRequiredTable() {
        assertThrows(InvalidScenarioException.class, () -> loader.loadFromString(MINIMAL));
    }
}
