package org.carma.coalition.config;

import org.carma.coalition.model.Scenario;
import org.carma.coalition.safety.InvalidScenarioException;
import org.carma.coalition.safety.ScenarioValidator.ValidationError;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Loads scenarios from YAML files.
 *
 * Keys (case-insensitive):
 * <pre>
 * name: three-providers                 # optional
 * description: ...                      # optional
 * num_cips: 3
 * num_pm_types: 3
 * num_vm_types: 3
 * cip_revenues: [[0.08, 0.08, 0.08], ...]          # CIP x VM type, $/h
 * pm_spec_min_powers: [86.7, 143.0, 490.1]         # W
 * pm_spec_max_powers: [274.9, 518.4, 1117.8]       # W
 * cip_num_pms: [[0, 42, 0], ...]                   # CIP x PM type
 * cip_pm_power_states: [[0, 1, ...], ...]          # optional, CIP x PM, default all off
 * cip_num_vms: [[0, 65, 0], ...]                   # CIP x VM type
 * cip_electricity_costs: [0.4, 0.4, 0.4]           # $/kWh (alias cip_wcosts)
 * cip_pm_asleep_costs: [[0, 0, 0], ...]            # optional, CIP x PM type
 * cip_pm_awake_costs: [[0, 0, 0], ...]             # optional, CIP x PM type
 * cip_to_cip_vm_migration_costs: [[[...]]]         # optional, CIP x CIP x VM type
 * vm_spec_cpus: [[0.2, 0.15, 0.1], ...]            # VM type x PM type
 * vm_spec_rams: [[0.0625, 0.03125, 0.015625], ...] # VM type x PM type
 * </pre>
 * Unknown keys are reported on stderr and otherwise ignored.
 */
public class ScenarioConfigLoader {

    private static final Set<String> KNOWN_KEYS = Set.of(
        "name", "description", "num_cips", "num_pm_types", "num_vm_types",
        "cip_revenues", "pm_spec_min_powers", "pm_spec_max_powers",
        "cip_num_pms", "cip_pm_power_states", "cip_num_vms",
        "cip_electricity_costs", "cip_wcosts", "cip_pm_asleep_costs", "cip_pm_awake_costs",
        "cip_to_cip_vm_migration_costs", "vm_spec_cpus", "vm_spec_rams"
    );

    private final Yaml yaml;

    public ScenarioConfigLoader() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        this.yaml = new Yaml(options);
    }

    // ========================================================================
    // LOADING
    // ========================================================================

    /**
     * Load a scenario from a YAML file.
     */
    public Scenario load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Scenario file not found: " + file);
        }
        try (InputStream is = Files.newInputStream(file)) {
            Scenario.Builder builder = parse(is);
            if (builder.getName() == null) {
                builder.name(stripExtension(file.getFileName().toString()));
            }
            return builder.build();
        }
    }

    /**
     * Load a scenario from the classpath.
     */
    public Scenario loadResource(String resource) throws IOException {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Scenario resource not found: " + resource);
            }
            return parse(is).build();
        }
    }

    public Scenario loadFromString(String content) {
        return parse(new ByteArrayInputStream(content.getBytes(java.nio.charset.StandardCharsets.UTF_8))).build();
    }

    private Scenario.Builder parse(InputStream is) {
        Object root;
        try {
            root = yaml.load(is);
        } catch (YAMLException e) {
            throw invalid("yaml", "malformed scenario: " + e.getMessage());
        }
        if (!(root instanceof Map)) {
            throw invalid("yaml", "scenario must be a mapping of keys to values");
        }
        return parseScenario(normalizeKeys((Map<?, ?>) root));
    }

    private Map<String, Object> normalizeKeys(Map<?, ?> raw) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : raw.entrySet()) {
            String key = String.valueOf(e.getKey()).trim().toLowerCase(Locale.ROOT);
            if (map.put(key, e.getValue()) != null) {
                throw invalid(key, "key given more than once");
            }
            if (!KNOWN_KEYS.contains(key)) {
                System.err.println("(W) Unknown scenario key '" + key + "' ignored");
            }
        }
        return map;
    }

    private Scenario.Builder parseScenario(Map<String, Object> raw) {
        Scenario.Builder b = Scenario.builder()
            .name(getString(raw, "name", null))
            .description(getString(raw, "description", null))
            .numProviders(getInt(raw, "num_cips"))
            .numPmTypes(getInt(raw, "num_pm_types"))
            .numVmTypes(getInt(raw, "num_vm_types"))
            .revenues(getMatrix(raw, "cip_revenues"))
            .pmMinPowers(getVector(raw, "pm_spec_min_powers"))
            .pmMaxPowers(getVector(raw, "pm_spec_max_powers"))
            .pmCounts(getIntMatrix(raw, "cip_num_pms"))
            .pmPowerStates(getBooleanMatrix(raw, "cip_pm_power_states"))
            .vmCounts(getIntMatrix(raw, "cip_num_vms"))
            .pmAsleepCosts(getMatrix(raw, "cip_pm_asleep_costs"))
            .pmAwakeCosts(getMatrix(raw, "cip_pm_awake_costs"))
            .migrationCosts(getCube(raw, "cip_to_cip_vm_migration_costs"))
            .vmCpuShares(getMatrix(raw, "vm_spec_cpus"))
            .vmRamShares(getMatrix(raw, "vm_spec_rams"));

        double[] wcosts = getVector(raw, "cip_electricity_costs");
        b.electricityCosts(wcosts != null ? wcosts : getVector(raw, "cip_wcosts"));
        return b;
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            throw invalid(key, "missing");
        }
        if (!(value instanceof Number)) {
            throw invalid(key, "expected an integer, got " + value);
        }
        return ((Number) value).intValue();
    }

    private static double toDouble(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw invalid(key, "expected a number, got " + value);
    }

    private static boolean toBoolean(String key, Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue() != 0;
        }
        throw invalid(key, "expected 0/1 or true/false, got " + value);
    }

    private static List<?> toList(String key, Object value) {
        if (value instanceof List) {
            return (List<?>) value;
        }
        throw invalid(key, "expected a list, got " + value);
    }

    private static double[] getVector(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value != null ? toVector(key, value) : null;
    }

    private static double[] toVector(String key, Object value) {
        List<?> list = toList(key, value);
        double[] result = new double[list.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = toDouble(key, list.get(i));
        }
        return result;
    }

    private static double[][] getMatrix(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value != null ? toMatrix(key, value) : null;
    }

    private static double[][] toMatrix(String key, Object value) {
        List<?> rows = toList(key, value);
        double[][] result = new double[rows.size()][];
        for (int i = 0; i < result.length; i++) {
            result[i] = toVector(key, rows.get(i));
        }
        return result;
    }

    private static double[][][] getCube(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        List<?> planes = toList(key, value);
        double[][][] result = new double[planes.size()][][];
        for (int i = 0; i < result.length; i++) {
            result[i] = toMatrix(key, planes.get(i));
        }
        return result;
    }

    private static int[][] getIntMatrix(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        List<?> rows = toList(key, value);
        int[][] result = new int[rows.size()][];
        for (int i = 0; i < result.length; i++) {
            List<?> row = toList(key, rows.get(i));
            result[i] = new int[row.size()];
            for (int j = 0; j < row.size(); j++) {
                Object cell = row.get(j);
                if (!(cell instanceof Integer || cell instanceof Long)) {
                    throw invalid(key, "expected an integer, got " + cell);
                }
                result[i][j] = ((Number) cell).intValue();
            }
        }
        return result;
    }

    private static boolean[][] getBooleanMatrix(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        List<?> rows = toList(key, value);
        boolean[][] result = new boolean[rows.size()][];
        for (int i = 0; i < result.length; i++) {
            List<?> row = toList(key, rows.get(i));
            result[i] = new boolean[row.size()];
            for (int j = 0; j < row.size(); j++) {
                result[i][j] = toBoolean(key, row.get(j));
            }
        }
        return result;
    }

    private static InvalidScenarioException invalid(String key, String message) {
        return new InvalidScenarioException(List.of(new ValidationError(key, message)));
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
